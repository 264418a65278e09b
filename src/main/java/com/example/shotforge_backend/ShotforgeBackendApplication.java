package com.example.shotforge_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShotforgeBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShotforgeBackendApplication.class, args);
	}

}
