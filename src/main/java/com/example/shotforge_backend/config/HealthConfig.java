package com.example.shotforge_backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator generationServiceHealth(@Qualifier("generationWebClient") WebClient client,
                                                   GenerationProperties props) {
        return () -> {
            try {
                client.get().uri(props.getPaths().getHealth())
                        .retrieve()
                        .toBodilessEntity()
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("generationService", "ok").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("generationService", "unreachable").build();
            }
        };
    }
}
