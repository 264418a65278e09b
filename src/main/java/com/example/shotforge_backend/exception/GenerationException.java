package com.example.shotforge_backend.exception;

import org.springframework.http.HttpStatus;

public class GenerationException extends PipelineException {

    public GenerationException(String message) {
        super(HttpStatus.BAD_GATEWAY, "GENERATION_FAILED", message);
    }

    public GenerationException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "GENERATION_FAILED", message, cause);
    }
}
