package com.example.shotforge_backend.exception;

import org.springframework.http.HttpStatus;

public class ScriptGenerationException extends PipelineException {

    public ScriptGenerationException(String message) {
        super(HttpStatus.BAD_GATEWAY, "SCRIPT_GENERATION_FAILED", message);
    }

    public ScriptGenerationException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "SCRIPT_GENERATION_FAILED", message, cause);
    }
}
