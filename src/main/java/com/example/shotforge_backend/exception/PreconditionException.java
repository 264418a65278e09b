package com.example.shotforge_backend.exception;

import org.springframework.http.HttpStatus;

public class PreconditionException extends PipelineException {

    public PreconditionException(String message) {
        super(HttpStatus.CONFLICT, "PRECONDITION_FAILED", message);
    }

    public PreconditionException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, "PRECONDITION_FAILED", message, cause);
    }
}
