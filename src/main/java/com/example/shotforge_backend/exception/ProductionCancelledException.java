package com.example.shotforge_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised inside a run when the user cancelled it. Informational: the run loop
 * turns it into the CANCELLED state and never reports it as a failure.
 */
public class ProductionCancelledException extends PipelineException {

    public ProductionCancelledException(String message) {
        super(HttpStatus.CONFLICT, "PRODUCTION_CANCELLED", message);
    }
}
