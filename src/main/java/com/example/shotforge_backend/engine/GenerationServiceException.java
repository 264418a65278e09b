package com.example.shotforge_backend.engine;

/**
 * Transport-level failure of a generation service call. Services translate it into the
 * pipeline error of their operation.
 */
public class GenerationServiceException extends RuntimeException {
    private final String operation;
    private final int status;

    public GenerationServiceException(String operation, int status, String message) {
        super("%s failed status=%d: %s".formatted(operation, status, message));
        this.operation = operation;
        this.status = status;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * HTTP status of the failed exchange, {@code 0} when the response was unusable.
     */
    public int getStatus() {
        return status;
    }
}
