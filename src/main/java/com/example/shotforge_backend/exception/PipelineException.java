package com.example.shotforge_backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Base type of every pipeline failure. The reason is a stable machine-readable code,
 * the detail message carries the human-readable cause.
 */
public abstract class PipelineException extends ResponseStatusException {

    private final String detailMessage;

    protected PipelineException(HttpStatus status, String code, String detailMessage) {
        super(status, code);
        this.detailMessage = detailMessage;
    }

    protected PipelineException(HttpStatus status, String code, String detailMessage, Throwable cause) {
        super(status, code, cause);
        this.detailMessage = detailMessage;
    }

    public String getCode() {
        return getReason();
    }

    public String getDetailMessage() {
        return detailMessage;
    }

    @Override
    public String getMessage() {
        return detailMessage == null ? super.getMessage() : getReason() + ": " + detailMessage;
    }
}
