package com.example.shotforge_backend.exception;

import org.springframework.http.HttpStatus;

public class ExportException extends PipelineException {

    public ExportException(String message) {
        super(HttpStatus.BAD_GATEWAY, "EXPORT_FAILED", message);
    }

    public ExportException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "EXPORT_FAILED", message, cause);
    }
}
