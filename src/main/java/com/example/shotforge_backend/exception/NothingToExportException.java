package com.example.shotforge_backend.exception;

import org.springframework.http.HttpStatus;

public class NothingToExportException extends PipelineException {

    public NothingToExportException(String message) {
        super(HttpStatus.CONFLICT, "NOTHING_TO_EXPORT", message);
    }

    public NothingToExportException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, "NOTHING_TO_EXPORT", message, cause);
    }
}
