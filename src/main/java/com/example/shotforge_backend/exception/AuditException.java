package com.example.shotforge_backend.exception;

import org.springframework.http.HttpStatus;

public class AuditException extends PipelineException {

    public AuditException(String message) {
        super(HttpStatus.BAD_GATEWAY, "AUDIT_FAILED", message);
    }

    public AuditException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "AUDIT_FAILED", message, cause);
    }
}
