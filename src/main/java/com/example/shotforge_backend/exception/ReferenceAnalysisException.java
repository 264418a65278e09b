package com.example.shotforge_backend.exception;

import org.springframework.http.HttpStatus;

public class ReferenceAnalysisException extends PipelineException {

    public ReferenceAnalysisException(String message) {
        super(HttpStatus.BAD_GATEWAY, "REFERENCE_ANALYSIS_FAILED", message);
    }

    public ReferenceAnalysisException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "REFERENCE_ANALYSIS_FAILED", message, cause);
    }
}
