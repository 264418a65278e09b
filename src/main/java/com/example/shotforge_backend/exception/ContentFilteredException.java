package com.example.shotforge_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * The video service refused the prompt on content-policy grounds. Retried with a softened prompt.
 */
public class ContentFilteredException extends PipelineException {

    private final String filterReason;

    public ContentFilteredException(String shotId, String filterReason) {
        super(HttpStatus.BAD_GATEWAY, "CONTENT_FILTERED",
                "shotId=" + shotId + (filterReason == null ? "" : " reason=" + filterReason));
        this.filterReason = filterReason;
    }

    public String getFilterReason() {
        return filterReason;
    }
}
