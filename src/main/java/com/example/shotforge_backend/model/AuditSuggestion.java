package com.example.shotforge_backend.model;

/**
 * One corrective suggestion produced by the cinematic audit for a single shot.
 *
 * @param shotId               shot the suggestion targets
 * @param severity             {@code critical}, {@code warning} or {@code suggestion}
 * @param category             e.g. {@code technique}, {@code physics}, {@code continuity}, {@code identity}
 * @param suggestion           human readable critique
 * @param rewrittenDescription replacement description, {@code null} keeps the current one
 * @param rewrittenDialogue    replacement dialogue, {@code null} keeps the current one
 */
public record AuditSuggestion(String shotId,
                              String severity,
                              String category,
                              String suggestion,
                              String rewrittenDescription,
                              String rewrittenDialogue) {
}
