package com.example.shotforge_backend.model;

import java.util.List;
import java.util.Optional;

/**
 * Stored result of one explicit audit run. {@code passed} is informational; approval stays a user action.
 */
public record AuditResult(double score,
                          boolean passed,
                          List<AuditSuggestion> perShotSuggestions,
                          List<String> correctivePrompts,
                          long createdAt) {

    public AuditResult {
        perShotSuggestions = perShotSuggestions == null ? List.of() : List.copyOf(perShotSuggestions);
        correctivePrompts = correctivePrompts == null ? List.of() : List.copyOf(correctivePrompts);
    }

    public Optional<AuditSuggestion> suggestionFor(String shotId) {
        return perShotSuggestions.stream()
                .filter(s -> shotId.equals(s.shotId()))
                .findFirst();
    }
}
