package com.example.shotforge_backend.model;

import java.util.List;

/**
 * Outcome of one generation attempt as judged by the visual debugger.
 * Attempts that failed before scoring carry a score of 0 and the generation error.
 *
 * @param score             0-100 quality score
 * @param passed            whether the attempt cleared the gate
 * @param correctivePrompt  prompt fragment to append on the next attempt, may be {@code null}
 * @param issues            issues reported by the debugger
 * @param error             generation error for this attempt, {@code null} when the clip was produced
 * @param timestamp         epoch millis of the verdict
 */
public record VisualDebugResult(double score,
                                boolean passed,
                                String correctivePrompt,
                                List<String> issues,
                                String error,
                                long timestamp) {

    public VisualDebugResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static VisualDebugResult generationFailure(String error, long timestamp) {
        return new VisualDebugResult(0, false, null, List.of(), error, timestamp);
    }
}
