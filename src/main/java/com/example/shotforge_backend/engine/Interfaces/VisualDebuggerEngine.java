package com.example.shotforge_backend.engine.Interfaces;

import com.example.shotforge_backend.util.CancellationToken;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Scores a generated clip against the character bible and the audit's corrective criteria.
 */
public interface VisualDebuggerEngine {
    record Request(String shotId,
                   String clipUrl,
                   String frameUrl,
                   String shotDescription,
                   String characterBible,
                   List<String> correctiveCriteria) {}
    record Result(double score, boolean passed, String correctivePrompt, List<String> issues) {}

    CompletableFuture<Result> evaluate(Request req, CancellationToken token);
}
