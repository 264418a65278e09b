package com.example.shotforge_backend.engine.Interfaces;

import com.example.shotforge_backend.model.QualityTier;
import com.example.shotforge_backend.util.CancellationToken;

import java.util.concurrent.CompletableFuture;

public interface VideoGenerationEngine {
    record Request(String shotId,
                   String prompt,
                   String negativePrompt,
                   String referenceFrameUrl,
                   long seed,
                   String characterBible,
                   int durationSeconds,
                   QualityTier qualityTier) {}
    record Result(String videoUrl, String endFrameUrl) {}

    /**
     * Starts generation. The returned future is cancelled, and the remote call disposed,
     * when the token is cancelled.
     */
    CompletableFuture<Result> generate(Request req, CancellationToken token);
}
