package com.example.shotforge_backend.engine.Interfaces;

import com.example.shotforge_backend.util.CancellationToken;

import java.util.concurrent.CompletableFuture;

public interface VoiceGenerationEngine {
    record Request(String shotId, String text, String voiceId) {}
    record Result(String audioUrl) {}

    CompletableFuture<Result> synthesize(Request req, CancellationToken token);
}
