package com.example.shotforge_backend.engine.Interfaces;

public interface ScriptGenerationEngine {
    record Request(String title, String genre, String synopsis, int targetDurationSeconds) {}
    record Result(String rawScript, String provider) {}

    Result generate(Request req) throws Exception;
}
