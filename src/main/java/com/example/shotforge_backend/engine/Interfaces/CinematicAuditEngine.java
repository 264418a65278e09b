package com.example.shotforge_backend.engine.Interfaces;

import com.example.shotforge_backend.model.AuditSuggestion;

import java.util.List;

public interface CinematicAuditEngine {
    record ShotInput(String shotId, String title, String description, String dialogue,
                     String mood, int durationSeconds) {}
    record Request(List<ShotInput> shots, String characterBible) {}
    record Result(double score, List<AuditSuggestion> perShotSuggestions, List<String> correctivePrompts) {}

    Result critique(Request req) throws Exception;
}
