package com.example.shotforge_backend.dto.web;

import jakarta.validation.constraints.Positive;

/**
 * Overrides for the breakdown; missing fields fall back to the project's own values.
 */
public record BreakdownRequest(String title, String genre, String synopsis, @Positive Integer targetDurationSeconds) {
}
