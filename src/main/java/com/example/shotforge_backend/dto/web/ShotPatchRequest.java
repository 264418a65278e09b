package com.example.shotforge_backend.dto.web;

/**
 * Partial update of a shot; {@code null} fields stay unchanged.
 */
public record ShotPatchRequest(String description, String dialogue) {
}
