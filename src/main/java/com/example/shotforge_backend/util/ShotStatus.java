package com.example.shotforge_backend.util;

/**
 * Lifecycle of a single shot: {@code PENDING -> GENERATING -> COMPLETED | FAILED}.
 * {@code GENERATING -> PENDING} only happens on cancellation.
 */
public enum ShotStatus {
    PENDING,
    GENERATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Shots the user may still edit (description/dialogue). */
    public boolean isEditable() {
        return this == PENDING || this == FAILED;
    }
}
