package com.example.shotforge_backend.util;

/**
 * Tracks the lifecycle of a production run for a project.
 */
public enum RunStatus {
    IDLE,
    RUNNING,
    HALTED,
    CANCELLED,
    COMPLETED
}
