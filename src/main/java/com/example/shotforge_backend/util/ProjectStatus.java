package com.example.shotforge_backend.util;

public enum ProjectStatus {
    DRAFT,
    SCRIPTED,
    IN_PRODUCTION,
    COMPLETED
}
