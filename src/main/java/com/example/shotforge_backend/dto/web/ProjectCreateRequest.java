package com.example.shotforge_backend.dto.web;

import com.example.shotforge_backend.model.QualityTier;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record ProjectCreateRequest(
        @NotBlank String ownerExternalSubject,
        @NotBlank String title,
        String genre,
        String synopsis,
        @Positive Integer targetDurationSeconds,
        QualityTier qualityTier
) {
    public static final int DEFAULT_TARGET_DURATION_SECONDS = 60;

    public int resolvedTargetDuration() {
        return targetDurationSeconds != null ? targetDurationSeconds : DEFAULT_TARGET_DURATION_SECONDS;
    }
}
