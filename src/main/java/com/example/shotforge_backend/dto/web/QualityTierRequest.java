package com.example.shotforge_backend.dto.web;

import com.example.shotforge_backend.model.QualityTier;
import jakarta.validation.constraints.NotNull;

public record QualityTierRequest(@NotNull QualityTier qualityTier) {
}
