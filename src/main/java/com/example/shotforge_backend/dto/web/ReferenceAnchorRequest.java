package com.example.shotforge_backend.dto.web;

import jakarta.validation.constraints.NotBlank;

public record ReferenceAnchorRequest(@NotBlank String imageUrl, String subjectName) {
}
