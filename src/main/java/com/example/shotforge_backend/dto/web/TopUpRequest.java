package com.example.shotforge_backend.dto.web;

import jakarta.validation.constraints.Positive;

public record TopUpRequest(@Positive long amount) {
}
