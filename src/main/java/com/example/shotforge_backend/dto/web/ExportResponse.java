package com.example.shotforge_backend.dto.web;

import com.example.shotforge_backend.util.AudioMixMode;

import java.util.UUID;

public record ExportResponse(UUID projectId, String artifactUrl, AudioMixMode audioMixMode, int clipCount) {
}
