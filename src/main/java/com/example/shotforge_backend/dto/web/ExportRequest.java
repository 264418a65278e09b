package com.example.shotforge_backend.dto.web;

public record ExportRequest(String audioMixMode) {
}
