package com.example.shotforge_backend.dto.web;

public record CreditsResponse(String ownerExternalSubject, long balance) {
}
