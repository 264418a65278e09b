package com.example.shotforge_backend.model;

/**
 * Result of analysing the uploaded reference image. Production refuses to start until
 * {@code analysisComplete} is true.
 */
public record ReferenceAnchor(String imageUrl,
                              CharacterBible characterBible,
                              boolean analysisComplete,
                              long analyzedAt) {
}
