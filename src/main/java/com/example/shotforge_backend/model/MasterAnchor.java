package com.example.shotforge_backend.model;

/**
 * Visual reference that seeds the whole run. Set once when a run first starts.
 */
public record MasterAnchor(String imageUrl, CharacterBible characterBible) {
}
