package com.example.shotforge_backend.util;

import com.example.shotforge_backend.engine.Interfaces.VisionAnalysisEngine;
import com.example.shotforge_backend.model.CharacterBible;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Completes a character bible from partial vision output so that no field is ever missing.
 */
public final class CharacterBibleTemplates {

    public static final String DEFAULT_SUBJECT = "the subject";

    static final List<String> IDENTITY_NEGATIVE_PROMPTS = List.of(
            "different person",
            "face change",
            "different hairstyle",
            "different outfit",
            "morphing",
            "inconsistent appearance");

    private CharacterBibleTemplates() {
    }

    public static CharacterBible complete(String subjectName, VisionAnalysisEngine.Result analysis) {
        String name = subjectName == null || subjectName.isBlank() ? DEFAULT_SUBJECT : subjectName.trim();
        VisionAnalysisEngine.Result a = analysis != null ? analysis
                : new VisionAnalysisEngine.Result(null, null, null, null, null, null, null);

        List<String> features = a.distinguishingFeatures() == null ? List.of() : a.distinguishingFeatures();

        Set<String> negatives = new LinkedHashSet<>();
        if (a.negativePrompts() == null || a.negativePrompts().isEmpty()) {
            negatives.addAll(IDENTITY_NEGATIVE_PROMPTS);
        } else {
            negatives.addAll(a.negativePrompts());
        }
        negatives.addAll(CameramanFilter.NEGATIVE_PROMPTS);

        return new CharacterBible(
                name,
                orElse(a.frontView(), name + ", facing forward directly, neutral confident expression"),
                orElse(a.sideView(), name + ", side profile view, same outfit and styling"),
                orElse(a.backView(), name + ", back view showing hair and outfit from behind"),
                orElse(a.hair(), "consistent hairstyle throughout"),
                orElse(a.clothing(), "consistent outfit throughout"),
                features,
                new ArrayList<>(negatives));
    }

    private static String orElse(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
