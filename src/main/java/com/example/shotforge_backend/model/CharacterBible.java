package com.example.shotforge_backend.model;

import java.util.List;

/**
 * Structured description of the anchored character, injected into every generation request
 * so the identity stays stable across shots.
 */
public record CharacterBible(String subjectName,
                             String frontView,
                             String sideView,
                             String backView,
                             String hair,
                             String clothing,
                             List<String> distinguishingFeatures,
                             List<String> negativePrompts) {

    public CharacterBible {
        distinguishingFeatures = distinguishingFeatures == null ? List.of() : List.copyOf(distinguishingFeatures);
        negativePrompts = negativePrompts == null ? List.of() : List.copyOf(negativePrompts);
    }

    /**
     * Renders the bible as a prompt block.
     */
    public String toPromptString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[CHARACTER: ").append(subjectName).append("]\n");
        sb.append("- Front: ").append(frontView).append("\n");
        sb.append("- Side: ").append(sideView).append("\n");
        sb.append("- Back: ").append(backView).append("\n");
        sb.append("- Hair: ").append(hair).append("\n");
        sb.append("- Clothing: ").append(clothing).append("\n");
        if (!distinguishingFeatures.isEmpty()) {
            sb.append("[DISTINGUISHING FEATURES]\n");
            distinguishingFeatures.forEach(f -> sb.append("- ").append(f).append("\n"));
        }
        return sb.toString();
    }

    public String negativePrompt() {
        return String.join(", ", negativePrompts);
    }
}
