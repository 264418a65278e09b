package com.example.shotforge_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a shot flows into the next one.
 */
public enum TransitionType {
    CONTINUOUS("continuous"),
    MATCH_CUT("match-cut"),
    DISSOLVE("dissolve"),
    FADE("fade");

    private final String code;

    TransitionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /** Lenient parse; unknown or missing values fall back to {@link #CONTINUOUS}. */
    @JsonCreator
    public static TransitionType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return CONTINUOUS;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (TransitionType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        return CONTINUOUS;
    }
}
