package com.example.shotforge_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which tracks are mixed during review playback and export, with their volumes.
 */
public enum AudioMixMode {
    FULL("full", 1.0, 0.6),
    DIALOGUE_ONLY("dialogue-only", 1.0, 0.0),
    MUSIC_ONLY("music-only", 0.0, 1.0),
    MUTE("mute", 0.0, 0.0);

    private final String code;
    private final double dialogueVolume;
    private final double musicVolume;

    AudioMixMode(String code, double dialogueVolume, double musicVolume) {
        this.code = code;
        this.dialogueVolume = dialogueVolume;
        this.musicVolume = musicVolume;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public double getDialogueVolume() {
        return dialogueVolume;
    }

    public double getMusicVolume() {
        return musicVolume;
    }

    /**
     * Accepts both the wire code ({@code dialogue-only}) and the constant name ({@code DIALOGUE_ONLY}).
     *
     * @param raw user supplied value, {@code null} or blank means {@link #FULL}
     * @return resolved mode
     * @throws IllegalArgumentException when the value is unknown
     */
    @JsonCreator
    public static AudioMixMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return FULL;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (AudioMixMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown audio mix mode: " + raw);
    }
}
