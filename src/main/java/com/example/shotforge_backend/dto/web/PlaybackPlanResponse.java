package com.example.shotforge_backend.dto.web;

import com.example.shotforge_backend.util.AudioMixMode;
import com.example.shotforge_backend.util.TransitionType;

import java.util.List;
import java.util.UUID;

/**
 * Ordered playlist of completed clips with the track volumes of the chosen mix mode.
 */
public record PlaybackPlanResponse(
        UUID projectId,
        AudioMixMode audioMixMode,
        double dialogueVolume,
        double musicVolume,
        int totalDurationSeconds,
        List<Item> items
) {
    public record Item(String shotId,
                       int index,
                       String title,
                       String videoUrl,
                       String dialogueAudioUrl,
                       int durationSeconds,
                       TransitionType transitionOut) {}
}
