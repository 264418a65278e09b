package com.example.shotforge_backend.dto.web;

import com.example.shotforge_backend.model.Shot;
import com.example.shotforge_backend.model.VisualDebugResult;
import com.example.shotforge_backend.util.ShotStatus;
import com.example.shotforge_backend.util.TransitionType;

import java.util.List;

public record ShotResponse(
        String id,
        int index,
        String title,
        String description,
        String dialogue,
        String mood,
        String cameraMovement,
        TransitionType transitionOut,
        int durationSeconds,
        ShotStatus status,
        String videoUrl,
        String endFrameUrl,
        int retryCount,
        List<VisualDebugResult> visualDebugResults,
        String error
) {
    public static ShotResponse from(Shot s) {
        return new ShotResponse(
                s.getId(),
                s.getIndex(),
                s.getTitle(),
                s.getDescription(),
                s.getDialogue(),
                s.getMood(),
                s.getCameraMovement(),
                s.getTransitionOut(),
                s.getDurationSeconds(),
                s.getStatus(),
                s.getVideoUrl(),
                s.getEndFrameUrl(),
                s.getRetryCount(),
                List.copyOf(s.getVisualDebugResults()),
                s.getError()
        );
    }
}
