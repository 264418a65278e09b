package com.example.shotforge_backend.controller;

import com.example.shotforge_backend.dto.web.ExportRequest;
import com.example.shotforge_backend.dto.web.ExportResponse;
import com.example.shotforge_backend.dto.web.PlaybackPlanResponse;
import com.example.shotforge_backend.service.ReviewAssembler;
import com.example.shotforge_backend.util.AudioMixMode;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping("/v1/projects/{projectId}/review")
public class ReviewController {
    private final ReviewAssembler reviewAssembler;

    public ReviewController(ReviewAssembler reviewAssembler) {
        this.reviewAssembler = reviewAssembler;
    }

    @Operation(summary = "Ordered playlist of completed clips for the given mix mode")
    @GetMapping("/playback")
    public PlaybackPlanResponse playback(@PathVariable UUID projectId,
                                         @RequestParam(required = false) String mode) {
        return reviewAssembler.playback(projectId, parseMode(mode));
    }

    @Operation(summary = "Export completed clips as one artifact")
    @PostMapping("/export")
    public ExportResponse export(@PathVariable UUID projectId,
                                 @RequestBody(required = false) ExportRequest request) {
        return reviewAssembler.export(projectId, parseMode(request == null ? null : request.audioMixMode()));
    }

    private static AudioMixMode parseMode(String raw) {
        try {
            return AudioMixMode.fromValue(raw);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_AUDIO_MIX_MODE", e);
        }
    }
}
