package com.example.shotforge_backend.service;

import com.example.shotforge_backend.dto.web.ExportResponse;
import com.example.shotforge_backend.dto.web.PlaybackPlanResponse;
import com.example.shotforge_backend.engine.Interfaces.ExportEngine;
import com.example.shotforge_backend.exception.ExportException;
import com.example.shotforge_backend.exception.NothingToExportException;
import com.example.shotforge_backend.model.ProductionState;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.Shot;
import com.example.shotforge_backend.model.VoiceTrack;
import com.example.shotforge_backend.util.AudioMixMode;
import com.example.shotforge_backend.util.ShotStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Assembles completed shots for review. Playback only changes track volumes and never re-encodes;
 * export hands the ordered clips to the external exporter.
 */
@Service
public class ReviewAssembler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReviewAssembler.class);

    private final ProjectService projectService;
    private final ExportEngine exportEngine;

    public ReviewAssembler(ProjectService projectService, ExportEngine exportEngine) {
        this.projectService = projectService;
        this.exportEngine = exportEngine;
    }

    public PlaybackPlanResponse playback(UUID projectId, AudioMixMode mode) {
        return projectService.read(projectId, project -> buildPlan(project, mode));
    }

    static PlaybackPlanResponse buildPlan(Project project, AudioMixMode mode) {
        ProductionState state = project.getProductionState();
        List<PlaybackPlanResponse.Item> items = completedShots(project).stream()
                .map(s -> new PlaybackPlanResponse.Item(
                        s.getId(),
                        s.getIndex(),
                        s.getTitle(),
                        s.getVideoUrl(),
                        mode.getDialogueVolume() > 0 ? dialogueAudio(state, s.getId()) : null,
                        s.getDurationSeconds(),
                        s.getTransitionOut()))
                .toList();
        int total = items.stream().mapToInt(PlaybackPlanResponse.Item::durationSeconds).sum();
        return new PlaybackPlanResponse(project.getId(), mode, mode.getDialogueVolume(), mode.getMusicVolume(), total, items);
    }

    /**
     * @throws NothingToExportException when no shot has completed
     * @throws ExportException          when the exporter fails
     */
    public ExportResponse export(UUID projectId, AudioMixMode mode) {
        Project project = projectService.get(projectId);
        projectService.requireNoActiveRun(project);
        List<String> clipUrls = completedShots(project).stream().map(Shot::getVideoUrl).toList();
        if (clipUrls.isEmpty()) {
            throw new NothingToExportException("project " + projectId + " has no completed shots");
        }

        LOGGER.info("EXPORT START projectId={} clips={} mix={}", projectId, clipUrls.size(), mode.getCode());
        ExportEngine.Result result;
        try {
            result = exportEngine.export(new ExportEngine.Request(projectId, clipUrls, mode));
        } catch (Exception e) {
            LOGGER.warn("EXPORT FAILED projectId={} cause={}", projectId, e.getMessage());
            throw new ExportException("export failed: " + e.getMessage(), e);
        }

        project.setAudioMixMode(mode);
        project.setExportUrl(result.artifactUrl());
        projectService.save(project);
        LOGGER.info("EXPORT DONE projectId={} artifactUrl={}", projectId, result.artifactUrl());
        return new ExportResponse(projectId, result.artifactUrl(), mode, clipUrls.size());
    }

    private static List<Shot> completedShots(Project project) {
        return project.getShots().stream()
                .filter(s -> s.getStatus() == ShotStatus.COMPLETED && s.getVideoUrl() != null)
                .sorted(Comparator.comparingInt(Shot::getIndex))
                .toList();
    }

    private static String dialogueAudio(ProductionState state, String shotId) {
        if (state == null) return null;
        return state.getVoiceTracks().stream()
                .filter(v -> v.getShotId().equals(shotId) && v.getStatus() == ShotStatus.COMPLETED)
                .map(VoiceTrack::getAudioUrl)
                .findFirst()
                .orElse(null);
    }
}
