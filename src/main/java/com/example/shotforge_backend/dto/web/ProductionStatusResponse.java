package com.example.shotforge_backend.dto.web;

import com.example.shotforge_backend.model.ProductionState;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.QualityTier;
import com.example.shotforge_backend.model.VoiceTrack;
import com.example.shotforge_backend.util.ProjectStatus;
import com.example.shotforge_backend.util.RunStatus;
import com.example.shotforge_backend.util.ShotStatus;

import java.util.List;
import java.util.UUID;

/**
 * Point-in-time copy of a project's production. Safe to serialize while the run keeps going.
 */
public record ProductionStatusResponse(
        UUID projectId,
        ProjectStatus projectStatus,
        boolean auditApproved,
        RunStatus runStatus,
        boolean running,
        String haltReason,
        int currentShotIndex,
        QualityTier qualityTier,
        Long seed,
        String masterAnchorImageUrl,
        String previousFrameUrl,
        List<ShotResponse> shots,
        List<VoiceTrackView> voiceTracks,
        List<String> clipUrls,
        Long startedAt,
        Long finishedAt
) {
    public record VoiceTrackView(String shotId, ShotStatus status, String audioUrl) {
        static VoiceTrackView from(VoiceTrack v) {
            return new VoiceTrackView(v.getShotId(), v.getStatus(), v.getAudioUrl());
        }
    }

    public static ProductionStatusResponse from(Project p) {
        ProductionState st = p.getProductionState();
        List<ShotResponse> shots = p.getShots().stream().map(ShotResponse::from).toList();
        if (st == null) {
            return new ProductionStatusResponse(p.getId(), p.getStatus(), p.isAuditApproved(), RunStatus.IDLE, false,
                    null, 0, p.getQualityTier(), null, null, null, shots, List.of(),
                    List.copyOf(p.getClipUrls()), null, null);
        }
        return new ProductionStatusResponse(
                p.getId(),
                p.getStatus(),
                st.isAuditApproved(),
                st.getRunStatus(),
                st.isRunning(),
                st.getHaltReason(),
                st.getCurrentShotIndex(),
                st.getQualityTier(),
                st.getChainContext().getSeed(),
                st.getMasterAnchor() == null ? null : st.getMasterAnchor().imageUrl(),
                st.getChainContext().getPreviousFrameUrl(),
                shots,
                st.getVoiceTracks().stream().map(VoiceTrackView::from).toList(),
                List.copyOf(p.getClipUrls()),
                st.getStartedAt(),
                st.getFinishedAt()
        );
    }
}
