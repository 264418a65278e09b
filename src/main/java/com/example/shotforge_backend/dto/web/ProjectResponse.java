package com.example.shotforge_backend.dto.web;

import com.example.shotforge_backend.model.AuditResult;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.QualityTier;
import com.example.shotforge_backend.model.ReferenceAnchor;
import com.example.shotforge_backend.util.AudioMixMode;
import com.example.shotforge_backend.util.ProjectStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ProjectResponse(
        UUID id,
        UUID ownerId,
        String ownerExternalSubject,
        String title,
        String genre,
        String synopsis,
        int targetDurationSeconds,
        ProjectStatus status,
        QualityTier qualityTier,
        List<ShotResponse> shots,
        ReferenceAnchor referenceAnchor,
        AuditResult auditResult,
        boolean auditApproved,
        AudioMixMode audioMixMode,
        String exportUrl,
        Instant createdAt
) {
    public static ProjectResponse from(Project p) {
        var o = p.getOwner();
        return new ProjectResponse(
                p.getId(),
                o.getId(),
                o.getExternalSubject(),
                p.getTitle(),
                p.getGenre(),
                p.getSynopsis(),
                p.getTargetDurationSeconds(),
                p.getStatus(),
                p.getQualityTier(),
                p.getShots().stream().map(ShotResponse::from).toList(),
                p.getReferenceAnchor(),
                p.getAuditResult(),
                p.isAuditApproved(),
                p.getAudioMixMode(),
                p.getExportUrl(),
                p.getCreatedAt()
        );
    }
}
