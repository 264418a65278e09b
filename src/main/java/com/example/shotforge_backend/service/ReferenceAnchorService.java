package com.example.shotforge_backend.service;

import com.example.shotforge_backend.engine.Interfaces.VisionAnalysisEngine;
import com.example.shotforge_backend.exception.PreconditionException;
import com.example.shotforge_backend.exception.ReferenceAnalysisException;
import com.example.shotforge_backend.model.CharacterBible;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.ReferenceAnchor;
import com.example.shotforge_backend.util.CharacterBibleTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.UUID;

/**
 * Analyzes the reference image into the character bible that anchors the whole production.
 */
@Service
public class ReferenceAnchorService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceAnchorService.class);

    private final VisionAnalysisEngine visionEngine;
    private final ProjectService projectService;
    private final Clock clock;

    public ReferenceAnchorService(VisionAnalysisEngine visionEngine, ProjectService projectService, Clock clock) {
        this.visionEngine = visionEngine;
        this.projectService = projectService;
        this.clock = clock;
    }

    /**
     * Replaces the project's reference anchor. A failed analysis is stored as incomplete so
     * production cannot start on a stale anchor.
     */
    public ReferenceAnchor analyze(UUID projectId, String imageUrl, String subjectName) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "IMAGE_URL_REQUIRED");
        }
        Project project = projectService.get(projectId);
        if (project.isProductionStarted()) {
            throw new PreconditionException("master anchor is locked once production has started");
        }
        projectService.requireNoActiveRun(project);

        LOGGER.info("ANCHOR START projectId={} imageUrl={}", projectId, imageUrl);
        VisionAnalysisEngine.Result analysis;
        try {
            analysis = visionEngine.analyze(new VisionAnalysisEngine.Request(imageUrl, subjectName));
        } catch (Exception e) {
            project.setReferenceAnchor(new ReferenceAnchor(imageUrl, null, false, clock.millis()));
            projectService.save(project);
            LOGGER.warn("ANCHOR FAILED projectId={} cause={}", projectId, e.getMessage());
            throw new ReferenceAnalysisException("reference analysis failed: " + e.getMessage(), e);
        }

        CharacterBible bible = CharacterBibleTemplates.complete(subjectName, analysis);
        ReferenceAnchor anchor = new ReferenceAnchor(imageUrl, bible, true, clock.millis());
        project.setReferenceAnchor(anchor);
        projectService.save(project);
        LOGGER.info("ANCHOR DONE projectId={} subject={} negativePrompts={}", projectId, bible.subjectName(), bible.negativePrompts().size());
        return anchor;
    }
}
