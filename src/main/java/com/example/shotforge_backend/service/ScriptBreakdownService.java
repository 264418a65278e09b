package com.example.shotforge_backend.service;

import com.example.shotforge_backend.config.ProductionProperties;
import com.example.shotforge_backend.engine.Interfaces.ScriptGenerationEngine;
import com.example.shotforge_backend.exception.PreconditionException;
import com.example.shotforge_backend.exception.ScriptGenerationException;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.Shot;
import com.example.shotforge_backend.util.ProjectStatus;
import com.example.shotforge_backend.util.ScriptParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Turns a synopsis into an ordered shot list through the script generator.
 */
@Service
public class ScriptBreakdownService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptBreakdownService.class);

    private final ScriptGenerationEngine scriptEngine;
    private final ProjectService projectService;
    private final ProductionProperties properties;

    public ScriptBreakdownService(ScriptGenerationEngine scriptEngine, ProjectService projectService,
                                  ProductionProperties properties) {
        this.scriptEngine = scriptEngine;
        this.projectService = projectService;
        this.properties = properties;
    }

    /**
     * Generates and parses a script for the project. Non-null arguments replace the stored inputs.
     * Nothing is stored when generation or parsing fails.
     *
     * @throws ScriptGenerationException when the generator fails or its script yields no shots
     * @throws PreconditionException     once the audit has been approved
     */
    public Project breakdown(UUID projectId, String title, String genre, String synopsis, Integer targetDurationSeconds) {
        Project project = projectService.get(projectId);
        if (project.getProductionState() != null) {
            throw new PreconditionException("shot list is locked after audit approval");
        }
        if (title != null && !title.isBlank()) project.setTitle(title.trim());
        if (genre != null) project.setGenre(genre.trim());
        if (synopsis != null) project.setSynopsis(synopsis.trim());
        if (targetDurationSeconds != null) project.setTargetDurationSeconds(targetDurationSeconds);

        var request = new ScriptGenerationEngine.Request(project.getTitle(), project.getGenre(),
                project.getSynopsis(), project.getTargetDurationSeconds());
        LOGGER.info("BREAKDOWN START projectId={} targetDuration={}", projectId, request.targetDurationSeconds());

        String rawScript;
        try {
            rawScript = scriptEngine.generate(request).rawScript();
        } catch (Exception e) {
            LOGGER.warn("BREAKDOWN generator failed projectId={} cause={}", projectId, e.getMessage());
            throw new ScriptGenerationException("script generation failed: " + e.getMessage(), e);
        }
        if (rawScript == null || rawScript.isBlank()) {
            throw new ScriptGenerationException("script generator returned an empty script");
        }

        List<Shot> shots;
        try {
            shots = ScriptParser.parse(rawScript, project.getTargetDurationSeconds(),
                    properties.getMinShotDurationSeconds(), properties.getMaxShotDurationSeconds());
        } catch (IllegalArgumentException e) {
            LOGGER.warn("BREAKDOWN unparseable script projectId={} length={} cause={}", projectId, rawScript.length(), e.getMessage());
            throw new ScriptGenerationException(e.getMessage(), e);
        }

        project.setGeneratedScript(rawScript);
        project.setShots(shots);
        project.setAuditResult(null);
        project.setAuditApproved(false);
        project.setStatus(ProjectStatus.SCRIPTED);
        Project saved = projectService.save(project);
        LOGGER.info("BREAKDOWN DONE projectId={} shots={} totalSeconds={}", projectId, shots.size(),
                shots.stream().mapToInt(Shot::getDurationSeconds).sum());
        return saved;
    }
}
