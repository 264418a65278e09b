package com.example.shotforge_backend.service;

import com.example.shotforge_backend.exception.PreconditionException;
import com.example.shotforge_backend.model.Account;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.QualityTier;
import com.example.shotforge_backend.model.Shot;
import com.example.shotforge_backend.repository.ProjectRepository;
import com.example.shotforge_backend.service.production.ProductionRunRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;
import java.util.function.Function;

@Service
public class ProjectService {
    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepository;
    private final AccountService accountService;
    private final ProductionRunRegistry runRegistry;

    public ProjectService(ProjectRepository projectRepository,
                          AccountService accountService,
                          ProductionRunRegistry runRegistry) {
        this.projectRepository = projectRepository;
        this.accountService = accountService;
        this.runRegistry = runRegistry;
    }

    /* ---------- CREATE ---------- */

    @Transactional
    public Project createProject(String ownerExternalSubject, String title, String genre, String synopsis,
                                 int targetDurationSeconds, QualityTier qualityTier) {
        Account owner = accountService.ensureByExternalSubject(ownerExternalSubject, null);
        var project = new Project(owner, title.trim(), genre, synopsis, targetDurationSeconds);
        if (qualityTier != null) project.setQualityTier(qualityTier);
        Project saved = projectRepository.save(project);
        log.info("Project created id={} owner={} targetDuration={}", saved.getId(), ownerExternalSubject, targetDurationSeconds);
        return saved;
    }

    /* ---------- READ ---------- */

    @Transactional(readOnly = true)
    public Project get(UUID projectId) {
        return projectRepository.findWithOwnerById(projectId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "PROJECT_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public Page<Project> listBySubject(String ownerExternalSubject, Pageable pageable) {
        Account owner = accountService.getByExternalSubjectOrThrow(ownerExternalSubject);
        return projectRepository.findByOwnerOrderByCreatedAtDesc(owner, pageable);
    }

    /**
     * Project as the production run currently sees it: the live copy while a run is active.
     */
    public <T> T read(UUID projectId, Function<Project, T> reader) {
        return runRegistry.read(projectId, () -> get(projectId), reader);
    }

    /* ---------- UPDATE ---------- */

    @Transactional
    public Project save(Project project) {
        return projectRepository.save(project);
    }

    /**
     * Edits the user-owned fields of a shot. {@code null} leaves a field unchanged.
     */
    @Transactional
    public Project editShot(UUID projectId, String shotId, String description, String dialogue) {
        Project project = get(projectId);
        Shot shot = requireEditableShot(project, shotId);
        if (description != null) {
            if (description.isBlank()) throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "DESCRIPTION_REQUIRED");
            shot.setDescription(description.trim());
        }
        if (dialogue != null) shot.setDialogue(dialogue.trim());
        log.info("Shot edited projectId={} shotId={}", projectId, shotId);
        return projectRepository.save(project);
    }

    @Transactional
    public Project selectQualityTier(UUID projectId, QualityTier tier) {
        Project project = get(projectId);
        requireNoActiveRun(project);
        project.setQualityTier(tier);
        if (project.getProductionState() != null) {
            project.getProductionState().setQualityTier(tier);
        }
        return projectRepository.save(project);
    }

    /**
     * Only {@code PENDING} or {@code FAILED} shots are editable, and never while a run is active.
     */
    public Shot requireEditableShot(Project project, String shotId) {
        Shot shot = project.findShot(shotId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "SHOT_NOT_FOUND"));
        requireNoActiveRun(project);
        if (!shot.getStatus().isEditable()) {
            throw new PreconditionException("shot " + shotId + " is " + shot.getStatus() + " and can no longer be edited");
        }
        return shot;
    }

    public void requireNoActiveRun(Project project) {
        if (runRegistry.isActive(project.getId())) {
            throw new PreconditionException("production is running for project " + project.getId());
        }
    }
}
