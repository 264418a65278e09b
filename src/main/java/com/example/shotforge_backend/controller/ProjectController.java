package com.example.shotforge_backend.controller;

import com.example.shotforge_backend.dto.web.ProjectCreateRequest;
import com.example.shotforge_backend.dto.web.ProjectResponse;
import com.example.shotforge_backend.dto.web.QualityTierRequest;
import com.example.shotforge_backend.dto.web.ShotPatchRequest;
import com.example.shotforge_backend.dto.web.ShotResponse;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.service.ProjectService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping("/v1/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    /* ================== CREATE ================== */

    @Operation(summary = "Create a project in DRAFT")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProjectResponse createProject(@Valid @RequestBody ProjectCreateRequest request) {
        Project project = projectService.createProject(request.ownerExternalSubject(), request.title(), request.genre(),
                request.synopsis(), request.resolvedTargetDuration(), request.qualityTier());
        return ProjectResponse.from(project);
    }

    /* ================== READ ================== */

    @GetMapping
    public Page<ProjectResponse> listProjects(@RequestParam String ownerExternalSubject,
                                              @RequestParam(defaultValue = "0") int page,
                                              @RequestParam(defaultValue = "10") int size) {
        if (page < 0 || size <= 0 || size > 200) throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "BAD_PAGINATION");
        return projectService.listBySubject(ownerExternalSubject, PageRequest.of(page, size))
                .map(ProjectResponse::from);
    }

    @Operation(summary = "Project as currently seen by production, including a running one")
    @GetMapping("/{projectId}")
    public ProjectResponse getProject(@PathVariable UUID projectId) {
        return projectService.read(projectId, ProjectResponse::from);
    }

    /* ================== UPDATE ================== */

    @Operation(summary = "Edit description or dialogue of a pending or failed shot")
    @PatchMapping("/{projectId}/shots/{shotId}")
    public ShotResponse patchShot(@PathVariable UUID projectId,
                                  @PathVariable String shotId,
                                  @RequestBody ShotPatchRequest request) {
        Project project = projectService.editShot(projectId, shotId, request.description(), request.dialogue());
        return project.findShot(shotId).map(ShotResponse::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "SHOT_NOT_FOUND"));
    }

    @PutMapping("/{projectId}/quality-tier")
    public ProjectResponse selectQualityTier(@PathVariable UUID projectId,
                                             @Valid @RequestBody QualityTierRequest request) {
        return ProjectResponse.from(projectService.selectQualityTier(projectId, request.qualityTier()));
    }
}
