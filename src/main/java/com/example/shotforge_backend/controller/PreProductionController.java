package com.example.shotforge_backend.controller;

import com.example.shotforge_backend.dto.web.BreakdownRequest;
import com.example.shotforge_backend.dto.web.ProductionStatusResponse;
import com.example.shotforge_backend.dto.web.ProjectResponse;
import com.example.shotforge_backend.dto.web.ReferenceAnchorRequest;
import com.example.shotforge_backend.dto.web.ShotResponse;
import com.example.shotforge_backend.model.AuditResult;
import com.example.shotforge_backend.model.ReferenceAnchor;
import com.example.shotforge_backend.service.CinematicAuditService;
import com.example.shotforge_backend.service.ProjectService;
import com.example.shotforge_backend.service.ReferenceAnchorService;
import com.example.shotforge_backend.service.ScriptBreakdownService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Script breakdown, reference anchoring and the cinematic audit gate.
 */
@RestController
@RequestMapping("/v1/projects/{projectId}")
public class PreProductionController {
    private final ScriptBreakdownService breakdownService;
    private final ReferenceAnchorService anchorService;
    private final CinematicAuditService auditService;
    private final ProjectService projectService;

    public PreProductionController(ScriptBreakdownService breakdownService,
                                   ReferenceAnchorService anchorService,
                                   CinematicAuditService auditService,
                                   ProjectService projectService) {
        this.breakdownService = breakdownService;
        this.anchorService = anchorService;
        this.auditService = auditService;
        this.projectService = projectService;
    }

    @Operation(summary = "Generate a script and break it into shots")
    @ApiResponse(responseCode = "200", description = "Shot list replaced")
    @ApiResponse(responseCode = "409", description = "Shot list is locked")
    @ApiResponse(responseCode = "502", description = "Script generator failed")
    @PostMapping("/breakdown")
    public ProjectResponse breakdown(@PathVariable UUID projectId,
                                     @Valid @RequestBody(required = false) BreakdownRequest request) {
        BreakdownRequest r = request != null ? request : new BreakdownRequest(null, null, null, null);
        var project = breakdownService.breakdown(projectId, r.title(), r.genre(), r.synopsis(), r.targetDurationSeconds());
        return ProjectResponse.from(project);
    }

    @Operation(summary = "Analyse the reference image into a character bible")
    @PostMapping("/reference-anchor")
    public ReferenceAnchor referenceAnchor(@PathVariable UUID projectId,
                                           @Valid @RequestBody ReferenceAnchorRequest request) {
        return anchorService.analyze(projectId, request.imageUrl(), request.subjectName());
    }

    @Operation(summary = "Run the cinematic audit over the current shot list")
    @PostMapping("/audit")
    public AuditResult audit(@PathVariable UUID projectId) {
        return auditService.runAudit(projectId);
    }

    @PostMapping("/audit/suggestions/{shotId}/apply")
    public ShotResponse applySuggestion(@PathVariable UUID projectId, @PathVariable String shotId) {
        return ShotResponse.from(auditService.applySuggestion(projectId, shotId));
    }

    @Operation(summary = "Apply every suggested rewrite and audit again")
    @PostMapping("/audit/suggestions/apply-all")
    public AuditResult applyAllSuggestions(@PathVariable UUID projectId) {
        return auditService.applyAllSuggestionsAndReaudit(projectId);
    }

    @Operation(summary = "Iterate audit rewrites until the pass score is reached, keeping only improvements")
    @PostMapping("/audit/optimize")
    public CinematicAuditService.OptimizationReport optimize(@PathVariable UUID projectId) {
        return auditService.autoOptimizeUntilReady(projectId);
    }

    @Operation(summary = "Approve the audit and lock pre-production")
    @ApiResponse(responseCode = "409", description = "No audit result or no shots")
    @PostMapping("/audit/approve")
    public ProductionStatusResponse approve(@PathVariable UUID projectId) {
        auditService.approveAudit(projectId);
        return projectService.read(projectId, ProductionStatusResponse::from);
    }
}
