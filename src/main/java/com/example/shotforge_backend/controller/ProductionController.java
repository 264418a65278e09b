package com.example.shotforge_backend.controller;

import com.example.shotforge_backend.dto.web.ProductionStatusResponse;
import com.example.shotforge_backend.service.production.ProductionOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Drives the shot-by-shot production run. Start and retry return as soon as the run is queued.
 */
@RestController
@RequestMapping("/v1/projects/{projectId}/production")
public class ProductionController {
    private final ProductionOrchestrator orchestrator;

    public ProductionController(ProductionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Operation(summary = "Start or resume production")
    @ApiResponse(responseCode = "202", description = "Run accepted")
    @ApiResponse(responseCode = "402", description = "Not enough credits for the next shot")
    @ApiResponse(responseCode = "409", description = "Anchor missing, audit not approved or failed shots pending retry")
    @PostMapping("/start")
    public ResponseEntity<ProductionStatusResponse> start(@PathVariable UUID projectId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.start(projectId));
    }

    @Operation(summary = "Regenerate failed shots only")
    @PostMapping("/retry-failed")
    public ResponseEntity<ProductionStatusResponse> retryFailed(@PathVariable UUID projectId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.retryFailedShots(projectId));
    }

    @PostMapping("/cancel")
    public ProductionStatusResponse cancel(@PathVariable UUID projectId) {
        return orchestrator.cancel(projectId);
    }

    @GetMapping
    public ProductionStatusResponse status(@PathVariable UUID projectId) {
        return orchestrator.status(projectId);
    }
}
