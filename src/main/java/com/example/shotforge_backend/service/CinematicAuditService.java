package com.example.shotforge_backend.service;

import com.example.shotforge_backend.config.AuditProperties;
import com.example.shotforge_backend.engine.Interfaces.CinematicAuditEngine;
import com.example.shotforge_backend.exception.AuditException;
import com.example.shotforge_backend.exception.PreconditionException;
import com.example.shotforge_backend.model.AuditResult;
import com.example.shotforge_backend.model.AuditSuggestion;
import com.example.shotforge_backend.model.CharacterBible;
import com.example.shotforge_backend.model.ProductionState;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.Shot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Pre-production critique of the shot list, and the user actions on its result.
 * Approval is manual and never revoked by later shot edits.
 */
@Service
public class CinematicAuditService {
    private static final Logger LOGGER = LoggerFactory.getLogger(CinematicAuditService.class);

    private final CinematicAuditEngine auditEngine;
    private final ProjectService projectService;
    private final AuditProperties properties;
    private final Clock clock;

    public CinematicAuditService(CinematicAuditEngine auditEngine,
                                 ProjectService projectService,
                                 AuditProperties properties,
                                 Clock clock) {
        this.auditEngine = auditEngine;
        this.projectService = projectService;
        this.properties = properties;
        this.clock = clock;
    }

    public AuditResult runAudit(UUID projectId) {
        Project project = projectService.get(projectId);
        requireAuditable(project);

        List<CinematicAuditEngine.ShotInput> shots = snapshot(project);
        LOGGER.info("AUDIT START projectId={} shots={}", projectId, shots.size());
        CinematicAuditEngine.Result critique;
        try {
            critique = critique(project, shots);
        } catch (Exception e) {
            LOGGER.warn("AUDIT FAILED projectId={} cause={}", projectId, e.getMessage());
            throw new AuditException("cinematic audit failed: " + e.getMessage(), e);
        }

        AuditResult result = toResult(project, critique);
        project.setAuditResult(result);
        projectService.save(project);
        LOGGER.info("AUDIT DONE projectId={} score={} passed={} suggestions={}", projectId, result.score(), result.passed(),
                result.perShotSuggestions().size());
        return result;
    }

    /**
     * Applies every suggestion that carries a rewrite, drops the stale result and audits again.
     * When the re-audit fails the rewrites stay applied and the project is left without an audit result.
     */
    public AuditResult applyAllSuggestionsAndReaudit(UUID projectId) {
        Project project = projectService.get(projectId);
        requireAuditable(project);
        AuditResult audit = project.getAuditResult();
        if (audit == null) {
            throw new PreconditionException("no audit result to apply");
        }
        int applied = 0;
        for (AuditSuggestion suggestion : audit.perShotSuggestions()) {
            if (!hasRewrite(suggestion)) continue;
            Shot shot = project.findShot(suggestion.shotId()).orElse(null);
            if (shot == null || !shot.getStatus().isEditable()) continue;
            if (!isBlank(suggestion.rewrittenDescription())) shot.setDescription(suggestion.rewrittenDescription());
            if (suggestion.rewrittenDialogue() != null) shot.setDialogue(suggestion.rewrittenDialogue());
            applied++;
        }
        project.setAuditResult(null);
        projectService.save(project);
        LOGGER.info("AUDIT suggestions applied projectId={} applied={} reauditing", projectId, applied);
        return runAudit(projectId);
    }

    /**
     * Repeatedly audits the shot list and tries the proposed rewrites, keeping a round only when a
     * validation audit scores it higher than the best list so far. Stops at the pass score, when no
     * rewrites are offered, after two rounds without a meaningful gain, or at the iteration cap.
     * The best shot list and its audit are stored; approval stays a separate action.
     */
    public OptimizationReport autoOptimizeUntilReady(UUID projectId) {
        Project project = projectService.get(projectId);
        requireAuditable(project);

        double target = properties.getPassScore();
        int maxIterations = Math.max(1, properties.getMaxOptimizeIterations());
        double startScore = project.getAuditResult() == null ? 0 : project.getAuditResult().score();

        List<CinematicAuditEngine.ShotInput> best = snapshot(project);
        CinematicAuditEngine.Result bestAudit = null;
        double bestScore = startScore;
        int iteration = 0;
        int stalls = 0;
        OptimizationOutcome outcome = OptimizationOutcome.MAX_ITERATIONS;

        LOGGER.info("OPTIMIZE START projectId={} score={} target={}", projectId, startScore, target);
        while (iteration < maxIterations) {
            if (stalls >= 2) {
                outcome = OptimizationOutcome.STALLED;
                break;
            }
            iteration++;
            CinematicAuditEngine.Result current;
            try {
                current = critique(project, best);
            } catch (Exception e) {
                LOGGER.warn("OPTIMIZE FAILED projectId={} iteration={} cause={}", projectId, iteration, e.getMessage());
                throw new AuditException("cinematic audit failed during optimization: " + e.getMessage(), e);
            }
            double currentScore = clamp(current.score());
            if (iteration == 1) {
                bestAudit = current;
                bestScore = currentScore;
            }
            if (currentScore >= target) {
                bestAudit = current;
                bestScore = currentScore;
                outcome = OptimizationOutcome.TARGET_REACHED;
                break;
            }

            List<AuditSuggestion> rewrites = current.perShotSuggestions() == null ? List.of()
                    : current.perShotSuggestions().stream().filter(CinematicAuditService::hasRewrite).toList();
            if (rewrites.isEmpty()) {
                outcome = OptimizationOutcome.NO_REWRITES;
                break;
            }

            List<CinematicAuditEngine.ShotInput> candidate = applyRewrites(best, rewrites);
            CinematicAuditEngine.Result validation;
            try {
                validation = critique(project, candidate);
            } catch (Exception e) {
                LOGGER.warn("OPTIMIZE validation failed projectId={} iteration={} cause={}", projectId, iteration, e.getMessage());
                stalls++;
                continue;
            }
            double validated = clamp(validation.score());
            double improvement = validated - bestScore;
            if (improvement > 0) {
                best = candidate;
                bestAudit = validation;
                bestScore = validated;
                stalls = improvement >= properties.getMinImprovement() ? 0 : stalls + 1;
                LOGGER.info("OPTIMIZE accepted projectId={} iteration={} score={} gain={}", projectId, iteration, validated, improvement);
            } else {
                stalls++;
                LOGGER.info("OPTIMIZE rejected projectId={} iteration={} validated={} best={}", projectId, iteration, validated, bestScore);
            }
        }
        if (outcome == OptimizationOutcome.MAX_ITERATIONS && stalls >= 2) {
            outcome = OptimizationOutcome.STALLED;
        }

        for (CinematicAuditEngine.ShotInput input : best) {
            project.findShot(input.shotId()).ifPresent(shot -> {
                shot.setDescription(input.description());
                shot.setDialogue(input.dialogue());
            });
        }
        AuditResult result = toResult(project, bestAudit);
        project.setAuditResult(result);
        projectService.save(project);
        LOGGER.info("OPTIMIZE DONE projectId={} outcome={} iterations={} score={}", projectId, outcome, iteration, result.score());
        return new OptimizationReport(outcome, iteration, startScore, result.score(), result);
    }

    /**
     * Copies the suggested rewrite onto the shot. Does not re-run or re-validate the audit.
     */
    public Shot applySuggestion(UUID projectId, String shotId) {
        Project project = projectService.get(projectId);
        AuditResult audit = project.getAuditResult();
        if (audit == null) {
            throw new PreconditionException("no audit result to apply");
        }
        AuditSuggestion suggestion = audit.suggestionFor(shotId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "SUGGESTION_NOT_FOUND"));
        Shot shot = projectService.requireEditableShot(project, shotId);
        if (!hasRewrite(suggestion)) {
            throw new PreconditionException("suggestion for " + shotId + " carries no rewrite");
        }
        if (!isBlank(suggestion.rewrittenDescription())) shot.setDescription(suggestion.rewrittenDescription());
        if (suggestion.rewrittenDialogue() != null) shot.setDialogue(suggestion.rewrittenDialogue());
        projectService.save(project);
        LOGGER.info("AUDIT suggestion applied projectId={} shotId={} category={}", projectId, shotId, suggestion.category());
        return shot;
    }

    /**
     * Approves the audit and creates the production state. Idempotent.
     */
    public ProductionState approveAudit(UUID projectId) {
        Project project = projectService.get(projectId);
        if (project.isAuditApproved() && project.getProductionState() != null) {
            return project.getProductionState();
        }
        if (project.getShots().isEmpty()) {
            throw new PreconditionException("nothing to approve, run the script breakdown first");
        }
        if (project.getAuditResult() == null) {
            throw new PreconditionException("run the cinematic audit before approving it");
        }
        project.setAuditApproved(true);
        project.setProductionState(new ProductionState(project.getQualityTier()));
        Project saved = projectService.save(project);
        LOGGER.info("AUDIT APPROVED projectId={} score={}", projectId, project.getAuditResult().score());
        return saved.getProductionState();
    }

    private void requireAuditable(Project project) {
        if (project.isProductionStarted()) {
            throw new PreconditionException("audit is locked once production has started");
        }
        projectService.requireNoActiveRun(project);
        if (project.getShots().isEmpty()) {
            throw new PreconditionException("nothing to audit, run the script breakdown first");
        }
    }

    private CinematicAuditEngine.Result critique(Project project, List<CinematicAuditEngine.ShotInput> shots) throws Exception {
        CharacterBible bible = project.getReferenceAnchor() == null ? null : project.getReferenceAnchor().characterBible();
        String biblePrompt = bible == null ? "" : bible.toPromptString();
        return auditEngine.critique(new CinematicAuditEngine.Request(shots, biblePrompt));
    }

    private AuditResult toResult(Project project, CinematicAuditEngine.Result critique) {
        Set<String> shotIds = project.getShots().stream().map(Shot::getId).collect(Collectors.toSet());
        List<AuditSuggestion> suggestions = critique.perShotSuggestions() == null ? List.of()
                : critique.perShotSuggestions().stream().filter(s -> shotIds.contains(s.shotId())).toList();
        double score = clamp(critique.score());
        return new AuditResult(score, score >= properties.getPassScore(), suggestions,
                critique.correctivePrompts(), clock.millis());
    }

    private static List<CinematicAuditEngine.ShotInput> snapshot(Project project) {
        return project.getShots().stream()
                .map(s -> new CinematicAuditEngine.ShotInput(s.getId(), s.getTitle(), s.getDescription(),
                        s.getDialogue(), s.getMood(), s.getDurationSeconds()))
                .toList();
    }

    private static List<CinematicAuditEngine.ShotInput> applyRewrites(List<CinematicAuditEngine.ShotInput> shots,
                                                                     List<AuditSuggestion> rewrites) {
        Map<String, AuditSuggestion> byShot = new HashMap<>();
        for (AuditSuggestion rewrite : rewrites) {
            byShot.putIfAbsent(rewrite.shotId(), rewrite);
        }
        List<CinematicAuditEngine.ShotInput> out = new ArrayList<>(shots.size());
        for (CinematicAuditEngine.ShotInput shot : shots) {
            AuditSuggestion s = byShot.get(shot.shotId());
            if (s == null) {
                out.add(shot);
                continue;
            }
            String description = isBlank(s.rewrittenDescription()) ? shot.description() : s.rewrittenDescription();
            String dialogue = s.rewrittenDialogue() == null ? shot.dialogue() : s.rewrittenDialogue();
            out.add(new CinematicAuditEngine.ShotInput(shot.shotId(), shot.title(), description, dialogue,
                    shot.mood(), shot.durationSeconds()));
        }
        return out;
    }

    private static boolean hasRewrite(AuditSuggestion suggestion) {
        return !isBlank(suggestion.rewrittenDescription()) || suggestion.rewrittenDialogue() != null;
    }

    private static double clamp(double score) {
        return Math.max(0, Math.min(100, score));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public enum OptimizationOutcome { TARGET_REACHED, NO_REWRITES, STALLED, MAX_ITERATIONS }

    public record OptimizationReport(OptimizationOutcome outcome,
                                     int iterations,
                                     double startScore,
                                     double finalScore,
                                     AuditResult audit) {}
}
