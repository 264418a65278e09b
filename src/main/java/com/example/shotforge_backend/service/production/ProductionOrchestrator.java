package com.example.shotforge_backend.service.production;

import com.example.shotforge_backend.config.GenerationProperties;
import com.example.shotforge_backend.config.ProductionProperties;
import com.example.shotforge_backend.dto.web.ProductionStatusResponse;
import com.example.shotforge_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.shotforge_backend.engine.Interfaces.VisualDebuggerEngine;
import com.example.shotforge_backend.engine.Interfaces.VoiceGenerationEngine;
import com.example.shotforge_backend.exception.ContentFilteredException;
import com.example.shotforge_backend.exception.InsufficientCreditsException;
import com.example.shotforge_backend.exception.PreconditionException;
import com.example.shotforge_backend.exception.ProductionCancelledException;
import com.example.shotforge_backend.model.AuditResult;
import com.example.shotforge_backend.model.CharacterBible;
import com.example.shotforge_backend.model.MasterAnchor;
import com.example.shotforge_backend.model.ProductionState;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.Shot;
import com.example.shotforge_backend.model.VisualDebugResult;
import com.example.shotforge_backend.model.VoiceTrack;
import com.example.shotforge_backend.service.ProjectService;
import com.example.shotforge_backend.service.billing.CreditBillingGuard;
import com.example.shotforge_backend.util.CameramanFilter;
import com.example.shotforge_backend.util.CancellationToken;
import com.example.shotforge_backend.util.ContentFilterRephraser;
import com.example.shotforge_backend.util.ProjectStatus;
import com.example.shotforge_backend.util.RunStatus;
import com.example.shotforge_backend.util.ShotStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Drives the shot-by-shot production of one project.
 * <p>
 * Shots are processed strictly in index order on the production executor: admission against the
 * credit balance, video and voice generation in parallel, a visual-debugger gate with corrective
 * retries, then the chain frame update and the single charge for the shot. A failed shot halts
 * the run. Every transition is persisted and applied under the run's monitor.
 */
@Service
public class ProductionOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProductionOrchestrator.class);

    static final String HALT_INSUFFICIENT_CREDITS = "INSUFFICIENT_CREDITS";
    static final String HALT_SHOT_FAILED = "SHOT_FAILED";
    static final String HALT_CANCELLED = "CANCELLED";
    static final String HALT_ERROR = "ERROR";

    private final ProjectService projectService;
    private final CreditBillingGuard billing;
    private final VideoGenerationEngine videoEngine;
    private final VoiceGenerationEngine voiceEngine;
    private final VisualDebuggerEngine debuggerEngine;
    private final ProductionRunRegistry registry;
    private final ProductionProperties properties;
    private final GenerationProperties generationProperties;
    private final Executor executor;
    private final Clock clock;

    public ProductionOrchestrator(ProjectService projectService,
                                  CreditBillingGuard billing,
                                  VideoGenerationEngine videoEngine,
                                  VoiceGenerationEngine voiceEngine,
                                  VisualDebuggerEngine debuggerEngine,
                                  ProductionRunRegistry registry,
                                  ProductionProperties properties,
                                  GenerationProperties generationProperties,
                                  @Qualifier("productionTaskExecutor") Executor executor,
                                  Clock clock) {
        this.projectService = projectService;
        this.billing = billing;
        this.videoEngine = videoEngine;
        this.voiceEngine = voiceEngine;
        this.debuggerEngine = debuggerEngine;
        this.registry = registry;
        this.properties = properties;
        this.generationProperties = generationProperties;
        this.executor = executor;
        this.clock = clock;
    }

    /* ================== COMMANDS ================== */

    /**
     * Starts or resumes production from the first pending shot. A no-op while a run is active.
     *
     * @throws PreconditionException        when the anchor analysis or the audit approval is missing,
     *                                      or failed shots wait for {@link #retryFailedShots(UUID)}
     * @throws InsufficientCreditsException when the next shot cannot be admitted
     */
    public ProductionStatusResponse start(UUID projectId) {
        if (registry.isActive(projectId)) {
            LOGGER.info("PRODUCTION start ignored, run active projectId={}", projectId);
            return status(projectId);
        }
        Project project = projectService.get(projectId);
        ProductionState state = requireStartable(project);
        if (project.getShots().stream().anyMatch(s -> s.getStatus() == ShotStatus.FAILED)) {
            throw new PreconditionException("failed shots must be retried before production can resume");
        }
        List<String> targets = project.getShots().stream()
                .filter(s -> s.getStatus() != ShotStatus.COMPLETED)
                .map(Shot::getId)
                .toList();
        if (targets.isEmpty()) {
            return ProductionStatusResponse.from(project);
        }
        billing.ensureAffordable(project, targets.get(0), state.getQualityTier());
        return launch(project, targets, "start");
    }

    /**
     * Resets failed shots to pending and re-processes only those, in index order.
     * Completed shots are neither regenerated nor charged again. A no-op while a run is active.
     */
    public ProductionStatusResponse retryFailedShots(UUID projectId) {
        if (registry.isActive(projectId)) {
            LOGGER.info("PRODUCTION retry ignored, run active projectId={}", projectId);
            return status(projectId);
        }
        Project project = projectService.get(projectId);
        ProductionState state = requireStartable(project);
        List<Shot> failed = project.getShots().stream()
                .filter(s -> s.getStatus() == ShotStatus.FAILED)
                .toList();
        if (failed.isEmpty()) {
            return ProductionStatusResponse.from(project);
        }
        billing.ensureAffordable(project, failed.get(0).getId(), state.getQualityTier());
        return launch(project, failed.stream().map(Shot::getId).toList(), "retry");
    }

    /**
     * Signals cancellation to the active run. The in-flight shot returns to pending once the run
     * observes the signal; nothing is charged for it.
     */
    public ProductionStatusResponse cancel(UUID projectId) {
        registry.find(projectId).ifPresentOrElse(run -> {
            LOGGER.info("PRODUCTION cancel requested projectId={}", projectId);
            run.token().cancel();
        }, () -> LOGGER.info("PRODUCTION cancel ignored, no active run projectId={}", projectId));
        return status(projectId);
    }

    public ProductionStatusResponse status(UUID projectId) {
        return projectService.read(projectId, ProductionStatusResponse::from);
    }

    /* ================== RUN SETUP ================== */

    private ProductionState requireStartable(Project project) {
        if (!project.isAnalysisComplete()) {
            throw new PreconditionException("reference anchor analysis is not complete");
        }
        ProductionState state = project.getProductionState();
        if (!project.isAuditApproved() || state == null || !state.isAuditApproved()) {
            throw new PreconditionException("cinematic audit has not been approved");
        }
        if (project.getShots().isEmpty()) {
            throw new PreconditionException("project has no shots");
        }
        return state;
    }

    private ProductionStatusResponse launch(Project project, List<String> shotIds, String mode) {
        var claimed = registry.tryRegister(project);
        if (claimed.isEmpty()) {
            return status(project.getId());
        }
        ProductionRunRegistry.ActiveRun run = claimed.get();
        try {
            synchronized (run) {
                ProductionState state = project.getProductionState();
                if (state.getMasterAnchor() == null) {
                    var anchor = project.getReferenceAnchor();
                    state.setMasterAnchor(new MasterAnchor(anchor.imageUrl(), anchor.characterBible()));
                }
                if (state.getChainContext().getSeed() == null) {
                    state.getChainContext().setSeed(ThreadLocalRandom.current().nextLong(1, Integer.MAX_VALUE));
                }
                if ("retry".equals(mode)) {
                    for (String shotId : shotIds) {
                        Shot shot = project.findShot(shotId).orElseThrow();
                        shot.setStatus(ShotStatus.PENDING);
                        shot.setRetryCount(0);
                        shot.setError(null);
                    }
                }
                project.findShot(shotIds.get(0)).ifPresent(s -> state.setCurrentShotIndex(s.getIndex()));
                if (state.getStartedAt() == null) state.setStartedAt(clock.millis());
                state.setFinishedAt(null);
                state.setRunning(true);
                state.setRunStatus(RunStatus.RUNNING);
                state.setHaltReason(null);
                project.setStatus(ProjectStatus.IN_PRODUCTION);
                persist(project);
            }
        } catch (RuntimeException e) {
            registry.remove(run);
            throw e;
        }

        LOGGER.info("PRODUCTION {} projectId={} shots={} seed={}", mode.toUpperCase(), project.getId(), shotIds,
                project.getProductionState().getChainContext().getSeed());
        try {
            executor.execute(() -> runLoop(run, shotIds));
        } catch (TaskRejectedException e) {
            synchronized (run) {
                ProductionState state = project.getProductionState();
                state.setRunning(false);
                state.setRunStatus(RunStatus.IDLE);
                persist(project);
            }
            registry.remove(run);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "PRODUCTION_QUEUE_FULL", e);
        }
        return status(project.getId());
    }

    /* ================== RUN LOOP ================== */

    void runLoop(ProductionRunRegistry.ActiveRun run, List<String> shotIds) {
        Project project = run.project();
        long t0 = System.nanoTime();
        try {
            for (String shotId : shotIds) {
                if (!processShot(run, shotId)) {
                    halt(run, HALT_SHOT_FAILED + " " + shotId);
                    return;
                }
            }
            finish(run);
            LOGGER.info("PRODUCTION DONE projectId={} in={}ms", project.getId(), (System.nanoTime() - t0) / 1_000_000);
        } catch (ProductionCancelledException e) {
            markCancelled(run);
        } catch (InsufficientCreditsException e) {
            LOGGER.warn("PRODUCTION HALT projectId={} reason={} {}", project.getId(), HALT_INSUFFICIENT_CREDITS, e.getDetailMessage());
            halt(run, HALT_INSUFFICIENT_CREDITS);
        } catch (RuntimeException e) {
            LOGGER.error("PRODUCTION run failed projectId={}: {}", project.getId(), e.toString(), e);
            haltOnError(run, e);
        } finally {
            registry.remove(run);
        }
    }

    /**
     * @return {@code true} when the shot completed, {@code false} when it exhausted its attempts
     */
    boolean processShot(ProductionRunRegistry.ActiveRun run, String shotId) {
        CancellationToken token = run.token();
        token.throwIfCancelled();
        Project project = run.project();
        Shot shot;
        ProductionState state;
        synchronized (run) {
            state = project.getProductionState();
            shot = project.findShot(shotId).orElseThrow();
            if (shot.getStatus() == ShotStatus.COMPLETED) {
                return true;
            }
        }

        // 1. admission, before any transition
        if (!billing.checkAndReserve(project, shotId, state.getQualityTier())) {
            throw new InsufficientCreditsException(billing.costFor(state.getQualityTier()),
                    billing.available(project.getOwner().getId()));
        }

        // 2. generating
        synchronized (run) {
            shot.setStatus(ShotStatus.GENERATING);
            shot.setError(null);
            state.setCurrentShotIndex(shot.getIndex());
            persist(project);
        }
        LOGGER.info("SHOT GENERATING projectId={} shotId={} index={}", project.getId(), shotId, shot.getIndex());

        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        String correctivePrompt = null;
        boolean softened = false;
        while (shot.getRetryCount() < maxAttempts) {
            Attempt attempt = attempt(run, shot, correctivePrompt, softened);
            if (attempt.result().passed()) {
                complete(run, shot, attempt);
                return true;
            }
            synchronized (run) {
                shot.recordAttempt(attempt.result());
                shot.setRetryCount(shot.getRetryCount() + 1);
                persist(project);
            }
            if (attempt.contentFiltered()) {
                softened = true;
                LOGGER.warn("SHOT CONTENT FILTERED projectId={} shotId={} attempt={}/{} rephrasing", project.getId(), shotId,
                        shot.getRetryCount(), maxAttempts);
                continue;
            }
            correctivePrompt = attempt.result().correctivePrompt();
            LOGGER.warn("SHOT RETRY projectId={} shotId={} attempt={}/{} score={} error={}", project.getId(), shotId,
                    shot.getRetryCount(), maxAttempts, attempt.result().score(), attempt.result().error());
        }
        fail(run, shot);
        return false;
    }

    private record Attempt(VisualDebugResult result, VideoGenerationEngine.Result clip, boolean contentFiltered) {

        Attempt(VisualDebugResult result, VideoGenerationEngine.Result clip) {
            this(result, clip, false);
        }
    }

    private Attempt attempt(ProductionRunRegistry.ActiveRun run, Shot shot, String correctivePrompt, boolean softened) {
        CancellationToken token = run.token();
        Project project = run.project();
        ProductionState state;
        VideoGenerationEngine.Request request;
        VoiceTrack voiceTrack = null;
        List<String> criteria;
        synchronized (run) {
            state = project.getProductionState();
            MasterAnchor anchor = state.getMasterAnchor();
            CharacterBible bible = anchor.characterBible();
            String referenceFrame = shot.getIndex() == 0 || state.getChainContext().getPreviousFrameUrl() == null
                    ? anchor.imageUrl()
                    : state.getChainContext().getPreviousFrameUrl();
            request = new VideoGenerationEngine.Request(
                    shot.getId(),
                    softened ? ContentFilterRephraser.rephrase(buildPrompt(shot, correctivePrompt))
                            : buildPrompt(shot, correctivePrompt),
                    bible == null ? CameramanFilter.negativePrompt() : bible.negativePrompt(),
                    referenceFrame,
                    state.getChainContext().getSeed(),
                    bible == null ? "" : bible.toPromptString(),
                    shot.getDurationSeconds(),
                    state.getQualityTier());
            criteria = correctiveCriteria(project.getAuditResult(), shot.getId());
            if (shot.getDialogue() != null && !shot.getDialogue().isBlank()) {
                voiceTrack = state.voiceTrackFor(shot.getId());
                if (voiceTrack.getStatus() == ShotStatus.COMPLETED) {
                    voiceTrack = null;
                } else {
                    voiceTrack.setStatus(ShotStatus.GENERATING);
                }
            }
        }

        // fan-out
        CompletableFuture<VideoGenerationEngine.Result> video = dispatch(() -> videoEngine.generate(request, token));
        CompletableFuture<VoiceGenerationEngine.Result> voice = voiceTrack == null ? null
                : dispatch(() -> voiceEngine.synthesize(new VoiceGenerationEngine.Request(shot.getId(),
                        shot.getDialogue(), generationProperties.getVoiceId()), token));

        VideoGenerationEngine.Result clip = null;
        String generationError = null;
        boolean filtered = false;
        try {
            clip = token.await(video);
        } catch (ProductionCancelledException e) {
            if (voice != null) voice.cancel(true);
            throw e;
        } catch (ContentFilteredException e) {
            filtered = true;
            generationError = e.getMessage();
        } catch (RuntimeException e) {
            generationError = "video generation failed: " + e.getMessage();
        }
        if (voice != null) {
            joinVoice(run, voiceTrack, voice);
        }
        if (clip == null) {
            return new Attempt(VisualDebugResult.generationFailure(generationError, clock.millis()), null, filtered);
        }

        // quality gate
        final VideoGenerationEngine.Result produced = clip;
        final VisualDebuggerEngine.Request gate = new VisualDebuggerEngine.Request(shot.getId(), produced.videoUrl(),
                produced.endFrameUrl(), shot.getDescription(), request.characterBible(), criteria);
        VisualDebuggerEngine.Result verdict;
        try {
            verdict = token.await(dispatch(() -> debuggerEngine.evaluate(gate, token)));
        } catch (ProductionCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            return new Attempt(VisualDebugResult.generationFailure("visual debugger failed: " + e.getMessage(), clock.millis()), null);
        }
        return new Attempt(new VisualDebugResult(verdict.score(), verdict.passed(), verdict.correctivePrompt(),
                verdict.issues(), null, clock.millis()), produced);
    }

    private void joinVoice(ProductionRunRegistry.ActiveRun run, VoiceTrack track,
                           CompletableFuture<VoiceGenerationEngine.Result> voice) {
        try {
            VoiceGenerationEngine.Result result = run.token().await(voice);
            synchronized (run) {
                track.setAudioUrl(result.audioUrl());
                track.setStatus(ShotStatus.COMPLETED);
            }
        } catch (ProductionCancelledException e) {
            synchronized (run) {
                track.setStatus(ShotStatus.PENDING);
            }
            throw e;
        } catch (RuntimeException e) {
            LOGGER.warn("VOICE FAILED projectId={} shotId={} cause={}", run.project().getId(), track.getShotId(), e.getMessage());
            synchronized (run) {
                track.setStatus(ShotStatus.FAILED);
            }
        }
    }

    private static <T> CompletableFuture<T> dispatch(Supplier<CompletableFuture<T>> call) {
        try {
            CompletableFuture<T> future = call.get();
            return future != null ? future : CompletableFuture.failedFuture(new IllegalStateException("engine returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    static String buildPrompt(Shot shot, String correctivePrompt) {
        StringBuilder prompt = new StringBuilder(shot.getDescription());
        if (shot.getMood() != null && !shot.getMood().isBlank()) {
            prompt.append(". Mood: ").append(shot.getMood());
        }
        if (shot.getCameraMovement() != null && !shot.getCameraMovement().isBlank()) {
            prompt.append(". Movement: ").append(shot.getCameraMovement());
        }
        if (correctivePrompt != null && !correctivePrompt.isBlank()) {
            prompt.append(". ").append(correctivePrompt);
        }
        return CameramanFilter.apply(prompt.toString());
    }

    private static List<String> correctiveCriteria(AuditResult audit, String shotId) {
        List<String> criteria = new ArrayList<>();
        if (audit == null) return criteria;
        criteria.addAll(audit.correctivePrompts());
        audit.suggestionFor(shotId)
                .map(s -> s.suggestion())
                .filter(s -> s != null && !s.isBlank())
                .ifPresent(criteria::add);
        return criteria;
    }

    /* ================== TRANSITIONS ================== */

    private void complete(ProductionRunRegistry.ActiveRun run, Shot shot, Attempt attempt) {
        Project project = run.project();
        try {
            billing.commit(project, shot.getId());
        } catch (InsufficientCreditsException e) {
            synchronized (run) {
                shot.recordAttempt(attempt.result());
                shot.setStatus(ShotStatus.PENDING);
                shot.setRetryCount(0);
                persist(project);
            }
            billing.release(project.getId(), shot.getId());
            throw e;
        }
        synchronized (run) {
            ProductionState state = project.getProductionState();
            shot.recordAttempt(attempt.result());
            shot.setVideoUrl(attempt.clip().videoUrl());
            shot.setEndFrameUrl(attempt.clip().endFrameUrl());
            shot.setStatus(ShotStatus.COMPLETED);
            shot.setError(null);
            state.getChainContext().setPreviousFrameUrl(shot.getEndFrameUrl());
            state.setCurrentShotIndex(shot.getIndex() + 1);
            project.setClipUrls(project.getShots().stream()
                    .filter(s -> s.getStatus() == ShotStatus.COMPLETED)
                    .map(Shot::getVideoUrl)
                    .toList());
            persist(project);
        }
        LOGGER.info("SHOT COMPLETED projectId={} shotId={} attempts={} score={}", project.getId(), shot.getId(),
                shot.getVisualDebugResults().size(), attempt.result().score());
    }

    private void fail(ProductionRunRegistry.ActiveRun run, Shot shot) {
        Project project = run.project();
        synchronized (run) {
            VisualDebugResult last = shot.lastAttempt();
            String error = last == null ? "no attempt recorded"
                    : last.error() != null ? last.error()
                    : "visual debugger score %.1f below the gate after %d attempts".formatted(last.score(), shot.getRetryCount());
            shot.setStatus(ShotStatus.FAILED);
            shot.setError(error);
            persist(project);
        }
        billing.release(project.getId(), shot.getId());
        LOGGER.warn("SHOT FAILED projectId={} shotId={} error={}", project.getId(), shot.getId(), shot.getError());
    }

    private void finish(ProductionRunRegistry.ActiveRun run) {
        Project project = run.project();
        synchronized (run) {
            ProductionState state = project.getProductionState();
            state.setRunning(false);
            if (state.isAllCompleted()) {
                state.setRunStatus(RunStatus.COMPLETED);
                state.setFinishedAt(clock.millis());
                project.setStatus(ProjectStatus.COMPLETED);
            } else {
                state.setRunStatus(RunStatus.IDLE);
            }
            persist(project);
        }
    }

    private void halt(ProductionRunRegistry.ActiveRun run, String reason) {
        Project project = run.project();
        synchronized (run) {
            ProductionState state = project.getProductionState();
            state.setRunning(false);
            state.setRunStatus(RunStatus.HALTED);
            state.setHaltReason(reason);
            persist(project);
        }
        LOGGER.warn("PRODUCTION HALTED projectId={} reason={} currentShotIndex={}", project.getId(), reason,
                project.getProductionState().getCurrentShotIndex());
    }

    private void markCancelled(ProductionRunRegistry.ActiveRun run) {
        Project project = run.project();
        synchronized (run) {
            ProductionState state = project.getProductionState();
            state.generatingShot().ifPresent(shot -> {
                shot.setStatus(ShotStatus.PENDING);
                shot.setRetryCount(0);
                state.setCurrentShotIndex(shot.getIndex());
                billing.release(project.getId(), shot.getId());
            });
            state.getVoiceTracks().stream()
                    .filter(v -> v.getStatus() == ShotStatus.GENERATING)
                    .forEach(v -> v.setStatus(ShotStatus.PENDING));
            state.setRunning(false);
            state.setRunStatus(RunStatus.CANCELLED);
            state.setHaltReason(HALT_CANCELLED);
            persist(project);
        }
        LOGGER.info("PRODUCTION CANCELLED projectId={} currentShotIndex={}", project.getId(),
                project.getProductionState().getCurrentShotIndex());
    }

    private void haltOnError(ProductionRunRegistry.ActiveRun run, RuntimeException cause) {
        Project project = run.project();
        try {
            synchronized (run) {
                ProductionState state = project.getProductionState();
                state.generatingShot().ifPresent(shot -> {
                    shot.setStatus(ShotStatus.PENDING);
                    shot.setRetryCount(0);
                    billing.release(project.getId(), shot.getId());
                });
                state.setRunning(false);
                state.setRunStatus(RunStatus.HALTED);
                state.setHaltReason(HALT_ERROR + ": " + cause.getMessage());
                persist(project);
            }
        } catch (RuntimeException persistFailure) {
            cause.addSuppressed(persistFailure);
            LOGGER.error("PRODUCTION could not persist halt projectId={}, startup reconciliation will reset it",
                    project.getId(), persistFailure);
        }
    }

    private void persist(Project project) {
        projectService.save(project);
    }
}
