package com.example.shotforge_backend.service.production;

import com.example.shotforge_backend.model.ProductionState;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.Shot;
import com.example.shotforge_backend.repository.ProjectRepository;
import com.example.shotforge_backend.util.ProjectStatus;
import com.example.shotforge_backend.util.RunStatus;
import com.example.shotforge_backend.util.ShotStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resets runs that were interrupted by a restart. A shot persisted as generating goes back to
 * pending and the run waits for an explicit resume, since the outcome of the lost external call
 * is unknown.
 */
@Component
public class ProductionReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProductionReconciler.class);
    static final String HALT_INTERRUPTED = "INTERRUPTED";

    private final ProjectRepository projectRepository;

    public ProductionReconciler(ProjectRepository projectRepository) {
        this.projectRepository = projectRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public int reconcile() {
        int reset = 0;
        for (Project project : projectRepository.findByStatus(ProjectStatus.IN_PRODUCTION)) {
            ProductionState state = project.getProductionState();
            if (state == null) continue;
            boolean interrupted = state.isRunning();
            for (Shot shot : project.getShots()) {
                if (shot.getStatus() == ShotStatus.GENERATING) {
                    shot.setStatus(ShotStatus.PENDING);
                    shot.setRetryCount(0);
                    state.setCurrentShotIndex(shot.getIndex());
                    interrupted = true;
                }
            }
            state.getVoiceTracks().stream()
                    .filter(v -> v.getStatus() == ShotStatus.GENERATING)
                    .forEach(v -> v.setStatus(ShotStatus.PENDING));
            if (!interrupted) continue;
            state.setRunning(false);
            state.setRunStatus(RunStatus.IDLE);
            state.setHaltReason(HALT_INTERRUPTED);
            projectRepository.save(project);
            reset++;
            LOGGER.warn("RECONCILE interrupted run reset projectId={} currentShotIndex={}", project.getId(), state.getCurrentShotIndex());
        }
        if (reset > 0) {
            LOGGER.info("RECONCILE done resetRuns={}", reset);
        }
        return reset;
    }
}
