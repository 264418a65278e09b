package com.example.shotforge_backend.service.production;

import com.example.shotforge_backend.model.Account;
import com.example.shotforge_backend.model.ProductionState;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.QualityTier;
import com.example.shotforge_backend.model.Shot;
import com.example.shotforge_backend.repository.ProjectRepository;
import com.example.shotforge_backend.util.ProjectStatus;
import com.example.shotforge_backend.util.RunStatus;
import com.example.shotforge_backend.util.ShotStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProductionReconcilerTest {

    @Mock
    private ProjectRepository projectRepository;
    @InjectMocks
    private ProductionReconciler reconciler;

    @Test
    void resetsShotInterruptedMidGeneration() {
        Project project = project(ShotStatus.COMPLETED, ShotStatus.GENERATING, ShotStatus.PENDING);
        ProductionState state = project.getProductionState();
        state.setRunning(true);
        state.setRunStatus(RunStatus.RUNNING);
        state.voiceTrackFor("S02").setStatus(ShotStatus.GENERATING);
        when(projectRepository.findByStatus(ProjectStatus.IN_PRODUCTION)).thenReturn(List.of(project));

        int reset = reconciler.reconcile();

        Shot s02 = project.findShot("S02").orElseThrow();
        assertThat(reset).isEqualTo(1);
        assertThat(s02.getStatus()).isEqualTo(ShotStatus.PENDING);
        assertThat(s02.getRetryCount()).isZero();
        assertThat(state.getCurrentShotIndex()).isEqualTo(1);
        assertThat(state.isRunning()).isFalse();
        assertThat(state.getRunStatus()).isEqualTo(RunStatus.IDLE);
        assertThat(state.getHaltReason()).isEqualTo(ProductionReconciler.HALT_INTERRUPTED);
        assertThat(state.voiceTrackFor("S02").getStatus()).isEqualTo(ShotStatus.PENDING);
        assertThat(project.findShot("S01").orElseThrow().getStatus()).isEqualTo(ShotStatus.COMPLETED);
        verify(projectRepository).save(project);
    }

    @Test
    void leavesStoppedRunsAlone() {
        Project project = project(ShotStatus.COMPLETED, ShotStatus.FAILED);
        project.getProductionState().setRunStatus(RunStatus.HALTED);
        when(projectRepository.findByStatus(ProjectStatus.IN_PRODUCTION)).thenReturn(List.of(project));

        assertThat(reconciler.reconcile()).isZero();
        assertThat(project.getProductionState().getRunStatus()).isEqualTo(RunStatus.HALTED);
        verify(projectRepository, never()).save(any());
    }

    private static Project project(ShotStatus... statuses) {
        Account owner = new Account("user-1", "User");
        owner.setId(UUID.randomUUID());
        Project project = new Project(owner, "Night Market", "drama", "synopsis", 15);
        project.setId(UUID.randomUUID());
        List<Shot> shots = new ArrayList<>();
        for (int i = 0; i < statuses.length; i++) {
            Shot shot = new Shot(Shot.idForIndex(i), i);
            shot.setStatus(statuses[i]);
            shot.setRetryCount(statuses[i] == ShotStatus.GENERATING ? 2 : 0);
            shots.add(shot);
        }
        project.setShots(shots);
        project.setStatus(ProjectStatus.IN_PRODUCTION);
        project.setProductionState(new ProductionState(QualityTier.STANDARD));
        return project;
    }
}
