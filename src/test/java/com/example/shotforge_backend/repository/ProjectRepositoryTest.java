package com.example.shotforge_backend.repository;

import com.example.shotforge_backend.model.Account;
import com.example.shotforge_backend.model.ProductionState;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.QualityTier;
import com.example.shotforge_backend.model.Shot;
import com.example.shotforge_backend.util.ProjectStatus;
import com.example.shotforge_backend.util.RunStatus;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ProjectRepositoryTest {

    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private EntityManager entityManager;

    @Test
    void shotListAndProductionStateSurviveReload() {
        Account owner = accountRepository.save(new Account("ext-" + UUID.randomUUID(), "Owner"));
        Project project = new Project(owner, "Night Market", "drama", "synopsis", 10);
        Shot first = new Shot("S01", 0);
        first.setDescription("Mara walks through the market");
        Shot second = new Shot("S02", 1);
        second.setDescription("Mara stops at a stall");
        project.setShots(List.of(first, second));
        ProductionState state = new ProductionState(QualityTier.PROFESSIONAL);
        state.setRunStatus(RunStatus.HALTED);
        project.setProductionState(state);
        project.setStatus(ProjectStatus.IN_PRODUCTION);
        UUID id = projectRepository.saveAndFlush(project).getId();
        entityManager.clear();

        Project reloaded = projectRepository.findWithOwnerById(id).orElseThrow();

        assertThat(reloaded.getOwner().getExternalSubject()).isEqualTo(owner.getExternalSubject());
        assertThat(reloaded.getShots()).extracting(Shot::getId).containsExactly("S01", "S02");
        assertThat(reloaded.getShots().get(1).getDescription()).isEqualTo("Mara stops at a stall");
        assertThat(reloaded.getProductionState().getRunStatus()).isEqualTo(RunStatus.HALTED);
        assertThat(reloaded.getProductionState().getQualityTier()).isEqualTo(QualityTier.PROFESSIONAL);
    }

    @Test
    void findByStatusReturnsOnlyMatchingProjects() {
        Account owner = accountRepository.save(new Account("ext-" + UUID.randomUUID(), "Owner"));
        Project producing = new Project(owner, "A", null, null, 10);
        producing.setStatus(ProjectStatus.IN_PRODUCTION);
        projectRepository.save(producing);
        projectRepository.save(new Project(owner, "B", null, null, 10));
        projectRepository.flush();

        assertThat(projectRepository.findByStatus(ProjectStatus.IN_PRODUCTION))
                .extracting(Project::getTitle)
                .containsExactly("A");
    }
}
