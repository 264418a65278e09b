package com.example.shotforge_backend.controller;

import com.example.shotforge_backend.dto.web.ProductionStatusResponse;
import com.example.shotforge_backend.exception.InsufficientCreditsException;
import com.example.shotforge_backend.exception.PreconditionException;
import com.example.shotforge_backend.model.Account;
import com.example.shotforge_backend.model.ProductionState;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.QualityTier;
import com.example.shotforge_backend.model.Shot;
import com.example.shotforge_backend.service.production.ProductionOrchestrator;
import com.example.shotforge_backend.util.RunStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ProductionController.class)
@AutoConfigureMockMvc(addFilters = false)
class ProductionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProductionOrchestrator orchestrator;

    @Test
    void startIsAccepted() throws Exception {
        Project project = runningProject();
        when(orchestrator.start(project.getId())).thenReturn(ProductionStatusResponse.from(project));

        mockMvc.perform(post("/v1/projects/" + project.getId() + "/production/start"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runStatus").value("RUNNING"))
                .andExpect(jsonPath("$.shots[0].id").value("S01"));
    }

    @Test
    void startWithoutCreditsIsPaymentRequired() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(orchestrator.start(projectId)).thenThrow(new InsufficientCreditsException(25, 5));

        mockMvc.perform(post("/v1/projects/" + projectId + "/production/start"))
                .andExpect(status().isPaymentRequired());
    }

    @Test
    void startBeforeApprovalIsConflict() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(orchestrator.start(projectId)).thenThrow(new PreconditionException("cinematic audit has not been approved"));

        mockMvc.perform(post("/v1/projects/" + projectId + "/production/start"))
                .andExpect(status().isConflict());
    }

    @Test
    void cancelAndStatusDelegate() throws Exception {
        Project project = runningProject();
        when(orchestrator.cancel(project.getId())).thenReturn(ProductionStatusResponse.from(project));
        when(orchestrator.status(project.getId())).thenReturn(ProductionStatusResponse.from(project));

        mockMvc.perform(post("/v1/projects/" + project.getId() + "/production/cancel"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/v1/projects/" + project.getId() + "/production"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.qualityTier").value("STANDARD"));

        verify(orchestrator).cancel(project.getId());
    }

    private static Project runningProject() {
        Account owner = new Account("user-1", "User");
        owner.setId(UUID.randomUUID());
        Project project = new Project(owner, "Night Market", "drama", "synopsis", 5);
        project.setId(UUID.randomUUID());
        Shot shot = new Shot("S01", 0);
        shot.setDescription("Mara walks");
        project.setShots(List.of(shot));
        ProductionState state = new ProductionState(QualityTier.STANDARD);
        state.setRunStatus(RunStatus.RUNNING);
        state.setRunning(true);
        project.setProductionState(state);
        return project;
    }
}
