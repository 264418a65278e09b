package com.example.shotforge_backend.controller;

import com.example.shotforge_backend.exception.ScriptGenerationException;
import com.example.shotforge_backend.model.Account;
import com.example.shotforge_backend.model.AuditResult;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.service.CinematicAuditService;
import com.example.shotforge_backend.service.ProjectService;
import com.example.shotforge_backend.service.ReferenceAnchorService;
import com.example.shotforge_backend.service.ScriptBreakdownService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PreProductionController.class)
@AutoConfigureMockMvc(addFilters = false)
class PreProductionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ScriptBreakdownService breakdownService;
    @MockitoBean
    private ReferenceAnchorService anchorService;
    @MockitoBean
    private CinematicAuditService auditService;
    @MockitoBean
    private ProjectService projectService;

    @Test
    void breakdownWithoutBodyUsesStoredInputs() throws Exception {
        Account owner = new Account("user-1", "User");
        owner.setId(UUID.randomUUID());
        Project project = new Project(owner, "Night Market", "drama", "synopsis", 15);
        project.setId(UUID.randomUUID());
        when(breakdownService.breakdown(project.getId(), null, null, null, null)).thenReturn(project);

        mockMvc.perform(post("/v1/projects/" + project.getId() + "/breakdown"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Night Market"))
                .andExpect(jsonPath("$.ownerExternalSubject").value("user-1"));
    }

    @Test
    void breakdownFailureIsBadGateway() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(breakdownService.breakdown(projectId, null, null, null, 30))
                .thenThrow(new ScriptGenerationException("script generator returned an empty script"));

        mockMvc.perform(post("/v1/projects/" + projectId + "/breakdown")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetDurationSeconds\":30}"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void referenceAnchorRequiresImage() throws Exception {
        mockMvc.perform(post("/v1/projects/" + UUID.randomUUID() + "/reference-anchor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageUrl\":\"\",\"subjectName\":\"Mara\"}"))
                .andExpect(status().isBadRequest());
        verify(anchorService, never()).analyze(any(), any(), any());
    }

    @Test
    void auditReturnsStoredResult() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(auditService.runAudit(projectId)).thenReturn(new AuditResult(84, true, List.of(), List.of("warm light"), 0L));

        mockMvc.perform(post("/v1/projects/" + projectId + "/audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(84.0))
                .andExpect(jsonPath("$.passed").value(true))
                .andExpect(jsonPath("$.correctivePrompts[0]").value("warm light"));
    }

    @Test
    void optimizeReportsOutcomeAndBestAudit() throws Exception {
        UUID projectId = UUID.randomUUID();
        AuditResult best = new AuditResult(82, true, List.of(), List.of(), 0L);
        when(auditService.autoOptimizeUntilReady(projectId)).thenReturn(new CinematicAuditService.OptimizationReport(
                CinematicAuditService.OptimizationOutcome.TARGET_REACHED, 2, 64, 82, best));

        mockMvc.perform(post("/v1/projects/" + projectId + "/audit/optimize"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("TARGET_REACHED"))
                .andExpect(jsonPath("$.iterations").value(2))
                .andExpect(jsonPath("$.audit.passed").value(true));
    }

    @Test
    void applyAllReturnsFreshAudit() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(auditService.applyAllSuggestionsAndReaudit(projectId))
                .thenReturn(new AuditResult(77, false, List.of(), List.of(), 0L));

        mockMvc.perform(post("/v1/projects/" + projectId + "/audit/suggestions/apply-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(77.0));
    }
}
