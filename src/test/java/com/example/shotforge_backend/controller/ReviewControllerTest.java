package com.example.shotforge_backend.controller;

import com.example.shotforge_backend.dto.web.ExportResponse;
import com.example.shotforge_backend.dto.web.PlaybackPlanResponse;
import com.example.shotforge_backend.exception.NothingToExportException;
import com.example.shotforge_backend.service.ReviewAssembler;
import com.example.shotforge_backend.util.AudioMixMode;
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
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ReviewController.class)
@AutoConfigureMockMvc(addFilters = false)
class ReviewControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReviewAssembler reviewAssembler;

    @Test
    void playbackAcceptsWireCodeForMixMode() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(reviewAssembler.playback(projectId, AudioMixMode.DIALOGUE_ONLY)).thenReturn(new PlaybackPlanResponse(
                projectId, AudioMixMode.DIALOGUE_ONLY, 1.0, 0.0, 5,
                List.of(new PlaybackPlanResponse.Item("S01", 0, "Shot 1", "https://cdn.test/S01.mp4", null, 5, null))));

        mockMvc.perform(get("/v1/projects/" + projectId + "/review/playback").param("mode", "dialogue-only"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.audioMixMode").value("dialogue-only"))
                .andExpect(jsonPath("$.musicVolume").value(0.0))
                .andExpect(jsonPath("$.items[0].shotId").value("S01"));
    }

    @Test
    void unknownMixModeIsBadRequest() throws Exception {
        mockMvc.perform(get("/v1/projects/" + UUID.randomUUID() + "/review/playback").param("mode", "karaoke"))
                .andExpect(status().isBadRequest());
        verify(reviewAssembler, never()).playback(any(), any());
    }

    @Test
    void exportDefaultsToFullMix() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(reviewAssembler.export(projectId, AudioMixMode.FULL))
                .thenReturn(new ExportResponse(projectId, "https://cdn.test/final.mp4", AudioMixMode.FULL, 3));

        mockMvc.perform(post("/v1/projects/" + projectId + "/review/export"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.artifactUrl").value("https://cdn.test/final.mp4"))
                .andExpect(jsonPath("$.clipCount").value(3));
    }

    @Test
    void exportWithNothingCompletedIsConflict() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(reviewAssembler.export(projectId, AudioMixMode.MUTE)).thenThrow(new NothingToExportException("none"));

        mockMvc.perform(post("/v1/projects/" + projectId + "/review/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"audioMixMode\":\"MUTE\"}"))
                .andExpect(status().isConflict());
    }
}
