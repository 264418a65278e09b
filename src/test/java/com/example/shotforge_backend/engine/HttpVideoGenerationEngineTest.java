package com.example.shotforge_backend.engine;

import com.example.shotforge_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.shotforge_backend.exception.ContentFilteredException;
import com.example.shotforge_backend.exception.GenerationException;
import com.example.shotforge_backend.model.QualityTier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpVideoGenerationEngineTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final VideoGenerationEngine.Request request = new VideoGenerationEngine.Request(
            "S03", "Mara walks", "", "https://cdn.test/master.png", 42L, "", 5, QualityTier.STANDARD);

    @Test
    void clipWithoutEndFrameChainsFromTheClip() throws Exception {
        var result = HttpVideoGenerationEngine.toResult(request, mapper.readTree("{\"videoUrl\": \"https://cdn.test/S03.mp4\"}"));

        assertThat(result.endFrameUrl()).isEqualTo("https://cdn.test/S03.mp4");
    }

    @Test
    void contentFilteredStatusCarriesTheReason() throws Exception {
        assertThatThrownBy(() -> HttpVideoGenerationEngine.toResult(request,
                mapper.readTree("{\"status\": \"CONTENT_FILTERED\", \"contentFilterReason\": \"violence\"}")))
                .isInstanceOfSatisfying(ContentFilteredException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("CONTENT_FILTERED");
                    assertThat(e.getFilterReason()).isEqualTo("violence");
                    assertThat(e.getMessage()).contains("S03");
                });
    }

    @Test
    void missingVideoUrlIsAGenerationFailure() throws Exception {
        assertThatThrownBy(() -> HttpVideoGenerationEngine.toResult(request, mapper.readTree("{\"status\": \"done\"}")))
                .isInstanceOf(GenerationException.class);
    }
}
