package com.example.shotforge_backend.engine;

import com.example.shotforge_backend.engine.Interfaces.VisualDebuggerEngine;
import com.example.shotforge_backend.exception.GenerationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpVisualDebuggerEngineTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final VisualDebuggerEngine.Request request = new VisualDebuggerEngine.Request(
            "S01", "https://cdn.test/S01.mp4", "https://cdn.test/S01-end.png", "Mara walks", "", List.of());

    @Test
    void explicitVerdictWins() throws Exception {
        var result = HttpVisualDebuggerEngine.toResult(request,
                mapper.readTree("{\"score\": 95, \"passed\": false, \"correctivePrompt\": \"fix the hands\", \"issues\": [\"six fingers\"]}"));

        assertThat(result.passed()).isFalse();
        assertThat(result.correctivePrompt()).isEqualTo("fix the hands");
        assertThat(result.issues()).containsExactly("six fingers");
    }

    @Test
    void scoreDecidesWhenVerdictMissing() throws Exception {
        assertThat(HttpVisualDebuggerEngine.toResult(request, mapper.readTree("{\"score\": 70}")).passed()).isTrue();
        assertThat(HttpVisualDebuggerEngine.toResult(request, mapper.readTree("{\"score\": 69.5}")).passed()).isFalse();
    }

    @Test
    void missingScoreIsAGenerationFailure() throws Exception {
        assertThatThrownBy(() -> HttpVisualDebuggerEngine.toResult(request, mapper.readTree("{\"passed\": true}")))
                .isInstanceOf(GenerationException.class);
    }
}
