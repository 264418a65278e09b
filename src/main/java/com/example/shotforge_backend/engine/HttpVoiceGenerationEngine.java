package com.example.shotforge_backend.engine;

import com.example.shotforge_backend.config.GenerationProperties;
import com.example.shotforge_backend.engine.Interfaces.VoiceGenerationEngine;
import com.example.shotforge_backend.exception.GenerationException;
import com.example.shotforge_backend.util.CancellationToken;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static com.example.shotforge_backend.engine.GenerationServiceClient.text;

@Service
public class HttpVoiceGenerationEngine implements VoiceGenerationEngine {
    private final GenerationServiceClient client;
    private final GenerationProperties props;

    public HttpVoiceGenerationEngine(GenerationServiceClient client, GenerationProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public CompletableFuture<Result> synthesize(Request req, CancellationToken token) {
        return client.postAsync("voice", props.getPaths().getVoice(), req,
                        Duration.ofSeconds(props.getTimeoutSeconds()), token)
                .thenApply(root -> {
                    String audioUrl = text(root, "audioUrl");
                    if (audioUrl == null) {
                        throw new GenerationException("voice response without audioUrl shotId=" + req.shotId());
                    }
                    return new Result(audioUrl);
                });
    }
}
