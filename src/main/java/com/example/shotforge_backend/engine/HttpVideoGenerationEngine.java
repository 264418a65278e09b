package com.example.shotforge_backend.engine;

import com.example.shotforge_backend.config.GenerationProperties;
import com.example.shotforge_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.shotforge_backend.exception.ContentFilteredException;
import com.example.shotforge_backend.exception.GenerationException;
import com.example.shotforge_backend.util.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static com.example.shotforge_backend.engine.GenerationServiceClient.text;

@Service
public class HttpVideoGenerationEngine implements VideoGenerationEngine {
    static final String CONTENT_FILTERED = "CONTENT_FILTERED";

    private final GenerationServiceClient client;
    private final GenerationProperties props;

    public HttpVideoGenerationEngine(GenerationServiceClient client, GenerationProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public CompletableFuture<Result> generate(Request req, CancellationToken token) {
        return client.postAsync("video", props.getPaths().getVideo(), req,
                        Duration.ofSeconds(props.getVideoTimeoutSeconds()), token)
                .thenApply(root -> toResult(req, root));
    }

    static Result toResult(Request req, JsonNode root) {
        if (CONTENT_FILTERED.equalsIgnoreCase(text(root, "status"))) {
            throw new ContentFilteredException(req.shotId(), text(root, "contentFilterReason", "reason"));
        }
        String videoUrl = text(root, "videoUrl");
        if (videoUrl == null) {
            throw new GenerationException("video response without videoUrl shotId=" + req.shotId());
        }
        // without a dedicated end frame the clip itself is the chaining reference
        String endFrame = text(root, "endFrameUrl", "lastFrameUrl");
        return new Result(videoUrl, endFrame == null ? videoUrl : endFrame);
    }
}
