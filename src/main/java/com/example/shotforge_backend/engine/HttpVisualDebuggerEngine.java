package com.example.shotforge_backend.engine;

import com.example.shotforge_backend.config.GenerationProperties;
import com.example.shotforge_backend.engine.Interfaces.VisualDebuggerEngine;
import com.example.shotforge_backend.exception.GenerationException;
import com.example.shotforge_backend.util.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static com.example.shotforge_backend.engine.GenerationServiceClient.stringList;
import static com.example.shotforge_backend.engine.GenerationServiceClient.text;

@Service
public class HttpVisualDebuggerEngine implements VisualDebuggerEngine {
    /** Used when the debugger reports a score but no verdict. */
    static final double DEFAULT_PASS_SCORE = 70.0;

    private final GenerationServiceClient client;
    private final GenerationProperties props;

    public HttpVisualDebuggerEngine(GenerationServiceClient client, GenerationProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public CompletableFuture<Result> evaluate(Request req, CancellationToken token) {
        return client.postAsync("visual-debugger", props.getPaths().getVisualDebugger(), req,
                        Duration.ofSeconds(props.getTimeoutSeconds()), token)
                .thenApply(root -> toResult(req, root));
    }

    static Result toResult(Request req, JsonNode root) {
        JsonNode score = root.get("score");
        if (score == null || !score.isNumber()) {
            throw new GenerationException("debugger response without score shotId=" + req.shotId());
        }
        JsonNode passed = root.get("passed");
        boolean verdict = passed != null && passed.isBoolean()
                ? passed.asBoolean()
                : score.asDouble() >= DEFAULT_PASS_SCORE;
        return new Result(score.asDouble(), verdict, text(root, "correctivePrompt"), stringList(root, "issues"));
    }
}
