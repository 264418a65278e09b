package com.example.shotforge_backend.engine;

import com.example.shotforge_backend.config.GenerationProperties;
import com.example.shotforge_backend.engine.Interfaces.ScriptGenerationEngine;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

@Service
public class HttpScriptGenerationEngine implements ScriptGenerationEngine {
    private final GenerationServiceClient client;
    private final GenerationProperties props;

    public HttpScriptGenerationEngine(GenerationServiceClient client, GenerationProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public Result generate(Request req) {
        JsonNode root = client.postBlocking("script", props.getPaths().getScript(), req);
        // some deployments return the script as a bare JSON string
        String raw = root.isTextual() ? root.asText() : GenerationServiceClient.text(root, "rawScript", "script", "content");
        return new Result(raw, "generation-service");
    }
}
