package com.example.shotforge_backend.engine;

import com.example.shotforge_backend.config.GenerationProperties;
import com.example.shotforge_backend.engine.Interfaces.VisionAnalysisEngine;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import static com.example.shotforge_backend.engine.GenerationServiceClient.stringList;
import static com.example.shotforge_backend.engine.GenerationServiceClient.text;

@Service
public class HttpVisionAnalysisEngine implements VisionAnalysisEngine {
    private final GenerationServiceClient client;
    private final GenerationProperties props;

    public HttpVisionAnalysisEngine(GenerationServiceClient client, GenerationProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public Result analyze(Request req) {
        JsonNode root = client.postBlocking("vision", props.getPaths().getVision(), req);
        JsonNode bible = root.has("characterBible") ? root.get("characterBible") : root;
        return new Result(
                text(bible, "frontView", "front_view"),
                text(bible, "sideView", "side_view"),
                text(bible, "backView", "back_view"),
                text(bible, "hair", "hairDescription"),
                text(bible, "clothing", "clothingDescription"),
                stringList(bible, "distinguishingFeatures", "distinguishing_features"),
                stringList(bible, "negativePrompts", "negative_prompts"));
    }
}
