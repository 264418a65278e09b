package com.example.shotforge_backend.engine;

import com.example.shotforge_backend.config.GenerationProperties;
import com.example.shotforge_backend.engine.Interfaces.CinematicAuditEngine;
import com.example.shotforge_backend.model.AuditSuggestion;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.example.shotforge_backend.engine.GenerationServiceClient.stringList;
import static com.example.shotforge_backend.engine.GenerationServiceClient.text;

@Service
public class HttpCinematicAuditEngine implements CinematicAuditEngine {
    private final GenerationServiceClient client;
    private final GenerationProperties props;

    public HttpCinematicAuditEngine(GenerationServiceClient client, GenerationProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public Result critique(Request req) {
        JsonNode root = client.postBlocking("audit", props.getPaths().getAudit(), req);
        JsonNode score = root.get("score");
        if (score == null || !score.isNumber()) {
            throw new GenerationServiceException("audit", 0, "response without numeric score");
        }
        List<AuditSuggestion> suggestions = new ArrayList<>();
        JsonNode items = root.get("perShotSuggestions");
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                String shotId = text(item, "shotId");
                if (shotId == null) continue;
                suggestions.add(new AuditSuggestion(
                        shotId,
                        text(item, "severity"),
                        text(item, "category"),
                        text(item, "suggestion"),
                        text(item, "rewrittenDescription"),
                        text(item, "rewrittenDialogue")));
            }
        }
        return new Result(score.asDouble(), suggestions, stringList(root, "correctivePrompts"));
    }
}
