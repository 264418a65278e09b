package com.example.shotforge_backend.engine;

import com.example.shotforge_backend.config.GenerationProperties;
import com.example.shotforge_backend.engine.Interfaces.ExportEngine;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class HttpExportEngine implements ExportEngine {
    private final GenerationServiceClient client;
    private final GenerationProperties props;

    public HttpExportEngine(GenerationServiceClient client, GenerationProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public Result export(Request req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("projectId", req.projectId());
        body.put("orderedClipUrls", req.orderedClipUrls());
        body.put("audioMixMode", req.audioMixMode().getCode());
        body.put("dialogueVolume", req.audioMixMode().getDialogueVolume());
        body.put("musicVolume", req.audioMixMode().getMusicVolume());
        JsonNode root = client.postBlocking("export", props.getPaths().getExport(), body);
        String url = GenerationServiceClient.text(root, "artifactUrl", "url");
        if (url == null) {
            throw new GenerationServiceException("export", 0, "response without artifactUrl");
        }
        return new Result(url);
    }
}
