package com.example.shotforge_backend.engine.Interfaces;

import com.example.shotforge_backend.util.AudioMixMode;

import java.util.List;
import java.util.UUID;

public interface ExportEngine {
    record Request(UUID projectId, List<String> orderedClipUrls, AudioMixMode audioMixMode) {}
    record Result(String artifactUrl) {}

    Result export(Request req) throws Exception;
}
