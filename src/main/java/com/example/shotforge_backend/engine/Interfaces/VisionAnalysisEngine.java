package com.example.shotforge_backend.engine.Interfaces;

import java.util.List;

/**
 * Derives character-bible fields from a reference image. Any field may come back {@code null};
 * callers fill the gaps.
 */
public interface VisionAnalysisEngine {
    record Request(String imageUrl, String subjectName) {}
    record Result(String frontView,
                  String sideView,
                  String backView,
                  String hair,
                  String clothing,
                  List<String> distinguishingFeatures,
                  List<String> negativePrompts) {}

    Result analyze(Request req) throws Exception;
}
