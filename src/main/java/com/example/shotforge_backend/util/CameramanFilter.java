package com.example.shotforge_backend.util;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps production gear out of generated frames: camera-movement jargon is rewritten into
 * perspective language and crew/equipment terms are stripped from prompts. The same terms are
 * sent as negative prompts.
 */
public final class CameramanFilter {

    public static final List<String> NEGATIVE_PROMPTS = List.of(
            "camera",
            "cameraman",
            "camera operator",
            "film crew",
            "camera equipment",
            "tripod",
            "dolly track",
            "boom mic",
            "lighting rig",
            "film set",
            "behind the scenes",
            "production crew",
            "director",
            "clapper board",
            "camera lens visible",
            "crew reflection",
            "equipment shadow",
            "microphone in frame",
            "cables visible",
            "studio lights",
            "green screen edge",
            "film equipment",
            "camera rig",
            "gimbal",
            "steadicam operator");

    private static final Map<String, String> MOVEMENT_REWRITES = new LinkedHashMap<>();

    static {
        MOVEMENT_REWRITES.put("dolly shot", "smooth forward movement through the scene");
        MOVEMENT_REWRITES.put("tracking shot", "following movement alongside subjects");
        MOVEMENT_REWRITES.put("crane shot", "elevated perspective descending or rising");
        MOVEMENT_REWRITES.put("pan", "horizontal rotation revealing the scene");
        MOVEMENT_REWRITES.put("tilt", "vertical rotation showing height");
        MOVEMENT_REWRITES.put("zoom", "focal length shift bringing subjects closer");
        MOVEMENT_REWRITES.put("push in", "gradual forward approach toward subject");
        MOVEMENT_REWRITES.put("pull back", "retreating movement revealing wider scene");
        MOVEMENT_REWRITES.put("handheld", "subtle organic motion with natural feel");
        MOVEMENT_REWRITES.put("steadicam", "fluid movement through space");
        MOVEMENT_REWRITES.put("aerial", "overhead perspective looking down");
        MOVEMENT_REWRITES.put("pov", "first-person perspective through character eyes");
        MOVEMENT_REWRITES.put("dutch angle", "tilted horizon creating tension");
        MOVEMENT_REWRITES.put("establishing shot", "wide view setting the scene location");
        MOVEMENT_REWRITES.put("close-up", "intimate framing focusing on details");
        MOVEMENT_REWRITES.put("medium shot", "standard framing showing subject in context");
        MOVEMENT_REWRITES.put("wide shot", "expansive framing showing environment");
    }

    // longest first so "camera operator" goes before "camera"
    private static final List<Pattern> STRIP_PATTERNS = NEGATIVE_PROMPTS.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(term -> Pattern.compile("\\b" + Pattern.quote(term) + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();

    private CameramanFilter() {
    }

    public static String apply(String prompt) {
        if (prompt == null || prompt.isBlank()) return "";
        String clean = prompt;
        for (Map.Entry<String, String> rewrite : MOVEMENT_REWRITES.entrySet()) {
            Pattern p = Pattern.compile("\\b" + Pattern.quote(rewrite.getKey()) + "\\b", Pattern.CASE_INSENSITIVE);
            clean = p.matcher(clean).replaceAll(Matcher.quoteReplacement(rewrite.getValue()));
        }
        for (Pattern p : STRIP_PATTERNS) {
            clean = p.matcher(clean).replaceAll("");
        }
        return clean.replaceAll("\\s+", " ").replaceAll("\\s+([,.;])", "$1").trim();
    }

    public static String negativePrompt() {
        return String.join(", ", NEGATIVE_PROMPTS);
    }
}
