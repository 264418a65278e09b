package com.example.shotforge_backend.util;

import com.example.shotforge_backend.model.Shot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw generator output into an ordered shot list.
 * <p>
 * Accepted input: a JSON document ({@code {"scenes": [...]}}, {@code {"shots": [...]}},
 * {@code {"clips": [...]}} or a bare array, optionally inside a Markdown code fence), or a
 * plain-text screenplay split on {@code SCENE n}, {@code SHOT n}, {@code INT.} and {@code EXT.}
 * headings, or on blank lines when it has none. Text that only looks like JSON (a screenplay
 * opening with {@code [FADE IN]}) is read as a screenplay. Missing fields get defaults; a
 * malformed scene never rejects the whole script.
 */
public final class ScriptParser {

    public static final int DEFAULT_DURATION_SECONDS = 5;
    public static final int MIN_DURATION_SECONDS = 4;
    public static final int MAX_DURATION_SECONDS = 8;
    public static final String DEFAULT_MOOD = "neutral";
    public static final String FALLBACK_DESCRIPTION = "Establishing shot of the scene";

    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);
    private static final Pattern HEADING = Pattern.compile(
            "^\\s*(?:(?:SCENE|SHOT)\\s+\\d+\\b.*|(?:INT|EXT|INT\\./EXT)\\..*)$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern META_LINE = Pattern.compile(
            "^\\s*(MOOD|DURATION|CAMERA|TRANSITION|TITLE)\\s*:\\s*(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIALOGUE_LINE = Pattern.compile(
            "^\\s*(?:DIALOGUE|NARRATION|VO|V\\.O\\.|[A-Z][A-Z .'-]{1,30})\\s*:\\s*(.+)$");
    private static final Pattern QUOTED_LINE = Pattern.compile("^\\s*[\"“](.+)[\"”]\\s*$");
    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    private ScriptParser() {
    }

    record Draft(String title, String description, String dialogue, String mood,
                 String cameraMovement, String transition, Integer durationSeconds) {}

    public static List<Shot> parse(String rawScript, int targetDurationSeconds) {
        return parse(rawScript, targetDurationSeconds, MIN_DURATION_SECONDS, MAX_DURATION_SECONDS);
    }

    /**
     * @param minSeconds lower bound of every shot after rescaling
     * @param maxSeconds upper bound of every shot after rescaling
     * @throws IllegalArgumentException when the script is empty or yields no shot
     */
    public static List<Shot> parse(String rawScript, int targetDurationSeconds, int minSeconds, int maxSeconds) {
        if (rawScript == null || rawScript.isBlank()) {
            throw new IllegalArgumentException("empty script");
        }
        List<Draft> drafts = looksLikeJson(rawScript) ? parseJson(rawScript) : List.of();
        if (drafts.isEmpty()) {
            drafts = parseText(rawScript);
        }
        if (drafts.isEmpty()) {
            throw new IllegalArgumentException("script contains no scenes");
        }
        List<Shot> shots = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            shots.add(toShot(drafts.get(i), i, drafts.size()));
        }
        rescaleDurations(shots, targetDurationSeconds, minSeconds, maxSeconds);
        return shots;
    }

    private static boolean looksLikeJson(String raw) {
        String s = unfence(raw).trim();
        return s.startsWith("{") || s.startsWith("[");
    }

    private static String unfence(String raw) {
        Matcher m = CODE_FENCE.matcher(raw);
        return m.find() ? m.group(1) : raw;
    }

    /**
     * @return the scenes, or an empty list when the text is not JSON or has no scene array
     */
    static List<Draft> parseJson(String raw) {
        JsonNode root;
        try {
            root = MAPPER.readTree(unfence(raw).trim());
        } catch (JsonProcessingException e) {
            LOGGER.debug("Script is not JSON, reading it as a screenplay: {}", e.getOriginalMessage());
            return List.of();
        }
        JsonNode items = root;
        if (root != null && root.isObject()) {
            items = firstArray(root, "scenes", "shots", "clips");
        }
        List<Draft> drafts = new ArrayList<>();
        if (items == null || !items.isArray()) {
            return drafts;
        }
        for (JsonNode item : items) {
            if (item.isTextual() && !item.asText().isBlank()) {
                drafts.add(new Draft(null, item.asText().trim(), null, null, null, null, null));
            } else if (item.isObject()) {
                drafts.add(new Draft(
                        str(item, "title", "heading"),
                        str(item, "visualDescription", "description", "prompt", "action"),
                        str(item, "dialogue", "scriptText", "narration"),
                        str(item, "mood"),
                        str(item, "cameraMovement", "camera"),
                        str(item, "transitionOut", "transition"),
                        duration(item)));
            }
        }
        return drafts;
    }

    static List<Draft> parseText(String raw) {
        List<String> blocks = new ArrayList<>();
        List<String> headings = new ArrayList<>();
        Matcher m = HEADING.matcher(raw);
        if (m.find()) {
            int blockStart = -1;
            String heading = null;
            do {
                if (heading != null) {
                    headings.add(heading);
                    blocks.add(raw.substring(blockStart, m.start()));
                }
                heading = m.group().trim();
                blockStart = m.end();
            } while (m.find());
            headings.add(heading);
            blocks.add(raw.substring(blockStart));
        } else {
            for (String block : raw.split("\\n\\s*\\n")) {
                if (!block.isBlank()) {
                    headings.add(null);
                    blocks.add(block);
                }
            }
        }

        List<Draft> drafts = new ArrayList<>();
        for (int i = 0; i < blocks.size(); i++) {
            Draft d = parseBlock(headings.get(i), blocks.get(i));
            if (d != null) drafts.add(d);
        }
        return drafts;
    }

    private static Draft parseBlock(String heading, String block) {
        String title = heading;
        String mood = null;
        String camera = null;
        String transition = null;
        Integer duration = null;
        StringBuilder description = new StringBuilder();
        StringBuilder dialogue = new StringBuilder();

        for (String line : block.split("\\R")) {
            if (line.isBlank()) continue;
            Matcher meta = META_LINE.matcher(line);
            if (meta.matches()) {
                String key = meta.group(1).toUpperCase(Locale.ROOT);
                String value = meta.group(2).trim();
                switch (key) {
                    case "MOOD" -> mood = value;
                    case "DURATION" -> duration = parseSeconds(value);
                    case "CAMERA" -> camera = value;
                    case "TRANSITION" -> transition = value;
                    default -> title = value;
                }
                continue;
            }
            Matcher spoken = DIALOGUE_LINE.matcher(line);
            Matcher quoted = QUOTED_LINE.matcher(line);
            if (spoken.matches()) {
                appendSentence(dialogue, spoken.group(1));
            } else if (quoted.matches()) {
                appendSentence(dialogue, quoted.group(1));
            } else {
                appendSentence(description, line);
            }
        }
        if (heading == null && description.length() == 0 && dialogue.length() == 0) {
            return null;
        }
        return new Draft(title, blankToNull(description.toString()), blankToNull(dialogue.toString()),
                mood, camera, transition, duration);
    }

    private static Shot toShot(Draft d, int index, int shotCount) {
        Shot shot = new Shot(Shot.idForIndex(index, shotCount), index);
        shot.setTitle(d.title() != null ? d.title() : "Shot " + (index + 1));
        String description = d.description();
        if (description == null) description = d.title();
        if (description == null) description = d.dialogue();
        if (description == null) description = FALLBACK_DESCRIPTION;
        shot.setDescription(description);
        shot.setDialogue(d.dialogue() == null ? "" : d.dialogue());
        shot.setMood(d.mood() == null ? DEFAULT_MOOD : d.mood());
        shot.setCameraMovement(d.cameraMovement() == null ? "steady" : d.cameraMovement());
        shot.setTransitionOut(TransitionType.fromValue(d.transition()));
        shot.setDurationSeconds(d.durationSeconds() == null ? DEFAULT_DURATION_SECONDS : d.durationSeconds());
        return shot;
    }

    /**
     * Scales durations so their sum lands near {@code target}, then clamps every shot into
     * {@code [minSeconds, maxSeconds]}. A non-positive target only clamps.
     */
    static void rescaleDurations(List<Shot> shots, int target, int minSeconds, int maxSeconds) {
        int min = Math.max(1, minSeconds);
        int max = Math.max(min, maxSeconds);
        long total = shots.stream().mapToLong(Shot::getDurationSeconds).sum();
        double factor = target > 0 && total > 0 ? (double) target / total : 1.0;
        for (Shot s : shots) {
            long scaled = Math.round(s.getDurationSeconds() * factor);
            s.setDurationSeconds((int) Math.min(max, Math.max(min, scaled)));
        }
    }

    private static JsonNode firstArray(JsonNode node, String... fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (v != null && v.isArray()) return v;
        }
        return null;
    }

    private static String str(JsonNode node, String... fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (v != null && v.isValueNode() && !v.isNull() && !v.asText().isBlank()) {
                return v.asText().trim();
            }
        }
        return null;
    }

    private static Integer duration(JsonNode item) {
        for (String f : new String[]{"durationSeconds", "duration"}) {
            JsonNode v = item.get(f);
            if (v == null || v.isNull()) continue;
            if (v.isNumber()) return positiveOrNull((int) Math.round(v.asDouble()));
            if (v.isTextual()) return parseSeconds(v.asText());
        }
        return null;
    }

    private static Integer parseSeconds(String value) {
        Matcher m = NUMBER.matcher(value);
        if (!m.find()) return null;
        return positiveOrNull((int) Math.round(Double.parseDouble(m.group(1))));
    }

    private static Integer positiveOrNull(int seconds) {
        return seconds > 0 ? seconds : null;
    }

    private static void appendSentence(StringBuilder sb, String text) {
        if (sb.length() > 0) sb.append(' ');
        sb.append(text.trim());
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
