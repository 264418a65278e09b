package com.example.shotforge_backend.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Softens a video prompt after a content-policy refusal: contact and violence terms become neutral
 * gestures, intense emotions are toned down, adult and drug references are dropped.
 */
public final class ContentFilterRephraser {

    public static final String SAFETY_PREFIX = "Cinematic scene, professional filmmaking style: ";
    static final String NEUTRAL_CONTEXT = "A person in a natural setting, engaging in everyday activities. ";
    static final int MIN_LENGTH = 50;

    private static final Map<Pattern, String> REWRITES = new LinkedHashMap<>();

    static {
        // multi-word phrases first, the single-word rules would split them
        rule("slap contest|slapping contest", "friendly competition");
        rule("face\\s*to\\s*face\\s*(?:off|showdown)", "standing together");
        rule("slap|slapping|slapped|hit|hitting|punch|punching|strike|striking|smack|smacking", "gesture");
        rule("fight|fighting|battle|attack|attacking|kill|murder|blood|violent|weapon|gun|knife|sword|assault|beat|beating", "");
        rule("angry|rage|fury|hatred|aggressive", "determined");
        rule("scared|terrified|horrified|pain|painful", "alert");
        rule("naked|nude|undressed|revealing|provocative", "");
        rule("drunk|intoxicated|smoking|drugs", "");
        rule("confrontation|conflict|struggle|versus|vs", "interaction");
        rule("chase|pursuit", "movement");
    }

    private ContentFilterRephraser() {
    }

    private static void rule(String alternatives, String replacement) {
        REWRITES.put(Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE), replacement);
    }

    public static String rephrase(String prompt) {
        String safer = prompt == null ? "" : prompt;
        if (safer.startsWith(SAFETY_PREFIX)) {
            safer = safer.substring(SAFETY_PREFIX.length());
        }
        for (Map.Entry<Pattern, String> rewrite : REWRITES.entrySet()) {
            safer = rewrite.getKey().matcher(safer).replaceAll(rewrite.getValue());
        }
        safer = safer.replaceAll("\\s+", " ").trim();
        if (safer.length() < MIN_LENGTH) {
            safer = NEUTRAL_CONTEXT + safer;
        }
        return SAFETY_PREFIX + safer.trim();
    }
}
