package com.example.shotforge_backend.util;

import com.example.shotforge_backend.model.Shot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptParserTest {

    @Test
    void parsesFencedJsonWithFieldAliasesAndDefaults() {
        String raw = """
                Here is your script:
                ```json
                {"scenes": [
                  {"title": "Open", "visualDescription": "Rain on neon signs", "duration": "6s", "transition": "match-cut"},
                  {"description": "Close on Mara", "dialogue": "Found it", "durationSeconds": 4, "camera": "push in"},
                  "Wide of the market",
                  {"mood": "calm"}
                ]}
                ```
                """;

        List<Shot> shots = ScriptParser.parse(raw, 0);

        assertThat(shots).extracting(Shot::getId).containsExactly("S01", "S02", "S03", "S04");
        assertThat(shots).extracting(Shot::getIndex).containsExactly(0, 1, 2, 3);
        assertThat(shots).extracting(Shot::getDurationSeconds).containsExactly(6, 4, 5, 5);
        assertThat(shots.get(0).getTransitionOut()).isEqualTo(TransitionType.MATCH_CUT);
        assertThat(shots.get(1).getDialogue()).isEqualTo("Found it");
        assertThat(shots.get(1).getCameraMovement()).isEqualTo("push in");
        assertThat(shots.get(2).getDescription()).isEqualTo("Wide of the market");
        assertThat(shots.get(3).getTitle()).isEqualTo("Shot 4");
        assertThat(shots.get(3).getDescription()).isEqualTo(ScriptParser.FALLBACK_DESCRIPTION);
        assertThat(shots.get(3).getMood()).isEqualTo("calm");
        assertThat(shots).allMatch(s -> s.getStatus() == ShotStatus.PENDING && s.getRetryCount() == 0);
    }

    @Test
    void parsesScreenplayHeadingsMetaAndDialogue() {
        String raw = """
                SCENE 1
                TITLE: Arrival
                Mara walks into the night market.
                MOOD: tense
                DURATION: 4s
                MARA: Where is it?

                SCENE 2
                Lanterns sway above the stalls.
                "Keep moving."
                CAMERA: slow pan
                TRANSITION: dissolve
                """;

        List<Shot> shots = ScriptParser.parse(raw, 0);

        assertThat(shots).hasSize(2);
        Shot first = shots.get(0);
        assertThat(first.getTitle()).isEqualTo("Arrival");
        assertThat(first.getDescription()).isEqualTo("Mara walks into the night market.");
        assertThat(first.getDialogue()).isEqualTo("Where is it?");
        assertThat(first.getMood()).isEqualTo("tense");
        assertThat(first.getDurationSeconds()).isEqualTo(4);

        Shot second = shots.get(1);
        assertThat(second.getTitle()).isEqualTo("SCENE 2");
        assertThat(second.getDialogue()).isEqualTo("Keep moving.");
        assertThat(second.getCameraMovement()).isEqualTo("slow pan");
        assertThat(second.getTransitionOut()).isEqualTo(TransitionType.DISSOLVE);
        assertThat(second.getMood()).isEqualTo(ScriptParser.DEFAULT_MOOD);
        assertThat(second.getDurationSeconds()).isEqualTo(ScriptParser.DEFAULT_DURATION_SECONDS);
    }

    @Test
    void splitsOnBlankLinesWithoutHeadings() {
        List<Shot> shots = ScriptParser.parse("A quiet street at dawn.\n\nA door opens.\n\n\nFootsteps echo.", 0);

        assertThat(shots).extracting(Shot::getDescription)
                .containsExactly("A quiet street at dawn.", "A door opens.", "Footsteps echo.");
        assertThat(shots).extracting(Shot::getId).containsExactly("S01", "S02", "S03");
    }

    @Test
    void rescalesDurationsTowardTarget() {
        List<Shot> shots = ScriptParser.parse("[\"one\", \"two\", \"three\"]", 18);

        assertThat(shots).extracting(Shot::getDurationSeconds).containsExactly(6, 6, 6);
    }

    @Test
    void clampsEveryShotIntoDurationBounds() {
        List<Shot> single = ScriptParser.parse("[\"The whole story in one take\"]", 120);
        List<Shot> huge = ScriptParser.parse(
                "[{\"description\":\"a\",\"duration\":2000000000},{\"description\":\"b\",\"duration\":2000000000}]", 10);
        List<Shot> custom = ScriptParser.parse(
                "[{\"description\":\"a\",\"duration\":1},{\"description\":\"b\",\"duration\":20}]", 0, 2, 12);

        assertThat(single).extracting(Shot::getDurationSeconds).containsExactly(ScriptParser.MAX_DURATION_SECONDS);
        assertThat(huge).extracting(Shot::getDurationSeconds).containsExactly(5, 5);
        assertThat(custom).extracting(Shot::getDurationSeconds).containsExactly(2, 12);
    }

    @Test
    void screenplayOpeningWithBracketIsNotTreatedAsJson() {
        String raw = "[FADE IN]\n\nA chef walks through the night market.\n\nShe stops at a noodle stall.";

        List<Shot> shots = ScriptParser.parse(raw, 10);

        assertThat(shots).extracting(Shot::getDescription)
                .containsExactly("[FADE IN]", "A chef walks through the night market.", "She stops at a noodle stall.");
        assertThat(shots).allMatch(s -> s.getDurationSeconds() >= ScriptParser.MIN_DURATION_SECONDS
                && s.getDurationSeconds() <= ScriptParser.MAX_DURATION_SECONDS);
    }

    @Test
    void jsonWithoutSceneArrayIsReadAsText() {
        List<Shot> shots = ScriptParser.parse("{\"note\": \"draft\"}\n\nMara opens the door.", 0);

        assertThat(shots).extracting(Shot::getDescription)
                .containsExactly("{\"note\": \"draft\"}", "Mara opens the door.");
    }

    @Test
    void idsSortInIndexOrderPastNinetyNineShots() {
        StringBuilder raw = new StringBuilder();
        for (int i = 1; i <= 120; i++) {
            raw.append("Beat ").append(i).append(".\n\n");
        }

        List<Shot> shots = ScriptParser.parse(raw.toString(), 0);

        assertThat(shots).hasSize(120);
        assertThat(shots.get(0).getId()).isEqualTo("S001");
        assertThat(shots.get(119).getId()).isEqualTo("S120");
        assertThat(shots).extracting(Shot::getId).isSorted();
    }

    @Test
    void rejectsEmptyScripts() {
        assertThatThrownBy(() -> ScriptParser.parse("   ", 30)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScriptParser.parse(null, 30)).isInstanceOf(IllegalArgumentException.class);
    }
}
