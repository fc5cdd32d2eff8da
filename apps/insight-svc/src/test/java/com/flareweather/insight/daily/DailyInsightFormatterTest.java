package com.flareweather.insight.daily;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flareweather.insight.config.InsightProperties;
import com.flareweather.insight.model.InsightPayloadParser;
import com.flareweather.insight.model.WeatherFactor;
import com.flareweather.insight.policy.DistinctWhyGenerator;
import com.flareweather.insight.policy.VagueLanguageGuard;
import com.flareweather.insight.text.SimilarityEngine;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DailyInsightFormatterTest {

    SimilarityEngine similarityEngine;
    VagueLanguageGuard guard;
    DailyInsightFormatter formatter;

    @BeforeEach
    void setUp() {
        Random random = new Random(42L);
        similarityEngine = new SimilarityEngine(InsightProperties.defaults());
        guard = new VagueLanguageGuard(random);
        formatter = new DailyInsightFormatter(
                new InsightPayloadParser(new ObjectMapper()),
                guard,
                new DistinctWhyGenerator(guard, similarityEngine),
                similarityEngine,
                new ApprovedPhrases(random));
    }

    @Test
    void blankPayloadReturnsDefaultMessage() {
        String expected = """
                Cooler air and steady pressure may make today feel easier on the body.

                Why: Stable pressure can ease tension in sensitive joints.

                Comfort tip: Take short pauses through the day.

                Move at the pace that feels right.""";

        assertThat(formatter.format("")).isEqualTo(expected);
        assertThat(formatter.format(null)).isEqualTo(expected);
        assertThat(formatter.format("   \n")).isEqualTo(expected);
    }

    @Test
    void repeatedWhyAndSignOffAreDeduplicated() {
        String raw = """
                {"summary": "Pressure drops today.", "why": "Pressure drops today.",
                 "comfort_tip": "Rest when needed.", "sign_off": "Rest when needed."}""";

        assertThat(formatter.format(raw)).isEqualTo(
                "Pressure drops today.\n\nWhy: Pressure drops can make the body feel heavy or slow.\n\nComfort tip: Rest when needed.");
    }

    @Test
    void nestedDailyInsightShapeIsRead() {
        String raw = """
                {"daily_insight": {
                  "summary_sentence": "Steady pressure today.",
                  "why_line": "Rapid pressure changes can make muscles feel stiff or tense.",
                  "comfort_tip": "Ayurveda suggests warm oil massage to support joint mobility.",
                  "sign_off": "Take things one moment at a time."}}""";

        assertThat(formatter.format(raw)).isEqualTo("""
                Steady pressure today.

                Why: Rapid pressure changes can make muscles feel stiff or tense.

                Comfort tip: Ayurveda suggests warm oil massage to support joint mobility.

                Take things one moment at a time.""");
    }

    @Test
    void vagueWhyIsRewrittenForItsFactor() {
        String raw = """
                {"summary": "Humid afternoon ahead.", "why": "The humidity feels heavy today."}""";

        String why = whyLine(formatter.format(raw));

        assertThat(guard.catalog(WeatherFactor.HUMIDITY)).contains(why);
        assertThat(guard.containsVagueLanguage(why)).isFalse();
    }

    @Test
    void whyOverrideWinsOverPayload() {
        String raw = """
                {"summary": "Cooler evening ahead.", "why": "Heat can drain energy and make the body feel sluggish."}""";

        String why = whyLine(formatter.format(raw, "Cool air can stiffen muscles and increase sensitivity."));

        assertThat(why).isEqualTo("Cool air can stiffen muscles and increase sensitivity.");
    }

    @Test
    void appNudgeInSummaryFallsBackToDefaultSummary() {
        String raw = """
                {"summary": "Take one minute to jot how you feel in the app.",
                 "why": "Heat can drain energy and make the body feel sluggish."}""";

        assertThat(formatter.format(raw)).startsWith(DailyInsightFormatter.DEFAULT_SUMMARY + "\n\nWhy: Heat can drain");
    }

    @Test
    void missingFieldsDegradeToDefaults() {
        String message = formatter.format("{\"unrelated\": 3}");

        assertThat(message).startsWith(DailyInsightFormatter.DEFAULT_SUMMARY
                + "\n\nWhy: " + DailyInsightFormatter.DEFAULT_WHY);
        assertThat(message).doesNotContain("Comfort tip:");
        assertThat(ApprovedPhrases.SIGN_OFFS).contains(lastLine(message));
    }

    @Test
    void overlongComfortTipIsReplacedWithApprovedTip() {
        String raw = """
                {"summary": "Cooler air tonight.", "why": "Cool air can stiffen muscles and increase sensitivity.",
                 "comfort_tip": "Before bed take a warm shower then stretch your calves and your shoulders and your back and then rest for a while longer."}""";

        assertThat(ApprovedPhrases.COMFORT_TIPS).contains(tipLine(formatter.format(raw)));
    }

    @Test
    void vagueComfortTipNeedsWellnessSource() {
        String vague = """
                {"summary": "Cooler air tonight.", "why": "Cool air can stiffen muscles and increase sensitivity.",
                 "comfort_tip": "A gentle walk might help."}""";
        String sourced = """
                {"summary": "Cooler air tonight.", "why": "Cool air can stiffen muscles and increase sensitivity.",
                 "comfort_tip": "Chinese medicine suggests gentle qigong."}""";

        assertThat(ApprovedPhrases.COMFORT_TIPS).contains(tipLine(formatter.format(vague)));
        assertThat(tipLine(formatter.format(sourced))).isEqualTo("Chinese medicine suggests gentle qigong.");
    }

    @Test
    void signOffEmbeddedInTipIsStrippedFromTip() {
        String raw = """
                {"summary": "Cooler air tonight.", "why": "Cool air can stiffen muscles and increase sensitivity.",
                 "comfort_tip": "Stretch slowly and keep warm layers close by. Move at the pace that feels right.",
                 "sign_off": "Move at the pace that feels right."}""";

        String message = formatter.format(raw);

        assertThat(tipLine(message)).isEqualTo("Stretch slowly and keep warm layers close by.");
        assertThat(lastLine(message)).isEqualTo("Move at the pace that feels right.");
    }

    @Test
    void comfortTipRepeatingWhyIsReplacedWithApprovedTip() {
        String raw = """
                {"summary": "Pressure drops today.", "why": "Stretch slowly and keep warm layers close by.",
                 "comfort_tip": "Stretch slowly and keep warm layers close by."}""";

        String message = formatter.format(raw);

        assertThat(whyLine(message)).isEqualTo("Stretch slowly and keep warm layers close by.");
        assertThat(ApprovedPhrases.COMFORT_TIPS).contains(tipLine(message));
        assertThat(similarityEngine.areSimilar(whyLine(message), tipLine(message))).isFalse();
    }

    @Test
    void signOffRepeatingWhyIsOmittedWhenNoTip() {
        String raw = """
                {"summary": "Cooler air tonight.", "why": "Cool air can stiffen muscles and increase sensitivity.",
                 "sign_off": "Cool air can stiffen muscles and increase sensitivity!"}""";

        assertThat(formatter.format(raw)).isEqualTo(
                "Cooler air tonight.\n\nWhy: Cool air can stiffen muscles and increase sensitivity.");
    }

    @Test
    void signOffMatchingSummaryIsOmitted() {
        String raw = """
                {"summary": "Take things one moment at a time.",
                 "why": "Pressure drops can make the body feel heavy or slow.",
                 "sign_off": "Take things one moment at a time."}""";

        assertThat(formatter.format(raw)).isEqualTo(
                "Take things one moment at a time.\n\nWhy: Pressure drops can make the body feel heavy or slow.");
    }

    @Test
    void legacyTextIsSplitIntoSummaryAndWhy() {
        String message = formatter.format(
                "Cooler air moves in today. Cool air can stiffen muscles and increase sensitivity. Extra line.");

        assertThat(message).startsWith(
                "Cooler air moves in today.\n\nWhy: Cool air can stiffen muscles and increase sensitivity.\n\n");
        assertThat(message).doesNotContain("Comfort tip:");
        assertThat(ApprovedPhrases.SIGN_OFFS).contains(lastLine(message));
    }

    @Test
    void legacyTextWithSingleSentenceUsesDefaultWhy() {
        assertThat(whyLine(formatter.format("Cooler air moves in today"))).isEqualTo(DailyInsightFormatter.DEFAULT_WHY);
    }

    @Test
    void emittedWhyIsNeverVagueOrSimilarToSummary() {
        List<String> payloads = List.of(
                "{\"summary\": \"Pressure feels different today.\", \"why\": \"Pressure feels different today.\"}",
                "{\"summary\": \"Humidity rises.\", \"why\": \"The air feels heavy and might help nothing.\"}",
                "{\"summary\": \"Stable pressure can ease tension in sensitive joints.\"}",
                "{\"summary\": \"Wind picks up.\", \"why\": \"Wind picks up.\"}",
                "Heat builds. Weather feels moody.",
                "{\"summary\": \"Cooler air ahead.\", \"why\": \"Conditions feel gentle and a bit unusual.\"}");

        for (String payload : payloads) {
            String message = formatter.format(payload);
            String summary = message.lines().findFirst().orElseThrow();
            String why = whyLine(message);
            assertThat(guard.containsVagueLanguage(why)).as(payload).isFalse();
            assertThat(similarityEngine.areSimilar(summary, why)).as(payload).isFalse();
        }
    }

    private static String whyLine(String message) {
        return lineWithPrefix(message, "Why: ");
    }

    private static String tipLine(String message) {
        return lineWithPrefix(message, "Comfort tip: ");
    }

    private static String lineWithPrefix(String message, String prefix) {
        return message.lines()
                .filter(line -> line.startsWith(prefix))
                .map(line -> line.substring(prefix.length()))
                .findFirst()
                .orElseThrow();
    }

    private static String lastLine(String message) {
        List<String> lines = Arrays.asList(message.split("\n"));
        return lines.get(lines.size() - 1);
    }
}
