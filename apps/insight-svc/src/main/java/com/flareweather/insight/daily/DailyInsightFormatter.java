package com.flareweather.insight.daily;

import com.flareweather.insight.model.InsightPayloadParser;
import com.flareweather.insight.model.RawInsightPayload;
import com.flareweather.insight.model.WeatherFactor;
import com.flareweather.insight.policy.DistinctWhyGenerator;
import com.flareweather.insight.policy.FieldResolver;
import com.flareweather.insight.policy.VagueLanguageGuard;
import com.flareweather.insight.text.InsightSanitizer;
import com.flareweather.insight.text.SimilarityEngine;
import com.flareweather.insight.text.WeatherClassifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the daily insight card text: summary, "Why:" line, optional comfort tip and optional
 * sign-off, separated by blank lines.
 */
@Service
public class DailyInsightFormatter {

    private static final Logger log = LoggerFactory.getLogger(DailyInsightFormatter.class);

    static final String DEFAULT_SUMMARY = "Cooler air and steady pressure may make today feel easier on the body.";
    static final String DEFAULT_WHY = "Stable pressure can ease tension in sensitive joints.";
    static final String DEFAULT_MESSAGE = DEFAULT_SUMMARY + "\n\n"
            + "Why: " + DEFAULT_WHY + "\n\n"
            + "Comfort tip: Take short pauses through the day.\n\n"
            + "Move at the pace that feels right.";

    private static final int MAX_TIP_WORDS = 20;
    private static final Pattern WELLNESS_SOURCE = Pattern.compile(
            "\\b(?:chinese medicine|tcm|ayurveda|western medicine|suggests|recommends)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ONLY_PUNCTUATION = Pattern.compile("^[\\p{Punct}\\s]*$");

    private final InsightPayloadParser payloadParser;
    private final VagueLanguageGuard vagueLanguageGuard;
    private final DistinctWhyGenerator distinctWhyGenerator;
    private final SimilarityEngine similarityEngine;
    private final ApprovedPhrases approvedPhrases;

    public DailyInsightFormatter(InsightPayloadParser payloadParser,
                                 VagueLanguageGuard vagueLanguageGuard,
                                 DistinctWhyGenerator distinctWhyGenerator,
                                 SimilarityEngine similarityEngine,
                                 ApprovedPhrases approvedPhrases) {
        this.payloadParser = payloadParser;
        this.vagueLanguageGuard = vagueLanguageGuard;
        this.distinctWhyGenerator = distinctWhyGenerator;
        this.similarityEngine = similarityEngine;
        this.approvedPhrases = approvedPhrases;
    }

    public String format(String raw) {
        return format(raw, null);
    }

    /**
     * @param whyOverride a separately delivered "why" that takes priority over the payload's own
     */
    public String format(String raw, String whyOverride) {
        if (raw == null || raw.isBlank()) {
            log.debug("Daily payload blank, using default message");
            return DEFAULT_MESSAGE;
        }
        RawInsightPayload payload = payloadParser.parse(raw);
        if (payload instanceof RawInsightPayload.Structured structured) {
            log.debug("Formatting structured daily payload");
            return formatStructured(structured, whyOverride);
        }
        log.debug("Formatting legacy daily payload");
        return formatLegacy(((RawInsightPayload.Legacy) payload).text(), whyOverride);
    }

    private String formatStructured(RawInsightPayload.Structured payload, String whyOverride) {
        RawInsightPayload.Structured source = payload.nested("daily_insight").orElse(payload);

        String summary = FieldResolver.resolve(
                source.text("summary_sentence").or(() -> source.text("summary")),
                DEFAULT_SUMMARY, FieldResolver.STANDARD);
        Optional<String> whyRaw = nonBlank(whyOverride)
                .or(() -> source.text("why_line"))
                .or(() -> source.text("why"));
        String why = resolveWhy(summary, FieldResolver.resolve(whyRaw, DEFAULT_WHY, FieldResolver.STANDARD));

        String tip = FieldResolver.resolve(source.text("comfort_tip"), "", FieldResolver.STANDARD);
        if (!tip.isEmpty() && !isAcceptableTip(tip)) {
            log.debug("Comfort tip rejected, substituting an approved tip");
            tip = approvedPhrases.comfortTip();
        }
        String signOff = FieldResolver.resolve(source.text("sign_off"), approvedPhrases.signOff(), FieldResolver.STANDARD);

        return assemble(summary, why, tip, signOff);
    }

    private String formatLegacy(String text, String whyOverride) {
        String cleaned = FieldResolver.resolve(text, "", FieldResolver.STANDARD);
        List<String> sentences = InsightSanitizer.sentences(cleaned);

        String summary = sentences.isEmpty() ? DEFAULT_SUMMARY : sentences.get(0) + ".";
        String legacyWhy = sentences.size() > 1 ? sentences.get(1) + "." : DEFAULT_WHY;
        String why = nonBlank(whyOverride)
                .map(override -> FieldResolver.resolve(override, legacyWhy, FieldResolver.STANDARD))
                .orElse(legacyWhy);

        return assemble(summary, resolveWhy(summary, why), "", approvedPhrases.signOff());
    }

    private String resolveWhy(String summary, String candidate) {
        WeatherFactor factor = WeatherClassifier.classifyWeatherFactor(summary);
        String why = candidate;
        if (vagueLanguageGuard.containsVagueLanguage(why)) {
            log.debug("Why line uses vague language, rewriting for factor {}", factor);
            why = vagueLanguageGuard.rewriteVague(why, factor);
        }
        if (similarityEngine.areSimilar(summary, why)) {
            log.debug("Why line repeats the summary, generating a distinct one");
            why = distinctWhyGenerator.generateDistinctWhy(summary, factor);
            // a rewrite can bring back banned phrasing
            if (vagueLanguageGuard.containsVagueLanguage(why)) {
                why = vagueLanguageGuard.rewriteVague(why, factor);
            }
        }
        if (vagueLanguageGuard.containsVagueLanguage(why) || similarityEngine.areSimilar(summary, why)) {
            why = distinctWhyGenerator.generateDistinctWhy(summary, factor);
        }
        return why;
    }

    private boolean isAcceptableTip(String tip) {
        if (WHITESPACE.split(tip.trim()).length > MAX_TIP_WORDS) {
            return false;
        }
        return !vagueLanguageGuard.containsVagueLanguage(tip)
                || WELLNESS_SOURCE.matcher(tip.toLowerCase(Locale.ROOT)).find();
    }

    private String assemble(String summary, String why, String comfortTip, String signOff) {
        String tip = comfortTip;
        String closing = signOff;

        if (!tip.isEmpty() && similarityEngine.areSimilar(why, tip)) {
            log.debug("Comfort tip repeats the why line, substituting an approved tip");
            tip = approvedPhrases.comfortTip();
            if (similarityEngine.areSimilar(why, tip)) {
                tip = "";
            }
        }
        if (!tip.isEmpty() && closing != null && !closing.isEmpty()) {
            if (similarityEngine.areSimilarIgnoringPunctuation(closing, tip)) {
                closing = null;
            } else if (tip.toLowerCase(Locale.ROOT).contains(closing.toLowerCase(Locale.ROOT))) {
                String stripped = removeIgnoringCase(tip, closing);
                if (ONLY_PUNCTUATION.matcher(stripped).matches()) {
                    // the tip was nothing but the sign-off; keep the tip, drop the repeat
                    closing = null;
                } else {
                    tip = stripped;
                }
            }
        }
        if (closing != null && overlapsSummary(summary, closing)) {
            closing = null;
        }
        // with no tip the sign-off sits directly under the why line
        if (closing != null && tip.isEmpty() && similarityEngine.areSimilarIgnoringPunctuation(why, closing)) {
            closing = null;
        }

        List<String> lines = new ArrayList<>();
        lines.add(summary);
        lines.add("");
        lines.add("Why: " + why);
        if (!tip.isEmpty()) {
            lines.add("");
            lines.add("Comfort tip: " + tip);
        }
        if (closing != null && !closing.isEmpty()) {
            lines.add("");
            lines.add(closing);
        }
        return String.join("\n", lines).trim();
    }

    private static boolean overlapsSummary(String summary, String signOff) {
        String s = summary.toLowerCase(Locale.ROOT).trim();
        String o = signOff.toLowerCase(Locale.ROOT).trim();
        return s.equals(o) || s.contains(o) || o.contains(s);
    }

    private static String removeIgnoringCase(String text, String fragment) {
        String removed = Pattern.compile(Pattern.quote(fragment), Pattern.CASE_INSENSITIVE)
                .matcher(text)
                .replaceAll("");
        return WHITESPACE.matcher(removed).replaceAll(" ").trim();
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
