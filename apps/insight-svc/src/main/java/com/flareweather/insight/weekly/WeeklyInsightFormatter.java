package com.flareweather.insight.weekly;

import com.flareweather.insight.model.FormattedWeeklyInsight;
import com.flareweather.insight.model.InsightPayloadParser;
import com.flareweather.insight.model.RawInsightPayload;
import com.flareweather.insight.model.WeekdayEntry;
import com.flareweather.insight.policy.AppReferenceFilter;
import com.flareweather.insight.policy.FieldResolver;
import com.flareweather.insight.policy.TemplateRepair;
import com.flareweather.insight.text.InsightSanitizer;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the weekly outlook: a one-sentence summary and exactly seven day entries starting the day
 * after the reference date, whatever shape the upstream payload takes.
 */
@Service
public class WeeklyInsightFormatter {

    private static final Logger log = LoggerFactory.getLogger(WeeklyInsightFormatter.class);

    static final String DEFAULT_SUMMARY = "A mostly steady week ahead with consistent conditions.";

    private static final List<String> BODY_FEEL_ROTATION = List.of(
            "generally low flare risk",
            "often easier on the body",
            "typically low sensitivity",
            "generally low sensitivity",
            "often low flare risk",
            "typically easier on the body",
            "generally easier on the body"
    );

    // used for days the paragraph never mentions
    private static final List<String> PATTERN_ROTATION = List.of(
            "cooler air",
            "steady conditions",
            "stable air",
            "steady conditions",
            "warming trend",
            "steady conditions",
            "calm pattern"
    );

    private static final List<String> DEFAULT_DESCRIPTIONS = List.of(
            "Steady conditions — generally low flare risk",
            "Stable air — typically easier on the body",
            "Calm pattern — often low flare risk",
            "Cooler air — generally low sensitivity",
            "Rising humidity — may increase sensitivity",
            "Steady conditions — typically easier on the body",
            "Stable pattern — generally low flare risk"
    );

    private static final int CONTEXT_BEFORE = 50;
    private static final int CONTEXT_AFTER = 100;
    private static final String STEADY_CONDITIONS = "steady conditions";

    private static final Pattern CITATION_IN_PARENS = Pattern.compile("(?i)\\(\\s*sources?\\s*:[^)]*\\)");
    private static final Pattern TRAILING_CITATION = Pattern.compile("(?i)\\s*\\bsources?\\s*:.*$");
    private static final Pattern EM_DASH = Pattern.compile("\\s*[—–]\\s*");
    private static final Pattern NON_LETTER = Pattern.compile("[^\\p{L}]");

    private static final FieldResolver.Stage REMOVE_CITATIONS = value -> Optional.of(removeCitations(value));

    private final InsightPayloadParser payloadParser;
    private final DayDetailFormatter dayDetailFormatter;
    private final Clock clock;
    private final List<FieldResolver.Stage> summaryStages;

    public WeeklyInsightFormatter(InsightPayloadParser payloadParser,
                                  TemplateRepair templateRepair,
                                  DayDetailFormatter dayDetailFormatter,
                                  Clock clock) {
        this.payloadParser = payloadParser;
        this.dayDetailFormatter = dayDetailFormatter;
        this.clock = clock;
        // sanitize before repair so its length cutoff sees the text that will be shown
        this.summaryStages = List.of(
                FieldResolver.SANITIZE,
                FieldResolver.FILTER_APP_REFERENCES,
                REMOVE_CITATIONS,
                value -> Optional.of(templateRepair.repair(value)),
                FieldResolver.SANITIZE,
                FieldResolver.NON_BLANK);
    }

    public FormattedWeeklyInsight format(String raw) {
        return format(raw, LocalDate.now(clock));
    }

    public FormattedWeeklyInsight format(String raw, LocalDate referenceDate) {
        List<DayOfWeek> days = upcomingDays(referenceDate);
        if (raw == null || raw.isBlank()) {
            log.debug("Weekly payload blank, using default outlook");
            return build(DEFAULT_SUMMARY, days, List.of(), null);
        }

        RawInsightPayload payload = payloadParser.parse(raw);
        WeeklyPayloadShape shape = WeeklyPayloadShape.of(payload);
        log.debug("Formatting weekly payload as {}", shape);

        return switch (shape) {
            case STRUCTURED_LIST, STRUCTURED_MAP -> formatStructured((RawInsightPayload.Structured) payload, shape, days);
            case LEGACY_MULTI_LINE -> formatMultiLine(((RawInsightPayload.Legacy) payload).text(), days);
            case LEGACY_SINGLE_PARAGRAPH -> formatParagraph(((RawInsightPayload.Legacy) payload).text(), days);
        };
    }

    /**
     * The seven days following {@code referenceDate}.
     */
    public static List<DayOfWeek> upcomingDays(LocalDate referenceDate) {
        List<DayOfWeek> days = new ArrayList<>(FormattedWeeklyInsight.DAY_COUNT);
        for (int offset = 1; offset <= FormattedWeeklyInsight.DAY_COUNT; offset++) {
            days.add(referenceDate.plusDays(offset).getDayOfWeek());
        }
        return days;
    }

    private FormattedWeeklyInsight formatStructured(RawInsightPayload.Structured payload,
                                                    WeeklyPayloadShape shape,
                                                    List<DayOfWeek> days) {
        String summary = FieldResolver.resolve(
                payload.text("weekly_summary").or(() -> payload.text("summary")),
                DEFAULT_SUMMARY, summaryStages);

        List<String> details = new ArrayList<>();
        if (shape == WeeklyPayloadShape.STRUCTURED_MAP) {
            Map<?, ?> breakdown = (Map<?, ?>) payload.fields().get("daily_breakdown");
            for (DayOfWeek day : days) {
                details.add(detailFor(lookupDay(breakdown, day)));
            }
        } else {
            List<?> breakdown = payload.list("daily_breakdown").orElse(List.of());
            if (breakdown.size() > FormattedWeeklyInsight.DAY_COUNT) {
                log.debug("Weekly breakdown has {} entries, keeping the first {}", breakdown.size(), FormattedWeeklyInsight.DAY_COUNT);
            }
            for (int i = 0; i < Math.min(breakdown.size(), FormattedWeeklyInsight.DAY_COUNT); i++) {
                details.add(detailFor(entryText(breakdown.get(i))));
            }
        }

        String preparationTip = FieldResolver.resolve(payload.text("preparation_tip"), null, FieldResolver.STANDARD);
        return build(summary, days, details, preparationTip);
    }

    private FormattedWeeklyInsight formatMultiLine(String text, List<DayOfWeek> days) {
        List<String> lines = text.trim().lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();

        String summary = FieldResolver.resolve(lines.get(0), DEFAULT_SUMMARY, summaryStages);

        List<String> details = new ArrayList<>();
        for (String line : lines.subList(1, lines.size())) {
            if (details.size() == FormattedWeeklyInsight.DAY_COUNT) {
                break;
            }
            String[] parts = EM_DASH.split(line, 2);
            details.add(detailFor(parts.length == 2 ? parts[1] : line));
        }
        return build(summary, days, details, null);
    }

    private FormattedWeeklyInsight formatParagraph(String text, List<DayOfWeek> days) {
        String cleaned = FieldResolver.resolve(text, "", List.of(
                FieldResolver.SANITIZE, FieldResolver.FILTER_APP_REFERENCES, REMOVE_CITATIONS));
        List<String> sentences = InsightSanitizer.sentences(cleaned);
        String summary = sentences.isEmpty()
                ? DEFAULT_SUMMARY
                : FieldResolver.resolve(sentences.get(0), DEFAULT_SUMMARY, summaryStages);
        String remaining = sentences.size() > 1
                ? String.join(". ", sentences.subList(1, sentences.size())).toLowerCase(Locale.ROOT)
                : "";

        List<String> details = new ArrayList<>();
        for (int index = 0; index < days.size(); index++) {
            String description;
            if (remaining.isEmpty()) {
                description = DEFAULT_DESCRIPTIONS.get(index);
            } else {
                String pattern = minePattern(remaining, days.get(index)).orElse(PATTERN_ROTATION.get(index));
                String bodyFeel = BODY_FEEL_ROTATION.get(index);
                description = capitalize(pattern) + " — " + bodyFeel;
            }
            details.add(dayDetailFormatter.formatDayDetail(description));
        }
        return build(summary, days, details, null);
    }

    /**
     * Looks around the first mention of the day for a recognisable weather pattern.
     */
    private static Optional<String> minePattern(String text, DayOfWeek day) {
        String full = day.getDisplayName(TextStyle.FULL, Locale.US).toLowerCase(Locale.ROOT);
        String abbreviation = day.getDisplayName(TextStyle.SHORT, Locale.US).toLowerCase(Locale.ROOT);
        Matcher mention = Pattern.compile("\\b(?:" + full + "|" + abbreviation + ")\\b").matcher(text);
        if (!mention.find()) {
            return Optional.empty();
        }
        String context = text.substring(
                Math.max(0, mention.start() - CONTEXT_BEFORE),
                Math.min(text.length(), mention.end() + CONTEXT_AFTER));

        if (context.contains("cool")) {
            return Optional.of("cooler air");
        } else if (context.contains("warm")) {
            return Optional.of("warming trend");
        } else if (context.contains("humid")) {
            return Optional.of("rising humidity");
        } else if (context.contains("pressure") || context.contains("shift")) {
            return Optional.of("quick pressure dip");
        } else if (context.contains("calm") || context.contains("stable")) {
            return Optional.of(STEADY_CONDITIONS);
        } else if (context.contains("cloud")) {
            return Optional.of("cloudy stretch");
        } else if (context.contains("clear")) {
            return Optional.of("clear skies");
        }
        return Optional.of(STEADY_CONDITIONS);
    }

    private String detailFor(String text) {
        if (text == null) {
            return DayDetailFormatter.LOW_FLARE_RISK;
        }
        return AppReferenceFilter.filter(text)
                .map(dayDetailFormatter::formatDayDetail)
                .orElse(DayDetailFormatter.LOW_FLARE_RISK);
    }

    /**
     * Keys match on their first three letters, so "Tues", "Thurs." and "tuesday" all find Tuesday.
     */
    private static String lookupDay(Map<?, ?> breakdown, DayOfWeek day) {
        String abbreviation = day.getDisplayName(TextStyle.SHORT, Locale.US);
        for (Map.Entry<?, ?> entry : breakdown.entrySet()) {
            String key = NON_LETTER.matcher(String.valueOf(entry.getKey())).replaceAll("");
            if (key.length() >= 3 && key.substring(0, 3).equalsIgnoreCase(abbreviation)) {
                return entryText(entry.getValue());
            }
        }
        return null;
    }

    private static String entryText(Object entry) {
        if (entry instanceof String text) {
            return text;
        }
        if (entry instanceof Map<?, ?> map) {
            for (String key : List.of("insight", "detail", "text")) {
                if (map.get(key) instanceof String text) {
                    return text;
                }
            }
        }
        return null;
    }

    private static FormattedWeeklyInsight build(String summary,
                                                List<DayOfWeek> days,
                                                List<String> details,
                                                String preparationTip) {
        List<WeekdayEntry> entries = new ArrayList<>(FormattedWeeklyInsight.DAY_COUNT);
        for (int i = 0; i < days.size(); i++) {
            String detail = i < details.size() ? details.get(i) : DayDetailFormatter.LOW_FLARE_RISK;
            entries.add(new WeekdayEntry(days.get(i).getDisplayName(TextStyle.SHORT, Locale.US), detail));
        }
        return new FormattedWeeklyInsight(firstSentence(summary), entries, preparationTip);
    }

    static String firstSentence(String text) {
        List<String> sentences = InsightSanitizer.sentences(text);
        return sentences.isEmpty() ? DEFAULT_SUMMARY : sentences.get(0) + ".";
    }

    static String removeCitations(String text) {
        String withoutParens = CITATION_IN_PARENS.matcher(text).replaceAll("");
        return TRAILING_CITATION.matcher(withoutParens).replaceAll("").trim();
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
