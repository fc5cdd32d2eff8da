package com.flareweather.insight.policy;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Drops fragments that nudge the reader to use the product (log symptoms, jot notes, teach the app)
 * instead of describing weather and the body. An empty result means "use this field's default".
 */
public final class AppReferenceFilter {

    private static final Pattern HEADER =
            Pattern.compile("(?i)^[\\s\\u2600\\uFE0F]*daily\\s+insight\\s*:?\\s*|^[\\u2600\\uFE0F]+\\s*");

    private static final List<String> INSTRUCTION_PHRASES = List.of(
            "take one minute",
            "jot how you feel",
            "jot down",
            "update in flare",
            "update flare",
            "drop a quick update",
            "teach the app",
            "what matters most",
            "those notes teach",
            "so the guidance stays personal",
            "log how you feel",
            "log your symptoms",
            "logging symptoms"
    );

    // "flare risk" and "flare-ups" are content, not a product mention
    private static final Pattern SELF_REFERENCE =
            Pattern.compile("\\bflare(?:weather)?\\b(?![\\s-]*(?:risk|ups?)\\b)|\\bapps?\\b");
    private static final Pattern JOT = Pattern.compile("\\bjot");
    private static final Pattern TEACH = Pattern.compile("\\bteach");
    private static final Pattern MATTERS_MOST = Pattern.compile("\\bmatters most\\b");
    private static final Pattern ONE_MINUTE = Pattern.compile("\\bone minute\\b");
    private static final Pattern LOG = Pattern.compile("\\blog(?:s|ged|ging)?\\b");

    private AppReferenceFilter() {
    }

    public static Optional<String> filter(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String cleaned = stripHeader(text);
        String lower = cleaned.toLowerCase(Locale.ROOT);

        boolean selfReference = SELF_REFERENCE.matcher(lower).find();
        if (selfReference && INSTRUCTION_PHRASES.stream().anyMatch(lower::contains)) {
            return Optional.empty();
        }
        boolean oneMinute = ONE_MINUTE.matcher(lower).find();
        boolean jot = JOT.matcher(lower).find();
        if (oneMinute && jot) {
            return Optional.empty();
        }
        if (selfReference && (jot || oneMinute
                || TEACH.matcher(lower).find()
                || MATTERS_MOST.matcher(lower).find()
                || LOG.matcher(lower).find())) {
            return Optional.empty();
        }
        return Optional.of(cleaned);
    }

    /**
     * Removes a leading "Daily Insight" card header, with or without the sun emoji and colon.
     */
    public static String stripHeader(String text) {
        if (text == null) {
            return "";
        }
        return HEADER.matcher(text).replaceFirst("").trim();
    }
}
