package com.flareweather.insight.text;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips markup, numeric weather readings and forbidden technical/advisory wording from a fragment of
 * model output. Rules are re-applied until the text stops changing, so {@code sanitize} is idempotent.
 */
public final class InsightSanitizer {

    private static final Pattern LINE_BREAK_MARKUP = Pattern.compile("(?i)<br\\s*/?>");
    private static final Pattern EMPHASIS = Pattern.compile("[*_]+");
    private static final Pattern BULLET_DOT = Pattern.compile("[•·]");
    private static final Pattern LEADING_DASH = Pattern.compile("(?m)^[ \\t]*-+[ \\t]*");

    private static final String NUMBER = "[-+]?\\d+(?:\\.\\d+)?";
    private static final String CONNECTIVE = "(?:\\b(?:at|around|near|about)\\s+)?";
    private static final String RANGE_START = "(?:\\d+(?:\\.\\d+)?\\s*(?:-|–|to)\\s*)?";
    private static final String UNIT = "(?:°\\s*[cf]?|degrees?(?:\\s+(?:celsius|fahrenheit))?|celsius|fahrenheit"
            + "|percent|%|hectopascals?|hpa|millibars?|mbar|mb|kpa|mmhg|inhg|inches|mm|cm)";

    private static final List<Pattern> NUMERIC_READINGS = List.of(
            Pattern.compile("(?i)" + CONNECTIVE + RANGE_START + NUMBER + "\\s*" + UNIT + "(?![a-z])"),
            Pattern.compile("(?i)" + CONNECTIVE + NUMBER + "[cf](?![a-z])")
    );

    private static final Pattern READING_WITHOUT_UNIT =
            Pattern.compile("(?i)\\b(pressure|temperatures?|humidity)\\s+(?:at|around|near|of)\\s+\\d+(?:\\.\\d+)?\\b");

    private static final Pattern FORBIDDEN_TERMS = Pattern.compile(
            "(?i)\\b(?:dew point|pressure gradient|trough|barometric|atmospheric|millibars?|hectopascals?"
                    + "|hpa|mbar|mb|kpa|mmhg|inhg|you should|try to|good day for|keeps things gentle"
                    + "|conditions stay stable|high/low sensitivity)\\b");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile(" +([,.;:!?])");
    private static final Pattern REPEATED_COMMA = Pattern.compile(",(?:\\s*,)+");
    private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[,;:.\\s]+");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]$");

    private InsightSanitizer() {
    }

    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String current = text;
        while (true) {
            String next = applyRules(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
    }

    private static String applyRules(String input) {
        String value = LINE_BREAK_MARKUP.matcher(input).replaceAll(" ");
        value = EMPHASIS.matcher(value).replaceAll("");
        value = BULLET_DOT.matcher(value).replaceAll(" ");
        value = LEADING_DASH.matcher(value).replaceAll("");

        for (Pattern reading : NUMERIC_READINGS) {
            value = reading.matcher(value).replaceAll("");
        }
        value = READING_WITHOUT_UNIT.matcher(value).replaceAll("$1");
        value = FORBIDDEN_TERMS.matcher(value).replaceAll("");

        value = WHITESPACE.matcher(value).replaceAll(" ");
        value = SPACE_BEFORE_PUNCTUATION.matcher(value).replaceAll("$1");
        value = REPEATED_COMMA.matcher(value).replaceAll(",");
        value = LEADING_PUNCTUATION.matcher(value).replaceAll("");
        return capitalizeSentences(value.trim());
    }

    /**
     * Upper-cases the first letter of the text and the first letter after each {@code . ! ?}.
     */
    static String capitalizeSentences(String text) {
        if (text.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        boolean capitalizeNext = true;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (capitalizeNext && Character.isLetter(c)) {
                sb.append(Character.toUpperCase(c));
                capitalizeNext = false;
            } else {
                sb.append(c);
                if (c == '.' || c == '!' || c == '?') {
                    capitalizeNext = true;
                }
            }
        }
        return sb.toString();
    }

    /**
     * Splits on sentence terminators and returns the trimmed, non-empty pieces without punctuation.
     */
    public static List<String> sentences(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return SENTENCE_BREAK.splitAsStream(text)
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .toList();
    }

    public static boolean endsWithSentencePunctuation(String text) {
        return text != null && SENTENCE_END.matcher(text).find();
    }
}
