package com.flareweather.insight.policy;

import com.flareweather.insight.config.InsightProperties;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cleans up weekly sentences whose upstream template lost its interpolated values, e.g.
 * "temperatures around to , steady at , and humidity around.". Falls back to a canned sentence when
 * too little survives.
 */
@Component
public class TemplateRepair {

    private static final Logger log = LoggerFactory.getLogger(TemplateRepair.class);

    static final String STEADY_FALLBACK = "A steady week ahead with consistent conditions.";
    static final String COOL_FALLBACK = "A mostly stable pattern with slightly cooler conditions.";
    static final String WARM_FALLBACK = "A mostly stable pattern with mild temperatures.";
    static final String NEUTRAL_FALLBACK = "Weather stays fairly consistent through the week.";

    private static final List<Pattern> BROKEN_SIGNATURES = List.of(
            Pattern.compile("the upcoming week presents.*temperatures around to.*steady at.*humidity around"),
            Pattern.compile("consistent weather pattern.*temperatures around to"),
            Pattern.compile("temperatures around to\\b"),
            Pattern.compile("steady at\\s*,\\s*and\\b"),
            Pattern.compile("humidity around\\s*\\.?\\s*$")
    );

    private static final String NUM = "-?\\d+(?:\\.\\d+)?";
    private static final String UNIT = "(?:\\s*(?:°\\s*[cf]?|degrees?|%|percent|hpa|mb|mbar|inhg|mmhg|kpa))?";

    /** Applied in order; each entry is a pattern and its replacement. */
    private static final List<Rule> REMOVAL_RULES = List.of(
            new Rule("\\{\\{[^}]*\\}\\}", ""),
            new Rule("\\{[^}]*\\}", ""),
            new Rule("\\b(?:ranging\\s+)?(?:from|between)\\s+" + NUM + UNIT + "\\s*(?:to|and|-|–)\\s*" + NUM + UNIT, ""),
            new Rule("\\branging\\s+" + NUM + UNIT + "\\s*(?:to|-|–)\\s*" + NUM + UNIT, ""),
            new Rule(NUM + UNIT + "\\s*(?:to|-|–)\\s*" + NUM + UNIT, ""),
            new Rule("\\b(steady\\s+)?(?:at|around|near)\\s+" + NUM + UNIT, "$1"),
            new Rule(NUM + "\\s*%", ""),
            new Rule("\\b(?:ranging\\s+)?(?:from|between|around|near)\\s+(?:to|and)\\b", ""),
            new Rule("\\b(steady)\\s+at\\s*(?=[,.;]|\\b(?:and|with)\\b|$)", "$1"),
            new Rule("\\b(?:at|around|near)\\s*(?=[,.;]|\\b(?:and|with)\\b|$)", ""),
            new Rule("\\b(temps?|temperatures?|pressure|humidity)\\s+(?:ranging|from|between)\\s*(?=[,.;]|\\b(?:and|with)\\b|$)", "$1"),
            new Rule("\\branging\\s*(?=[,.;]|$)", "")
    );

    private static final List<Rule> TIDY_RULES = List.of(
            new Rule("\\s+", " "),
            new Rule("\\s+([,.;!?])", "$1"),
            new Rule(",(?:\\s*,)+", ","),
            new Rule("[,;]\\s*([.!?])", "$1"),
            new Rule("^(?:\\s*(?:and\\b|[,;.]))+\\s*", ""),
            new Rule("(?:[,;]?\\s*\\band)+\\s*([.!?]?)$", "$1"),
            new Rule("[,;\\s]+$", "")
    );

    private final int minLength;

    public TemplateRepair(InsightProperties properties) {
        this.minLength = properties.templateRepair().minLength();
    }

    public String repair(String text) {
        if (text == null) {
            return cannedFallback("");
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Pattern signature : BROKEN_SIGNATURES) {
            if (signature.matcher(lower).find()) {
                log.debug("Weekly text matches a broken template signature, using canned fallback");
                return cannedFallback(lower);
            }
        }

        String cleaned = text;
        for (Rule rule : REMOVAL_RULES) {
            cleaned = rule.apply(cleaned);
        }
        for (Rule rule : TIDY_RULES) {
            cleaned = rule.apply(cleaned);
        }
        cleaned = cleaned.trim();

        if (cleaned.length() < minLength) {
            log.debug("Repaired weekly text too short ({} chars), using canned fallback", cleaned.length());
            return cannedFallback(lower);
        }
        if (!cleaned.matches("(?s).*[.!?]$")) {
            cleaned = cleaned + ".";
        }
        return cleaned;
    }

    private static String cannedFallback(String original) {
        if (original.contains("steady") || original.contains("stable")) {
            return STEADY_FALLBACK;
        }
        if (original.contains("cool")) {
            return COOL_FALLBACK;
        }
        if (original.contains("warm")) {
            return WARM_FALLBACK;
        }
        return NEUTRAL_FALLBACK;
    }

    private record Rule(Pattern pattern, String replacement) {

        Rule(String regex, String replacement) {
            this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
        }

        String apply(String input) {
            return pattern.matcher(input).replaceAll(replacement);
        }
    }
}
