package com.flareweather.insight.text;

import com.flareweather.insight.model.RiskLevel;
import com.flareweather.insight.model.WeatherFactor;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * First-match keyword scans used to pick a weather factor for a sentence and a risk level for a
 * weekly day detail.
 */
public final class WeatherClassifier {

    // iteration order is the priority order
    private static final Map<WeatherFactor, Pattern> FACTOR_KEYWORDS = new LinkedHashMap<>();

    static {
        FACTOR_KEYWORDS.put(WeatherFactor.PRESSURE, Pattern.compile("\\b(?:pressure|barometric)"));
        FACTOR_KEYWORDS.put(WeatherFactor.HUMIDITY, Pattern.compile("\\b(?:humid|moist)"));
        FACTOR_KEYWORDS.put(WeatherFactor.TEMPERATURE, Pattern.compile("\\b(?:temperat|cool|warm|heat|cold|chill)"));
        FACTOR_KEYWORDS.put(WeatherFactor.WIND, Pattern.compile("\\b(?:wind|breez|gust)"));
    }

    private static final Pattern LOW_RISK_MARKERS = Pattern.compile(
            "\\blow (?:flare )?risk\\b|\\b(?:steady|calm|stable)\\s+(?:pattern|conditions|trend|pressure)\\b");
    private static final Pattern HIGHER_RISK_MARKERS = Pattern.compile(
            "\\b(?:moderate|high|rising|shift|storm|front|stiff|tiring|draining|heavy|sluggish|tense"
                    + "|sensitive|effortful|watch for)");
    private static final Pattern GENTLE = Pattern.compile("\\bgentle\\b");
    private static final Pattern MILD = Pattern.compile("\\bmild\\b");
    private static final Pattern WEATHER_DETAIL = Pattern.compile("[—–]|\\s-\\s|\\b(?:humidity|temperature|pressure)\\b");

    private WeatherClassifier() {
    }

    public static WeatherFactor classifyWeatherFactor(String text) {
        return detectWeatherFactor(text).orElse(WeatherFactor.PRESSURE);
    }

    /**
     * Same scan as {@link #classifyWeatherFactor(String)} but empty when no factor keyword is present.
     */
    public static Optional<WeatherFactor> detectWeatherFactor(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<WeatherFactor, Pattern> entry : FACTOR_KEYWORDS.entrySet()) {
            if (entry.getValue().matcher(lower).find()) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public static RiskLevel classifyRisk(String detail) {
        if (detail == null || detail.isBlank()) {
            return RiskLevel.LOW;
        }
        String lower = detail.toLowerCase(Locale.ROOT);
        if (LOW_RISK_MARKERS.matcher(lower).find()) {
            return RiskLevel.LOW;
        }
        if (HIGHER_RISK_MARKERS.matcher(lower).find()) {
            return RiskLevel.ELEVATED;
        }
        if (GENTLE.matcher(lower).find() && MILD.matcher(lower).find()) {
            return RiskLevel.LOW;
        }
        if (WEATHER_DETAIL.matcher(lower).find()) {
            return RiskLevel.ELEVATED;
        }
        return RiskLevel.LOW;
    }
}
