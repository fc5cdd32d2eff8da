package com.flareweather.insight.weekly;

import com.flareweather.insight.model.RiskLevel;
import com.flareweather.insight.text.InsightSanitizer;
import com.flareweather.insight.text.WeatherClassifier;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Collapses low-risk day details to a fixed phrase and keeps descriptive text for the rest.
 */
@Component
public class DayDetailFormatter {

    public static final String LOW_FLARE_RISK = "low flare risk";

    private static final Pattern LEADING_BULLET = Pattern.compile("^\\s*[-•*]\\s*");

    public String formatDayDetail(String text) {
        if (text == null) {
            return LOW_FLARE_RISK;
        }
        String sanitized = InsightSanitizer.sanitize(LEADING_BULLET.matcher(text).replaceFirst(""));
        if (sanitized.isBlank() || WeatherClassifier.classifyRisk(sanitized) == RiskLevel.LOW) {
            return LOW_FLARE_RISK;
        }
        return sanitized;
    }
}
