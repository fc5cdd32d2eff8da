package com.flareweather.insight.weekly;

import com.flareweather.insight.model.RawInsightPayload;
import java.util.Map;

/**
 * How a weekly payload lays out its seven days.
 */
public enum WeeklyPayloadShape {
    STRUCTURED_LIST,
    STRUCTURED_MAP,
    LEGACY_MULTI_LINE,
    LEGACY_SINGLE_PARAGRAPH;

    public static WeeklyPayloadShape of(RawInsightPayload payload) {
        if (payload instanceof RawInsightPayload.Structured structured) {
            return structured.fields().get("daily_breakdown") instanceof Map<?, ?> ? STRUCTURED_MAP : STRUCTURED_LIST;
        }
        String text = ((RawInsightPayload.Legacy) payload).text().trim();
        long lines = text.lines().filter(line -> !line.isBlank()).count();
        return lines > 1 ? LEGACY_MULTI_LINE : LEGACY_SINGLE_PARAGRAPH;
    }
}
