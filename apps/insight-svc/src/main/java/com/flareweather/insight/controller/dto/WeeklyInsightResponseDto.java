package com.flareweather.insight.controller.dto;

import com.flareweather.insight.model.FormattedWeeklyInsight;
import java.util.List;

public record WeeklyInsightResponseDto(String summary, List<DayDto> days, String preparationTip, String traceId) {

    public record DayDto(String label, String detail) {
    }

    public static WeeklyInsightResponseDto from(FormattedWeeklyInsight insight, String traceId) {
        List<DayDto> days = insight.days().stream()
                .map(day -> new DayDto(day.label(), day.detail()))
                .toList();
        return new WeeklyInsightResponseDto(insight.summary(), days, insight.preparationTip(), traceId);
    }
}
