package com.flareweather.insight.model;

import java.util.List;

/**
 * Weekly card content: a one sentence summary and exactly seven days starting tomorrow.
 * {@code preparationTip} is null when the upstream payload carried none.
 */
public record FormattedWeeklyInsight(String summary, List<WeekdayEntry> days, String preparationTip) {

    public static final int DAY_COUNT = 7;

    public FormattedWeeklyInsight {
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("summary must be provided");
        }
        if (days == null || days.size() != DAY_COUNT) {
            throw new IllegalArgumentException("exactly " + DAY_COUNT + " days must be provided");
        }
        days = List.copyOf(days);
    }
}
