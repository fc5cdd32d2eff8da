package com.flareweather.insight.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Pattern;

/**
 * @param referenceDate ISO date the week is counted from; today in the configured zone when absent
 */
public record WeeklyInsightRequestDto(
        JsonNode payload,
        @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "referenceDate must be an ISO date (yyyy-MM-dd)")
        String referenceDate
) {
}
