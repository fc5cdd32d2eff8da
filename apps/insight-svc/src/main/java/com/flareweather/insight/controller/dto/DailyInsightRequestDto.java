package com.flareweather.insight.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param payload the analysis payload, either a JSON object or a string
 * @param why     optional "why" delivered next to the payload; wins over the payload's own
 */
public record DailyInsightRequestDto(JsonNode payload, String why) {
}
