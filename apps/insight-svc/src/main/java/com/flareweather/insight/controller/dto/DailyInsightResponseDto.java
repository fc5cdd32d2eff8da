package com.flareweather.insight.controller.dto;

public record DailyInsightResponseDto(String message, String traceId) {
}
