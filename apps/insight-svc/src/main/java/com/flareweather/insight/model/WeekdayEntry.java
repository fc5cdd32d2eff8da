package com.flareweather.insight.model;

public record WeekdayEntry(String label, String detail) {
}
