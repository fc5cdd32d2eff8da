package com.flareweather.insight.model;

public enum RiskLevel {
    LOW,
    ELEVATED
}
