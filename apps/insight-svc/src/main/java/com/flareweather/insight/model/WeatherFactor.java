package com.flareweather.insight.model;

/**
 * The single dominant weather variable a sentence talks about.
 */
public enum WeatherFactor {
    PRESSURE,
    HUMIDITY,
    TEMPERATURE,
    WIND
}
