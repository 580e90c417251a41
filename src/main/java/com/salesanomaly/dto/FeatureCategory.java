package com.salesanomaly.dto;

public enum FeatureCategory {
    OPERATIONAL,
    MARKETING,
    WEATHER,
    HOLIDAY,
    QUALITY,
    TEMPORAL,
    TREND,
    NONE
}
