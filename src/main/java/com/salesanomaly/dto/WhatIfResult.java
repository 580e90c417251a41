package com.salesanomaly.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class WhatIfResult {
    double basePrediction;
    List<ScenarioOutcome> scenarios;

    @Value
    @Builder
    public static class ScenarioOutcome {
        String name;
        double predictedSales;
        double delta;
    }
}
