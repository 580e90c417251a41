package com.salesanomaly.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class BacktestReport {
    Long restaurantId;
    int folds;
    int observations;
    Double mae;
    Double mape;
    Double r2;
    Map<String, Double> featureImportance;
}
