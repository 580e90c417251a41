package com.salesanomaly.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Recommendation {
    FeatureCategory category;
    String feature;
    String message;
    double contribution;
    double estimatedRecoverableValue;
}
