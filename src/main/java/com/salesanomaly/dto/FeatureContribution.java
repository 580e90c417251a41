package com.salesanomaly.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FeatureContribution {
    String feature;
    FeatureCategory category;
    double value;
    double contribution;
}
