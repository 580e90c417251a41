package com.salesanomaly.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class AttributionResult {
    AnomalyRecord anomaly;
    AttributionMethod method;
    double expectedSales;
    double baselineExpectation;
    List<FeatureContribution> contributions;
    double unexplainedResidual;
    boolean predictionUnreliable;
    boolean lowConfidence;
    boolean lagFeaturesImputed;
    boolean weatherEstimated;
    boolean locationEstimated;
    List<Recommendation> recommendations;

    /** True when any fallback fed into this result and its confidence should be discounted. */
    public boolean isEstimated() {
        return method == AttributionMethod.RULE_BASED
            || predictionUnreliable || lowConfidence || lagFeaturesImputed
            || weatherEstimated || locationEstimated;
    }

    public double explainedAmount() {
        return contributions.stream().mapToDouble(FeatureContribution::getContribution).sum();
    }
}
