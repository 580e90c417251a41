package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.AnomalyRecord;
import com.salesanomaly.dto.AttributionMethod;
import com.salesanomaly.dto.AttributionResult;
import com.salesanomaly.dto.FeatureContribution;
import com.salesanomaly.dto.FeatureVector;
import com.salesanomaly.dto.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fixed-coefficient attribution used when no model could be trained. Each triggered rule claims a
 * share of the expected sales; the residual absorbs the rest. Results are always low-confidence.
 */
@Component
@RequiredArgsConstructor
public class RuleBasedScoringPolicy {

    static final double STORE_CLOSED = -1.0;
    static final double OUT_OF_STOCK = -0.25;
    static final double STORE_OVERLOADED = -0.15;
    static final double RATING_TARGET = 4.5;
    static final double RATING_PENALTY_PER_TENTH = -0.05;
    static final double CANCELLATION_TOLERANCE = 0.05;

    private final AnalysisConfig config;

    public AttributionResult score(AnomalyRecord anomaly, FeatureVector vector) {
        double expected = anomaly.getSeverity() != Severity.UNCLASSIFIED && anomaly.getBaselineMean() != null
            ? anomaly.getBaselineMean()
            : anomaly.getActualSales();

        List<FeatureContribution> contributions = new ArrayList<>();
        addIfSet(contributions, vector, "store_closed", STORE_CLOSED * expected);
        addIfSet(contributions, vector, "out_of_stock", OUT_OF_STOCK * expected);
        addIfSet(contributions, vector, "store_overloaded", STORE_OVERLOADED * expected);

        double rain = vector.get("precipitation");
        double rainShare = rainCoefficient(rain);
        if (rainShare != 0.0) {
            contributions.add(contribution(vector, "precipitation", rainShare * expected));
        }
        double wind = vector.get("wind_speed");
        double windShare = wind > 15 ? -0.10 : wind > 10 ? -0.05 : 0.0;
        if (windShare != 0.0) {
            contributions.add(contribution(vector, "wind_speed", windShare * expected));
        }
        if (vector.get("is_holiday") > 0) {
            contributions.add(contribution(vector, "holiday_impact_weight",
                vector.get("holiday_impact_weight") * expected));
        }
        double rating = vector.get("rating");
        if (rating > 0 && rating < RATING_TARGET) {
            double tenths = (RATING_TARGET - rating) / 0.1;
            contributions.add(contribution(vector, "rating", RATING_PENALTY_PER_TENTH * tenths * expected));
        }
        double cancellation = vector.get("cancellation_rate");
        if (cancellation > CANCELLATION_TOLERANCE) {
            contributions.add(contribution(vector, "cancellation_rate",
                -(cancellation - CANCELLATION_TOLERANCE) * expected));
        }

        contributions.sort(Comparator.comparingDouble((FeatureContribution c) -> Math.abs(c.getContribution())).reversed());
        int topN = config.getAttribution().getTopN();
        List<FeatureContribution> top = List.copyOf(contributions.subList(0, Math.min(topN, contributions.size())));
        double reported = top.stream().mapToDouble(FeatureContribution::getContribution).sum();

        return AttributionResult.builder()
            .anomaly(anomaly.withExpectedSales(expected))
            .method(AttributionMethod.RULE_BASED)
            .expectedSales(expected)
            .baselineExpectation(expected)
            .contributions(top)
            .unexplainedResidual(anomaly.getActualSales() - expected - reported)
            .lowConfidence(true)
            .recommendations(List.of())
            .build();
    }

    static double rainCoefficient(double precipitation) {
        if (precipitation > 15) {
            return -0.30;
        }
        if (precipitation > 10) {
            return -0.25;
        }
        if (precipitation > 5) {
            return -0.15;
        }
        if (precipitation > 1) {
            return -0.08;
        }
        return 0.0;
    }

    private static void addIfSet(List<FeatureContribution> out, FeatureVector vector, String feature, double amount) {
        if (vector.get(feature) > 0) {
            out.add(contribution(vector, feature, amount));
        }
    }

    private static FeatureContribution contribution(FeatureVector vector, String feature, double amount) {
        return FeatureContribution.builder()
            .feature(feature)
            .category(FeatureBuilder.categoryOf(feature))
            .value(vector.get(feature))
            .contribution(amount)
            .build();
    }
}
