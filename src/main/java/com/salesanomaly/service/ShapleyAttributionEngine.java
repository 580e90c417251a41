package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.AnomalyRecord;
import com.salesanomaly.dto.AttributionMethod;
import com.salesanomaly.dto.AttributionResult;
import com.salesanomaly.dto.FeatureContribution;
import com.salesanomaly.dto.FeatureVector;
import com.salesanomaly.ml.TrainedSalesModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Splits the gap between actual and expected sales into per-feature contributions by sampling
 * feature orderings. The reference point is the model's training-set feature means; whatever the
 * reported contributions do not cover is returned as the unexplained residual.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShapleyAttributionEngine {

    private final AnalysisConfig config;

    public AttributionResult attribute(AnomalyRecord anomaly, FeatureVector vector, TrainedSalesModel model) {
        AnalysisConfig.Attribution cfg = config.getAttribution();
        double raw = model.predict(vector);
        Double mean = anomaly.getBaselineMean();
        double ceiling = mean != null && mean > 0 ? cfg.getImplausibleMultiple() * mean : Double.POSITIVE_INFINITY;

        boolean unreliable = !Double.isFinite(raw) || raw <= 0 || raw > ceiling;
        double expected = unreliable ? clamp(raw, cfg.getPredictionFloor(), ceiling) : raw;
        if (unreliable) {
            log.warn("Implausible prediction clamped | restaurantId={} | date={} | raw={} | clamped={}",
                anomaly.getRestaurantId(), anomaly.getDate(), raw, expected);
        }

        FeatureVector reference = model.referenceVector();
        double baselineExpectation = model.predict(reference);
        double[] phi = shapleyValues(vector, model);

        List<FeatureContribution> all = new ArrayList<>(phi.length);
        for (int j = 0; j < phi.length; j++) {
            String name = vector.names().get(j);
            all.add(FeatureContribution.builder()
                .feature(name)
                .category(FeatureBuilder.categoryOf(name))
                .value(vector.value(j))
                .contribution(phi[j])
                .build());
        }
        all.sort(Comparator.comparingDouble((FeatureContribution c) -> Math.abs(c.getContribution())).reversed());
        List<FeatureContribution> top = List.copyOf(all.subList(0, Math.min(cfg.getTopN(), all.size())));

        double reported = top.stream().mapToDouble(FeatureContribution::getContribution).sum();
        double residual = anomaly.getActualSales() - expected - reported;

        return AttributionResult.builder()
            .anomaly(anomaly.withExpectedSales(expected))
            .method(AttributionMethod.SHAPLEY_PERMUTATION)
            .expectedSales(expected)
            .baselineExpectation(baselineExpectation)
            .contributions(top)
            .unexplainedResidual(residual)
            .predictionUnreliable(unreliable)
            .lowConfidence(model.quality() != null && model.quality().isLowConfidence())
            .recommendations(List.of())
            .build();
    }

    /**
     * Permutation estimate of each feature's Shapley value against the model's reference vector.
     * Each sampled ordering switches features from reference to actual one at a time, so the values
     * always sum to {@code predict(vector) - predict(reference)}.
     */
    public double[] shapleyValues(FeatureVector vector, TrainedSalesModel model) {
        if (!vector.hasSameSchema(model.featureNames())) {
            throw new IllegalArgumentException("Feature vector schema " + vector.names()
                + " does not match model schema " + model.featureNames());
        }
        int permutations = config.getAttribution().getPermutations();
        double[] x = vector.toArray();
        double[] ref = model.referenceVector().toArray();
        int n = x.length;
        double start = model.predictRaw(ref);
        double[] phi = new double[n];
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Random rnd = new Random(config.getAttribution().getSeed());

        for (int p = 0; p < permutations; p++) {
            for (int i = n - 1; i > 0; i--) {
                int k = rnd.nextInt(i + 1);
                int tmp = order[i];
                order[i] = order[k];
                order[k] = tmp;
            }
            double[] current = ref.clone();
            double previous = start;
            for (int j : order) {
                if (current[j] == x[j]) {
                    continue;
                }
                current[j] = x[j];
                double next = model.predictRaw(current);
                phi[j] += next - previous;
                previous = next;
            }
        }
        for (int j = 0; j < n; j++) {
            phi[j] /= permutations;
        }
        return phi;
    }

    private static double clamp(double raw, double floor, double ceiling) {
        if (Double.isNaN(raw)) {
            return floor;
        }
        double upper = Double.isFinite(ceiling) ? ceiling : Math.max(floor, Math.min(raw, Double.MAX_VALUE));
        return Math.max(floor, Math.min(raw, upper));
    }
}
