package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.BacktestReport;
import com.salesanomaly.dto.DailyMetricRecord;
import com.salesanomaly.dto.ExternalFactorSnapshot;
import com.salesanomaly.dto.FeatureVector;
import com.salesanomaly.dto.WhatIfResult;
import com.salesanomaly.dto.WhatIfScenario;
import com.salesanomaly.entity.Restaurant;
import com.salesanomaly.exception.InsufficientHistoryException;
import com.salesanomaly.exception.RestaurantNotFoundException;
import com.salesanomaly.ml.RegressionMetrics;
import com.salesanomaly.ml.TrainedSalesModel;
import com.salesanomaly.repository.RestaurantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SalesInsightsService {

    private static final double FIRST_FOLD_FRACTION = 0.6;
    private static final double LAST_FOLD_FRACTION = 0.9;

    private final RestaurantRepository restaurantRepository;
    private final MetricAggregatorService aggregator;
    private final ExternalFactorEnrichmentService enrichment;
    private final FeatureBuilder featureBuilder;
    private final SalesModelService modelService;
    private final AnalysisConfig config;

    /**
     * Rolling-origin backtest over the lookback window ending at {@code to}: each fold trains on a
     * growing prefix of the feature rows and is scored on the rows after it. Metrics are pooled over
     * all scored rows.
     */
    public BacktestReport backtest(Long restaurantId, LocalDate to) {
        Restaurant restaurant = restaurantRepository.findById(restaurantId)
            .orElseThrow(() -> new RestaurantNotFoundException(restaurantId));
        List<DailyMetricRecord> records = aggregator.aggregate(restaurant,
            to.minusDays(config.getHistoryLookbackDays()), to);
        Map<LocalDate, ExternalFactorSnapshot> snapshots = enrichment.enrichBatch(restaurant,
            records.stream().map(DailyMetricRecord::getDate).toList(), () -> false);
        SalesHistory history = SalesHistory.of(records);

        List<FeatureVector> vectors = new ArrayList<>();
        List<Double> targets = new ArrayList<>();
        for (DailyMetricRecord record : records) {
            try {
                vectors.add(featureBuilder.build(record, snapshots.get(record.getDate()), history));
                targets.add(record.getTotalSales());
            } catch (InsufficientHistoryException ex) {
                log.debug("Backtest row skipped | date={} | reason={}", record.getDate(), ex.getMessage());
            }
        }
        return backtest(restaurantId, vectors, targets.stream().mapToDouble(Double::doubleValue).toArray());
    }

    BacktestReport backtest(Long restaurantId, List<FeatureVector> vectors, double[] sales) {
        AnalysisConfig.Backtest cfg = config.getBacktest();
        int n = vectors.size();
        List<Double> actual = new ArrayList<>();
        List<Double> predicted = new ArrayList<>();
        Map<String, Double> importance = new LinkedHashMap<>();
        int usedFolds = 0;

        for (int k = 0; k < cfg.getFolds(); k++) {
            double fraction = cfg.getFolds() == 1
                ? FIRST_FOLD_FRACTION
                : FIRST_FOLD_FRACTION + (LAST_FOLD_FRACTION - FIRST_FOLD_FRACTION) * k / (cfg.getFolds() - 1);
            int cut = (int) Math.floor(n * fraction + 1e-9);
            if (cut <= cfg.getMinTrainRows() || n - cut < cfg.getMinTestRows()) {
                log.debug("Backtest fold skipped | restaurantId={} | fold={} | trainRows={} | testRows={}",
                    restaurantId, k, cut, n - cut);
                continue;
            }
            double[] trainY = new double[cut];
            System.arraycopy(sales, 0, trainY, 0, cut);
            TrainedSalesModel model = modelService.fitForEvaluation(vectors.subList(0, cut), trainY);
            for (int i = cut; i < n; i++) {
                actual.add(sales[i]);
                predicted.add(model.predict(vectors.get(i)));
            }
            model.featureImportance().forEach((f, v) -> importance.merge(f, v, Double::sum));
            usedFolds++;
        }

        if (usedFolds == 0) {
            log.warn("Backtest produced no usable folds | restaurantId={} | rows={}", restaurantId, n);
            return BacktestReport.builder()
                .restaurantId(restaurantId)
                .folds(0)
                .observations(0)
                .featureImportance(Map.of())
                .build();
        }

        final int folds = usedFolds;
        importance.replaceAll((f, v) -> v / folds);
        double[] a = actual.stream().mapToDouble(Double::doubleValue).toArray();
        double[] p = predicted.stream().mapToDouble(Double::doubleValue).toArray();
        BacktestReport report = BacktestReport.builder()
            .restaurantId(restaurantId)
            .folds(folds)
            .observations(a.length)
            .mae(RegressionMetrics.meanAbsoluteError(a, p))
            .mape(RegressionMetrics.mape(a, p))
            .r2(RegressionMetrics.r2(a, p))
            .featureImportance(importance)
            .build();
        log.info("Backtest finished | restaurantId={} | folds={} | observations={} | mae={} | r2={}",
            restaurantId, folds, a.length, report.getMae(), report.getR2());
        return report;
    }

    /**
     * Predicts each scenario by overriding features of {@code vector}.
     *
     * @throws IllegalArgumentException when a scenario overrides a feature the model does not know,
     *         or gives an override no value
     */
    public WhatIfResult whatIf(TrainedSalesModel model, FeatureVector vector, List<WhatIfScenario> scenarios) {
        double base = model.predict(vector);
        List<WhatIfResult.ScenarioOutcome> outcomes = new ArrayList<>(scenarios.size());
        for (int i = 0; i < scenarios.size(); i++) {
            WhatIfScenario scenario = scenarios.get(i);
            FeatureVector variant = vector;
            if (scenario.getOverrides() != null) {
                for (Map.Entry<String, Double> override : scenario.getOverrides().entrySet()) {
                    if (variant.indexOf(override.getKey()) < 0) {
                        throw new IllegalArgumentException("Unknown feature in scenario: " + override.getKey());
                    }
                    if (override.getValue() == null) {
                        throw new IllegalArgumentException("No value for feature in scenario: " + override.getKey());
                    }
                    variant = variant.with(override.getKey(), override.getValue());
                }
            }
            String name = scenario.getName() != null && !scenario.getName().isBlank()
                ? scenario.getName() : "scenario-" + (i + 1);
            double prediction = model.predict(variant);
            outcomes.add(WhatIfResult.ScenarioOutcome.builder()
                .name(name)
                .predictedSales(prediction)
                .delta(prediction - base)
                .build());
        }
        return WhatIfResult.builder()
            .basePrediction(base)
            .scenarios(outcomes)
            .build();
    }
}
