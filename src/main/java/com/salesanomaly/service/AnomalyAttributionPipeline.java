package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.AnomalyRecord;
import com.salesanomaly.dto.AttributionMethod;
import com.salesanomaly.dto.AttributionResult;
import com.salesanomaly.dto.DailyMetricRecord;
import com.salesanomaly.dto.ExternalFactorSnapshot;
import com.salesanomaly.dto.FeatureVector;
import com.salesanomaly.dto.ModelScope;
import com.salesanomaly.dto.PipelineReport;
import com.salesanomaly.entity.Restaurant;
import com.salesanomaly.exception.InsufficientHistoryException;
import com.salesanomaly.exception.InsufficientTrainingDataException;
import com.salesanomaly.exception.PipelineCancelledException;
import com.salesanomaly.exception.RestaurantNotFoundException;
import com.salesanomaly.ml.TrainedSalesModel;
import com.salesanomaly.repository.RestaurantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Aggregate, enrich, train, detect, attribute, recommend: one run per restaurant and date range.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyAttributionPipeline {

    private final RestaurantRepository restaurantRepository;
    private final MetricAggregatorService aggregator;
    private final ExternalFactorEnrichmentService enrichment;
    private final FeatureBuilder featureBuilder;
    private final BaselineAnomalyDetector detector;
    private final SalesModelService modelService;
    private final ShapleyAttributionEngine attributionEngine;
    private final RuleBasedScoringPolicy rulePolicy;
    private final RecommendationGenerator recommendationGenerator;
    private final AnalysisWorkerPool workerPool;
    private final AnalysisConfig config;

    public PipelineReport run(Long restaurantId, LocalDate from, LocalDate to) {
        return run(restaurantId, from, to, () -> false);
    }

    public PipelineReport run(Long restaurantId, LocalDate from, LocalDate to, BooleanSupplier cancelled) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from " + from + " is after to " + to);
        }
        Restaurant restaurant = restaurantRepository.findById(restaurantId)
            .orElseThrow(() -> new RestaurantNotFoundException(restaurantId));
        long started = System.currentTimeMillis();
        log.info("Pipeline started | restaurant={} | from={} | to={}", restaurant.getName(), from, to);

        List<String> warnings = new ArrayList<>();
        LocalDate historyStart = to.minusDays(config.getHistoryLookbackDays());
        List<DailyMetricRecord> records = aggregator.aggregate(restaurant, historyStart, to);
        if (records.isEmpty()) {
            log.warn("No sales records | restaurant={} | from={} | to={}", restaurant.getName(), historyStart, to);
            warnings.add("No sales records between " + historyStart + " and " + to);
            return PipelineReport.builder()
                .restaurantId(restaurant.getId())
                .restaurantName(restaurant.getName())
                .fromDate(from)
                .toDate(to)
                .daysScanned(0)
                .results(List.of())
                .warnings(warnings)
                .build();
        }

        Map<LocalDate, ExternalFactorSnapshot> snapshots = enrichment.enrichBatch(restaurant,
            records.stream().map(DailyMetricRecord::getDate).toList(), cancelled);
        SalesHistory history = SalesHistory.of(records);

        TrainedSalesModel model = trainModel(restaurant, records, snapshots, history, to, cancelled, warnings);

        List<AnomalyRecord> classified = detector.classify(records);
        Map<LocalDate, DailyMetricRecord> byDate = new HashMap<>();
        records.forEach(r -> byDate.put(r.getDate(), r));

        List<AnomalyRecord> inRange = classified.stream()
            .filter(a -> !a.getDate().isBefore(from) && !a.getDate().isAfter(to))
            .toList();
        List<AnomalyRecord> flagged = inRange.stream()
            .filter(a -> detector.isFlagged(a.getSeverity()))
            .toList();

        AtomicInteger completed = new AtomicInteger();
        List<Supplier<AttributionResult>> units = new ArrayList<>(flagged.size());
        for (AnomalyRecord anomaly : flagged) {
            units.add(() -> {
                if (cancelled.getAsBoolean()) {
                    return null;
                }
                AttributionResult result = attribute(anomaly, byDate.get(anomaly.getDate()),
                    snapshots.get(anomaly.getDate()), history, model);
                completed.incrementAndGet();
                return result;
            });
        }
        List<AttributionResult> results = workerPool.invokeAll(units).stream()
            .filter(Objects::nonNull)
            .toList();
        if (completed.get() < flagged.size()) {
            log.warn("Pipeline cancelled | restaurant={} | attributed={} | flagged={}",
                restaurant.getName(), completed.get(), flagged.size());
            throw new PipelineCancelledException(restaurant.getId(), completed.get(), flagged.size());
        }

        long estimated = results.stream().filter(AttributionResult::isEstimated).count();
        log.info("Pipeline finished | restaurant={} | scanned={} | anomalies={} | estimated={} | elapsedMs={}",
            restaurant.getName(), inRange.size(), results.size(), estimated, System.currentTimeMillis() - started);
        return PipelineReport.builder()
            .restaurantId(restaurant.getId())
            .restaurantName(restaurant.getName())
            .fromDate(from)
            .toDate(to)
            .method(model != null ? AttributionMethod.SHAPLEY_PERMUTATION : AttributionMethod.RULE_BASED)
            .modelQuality(model != null ? model.quality() : null)
            .daysScanned(inRange.size())
            .results(results)
            .warnings(List.copyOf(warnings))
            .build();
    }

    AttributionResult attribute(AnomalyRecord anomaly, DailyMetricRecord record, ExternalFactorSnapshot snapshot,
                                SalesHistory history, TrainedSalesModel model) {
        boolean lagsImputed = false;
        FeatureVector vector;
        try {
            vector = featureBuilder.build(record, snapshot, history);
        } catch (InsufficientHistoryException ex) {
            log.warn("Lag features imputed | restaurantId={} | date={} | reason={}",
                anomaly.getRestaurantId(), anomaly.getDate(), ex.getMessage());
            vector = featureBuilder.buildWithImputedLags(record, snapshot);
            lagsImputed = true;
        }

        AttributionResult result = model != null
            ? attributionEngine.attribute(anomaly, vector, model)
            : rulePolicy.score(anomaly, vector);
        return result.toBuilder()
            .lagFeaturesImputed(lagsImputed)
            .weatherEstimated(snapshot.isWeatherEstimated())
            .locationEstimated(snapshot.isLocationEstimated())
            .recommendations(recommendationGenerator.generate(result.getContributions(), result.getExpectedSales()))
            .build();
    }

    private TrainedSalesModel trainModel(Restaurant restaurant, List<DailyMetricRecord> records,
                                         Map<LocalDate, ExternalFactorSnapshot> snapshots, SalesHistory history,
                                         LocalDate to, BooleanSupplier cancelled, List<String> warnings) {
        ModelScope scope = config.getModel().getScope();
        TrainingSet training = new TrainingSet();
        training.add(records, snapshots, history);

        if (scope == ModelScope.MARKET) {
            LocalDate historyStart = to.minusDays(config.getHistoryLookbackDays());
            for (Restaurant other : restaurantRepository.findAll()) {
                if (other.getId().equals(restaurant.getId())) {
                    continue;
                }
                List<DailyMetricRecord> otherRecords = aggregator.aggregate(other, historyStart, to);
                if (otherRecords.isEmpty()) {
                    continue;
                }
                Map<LocalDate, ExternalFactorSnapshot> otherSnapshots = enrichment.enrichBatch(other,
                    otherRecords.stream().map(DailyMetricRecord::getDate).toList(), cancelled);
                training.add(otherRecords, otherSnapshots, SalesHistory.of(otherRecords));
            }
        }
        if (training.skipped > 0) {
            log.warn("Training rows skipped for short history | restaurant={} | skipped={} | kept={}",
                restaurant.getName(), training.skipped, training.vectors.size());
        }

        try {
            return modelService.train(training.vectors, training.targets(), scope);
        } catch (InsufficientTrainingDataException ex) {
            log.warn("Falling back to rule-based attribution | restaurant={} | reason={}",
                restaurant.getName(), ex.getMessage());
            warnings.add("Rule-based attribution used: " + ex.getMessage());
            return null;
        }
    }

    private final class TrainingSet {
        private final List<FeatureVector> vectors = new ArrayList<>();
        private final List<Double> sales = new ArrayList<>();
        private int skipped;

        private void add(List<DailyMetricRecord> records, Map<LocalDate, ExternalFactorSnapshot> snapshots,
                         SalesHistory history) {
            for (DailyMetricRecord record : records) {
                ExternalFactorSnapshot snapshot = snapshots.get(record.getDate());
                try {
                    vectors.add(featureBuilder.build(record, snapshot, history));
                    sales.add(record.getTotalSales());
                } catch (InsufficientHistoryException ex) {
                    skipped++;
                }
            }
        }

        private double[] targets() {
            return sales.stream().mapToDouble(Double::doubleValue).toArray();
        }
    }
}
