package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.BacktestReport;
import com.salesanomaly.dto.DailyMetricRecord;
import com.salesanomaly.dto.ExternalFactorSnapshot;
import com.salesanomaly.dto.FeatureVector;
import com.salesanomaly.dto.ModelScope;
import com.salesanomaly.dto.WhatIfResult;
import com.salesanomaly.dto.WhatIfScenario;
import com.salesanomaly.entity.Restaurant;
import com.salesanomaly.exception.RestaurantNotFoundException;
import com.salesanomaly.ml.TrainedSalesModel;
import com.salesanomaly.repository.RestaurantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SalesInsightsServiceTest {

    @Mock RestaurantRepository restaurantRepository;
    @Mock MetricAggregatorService aggregator;
    @Mock ExternalFactorEnrichmentService enrichment;

    private final AnalysisConfig config = new AnalysisConfig();
    private SalesModelService modelService;
    private SalesInsightsService service;

    @BeforeEach
    void setUp() {
        config.getModel().setTrees(15);
        modelService = new SalesModelService(config);
        service = new SalesInsightsService(restaurantRepository, aggregator, enrichment,
            new FeatureBuilder(config), modelService, config);
    }

    @Test
    void backtest_growingFoldsPoolMetrics() {
        List<FeatureVector> rows = ModelFixtures.rows(200, 1);

        BacktestReport report = service.backtest(1L, rows, ModelFixtures.sales(rows, 2));

        assertThat(report.getFolds()).isEqualTo(4);
        // suffixes of 80, 60, 40 and 20 rows
        assertThat(report.getObservations()).isEqualTo(200);
        assertThat(report.getMae()).isPositive();
        assertThat(report.getR2()).isGreaterThan(0.5);
        assertThat(report.getMape()).isNotNull();
        assertThat(report.getFeatureImportance().values().stream().mapToDouble(Double::doubleValue).sum())
            .isCloseTo(1.0, within(1e-9));
        assertThat(report.getFeatureImportance()).containsKey("store_closed");
    }

    @Test
    void backtest_tooFewRows_reportsNoFolds() {
        List<FeatureVector> rows = ModelFixtures.rows(30, 1);

        BacktestReport report = service.backtest(1L, rows, ModelFixtures.sales(rows, 2));

        assertThat(report.getFolds()).isZero();
        assertThat(report.getMae()).isNull();
        assertThat(report.getR2()).isNull();
        assertThat(report.getFeatureImportance()).isEmpty();
    }

    @Test
    void backtest_skipsFoldsWithShortSuffix() {
        config.getBacktest().setMinTestRows(30);
        List<FeatureVector> rows = ModelFixtures.rows(100, 1);

        BacktestReport report = service.backtest(1L, rows, ModelFixtures.sales(rows, 2));

        // cuts at 60, 70, 80, 90 leave suffixes of 40, 30, 20, 10
        assertThat(report.getFolds()).isEqualTo(2);
        assertThat(report.getObservations()).isEqualTo(70);
    }

    @Test
    void backtest_byRestaurant_buildsRowsFromStore() {
        Restaurant restaurant = Restaurant.builder().id(1L).name("Healthy Fit").build();
        LocalDate to = LocalDate.of(2025, 6, 30);
        LocalDate start = to.minusDays(99);
        double[] sales = new double[100];
        for (int i = 0; i < sales.length; i++) {
            sales[i] = i % 7 == 6 ? 1_300_000 : 1_000_000;
        }
        List<DailyMetricRecord> records = TestData.series(start, sales);
        Map<LocalDate, ExternalFactorSnapshot> snapshots = new HashMap<>();
        records.forEach(r -> snapshots.put(r.getDate(), TestData.dryDay(r.getDate())));
        when(restaurantRepository.findById(1L)).thenReturn(Optional.of(restaurant));
        when(aggregator.aggregate(eq(restaurant), any(), eq(to))).thenReturn(records);
        when(enrichment.enrichBatch(eq(restaurant), anyCollection(), any())).thenReturn(snapshots);

        BacktestReport report = service.backtest(1L, to);

        // 7 rows lack history, leaving 93 for folds cut at 55, 65, 74 and 83
        assertThat(report.getFolds()).isEqualTo(4);
        assertThat(report.getObservations()).isEqualTo(38 + 28 + 19 + 10);
        assertThat(report.getMape()).isNotNull();
    }

    @Test
    void backtest_unknownRestaurant_throws() {
        when(restaurantRepository.findById(3L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.backtest(3L, LocalDate.of(2025, 6, 30)))
            .isInstanceOf(RestaurantNotFoundException.class);
    }

    @Test
    void whatIf_overridesFeaturesAndReportsDelta() {
        List<FeatureVector> rows = ModelFixtures.rows(200, 1);
        TrainedSalesModel model = modelService.train(rows, ModelFixtures.sales(rows, 2), ModelScope.RESTAURANT);
        FeatureVector day = rows.get(1);

        WhatIfResult result = service.whatIf(model, day, List.of(
            WhatIfScenario.builder().name("closed").overrides(Map.of("store_closed", 1.0)).build(),
            WhatIfScenario.builder().overrides(Map.of()).build()));

        assertThat(result.getBasePrediction()).isEqualTo(model.predict(day));
        assertThat(result.getScenarios()).hasSize(2);
        assertThat(result.getScenarios().get(0).getName()).isEqualTo("closed");
        assertThat(result.getScenarios().get(0).getDelta()).isLessThan(-result.getBasePrediction() * 0.5);
        assertThat(result.getScenarios().get(1).getName()).isEqualTo("scenario-2");
        assertThat(result.getScenarios().get(1).getDelta()).isZero();
    }

    @Test
    void whatIf_unknownFeature_throws() {
        List<FeatureVector> rows = ModelFixtures.rows(120, 1);
        TrainedSalesModel model = modelService.train(rows, ModelFixtures.sales(rows, 2), ModelScope.RESTAURANT);

        assertThatThrownBy(() -> service.whatIf(model, rows.get(0), List.of(
                WhatIfScenario.builder().name("bad").overrides(Map.of("footfall", 3.0)).build())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("footfall");
    }

    @Test
    void whatIf_overrideWithoutValue_throws() {
        List<FeatureVector> rows = ModelFixtures.rows(120, 1);
        TrainedSalesModel model = modelService.train(rows, ModelFixtures.sales(rows, 2), ModelScope.RESTAURANT);
        Map<String, Double> overrides = new HashMap<>();
        overrides.put("precipitation", null);

        assertThatThrownBy(() -> service.whatIf(model, rows.get(0), List.of(
                WhatIfScenario.builder().name("blank").overrides(overrides).build())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("precipitation");
    }
}
