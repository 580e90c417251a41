package com.salesanomaly.config;

import com.salesanomaly.dto.ModelScope;
import com.salesanomaly.dto.Severity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Thresholds and tuning knobs for one analysis run. Every constant the detector, feature builder,
 * model and attribution engine rely on is bound from the {@code analysis.*} namespace.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "analysis")
@Data
public class AnalysisConfig {

    /** Trailing baseline window in observations; 0 uses all prior history. */
    @Min(0)
    private int baselineWindowDays = 0;

    @Min(2)
    private int minBaselineObservations = 10;

    private double criticalSigma = 2.0;
    private double badSigma = 1.0;
    private double watchSigma = 0.5;
    private double criticalPercentile = 5.0;
    private Severity flagMinSeverity = Severity.WATCH;

    @Min(1)
    private int minHistoryDays = 7;

    @DecimalMin("0.0")
    private double materialityThreshold = 0.05;

    @Min(30)
    private int historyLookbackDays = 730;

    @Min(1)
    private int workerThreads = 4;

    private double defaultHolidayImpactWeight = -0.2;
    private Map<String, Double> holidayImpactWeights = new LinkedHashMap<>(Map.of(
        "balinese", -0.26,
        "hindu", -0.26,
        "muslim", -0.28,
        "national", -0.28,
        "christian", -0.30,
        "international", 0.12,
        "observance", -0.05
    ));

    private Map<String, Double> zoneWeatherSensitivity = new LinkedHashMap<>(Map.of(
        "Beach", 1.3,
        "Central", 1.0,
        "Mountain", 1.2,
        "Urban", 1.0
    ));

    @Valid
    private Enrichment enrichment = new Enrichment();
    @Valid
    private Model model = new Model();
    @Valid
    private Attribution attribution = new Attribution();
    @Valid
    private Backtest backtest = new Backtest();

    public double holidayWeight(String category) {
        if (category == null) {
            return defaultHolidayImpactWeight;
        }
        return holidayImpactWeights.getOrDefault(category.toLowerCase(Locale.ROOT), defaultHolidayImpactWeight);
    }

    public double zoneSensitivity(String zone) {
        if (zone == null) {
            return 1.0;
        }
        return zoneWeatherSensitivity.getOrDefault(zone, 1.0);
    }

    @Data
    public static class Enrichment {
        private double defaultLatitude = -8.4095;
        private double defaultLongitude = 115.1889;
        private String defaultZone = "Central";
        private double defaultTemperature = 28.0;
        private double defaultWindSpeed = 0.0;
        @Min(0)
        private int coordinatePrecision = 2;
    }

    @Data
    public static class Model {
        private ModelScope scope = ModelScope.RESTAURANT;
        @Min(1)
        private int trees = 100;
        @Min(1)
        private int maxDepth = 12;
        @Min(2)
        private int minSamplesSplit = 10;
        @Min(1)
        private int minSamplesLeaf = 5;
        @DecimalMin("0.05")
        private double maxFeaturesFraction = 1.0;
        private long seed = 42L;
        @Min(1)
        private int minTrainingRows = 100;
        private double validationFraction = 0.2;
        private double lowConfidenceR2 = 0.3;
    }

    @Data
    public static class Attribution {
        @Min(1)
        private int permutations = 64;
        @Min(1)
        private int topN = 10;
        private double predictionFloor = 1.0;
        private double implausibleMultiple = 5.0;
        private long seed = 7L;
    }

    @Data
    public static class Backtest {
        @Min(1)
        private int folds = 4;
        @Min(2)
        private int minTrainRows = 30;
        @Min(1)
        private int minTestRows = 7;
    }
}
