package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.DailyMetricRecord;
import com.salesanomaly.dto.ExternalFactorSnapshot;
import com.salesanomaly.dto.FeatureCategory;
import com.salesanomaly.dto.FeatureVector;
import com.salesanomaly.dto.OperationalFlags;
import com.salesanomaly.exception.InsufficientHistoryException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a merged day and its external context into the model's feature vector. Every vector has
 * {@link #FEATURE_NAMES} in that order.
 */
@Component
@RequiredArgsConstructor
public class FeatureBuilder {

    public static final List<String> FEATURE_NAMES = List.of(
        "day_of_week", "month", "is_weekend",
        "store_closed", "out_of_stock", "store_overloaded",
        "rating", "cancellation_rate",
        "marketing_spend", "roas",
        "prep_time", "delivery_time",
        "temperature", "precipitation", "wind_speed", "rain_zone_exposure",
        "is_holiday", "holiday_impact_weight",
        "sales_mean_7d", "sales_mean_30d");

    private static final Map<String, FeatureCategory> CATEGORIES = Map.ofEntries(
        Map.entry("day_of_week", FeatureCategory.TEMPORAL),
        Map.entry("month", FeatureCategory.TEMPORAL),
        Map.entry("is_weekend", FeatureCategory.TEMPORAL),
        Map.entry("store_closed", FeatureCategory.OPERATIONAL),
        Map.entry("out_of_stock", FeatureCategory.OPERATIONAL),
        Map.entry("store_overloaded", FeatureCategory.OPERATIONAL),
        Map.entry("rating", FeatureCategory.QUALITY),
        Map.entry("cancellation_rate", FeatureCategory.QUALITY),
        Map.entry("marketing_spend", FeatureCategory.MARKETING),
        Map.entry("roas", FeatureCategory.MARKETING),
        Map.entry("prep_time", FeatureCategory.OPERATIONAL),
        Map.entry("delivery_time", FeatureCategory.OPERATIONAL),
        Map.entry("temperature", FeatureCategory.WEATHER),
        Map.entry("precipitation", FeatureCategory.WEATHER),
        Map.entry("wind_speed", FeatureCategory.WEATHER),
        Map.entry("rain_zone_exposure", FeatureCategory.WEATHER),
        Map.entry("is_holiday", FeatureCategory.HOLIDAY),
        Map.entry("holiday_impact_weight", FeatureCategory.HOLIDAY),
        Map.entry("sales_mean_7d", FeatureCategory.TREND),
        Map.entry("sales_mean_30d", FeatureCategory.TREND));

    private final AnalysisConfig config;

    public static FeatureCategory categoryOf(String feature) {
        return CATEGORIES.getOrDefault(feature, FeatureCategory.NONE);
    }

    /**
     * @throws InsufficientHistoryException when fewer than {@code analysis.min-history-days}
     *         observations precede the record's date
     */
    public FeatureVector build(DailyMetricRecord record, ExternalFactorSnapshot snapshot, SalesHistory history) {
        LocalDate date = record.getDate();
        int prior = history.countBefore(date);
        if (prior < config.getMinHistoryDays()) {
            throw new InsufficientHistoryException(date, prior, config.getMinHistoryDays());
        }
        return assemble(record, snapshot, history.meanOfLast(date, 7), history.meanOfLast(date, 30));
    }

    /** Same as {@link #build} with both sales lags set to 0. */
    public FeatureVector buildWithImputedLags(DailyMetricRecord record, ExternalFactorSnapshot snapshot) {
        return assemble(record, snapshot, 0.0, 0.0);
    }

    private FeatureVector assemble(DailyMetricRecord record, ExternalFactorSnapshot snapshot,
                                   double mean7, double mean30) {
        LocalDate date = record.getDate();
        DayOfWeek dow = date.getDayOfWeek();
        OperationalFlags flags = record.getOperationalFlags() != null ? record.getOperationalFlags() : OperationalFlags.NONE;

        Map<String, Double> f = new LinkedHashMap<>();
        f.put("day_of_week", (double) (dow.getValue() - 1));
        f.put("month", (double) date.getMonthValue());
        f.put("is_weekend", indicator(dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY));
        f.put("store_closed", indicator(flags.closed()));
        f.put("out_of_stock", indicator(flags.outOfStock()));
        f.put("store_overloaded", indicator(flags.overloaded()));
        f.put("rating", orZero(record.getRating()));
        f.put("cancellation_rate", orZero(record.getCancellationRate()));
        f.put("marketing_spend", record.getMarketingSpend());
        f.put("roas", orZero(record.getRoas()));
        f.put("prep_time", orZero(record.getPrepTime()));
        f.put("delivery_time", orZero(record.getDeliveryTime()));
        f.put("temperature", snapshot.getTemperature());
        f.put("precipitation", snapshot.getPrecipitation());
        f.put("wind_speed", snapshot.getWindSpeed());
        f.put("rain_zone_exposure", snapshot.getPrecipitation() * config.zoneSensitivity(snapshot.getZone()));
        f.put("is_holiday", indicator(snapshot.isHoliday()));
        f.put("holiday_impact_weight", snapshot.isHoliday() ? snapshot.getHolidayImpactWeight() : 0.0);
        f.put("sales_mean_7d", mean7);
        f.put("sales_mean_30d", mean30);
        return FeatureVector.of(f);
    }

    private static double indicator(boolean b) {
        return b ? 1.0 : 0.0;
    }

    private static double orZero(Double v) {
        return v != null && Double.isFinite(v) ? v : 0.0;
    }
}
