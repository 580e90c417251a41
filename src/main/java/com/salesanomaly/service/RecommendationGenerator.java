package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.FeatureCategory;
import com.salesanomaly.dto.FeatureContribution;
import com.salesanomaly.dto.Recommendation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class RecommendationGenerator {

    static final int MAX_RECOMMENDATIONS = 3;
    static final String NO_DOMINANT_FACTOR = "No dominant factor identified; monitor the next days before acting.";

    private static final Map<FeatureCategory, CatalogEntry> CATALOG = new EnumMap<>(FeatureCategory.class);

    static {
        CATALOG.put(FeatureCategory.OPERATIONAL, new CatalogEntry(0.9,
            "Operational issue (%s) cost sales. Review opening hours, stock levels and kitchen capacity for this day.",
            "Smooth operations (%s) lifted sales. Keep the current staffing and stock routine."));
        CATALOG.put(FeatureCategory.MARKETING, new CatalogEntry(0.6,
            "Marketing (%s) underperformed. Rebalance ad spend toward campaigns with higher ROAS.",
            "Marketing (%s) drove extra sales. Consider repeating the campaign on similar days."));
        CATALOG.put(FeatureCategory.QUALITY, new CatalogEntry(0.5,
            "Service quality (%s) dragged sales down. Follow up on reviews and cancelled orders.",
            "Strong service quality (%s) supported sales. Keep monitoring ratings."));
        CATALOG.put(FeatureCategory.WEATHER, new CatalogEntry(0.2,
            "Weather (%s) reduced demand. Run rainy-day promotions and prepare delivery capacity for bad weather.",
            "Favourable weather (%s) lifted demand. Staff up on similar forecast days."));
        CATALOG.put(FeatureCategory.HOLIDAY, new CatalogEntry(0.1,
            "Holiday effect (%s) reduced sales. Plan holiday menus or reduced hours in advance.",
            "Holiday effect (%s) boosted sales. Prepare extra stock for the next occurrence."));
        CATALOG.put(FeatureCategory.TEMPORAL, new CatalogEntry(0.0,
            "Calendar pattern (%s) explains part of the drop. No action needed beyond seasonal planning.",
            "Calendar pattern (%s) favoured sales. Align promotions with this seasonality."));
        CATALOG.put(FeatureCategory.TREND, new CatalogEntry(0.3,
            "Recent sales trend (%s) is declining. Investigate what changed over the past weeks.",
            "Recent sales trend (%s) is positive. Sustain what changed over the past weeks."));
    }

    private final AnalysisConfig config;

    /**
     * At most three recommendations, one per material contribution in descending order of impact.
     * A contribution is material when its size exceeds {@code analysis.materiality-threshold} of expected sales.
     */
    public List<Recommendation> generate(List<FeatureContribution> contributions, double expectedSales) {
        double threshold = config.getMaterialityThreshold() * Math.abs(expectedSales);
        List<Recommendation> recommendations = contributions.stream()
            .filter(c -> Math.abs(c.getContribution()) > threshold)
            .sorted(Comparator.comparingDouble((FeatureContribution c) -> Math.abs(c.getContribution())).reversed())
            .limit(MAX_RECOMMENDATIONS)
            .map(this::toRecommendation)
            .toList();
        if (recommendations.isEmpty()) {
            return List.of(Recommendation.builder()
                .category(FeatureCategory.NONE)
                .message(NO_DOMINANT_FACTOR)
                .contribution(0.0)
                .estimatedRecoverableValue(0.0)
                .build());
        }
        return recommendations;
    }

    private Recommendation toRecommendation(FeatureContribution c) {
        CatalogEntry entry = CATALOG.getOrDefault(c.getCategory(), CATALOG.get(FeatureCategory.TREND));
        boolean negative = c.getContribution() < 0;
        return Recommendation.builder()
            .category(c.getCategory())
            .feature(c.getFeature())
            .message(String.format(negative ? entry.negative() : entry.positive(), c.getFeature()))
            .contribution(c.getContribution())
            .estimatedRecoverableValue(negative ? Math.abs(c.getContribution()) * entry.recoverability() : 0.0)
            .build();
    }

    static double recoverability(FeatureCategory category) {
        CatalogEntry entry = CATALOG.get(category);
        return entry != null ? entry.recoverability() : 0.0;
    }

    private record CatalogEntry(double recoverability, String negative, String positive) {}
}
