package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.FeatureCategory;
import com.salesanomaly.dto.FeatureContribution;
import com.salesanomaly.dto.Recommendation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RecommendationGeneratorTest {

    private final RecommendationGenerator generator = new RecommendationGenerator(new AnalysisConfig());

    private static FeatureContribution c(String feature, double amount) {
        return FeatureContribution.builder()
            .feature(feature).category(FeatureBuilder.categoryOf(feature)).value(1.0).contribution(amount).build();
    }

    @Test
    void generate_topThreeMaterialContributions() {
        List<FeatureContribution> contributions = List.of(
            c("precipitation", -120_000),
            c("store_closed", -600_000),
            c("rating", -60_000),
            c("sales_mean_7d", 80_000),
            c("month", -10_000));

        List<Recommendation> recs = generator.generate(contributions, 1_000_000);

        assertThat(recs).extracting(Recommendation::getFeature)
            .containsExactly("store_closed", "precipitation", "sales_mean_7d");
        assertThat(recs.get(0).getCategory()).isEqualTo(FeatureCategory.OPERATIONAL);
        assertThat(recs.get(0).getEstimatedRecoverableValue()).isCloseTo(540_000, within(1e-6));
        assertThat(recs.get(1).getEstimatedRecoverableValue()).isCloseTo(24_000, within(1e-6));
        assertThat(recs.get(2).getEstimatedRecoverableValue()).isZero();
        assertThat(recs.get(0).getMessage()).contains("store_closed");
    }

    @Test
    void generate_nothingMaterial_returnsSingleNoDominantFactor() {
        List<Recommendation> recs = generator.generate(List.of(c("temperature", -20_000), c("month", 30_000)), 1_000_000);

        assertThat(recs).singleElement().satisfies(r -> {
            assertThat(r.getCategory()).isEqualTo(FeatureCategory.NONE);
            assertThat(r.getMessage()).isEqualTo(RecommendationGenerator.NO_DOMINANT_FACTOR);
            assertThat(r.getEstimatedRecoverableValue()).isZero();
        });
    }

    @Test
    void generate_emptyContributions_returnsNoDominantFactor() {
        assertThat(generator.generate(List.of(), 500_000)).hasSize(1);
    }

    @Test
    void recoverability_perCategory() {
        assertThat(RecommendationGenerator.recoverability(FeatureCategory.OPERATIONAL)).isEqualTo(0.9);
        assertThat(RecommendationGenerator.recoverability(FeatureCategory.MARKETING)).isEqualTo(0.6);
        assertThat(RecommendationGenerator.recoverability(FeatureCategory.QUALITY)).isEqualTo(0.5);
        assertThat(RecommendationGenerator.recoverability(FeatureCategory.WEATHER)).isEqualTo(0.2);
        assertThat(RecommendationGenerator.recoverability(FeatureCategory.HOLIDAY)).isEqualTo(0.1);
        assertThat(RecommendationGenerator.recoverability(FeatureCategory.TEMPORAL)).isZero();
        assertThat(RecommendationGenerator.recoverability(FeatureCategory.TREND)).isEqualTo(0.3);
        assertThat(RecommendationGenerator.recoverability(FeatureCategory.NONE)).isZero();
    }
}
