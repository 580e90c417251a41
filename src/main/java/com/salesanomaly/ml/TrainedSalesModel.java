package com.salesanomaly.ml;

import com.salesanomaly.dto.FeatureVector;
import com.salesanomaly.dto.ModelQuality;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A deployed expected-sales model: the ensemble, the feature schema it was trained on, the
 * training-set feature means used as the attribution reference, and its validation quality.
 * Immutable, so concurrent predictions need no locking.
 */
public final class TrainedSalesModel {

    private final String version;
    private final List<String> featureNames;
    private final BaggedTreeEnsemble ensemble;
    private final double[] background;
    private final ModelQuality quality;

    public TrainedSalesModel(String version, List<String> featureNames, BaggedTreeEnsemble ensemble,
                             double[] background, ModelQuality quality) {
        if (featureNames.size() != ensemble.featureCount() || background.length != featureNames.size()) {
            throw new IllegalArgumentException("Feature schema, ensemble and background sizes differ");
        }
        this.version = version;
        this.featureNames = List.copyOf(featureNames);
        this.ensemble = ensemble;
        this.background = background.clone();
        this.quality = quality;
    }

    public double predict(FeatureVector vector) {
        if (!vector.hasSameSchema(featureNames)) {
            throw new IllegalArgumentException("Feature vector schema " + vector.names()
                + " does not match model schema " + featureNames);
        }
        return ensemble.predict(vector.toArray());
    }

    public double predictRaw(double[] row) {
        return ensemble.predict(row);
    }

    public FeatureVector referenceVector() {
        return new FeatureVector(featureNames, background);
    }

    public Map<String, Double> featureImportance() {
        double[] imp = ensemble.featureImportances();
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < imp.length; i++) {
            map.put(featureNames.get(i), imp[i]);
        }
        return map;
    }

    public String version() {
        return version;
    }

    public List<String> featureNames() {
        return featureNames;
    }

    public ModelQuality quality() {
        return quality;
    }
}
