package com.salesanomaly.ml;

public record TreeParameters(int maxDepth, int minSamplesSplit, int minSamplesLeaf, double maxFeaturesFraction) {

    public TreeParameters {
        if (maxDepth < 1 || minSamplesSplit < 2 || minSamplesLeaf < 1) {
            throw new IllegalArgumentException("Invalid tree parameters: depth=" + maxDepth
                + ", split=" + minSamplesSplit + ", leaf=" + minSamplesLeaf);
        }
        if (maxFeaturesFraction <= 0.0 || maxFeaturesFraction > 1.0) {
            throw new IllegalArgumentException("maxFeaturesFraction must be in (0, 1]");
        }
    }

    int featuresPerSplit(int featureCount) {
        return Math.max(1, (int) Math.ceil(featureCount * maxFeaturesFraction));
    }
}
