package com.salesanomaly.service;

import com.salesanomaly.dto.FeatureVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Synthetic feature rows whose sales are driven by closures and rain. */
final class ModelFixtures {

    static final double BASE_SALES = 1_000_000;

    private ModelFixtures() {
    }

    static List<FeatureVector> rows(int n, long seed) {
        Random rnd = new Random(seed);
        List<FeatureVector> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double[] v = new double[FeatureBuilder.FEATURE_NAMES.size()];
            v[0] = i % 7;
            v[1] = 1 + (i / 30) % 12;
            v[2] = i % 7 >= 5 ? 1 : 0;
            v[3] = i % 10 == 0 ? 1 : 0;
            v[6] = 4.5 + rnd.nextDouble() * 0.4;
            v[7] = rnd.nextDouble() * 0.05;
            v[8] = 50_000 + rnd.nextDouble() * 10_000;
            v[9] = 3 + rnd.nextDouble();
            v[12] = 26 + rnd.nextDouble() * 4;
            v[13] = rnd.nextDouble() < 0.3 ? rnd.nextDouble() * 20 : 0.0;
            v[14] = rnd.nextDouble() * 12;
            v[15] = v[13];
            v[18] = BASE_SALES;
            v[19] = BASE_SALES;
            out.add(new FeatureVector(FeatureBuilder.FEATURE_NAMES, v));
        }
        return out;
    }

    static double[] sales(List<FeatureVector> rows, long seed) {
        Random rnd = new Random(seed);
        double[] y = new double[rows.size()];
        for (int i = 0; i < y.length; i++) {
            FeatureVector r = rows.get(i);
            double closed = r.get("store_closed");
            double rain = r.get("precipitation");
            y[i] = closed > 0 ? 0.0 : BASE_SALES - 15_000 * rain + rnd.nextGaussian() * 10_000;
        }
        return y;
    }

    static double[] noise(int n, long seed) {
        Random rnd = new Random(seed);
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = BASE_SALES + rnd.nextGaussian() * 100_000;
        }
        return y;
    }

    static FeatureVector closedRainyDay() {
        double[] v = rows(1, 99).get(0).toArray();
        v[3] = 1;
        v[13] = 18;
        v[15] = 18;
        return new FeatureVector(FeatureBuilder.FEATURE_NAMES, v);
    }
}
