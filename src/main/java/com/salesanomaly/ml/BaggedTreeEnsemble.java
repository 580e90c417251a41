package com.salesanomaly.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Bootstrap-aggregated regression trees. Tree {@code t} draws its bootstrap sample from
 * {@code new Random(seed + t)}, so the same data and seed always produce the same ensemble.
 */
public final class BaggedTreeEnsemble {

    private final List<RegressionTree> trees;
    private final int featureCount;

    private BaggedTreeEnsemble(List<RegressionTree> trees, int featureCount) {
        this.trees = List.copyOf(trees);
        this.featureCount = featureCount;
    }

    public static BaggedTreeEnsemble fit(double[][] x, double[] y, TreeParameters params, int treeCount, long seed) {
        if (x.length == 0 || x.length != y.length) {
            throw new IllegalArgumentException("Training matrix has " + x.length + " rows and target has " + y.length);
        }
        int n = x.length;
        List<RegressionTree> trees = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            Random rnd = new Random(seed + t);
            int[] bootstrap = new int[n];
            for (int i = 0; i < n; i++) {
                bootstrap[i] = rnd.nextInt(n);
            }
            trees.add(RegressionTree.fit(x, y, bootstrap, params, rnd));
        }
        return new BaggedTreeEnsemble(trees, x[0].length);
    }

    public double predict(double[] row) {
        if (row.length != featureCount) {
            throw new IllegalArgumentException("Expected " + featureCount + " features, got " + row.length);
        }
        double sum = 0.0;
        for (RegressionTree tree : trees) {
            sum += tree.predict(row);
        }
        return sum / trees.size();
    }

    /** Impurity decrease per feature averaged over trees, normalized to sum to 1 (all zeros if no split was made). */
    public double[] featureImportances() {
        double[] total = new double[featureCount];
        for (RegressionTree tree : trees) {
            double[] imp = tree.impurityDecrease();
            double treeSum = 0.0;
            for (double v : imp) {
                treeSum += v;
            }
            if (treeSum <= 0.0) {
                continue;
            }
            for (int i = 0; i < featureCount; i++) {
                total[i] += imp[i] / treeSum;
            }
        }
        double sum = 0.0;
        for (double v : total) {
            sum += v;
        }
        if (sum > 0.0) {
            for (int i = 0; i < featureCount; i++) {
                total[i] /= sum;
            }
        }
        return total;
    }

    public int size() {
        return trees.size();
    }

    public int featureCount() {
        return featureCount;
    }
}
