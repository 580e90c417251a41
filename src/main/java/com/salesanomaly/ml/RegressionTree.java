package com.salesanomaly.ml;

import java.util.Arrays;
import java.util.Random;

/**
 * CART regression tree grown by greedy variance reduction. Leaves predict the mean target of the
 * samples that reach them. Instances are immutable after {@link #fit}.
 */
public final class RegressionTree {

    private final Node root;
    private final double[] impurityDecrease;

    private RegressionTree(Node root, double[] impurityDecrease) {
        this.root = root;
        this.impurityDecrease = impurityDecrease;
    }

    public static RegressionTree fit(double[][] x, double[] y, int[] samples, TreeParameters params, Random rnd) {
        if (samples.length == 0) {
            throw new IllegalArgumentException("Cannot fit a tree on zero samples");
        }
        int featureCount = x[0].length;
        double[] importance = new double[featureCount];
        Builder builder = new Builder(x, y, params, rnd, importance);
        Node root = builder.grow(samples.clone(), 0);
        return new RegressionTree(root, importance);
    }

    public double predict(double[] row) {
        Node node = root;
        while (!node.isLeaf()) {
            node = row[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.value;
    }

    double[] impurityDecrease() {
        return impurityDecrease.clone();
    }

    private static final class Node {
        private final int feature;
        private final double threshold;
        private final Node left;
        private final Node right;
        private final double value;

        private Node(double value) {
            this(-1, Double.NaN, null, null, value);
        }

        private Node(int feature, double threshold, Node left, Node right, double value) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.value = value;
        }

        private boolean isLeaf() {
            return left == null;
        }
    }

    private record Split(int feature, double threshold, double gain) {}

    private static final class Builder {
        private final double[][] x;
        private final double[] y;
        private final TreeParameters params;
        private final Random rnd;
        private final double[] importance;
        private final int featureCount;

        private Builder(double[][] x, double[] y, TreeParameters params, Random rnd, double[] importance) {
            this.x = x;
            this.y = y;
            this.params = params;
            this.rnd = rnd;
            this.importance = importance;
            this.featureCount = x[0].length;
        }

        private Node grow(int[] samples, int depth) {
            double mean = mean(samples);
            if (depth >= params.maxDepth() || samples.length < params.minSamplesSplit()) {
                return new Node(mean);
            }
            Split best = findBestSplit(samples);
            if (best == null || best.gain() <= 1e-12) {
                return new Node(mean);
            }

            int leftCount = 0;
            for (int s : samples) {
                if (x[s][best.feature()] <= best.threshold()) {
                    leftCount++;
                }
            }
            int[] left = new int[leftCount];
            int[] right = new int[samples.length - leftCount];
            int li = 0;
            int ri = 0;
            for (int s : samples) {
                if (x[s][best.feature()] <= best.threshold()) {
                    left[li++] = s;
                } else {
                    right[ri++] = s;
                }
            }
            importance[best.feature()] += best.gain();
            return new Node(best.feature(), best.threshold(),
                grow(left, depth + 1), grow(right, depth + 1), mean);
        }

        private Split findBestSplit(int[] samples) {
            int n = samples.length;
            double total = 0.0;
            double totalSq = 0.0;
            for (int s : samples) {
                total += y[s];
                totalSq += y[s] * y[s];
            }
            double parentSse = totalSq - total * total / n;

            Split best = null;
            Integer[] order = new Integer[n];
            for (int f : candidateFeatures()) {
                for (int i = 0; i < n; i++) {
                    order[i] = samples[i];
                }
                final int feature = f;
                Arrays.sort(order, (a, b) -> Double.compare(x[a][feature], x[b][feature]));

                double leftSum = 0.0;
                double leftSq = 0.0;
                for (int i = 0; i < n - 1; i++) {
                    double v = y[order[i]];
                    leftSum += v;
                    leftSq += v * v;
                    int leftN = i + 1;
                    int rightN = n - leftN;
                    if (leftN < params.minSamplesLeaf() || rightN < params.minSamplesLeaf()) {
                        continue;
                    }
                    double current = x[order[i]][feature];
                    double next = x[order[i + 1]][feature];
                    if (current == next) {
                        continue;
                    }
                    double rightSum = total - leftSum;
                    double rightSq = totalSq - leftSq;
                    double sse = (leftSq - leftSum * leftSum / leftN) + (rightSq - rightSum * rightSum / rightN);
                    double gain = parentSse - sse;
                    if (best == null || gain > best.gain()) {
                        best = new Split(feature, (current + next) / 2.0, gain);
                    }
                }
            }
            return best;
        }

        private int[] candidateFeatures() {
            int k = params.featuresPerSplit(featureCount);
            int[] all = new int[featureCount];
            for (int i = 0; i < featureCount; i++) {
                all[i] = i;
            }
            if (k >= featureCount) {
                return all;
            }
            // partial Fisher-Yates
            for (int i = 0; i < k; i++) {
                int j = i + rnd.nextInt(featureCount - i);
                int tmp = all[i];
                all[i] = all[j];
                all[j] = tmp;
            }
            return Arrays.copyOf(all, k);
        }

        private double mean(int[] samples) {
            double sum = 0.0;
            for (int s : samples) {
                sum += y[s];
            }
            return sum / samples.length;
        }
    }
}
