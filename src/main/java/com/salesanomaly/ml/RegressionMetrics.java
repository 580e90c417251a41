package com.salesanomaly.ml;

public final class RegressionMetrics {

    private RegressionMetrics() {
    }

    public static double meanAbsoluteError(double[] actual, double[] predicted) {
        checkLengths(actual, predicted);
        double sum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs(predicted[i] - actual[i]);
        }
        return sum / actual.length;
    }

    /** Coefficient of determination. A constant target yields 0 unless the predictions are exact. */
    public static double r2(double[] actual, double[] predicted) {
        checkLengths(actual, predicted);
        double mean = 0.0;
        for (double v : actual) {
            mean += v;
        }
        mean /= actual.length;
        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double err = actual[i] - predicted[i];
            ssRes += err * err;
            double dev = actual[i] - mean;
            ssTot += dev * dev;
        }
        if (ssTot == 0.0) {
            return ssRes == 0.0 ? 1.0 : 0.0;
        }
        return 1.0 - ssRes / ssTot;
    }

    /** Mean absolute percentage error in percent over non-zero actuals; null when every actual is zero. */
    public static Double mape(double[] actual, double[] predicted) {
        checkLengths(actual, predicted);
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] != 0.0d) {
                sum += Math.abs((predicted[i] - actual[i]) / actual[i]);
                count++;
            }
        }
        return count > 0 ? (sum / count) * 100.0 : null;
    }

    private static void checkLengths(double[] actual, double[] predicted) {
        if (actual.length == 0 || actual.length != predicted.length) {
            throw new IllegalArgumentException("Metric inputs must be non-empty and equally sized");
        }
    }
}
