package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.FeatureVector;
import com.salesanomaly.dto.ModelQuality;
import com.salesanomaly.dto.ModelScope;
import com.salesanomaly.exception.InsufficientTrainingDataException;
import com.salesanomaly.ml.BaggedTreeEnsemble;
import com.salesanomaly.ml.RegressionMetrics;
import com.salesanomaly.ml.TrainedSalesModel;
import com.salesanomaly.ml.TreeParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Trains expected-sales models. Training runs one at a time; callers predict through the returned
 * {@link TrainedSalesModel}, which is immutable and safe to share across threads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SalesModelService {

    private final AnalysisConfig config;

    private final ReentrantLock trainingLock = new ReentrantLock();
    private final AtomicInteger versionCounter = new AtomicInteger();

    /**
     * Evaluates on a seeded 80/20 split, then returns a model retrained on every row.
     *
     * @throws InsufficientTrainingDataException below {@code analysis.model.min-training-rows}
     */
    public TrainedSalesModel train(List<FeatureVector> vectors, double[] sales, ModelScope scope) {
        AnalysisConfig.Model cfg = config.getModel();
        if (vectors.size() < cfg.getMinTrainingRows()) {
            throw new InsufficientTrainingDataException(vectors.size(), cfg.getMinTrainingRows());
        }
        trainingLock.lock();
        try {
            List<String> names = checkSchema(vectors, sales);
            double[][] x = toMatrix(vectors);
            int n = x.length;

            int[] order = shuffledIndices(n, new Random(cfg.getSeed()));
            int validationRows = Math.max(1, (int) Math.round(n * cfg.getValidationFraction()));
            int trainRows = n - validationRows;
            double[][] trainX = new double[trainRows][];
            double[] trainY = new double[trainRows];
            for (int i = 0; i < trainRows; i++) {
                trainX[i] = x[order[i]];
                trainY[i] = sales[order[i]];
            }
            BaggedTreeEnsemble holdout = fitEnsemble(trainX, trainY);
            double[] actual = new double[validationRows];
            double[] predicted = new double[validationRows];
            for (int i = 0; i < validationRows; i++) {
                int row = order[trainRows + i];
                actual[i] = sales[row];
                predicted[i] = holdout.predict(x[row]);
            }
            double r2 = RegressionMetrics.r2(actual, predicted);
            double mae = RegressionMetrics.meanAbsoluteError(actual, predicted);
            boolean lowConfidence = r2 < cfg.getLowConfidenceR2();

            ModelQuality quality = ModelQuality.builder()
                .r2(r2)
                .meanAbsoluteError(mae)
                .trainingRows(trainRows)
                .validationRows(validationRows)
                .lowConfidence(lowConfidence)
                .scope(scope)
                .trainedAt(Instant.now())
                .build();

            TrainedSalesModel model = new TrainedSalesModel(nextVersion(), names, fitEnsemble(x, sales),
                columnMeans(x), quality);
            if (lowConfidence) {
                log.warn("Model trained with low confidence | version={} | scope={} | rows={} | r2={} | mae={}",
                    model.version(), scope, n, String.format("%.3f", r2), String.format("%.2f", mae));
            } else {
                log.info("Model trained | version={} | scope={} | rows={} | r2={} | mae={}",
                    model.version(), scope, n, String.format("%.3f", r2), String.format("%.2f", mae));
            }
            return model;
        } finally {
            trainingLock.unlock();
        }
    }

    /**
     * Fits on every row without the minimum-row gate or a validation split. Used for evaluation
     * folds; versions are prefixed {@code eval-}.
     */
    public TrainedSalesModel fitForEvaluation(List<FeatureVector> vectors, double[] sales) {
        trainingLock.lock();
        try {
            List<String> names = checkSchema(vectors, sales);
            double[][] x = toMatrix(vectors);
            ModelQuality quality = ModelQuality.builder()
                .trainingRows(x.length)
                .scope(config.getModel().getScope())
                .trainedAt(Instant.now())
                .build();
            return new TrainedSalesModel("eval-" + versionCounter.incrementAndGet(), names,
                fitEnsemble(x, sales), columnMeans(x), quality);
        } finally {
            trainingLock.unlock();
        }
    }

    private BaggedTreeEnsemble fitEnsemble(double[][] x, double[] y) {
        AnalysisConfig.Model cfg = config.getModel();
        TreeParameters params = new TreeParameters(cfg.getMaxDepth(), cfg.getMinSamplesSplit(),
            cfg.getMinSamplesLeaf(), cfg.getMaxFeaturesFraction());
        return BaggedTreeEnsemble.fit(x, y, params, cfg.getTrees(), cfg.getSeed());
    }

    private String nextVersion() {
        return "model-" + versionCounter.incrementAndGet();
    }

    private static List<String> checkSchema(List<FeatureVector> vectors, double[] sales) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("No training rows");
        }
        if (vectors.size() != sales.length) {
            throw new IllegalArgumentException("Got " + vectors.size() + " feature rows and " + sales.length + " targets");
        }
        List<String> names = vectors.get(0).names();
        for (FeatureVector v : vectors) {
            if (!v.hasSameSchema(names)) {
                throw new IllegalArgumentException("Inconsistent feature schema: " + v.names() + " vs " + names);
            }
        }
        return names;
    }

    private static double[][] toMatrix(List<FeatureVector> vectors) {
        double[][] x = new double[vectors.size()][];
        for (int i = 0; i < x.length; i++) {
            x[i] = vectors.get(i).toArray();
        }
        return x;
    }

    private static double[] columnMeans(double[][] x) {
        double[] means = new double[x[0].length];
        for (double[] row : x) {
            for (int j = 0; j < row.length; j++) {
                means[j] += row[j];
            }
        }
        for (int j = 0; j < means.length; j++) {
            means[j] /= x.length;
        }
        return means;
    }

    private static int[] shuffledIndices(int n, Random rnd) {
        int[] idx = new int[n];
        for (int i = 0; i < n; i++) {
            idx[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
        }
        return idx;
    }
}
