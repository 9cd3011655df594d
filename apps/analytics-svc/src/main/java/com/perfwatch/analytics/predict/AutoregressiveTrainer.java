package com.perfwatch.analytics.predict;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.error.ModelTrainingException;
import com.perfwatch.analytics.stats.SampleStatistics;
import java.time.Clock;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fits an {@link AutoregressiveModel} by seeded mini-batch gradient descent on mean squared
 * error. The last {@code validationSplit} share of windows is held out in time order.
 */
@Component
public class AutoregressiveTrainer {

    private static final Logger log = LoggerFactory.getLogger(AutoregressiveTrainer.class);
    private static final int MIN_WINDOWS_FOR_VALIDATION = 5;

    private final AnalyticsProperties.Training training;
    private final Clock clock;

    public AutoregressiveTrainer(AnalyticsProperties properties, Clock analyticsClock) {
        this.training = properties.training();
        this.clock = analyticsClock;
    }

    public AutoregressiveModel train(double[] values, int windowSize, CancellationToken token) {
        SampleStatistics.requireFinite(values, "series");
        MinMaxScaler scaler = MinMaxScaler.fit(values);
        SupervisedWindows windows = SupervisedWindows.prepare(scaler.normalize(values), windowSize);
        int total = windows.size();
        int validationCount = total >= MIN_WINDOWS_FOR_VALIDATION
                ? (int) Math.floor(total * training.validationSplit())
                : 0;
        int trainCount = total - validationCount;

        double[][] features = new double[total][];
        double[] targets = new double[total];
        for (int i = 0; i < total; i++) {
            double[] window = windows.input(i);
            features[i] = deltas(window);
            targets[i] = windows.target(i) - window[window.length - 1];
        }

        Random random = new Random(training.seed());
        double[] weights = new double[windowSize - 1];
        for (int j = 0; j < weights.length; j++) {
            weights[j] = random.nextGaussian() * 0.01;
        }
        double[] bias = {0d};
        int[] order = new int[trainCount];
        for (int i = 0; i < trainCount; i++) {
            order[i] = i;
        }

        double loss = Double.NaN;
        for (int epoch = 1; epoch <= training.epochs(); epoch++) {
            token.throwIfCancelled();
            shuffle(order, random);
            for (int start = 0; start < trainCount; start += training.batchSize()) {
                int end = Math.min(trainCount, start + training.batchSize());
                step(features, targets, order, start, end, weights, bias);
            }
            loss = meanSquaredError(features, targets, 0, trainCount, weights, bias[0]);
            if (!Double.isFinite(loss)) {
                throw new ModelTrainingException("training diverged at epoch " + epoch + " (loss=" + loss + ")");
            }
        }

        Double validationRmse = null;
        if (validationCount > 0) {
            double validationMse = meanSquaredError(features, targets, trainCount, total, weights, bias[0]);
            validationRmse = Math.sqrt(validationMse) * scaler.range();
        }
        log.debug("Trained autoregressive model: window={} windows={} loss={} validationRmse={}",
                windowSize, total, loss, validationRmse);
        return new AutoregressiveModel(weights, bias[0], scaler, windowSize, loss, validationRmse,
                values.length, clock.instant());
    }

    private void step(double[][] features, double[] targets, int[] order, int start, int end,
                      double[] weights, double[] bias) {
        double[] gradient = new double[weights.length];
        double biasGradient = 0d;
        int batch = end - start;
        for (int b = start; b < end; b++) {
            int sample = order[b];
            double error = predict(features[sample], weights, bias[0]) - targets[sample];
            for (int j = 0; j < weights.length; j++) {
                gradient[j] += 2d * error * features[sample][j] / batch;
            }
            biasGradient += 2d * error / batch;
        }
        double learningRate = training.learningRate();
        for (int j = 0; j < weights.length; j++) {
            weights[j] -= learningRate * gradient[j];
        }
        bias[0] -= learningRate * biasGradient;
    }

    private static double meanSquaredError(double[][] features, double[] targets, int from, int to,
                                           double[] weights, double bias) {
        if (to <= from) {
            return 0d;
        }
        double sum = 0d;
        for (int i = from; i < to; i++) {
            double error = predict(features[i], weights, bias) - targets[i];
            sum += error * error;
        }
        return sum / (to - from);
    }

    private static double predict(double[] feature, double[] weights, double bias) {
        double value = bias;
        for (int j = 0; j < weights.length; j++) {
            value += weights[j] * feature[j];
        }
        return value;
    }

    private static double[] deltas(double[] window) {
        double[] deltas = new double[window.length - 1];
        for (int i = 1; i < window.length; i++) {
            deltas[i - 1] = window[i] - window[i - 1];
        }
        return deltas;
    }

    private static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }
}
