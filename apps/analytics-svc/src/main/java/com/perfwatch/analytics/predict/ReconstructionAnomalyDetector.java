package com.perfwatch.analytics.predict;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.error.ModelTrainingException;
import com.perfwatch.analytics.error.SeriesValidationException;
import com.perfwatch.analytics.model.AnomalySet;
import com.perfwatch.analytics.stats.SampleStatistics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Learned anomaly detector: a linear autoencoder compresses each normalized window through a
 * narrow code and rebuilds it. Windows whose reconstruction error exceeds mean + 2 std of all
 * errors mark their trailing point anomalous.
 */
@Component
public class ReconstructionAnomalyDetector {

    private static final double THRESHOLD_STD_MULTIPLIER = 2d;

    private final AnalyticsProperties.Training training;

    public ReconstructionAnomalyDetector(AnalyticsProperties properties) {
        this.training = properties.training();
    }

    public AnomalySet detect(double[] values, int windowSize) {
        SampleStatistics.requireFinite(values, "series");
        if (values.length < windowSize + 1) {
            throw new SeriesValidationException("series of " + values.length
                    + " points is too short for window size " + windowSize + "; need at least " + (windowSize + 1));
        }
        double[] normalized = MinMaxScaler.fit(values).normalize(values);
        int count = values.length - windowSize + 1;
        double[][] windows = new double[count][];
        for (int i = 0; i < count; i++) {
            windows[i] = Arrays.copyOfRange(normalized, i, i + windowSize);
        }

        LinearAutoencoder autoencoder = new LinearAutoencoder(windowSize, Math.max(2, windowSize / 4),
                new Random(training.seed()));
        autoencoder.fit(windows, training.epochs(), training.learningRate(), training.batchSize());

        double[] errors = new double[count];
        for (int i = 0; i < count; i++) {
            errors[i] = autoencoder.reconstructionError(windows[i]);
        }
        double mean = SampleStatistics.mean(errors);
        double threshold = mean + THRESHOLD_STD_MULTIPLIER * SampleStatistics.populationStdDev(errors);

        List<AnomalySet.Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            if (errors[i] > threshold) {
                int index = i + windowSize - 1;
                anomalies.add(new AnomalySet.Anomaly(index, values[index], errors[i], errors[i] - mean));
            }
        }
        return AnomalySet.of(AnomalySet.Method.RECONSTRUCTION, threshold, anomalies, values.length);
    }

    static final class LinearAutoencoder {
        private final int inputSize;
        private final int codeSize;
        private final double[][] encoder;
        private final double[] encoderBias;
        private final double[][] decoder;
        private final double[] decoderBias;

        LinearAutoencoder(int inputSize, int codeSize, Random random) {
            this.inputSize = inputSize;
            this.codeSize = codeSize;
            this.encoder = new double[codeSize][inputSize];
            this.encoderBias = new double[codeSize];
            this.decoder = new double[inputSize][codeSize];
            this.decoderBias = new double[inputSize];
            double scale = 1d / Math.sqrt(inputSize);
            for (int k = 0; k < codeSize; k++) {
                for (int j = 0; j < inputSize; j++) {
                    encoder[k][j] = random.nextGaussian() * scale;
                    decoder[j][k] = random.nextGaussian() * scale;
                }
            }
        }

        void fit(double[][] windows, int epochs, double learningRate, int batchSize) {
            for (int epoch = 1; epoch <= epochs; epoch++) {
                for (int start = 0; start < windows.length; start += batchSize) {
                    step(windows, start, Math.min(windows.length, start + batchSize), learningRate);
                }
                double loss = 0d;
                for (double[] window : windows) {
                    loss += reconstructionError(window);
                }
                if (!Double.isFinite(loss)) {
                    throw new ModelTrainingException("autoencoder training diverged at epoch " + epoch);
                }
            }
        }

        private void step(double[][] windows, int from, int to, double learningRate) {
            double[][] encoderGradient = new double[codeSize][inputSize];
            double[] encoderBiasGradient = new double[codeSize];
            double[][] decoderGradient = new double[inputSize][codeSize];
            double[] decoderBiasGradient = new double[inputSize];
            double scale = 2d / ((to - from) * (double) inputSize);
            for (int s = from; s < to; s++) {
                double[] x = windows[s];
                double[] code = encode(x);
                double[] output = decode(code);
                double[] codeGradient = new double[codeSize];
                for (int j = 0; j < inputSize; j++) {
                    double outputGradient = scale * (output[j] - x[j]);
                    decoderBiasGradient[j] += outputGradient;
                    for (int k = 0; k < codeSize; k++) {
                        decoderGradient[j][k] += outputGradient * code[k];
                        codeGradient[k] += outputGradient * decoder[j][k];
                    }
                }
                for (int k = 0; k < codeSize; k++) {
                    encoderBiasGradient[k] += codeGradient[k];
                    for (int j = 0; j < inputSize; j++) {
                        encoderGradient[k][j] += codeGradient[k] * x[j];
                    }
                }
            }
            for (int k = 0; k < codeSize; k++) {
                encoderBias[k] -= learningRate * encoderBiasGradient[k];
                for (int j = 0; j < inputSize; j++) {
                    encoder[k][j] -= learningRate * encoderGradient[k][j];
                }
            }
            for (int j = 0; j < inputSize; j++) {
                decoderBias[j] -= learningRate * decoderBiasGradient[j];
                for (int k = 0; k < codeSize; k++) {
                    decoder[j][k] -= learningRate * decoderGradient[j][k];
                }
            }
        }

        double reconstructionError(double[] x) {
            double[] output = decode(encode(x));
            double sum = 0d;
            for (int j = 0; j < inputSize; j++) {
                double diff = output[j] - x[j];
                sum += diff * diff;
            }
            return sum / inputSize;
        }

        private double[] encode(double[] x) {
            double[] code = encoderBias.clone();
            for (int k = 0; k < codeSize; k++) {
                for (int j = 0; j < inputSize; j++) {
                    code[k] += encoder[k][j] * x[j];
                }
            }
            return code;
        }

        private double[] decode(double[] code) {
            double[] output = decoderBias.clone();
            for (int j = 0; j < inputSize; j++) {
                for (int k = 0; k < codeSize; k++) {
                    output[j] += decoder[j][k] * code[k];
                }
            }
            return output;
        }
    }
}
