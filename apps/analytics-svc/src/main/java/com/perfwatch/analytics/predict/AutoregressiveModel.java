package com.perfwatch.analytics.predict;

import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Trained linear autoregression on first differences: the next normalized value is the last
 * normalized value plus {@code bias + weights · deltas(window)}. Immutable once built, so a
 * cached instance can be shared between concurrent forecasts.
 */
public final class AutoregressiveModel {

    private final double[] weights;
    private final double bias;
    private final MinMaxScaler scaler;
    private final int windowSize;
    private final double trainingLoss;
    private final Double validationRmse;
    private final int trainingSize;
    private final Instant trainedAt;

    AutoregressiveModel(double[] weights, double bias, MinMaxScaler scaler, int windowSize, double trainingLoss,
                        Double validationRmse, int trainingSize, Instant trainedAt) {
        if (weights.length != windowSize - 1) {
            throw new IllegalArgumentException("expected " + (windowSize - 1) + " weights, got " + weights.length);
        }
        this.weights = weights.clone();
        this.bias = bias;
        this.scaler = scaler;
        this.windowSize = windowSize;
        this.trainingLoss = trainingLoss;
        this.validationRmse = validationRmse;
        this.trainingSize = trainingSize;
        this.trainedAt = trainedAt;
    }

    /**
     * Predicts the value following {@code window}, both in original units.
     */
    public double predictNext(double[] window) {
        if (window.length != windowSize) {
            throw new IllegalArgumentException("window must have " + windowSize + " values, got " + window.length);
        }
        double[] normalized = scaler.normalize(window);
        return scaler.denormalize(normalized[windowSize - 1] + predictDelta(normalized));
    }

    double predictDelta(double[] normalizedWindow) {
        double delta = bias;
        for (int i = 1; i < normalizedWindow.length; i++) {
            delta += weights[i - 1] * (normalizedWindow[i] - normalizedWindow[i - 1]);
        }
        return delta;
    }

    public int windowSize() {
        return windowSize;
    }

    public double trainingLoss() {
        return trainingLoss;
    }

    /**
     * Root mean squared error on the held-out windows, in original units.
     */
    public OptionalDouble validationRmse() {
        return validationRmse == null ? OptionalDouble.empty() : OptionalDouble.of(validationRmse);
    }

    public int trainingSize() {
        return trainingSize;
    }

    public Instant trainedAt() {
        return trainedAt;
    }

    public MinMaxScaler scaler() {
        return scaler;
    }

    public double[] weights() {
        return weights.clone();
    }

    public double bias() {
        return bias;
    }
}
