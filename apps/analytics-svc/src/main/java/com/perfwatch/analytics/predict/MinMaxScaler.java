package com.perfwatch.analytics.predict;

/**
 * Maps a series onto [0, 1]. A constant series maps to 0 with unit scale.
 */
public record MinMaxScaler(double min, double max) {

    public static MinMaxScaler fit(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        if (values.length == 0) {
            return new MinMaxScaler(0d, 1d);
        }
        return new MinMaxScaler(min, max);
    }

    public double range() {
        double range = max - min;
        return range > 0 ? range : 1d;
    }

    public double normalize(double value) {
        return (value - min) / range();
    }

    public double denormalize(double value) {
        return value * range() + min;
    }

    public double[] normalize(double[] values) {
        double[] normalized = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            normalized[i] = normalize(values[i]);
        }
        return normalized;
    }
}
