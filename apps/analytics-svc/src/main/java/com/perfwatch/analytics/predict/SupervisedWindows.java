package com.perfwatch.analytics.predict;

import com.perfwatch.analytics.error.SeriesValidationException;
import java.util.Arrays;

/**
 * Sliding-window framing of a series: {@code inputs[i] = v[i..i+w)}, {@code targets[i] = v[i+w]}.
 */
public final class SupervisedWindows {

    private final double[][] inputs;
    private final double[] targets;

    private SupervisedWindows(double[][] inputs, double[] targets) {
        this.inputs = inputs;
        this.targets = targets;
    }

    public static SupervisedWindows prepare(double[] values, int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        if (values.length < windowSize + 1) {
            throw new SeriesValidationException("series of " + values.length
                    + " points is too short for window size " + windowSize + "; need at least " + (windowSize + 1));
        }
        int count = values.length - windowSize;
        double[][] inputs = new double[count][];
        double[] targets = new double[count];
        for (int i = 0; i < count; i++) {
            inputs[i] = Arrays.copyOfRange(values, i, i + windowSize);
            targets[i] = values[i + windowSize];
        }
        return new SupervisedWindows(inputs, targets);
    }

    public int size() {
        return targets.length;
    }

    public int windowSize() {
        return inputs.length == 0 ? 0 : inputs[0].length;
    }

    public double[] input(int index) {
        return inputs[index].clone();
    }

    public double target(int index) {
        return targets[index];
    }
}
