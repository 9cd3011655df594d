package com.perfwatch.analytics.stats;

import com.perfwatch.analytics.error.SeriesValidationException;
import java.util.Arrays;
import java.util.List;

/**
 * Numeric helpers shared by the analyzers. All methods treat degenerate input (empty arrays,
 * zero variance) as neutral instead of returning NaN.
 */
public final class SampleStatistics {

    private SampleStatistics() {
    }

    public static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public static void requireFinite(double[] values, String what) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new SeriesValidationException(what + " contains a non-finite value at index " + i);
            }
        }
    }

    public static void requireNonEmpty(double[] values, String what) {
        if (values.length == 0) {
            throw new SeriesValidationException(what + " must contain at least one point");
        }
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Population variance (divide by n).
     */
    public static double populationVariance(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double mean = mean(values);
        double sum = 0d;
        for (double value : values) {
            double diff = value - mean;
            sum += diff * diff;
        }
        return sum / values.length;
    }

    /**
     * Sample variance (divide by n - 1); zero for fewer than two points.
     */
    public static double sampleVariance(double[] values) {
        if (values.length < 2) {
            return 0d;
        }
        double mean = mean(values);
        double sum = 0d;
        for (double value : values) {
            double diff = value - mean;
            sum += diff * diff;
        }
        return sum / (values.length - 1);
    }

    public static double populationStdDev(double[] values) {
        return Math.sqrt(populationVariance(values));
    }

    public static double sampleStdDev(double[] values) {
        return Math.sqrt(sampleVariance(values));
    }

    /**
     * Pearson correlation; 0 when either side has no variance.
     */
    public static double pearson(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) {
            return 0d;
        }
        double meanX = 0d;
        double meanY = 0d;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;
        double scaleX = 0d;
        double scaleY = 0d;
        for (int i = 0; i < n; i++) {
            scaleX = Math.max(scaleX, Math.abs(x[i] - meanX));
            scaleY = Math.max(scaleY, Math.abs(y[i] - meanY));
        }
        if (scaleX == 0d || scaleY == 0d) {
            return 0d;
        }
        // deviations scaled into [-1, 1] so the squared sums cannot overflow
        double sxx = 0d;
        double syy = 0d;
        double sxy = 0d;
        for (int i = 0; i < n; i++) {
            double dx = (x[i] - meanX) / scaleX;
            double dy = (y[i] - meanY) / scaleY;
            sxx += dx * dx;
            syy += dy * dy;
            sxy += dx * dy;
        }
        double r = sxy / Math.sqrt(sxx * syy);
        return Math.max(-1d, Math.min(1d, r));
    }

    public static double[] indexPositions(int n) {
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = i;
        }
        return x;
    }

    /**
     * Ordinary least squares of y against x. Returns {slope, intercept}.
     */
    public static double[] linearRegression(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n == 0) {
            return new double[]{0d, 0d};
        }
        if (n == 1) {
            return new double[]{0d, y[0]};
        }
        double meanX = 0d;
        double meanY = 0d;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;
        double sxx = 0d;
        double sxy = 0d;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            sxx += dx * dx;
            sxy += dx * (y[i] - meanY);
        }
        double slope = sxx == 0d ? 0d : sxy / sxx;
        return new double[]{slope, meanY - slope * meanX};
    }

    /**
     * Linear-interpolated quantile over an already sorted array, q in [0, 1].
     */
    public static double quantileSorted(double[] sorted, double q) {
        if (sorted.length == 0) {
            return 0d;
        }
        double index = q * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    public static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return quantileSorted(sorted, q);
    }

    public static double median(double[] values) {
        return quantile(values, 0.5);
    }

    public static double[] firstDifferences(double[] values) {
        if (values.length < 2) {
            return new double[0];
        }
        double[] diffs = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            diffs[i - 1] = values[i] - values[i - 1];
        }
        return diffs;
    }

    /**
     * Relative step changes (v[i] - v[i-1]) / |v[i-1]|. Steps from a zero value are skipped.
     */
    public static double[] relativeChanges(double[] values) {
        if (values.length < 2) {
            return new double[0];
        }
        double[] changes = new double[values.length - 1];
        int count = 0;
        for (int i = 1; i < values.length; i++) {
            double previous = values[i - 1];
            if (previous == 0d) {
                continue;
            }
            changes[count++] = (values[i] - previous) / Math.abs(previous);
        }
        return Arrays.copyOf(changes, count);
    }

    /**
     * Share of steps that move upwards, in [0, 1]; 0 for fewer than two points.
     */
    public static double upwardShare(double[] values) {
        double[] diffs = firstDifferences(values);
        if (diffs.length == 0) {
            return 0d;
        }
        int rising = 0;
        for (double diff : diffs) {
            if (diff > 0) {
                rising++;
            }
        }
        return (double) rising / diffs.length;
    }
}
