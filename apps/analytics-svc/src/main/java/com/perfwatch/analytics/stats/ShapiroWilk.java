package com.perfwatch.analytics.stats;

import com.perfwatch.analytics.model.DistributionProfile;
import java.util.Arrays;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Shapiro-Wilk normality test using Royston's 1992 approximation (AS R94) for the coefficients
 * and the p-value. Approximate; valid for 3 to 5000 observations.
 */
public final class ShapiroWilk {

    public static final String METHOD = "Shapiro-Wilk (Royston 1992 approximation)";
    public static final int MIN_SIZE = 3;
    public static final int MAX_SIZE = 5000;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0d, 1d);

    private ShapiroWilk() {
    }

    /**
     * Returns null when the sample size is out of range or the data has no spread.
     */
    public static DistributionProfile.Normality test(double[] values, double alpha) {
        int n = values.length;
        if (n < MIN_SIZE || n > MAX_SIZE) {
            return null;
        }
        double[] x = values.clone();
        Arrays.sort(x);
        if (x[n - 1] - x[0] == 0d) {
            return null;
        }
        double w = statistic(x);
        double p = pValue(w, n);
        return new DistributionProfile.Normality(w, p, p > alpha, METHOD);
    }

    static double statistic(double[] sorted) {
        int n = sorted.length;
        double[] a = coefficients(n);
        double mean = SampleStatistics.mean(sorted);
        double numerator = 0d;
        double ss = 0d;
        for (int i = 0; i < n; i++) {
            numerator += a[i] * sorted[i];
            double diff = sorted[i] - mean;
            ss += diff * diff;
        }
        return Math.min(1d, numerator * numerator / ss);
    }

    static double[] coefficients(int n) {
        double[] a = new double[n];
        if (n == 3) {
            a[0] = -Math.sqrt(0.5);
            a[2] = Math.sqrt(0.5);
            return a;
        }
        double[] m = new double[n];
        double mm = 0d;
        for (int i = 0; i < n; i++) {
            m[i] = STANDARD_NORMAL.inverseCumulativeProbability((i + 1 - 0.375) / (n + 0.25));
            mm += m[i] * m[i];
        }
        double u = 1d / Math.sqrt(n);
        double root = Math.sqrt(mm);
        double an = m[n - 1] / root
                + 0.221157 * u - 0.147981 * u * u - 2.071190 * Math.pow(u, 3)
                + 4.434685 * Math.pow(u, 4) - 2.706056 * Math.pow(u, 5);
        a[n - 1] = an;
        a[0] = -an;
        if (n > 5) {
            double an1 = m[n - 2] / root
                    + 0.042981 * u - 0.293762 * u * u - 1.752461 * Math.pow(u, 3)
                    + 5.682633 * Math.pow(u, 4) - 3.582633 * Math.pow(u, 5);
            double phi = (mm - 2 * m[n - 1] * m[n - 1] - 2 * m[n - 2] * m[n - 2])
                    / (1 - 2 * an * an - 2 * an1 * an1);
            a[n - 2] = an1;
            a[1] = -an1;
            for (int i = 2; i < n - 2; i++) {
                a[i] = m[i] / Math.sqrt(phi);
            }
        } else {
            double phi = (mm - 2 * m[n - 1] * m[n - 1]) / (1 - 2 * an * an);
            for (int i = 1; i < n - 1; i++) {
                a[i] = m[i] / Math.sqrt(phi);
            }
        }
        return a;
    }

    static double pValue(double w, int n) {
        if (w >= 1d) {
            return 1d;
        }
        if (n == 3) {
            double p = 6d / Math.PI * (Math.asin(Math.sqrt(w)) - Math.asin(Math.sqrt(0.75)));
            return Math.max(0d, Math.min(1d, p));
        }
        double z;
        if (n <= 11) {
            double gamma = 0.459 * n - 2.273;
            double mu = 0.5440 - 0.39978 * n + 0.025054 * n * n - 0.0006714 * n * n * n;
            double sigma = Math.exp(1.3822 - 0.77857 * n + 0.062767 * n * n - 0.0020322 * n * n * n);
            double inner = gamma - Math.log(1 - w);
            if (inner <= 0d) {
                return 0d;
            }
            z = (-Math.log(inner) - mu) / sigma;
        } else {
            double ln = Math.log(n);
            double mu = 0.0038915 * Math.pow(ln, 3) - 0.083751 * ln * ln - 0.31082 * ln - 1.5861;
            double sigma = Math.exp(0.0030302 * ln * ln - 0.082676 * ln - 0.4803);
            z = (Math.log(1 - w) - mu) / sigma;
        }
        return 1d - STANDARD_NORMAL.cumulativeProbability(z);
    }
}
