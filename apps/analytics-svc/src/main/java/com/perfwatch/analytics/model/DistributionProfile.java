package com.perfwatch.analytics.model;

import java.util.List;

public record DistributionProfile(
        int count,
        double mean,
        double median,
        double mode,
        double variance,
        double standardDeviation,
        double skewness,
        double kurtosis,
        Quartiles quartiles,
        Outliers outliers,
        Normality normality
) {
    public record Quartiles(double q1, double q2, double q3) {
        public double iqr() {
            return q3 - q1;
        }
    }

    public record Outliers(Interval bounds, List<Integer> indices) {
    }

    /**
     * Shapiro-Wilk result. Null on the profile when the sample size is outside the supported range.
     */
    public record Normality(double statistic, double pValue, boolean normal, String method) {
    }
}
