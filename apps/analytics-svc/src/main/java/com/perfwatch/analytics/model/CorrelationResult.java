package com.perfwatch.analytics.model;

/**
 * Pearson correlation across cohorts. {@code tStatistic} is null when |r| = 1.
 */
public record CorrelationResult(
        String metricA,
        String metricB,
        int sampleSize,
        double correlation,
        Double tStatistic,
        double pValue,
        boolean significant
) {
}
