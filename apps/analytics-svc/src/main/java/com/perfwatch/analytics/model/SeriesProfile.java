package com.perfwatch.analytics.model;

import java.util.List;

public record SeriesProfile(
        int count,
        double mean,
        double median,
        double standardDeviation,
        Percentiles percentiles,
        Volatility volatility,
        Growth growth,
        Stability stability,
        SampleConfidence confidence,
        List<DropEvent> dropEvents
) {
    public record Percentiles(double p50, double p75, double p90, double p95, double p99) {
    }

    public record Volatility(double value, double annualized) {
    }

    public record Growth(double average, TrendResult trend, boolean consistent) {
    }

    public enum Stability {
        STABLE,
        MODERATE,
        UNSTABLE
    }

    public record SampleConfidence(double score, RiskAssessment.Level level) {
    }

    /**
     * A sharp relative drop between consecutive points, typically a garbage collection on a
     * memory series.
     */
    public record DropEvent(int index, double size, double percentage) {
    }
}
