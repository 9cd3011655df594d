package com.perfwatch.analytics.model;

public record SignificanceResult(
        String comparisonId,
        double statistic,
        double pValue,
        boolean significant,
        Interval confidenceInterval,
        boolean degenerate,
        String note
) {
}
