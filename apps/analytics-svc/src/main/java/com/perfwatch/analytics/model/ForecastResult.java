package com.perfwatch.analytics.model;

import java.util.List;

public record ForecastResult(
        int horizon,
        List<Double> values,
        List<Interval> confidenceIntervals,
        double confidenceScore,
        Method method,
        TrendResult forecastTrend
) {
    public enum Method {
        SEQUENCE_MODEL,
        LINEAR_EXTRAPOLATION
    }
}
