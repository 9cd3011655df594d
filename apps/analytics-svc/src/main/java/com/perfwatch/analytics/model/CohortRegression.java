package com.perfwatch.analytics.model;

import java.util.List;

public record CohortRegression(
        double slope,
        double intercept,
        double rSquared,
        List<Double> fitted,
        List<Double> residuals,
        Direction direction
) {
    public enum Direction {
        IMPROVING,
        REGRESSING,
        FLAT
    }
}
