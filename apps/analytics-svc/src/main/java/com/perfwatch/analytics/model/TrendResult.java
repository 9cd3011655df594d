package com.perfwatch.analytics.model;

public record TrendResult(
        double slope,
        double intercept,
        double correlation,
        Direction direction,
        Strength strength
) {
    public enum Direction {
        INCREASING,
        DECREASING
    }

    public enum Strength {
        WEAK,
        STRONG
    }

    public static TrendResult neutral() {
        return new TrendResult(0d, 0d, 0d, Direction.DECREASING, Strength.WEAK);
    }

    /**
     * Value of the fitted line at the given index position.
     */
    public double valueAt(double index) {
        return intercept + slope * index;
    }
}
