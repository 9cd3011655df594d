package com.perfwatch.analytics.model;

public record Interval(double lower, double upper) {

    public static Interval around(double center, double halfWidth) {
        return new Interval(center - halfWidth, center + halfWidth);
    }

    public double width() {
        return upper - lower;
    }
}
