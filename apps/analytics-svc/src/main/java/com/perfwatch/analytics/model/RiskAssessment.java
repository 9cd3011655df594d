package com.perfwatch.analytics.model;

public record RiskAssessment(
        Kind kind,
        double probability,
        Level level,
        Integer estimatedTimeToEvent,
        Signals signals
) {
    public enum Kind {
        LEAK,
        SATURATION
    }

    public enum Level {
        LOW,
        MEDIUM,
        HIGH
    }

    /**
     * The three weighted inputs of the composite score.
     */
    public record Signals(boolean positiveSlope, double meanGrowthRate, double growthConsistency) {
    }
}
