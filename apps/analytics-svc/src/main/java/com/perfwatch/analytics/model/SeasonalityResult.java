package com.perfwatch.analytics.model;

import java.util.List;

public record SeasonalityResult(
        List<Candidate> candidates,
        Integer dominantPeriod,
        boolean hasSeasonality
) {
    public record Candidate(int period, double strength, Kind kind) {
    }

    public enum Kind {
        CYCLE,
        SEASONAL
    }

    public static SeasonalityResult none() {
        return new SeasonalityResult(List.of(), null, false);
    }
}
