package com.perfwatch.analytics.model;

import java.time.Duration;
import java.time.Instant;

public record TimeRange(Instant fromInclusive, Instant toExclusive) {

    public TimeRange {
        if (fromInclusive == null || toExclusive == null) {
            throw new IllegalArgumentException("range bounds must be provided");
        }
        if (toExclusive.isBefore(fromInclusive)) {
            throw new IllegalArgumentException("range end precedes range start");
        }
    }

    public static TimeRange lastDuration(Instant now, Duration duration) {
        return new TimeRange(now.minus(duration), now);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(fromInclusive) && instant.isBefore(toExclusive);
    }
}
