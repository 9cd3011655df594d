package com.perfwatch.analytics.model;

import java.time.Instant;

/**
 * One aggregated bucket returned by the time-series source. {@code average} is the
 * canonical per-bucket value for trend and forecast purposes.
 */
public record MetricBucket(
        Instant bucketStart,
        double average,
        double minimum,
        double maximum,
        long sampleCount
) {
}
