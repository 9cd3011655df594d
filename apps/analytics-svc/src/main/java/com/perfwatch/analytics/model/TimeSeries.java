package com.perfwatch.analytics.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered observations for one metric key. Insertion order is time order; gaps are allowed,
 * analyzers work on index position only.
 */
public record TimeSeries(MetricKey key, List<Observation> observations) {

    public TimeSeries {
        if (key == null) {
            throw new IllegalArgumentException("key must be provided");
        }
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public static TimeSeries fromBuckets(MetricKey key, List<MetricBucket> buckets) {
        List<Observation> observations = new ArrayList<>(buckets.size());
        for (MetricBucket bucket : buckets) {
            observations.add(new Observation(bucket.bucketStart(), bucket.average()));
        }
        return new TimeSeries(key, observations);
    }

    /**
     * Builds an hourly series starting at the epoch; handy for callers that only have values.
     */
    public static TimeSeries of(MetricKey key, double... values) {
        List<Observation> observations = new ArrayList<>(values.length);
        Instant start = Instant.EPOCH;
        for (int i = 0; i < values.length; i++) {
            observations.add(new Observation(start.plus(Duration.ofHours(i)), values[i]));
        }
        return new TimeSeries(key, observations);
    }

    public double[] values() {
        double[] values = new double[observations.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = observations.get(i).value();
        }
        return values;
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }
}
