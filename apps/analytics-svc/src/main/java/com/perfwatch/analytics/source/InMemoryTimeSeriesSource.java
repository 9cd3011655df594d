package com.perfwatch.analytics.source;

import com.perfwatch.analytics.model.MetricBucket;
import com.perfwatch.analytics.model.MetricKey;
import com.perfwatch.analytics.model.Observation;
import com.perfwatch.analytics.model.TimeRange;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTimeSeriesSource implements TimeSeriesSource {

    private final Map<MetricKey, List<Observation>> storage = new ConcurrentHashMap<>();

    public void append(MetricKey key, Instant timestamp, double value) {
        storage.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(new Observation(timestamp, value));
    }

    public void appendAll(MetricKey key, List<Observation> observations) {
        storage.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).addAll(observations);
    }

    public void clear(MetricKey key) {
        storage.remove(key);
    }

    @Override
    public List<MetricBucket> query(String metricType, String metricName, Duration granularity, TimeRange range) {
        if (granularity == null || granularity.isNegative() || granularity.isZero()) {
            throw new IllegalArgumentException("granularity must be positive");
        }
        List<Observation> observations = storage.getOrDefault(MetricKey.of(metricType, metricName), List.of());
        long width = granularity.toMillis();
        Map<Long, List<Double>> buckets = new TreeMap<>();
        for (Observation observation : observations) {
            if (!range.contains(observation.timestamp())) {
                continue;
            }
            long start = Math.floorDiv(observation.timestamp().toEpochMilli(), width) * width;
            buckets.computeIfAbsent(start, k -> new ArrayList<>()).add(observation.value());
        }
        List<MetricBucket> result = new ArrayList<>(buckets.size());
        buckets.forEach((start, values) -> {
            double sum = 0d;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double value : values) {
                sum += value;
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            result.add(new MetricBucket(Instant.ofEpochMilli(start), sum / values.size(), min, max, values.size()));
        });
        return result;
    }
}
