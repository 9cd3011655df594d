package com.perfwatch.analytics.source;

import com.perfwatch.analytics.model.MetricBucket;
import com.perfwatch.analytics.model.TimeRange;
import java.time.Duration;
import java.util.List;

/**
 * Read side of the metric store. Buckets come back in ascending time order; empty buckets are
 * omitted rather than zero-filled.
 */
public interface TimeSeriesSource {

    List<MetricBucket> query(String metricType, String metricName, Duration granularity, TimeRange range);
}
