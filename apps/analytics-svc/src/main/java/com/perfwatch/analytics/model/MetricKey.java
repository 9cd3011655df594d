package com.perfwatch.analytics.model;

public record MetricKey(String metricType, String metricName) {

    public MetricKey {
        if (metricType == null || metricType.isBlank()) {
            throw new IllegalArgumentException("metricType must be provided");
        }
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName must be provided");
        }
    }

    public static MetricKey of(String metricType, String metricName) {
        return new MetricKey(metricType, metricName);
    }

    @Override
    public String toString() {
        return metricType + ":" + metricName;
    }
}
