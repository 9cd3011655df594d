package com.perfwatch.analytics.model;

import java.util.List;

public record AnomalySet(
        Method method,
        double threshold,
        List<Anomaly> anomalies,
        int count,
        double percentage
) {
    public enum Method {
        Z_SCORE,
        RECONSTRUCTION
    }

    public record Anomaly(int index, double value, double score, double deviation) {
    }

    public static AnomalySet of(Method method, double threshold, List<Anomaly> anomalies, int seriesLength) {
        double percentage = seriesLength == 0 ? 0d : anomalies.size() * 100d / seriesLength;
        return new AnomalySet(method, threshold, List.copyOf(anomalies), anomalies.size(), percentage);
    }

    public boolean isEmpty() {
        return anomalies.isEmpty();
    }
}
