package com.perfwatch.analytics.model;

import java.util.List;

public record Recommendation(
        Type type,
        Priority priority,
        String message,
        List<String> actions,
        String timeline
) {
    public enum Type {
        PERFORMANCE_DEGRADATION,
        MEMORY_LEAK,
        RESOURCE_SATURATION,
        PERFORMANCE_OPTIMIZATION,
        ANOMALY_INVESTIGATION,
        CAPACITY_PLANNING,
        STATISTICAL_REGRESSION,
        SIGNIFICANT_DIFFERENCE
    }

    public enum Priority {
        LOW,
        MEDIUM,
        HIGH
    }
}
