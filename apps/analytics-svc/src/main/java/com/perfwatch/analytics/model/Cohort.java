package com.perfwatch.analytics.model;

import com.perfwatch.analytics.error.SeriesValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One comparable group of results, e.g. the evaluation outputs of a model version.
 */
public record Cohort(String label, Map<String, List<Double>> metrics) {

    public Cohort {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label must be provided");
        }
        metrics = metrics == null ? Map.of() : copy(metrics);
    }

    public static Cohort ofScores(String label, Map<String, Double> scores) {
        Map<String, List<Double>> metrics = new LinkedHashMap<>();
        scores.forEach((name, value) -> metrics.put(name, List.of(value)));
        return new Cohort(label, metrics);
    }

    public Optional<List<Double>> samples(String metric) {
        List<Double> samples = metrics.get(metric);
        return samples == null || samples.isEmpty() ? Optional.empty() : Optional.of(samples);
    }

    public Optional<Double> mean(String metric) {
        return samples(metric).map(values -> values.stream().mapToDouble(Double::doubleValue).average().orElse(0d));
    }

    private static Map<String, List<Double>> copy(Map<String, List<Double>> metrics) {
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        metrics.forEach((name, values) -> {
            List<Double> samples = values == null ? List.of() : List.copyOf(values);
            for (Double sample : samples) {
                if (!Double.isFinite(sample)) {
                    throw new SeriesValidationException("metric '" + name + "' contains a non-finite sample");
                }
            }
            copy.put(name, samples);
        });
        return Collections.unmodifiableMap(copy);
    }
}
