package com.perfwatch.analytics.model;

import java.util.List;

public record PatternMatch(List<Double> sequence, List<Integer> positions, int occurrences) {
}
