package com.perfwatch.analytics.model;

import java.time.Instant;

public record Observation(Instant timestamp, double value) {
}
