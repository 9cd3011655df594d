package com.perfwatch.analytics.model;

/**
 * A report section. Sections that cannot be computed carry {@link Status#INSUFFICIENT_DATA}
 * and a reason instead of failing the whole report.
 */
public record SectionResult<T>(Status status, T value, String reason) {

    public enum Status {
        OK,
        DEGRADED,
        INSUFFICIENT_DATA
    }

    public static <T> SectionResult<T> ok(T value) {
        return new SectionResult<>(Status.OK, value, null);
    }

    public static <T> SectionResult<T> degraded(T value, String reason) {
        return new SectionResult<>(Status.DEGRADED, value, reason);
    }

    public static <T> SectionResult<T> insufficient(String reason) {
        return new SectionResult<>(Status.INSUFFICIENT_DATA, null, reason);
    }

    public boolean hasValue() {
        return value != null;
    }
}
