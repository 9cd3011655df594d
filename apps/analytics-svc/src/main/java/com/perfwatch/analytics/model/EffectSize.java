package com.perfwatch.analytics.model;

import java.util.List;

public record EffectSize(
        double cohensD,
        double hedgesG,
        double glassDelta,
        Interpretation interpretation,
        List<String> notes
) {
    public enum Interpretation {
        NEGLIGIBLE,
        SMALL,
        MEDIUM,
        LARGE;

        public static Interpretation of(double magnitude) {
            double d = Math.abs(magnitude);
            if (d < 0.2) {
                return NEGLIGIBLE;
            }
            if (d < 0.5) {
                return SMALL;
            }
            if (d < 0.8) {
                return MEDIUM;
            }
            return LARGE;
        }
    }
}
