package com.perfwatch.analytics.predict;

/**
 * How forecast confidence intervals grow with the step index.
 */
public enum IntervalPolicy {
    /**
     * Half-width scales with sqrt(step), reflecting error compounding in iterative forecasts.
     */
    SQRT_STEP,
    /**
     * Same half-width at every step. Understates uncertainty at long horizons.
     */
    CONSTANT;

    public double multiplier(int step) {
        return this == SQRT_STEP ? Math.sqrt(Math.max(1, step)) : 1d;
    }
}
