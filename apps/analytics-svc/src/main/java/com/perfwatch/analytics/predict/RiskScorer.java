package com.perfwatch.analytics.predict;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.error.NumericFaultException;
import com.perfwatch.analytics.model.MetricKey;
import com.perfwatch.analytics.model.RiskAssessment;
import com.perfwatch.analytics.model.TrendResult;
import com.perfwatch.analytics.stats.SampleStatistics;
import org.springframework.stereotype.Component;

/**
 * Composite leak / saturation score from three signals: positive slope (0.4), mean growth
 * above threshold (0.3) and consistent upward moves (0.3).
 */
@Component
public class RiskScorer {

    private static final int SLOPE_POINTS = 4;
    private static final int GROWTH_POINTS = 3;
    private static final int CONSISTENCY_POINTS = 3;
    private static final double HIGH_RISK = 0.7d;
    private static final double MEDIUM_RISK = 0.3d;

    private final AnalyticsProperties.Risk risk;

    public RiskScorer(AnalyticsProperties properties) {
        this.risk = properties.risk();
    }

    public RiskAssessment assess(MetricKey key, double[] values, TrendResult trend, int horizon) {
        SampleStatistics.requireNonEmpty(values, "series");
        SampleStatistics.requireFinite(values, "series");
        boolean positiveSlope = trend.slope() > 0;
        double meanGrowth = NumericFaultException.requireFinite(
                SampleStatistics.mean(SampleStatistics.relativeChanges(values)), "mean growth rate");
        double consistency = SampleStatistics.upwardShare(values);

        // tenths, so 0.4 + 0.3 stays exactly 0.7
        int points = 0;
        if (positiveSlope) {
            points += SLOPE_POINTS;
        }
        if (meanGrowth > risk.growthRateThreshold()) {
            points += GROWTH_POINTS;
        }
        if (consistency >= risk.consistencyRatio()) {
            points += CONSISTENCY_POINTS;
        }
        double probability = points / 10d;

        return new RiskAssessment(
                risk.isLeakType(key.metricType()) ? RiskAssessment.Kind.LEAK : RiskAssessment.Kind.SATURATION,
                probability,
                level(probability),
                timeToThreshold(values, trend, risk.thresholdFor(key.metricType()), horizon),
                new RiskAssessment.Signals(positiveSlope, meanGrowth, consistency)
        );
    }

    static RiskAssessment.Level level(double probability) {
        if (probability > HIGH_RISK) {
            return RiskAssessment.Level.HIGH;
        }
        if (probability > MEDIUM_RISK) {
            return RiskAssessment.Level.MEDIUM;
        }
        return RiskAssessment.Level.LOW;
    }

    /**
     * Steps until the fitted trend reaches {@code threshold}, 0 when the last value already has,
     * null when no threshold is configured or it is not reached within the horizon.
     */
    static Integer timeToThreshold(double[] values, TrendResult trend, Double threshold, int horizon) {
        if (threshold == null) {
            return null;
        }
        int last = values.length - 1;
        if (values[last] >= threshold) {
            return 0;
        }
        if (trend.slope() <= 0) {
            return null;
        }
        for (int step = 1; step <= horizon; step++) {
            if (trend.valueAt(last + step) >= threshold) {
                return step;
            }
        }
        return null;
    }
}
