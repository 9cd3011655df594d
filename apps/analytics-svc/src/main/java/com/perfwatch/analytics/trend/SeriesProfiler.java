package com.perfwatch.analytics.trend;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.error.NumericFaultException;
import com.perfwatch.analytics.model.RiskAssessment;
import com.perfwatch.analytics.model.SeriesProfile;
import com.perfwatch.analytics.stats.SampleStatistics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Descriptive profile of one series: percentiles, volatility, growth, stability and sharp drops.
 */
@Component
public class SeriesProfiler {

    private static final double DROP_THRESHOLD = 0.1d;
    private static final double STABLE_VARIATION = 0.1d;
    private static final double MODERATE_VARIATION = 0.3d;

    private final TrendAnalyzer trendAnalyzer;
    private final AnalyticsProperties properties;

    public SeriesProfiler(TrendAnalyzer trendAnalyzer, AnalyticsProperties properties) {
        this.trendAnalyzer = trendAnalyzer;
        this.properties = properties;
    }

    public SeriesProfile profile(double[] values, boolean trackDrops) {
        SampleStatistics.requireNonEmpty(values, "series");
        SampleStatistics.requireFinite(values, "series");
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double mean = SampleStatistics.mean(values);
        double stdDev = SampleStatistics.populationStdDev(values);

        SeriesProfile.Percentiles percentiles = new SeriesProfile.Percentiles(
                SampleStatistics.quantileSorted(sorted, 0.5),
                SampleStatistics.quantileSorted(sorted, 0.75),
                SampleStatistics.quantileSorted(sorted, 0.9),
                SampleStatistics.quantileSorted(sorted, 0.95),
                SampleStatistics.quantileSorted(sorted, 0.99)
        );

        // a near-zero predecessor can push a relative change past Double.MAX_VALUE
        double[] returns = NumericFaultException.requireFinite(
                SampleStatistics.relativeChanges(values), "relative change");
        double volatility = NumericFaultException.requireFinite(
                SampleStatistics.populationStdDev(returns), "volatility");
        SeriesProfile.Volatility volatilityProfile = new SeriesProfile.Volatility(
                volatility, volatility * Math.sqrt(values.length));

        SeriesProfile.Growth growth = new SeriesProfile.Growth(
                NumericFaultException.requireFinite(SampleStatistics.mean(returns), "mean growth rate"),
                trendAnalyzer.calculateTrend(returns),
                SampleStatistics.upwardShare(values) >= properties.risk().consistencyRatio()
        );

        return new SeriesProfile(
                values.length,
                mean,
                SampleStatistics.quantileSorted(sorted, 0.5),
                stdDev,
                percentiles,
                volatilityProfile,
                growth,
                assessStability(mean, stdDev),
                sampleConfidence(values.length),
                trackDrops ? detectDrops(values) : List.of()
        );
    }

    static SeriesProfile.Stability assessStability(double mean, double stdDev) {
        if (stdDev == 0d) {
            return SeriesProfile.Stability.STABLE;
        }
        if (mean == 0d) {
            return SeriesProfile.Stability.UNSTABLE;
        }
        double variation = stdDev / Math.abs(mean);
        if (variation < STABLE_VARIATION) {
            return SeriesProfile.Stability.STABLE;
        }
        if (variation < MODERATE_VARIATION) {
            return SeriesProfile.Stability.MODERATE;
        }
        return SeriesProfile.Stability.UNSTABLE;
    }

    /**
     * More samples give more confidence, plateauing at 100.
     */
    public static SeriesProfile.SampleConfidence sampleConfidence(int sampleSize) {
        double score = Math.min(sampleSize / 100d, 1d);
        RiskAssessment.Level level = score > 0.8
                ? RiskAssessment.Level.HIGH
                : score > 0.5 ? RiskAssessment.Level.MEDIUM : RiskAssessment.Level.LOW;
        return new SeriesProfile.SampleConfidence(score, level);
    }

    static List<SeriesProfile.DropEvent> detectDrops(double[] values) {
        List<SeriesProfile.DropEvent> drops = new ArrayList<>();
        for (int i = 1; i < values.length; i++) {
            double previous = values[i - 1];
            double drop = previous - values[i];
            if (drop > 0 && previous > 0 && drop / previous > DROP_THRESHOLD) {
                drops.add(new SeriesProfile.DropEvent(i, drop, drop / previous * 100d));
            }
        }
        return drops;
    }
}
