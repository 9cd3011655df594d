package com.perfwatch.analytics.trend;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.model.AnomalySet;
import com.perfwatch.analytics.model.PatternMatch;
import com.perfwatch.analytics.model.SeasonalityResult;
import com.perfwatch.analytics.model.TimeSeries;
import com.perfwatch.analytics.model.TrendResult;
import com.perfwatch.analytics.stats.SampleStatistics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Single-series analysis: linear trend, seasonality, static z-score anomalies and repeated
 * subsequences. Every method is a pure function of its input.
 */
@Component
public class TrendAnalyzer {

    private static final double STRONG_CORRELATION = 0.7d;
    private static final double SEASONAL_CORRELATION = 0.7d;
    private static final int MIN_PATTERN_LENGTH = 3;

    private final AnalyticsProperties properties;

    public TrendAnalyzer(AnalyticsProperties properties) {
        this.properties = properties;
    }

    public TrendResult calculateTrend(TimeSeries series) {
        return calculateTrend(series.values());
    }

    /**
     * Least squares of value against index position, not wall-clock time.
     */
    public TrendResult calculateTrend(double[] values) {
        SampleStatistics.requireFinite(values, "series");
        if (values.length < 2) {
            return TrendResult.neutral();
        }
        double[] x = SampleStatistics.indexPositions(values.length);
        double[] fit = SampleStatistics.linearRegression(x, values);
        double correlation = SampleStatistics.pearson(x, values);
        return new TrendResult(
                fit[0],
                fit[1],
                correlation,
                fit[0] > 0 ? TrendResult.Direction.INCREASING : TrendResult.Direction.DECREASING,
                Math.abs(correlation) > STRONG_CORRELATION ? TrendResult.Strength.STRONG : TrendResult.Strength.WEAK
        );
    }

    public SeasonalityResult detectSeasonality(double[] values) {
        return detectSeasonality(values, values.length / 2);
    }

    public SeasonalityResult detectSeasonality(double[] values, int maxPeriod) {
        List<SeasonalityResult.Candidate> candidates = scanPeriods(values, maxPeriod);
        if (candidates.isEmpty()) {
            return SeasonalityResult.none();
        }
        return new SeasonalityResult(candidates, candidates.get(0).period(), true);
    }

    public List<SeasonalityResult.Candidate> detectCycles(double[] values) {
        return scanPeriods(values, values.length / 2);
    }

    private List<SeasonalityResult.Candidate> scanPeriods(double[] values, int maxPeriod) {
        SampleStatistics.requireFinite(values, "series");
        int upper = Math.min(maxPeriod, values.length / 2);
        double minCorrelation = properties.seasonalityMinCorrelation();
        List<SeasonalityResult.Candidate> candidates = new ArrayList<>();
        for (int period = 2; period <= upper; period++) {
            double strength = segmentCorrelation(values, period);
            if (strength > minCorrelation) {
                SeasonalityResult.Kind kind = strength > SEASONAL_CORRELATION
                        ? SeasonalityResult.Kind.SEASONAL
                        : SeasonalityResult.Kind.CYCLE;
                candidates.add(new SeasonalityResult.Candidate(period, strength, kind));
            }
        }
        candidates.sort(Comparator.comparingDouble(SeasonalityResult.Candidate::strength).reversed());
        return List.copyOf(candidates);
    }

    /**
     * Mean correlation between consecutive full segments of the given length.
     */
    double segmentCorrelation(double[] values, int period) {
        List<double[]> segments = new ArrayList<>();
        for (int i = 0; i < values.length - period; i += period) {
            segments.add(Arrays.copyOfRange(values, i, i + period));
        }
        if (segments.size() < 2) {
            return 0d;
        }
        double sum = 0d;
        for (int i = 1; i < segments.size(); i++) {
            sum += SampleStatistics.pearson(segments.get(i - 1), segments.get(i));
        }
        return sum / (segments.size() - 1);
    }

    public AnomalySet detectAnomalies(double[] values) {
        return detectAnomalies(values, properties.anomalyZThreshold(), properties.anomalyDetrend());
    }

    public AnomalySet detectAnomalies(double[] values, double zThreshold) {
        return detectAnomalies(values, zThreshold, false);
    }

    /**
     * Static z-score detector. Without detrending a strongly trending series over-flags its
     * late points; with {@code detrend} the fitted line is subtracted first.
     */
    public AnomalySet detectAnomalies(double[] values, double zThreshold, boolean detrend) {
        SampleStatistics.requireNonEmpty(values, "series");
        SampleStatistics.requireFinite(values, "series");
        double[] basis = detrend ? residuals(values) : values;
        double mean = SampleStatistics.mean(basis);
        double stdDev = SampleStatistics.populationStdDev(basis);
        List<AnomalySet.Anomaly> anomalies = new ArrayList<>();
        if (stdDev > 0) {
            for (int i = 0; i < basis.length; i++) {
                double zScore = Math.abs(basis[i] - mean) / stdDev;
                if (zScore > zThreshold) {
                    anomalies.add(new AnomalySet.Anomaly(i, values[i], zScore, basis[i] - mean));
                }
            }
        }
        return AnomalySet.of(AnomalySet.Method.Z_SCORE, zThreshold, anomalies, values.length);
    }

    private double[] residuals(double[] values) {
        TrendResult trend = calculateTrend(values);
        double[] residuals = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            residuals[i] = values[i] - trend.valueAt(i);
        }
        return residuals;
    }

    public List<PatternMatch> findPatterns(double[] values) {
        return findPatterns(values, properties.patterns().tolerance());
    }

    /**
     * Repeated subsequences of length 3..n/2. Values are bucketed at {@code tolerance} times the
     * mean absolute value, so near matches share a key. Returns the most frequent ones.
     */
    public List<PatternMatch> findPatterns(double[] values, double tolerance) {
        SampleStatistics.requireFinite(values, "series");
        double scale = 0d;
        for (double value : values) {
            scale += Math.abs(value);
        }
        scale = values.length == 0 ? 0d : scale / values.length;
        double step = scale > 0 ? tolerance * scale : tolerance;

        long[] buckets = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            buckets[i] = Math.round(values[i] / step);
        }

        List<PatternMatch> patterns = new ArrayList<>();
        int maxLength = values.length / 2;
        for (int length = MIN_PATTERN_LENGTH; length <= maxLength; length++) {
            patterns.addAll(repeatingSequences(values, buckets, length));
        }
        patterns.sort(Comparator.comparingInt(PatternMatch::occurrences).reversed());
        return List.copyOf(patterns.subList(0, Math.min(properties.patterns().maxResults(), patterns.size())));
    }

    private List<PatternMatch> repeatingSequences(double[] values, long[] buckets, int length) {
        Map<String, List<Integer>> positionsByKey = new LinkedHashMap<>();
        for (int start = 0; start <= values.length - length; start++) {
            StringBuilder key = new StringBuilder();
            for (int i = start; i < start + length; i++) {
                key.append(buckets[i]).append(',');
            }
            positionsByKey.computeIfAbsent(key.toString(), k -> new ArrayList<>()).add(start);
        }
        List<PatternMatch> repeated = new ArrayList<>();
        for (List<Integer> positions : positionsByKey.values()) {
            if (positions.size() < 2) {
                continue;
            }
            int first = positions.get(0);
            List<Double> sequence = new ArrayList<>(length);
            for (int i = first; i < first + length; i++) {
                sequence.add(values[i]);
            }
            repeated.add(new PatternMatch(List.copyOf(sequence), List.copyOf(positions), positions.size()));
        }
        return repeated;
    }
}
