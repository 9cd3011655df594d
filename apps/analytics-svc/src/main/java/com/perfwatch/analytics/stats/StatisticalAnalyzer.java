package com.perfwatch.analytics.stats;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.error.NumericFaultException;
import com.perfwatch.analytics.model.Cohort;
import com.perfwatch.analytics.model.CohortRegression;
import com.perfwatch.analytics.model.CorrelationResult;
import com.perfwatch.analytics.model.DistributionProfile;
import com.perfwatch.analytics.model.EffectSize;
import com.perfwatch.analytics.model.Interval;
import com.perfwatch.analytics.model.SectionResult;
import com.perfwatch.analytics.model.SignificanceResult;
import com.perfwatch.analytics.model.StatisticsReport;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.math3.distribution.TDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Compares ordered cohorts (for example successive model versions). Pairwise significance works
 * on each cohort's raw samples; distribution, effect size and regression work on the sequence of
 * cohort means, in cohort order.
 */
@Service
public class StatisticalAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(StatisticalAnalyzer.class);
    private static final double OUTLIER_IQR_FACTOR = 1.5d;
    private static final double FLAT_CHANGE_RATIO = 0.01d;

    private final AnalyticsProperties properties;

    public StatisticalAnalyzer(AnalyticsProperties properties) {
        this.properties = properties;
    }

    /**
     * Runs every comparison for each metric present in at least one cohort.
     */
    public StatisticsReport analyze(List<Cohort> cohorts) {
        Set<String> metricNames = new LinkedHashSet<>();
        cohorts.forEach(cohort -> metricNames.addAll(cohort.metrics().keySet()));
        return analyze(cohorts, List.copyOf(metricNames));
    }

    public StatisticsReport analyze(List<Cohort> cohorts, List<String> metricNames) {
        List<String> warnings = new ArrayList<>();
        Map<String, StatisticsReport.MetricStatistics> metrics = new LinkedHashMap<>();
        for (String metric : metricNames) {
            List<String> missing = missingFrom(cohorts, metric);
            if (!missing.isEmpty()) {
                warnings.add("metric '" + metric + "' missing from cohorts " + missing + "; excluded from its comparisons");
            }
            metrics.put(metric, new StatisticsReport.MetricStatistics(
                    pairwiseSignificance(cohorts, metric),
                    distributionProfile(cohorts, metric),
                    effectSize(cohorts, metric),
                    regressionOverCohortIndex(cohorts, metric)
            ));
        }
        Map<String, SectionResult<CorrelationResult>> correlations = new LinkedHashMap<>();
        for (int i = 0; i < metricNames.size(); i++) {
            for (int j = i + 1; j < metricNames.size(); j++) {
                String a = metricNames.get(i);
                String b = metricNames.get(j);
                correlations.put(a + "_" + b, correlation(cohorts, a, b));
            }
        }
        if (!warnings.isEmpty()) {
            log.warn("Cohort comparison produced {} warning(s): {}", warnings.size(), warnings);
        }
        return new StatisticsReport(cohorts.size(), metrics, correlations, List.copyOf(warnings));
    }

    /**
     * Pooled two-sample t-test for every ordered pair of cohorts that carry the metric.
     */
    public SectionResult<List<SignificanceResult>> pairwiseSignificance(List<Cohort> cohorts, String metric) {
        List<Cohort> present = withMetric(cohorts, metric);
        if (present.size() < 2) {
            return SectionResult.insufficient("significance needs at least 2 cohorts with '" + metric + "'");
        }
        List<SignificanceResult> results = new ArrayList<>();
        for (int i = 0; i < present.size() - 1; i++) {
            for (int j = i + 1; j < present.size(); j++) {
                Cohort first = present.get(i);
                Cohort second = present.get(j);
                results.add(tTest(first.label() + "_vs_" + second.label(),
                        SampleStatistics.toArray(first.samples(metric).orElseThrow()),
                        SampleStatistics.toArray(second.samples(metric).orElseThrow())));
            }
        }
        return SectionResult.ok(List.copyOf(results));
    }

    SignificanceResult tTest(String comparisonId, double[] group1, double[] group2) {
        int n1 = group1.length;
        int n2 = group2.length;
        double difference = SampleStatistics.mean(group1) - SampleStatistics.mean(group2);
        int df = n1 + n2 - 2;
        if (df <= 0) {
            return degenerate(comparisonId, difference,
                    "one sample per cohort leaves no degrees of freedom; difference reported without a test");
        }
        double pooledVariance = ((n1 - 1) * SampleStatistics.sampleVariance(group1)
                + (n2 - 1) * SampleStatistics.sampleVariance(group2)) / df;
        if (pooledVariance == 0d) {
            return degenerate(comparisonId, difference,
                    "zero within-cohort variance; difference reported without a test");
        }
        double standardError = Math.sqrt(pooledVariance * (1d / n1 + 1d / n2));
        double statistic = NumericFaultException.requireFinite(difference / standardError, "t statistic");
        TDistribution distribution = new TDistribution(null, df);
        double pValue = Math.min(1d, 2d * distribution.cumulativeProbability(-Math.abs(statistic)));
        double critical = distribution.inverseCumulativeProbability(0.975);
        return new SignificanceResult(
                comparisonId,
                statistic,
                pValue,
                pValue < properties.significanceAlpha(),
                Interval.around(difference, critical * standardError),
                false,
                null
        );
    }

    private static SignificanceResult degenerate(String comparisonId, double difference, String note) {
        return new SignificanceResult(comparisonId, difference, 1d, false,
                new Interval(difference, difference), true, note);
    }

    /**
     * Pearson correlation between two metrics over the cohorts that carry both, on cohort means.
     */
    public SectionResult<CorrelationResult> correlation(List<Cohort> cohorts, String metricA, String metricB) {
        List<Double> a = new ArrayList<>();
        List<Double> b = new ArrayList<>();
        for (Cohort cohort : cohorts) {
            if (cohort.mean(metricA).isPresent() && cohort.mean(metricB).isPresent()) {
                a.add(cohort.mean(metricA).get());
                b.add(cohort.mean(metricB).get());
            }
        }
        int n = a.size();
        if (n < 3) {
            return SectionResult.insufficient("correlation of '" + metricA + "' and '" + metricB
                    + "' needs at least 3 cohorts with both metrics, got " + n);
        }
        double r = SampleStatistics.pearson(SampleStatistics.toArray(a), SampleStatistics.toArray(b));
        if (Math.abs(r) >= 1d) {
            return SectionResult.ok(new CorrelationResult(metricA, metricB, n, r, null, 0d, true));
        }
        double t = NumericFaultException.requireFinite(r * Math.sqrt((n - 2) / (1 - r * r)), "correlation t statistic");
        double pValue = Math.min(1d, 2d * new TDistribution(null, n - 2).cumulativeProbability(-Math.abs(t)));
        return SectionResult.ok(new CorrelationResult(metricA, metricB, n, r, t, pValue,
                pValue < properties.significanceAlpha()));
    }

    public SectionResult<DistributionProfile> distributionProfile(List<Cohort> cohorts, String metric) {
        double[] values = cohortMeans(cohorts, metric);
        if (values.length < 2) {
            return SectionResult.insufficient("distribution needs at least 2 cohorts with '" + metric + "'");
        }
        return SectionResult.ok(distributionProfile(values));
    }

    /**
     * Descriptive statistics with sample (n - 1) variance, adjusted skewness and excess kurtosis.
     * Skewness needs 3 points and kurtosis 4; below that, or with no spread, they are 0.
     */
    public DistributionProfile distributionProfile(double[] values) {
        SampleStatistics.requireNonEmpty(values, "values");
        SampleStatistics.requireFinite(values, "values");
        int n = values.length;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double mean = SampleStatistics.mean(values);
        double variance = SampleStatistics.sampleVariance(values);
        double sd = Math.sqrt(variance);

        double skewness = 0d;
        double kurtosis = 0d;
        if (sd > 0) {
            double cubes = 0d;
            double fourths = 0d;
            for (double value : values) {
                double z = (value - mean) / sd;
                cubes += z * z * z;
                fourths += z * z * z * z;
            }
            if (n >= 3) {
                skewness = n * cubes / ((n - 1d) * (n - 2d));
            }
            if (n >= 4) {
                kurtosis = n * (n + 1d) * fourths / ((n - 1d) * (n - 2d) * (n - 3d))
                        - 3d * (n - 1d) * (n - 1d) / ((n - 2d) * (n - 3d));
            }
        }

        double q1 = SampleStatistics.quantileSorted(sorted, 0.25);
        double q2 = SampleStatistics.quantileSorted(sorted, 0.5);
        double q3 = SampleStatistics.quantileSorted(sorted, 0.75);
        double iqr = q3 - q1;
        Interval bounds = new Interval(q1 - OUTLIER_IQR_FACTOR * iqr, q3 + OUTLIER_IQR_FACTOR * iqr);
        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (values[i] < bounds.lower() || values[i] > bounds.upper()) {
                outliers.add(i);
            }
        }

        return new DistributionProfile(
                n,
                mean,
                q2,
                mode(sorted),
                variance,
                sd,
                skewness,
                kurtosis,
                new DistributionProfile.Quartiles(q1, q2, q3),
                new DistributionProfile.Outliers(bounds, List.copyOf(outliers)),
                ShapiroWilk.test(values, properties.significanceAlpha())
        );
    }

    /**
     * Most frequent value; ties resolve to the smallest.
     */
    static double mode(double[] sorted) {
        double mode = sorted[0];
        int best = 0;
        int run = 0;
        for (int i = 0; i < sorted.length; i++) {
            run = i > 0 && sorted[i] == sorted[i - 1] ? run + 1 : 1;
            if (run > best) {
                best = run;
                mode = sorted[i];
            }
        }
        return mode;
    }

    /**
     * Splits the cohort means at the midpoint (earlier vs later cohorts) and measures the shift.
     */
    public SectionResult<EffectSize> effectSize(List<Cohort> cohorts, String metric) {
        double[] values = cohortMeans(cohorts, metric);
        if (values.length < 2) {
            return SectionResult.insufficient("effect size needs at least 2 cohorts with '" + metric + "'");
        }
        return SectionResult.ok(effectSize(values));
    }

    public EffectSize effectSize(double[] values) {
        int split = values.length / 2;
        double[] group1 = Arrays.copyOfRange(values, 0, split);
        double[] group2 = Arrays.copyOfRange(values, split, values.length);
        double difference = Math.abs(SampleStatistics.mean(group1) - SampleStatistics.mean(group2));
        List<String> notes = new ArrayList<>();

        int df = group1.length + group2.length - 2;
        double spread = 0d;
        if (df > 0) {
            spread = Math.sqrt(((group1.length - 1) * SampleStatistics.sampleVariance(group1)
                    + (group2.length - 1) * SampleStatistics.sampleVariance(group2)) / df);
        }
        if (spread == 0d) {
            spread = SampleStatistics.sampleStdDev(values);
            notes.add("no within-group variance; Cohen's d uses the combined sample standard deviation");
        }
        double d = spread == 0d ? 0d : difference / spread;
        if (spread == 0d) {
            notes.add("all values are equal; effect sizes are 0");
        }

        double g = d;
        if (df >= 2) {
            g = d * (1d - 3d / (4d * df - 1d));
        } else {
            notes.add("too few values for the small-sample correction; Hedges' g equals Cohen's d");
        }

        double controlSd = SampleStatistics.sampleStdDev(group1);
        if (controlSd == 0d) {
            controlSd = spread;
            notes.add("first group has no variance; Glass's delta uses the same spread as Cohen's d");
        }
        double delta = controlSd == 0d ? 0d : difference / controlSd;

        return new EffectSize(d, g, delta, EffectSize.Interpretation.of(d), List.copyOf(notes));
    }

    /**
     * OLS of cohort means against cohort index. The direction accounts for whether the metric is
     * lower-is-better; a total fitted change under 1% of the mean level counts as flat.
     */
    public SectionResult<CohortRegression> regressionOverCohortIndex(List<Cohort> cohorts, String metric) {
        double[] values = cohortMeans(cohorts, metric);
        if (values.length < 2) {
            return SectionResult.insufficient("regression needs at least 2 cohorts with '" + metric + "'");
        }
        double[] x = SampleStatistics.indexPositions(values.length);
        double[] fit = SampleStatistics.linearRegression(x, values);
        double slope = fit[0];
        double intercept = fit[1];
        double mean = SampleStatistics.mean(values);
        List<Double> fitted = new ArrayList<>(values.length);
        List<Double> residuals = new ArrayList<>(values.length);
        double sse = 0d;
        double sst = 0d;
        for (int i = 0; i < values.length; i++) {
            double prediction = intercept + slope * i;
            fitted.add(prediction);
            residuals.add(values[i] - prediction);
            sse += (values[i] - prediction) * (values[i] - prediction);
            sst += (values[i] - mean) * (values[i] - mean);
        }
        double rSquared = sst == 0d ? 0d : Math.max(0d, 1d - sse / sst);
        return SectionResult.ok(new CohortRegression(slope, intercept, rSquared,
                List.copyOf(fitted), List.copyOf(residuals), direction(metric, slope, values.length, mean)));
    }

    private CohortRegression.Direction direction(String metric, double slope, int n, double mean) {
        double totalChange = Math.abs(slope) * (n - 1);
        double level = Math.abs(mean);
        if (slope == 0d || (level > 0 && totalChange < FLAT_CHANGE_RATIO * level)) {
            return CohortRegression.Direction.FLAT;
        }
        boolean rising = slope > 0;
        boolean lowerBetter = properties.isLowerBetter(metric);
        return rising == lowerBetter ? CohortRegression.Direction.REGRESSING : CohortRegression.Direction.IMPROVING;
    }

    private static List<Cohort> withMetric(List<Cohort> cohorts, String metric) {
        return cohorts.stream().filter(cohort -> cohort.samples(metric).isPresent()).toList();
    }

    private static List<String> missingFrom(List<Cohort> cohorts, String metric) {
        return cohorts.stream().filter(cohort -> cohort.samples(metric).isEmpty()).map(Cohort::label).toList();
    }

    private static double[] cohortMeans(List<Cohort> cohorts, String metric) {
        return withMetric(cohorts, metric).stream()
                .mapToDouble(cohort -> cohort.mean(metric).orElseThrow())
                .toArray();
    }
}
