package com.perfwatch.analytics.report;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.error.NumericFaultException;
import com.perfwatch.analytics.model.AnalysisReport;
import com.perfwatch.analytics.model.AnomalySet;
import com.perfwatch.analytics.model.Cohort;
import com.perfwatch.analytics.model.ForecastResult;
import com.perfwatch.analytics.model.MetricKey;
import com.perfwatch.analytics.model.PatternMatch;
import com.perfwatch.analytics.model.RiskAssessment;
import com.perfwatch.analytics.model.SeasonalityResult;
import com.perfwatch.analytics.model.SectionResult;
import com.perfwatch.analytics.model.SeriesProfile;
import com.perfwatch.analytics.model.StatisticsReport;
import com.perfwatch.analytics.model.TimeRange;
import com.perfwatch.analytics.model.TimeSeries;
import com.perfwatch.analytics.model.TrendResult;
import com.perfwatch.analytics.predict.PredictiveAnalyzer;
import com.perfwatch.analytics.recommend.RecommendationSynthesizer;
import com.perfwatch.analytics.source.TimeSeriesSource;
import com.perfwatch.analytics.stats.SampleStatistics;
import com.perfwatch.analytics.stats.StatisticalAnalyzer;
import com.perfwatch.analytics.trend.SeriesProfiler;
import com.perfwatch.analytics.trend.TrendAnalyzer;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every analyzer over a metric and assembles the report. Metrics are analyzed in parallel;
 * within one metric the trend is computed before forecasting and risk consume it.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);
    private static final double RELATED_METRIC_CORRELATION = 0.5d;

    private final TimeSeriesSource timeSeriesSource;
    private final TrendAnalyzer trendAnalyzer;
    private final SeriesProfiler seriesProfiler;
    private final PredictiveAnalyzer predictiveAnalyzer;
    private final StatisticalAnalyzer statisticalAnalyzer;
    private final RecommendationSynthesizer recommendationSynthesizer;
    private final AnalyticsProperties properties;
    private final ExecutorService analysisExecutor;
    private final Clock clock;

    public AnalysisService(
            TimeSeriesSource timeSeriesSource,
            TrendAnalyzer trendAnalyzer,
            SeriesProfiler seriesProfiler,
            PredictiveAnalyzer predictiveAnalyzer,
            StatisticalAnalyzer statisticalAnalyzer,
            RecommendationSynthesizer recommendationSynthesizer,
            AnalyticsProperties properties,
            ExecutorService analysisExecutor,
            Clock analyticsClock
    ) {
        this.timeSeriesSource = timeSeriesSource;
        this.trendAnalyzer = trendAnalyzer;
        this.seriesProfiler = seriesProfiler;
        this.predictiveAnalyzer = predictiveAnalyzer;
        this.statisticalAnalyzer = statisticalAnalyzer;
        this.recommendationSynthesizer = recommendationSynthesizer;
        this.properties = properties;
        this.analysisExecutor = analysisExecutor;
        this.clock = analyticsClock;
    }

    public TimeSeries load(MetricKey key, Duration granularity, TimeRange range) {
        return TimeSeries.fromBuckets(key,
                timeSeriesSource.query(key.metricType(), key.metricName(), granularity, range));
    }

    /**
     * Loads each metric from the source and analyzes them concurrently. Reports come back in the
     * order of {@code keys}.
     */
    public List<AnalysisReport> analyzeMetrics(List<MetricKey> keys, Duration granularity, TimeRange range,
                                               List<Cohort> cohorts) {
        List<TimeSeries> series = keys.stream().map(key -> load(key, granularity, range)).toList();
        return analyzeSeries(series, cohorts);
    }

    public List<AnalysisReport> analyzeSeries(List<TimeSeries> series, List<Cohort> cohorts) {
        List<CompletableFuture<AnalysisReport>> futures = new ArrayList<>(series.size());
        for (TimeSeries current : series) {
            List<TimeSeries> others = series.stream().filter(other -> other != current).toList();
            futures.add(CompletableFuture.supplyAsync(() -> analyze(current, others, cohorts), analysisExecutor));
        }
        List<AnalysisReport> reports = new ArrayList<>(futures.size());
        for (CompletableFuture<AnalysisReport> future : futures) {
            try {
                reports.add(future.join());
            } catch (CompletionException ex) {
                if (ex.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw ex;
            }
        }
        return reports;
    }

    public AnalysisReport analyze(TimeSeries series) {
        return analyze(series, List.of(), null);
    }

    /**
     * Full report for one metric. {@code cohorts} may be null when no cohort comparison is wanted.
     *
     * @throws com.perfwatch.analytics.error.SeriesValidationException when the series holds
     *                                                                   non-finite values
     */
    public AnalysisReport analyze(TimeSeries series, List<TimeSeries> related, List<Cohort> cohorts) {
        double[] values = series.values();
        SampleStatistics.requireFinite(values, "series " + series.key());
        List<String> warnings = new ArrayList<>();
        List<String> degradations = new ArrayList<>();

        SectionResult<TrendResult> trend = analyzeTrend(series, warnings);
        SectionResult<SeasonalityResult> seasonality = guarded("seasonality", warnings, () -> values.length < 4
                ? SectionResult.insufficient("seasonality needs at least 4 points")
                : SectionResult.ok(trendAnalyzer.detectSeasonality(values)));
        SectionResult<AnomalySet> anomalies = guarded("anomalies", warnings, () -> values.length == 0
                ? SectionResult.insufficient("no points")
                : SectionResult.ok(trendAnalyzer.detectAnomalies(values)));
        SectionResult<List<PatternMatch>> patterns = guarded("patterns", warnings, () -> values.length < 6
                ? SectionResult.insufficient("patterns need at least 6 points")
                : SectionResult.ok(trendAnalyzer.findPatterns(values)));
        boolean leakKind = properties.risk().isLeakType(series.key().metricType());
        SectionResult<SeriesProfile> profile = guarded("profile", warnings, () -> values.length == 0
                ? SectionResult.insufficient("no points")
                : SectionResult.ok(seriesProfiler.profile(values, leakKind)));

        SectionResult<ForecastResult> forecast = generatePredictions(series, trend, warnings, degradations);
        SectionResult<RiskAssessment> risk = guarded("risk", warnings, () -> trend.hasValue()
                ? SectionResult.ok(predictiveAnalyzer.assessRisk(series, trend.value()))
                : SectionResult.insufficient("risk needs a trend"));
        SectionResult<AnomalySet> reconstruction = guarded("reconstructionAnomalies", warnings,
                () -> predictiveAnalyzer.detectReconstructionAnomalies(series));

        SectionResult<StatisticsReport> statistics = cohorts == null ? null : analyzeStatistics(cohorts);
        if (statistics != null && statistics.hasValue()) {
            warnings.addAll(statistics.value().warnings());
        }

        AnalysisReport draft = new AnalysisReport(
                series.key(),
                trend,
                seasonality,
                anomalies,
                forecast,
                risk,
                statistics,
                List.of(),
                profile,
                patterns,
                reconstruction,
                new AnalysisReport.Metadata(
                        clock.instant(),
                        values.length,
                        relatedMetrics(series, related == null ? List.of() : related),
                        List.copyOf(warnings),
                        List.copyOf(degradations)
                )
        );
        AnalysisReport report = draft.withRecommendations(recommendationSynthesizer.synthesize(draft));
        log.info("Analyzed {}: {} points, {} recommendations, {} degradations",
                series.key(), values.length, report.recommendations().size(), degradations.size());
        return report;
    }

    public SectionResult<TrendResult> analyzeTrends(TimeSeries series) {
        return analyzeTrend(series, new ArrayList<>());
    }

    public SectionResult<StatisticsReport> analyzeStatistics(List<Cohort> cohorts) {
        if (cohorts.size() < 2) {
            return SectionResult.insufficient("cohort comparison needs at least 2 cohorts, got " + cohorts.size());
        }
        return guarded("statistics", new ArrayList<>(), () -> SectionResult.ok(statisticalAnalyzer.analyze(cohorts)));
    }

    private SectionResult<TrendResult> analyzeTrend(TimeSeries series, List<String> warnings) {
        return guarded("trend", warnings, () -> series.size() < 2
                ? SectionResult.insufficient("trend needs at least 2 points")
                : SectionResult.ok(trendAnalyzer.calculateTrend(series)));
    }

    private SectionResult<ForecastResult> generatePredictions(TimeSeries series, SectionResult<TrendResult> trend,
                                                             List<String> warnings, List<String> degradations) {
        int required = properties.windowSize() + 1;
        if (series.size() < required) {
            return SectionResult.insufficient("forecast needs at least " + required + " points, got " + series.size());
        }
        SectionResult<ForecastResult> forecast = guarded("forecast", warnings,
                () -> predictiveAnalyzer.generateForecast(series, properties.forecastHorizon(), trend.value()));
        if (forecast.status() == SectionResult.Status.DEGRADED) {
            degradations.add("forecast: " + forecast.reason());
        }
        return forecast;
    }

    /**
     * Pearson correlation with other metrics of the same length, kept when |r| > 0.5.
     */
    Map<String, Double> relatedMetrics(TimeSeries series, List<TimeSeries> others) {
        Map<String, Double> related = new LinkedHashMap<>();
        double[] values = series.values();
        for (TimeSeries other : others) {
            if (other.size() != values.length || values.length < 3) {
                continue;
            }
            double[] otherValues = other.values();
            if (!allFinite(otherValues)) {
                continue;
            }
            double r = SampleStatistics.pearson(values, otherValues);
            if (Math.abs(r) > RELATED_METRIC_CORRELATION) {
                related.put(other.key().toString(), r);
            }
        }
        return related;
    }

    private static boolean allFinite(double[] values) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    private static <T> SectionResult<T> guarded(String section, List<String> warnings,
                                                Supplier<SectionResult<T>> computation) {
        try {
            return computation.get();
        } catch (NumericFaultException ex) {
            log.warn("Numeric fault in {} section: {}", section, ex.getMessage());
            warnings.add(section + ": " + ex.getMessage());
            return SectionResult.insufficient("numeric fault: " + ex.getMessage());
        }
    }
}
