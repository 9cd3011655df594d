package com.perfwatch.analytics.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.error.SeriesValidationException;
import com.perfwatch.analytics.model.AnalysisReport;
import com.perfwatch.analytics.model.Cohort;
import com.perfwatch.analytics.model.ForecastResult;
import com.perfwatch.analytics.model.MetricBucket;
import com.perfwatch.analytics.model.MetricKey;
import com.perfwatch.analytics.model.Recommendation;
import com.perfwatch.analytics.model.RiskAssessment;
import com.perfwatch.analytics.model.SectionResult;
import com.perfwatch.analytics.model.TimeRange;
import com.perfwatch.analytics.model.TimeSeries;
import com.perfwatch.analytics.model.TrendResult;
import com.perfwatch.analytics.predict.AutoregressiveTrainer;
import com.perfwatch.analytics.predict.ModelRegistry;
import com.perfwatch.analytics.predict.PredictiveAnalyzer;
import com.perfwatch.analytics.predict.ReconstructionAnomalyDetector;
import com.perfwatch.analytics.predict.RiskScorer;
import com.perfwatch.analytics.recommend.RecommendationSynthesizer;
import com.perfwatch.analytics.source.TimeSeriesSource;
import com.perfwatch.analytics.stats.StatisticalAnalyzer;
import com.perfwatch.analytics.trend.SeriesProfiler;
import com.perfwatch.analytics.trend.TrendAnalyzer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AnalysisServiceTest {

    private static final MetricKey HEAP = MetricKey.of("memory", "heap_used");
    private static final MetricKey GC = MetricKey.of("gc", "pause_count");

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final TimeSeriesSource source = mock(TimeSeriesSource.class);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void growingHeapProducesFullReport() {
        AnalysisService service = service(properties(null));

        AnalysisReport report = service.analyze(TimeSeries.of(HEAP, ramp(40, 100, 2)));

        assertThat(report.metric()).isEqualTo(HEAP);
        assertThat(report.trend().value().direction()).isEqualTo(TrendResult.Direction.INCREASING);
        assertThat(report.forecast().status()).isEqualTo(SectionResult.Status.OK);
        assertThat(report.forecast().value().values()).hasSize(5);
        assertThat(report.forecast().value().method()).isEqualTo(ForecastResult.Method.SEQUENCE_MODEL);
        assertThat(report.risk().value().kind()).isEqualTo(RiskAssessment.Kind.LEAK);
        assertThat(report.statistics()).isNull();
        assertThat(report.recommendations()).extracting(Recommendation::type)
                .contains(Recommendation.Type.PERFORMANCE_DEGRADATION, Recommendation.Type.MEMORY_LEAK);
        assertThat(report.recommendations().get(0).priority()).isEqualTo(Recommendation.Priority.HIGH);
        assertThat(report.metadata().sampleCount()).isEqualTo(40);
        assertThat(report.metadata().generatedAt()).isEqualTo(clock.instant());
        assertThat(report.metadata().degradations()).isEmpty();
    }

    @Test
    void shortSeriesMarksSectionsInsufficient() {
        AnalysisService service = service(properties(null));

        AnalysisReport report = service.analyze(TimeSeries.of(HEAP, 1, 2, 3, 4, 5));

        assertThat(report.trend().status()).isEqualTo(SectionResult.Status.OK);
        assertThat(report.seasonality().status()).isEqualTo(SectionResult.Status.OK);
        assertThat(report.patterns().status()).isEqualTo(SectionResult.Status.INSUFFICIENT_DATA);
        assertThat(report.forecast().status()).isEqualTo(SectionResult.Status.INSUFFICIENT_DATA);
        assertThat(report.forecast().reason()).contains("at least 9");
        assertThat(report.reconstructionAnomalies().status()).isEqualTo(SectionResult.Status.INSUFFICIENT_DATA);
        assertThat(report.risk().status()).isEqualTo(SectionResult.Status.OK);
    }

    @Test
    void singlePointHasNoTrendOrRisk() {
        AnalysisReport report = service(properties(null)).analyze(TimeSeries.of(HEAP, 7));

        assertThat(report.trend().status()).isEqualTo(SectionResult.Status.INSUFFICIENT_DATA);
        assertThat(report.risk().status()).isEqualTo(SectionResult.Status.INSUFFICIENT_DATA);
        assertThat(report.anomalies().status()).isEqualTo(SectionResult.Status.OK);
    }

    @Test
    void rejectsNonFiniteSeries() {
        AnalysisService service = service(properties(null));

        assertThatThrownBy(() -> service.analyze(TimeSeries.of(HEAP, 1, Double.NaN, 3)))
                .isInstanceOf(SeriesValidationException.class);
    }

    @Test
    void overflowingGrowthMarksProfileAndRiskInsufficient() {
        AnalysisReport report = service(properties(null)).analyze(TimeSeries.of(HEAP, 1e-310, 1, 2, 3, 4));

        assertThat(report.trend().status()).isEqualTo(SectionResult.Status.OK);
        assertThat(report.risk().status()).isEqualTo(SectionResult.Status.INSUFFICIENT_DATA);
        assertThat(report.profile().status()).isEqualTo(SectionResult.Status.INSUFFICIENT_DATA);
        assertThat(report.metadata().warnings())
                .anySatisfy(warning -> assertThat(warning).startsWith("risk: "))
                .anySatisfy(warning -> assertThat(warning).startsWith("profile: "));
        assertThat(report.recommendations()).extracting(Recommendation::type)
                .doesNotContain(Recommendation.Type.MEMORY_LEAK);
    }

    @Test
    void failedTrainingDegradesForecast() {
        AnalysisService service = service(properties(new AnalyticsProperties.Training(50, 1e6, null, null, null)));

        AnalysisReport report = service.analyze(TimeSeries.of(HEAP, wave(40)));

        assertThat(report.forecast().status()).isEqualTo(SectionResult.Status.DEGRADED);
        assertThat(report.forecast().value().method()).isEqualTo(ForecastResult.Method.LINEAR_EXTRAPOLATION);
        assertThat(report.metadata().degradations()).singleElement().asString().startsWith("forecast: ");
        assertThat(report.reconstructionAnomalies().status()).isEqualTo(SectionResult.Status.INSUFFICIENT_DATA);
    }

    @Test
    void analyzesMetricsFromSourceInRequestOrder() {
        TimeRange range = new TimeRange(Instant.parse("2024-06-01T00:00:00Z"), Instant.parse("2024-06-02T00:00:00Z"));
        when(source.query("memory", "heap_used", Duration.ofHours(1), range)).thenReturn(buckets(ramp(12, 100, 2)));
        when(source.query("gc", "pause_count", Duration.ofHours(1), range)).thenReturn(buckets(ramp(12, 5, 1)));

        List<AnalysisReport> reports = service(properties(null))
                .analyzeMetrics(List.of(HEAP, GC), Duration.ofHours(1), range, null);

        assertThat(reports).extracting(AnalysisReport::metric).containsExactly(HEAP, GC);
        assertThat(reports.get(0).metadata().sampleCount()).isEqualTo(12);
        assertThat(reports.get(0).metadata().relatedMetrics()).containsOnlyKeys("gc:pause_count");
        assertThat(reports.get(1).metadata().relatedMetrics()).containsOnlyKeys("memory:heap_used");
    }

    @Test
    void cohortsAddStatisticsSection() {
        List<Cohort> cohorts = List.of(
                Cohort.ofScores("v1", Map.of("latency", 10.0)),
                Cohort.ofScores("v2", Map.of("latency", 12.0)),
                Cohort.ofScores("v3", Map.of("latency", 14.0))
        );

        AnalysisReport report = service(properties(null))
                .analyze(TimeSeries.of(HEAP, ramp(12, 100, 2)), List.of(), cohorts);

        assertThat(report.statistics().status()).isEqualTo(SectionResult.Status.OK);
        assertThat(report.statistics().value().cohortCount()).isEqualTo(3);
        assertThat(report.recommendations()).extracting(Recommendation::type)
                .contains(Recommendation.Type.STATISTICAL_REGRESSION);
    }

    @Test
    void singleCohortIsInsufficientForStatistics() {
        SectionResult<?> section = service(properties(null))
                .analyzeStatistics(List.of(Cohort.ofScores("v1", Map.of("latency", 10.0))));

        assertThat(section.status()).isEqualTo(SectionResult.Status.INSUFFICIENT_DATA);
    }

    private AnalysisService service(AnalyticsProperties props) {
        TrendAnalyzer trendAnalyzer = new TrendAnalyzer(props);
        PredictiveAnalyzer predictiveAnalyzer = new PredictiveAnalyzer(
                props,
                new ModelRegistry(Duration.ofHours(6), 0.2, clock),
                new AutoregressiveTrainer(props, clock),
                new ReconstructionAnomalyDetector(props),
                new RiskScorer(props),
                trendAnalyzer,
                executor
        );
        return new AnalysisService(
                source,
                trendAnalyzer,
                new SeriesProfiler(trendAnalyzer, props),
                predictiveAnalyzer,
                new StatisticalAnalyzer(props),
                new RecommendationSynthesizer(props),
                props,
                executor,
                clock
        );
    }

    private static AnalyticsProperties properties(AnalyticsProperties.Training training) {
        return new AnalyticsProperties(8, 5, null, null, null, null, null, null, null, null, null,
                training != null ? training : new AnalyticsProperties.Training(50, null, null, null, null), null, null);
    }

    private static double[] ramp(int n, double start, double step) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = start + step * i;
        }
        return values;
    }

    private static double[] wave(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = 50 + 10 * Math.sin(i / 3.0) + i;
        }
        return values;
    }

    private static List<MetricBucket> buckets(double[] values) {
        List<MetricBucket> buckets = new ArrayList<>();
        Instant start = Instant.parse("2024-06-01T00:00:00Z");
        for (int i = 0; i < values.length; i++) {
            buckets.add(new MetricBucket(start.plus(Duration.ofHours(i)), values[i], values[i], values[i], 1));
        }
        return buckets;
    }
}
