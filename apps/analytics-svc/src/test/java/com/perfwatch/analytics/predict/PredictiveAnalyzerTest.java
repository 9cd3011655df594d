package com.perfwatch.analytics.predict;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.error.ModelTrainingException;
import com.perfwatch.analytics.error.SeriesValidationException;
import com.perfwatch.analytics.model.ForecastResult;
import com.perfwatch.analytics.model.Interval;
import com.perfwatch.analytics.model.MetricKey;
import com.perfwatch.analytics.model.SectionResult;
import com.perfwatch.analytics.model.TimeSeries;
import com.perfwatch.analytics.trend.TrendAnalyzer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PredictiveAnalyzerTest {

    private static final MetricKey KEY = MetricKey.of("latency", "checkout");

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void forecastsRampWithSequenceModel() {
        PredictiveAnalyzer analyzer = analyzer(properties(IntervalPolicy.SQRT_STEP), null);
        TimeSeries series = TimeSeries.of(KEY, AutoregressiveTrainerTest.ramp(60));

        SectionResult<ForecastResult> result = analyzer.generateForecast(series, 5, null);

        assertThat(result.status()).isEqualTo(SectionResult.Status.OK);
        ForecastResult forecast = result.value();
        assertThat(forecast.method()).isEqualTo(ForecastResult.Method.SEQUENCE_MODEL);
        assertThat(forecast.values()).hasSize(5);
        assertThat(forecast.values().get(0)).isCloseTo(60.0, within(1.0));
        assertThat(forecast.values().get(4)).isGreaterThan(forecast.values().get(0));
        assertThat(forecast.confidenceScore()).isBetween(0.0, 1.0);
        assertThat(analyzer.modelState(series)).isEqualTo(ModelRegistry.State.TRAINED);
    }

    @Test
    void intervalsWidenWithStepUnderSqrtPolicy() {
        PredictiveAnalyzer analyzer = analyzer(properties(IntervalPolicy.SQRT_STEP), null);
        TimeSeries series = TimeSeries.of(KEY, AutoregressiveTrainerTest.noisySeries(80));

        ForecastResult forecast = analyzer.generateForecast(series, 6, null).value();

        List<Interval> intervals = forecast.confidenceIntervals();
        for (int i = 1; i < intervals.size(); i++) {
            assertThat(intervals.get(i).width()).isGreaterThanOrEqualTo(intervals.get(i - 1).width());
        }
        assertThat(intervals.get(5).width()).isGreaterThan(intervals.get(0).width());
        for (int i = 0; i < intervals.size(); i++) {
            assertThat(forecast.values().get(i)).isBetween(intervals.get(i).lower(), intervals.get(i).upper());
        }
    }

    @Test
    void constantPolicyKeepsWidthFixed() {
        PredictiveAnalyzer analyzer = analyzer(properties(IntervalPolicy.CONSTANT), null);
        TimeSeries series = TimeSeries.of(KEY, AutoregressiveTrainerTest.noisySeries(80));

        List<Interval> intervals = analyzer.generateForecast(series, 4, null).value().confidenceIntervals();

        assertThat(intervals).extracting(Interval::width)
                .allSatisfy(width -> assertThat(width).isCloseTo(intervals.get(0).width(), within(1e-9)));
    }

    @Test
    void forecastIsDeterministicForFixedSeed() {
        TimeSeries series = TimeSeries.of(KEY, AutoregressiveTrainerTest.noisySeries(80));

        List<Double> first = analyzer(properties(IntervalPolicy.SQRT_STEP), null)
                .generateForecast(series, 5, null).value().values();
        List<Double> second = analyzer(properties(IntervalPolicy.SQRT_STEP), null)
                .generateForecast(series, 5, null).value().values();

        assertThat(first).containsExactlyElementsOf(second);
    }

    @Test
    void shortSeriesIsRejectedBeforeTraining() {
        AutoregressiveTrainer trainer = mock(AutoregressiveTrainer.class);
        PredictiveAnalyzer analyzer = analyzer(properties(IntervalPolicy.SQRT_STEP), trainer);
        TimeSeries series = TimeSeries.of(KEY, AutoregressiveTrainerTest.ramp(8));

        assertThatThrownBy(() -> analyzer.generateForecast(series, 5, null))
                .isInstanceOf(SeriesValidationException.class)
                .hasMessageContaining("at least 9");
        verifyNoInteractions(trainer);
    }

    @Test
    void trainingFailureFallsBackToLinearExtrapolation() {
        AutoregressiveTrainer trainer = mock(AutoregressiveTrainer.class);
        when(trainer.train(any(), anyInt(), any())).thenThrow(new ModelTrainingException("training diverged at epoch 3"));
        PredictiveAnalyzer analyzer = analyzer(properties(IntervalPolicy.SQRT_STEP), trainer);
        TimeSeries series = TimeSeries.of(KEY, AutoregressiveTrainerTest.ramp(40));

        SectionResult<ForecastResult> result = analyzer.generateForecast(series, 3, null);

        assertThat(result.status()).isEqualTo(SectionResult.Status.DEGRADED);
        assertThat(result.reason()).contains("diverged");
        assertThat(result.value().method()).isEqualTo(ForecastResult.Method.LINEAR_EXTRAPOLATION);
        assertThat(result.value().values().get(0)).isCloseTo(40.0, within(1e-9));
        assertThat(result.value().values().get(2)).isCloseTo(42.0, within(1e-9));
    }

    @Test
    void cachedModelIsReusedAcrossForecasts() {
        AutoregressiveTrainer trainer = mock(AutoregressiveTrainer.class);
        when(trainer.train(any(), anyInt(), any())).thenReturn(persistenceModel(40));
        PredictiveAnalyzer analyzer = analyzer(properties(IntervalPolicy.SQRT_STEP), trainer);
        TimeSeries series = TimeSeries.of(KEY, AutoregressiveTrainerTest.ramp(40));

        analyzer.generateForecast(series, 3, null);
        SectionResult<ForecastResult> second = analyzer.generateForecast(series, 3, null);

        verify(trainer, times(1)).train(any(), anyInt(), any());
        assertThat(second.value().values()).containsOnly(39.0);
    }

    @Test
    void forecastRetrainsWhenJoinedRunIsCancelled() throws Exception {
        AutoregressiveTrainer trainer = mock(AutoregressiveTrainer.class);
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        when(trainer.train(any(), anyInt(), any())).thenAnswer(invocation -> {
            if (calls.incrementAndGet() > 1) {
                return persistenceModel(40);
            }
            CancellationToken token = invocation.getArgument(2);
            started.countDown();
            while (true) {
                token.throwIfCancelled();
                Thread.onSpinWait();
            }
        });
        PredictiveAnalyzer analyzer = analyzer(properties(IntervalPolicy.SQRT_STEP), trainer);
        TimeSeries series = TimeSeries.of(KEY, AutoregressiveTrainerTest.ramp(40));

        TrainingHandle handle = analyzer.trainAsync(series);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        AtomicReference<SectionResult<ForecastResult>> result = new AtomicReference<>();
        Thread forecaster = new Thread(() -> result.set(analyzer.generateForecast(series, 3, null)));
        forecaster.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (forecaster.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }

        handle.cancel();
        forecaster.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(result.get()).isNotNull();
        assertThat(result.get().status()).isEqualTo(SectionResult.Status.OK);
        assertThat(result.get().value().values()).containsOnly(39.0);
        verify(trainer, times(2)).train(any(), anyInt(), any());
    }

    @Test
    void trainAsyncCompletesInBackground() throws Exception {
        PredictiveAnalyzer analyzer = analyzer(properties(IntervalPolicy.SQRT_STEP), null);
        TimeSeries series = TimeSeries.of(KEY, AutoregressiveTrainerTest.noisySeries(40));

        TrainingHandle handle = analyzer.trainAsync(series);
        AutoregressiveModel model = handle.future().get(10, TimeUnit.SECONDS);

        assertThat(model.windowSize()).isEqualTo(8);
        assertThat(analyzer.modelState(series)).isEqualTo(ModelRegistry.State.TRAINED);
    }

    @Test
    void reconstructionOnShortSeriesIsInsufficient() {
        PredictiveAnalyzer analyzer = analyzer(properties(IntervalPolicy.SQRT_STEP), null);

        SectionResult<?> result = analyzer.detectReconstructionAnomalies(TimeSeries.of(KEY, 1, 2, 3));

        assertThat(result.status()).isEqualTo(SectionResult.Status.INSUFFICIENT_DATA);
    }

    private AutoregressiveModel persistenceModel(int trainingSize) {
        return new AutoregressiveModel(new double[7], 0d, new MinMaxScaler(0d, 39d), 8, 0d, 0d,
                trainingSize, clock.instant());
    }

    private PredictiveAnalyzer analyzer(AnalyticsProperties props, AutoregressiveTrainer trainer) {
        TrendAnalyzer trendAnalyzer = new TrendAnalyzer(props);
        return new PredictiveAnalyzer(
                props,
                new ModelRegistry(Duration.ofHours(6), 0.2, clock),
                trainer != null ? trainer : new AutoregressiveTrainer(props, clock),
                new ReconstructionAnomalyDetector(props),
                new RiskScorer(props),
                trendAnalyzer,
                executor
        );
    }

    private static AnalyticsProperties properties(IntervalPolicy policy) {
        return new AnalyticsProperties(8, 5, null, null, null, null, null, null, null, policy, null,
                new AnalyticsProperties.Training(100, null, null, null, null), null, null);
    }
}
