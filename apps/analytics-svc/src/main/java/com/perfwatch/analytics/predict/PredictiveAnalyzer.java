package com.perfwatch.analytics.predict;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.error.ModelTrainingException;
import com.perfwatch.analytics.error.NumericFaultException;
import com.perfwatch.analytics.error.SeriesValidationException;
import com.perfwatch.analytics.model.AnomalySet;
import com.perfwatch.analytics.model.ForecastResult;
import com.perfwatch.analytics.model.Interval;
import com.perfwatch.analytics.model.RiskAssessment;
import com.perfwatch.analytics.model.SectionResult;
import com.perfwatch.analytics.model.TimeSeries;
import com.perfwatch.analytics.model.TrendResult;
import com.perfwatch.analytics.stats.SampleStatistics;
import com.perfwatch.analytics.trend.TrendAnalyzer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Forecasting, leak/saturation risk and learned anomaly detection for one metric series.
 * Trained models are cached per metric key in the {@link ModelRegistry}.
 */
@Service
public class PredictiveAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PredictiveAnalyzer.class);
    private static final double Z_95 = 1.96d;

    private final AnalyticsProperties properties;
    private final ModelRegistry registry;
    private final AutoregressiveTrainer trainer;
    private final ReconstructionAnomalyDetector reconstructionDetector;
    private final RiskScorer riskScorer;
    private final TrendAnalyzer trendAnalyzer;
    private final ExecutorService analysisExecutor;

    public PredictiveAnalyzer(AnalyticsProperties properties,
                              ModelRegistry registry,
                              AutoregressiveTrainer trainer,
                              ReconstructionAnomalyDetector reconstructionDetector,
                              RiskScorer riskScorer,
                              TrendAnalyzer trendAnalyzer,
                              ExecutorService analysisExecutor) {
        this.properties = properties;
        this.registry = registry;
        this.trainer = trainer;
        this.reconstructionDetector = reconstructionDetector;
        this.riskScorer = riskScorer;
        this.trendAnalyzer = trendAnalyzer;
        this.analysisExecutor = analysisExecutor;
    }

    public SupervisedWindows prepareWindows(double[] values) {
        return SupervisedWindows.prepare(values, properties.windowSize());
    }

    public ModelRegistry.State modelState(TimeSeries series) {
        return registry.state(series.key(), series.size());
    }

    /**
     * Starts (or joins) background training for the series' key.
     */
    public TrainingHandle trainAsync(TimeSeries series) {
        double[] values = forecastable(series);
        int windowSize = properties.windowSize();
        return registry.trainAsync(series.key(), token -> trainer.train(values, windowSize, token), analysisExecutor);
    }

    public SectionResult<ForecastResult> generateForecast(TimeSeries series) {
        return generateForecast(series, properties.forecastHorizon(), null);
    }

    /**
     * Iterative multi-step forecast: each prediction is fed back into the window. Falls back to
     * extrapolating {@code trend} when the model cannot be trained.
     *
     * @throws SeriesValidationException when the series has fewer than windowSize + 1 points
     */
    public SectionResult<ForecastResult> generateForecast(TimeSeries series, int horizon, TrendResult trend) {
        if (horizon <= 0) {
            throw new IllegalArgumentException("horizon must be positive");
        }
        double[] values = forecastable(series);
        TrendResult historicalTrend = trend != null ? trend : trendAnalyzer.calculateTrend(values);
        int windowSize = properties.windowSize();
        try {
            AutoregressiveModel model = acquireModel(series, values, windowSize);
            double[] forecast = iterate(series, model, values, horizon);
            double residualStd = model.validationRmse().orElse(differenceStdDev(values));
            return SectionResult.ok(buildResult(values, forecast, residualStd, ForecastResult.Method.SEQUENCE_MODEL));
        } catch (ModelTrainingException | CancellationException ex) {
            log.warn("Sequence model unavailable for {}, falling back to linear extrapolation: {}",
                    series.key(), ex.getMessage());
            double[] forecast = new double[horizon];
            for (int step = 1; step <= horizon; step++) {
                forecast[step - 1] = historicalTrend.valueAt(values.length - 1 + step);
            }
            ForecastResult fallback = buildResult(values, forecast, differenceStdDev(values),
                    ForecastResult.Method.LINEAR_EXTRAPOLATION);
            return SectionResult.degraded(fallback, "sequence model training failed: " + ex.getMessage());
        }
    }

    /**
     * A shared run cancelled by another caller is retried once on this thread.
     */
    private AutoregressiveModel acquireModel(TimeSeries series, double[] values, int windowSize) {
        ModelTrainer modelTrainer = token -> trainer.train(values, windowSize, token);
        try {
            return registry.getOrTrain(series.key(), values.length, modelTrainer);
        } catch (CancellationException ex) {
            if (Thread.currentThread().isInterrupted()) {
                throw ex;
            }
            log.info("Shared training for {} was cancelled, retraining: {}", series.key(), ex.getMessage());
            return registry.getOrTrain(series.key(), values.length, modelTrainer);
        }
    }

    public RiskAssessment assessRisk(TimeSeries series, TrendResult trend) {
        return riskScorer.assess(series.key(), series.values(), trend, properties.forecastHorizon());
    }

    public SectionResult<AnomalySet> detectReconstructionAnomalies(TimeSeries series) {
        int windowSize = properties.windowSize();
        if (series.size() < windowSize + 1) {
            return SectionResult.insufficient("reconstruction needs at least " + (windowSize + 1)
                    + " points, got " + series.size());
        }
        try {
            return SectionResult.ok(reconstructionDetector.detect(series.values(), windowSize));
        } catch (ModelTrainingException ex) {
            log.warn("Reconstruction model failed for {}: {}", series.key(), ex.getMessage());
            return SectionResult.insufficient("reconstruction model failed: " + ex.getMessage());
        }
    }

    private double[] forecastable(TimeSeries series) {
        double[] values = series.values();
        SampleStatistics.requireFinite(values, "series " + series.key());
        int required = properties.windowSize() + 1;
        if (values.length < required) {
            throw new SeriesValidationException("series " + series.key() + " has " + values.length
                    + " points; forecasting needs at least " + required);
        }
        return values;
    }

    private double[] iterate(TimeSeries series, AutoregressiveModel model, double[] values, int horizon) {
        int windowSize = model.windowSize();
        double[] window = Arrays.copyOfRange(values, values.length - windowSize, values.length);
        double[] forecast = new double[horizon];
        for (int step = 0; step < horizon; step++) {
            double next = model.predictNext(window);
            if (!Double.isFinite(next)) {
                registry.invalidate(series.key());
                throw new ModelTrainingException("model produced a non-finite forecast at step " + (step + 1));
            }
            forecast[step] = next;
            System.arraycopy(window, 1, window, 0, windowSize - 1);
            window[windowSize - 1] = next;
        }
        return forecast;
    }

    private ForecastResult buildResult(double[] history, double[] forecast, double residualStd,
                                       ForecastResult.Method method) {
        IntervalPolicy policy = properties.intervalPolicy();
        List<Double> forecastValues = new ArrayList<>(forecast.length);
        List<Interval> intervals = new ArrayList<>(forecast.length);
        for (int i = 0; i < forecast.length; i++) {
            forecastValues.add(forecast[i]);
            double halfWidth = NumericFaultException.requireFinite(
                    Z_95 * residualStd * policy.multiplier(i + 1), "confidence interval half-width");
            intervals.add(Interval.around(forecast[i], halfWidth));
        }
        return new ForecastResult(
                forecast.length,
                List.copyOf(forecastValues),
                List.copyOf(intervals),
                NumericFaultException.requireFinite(confidenceScore(history, residualStd), "forecast confidence"),
                method,
                trendAnalyzer.calculateTrend(forecast)
        );
    }

    /**
     * Weighted blend of model error (0.4), historical volatility (0.3) and sample size (0.3).
     */
    static double confidenceScore(double[] history, double residualStd) {
        double range = MinMaxScaler.fit(history).range();
        double error = Math.min(1d, residualStd / range);
        double rawVolatility = SampleStatistics.populationStdDev(SampleStatistics.relativeChanges(history));
        // overflowing relative changes count as fully volatile
        double volatility = Double.isFinite(rawVolatility) ? Math.min(1d, rawVolatility) : 1d;
        double sample = Math.min(history.length / 100d, 1d);
        double score = (1d - error) * 0.4 + (1d - volatility) * 0.3 + sample * 0.3;
        return Math.max(0d, Math.min(1d, score));
    }

    private static double differenceStdDev(double[] values) {
        return SampleStatistics.populationStdDev(SampleStatistics.firstDifferences(values));
    }
}
