package com.perfwatch.analytics.config;

import com.perfwatch.analytics.predict.IntervalPolicy;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "perfwatch.analytics")
public record AnalyticsProperties(
        Integer windowSize,
        Integer forecastHorizon,
        Double anomalyZThreshold,
        Boolean anomalyDetrend,
        Double seasonalityMinCorrelation,
        Double significanceAlpha,
        Duration modelCacheTtl,
        Integer retentionDays,
        Double retrainGrowthRatio,
        IntervalPolicy intervalPolicy,
        List<String> lowerIsBetterMetrics,
        Training training,
        Risk risk,
        Patterns patterns
) {

    @ConstructorBinding
    public AnalyticsProperties {
        windowSize = windowSize == null ? 24 : windowSize;
        forecastHorizon = forecastHorizon == null ? 24 : forecastHorizon;
        anomalyZThreshold = anomalyZThreshold == null ? 2.0 : anomalyZThreshold;
        anomalyDetrend = anomalyDetrend != null && anomalyDetrend;
        seasonalityMinCorrelation = seasonalityMinCorrelation == null ? 0.6 : seasonalityMinCorrelation;
        significanceAlpha = significanceAlpha == null ? 0.05 : significanceAlpha;
        modelCacheTtl = modelCacheTtl == null ? Duration.ofHours(6) : modelCacheTtl;
        retentionDays = retentionDays == null ? 30 : retentionDays;
        retrainGrowthRatio = retrainGrowthRatio == null ? 0.2 : retrainGrowthRatio;
        intervalPolicy = intervalPolicy == null ? IntervalPolicy.SQRT_STEP : intervalPolicy;
        lowerIsBetterMetrics = lowerIsBetterMetrics == null
                ? List.of("execution", "latency", "duration", "memory", "cpu", "trainingtime")
                : lowerIsBetterMetrics.stream().map(name -> name.toLowerCase(Locale.ROOT)).toList();
        training = training == null ? new Training(null, null, null, null, null) : training;
        risk = risk == null ? new Risk(null, null, null, null) : risk;
        patterns = patterns == null ? new Patterns(null, null) : patterns;

        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be at least 2");
        }
        if (forecastHorizon <= 0) {
            throw new IllegalArgumentException("forecastHorizon must be positive");
        }
        if (anomalyZThreshold <= 0) {
            throw new IllegalArgumentException("anomalyZThreshold must be positive");
        }
        if (seasonalityMinCorrelation <= 0 || seasonalityMinCorrelation >= 1) {
            throw new IllegalArgumentException("seasonalityMinCorrelation must be within (0, 1)");
        }
        if (significanceAlpha <= 0 || significanceAlpha >= 1) {
            throw new IllegalArgumentException("significanceAlpha must be within (0, 1)");
        }
        if (modelCacheTtl.isNegative() || modelCacheTtl.isZero()) {
            throw new IllegalArgumentException("modelCacheTtl must be positive");
        }
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be positive");
        }
        if (retrainGrowthRatio < 0) {
            throw new IllegalArgumentException("retrainGrowthRatio must not be negative");
        }
    }

    public static AnalyticsProperties defaults() {
        return new AnalyticsProperties(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * True when a rising value of the metric is bad news (latency, memory). Matched on the
     * metric type or name by substring.
     */
    public boolean isLowerBetter(String metric) {
        if (metric == null) {
            return false;
        }
        String normalized = metric.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        return lowerIsBetterMetrics.stream().anyMatch(normalized::contains);
    }

    public record Training(Integer epochs, Double learningRate, Double validationSplit, Integer batchSize, Long seed) {
        public Training {
            epochs = epochs == null ? 200 : epochs;
            learningRate = learningRate == null ? 0.05 : learningRate;
            validationSplit = validationSplit == null ? 0.2 : validationSplit;
            batchSize = batchSize == null ? 32 : batchSize;
            seed = seed == null ? 42L : seed;
            if (epochs <= 0) {
                throw new IllegalArgumentException("epochs must be positive");
            }
            if (learningRate <= 0) {
                throw new IllegalArgumentException("learningRate must be positive");
            }
            if (validationSplit < 0 || validationSplit >= 1) {
                throw new IllegalArgumentException("validationSplit must be within [0, 1)");
            }
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
        }
    }

    public record Risk(
            Double growthRateThreshold,
            Double consistencyRatio,
            List<String> leakMetricTypes,
            Map<String, Double> thresholds
    ) {
        public Risk {
            growthRateThreshold = growthRateThreshold == null ? 0.0 : growthRateThreshold;
            consistencyRatio = consistencyRatio == null ? 0.8 : consistencyRatio;
            leakMetricTypes = leakMetricTypes == null
                    ? List.of("memory", "heap")
                    : leakMetricTypes.stream().map(type -> type.toLowerCase(Locale.ROOT)).toList();
            thresholds = thresholds == null ? Map.of() : Map.copyOf(thresholds);
            if (consistencyRatio <= 0 || consistencyRatio > 1) {
                throw new IllegalArgumentException("consistencyRatio must be within (0, 1]");
            }
        }

        public boolean isLeakType(String metricType) {
            String normalized = metricType == null ? "" : metricType.toLowerCase(Locale.ROOT);
            return leakMetricTypes.stream().anyMatch(normalized::contains);
        }

        public Double thresholdFor(String metricType) {
            if (metricType == null) {
                return null;
            }
            Double exact = thresholds.get(metricType);
            return exact != null ? exact : thresholds.get(metricType.toLowerCase(Locale.ROOT));
        }
    }

    public record Patterns(Double tolerance, Integer maxResults) {
        public Patterns {
            tolerance = tolerance == null ? 0.1 : tolerance;
            maxResults = maxResults == null ? 5 : maxResults;
            if (tolerance <= 0) {
                throw new IllegalArgumentException("tolerance must be positive");
            }
            if (maxResults <= 0) {
                throw new IllegalArgumentException("maxResults must be positive");
            }
        }
    }
}
