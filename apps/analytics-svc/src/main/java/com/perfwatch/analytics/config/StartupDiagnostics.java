package com.perfwatch.analytics.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final AnalyticsProperties props;

    public StartupDiagnostics(AnalyticsProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        log.info("Analytics config: windowSize={}, forecastHorizon={}, anomalyZThreshold={}, detrend={}, seasonalityMinCorrelation={}, significanceAlpha={}",
                props.windowSize(), props.forecastHorizon(), props.anomalyZThreshold(), props.anomalyDetrend(),
                props.seasonalityMinCorrelation(), props.significanceAlpha());

        var training = props.training();
        log.info("Model config: epochs={}, learningRate={}, validationSplit={}, seed={}, cacheTtl={}, retentionDays={}, intervalPolicy={}",
                training.epochs(), training.learningRate(), training.validationSplit(), training.seed(),
                props.modelCacheTtl(), props.retentionDays(), props.intervalPolicy());

        var risk = props.risk();
        log.info("Risk config: leakMetricTypes={}, thresholds={}, growthRateThreshold={}",
                risk.leakMetricTypes(), risk.thresholds().keySet(), risk.growthRateThreshold());
    }
}
