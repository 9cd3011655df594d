package com.perfwatch.analytics.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full analysis of one metric. {@code statistics} is null unless cohorts were supplied.
 */
public record AnalysisReport(
        MetricKey metric,
        SectionResult<TrendResult> trend,
        SectionResult<SeasonalityResult> seasonality,
        SectionResult<AnomalySet> anomalies,
        SectionResult<ForecastResult> forecast,
        SectionResult<RiskAssessment> risk,
        SectionResult<StatisticsReport> statistics,
        List<Recommendation> recommendations,
        SectionResult<SeriesProfile> profile,
        SectionResult<List<PatternMatch>> patterns,
        SectionResult<AnomalySet> reconstructionAnomalies,
        Metadata metadata
) {
    public record Metadata(
            Instant generatedAt,
            int sampleCount,
            Map<String, Double> relatedMetrics,
            List<String> warnings,
            List<String> degradations
    ) {
    }

    public AnalysisReport withRecommendations(List<Recommendation> recommendations) {
        return new AnalysisReport(metric, trend, seasonality, anomalies, forecast, risk, statistics,
                List.copyOf(recommendations), profile, patterns, reconstructionAnomalies, metadata);
    }
}
