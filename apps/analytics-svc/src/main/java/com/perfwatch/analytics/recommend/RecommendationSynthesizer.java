package com.perfwatch.analytics.recommend;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.model.AnalysisReport;
import com.perfwatch.analytics.model.AnomalySet;
import com.perfwatch.analytics.model.CohortRegression;
import com.perfwatch.analytics.model.ForecastResult;
import com.perfwatch.analytics.model.Recommendation;
import com.perfwatch.analytics.model.RiskAssessment;
import com.perfwatch.analytics.model.SeasonalityResult;
import com.perfwatch.analytics.model.SectionResult;
import com.perfwatch.analytics.model.SignificanceResult;
import com.perfwatch.analytics.model.StatisticsReport;
import com.perfwatch.analytics.model.TrendResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns analysis findings into prioritized, typed recommendations. Sections without a value
 * contribute nothing.
 */
@Component
public class RecommendationSynthesizer {

    private static final double HIGH_RISK = 0.7d;
    private static final double FORECAST_SIGNIFICANCE = 0.8d;
    private static final double ANOMALY_PERCENTAGE = 5d;
    private static final double REGRESSION_FIT = 0.5d;

    private final AnalyticsProperties properties;

    public RecommendationSynthesizer(AnalyticsProperties properties) {
        this.properties = properties;
    }

    public List<Recommendation> synthesize(AnalysisReport report) {
        List<Recommendation> recommendations = new ArrayList<>();
        String metric = report.metric().toString();
        boolean lowerBetter = properties.isLowerBetter(report.metric().metricType())
                || properties.isLowerBetter(report.metric().metricName());

        TrendResult trend = valueOf(report.trend());
        if (trend != null && lowerBetter
                && trend.direction() == TrendResult.Direction.INCREASING
                && trend.strength() == TrendResult.Strength.STRONG) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.PERFORMANCE_DEGRADATION,
                    Recommendation.Priority.HIGH,
                    metric + " is consistently degrading over time",
                    List.of("Review recent code changes", "Check for resource constraints",
                            "Consider optimization opportunities"),
                    null));
        }

        RiskAssessment risk = valueOf(report.risk());
        if (risk != null && risk.probability() > HIGH_RISK) {
            recommendations.add(riskRecommendation(metric, risk));
        }

        ForecastResult forecast = valueOf(report.forecast());
        if (forecast != null && forecast.forecastTrend().slope() > 0
                && Math.abs(forecast.forecastTrend().correlation()) > FORECAST_SIGNIFICANCE) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.PERFORMANCE_OPTIMIZATION,
                    Recommendation.Priority.HIGH,
                    "Continued growth predicted for " + metric,
                    List.of("Implement performance monitoring", "Review resource allocation",
                            "Consider scaling infrastructure"),
                    "Within 24 hours"));
        }

        AnomalySet anomalies = valueOf(report.anomalies());
        if (anomalies != null && anomalies.percentage() > ANOMALY_PERCENTAGE) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.ANOMALY_INVESTIGATION,
                    Recommendation.Priority.MEDIUM,
                    String.format(Locale.ROOT, "%d anomalous points (%.1f%%) in %s",
                            anomalies.count(), anomalies.percentage(), metric),
                    List.of("Correlate anomalies with deployments and incidents", "Check the affected time ranges in logs"),
                    null));
        }

        SeasonalityResult seasonality = valueOf(report.seasonality());
        if (seasonality != null && seasonality.hasSeasonality()) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.CAPACITY_PLANNING,
                    Recommendation.Priority.LOW,
                    metric + " repeats with a period of " + seasonality.dominantPeriod() + " samples",
                    List.of("Schedule capacity around the recurring peaks", "Align maintenance with the quiet phase"),
                    null));
        }

        StatisticsReport statistics = valueOf(report.statistics());
        if (statistics != null) {
            recommendations.addAll(synthesize(statistics));
        }

        recommendations.sort(Comparator.comparing(Recommendation::priority).reversed());
        return List.copyOf(recommendations);
    }

    /**
     * Cohort-level findings: regressing metrics and significant pairwise differences.
     */
    public List<Recommendation> synthesize(StatisticsReport statistics) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (Map.Entry<String, StatisticsReport.MetricStatistics> entry : statistics.metrics().entrySet()) {
            String metric = entry.getKey();
            CohortRegression regression = valueOf(entry.getValue().regression());
            if (regression != null && regression.direction() == CohortRegression.Direction.REGRESSING
                    && regression.rSquared() >= REGRESSION_FIT) {
                recommendations.add(new Recommendation(
                        Recommendation.Type.STATISTICAL_REGRESSION,
                        Recommendation.Priority.HIGH,
                        String.format(Locale.ROOT, "'%s' regresses across cohorts (R² %.2f)",
                                metric, regression.rSquared()),
                        List.of("Bisect the cohorts where the regression starts", "Add a guard on this metric"),
                        null));
            }
            List<SignificanceResult> pairs = valueOf(entry.getValue().significance());
            if (pairs == null) {
                continue;
            }
            List<String> significant = pairs.stream()
                    .filter(pair -> pair.significant() && !pair.degenerate())
                    .map(SignificanceResult::comparisonId)
                    .toList();
            if (!significant.isEmpty()) {
                recommendations.add(new Recommendation(
                        Recommendation.Type.SIGNIFICANT_DIFFERENCE,
                        Recommendation.Priority.MEDIUM,
                        "'" + metric + "' differs significantly in " + significant,
                        List.of("Review what changed between the compared cohorts"),
                        null));
            }
        }
        return recommendations;
    }

    private static Recommendation riskRecommendation(String metric, RiskAssessment risk) {
        String timeline = risk.estimatedTimeToEvent() == null
                ? null
                : "Within " + risk.estimatedTimeToEvent() + " steps";
        if (risk.kind() == RiskAssessment.Kind.LEAK) {
            return new Recommendation(
                    Recommendation.Type.MEMORY_LEAK,
                    Recommendation.Priority.HIGH,
                    "Potential memory leak detected in " + metric,
                    List.of("Review memory allocation patterns", "Check for unclosed resources",
                            "Consider implementing memory monitoring"),
                    timeline);
        }
        return new Recommendation(
                Recommendation.Type.RESOURCE_SATURATION,
                Recommendation.Priority.MEDIUM,
                "Resource saturation predicted for " + metric,
                List.of("Monitor utilization", "Review resource allocation", "Consider load balancing"),
                timeline);
    }

    private static <T> T valueOf(SectionResult<T> section) {
        return section == null ? null : section.value();
    }
}
