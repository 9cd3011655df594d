package com.perfwatch.analytics.model;

import java.util.List;
import java.util.Map;

/**
 * Cross-cohort statistics for every compared metric plus pairwise metric correlations.
 */
public record StatisticsReport(
        int cohortCount,
        Map<String, MetricStatistics> metrics,
        Map<String, SectionResult<CorrelationResult>> correlations,
        List<String> warnings
) {
    public record MetricStatistics(
            SectionResult<List<SignificanceResult>> significance,
            SectionResult<DistributionProfile> distribution,
            SectionResult<EffectSize> effectSize,
            SectionResult<CohortRegression> regression
    ) {
    }
}
