package com.perfwatch.analytics.trend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.perfwatch.analytics.config.AnalyticsProperties;
import com.perfwatch.analytics.error.SeriesValidationException;
import com.perfwatch.analytics.model.AnomalySet;
import com.perfwatch.analytics.model.PatternMatch;
import com.perfwatch.analytics.model.SeasonalityResult;
import com.perfwatch.analytics.model.TrendResult;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TrendAnalyzerTest {

    private final TrendAnalyzer analyzer = new TrendAnalyzer(AnalyticsProperties.defaults());

    @Test
    void linearSeriesHasStrongIncreasingTrend() {
        TrendResult trend = analyzer.calculateTrend(new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10});

        assertThat(trend.slope()).isCloseTo(1.0, within(1e-9));
        assertThat(trend.intercept()).isCloseTo(1.0, within(1e-9));
        assertThat(trend.correlation()).isCloseTo(1.0, within(1e-9));
        assertThat(trend.direction()).isEqualTo(TrendResult.Direction.INCREASING);
        assertThat(trend.strength()).isEqualTo(TrendResult.Strength.STRONG);
    }

    @Test
    void correlationSurvivesValuesNearDoubleRange() {
        TrendResult trend = analyzer.calculateTrend(new double[]{1e200, 2e200, 3e200, 4e200, 5e200});

        assertThat(trend.correlation()).isCloseTo(1.0, within(1e-12));
        assertThat(trend.strength()).isEqualTo(TrendResult.Strength.STRONG);
        assertThat(trend.slope()).isCloseTo(1e200, within(1e188));
    }

    @Test
    void constantSeriesHasZeroCorrelationNotNaN() {
        TrendResult trend = analyzer.calculateTrend(new double[]{5, 5, 5, 5});

        assertThat(trend.slope()).isZero();
        assertThat(trend.correlation()).isZero();
        assertThat(trend.strength()).isEqualTo(TrendResult.Strength.WEAK);
    }

    @Test
    void singlePointGivesNeutralTrend() {
        assertThat(analyzer.calculateTrend(new double[]{42})).isEqualTo(TrendResult.neutral());
    }

    @Test
    void rejectsNonFiniteValues() {
        assertThatThrownBy(() -> analyzer.calculateTrend(new double[]{1, Double.NaN, 3}))
                .isInstanceOf(SeriesValidationException.class)
                .hasMessageContaining("index 1");
    }

    @Test
    void detectsDailyCycleInHourlySine() {
        double[] values = new double[96];
        for (int i = 0; i < values.length; i++) {
            values[i] = 50 + 10 * Math.sin(2 * Math.PI * i / 12);
        }

        SeasonalityResult result = analyzer.detectSeasonality(values);

        assertThat(result.hasSeasonality()).isTrue();
        assertThat(result.dominantPeriod() % 12).isZero();
        assertThat(result.candidates().get(0).strength()).isGreaterThan(0.99);
        assertThat(result.candidates().get(0).kind()).isEqualTo(SeasonalityResult.Kind.SEASONAL);
        assertThat(result.candidates()).noneMatch(candidate -> candidate.period() == 6);
    }

    @Test
    void repeatedAnalysisIsIdempotent() {
        double[] values = new double[72];
        for (int i = 0; i < values.length; i++) {
            values[i] = 50 + 10 * Math.sin(2 * Math.PI * i / 12) + 0.1 * i;
        }
        TrendAnalyzer other = new TrendAnalyzer(AnalyticsProperties.defaults());

        assertThat(analyzer.calculateTrend(values)).isEqualTo(other.calculateTrend(values));
        assertThat(analyzer.calculateTrend(values)).isEqualTo(analyzer.calculateTrend(values.clone()));
        assertThat(analyzer.detectSeasonality(values)).isEqualTo(other.detectSeasonality(values));
        assertThat(analyzer.detectAnomalies(values)).isEqualTo(analyzer.detectAnomalies(values));
    }

    @Test
    void tooShortForTwoSegmentsHasNoSeasonality() {
        assertThat(analyzer.detectSeasonality(new double[]{1, 2, 3})).isEqualTo(SeasonalityResult.none());
    }

    @Test
    void segmentCorrelationOfAlternatingHalvesIsNegative() {
        assertThat(analyzer.segmentCorrelation(new double[]{1, 2, 3, 3, 2, 1, 0}, 3)).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    void flagsSingleSpike() {
        double[] values = new double[50];
        Arrays.fill(values, 1.0);
        values[25] = 100;

        AnomalySet anomalies = analyzer.detectAnomalies(values, 2.0);

        assertThat(anomalies.method()).isEqualTo(AnomalySet.Method.Z_SCORE);
        assertThat(anomalies.anomalies()).extracting(AnomalySet.Anomaly::index).containsExactly(25);
        assertThat(anomalies.anomalies().get(0).value()).isEqualTo(100.0);
        assertThat(anomalies.anomalies().get(0).score()).isCloseTo(7.0, within(1e-9));
        assertThat(anomalies.percentage()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void constantSeriesHasNoAnomalies() {
        assertThat(analyzer.detectAnomalies(new double[]{3, 3, 3, 3}).isEmpty()).isTrue();
    }

    @Test
    void emptySeriesIsRejectedForAnomalies() {
        assertThatThrownBy(() -> analyzer.detectAnomalies(new double[0]))
                .isInstanceOf(SeriesValidationException.class);
    }

    @Test
    void detrendingIsolatesSpikeOnTrendingSeries() {
        double[] values = new double[40];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        values[20] += 50;

        AnomalySet raw = analyzer.detectAnomalies(values, 1.4, false);
        AnomalySet detrended = analyzer.detectAnomalies(values, 2.0, true);

        assertThat(raw.count()).isGreaterThan(1);
        assertThat(raw.anomalies()).extracting(AnomalySet.Anomaly::index).contains(0, 20);
        assertThat(detrended.anomalies()).extracting(AnomalySet.Anomaly::index).containsExactly(20);
    }

    @Test
    void findsMostFrequentRepeatedSequence() {
        double[] values = {1, 2, 3, 1, 2, 3, 1, 2, 3, 1, 2, 3};

        List<PatternMatch> patterns = analyzer.findPatterns(values, 0.1);

        assertThat(patterns).hasSizeLessThanOrEqualTo(5);
        PatternMatch top = patterns.get(0);
        assertThat(top.sequence()).containsExactly(1.0, 2.0, 3.0);
        assertThat(top.positions()).containsExactly(0, 3, 6, 9);
        assertThat(top.occurrences()).isEqualTo(4);
    }

    @Test
    void noRepeatsMeansNoPatterns() {
        assertThat(analyzer.findPatterns(new double[]{1, 10, 100, 1000, 10000, 100000}, 0.01)).isEmpty();
    }
}
