package com.modelmonitor.service;

import com.modelmonitor.config.LifecycleProperties;
import com.modelmonitor.config.LifecycleProperties.BinningStrategy;
import com.modelmonitor.config.LifecycleProperties.PsiAggregation;
import com.modelmonitor.dto.DistributionSample;
import com.modelmonitor.dto.DriftScores;
import com.modelmonitor.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DriftCalculatorTest {

    private static final double LN2 = Math.log(2.0);

    private LifecycleProperties.Drift config;
    private DriftCalculator calculator;

    @BeforeEach
    void setUp() {
        config = new LifecycleProperties.Drift();
        calculator = new DriftCalculator(config);
    }

    @Test
    void psiFromPercentages_identicalBins_isZero() {
        double[] bins = {0.1, 0.2, 0.3, 0.4};
        assertThat(calculator.psiFromPercentages(bins, bins.clone())).isEqualTo(0.0);
    }

    @Test
    void psiFromPercentages_emptyBucketUsesEpsilon() {
        double psi = calculator.psiFromPercentages(new double[] {0.5, 0.5}, new double[] {1.0, 0.0});
        assertThat(psi).isFinite().isGreaterThan(0.1);
    }

    @Test
    void psiFromPercentages_lengthMismatch_rejected() {
        assertThatThrownBy(() -> calculator.psiFromPercentages(new double[] {1.0}, new double[] {0.5, 0.5}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void score_identicalDistributions_noDrift() {
        DistributionSample baseline = Fixtures.churnBaseline();
        DriftScores scores = calculator.score(baseline, Fixtures.churnBaseline());

        assertThat(scores.psi()).isEqualTo(0.0);
        assertThat(scores.jsDivergence()).isEqualTo(0.0);
        assertThat(scores.driftDetected()).isFalse();
        assertThat(scores.featurePsi()).containsOnlyKeys("tenure");
    }

    @Test
    void score_shiftedFeature_flagsDrift() {
        DistributionSample current = new DistributionSample(
            Map.of("tenure", Fixtures.range(20, 49)), Map.of("stay", 20L, "churn", 10L), 30);

        DriftScores scores = calculator.score(Fixtures.churnBaseline(), current);

        assertThat(scores.psi()).isGreaterThan(config.getPsiThreshold());
        assertThat(scores.jsDivergence()).isEqualTo(0.0);
        assertThat(scores.driftDetected()).isTrue();
    }

    @Test
    void score_classShiftOnly_flagsDriftThroughJs() {
        DistributionSample current = new DistributionSample(
            Map.of("tenure", Fixtures.range(1, 30)), Map.of("churn", 30L), 30);

        DriftScores scores = calculator.score(Fixtures.churnBaseline(), current);

        assertThat(scores.psi()).isEqualTo(0.0);
        assertThat(scores.jsDivergence()).isGreaterThan(config.getJsThreshold());
        assertThat(scores.driftDetected()).isTrue();
    }

    @Test
    void score_featureMissingFromCurrent_isSkipped() {
        DistributionSample current = new DistributionSample(Map.of(), Map.of("stay", 20L, "churn", 10L), 30);
        DriftScores scores = calculator.score(Fixtures.churnBaseline(), current);
        assertThat(scores.featurePsi()).isEmpty();
        assertThat(scores.psi()).isEqualTo(0.0);
    }

    @Test
    void score_meanAggregation_averagesFeatures() {
        config.setPsiAggregation(PsiAggregation.MEAN);
        DistributionSample baseline = new DistributionSample(
            Map.of("a", Fixtures.range(1, 30), "b", Fixtures.range(1, 30)), Map.of(), 30);
        DistributionSample current = new DistributionSample(
            Map.of("a", Fixtures.range(1, 30), "b", Fixtures.range(16, 45)), Map.of(), 30);

        DriftScores scores = calculator.score(baseline, current);

        assertThat(scores.featurePsi().get("a")).isEqualTo(0.0);
        assertThat(scores.psi()).isCloseTo(scores.featurePsi().get("b") / 2, within(1e-12));
    }

    @Test
    void jsDivergence_disjointClasses_boundedByLn2() {
        double js = calculator.jsDivergence(Map.of("a", 10L), Map.of("b", 10L));
        assertThat(js).isLessThanOrEqualTo(LN2).isCloseTo(LN2, within(0.01));
    }

    @Test
    void jsDivergence_normalised_boundedByOne() {
        config.setNormalizeJs(true);
        double js = calculator.jsDivergence(Map.of("a", 10L), Map.of("b", 10L));
        assertThat(js).isLessThanOrEqualTo(1.0).isGreaterThan(0.98);
    }

    @Test
    void jsDivergence_emptySide_isZero() {
        assertThat(calculator.jsDivergence(Map.of(), Map.of("a", 3L))).isEqualTo(0.0);
        assertThat(calculator.jsDivergence(Map.of("a", 3L), Map.of())).isEqualTo(0.0);
    }

    @Test
    void jsDivergence_isSymmetric() {
        Map<String, Long> p = Map.of("a", 7L, "b", 3L);
        Map<String, Long> q = Map.of("a", 2L, "b", 5L, "c", 3L);
        assertThat(calculator.jsDivergence(p, q)).isCloseTo(calculator.jsDivergence(q, p), within(1e-12));
    }

    @Test
    void quantileEdges_constantBaseline_collapseToSingleEdge() {
        double[] edges = DriftCalculator.quantileEdges(new double[] {5, 5, 5, 5}, 10);
        assertThat(edges).containsExactly(5.0);
        assertThat(DriftCalculator.bucketShares(new double[] {5, 5, 6, 7}, edges)).containsExactly(0.5, 0.5);
    }

    @Test
    void quantileEdges_deciles_interpolateLinearly() {
        double[] values = Fixtures.range(0, 10).stream().mapToDouble(Double::doubleValue).toArray();
        assertThat(DriftCalculator.quantileEdges(values, 10))
            .containsExactly(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0);
    }

    @Test
    void equalWidth_bucketsOutOfRangeValuesIntoOuterBins() {
        config.setBinning(BinningStrategy.EQUAL_WIDTH);
        config.setBins(4);
        double[] edges = DriftCalculator.equalWidthEdges(new double[] {0, 4, 8}, 4);
        assertThat(edges).containsExactly(2.0, 4.0, 6.0);
        assertThat(DriftCalculator.bucketShares(new double[] {-10, 100}, edges)).containsExactly(0.5, 0.0, 0.0, 0.5);
    }
}
