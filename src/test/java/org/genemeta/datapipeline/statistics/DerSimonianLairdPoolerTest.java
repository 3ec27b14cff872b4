package org.genemeta.datapipeline.statistics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.genemeta.datapipeline.api.resources.database.dto.LedgerEntry;
import org.genemeta.datapipeline.api.resources.database.dto.MetricKind;
import org.genemeta.datapipeline.api.resources.database.dto.StatisticsKey;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Fixture checks of the DerSimonian–Laird estimator against hand-computed values.
 */
@Tag("unit")
class DerSimonianLairdPoolerTest {

    private static final double TOLERANCE = 1e-6;
    private static final StatisticsKey KEY = new StatisticsKey(1L, 10, "RNA_SEQ", "shock_vs_sepsis_d");

    private final DerSimonianLairdPooler pooler = new DerSimonianLairdPooler();

    static SufficientStatistics statistics(double[] thetas, double[] standardErrors) {
        SufficientStatistics stats = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        for (int i = 0; i < thetas.length; i++) {
            double se = standardErrors[i];
            stats.apply(new LedgerEntry(100 + i, 1.0 / (se * se), thetas[i], se, null, "run"));
        }
        return stats;
    }

    @Test
    void emptyRow_hasNoEstimate() {
        assertThat(pooler.pool(SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE))).isEmpty();
    }

    @Nested
    @DisplayName("Homogeneous studies (Q below k-1)")
    class Homogeneous {

        private final PooledEstimate estimate = pooler.pool(statistics(
            new double[]{0.2, 0.5, 0.3}, new double[]{0.1, 0.2, 0.15})).orElseThrow();

        @Test
        void truncatesTau2AndI2AtZero() {
            assertThat(estimate.q()).isCloseTo(1.85245901639344, within(TOLERANCE));
            assertThat(estimate.tau2()).isEqualTo(0.0);
            assertThat(estimate.i2()).isEqualTo(0.0);
        }

        @Test
        void randomEffectsEqualsFixedEffect() {
            assertThat(estimate.thetaFixed()).isCloseTo(0.27049180327868855, within(TOLERANCE));
            assertThat(estimate.thetaRandom()).isEqualTo(estimate.thetaFixed());
            assertThat(estimate.standardError()).isCloseTo(Math.sqrt(9.0 / 1525.0), within(TOLERANCE));
            assertThat(estimate.studyCount()).isEqualTo(3);
        }

        @Test
        void zAndConfidenceIntervalFollowFromEstimate() {
            double se = Math.sqrt(9.0 / 1525.0);
            assertThat(estimate.z()).isCloseTo(0.27049180327868855 / se, within(TOLERANCE));
            assertThat(estimate.p()).isLessThan(1e-6);
            assertThat(estimate.ciLower()).isCloseTo(0.27049180327868855 - DerSimonianLairdPooler.Z_975 * se, within(TOLERANCE));
            assertThat(estimate.ciUpper()).isCloseTo(0.27049180327868855 + DerSimonianLairdPooler.Z_975 * se, within(TOLERANCE));
        }
    }

    @Nested
    @DisplayName("Heterogeneous studies")
    class Heterogeneous {

        private final PooledEstimate estimate = pooler.pool(statistics(
            new double[]{0.1, 0.9, 0.5}, new double[]{0.1, 0.1, 0.1})).orElseThrow();

        @Test
        void estimatesBetweenStudyVariance() {
            assertThat(estimate.q()).isCloseTo(32.0, within(TOLERANCE));
            assertThat(estimate.tau2()).isCloseTo(0.15, within(TOLERANCE));
            assertThat(estimate.i2()).isCloseTo(93.75, within(TOLERANCE));
        }

        @Test
        void reweightsWithTau2() {
            assertThat(estimate.thetaRandom()).isCloseTo(0.5, within(TOLERANCE));
            assertThat(estimate.standardError()).isCloseTo(Math.sqrt(1.0 / 18.75), within(TOLERANCE));
            assertThat(estimate.standardError()).isGreaterThan(Math.sqrt(1.0 / 300.0));
        }
    }

    @Test
    @DisplayName("k=1: I2 undefined, random effects equals the single study")
    void singleStudy() {
        PooledEstimate estimate = pooler.pool(statistics(new double[]{0.3}, new double[]{0.1})).orElseThrow();

        assertThat(estimate.thetaRandom()).isEqualTo(estimate.thetaFixed());
        assertThat(estimate.thetaRandom()).isCloseTo(0.3, within(1e-12));
        assertThat(estimate.standardError()).isCloseTo(0.1, within(1e-12));
        assertThat(estimate.tau2()).isEqualTo(0.0);
        assertThat(estimate.q()).isEqualTo(0.0);
        assertThat(estimate.i2()).isNull();
        assertThat(estimate.studyCount()).isEqualTo(1);
    }

    @Test
    void twoSidedPValue_isSymmetricAndCapped() {
        assertThat(DerSimonianLairdPooler.twoSidedPValue(0.0)).isEqualTo(1.0);
        assertThat(DerSimonianLairdPooler.twoSidedPValue(1.959963984540054)).isCloseTo(0.05, within(1e-9));
        assertThat(DerSimonianLairdPooler.twoSidedPValue(-1.959963984540054)).isCloseTo(0.05, within(1e-9));
        assertThat(DerSimonianLairdPooler.twoSidedPValue(40.0)).isGreaterThanOrEqualTo(0.0).isLessThan(1e-300);
    }
}
