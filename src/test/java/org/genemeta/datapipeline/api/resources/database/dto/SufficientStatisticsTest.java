package org.genemeta.datapipeline.api.resources.database.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics.ApplyOutcome;
import org.genemeta.datapipeline.statistics.DerSimonianLairdPooler;
import org.genemeta.datapipeline.statistics.PooledEstimate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Tests the ledger semantics of {@link SufficientStatistics}: replacement, no-op re-application and
 * sums that depend only on the ledger.
 */
@Tag("unit")
class SufficientStatisticsTest {

    private static final StatisticsKey KEY = new StatisticsKey(7L, 3, "MICROARRAY", "coexpr_spearman");

    private static LedgerEntry entry(int studyKey, double theta, double se) {
        return new LedgerEntry(studyKey, 1.0 / (se * se), theta, se, 50, "run-" + studyKey);
    }

    @Test
    @DisplayName("Applying the same contribution twice leaves the row bit-identical")
    void reapplyingIsNoOp() {
        SufficientStatistics stats = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        stats.apply(entry(1, 0.4, 0.1));
        stats.apply(entry(2, 0.1, 0.2));
        double sumW = stats.getSumW();
        double sumWTheta2 = stats.getSumWTheta2();

        ApplyOutcome outcome = stats.apply(entry(1, 0.4, 0.1));

        assertThat(outcome).isEqualTo(ApplyOutcome.UNCHANGED);
        assertThat(stats.getSumW()).isEqualTo(sumW);
        assertThat(stats.getSumWTheta2()).isEqualTo(sumWTheta2);
        assertThat(stats.getStudyCount()).isEqualTo(2);
    }

    @Test
    void sameContributionFromAnotherRunIsUnchanged() {
        SufficientStatistics stats = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        stats.apply(entry(1, 0.4, 0.1));

        LedgerEntry rerun = new LedgerEntry(1, 100.0, 0.4, 0.1, 50, "another-run");

        assertThat(stats.apply(rerun)).isEqualTo(ApplyOutcome.UNCHANGED);
    }

    @Test
    @DisplayName("A corrected contribution replaces the old one instead of double counting")
    void correctionReplacesPreviousContribution() {
        SufficientStatistics corrected = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        corrected.apply(entry(1, 0.4, 0.1));
        corrected.apply(entry(2, 0.1, 0.2));
        assertThat(corrected.apply(entry(1, 0.6, 0.25))).isEqualTo(ApplyOutcome.REPLACED);

        SufficientStatistics direct = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        direct.apply(entry(2, 0.1, 0.2));
        direct.apply(entry(1, 0.6, 0.25));

        assertThat(corrected.getStudyCount()).isEqualTo(2);
        assertSameSums(corrected, direct);
        assertThat(corrected.getLedger()).extracting(LedgerEntry::theta).containsExactly(0.6, 0.1);
    }

    @Test
    @DisplayName("Correcting a study with a tiny standard error leaves no residue in the sums")
    void correctionOfHighWeightStudyMatchesDirectFold() {
        SufficientStatistics corrected = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        corrected.apply(entry(1, 0.0, 1.0));
        corrected.apply(entry(2, 5.0, 1e-4));
        assertThat(corrected.apply(entry(2, 3.0, 1.0))).isEqualTo(ApplyOutcome.REPLACED);

        SufficientStatistics direct = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        direct.apply(entry(2, 3.0, 1.0));
        direct.apply(entry(1, 0.0, 1.0));

        assertSameSums(corrected, direct);
        assertSameSums(corrected, corrected.replayLedger());
        assertThat(corrected.getSumW2()).isEqualTo(2.0);

        DerSimonianLairdPooler pooler = new DerSimonianLairdPooler();
        PooledEstimate fromCorrection = pooler.pool(corrected).orElseThrow();
        PooledEstimate fromDirect = pooler.pool(direct).orElseThrow();
        assertThat(fromCorrection.tau2()).isEqualTo(fromDirect.tau2()).isCloseTo(3.5, within(1e-12));
        assertThat(fromCorrection.thetaRandom()).isEqualTo(fromDirect.thetaRandom()).isCloseTo(1.5, within(1e-12));
        assertThat(fromCorrection.standardError()).isCloseTo(1.5, within(1e-12));
    }

    @Test
    void repeatedCorrectionsAcrossWeightScalesEqualReplay() {
        SufficientStatistics stats = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        Random random = new Random(11);
        for (int round = 0; round < 200; round++) {
            int study = 1 + random.nextInt(8);
            double se = Math.pow(10.0, -4.0 + random.nextDouble() * 5.0);
            stats.apply(entry(study, random.nextGaussian(), se));
        }

        assertSameSums(stats, stats.replayLedger());
    }

    @Test
    @DisplayName("Final sums do not depend on the order studies arrive in")
    void orderIndependence() {
        List<LedgerEntry> entries = new ArrayList<>();
        Random random = new Random(42);
        for (int study = 1; study <= 25; study++) {
            entries.add(entry(study, random.nextGaussian() * 0.5, 0.05 + random.nextDouble() * 0.3));
        }
        SufficientStatistics forward = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        entries.forEach(forward::apply);

        List<LedgerEntry> shuffled = new ArrayList<>(entries);
        Collections.shuffle(shuffled, new Random(7));
        SufficientStatistics permuted = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        shuffled.forEach(permuted::apply);

        assertThat(permuted.getStudyCount()).isEqualTo(forward.getStudyCount());
        assertSameSums(permuted, forward);
        assertThat(permuted.getLedger()).isEqualTo(forward.getLedger());
    }

    @Test
    void replayRebuildsSumsFromLedger() {
        SufficientStatistics stats = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        stats.apply(entry(3, 0.2, 0.1));
        stats.apply(entry(1, 0.5, 0.2));
        stats.apply(entry(3, -0.1, 0.3));

        SufficientStatistics replayed = stats.replayLedger();

        assertSameSums(replayed, stats);
        assertThat(replayed.getStudyCount()).isEqualTo(2);
    }

    @Test
    void restoreRejectsStudyCountThatDisagreesWithLedger() {
        List<LedgerEntry> ledger = List.of(entry(1, 0.1, 0.1));
        assertThatThrownBy(() -> SufficientStatistics.restore(KEY, MetricKind.EFFECT_SIZE,
            100.0, 10000.0, 10.0, 1.0, 2, ledger, 1L))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ledger holds 1");
    }

    @Test
    void totalSamplesIsNullWhenNoSampleSizeKnown() {
        SufficientStatistics stats = SufficientStatistics.empty(KEY, MetricKind.EFFECT_SIZE);
        stats.apply(new LedgerEntry(1, 100.0, 0.1, 0.1, null, "run"));
        assertThat(stats.getTotalSamples()).isNull();

        stats.apply(new LedgerEntry(2, 100.0, 0.1, 0.1, 40, "run"));
        assertThat(stats.getTotalSamples()).isEqualTo(40L);
    }

    private static void assertSameSums(SufficientStatistics actual, SufficientStatistics expected) {
        assertThat(actual.getSumW()).isEqualTo(expected.getSumW());
        assertThat(actual.getSumW2()).isEqualTo(expected.getSumW2());
        assertThat(actual.getSumWTheta()).isEqualTo(expected.getSumWTheta());
        assertThat(actual.getSumWTheta2()).isEqualTo(expected.getSumWTheta2());
    }
}
