package org.genemeta.datapipeline.api.resources.database.dto;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Running inverse-variance sums for one {@code (pair, disease, technology, metric)} key together
 * with the ledger of contributions folded into them.
 * <p>
 * Holds {@code S1 = Σw}, {@code S2 = Σw²}, {@code Sθ = Σwθ}, {@code Sθ2 = Σwθ²} and the ledger.
 * The study count is always the ledger's size. After every change the sums are re-accumulated from
 * the ledger in ascending study-key order, so they depend only on the ledger's contents: a correction
 * never leaves cancellation error behind, and the arrival order of studies does not matter.
 * <p>
 * {@code rowVersion} is the optimistic-concurrency version of the persisted row; 0 means the row
 * has never been written.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. An instance belongs to a single aggregation run.
 */
public final class SufficientStatistics {

    /**
     * Effect of {@link #apply(LedgerEntry)} on the row.
     */
    public enum ApplyOutcome {
        /** The study was not in the ledger and has been added. */
        ADDED,
        /** The study was in the ledger with a different contribution, which has been replaced. */
        REPLACED,
        /** The study was in the ledger with the identical contribution; nothing changed. */
        UNCHANGED
    }

    private final StatisticsKey key;
    private final MetricKind metricKind;
    private final SortedMap<Integer, LedgerEntry> ledger = new TreeMap<>();
    private double sumW;
    private double sumW2;
    private double sumWTheta;
    private double sumWTheta2;
    private long rowVersion;

    private SufficientStatistics(StatisticsKey key, MetricKind metricKind, long rowVersion) {
        this.key = key;
        this.metricKind = metricKind;
        this.rowVersion = rowVersion;
    }

    /**
     * Creates an empty, not yet persisted row.
     */
    public static SufficientStatistics empty(StatisticsKey key, MetricKind metricKind) {
        return new SufficientStatistics(key, metricKind, 0L);
    }

    /**
     * Restores a persisted row.
     *
     * @throws IllegalStateException if the stored study count does not match the ledger.
     */
    public static SufficientStatistics restore(StatisticsKey key,
                                               MetricKind metricKind,
                                               double sumW,
                                               double sumW2,
                                               double sumWTheta,
                                               double sumWTheta2,
                                               int studyCount,
                                               Collection<LedgerEntry> entries,
                                               long rowVersion) {
        SufficientStatistics stats = new SufficientStatistics(key, metricKind, rowVersion);
        for (LedgerEntry entry : entries) {
            if (stats.ledger.put(entry.studyKey(), entry) != null) {
                throw new IllegalStateException("Duplicate ledger entry for study " + entry.studyKey() + " in " + key);
            }
        }
        if (studyCount != stats.ledger.size()) {
            throw new IllegalStateException(String.format(
                "Corrupted sufficient statistics %s: study count %d but ledger holds %d entries",
                key, studyCount, stats.ledger.size()));
        }
        stats.sumW = sumW;
        stats.sumW2 = sumW2;
        stats.sumWTheta = sumWTheta;
        stats.sumWTheta2 = sumWTheta2;
        return stats;
    }

    /**
     * Folds one study's contribution into the sums.
     * <p>
     * If the study is already in the ledger with a different contribution, that contribution is
     * replaced. Re-applying an identical contribution leaves the row untouched.
     *
     * @param entry The new contribution.
     * @return What happened to the row.
     */
    public ApplyOutcome apply(LedgerEntry entry) {
        LedgerEntry previous = ledger.get(entry.studyKey());
        if (entry.sameContributionAs(previous)) {
            return ApplyOutcome.UNCHANGED;
        }
        ledger.put(entry.studyKey(), entry);
        resum();
        return previous == null ? ApplyOutcome.ADDED : ApplyOutcome.REPLACED;
    }

    /**
     * Rebuilds the sums from the ledger in ascending study-key order.
     *
     * @return A new instance with the same key, ledger and version and freshly summed totals.
     */
    public SufficientStatistics replayLedger() {
        SufficientStatistics replayed = new SufficientStatistics(key, metricKind, rowVersion);
        for (LedgerEntry entry : ledger.values()) {
            replayed.add(entry);
            replayed.ledger.put(entry.studyKey(), entry);
        }
        return replayed;
    }

    private void add(LedgerEntry entry) {
        double w = entry.weight();
        double theta = entry.theta();
        sumW += w;
        sumW2 += w * w;
        sumWTheta += w * theta;
        sumWTheta2 += w * theta * theta;
    }

    private void resum() {
        sumW = 0.0;
        sumW2 = 0.0;
        sumWTheta = 0.0;
        sumWTheta2 = 0.0;
        for (LedgerEntry entry : ledger.values()) {
            add(entry);
        }
    }

    /**
     * Records that the row has been written with the given version.
     */
    public void markPersisted(long newRowVersion) {
        this.rowVersion = newRowVersion;
    }

    public StatisticsKey getKey() {
        return key;
    }

    public MetricKind getMetricKind() {
        return metricKind;
    }

    public double getSumW() {
        return sumW;
    }

    public double getSumW2() {
        return sumW2;
    }

    public double getSumWTheta() {
        return sumWTheta;
    }

    public double getSumWTheta2() {
        return sumWTheta2;
    }

    public int getStudyCount() {
        return ledger.size();
    }

    public long getRowVersion() {
        return rowVersion;
    }

    public boolean isPersisted() {
        return rowVersion > 0;
    }

    public boolean containsStudy(int studyKey) {
        return ledger.containsKey(studyKey);
    }

    /**
     * Returns the ledger entries in ascending study-key order.
     */
    public List<LedgerEntry> getLedger() {
        return Collections.unmodifiableList(new ArrayList<>(ledger.values()));
    }

    /**
     * Returns the sum of known sample sizes, or null if no entry carries one.
     */
    public Long getTotalSamples() {
        long total = 0;
        boolean any = false;
        for (LedgerEntry entry : ledger.values()) {
            if (entry.nSamples() != null) {
                total += entry.nSamples();
                any = true;
            }
        }
        return any ? total : null;
    }

    @Override
    public String toString() {
        return "SufficientStatistics{" + key + ", k=" + ledger.size() + ", version=" + rowVersion + "}";
    }
}
