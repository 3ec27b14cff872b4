package org.genemeta.datapipeline.api.resources.database.dto;

import java.time.Instant;

/**
 * Pooled fact row for one {@code (pair, disease, technology, metric)} key.
 * <p>
 * A cache of the current {@link SufficientStatistics} row: it can always be derived again from it.
 * For correlation metrics {@code thetaPooled}, {@code thetaFixed} and the confidence bounds are
 * back-transformed to the correlation scale while {@code sePooled}, {@code z} and {@code p} stay
 * on the Fisher-z scale.
 */
public final class PooledMetricResult {

    public final StatisticsKey key;
    public final MetricKind metricKind;
    public final double thetaPooled;
    public final double thetaFixed;
    public final double sePooled;
    public final double ciLower;
    public final double ciUpper;
    public final double tau2;
    public final double q;
    /** Heterogeneity in percent, null for a single study. */
    public final Double i2;
    public final double z;
    public final double p;
    public final int includedStudyCount;
    /** Sum of known sample sizes, null if none is known. */
    public final Long totalSamples;
    public final String featureRunId;
    public final Instant updatedAt;

    /**
     * Creates a pooled fact row.
     *
     * @param key                The fact key.
     * @param metricKind         Kind of the pooled metric.
     * @param thetaPooled        Random-effects estimate (correlation scale for correlations).
     * @param thetaFixed         Fixed-effect estimate (correlation scale for correlations).
     * @param sePooled           Standard error of the random-effects estimate.
     * @param ciLower            Lower 95% confidence bound.
     * @param ciUpper            Upper 95% confidence bound.
     * @param tau2               Between-study variance.
     * @param q                  Cochran's Q.
     * @param i2                 I² in percent, or null.
     * @param z                  Wald z of the random-effects estimate.
     * @param p                  Two-sided p-value.
     * @param includedStudyCount Number of studies in the ledger.
     * @param totalSamples       Sum of known sample sizes, or null.
     * @param featureRunId       Run that last refreshed this row.
     * @param updatedAt          Refresh time.
     */
    public PooledMetricResult(StatisticsKey key,
                              MetricKind metricKind,
                              double thetaPooled,
                              double thetaFixed,
                              double sePooled,
                              double ciLower,
                              double ciUpper,
                              double tau2,
                              double q,
                              Double i2,
                              double z,
                              double p,
                              int includedStudyCount,
                              Long totalSamples,
                              String featureRunId,
                              Instant updatedAt) {
        this.key = key;
        this.metricKind = metricKind;
        this.thetaPooled = thetaPooled;
        this.thetaFixed = thetaFixed;
        this.sePooled = sePooled;
        this.ciLower = ciLower;
        this.ciUpper = ciUpper;
        this.tau2 = tau2;
        this.q = q;
        this.i2 = i2;
        this.z = z;
        this.p = p;
        this.includedStudyCount = includedStudyCount;
        this.totalSamples = totalSamples;
        this.featureRunId = featureRunId;
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return String.format("PooledMetricResult{%s, theta=%.6f, se=%.6f, tau2=%.6f, I2=%s, p=%.3g, k=%d}",
            key, thetaPooled, sePooled, tau2, i2, p, includedStudyCount);
    }
}
