package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * One study's estimate for one metric of one gene pair, as supplied by the ingestion side.
 * <p>
 * Transient: components are consumed by an aggregation run and never stored as such.
 * For {@link MetricKind#EFFECT_SIZE} the value is {@code theta} with its standard error;
 * for {@link MetricKind#CORRELATION} the value is {@code r} and the standard error is derived
 * from the sample size.
 *
 * @param studyKey      The contributing study.
 * @param pairId        Raw pair identifier {@code <geneA_key>_<geneB_key>}, in either order.
 * @param metricName    Metric name, e.g. {@code shock_vs_sepsis_d}.
 * @param kind          Metric kind.
 * @param value         {@code theta} or {@code r}.
 * @param standardError Standard error of {@code theta}; null for correlations.
 * @param nSamples      Sample size, or null when unknown.
 */
public record PerStudyComponent(int studyKey,
                                String pairId,
                                String metricName,
                                MetricKind kind,
                                double value,
                                Double standardError,
                                Integer nSamples) {

    /**
     * Creates an effect-size component.
     */
    public static PerStudyComponent effectSize(int studyKey, String pairId, String metricName,
                                               double theta, double standardError, Integer nSamples) {
        return new PerStudyComponent(studyKey, pairId, metricName, MetricKind.EFFECT_SIZE,
            theta, standardError, nSamples);
    }

    /**
     * Creates a correlation component.
     */
    public static PerStudyComponent correlation(int studyKey, String pairId, String metricName,
                                                double r, int nSamples) {
        return new PerStudyComponent(studyKey, pairId, metricName, MetricKind.CORRELATION,
            r, null, nSamples);
    }
}
