package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * Kind of a per-study metric.
 * <p>
 * Effect-size metrics are pooled on their natural scale. Correlation metrics are pooled
 * on the Fisher-z scale and back-transformed for reporting.
 */
public enum MetricKind {
    /** Standardized effect-size difference between two clinical cohorts. */
    EFFECT_SIZE,
    /** Correlation coefficient between the two genes of a pair. */
    CORRELATION
}
