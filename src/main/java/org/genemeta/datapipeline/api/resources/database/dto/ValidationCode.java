package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * Data-quality findings that drop a single contribution without failing the run.
 */
public enum ValidationCode {
    NON_POSITIVE_STANDARD_ERROR,
    NON_FINITE_ESTIMATE,
    CORRELATION_SAMPLE_TOO_SMALL,
    CORRELATION_OUT_OF_RANGE,
    METRIC_KIND_MISMATCH,
    /** The study supplied the same pair and metric more than once; the first one counts. */
    DUPLICATE_COMPONENT
}
