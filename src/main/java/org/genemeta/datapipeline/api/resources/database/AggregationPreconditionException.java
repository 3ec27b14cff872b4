package org.genemeta.datapipeline.api.resources.database;

/**
 * Base class of precondition failures of an aggregation run.
 * <p>
 * A precondition failure is fatal to the run and is never retried: re-running the same study
 * without fixing the reference data would fail the same way. Each subclass carries a stable
 * error code that is stored in the run's provenance record.
 */
public abstract class AggregationPreconditionException extends Exception {

    private final String errorCode;

    protected AggregationPreconditionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Returns the stable error code of this failure, e.g. {@code MISSING_DISEASE_MAPPING}.
     */
    public String getErrorCode() {
        return errorCode;
    }
}
