package org.genemeta.datapipeline.services;

/**
 * States of one aggregation run.
 * <p>
 * {@code PENDING → RESOLVING_DISEASE → UPDATING_STATS → RECOMPUTING_POOLED → COMMITTED}; any
 * state may move to {@code FAILED}. A transient failure sends the run back to
 * {@code RESOLVING_DISEASE} for the next attempt.
 */
public enum AggregationState {
    PENDING,
    RESOLVING_DISEASE,
    UPDATING_STATS,
    RECOMPUTING_POOLED,
    COMMITTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED;
    }
}
