package org.genemeta.datapipeline.services;

import org.genemeta.datapipeline.api.resources.database.dto.StudyContext;

/**
 * Notified after an aggregation run has committed its slice, before the run is reported as
 * successful in the provenance log.
 */
@FunctionalInterface
public interface IAggregationCommitListener {

    /**
     * @param featureRunId The committed run.
     * @param slice        The {@code (disease, technology)} slice the run wrote to.
     */
    void onCommitted(String featureRunId, StudyContext slice);
}
