package org.genemeta.datapipeline.services;

import java.util.List;

import org.genemeta.datapipeline.api.resources.database.dto.StudyContext;
import org.genemeta.datapipeline.api.resources.database.dto.ValidationWarning;

/**
 * Outcome of one aggregation run.
 *
 * @param featureRunId           Run identifier.
 * @param studyKey               Triggering study.
 * @param context                Resolved disease and technology, or null if resolution failed.
 * @param finalState             {@link AggregationState#COMMITTED} or {@link AggregationState#FAILED}.
 * @param states                 Every state the run passed through, in order.
 * @param attempts               Number of attempts made.
 * @param pairsTouched           Distinct pairs whose rows changed.
 * @param contributionsApplied   Contributions added or corrected.
 * @param contributionsUnchanged Contributions identical to the ones already applied.
 * @param contributionsSkipped   Contributions skipped with a warning.
 * @param warnings               Data-quality warnings of the last attempt.
 * @param errorCode              Failure code, or null.
 * @param errorMessage           Failure message, or null.
 */
public record AggregationRunResult(String featureRunId,
                                   int studyKey,
                                   StudyContext context,
                                   AggregationState finalState,
                                   List<AggregationState> states,
                                   int attempts,
                                   int pairsTouched,
                                   int contributionsApplied,
                                   int contributionsUnchanged,
                                   int contributionsSkipped,
                                   List<ValidationWarning> warnings,
                                   String errorCode,
                                   String errorMessage) {

    public boolean isCommitted() {
        return finalState == AggregationState.COMMITTED;
    }
}
