package org.genemeta.datapipeline.api.resources.database.dto;

import java.time.Instant;

/**
 * Provenance record of one aggregation invocation.
 *
 * @param featureRunId          Id minted when the run started.
 * @param triggeredByStudyKey   Study whose load triggered the run.
 * @param diseaseKey            Resolved disease, null if resolution did not succeed.
 * @param technology            Resolved technology, null if resolution did not succeed.
 * @param startedAt             Start time.
 * @param endedAt               End time, null while running.
 * @param status                Current status.
 * @param finalState            Last orchestrator state reached.
 * @param attempts              Number of attempts made (transient failures are retried).
 * @param pairsTouched          Distinct pairs whose rows were refreshed.
 * @param contributionsApplied  Contributions folded in (added or replaced).
 * @param contributionsSkipped  Contributions dropped by data-quality checks.
 * @param errorCode             Error code of a failed run.
 * @param errorMessage          Error message of a failed run.
 */
public record FeatureRun(String featureRunId,
                         int triggeredByStudyKey,
                         Integer diseaseKey,
                         String technology,
                         Instant startedAt,
                         Instant endedAt,
                         FeatureRunStatus status,
                         String finalState,
                         int attempts,
                         int pairsTouched,
                         int contributionsApplied,
                         int contributionsSkipped,
                         String errorCode,
                         String errorMessage) {

    /**
     * Creates the record written when a run starts.
     */
    public static FeatureRun started(String featureRunId, int studyKey, Instant startedAt) {
        return new FeatureRun(featureRunId, studyKey, null, null, startedAt, null,
            FeatureRunStatus.RUNNING, "PENDING", 0, 0, 0, 0, null, null);
    }
}
