package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * A skipped contribution, recorded in the validation log of its run.
 *
 * @param featureRunId Run that skipped the contribution.
 * @param studyKey     Contributing study.
 * @param pairId       Pair identifier as supplied.
 * @param metricName   Metric of the contribution.
 * @param code         Finding.
 * @param details      Human-readable detail.
 */
public record ValidationWarning(String featureRunId,
                                int studyKey,
                                String pairId,
                                String metricName,
                                ValidationCode code,
                                String details) {

    /** Severity stored alongside every warning. */
    public static final String SEVERITY = "WARN";
}
