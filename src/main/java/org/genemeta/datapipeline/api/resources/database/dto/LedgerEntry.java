package org.genemeta.datapipeline.api.resources.database.dto;

import java.util.Objects;

/**
 * Last applied contribution of one study to one sufficient-statistics row.
 * <p>
 * Keeps the raw estimate and standard error so the random-effects pass can be recomputed and
 * a later correction can be subtracted exactly once.
 *
 * @param studyKey      Contributing study.
 * @param weight        Inverse-variance weight {@code 1 / SE²}.
 * @param theta         Point estimate (Fisher-z for correlation metrics).
 * @param standardError Standard error of {@code theta}.
 * @param nSamples      Sample size, or null when unknown.
 * @param featureRunId  Run that applied this contribution.
 */
public record LedgerEntry(int studyKey,
                          double weight,
                          double theta,
                          double standardError,
                          Integer nSamples,
                          String featureRunId) {

    /**
     * Whether this entry carries the same numerical contribution as {@code other}.
     * The run id is provenance only and is ignored.
     */
    public boolean sameContributionAs(LedgerEntry other) {
        return other != null
            && studyKey == other.studyKey
            && Double.compare(weight, other.weight) == 0
            && Double.compare(theta, other.theta) == 0
            && Double.compare(standardError, other.standardError) == 0
            && Objects.equals(nSamples, other.nSamples);
    }
}
