package org.genemeta.datapipeline.api.resources.database.dto;

import java.time.Instant;

/**
 * Append-only reviewer verdict on a pair, tied to the run whose output was reviewed.
 *
 * @param reviewId     Surrogate key, 0 before the review is stored.
 * @param pairKey      Reviewed pair.
 * @param featureRunId Run whose pooled output was reviewed.
 * @param reviewer     Reviewer name.
 * @param verdict      Verdict.
 * @param comment      Free-text comment, may be null.
 * @param createdAt    Time the review was recorded.
 */
public record PairReview(long reviewId,
                         long pairKey,
                         String featureRunId,
                         String reviewer,
                         ReviewVerdict verdict,
                         String comment,
                         Instant createdAt) {

    /** Longest reviewer name the review log stores. */
    public static final int MAX_REVIEWER_LENGTH = 128;

    /** Longest comment the review log stores. */
    public static final int MAX_COMMENT_LENGTH = 4000;
}
