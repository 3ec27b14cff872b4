package org.genemeta.datapipeline.api.resources.database;

import java.sql.SQLException;
import java.util.List;

import org.genemeta.datapipeline.api.resources.database.dto.PairReview;

/**
 * Append-only audit log of reviewer verdicts. Not consumed by the pooling math.
 */
public interface IPairReviewLog {

    /**
     * Appends a review.
     *
     * @param review Review to store; its {@code reviewId} is ignored.
     * @return The generated review id.
     */
    long appendReview(PairReview review) throws SQLException;

    /**
     * Returns all reviews of a pair, oldest first.
     */
    List<PairReview> findReviews(long pairKey) throws SQLException;
}
