package org.genemeta.node.processes.http.api.pairs.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Response of a stored review.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReviewResponseDto(long reviewId,
                                long pairKey,
                                String featureRunId,
                                String reviewer,
                                String verdict,
                                String comment,
                                String createdAt) {}
