package org.genemeta.node.processes.http.api.runs.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Acknowledgement of a queued study-load event.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AggregationAcceptedDto(int studyKey, int queued) {
}
