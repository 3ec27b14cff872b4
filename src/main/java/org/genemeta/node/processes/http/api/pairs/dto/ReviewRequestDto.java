package org.genemeta.node.processes.http.api.pairs.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /pairs/{pair_key}/review}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewRequestDto(@JsonProperty("feature_run_id") String featureRunId,
                               @JsonProperty("reviewer") String reviewer,
                               @JsonProperty("verdict") String verdict,
                               @JsonProperty("comment") String comment) {}
