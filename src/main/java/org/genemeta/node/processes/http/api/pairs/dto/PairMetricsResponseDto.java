package org.genemeta.node.processes.http.api.pairs.dto;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Response of {@code GET /pairs/{pair_key}/metrics}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PairMetricsResponseDto(long pairKey,
                                     String pairId,
                                     String geneASymbol,
                                     String geneBSymbol,
                                     List<PooledMetricDto> metrics) {}
