package org.genemeta.node.processes.http.api.pairs.dto;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Response of {@code GET /pairs/top}.
 *
 * @param disease     Disease label as stored.
 * @param diseaseKey  Disease key.
 * @param technology  Queried technology.
 * @param q           Applied q threshold.
 * @param kMin        Applied minimum study count.
 * @param i2Max       Applied I² bound.
 * @param limit       Applied limit.
 * @param scoredPairs Pairs in the slice before filtering.
 * @param pairs       Ranked pairs passing the filter.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TopPairsResponseDto(String disease,
                                  int diseaseKey,
                                  String technology,
                                  double q,
                                  int kMin,
                                  double i2Max,
                                  int limit,
                                  int scoredPairs,
                                  List<RankedPairDto> pairs) {}
