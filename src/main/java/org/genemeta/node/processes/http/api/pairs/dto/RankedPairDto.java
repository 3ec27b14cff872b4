package org.genemeta.node.processes.http.api.pairs.dto;

import java.util.List;
import java.util.stream.Collectors;

import org.genemeta.datapipeline.services.ranking.RankedPair;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A ranked gene pair with gene symbols and its pooled metrics.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RankedPairDto(int rank,
                            long pairKey,
                            String pairId,
                            int geneAKey,
                            String geneAId,
                            String geneASymbol,
                            int geneBKey,
                            String geneBId,
                            String geneBSymbol,
                            double qStar,
                            double i2Star,
                            double zCombined,
                            double pCombined,
                            double qCombined,
                            double compositeScore,
                            long powerScore,
                            double consistencyScore,
                            double combinedEffectSize,
                            int includedStudyCount,
                            String latestFeatureRunId,
                            List<MetricDto> metrics) {

    public static RankedPairDto from(int rank, RankedPair p) {
        return new RankedPairDto(rank, p.pairKey(), p.pairId(), p.geneAKey(), p.geneAId(), p.geneASymbol(),
            p.geneBKey(), p.geneBId(), p.geneBSymbol(), p.qStar(), p.i2Star(), p.zCombined(), p.pCombined(),
            p.qCombined(), p.compositeScore(), p.powerScore(), p.consistencyScore(), p.combinedEffectSize(),
            p.includedStudyCount(), p.latestFeatureRunId(),
            p.metrics().stream().map(MetricDto::from).collect(Collectors.toList()));
    }
}
