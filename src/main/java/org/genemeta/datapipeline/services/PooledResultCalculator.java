package org.genemeta.datapipeline.services;

import java.time.Instant;
import java.util.Optional;

import org.genemeta.datapipeline.api.resources.database.dto.MetricKind;
import org.genemeta.datapipeline.api.resources.database.dto.PooledMetricResult;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics;
import org.genemeta.datapipeline.statistics.DerSimonianLairdPooler;
import org.genemeta.datapipeline.statistics.FisherZTransform;
import org.genemeta.datapipeline.statistics.PooledEstimate;

/**
 * Derives the pooled fact row of a sufficient-statistics row.
 * <p>
 * Correlation rows are pooled on the Fisher-z scale and their point estimates and confidence
 * bounds mapped back to r.
 */
public class PooledResultCalculator {

    private final DerSimonianLairdPooler pooler = new DerSimonianLairdPooler();

    /**
     * @return The pooled row, or empty if no study contributes to {@code statistics}.
     */
    public Optional<PooledMetricResult> calculate(SufficientStatistics statistics, String featureRunId, Instant now) {
        return pooler.pool(statistics).map(estimate -> {
            PooledEstimate reported = statistics.getMetricKind() == MetricKind.CORRELATION
                ? FisherZTransform.backTransform(estimate)
                : estimate;
            return new PooledMetricResult(
                statistics.getKey(),
                statistics.getMetricKind(),
                reported.thetaRandom(),
                reported.thetaFixed(),
                reported.standardError(),
                reported.ciLower(),
                reported.ciUpper(),
                reported.tau2(),
                reported.q(),
                reported.i2(),
                reported.z(),
                reported.p(),
                reported.studyCount(),
                statistics.getTotalSamples(),
                featureRunId,
                now);
        });
    }
}
