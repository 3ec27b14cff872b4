package org.genemeta.node.processes.http.api.pairs.dto;

import org.genemeta.datapipeline.api.resources.database.dto.AnnotatedPooledResult;
import org.genemeta.datapipeline.api.resources.database.dto.PooledMetricResult;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One row of the pooled fact table, as returned by {@code GET /pairs/{pair_key}/metrics}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PooledMetricDto(long pairKey,
                              int diseaseKey,
                              String technology,
                              String metricName,
                              String metricKind,
                              double thetaPooled,
                              double thetaFixed,
                              double sePooled,
                              double ciLower,
                              double ciUpper,
                              double tau2,
                              double q,
                              Double i2,
                              double z,
                              double p,
                              int includedStudyCount,
                              Long totalSamples,
                              String featureRunId,
                              String updatedAt) {

    public static PooledMetricDto from(AnnotatedPooledResult row) {
        PooledMetricResult r = row.result();
        return new PooledMetricDto(r.key.pairKey(), r.key.diseaseKey(), r.key.technology(), r.key.metricName(),
            r.metricKind.name(), r.thetaPooled, r.thetaFixed, r.sePooled, r.ciLower, r.ciUpper, r.tau2, r.q,
            r.i2, r.z, r.p, r.includedStudyCount, r.totalSamples, r.featureRunId,
            r.updatedAt != null ? r.updatedAt.toString() : null);
    }
}
