package org.genemeta.node.processes.http.api.pairs.dto;

import org.genemeta.datapipeline.services.ranking.MetricSummary;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One pooled metric of a ranked pair.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetricDto(String metricName,
                        String metricKind,
                        double thetaPooled,
                        double sePooled,
                        double ciLower,
                        double ciUpper,
                        double tau2,
                        Double i2,
                        double z,
                        double p,
                        double q,
                        int includedStudyCount,
                        Long totalSamples,
                        String featureRunId) {

    public static MetricDto from(MetricSummary m) {
        return new MetricDto(m.metricName(), m.metricKind().name(), m.thetaPooled(), m.sePooled(), m.ciLower(),
            m.ciUpper(), m.tau2(), m.i2(), m.z(), m.p(), m.q(), m.includedStudyCount(), m.totalSamples(),
            m.featureRunId());
    }
}
