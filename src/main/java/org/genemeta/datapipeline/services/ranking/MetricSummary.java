package org.genemeta.datapipeline.services.ranking;

import org.genemeta.datapipeline.api.resources.database.dto.MetricKind;

/**
 * One pooled metric of a ranked pair, with its slice-wide Benjamini–Hochberg q-value.
 */
public record MetricSummary(String metricName,
                            MetricKind metricKind,
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
}
