package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * Key of a sufficient-statistics row and of its pooled fact row.
 *
 * @param pairKey    Canonical pair key.
 * @param diseaseKey Disease the contributions belong to.
 * @param technology Measurement technology.
 * @param metricName Name of the pooled metric.
 */
public record StatisticsKey(long pairKey, int diseaseKey, String technology, String metricName) {
}
