package org.genemeta.datapipeline.services;

import org.genemeta.datapipeline.statistics.FisherZTransform;

import com.typesafe.config.Config;

/**
 * Tuning of the aggregation orchestrator, read from the {@code genemeta.aggregation} block.
 *
 * @param maxAttempts        Attempts per study before a transient failure fails the run.
 * @param initialBackoffMs   Delay before the first retry.
 * @param backoffMultiplier  Factor applied to the delay after every retry.
 * @param sliceLockTimeoutMs How long a run waits for its {@code (disease, technology)} slice.
 * @param minCorrelationN    Smallest sample size accepted for a correlation component.
 */
public record AggregationOptions(int maxAttempts,
                                 long initialBackoffMs,
                                 double backoffMultiplier,
                                 long sliceLockTimeoutMs,
                                 int minCorrelationN) {

    public AggregationOptions {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-attempts must be at least 1, got " + maxAttempts);
        }
        if (initialBackoffMs < 0) {
            throw new IllegalArgumentException("initial-backoff-ms must not be negative, got " + initialBackoffMs);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoff-multiplier must be at least 1, got " + backoffMultiplier);
        }
        if (minCorrelationN < FisherZTransform.MIN_SAMPLES) {
            throw new IllegalArgumentException("min-correlation-n must be at least "
                + FisherZTransform.MIN_SAMPLES + ", got " + minCorrelationN);
        }
    }

    public static AggregationOptions defaults() {
        return new AggregationOptions(3, 100L, 2.0, 30_000L, FisherZTransform.MIN_SAMPLES);
    }

    /**
     * Reads options from a {@code genemeta.aggregation} style block; missing keys keep their defaults.
     */
    public static AggregationOptions fromConfig(Config options) {
        AggregationOptions d = defaults();
        return new AggregationOptions(
            options.hasPath("max-attempts") ? options.getInt("max-attempts") : d.maxAttempts(),
            options.hasPath("initial-backoff-ms") ? options.getLong("initial-backoff-ms") : d.initialBackoffMs(),
            options.hasPath("backoff-multiplier") ? options.getDouble("backoff-multiplier") : d.backoffMultiplier(),
            options.hasPath("slice-lock-timeout-ms") ? options.getLong("slice-lock-timeout-ms") : d.sliceLockTimeoutMs(),
            options.hasPath("min-correlation-n") ? options.getInt("min-correlation-n") : d.minCorrelationN());
    }

    /**
     * Delay before retry number {@code retry} (1-based).
     */
    public long backoffMillis(int retry) {
        return Math.round(initialBackoffMs * Math.pow(backoffMultiplier, retry - 1));
    }
}
