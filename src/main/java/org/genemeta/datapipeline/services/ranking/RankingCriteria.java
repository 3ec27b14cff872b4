package org.genemeta.datapipeline.services.ranking;

import com.typesafe.config.Config;

/**
 * Filter thresholds and result size of a ranking query.
 *
 * @param qThreshold Maximum {@code q_star}.
 * @param kMin       Minimum included study count.
 * @param i2Max      Maximum {@code i2_star} in percent.
 * @param limit      Maximum number of ranked pairs returned.
 */
public record RankingCriteria(double qThreshold, int kMin, double i2Max, int limit) {

    public static final double DEFAULT_Q_THRESHOLD = 0.05;
    public static final int DEFAULT_K_MIN = 3;
    public static final double DEFAULT_I2_MAX = 75.0;
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public RankingCriteria {
        if (Double.isNaN(qThreshold) || qThreshold < 0.0 || qThreshold > 1.0) {
            throw new IllegalArgumentException("q must lie in [0, 1], got " + qThreshold);
        }
        if (kMin < 1) {
            throw new IllegalArgumentException("k_min must be at least 1, got " + kMin);
        }
        if (Double.isNaN(i2Max) || i2Max < 0.0 || i2Max > 100.0) {
            throw new IllegalArgumentException("i2_max must lie in [0, 100], got " + i2Max);
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must lie in [1, " + MAX_LIMIT + "], got " + limit);
        }
    }

    public static RankingCriteria defaults() {
        return new RankingCriteria(DEFAULT_Q_THRESHOLD, DEFAULT_K_MIN, DEFAULT_I2_MAX, DEFAULT_LIMIT);
    }

    /**
     * Reads default criteria from the {@code genemeta.ranking} block; missing keys keep the built-in defaults.
     */
    public static RankingCriteria fromConfig(Config options) {
        return new RankingCriteria(
            options.hasPath("q-threshold") ? options.getDouble("q-threshold") : DEFAULT_Q_THRESHOLD,
            options.hasPath("k-min") ? options.getInt("k-min") : DEFAULT_K_MIN,
            options.hasPath("i2-max") ? options.getDouble("i2-max") : DEFAULT_I2_MAX,
            options.hasPath("default-limit") ? options.getInt("default-limit") : DEFAULT_LIMIT);
    }

    public RankingCriteria withQThreshold(double value) {
        return new RankingCriteria(value, kMin, i2Max, limit);
    }

    public RankingCriteria withKMin(int value) {
        return new RankingCriteria(qThreshold, value, i2Max, limit);
    }

    public RankingCriteria withI2Max(double value) {
        return new RankingCriteria(qThreshold, kMin, value, limit);
    }

    public RankingCriteria withLimit(int value) {
        return new RankingCriteria(qThreshold, kMin, i2Max, value);
    }
}
