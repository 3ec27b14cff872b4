package org.genemeta.datapipeline.statistics;

import org.apache.commons.math3.util.FastMath;

/**
 * Fisher z-transform of correlation coefficients.
 * <p>
 * Correlations are pooled as {@code z = atanh(r)} with {@code SE = 1 / sqrt(n − 3)}; the pooled
 * estimate and its confidence bounds are mapped back with {@code tanh}. The transform is monotonic,
 * so the bounds keep their order.
 */
public final class FisherZTransform {

    /** Smallest sample size for which {@code 1 / sqrt(n − 3)} is defined. */
    public static final int MIN_SAMPLES = 4;

    private FisherZTransform() {
    }

    /**
     * Transforms a correlation to the Fisher-z scale.
     *
     * @param r Correlation, strictly between -1 and 1.
     * @return {@code atanh(r)}.
     * @throws IllegalArgumentException if {@code |r| >= 1} or r is not finite.
     */
    public static double toZ(double r) {
        if (!Double.isFinite(r) || Math.abs(r) >= 1.0) {
            throw new IllegalArgumentException("Correlation must lie in (-1, 1): " + r);
        }
        return FastMath.atanh(r);
    }

    /**
     * Transforms a Fisher-z value back to the correlation scale.
     */
    public static double toR(double z) {
        return FastMath.tanh(z);
    }

    /**
     * Standard error of a Fisher-z value from {@code n} samples.
     *
     * @throws IllegalArgumentException if {@code n < 4}.
     */
    public static double standardError(int n) {
        if (n < MIN_SAMPLES) {
            throw new IllegalArgumentException("Fisher-z standard error needs at least " + MIN_SAMPLES + " samples, got " + n);
        }
        return 1.0 / Math.sqrt(n - 3.0);
    }

    /**
     * Maps a pooled estimate on the Fisher-z scale back to the correlation scale.
     * <p>
     * The point estimates and both confidence bounds are transformed together; standard error,
     * τ², Q, I², z and p keep their Fisher-z scale values.
     */
    public static PooledEstimate backTransform(PooledEstimate onZScale) {
        return new PooledEstimate(
            toR(onZScale.thetaFixed()),
            toR(onZScale.thetaRandom()),
            onZScale.standardError(),
            onZScale.tau2(),
            onZScale.q(),
            onZScale.i2(),
            onZScale.z(),
            onZScale.p(),
            toR(onZScale.ciLower()),
            toR(onZScale.ciUpper()),
            onZScale.studyCount());
    }
}
