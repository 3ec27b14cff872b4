package org.genemeta.datapipeline.statistics;

import java.util.Optional;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.genemeta.datapipeline.api.resources.database.dto.LedgerEntry;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics;

/**
 * DerSimonian–Laird random-effects pooling over a sufficient-statistics snapshot.
 * <p>
 * Q, C and τ² come from the running sums alone. Once τ² is positive the random-effects weights
 * {@code 1 / (SE_i² + τ²)} cannot be derived from the sums, so the estimate is recomputed from the
 * raw estimates kept in the ledger.
 * <p>
 * Stateless and thread-safe.
 */
public final class DerSimonianLairdPooler {

    /** 97.5% quantile of the standard normal distribution. */
    public static final double Z_975 = 1.959963984540054;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private static final double TAIL_PROBABILITY = 1e-6;
    /** Φ(−37.5) is still a normal double; Φ(−4.5) is above {@link #TAIL_PROBABILITY}. */
    private static final double TAIL_LOWER_BOUND = -37.5;
    private static final double TAIL_UPPER_BOUND = -4.5;

    /**
     * Pools the contributions of a sufficient-statistics row.
     *
     * @param statistics The row to pool.
     * @return The pooled estimate, or empty if the row holds no contribution.
     */
    public Optional<PooledEstimate> pool(SufficientStatistics statistics) {
        final int k = statistics.getStudyCount();
        if (k == 0) {
            return Optional.empty();
        }

        final double s1 = statistics.getSumW();
        final double s2 = statistics.getSumW2();
        final double thetaFixed = statistics.getSumWTheta() / s1;

        if (k == 1) {
            double se = Math.sqrt(1.0 / s1);
            return Optional.of(estimate(thetaFixed, thetaFixed, se, 0.0, 0.0, null, k));
        }

        // Rounding can push Q a hair below zero for perfectly homogeneous studies
        final double q = Math.max(0.0,
            statistics.getSumWTheta2() - statistics.getSumWTheta() * statistics.getSumWTheta() / s1);
        final double c = s1 - s2 / s1;
        final double tau2 = c > 0.0 ? Math.max(0.0, (q - (k - 1)) / c) : 0.0;
        final double i2 = q > 0.0 ? Math.max(0.0, (q - (k - 1)) / q) * 100.0 : 0.0;

        final double thetaRandom;
        final double se;
        if (tau2 == 0.0) {
            thetaRandom = thetaFixed;
            se = Math.sqrt(1.0 / s1);
        } else {
            double sumWStar = 0.0;
            double sumWStarTheta = 0.0;
            for (LedgerEntry entry : statistics.getLedger()) {
                double variance = entry.standardError() * entry.standardError();
                double wStar = 1.0 / (variance + tau2);
                sumWStar += wStar;
                sumWStarTheta += wStar * entry.theta();
            }
            thetaRandom = sumWStarTheta / sumWStar;
            se = Math.sqrt(1.0 / sumWStar);
        }

        return Optional.of(estimate(thetaFixed, thetaRandom, se, tau2, q, i2, k));
    }

    private static PooledEstimate estimate(double thetaFixed, double thetaRandom, double se,
                                           double tau2, double q, Double i2, int k) {
        double z = thetaRandom / se;
        return new PooledEstimate(
            thetaFixed,
            thetaRandom,
            se,
            tau2,
            q,
            i2,
            z,
            twoSidedPValue(z),
            thetaRandom - Z_975 * se,
            thetaRandom + Z_975 * se,
            k);
    }

    /**
     * Returns the two-sided p-value {@code 2·(1 − Φ(|z|))} of a standard normal statistic.
     * Evaluated as {@code 2·Φ(−|z|)}, which is the same value without cancellation in the tail.
     */
    public static double twoSidedPValue(double z) {
        return Math.min(1.0, 2.0 * STANDARD_NORMAL.cumulativeProbability(-Math.abs(z)));
    }

    /**
     * Returns the standard normal quantile {@code Φ⁻¹(probability)}.
     * <p>
     * Below {@link #TAIL_PROBABILITY} the closed form loses precision ({@code 2p − 1} cancels, and rounds to −1 below 1e-16),
     * so the lower tail is solved from {@code ln Φ(x) = ln p}, which {@code erfc} keeps accurate down to
     * the smallest normal double.
     */
    static double standardNormalQuantile(double probability) {
        if (probability > 0.0 && probability < TAIL_PROBABILITY) {
            final double logTarget = Math.log(probability);
            final UnivariateFunction f = x -> Math.log(STANDARD_NORMAL.cumulativeProbability(x)) - logTarget;
            return new BrentSolver(1e-10).solve(200, f, TAIL_LOWER_BOUND, TAIL_UPPER_BOUND);
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(probability);
    }
}
