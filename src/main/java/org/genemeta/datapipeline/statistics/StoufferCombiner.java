package org.genemeta.datapipeline.statistics;

import java.util.List;

/**
 * Weighted Stouffer combination of independent two-sided p-values.
 * <p>
 * Each input becomes {@code z_i = Φ⁻¹(1 − p_i/2)·sign(effect_i)}; the combined statistic is
 * {@code Z = Σ w_i z_i / sqrt(Σ w_i²)} with two-sided {@code p = 2·(1 − Φ(|Z|))}.
 * <p>
 * Under {@link StoufferWeighting#SQRT_N} every input must carry a sample size; if any does not,
 * the whole combination uses equal weights and reports so in its result.
 */
public final class StoufferCombiner {

    /** p-values are clamped to this floor so the normal quantile stays finite. */
    static final double MIN_P_VALUE = 1e-300;

    /**
     * One independent significance result.
     *
     * @param pValue     Two-sided p-value.
     * @param effect     Signed effect; only its sign is used.
     * @param sampleSize Sample size, or null when unknown.
     */
    public record Input(double pValue, double effect, Long sampleSize) {
    }

    /**
     * Combined significance.
     *
     * @param z          Combined z.
     * @param p          Two-sided p-value of {@code z}.
     * @param weighting  Weighting actually applied.
     * @param inputCount Number of combined inputs.
     */
    public record Result(double z, double p, StoufferWeighting weighting, int inputCount) {
    }

    private final StoufferWeighting weighting;

    public StoufferCombiner(StoufferWeighting weighting) {
        this.weighting = weighting;
    }

    /**
     * Combines the given inputs.
     *
     * @param inputs At least one input.
     * @return The combined significance.
     * @throws IllegalArgumentException if {@code inputs} is empty or a p-value is outside [0, 1].
     */
    public Result combine(List<Input> inputs) {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("Stouffer combination needs at least one input");
        }
        StoufferWeighting applied = weighting;
        if (applied == StoufferWeighting.SQRT_N) {
            for (Input input : inputs) {
                if (input.sampleSize() == null || input.sampleSize() <= 0) {
                    applied = StoufferWeighting.EQUAL;
                    break;
                }
            }
        }

        double weightedSum = 0.0;
        double sumSquaredWeights = 0.0;
        for (Input input : inputs) {
            double w = applied == StoufferWeighting.SQRT_N ? Math.sqrt(input.sampleSize()) : 1.0;
            weightedSum += w * signedZ(input.pValue(), input.effect());
            sumSquaredWeights += w * w;
        }
        double z = weightedSum / Math.sqrt(sumSquaredWeights);
        return new Result(z, DerSimonianLairdPooler.twoSidedPValue(z), applied, inputs.size());
    }

    /**
     * Converts a two-sided p-value and an effect direction to a signed z-score.
     */
    public static double signedZ(double pValue, double effect) {
        if (Double.isNaN(pValue) || pValue < 0.0 || pValue > 1.0) {
            throw new IllegalArgumentException("p-value must lie in [0, 1]: " + pValue);
        }
        double clamped = Math.max(MIN_P_VALUE, pValue);
        // Lower tail: 1 - p/2 rounds to 1 for tiny p
        double magnitude = Math.abs(DerSimonianLairdPooler.standardNormalQuantile(clamped / 2.0));
        return magnitude * Math.signum(effect);
    }
}
