package org.genemeta.datapipeline.statistics;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Benjamini–Hochberg false discovery rate adjustment.
 */
public final class BenjaminiHochberg {

    private BenjaminiHochberg() {
    }

    /**
     * Returns the BH q-values of the given p-values, in input order.
     * <p>
     * {@code q_(i) = min_{j >= i} p_(j)·m / j}, capped at 1, where {@code p_(i)} is the i-th
     * smallest p-value.
     *
     * @param pValues p-values in [0, 1].
     * @return q-values aligned with the input.
     * @throws IllegalArgumentException if a p-value is NaN or outside [0, 1].
     */
    public static double[] adjust(double[] pValues) {
        final int m = pValues.length;
        for (double p : pValues) {
            if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
                throw new IllegalArgumentException("p-value must lie in [0, 1]: " + p);
            }
        }
        Integer[] order = IntStream.range(0, m).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> pValues[i]));

        double[] q = new double[m];
        double running = 1.0;
        for (int rank = m; rank >= 1; rank--) {
            int index = order[rank - 1];
            running = Math.min(running, pValues[index] * m / rank);
            q[index] = running;
        }
        return q;
    }
}
