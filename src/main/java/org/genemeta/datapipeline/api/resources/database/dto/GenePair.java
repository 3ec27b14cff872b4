package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * Canonical, order-independent identity of two genes.
 * <p>
 * The smaller gene key is always stored as gene A. Instances are immutable once created.
 *
 * @param pairKey  Surrogate key of the pair.
 * @param geneAKey The smaller gene key.
 * @param geneBKey The larger gene key.
 */
public record GenePair(long pairKey, int geneAKey, int geneBKey) {

    public GenePair {
        if (geneAKey >= geneBKey) {
            throw new IllegalArgumentException(
                "Gene pair must be canonically ordered (geneA < geneB), got " + geneAKey + "_" + geneBKey);
        }
    }

    /**
     * Returns the pair identifier in the external {@code <geneA_key>_<geneB_key>} format.
     */
    public String pairId() {
        return geneAKey + "_" + geneBKey;
    }
}
