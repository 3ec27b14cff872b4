package org.genemeta.datapipeline.api.resources.database;

/**
 * Thrown when a pair refers to a gene key that is not in the gene reference set.
 */
public class PairGeneKeyNotFoundException extends AggregationPreconditionException {

    public static final String ERROR_CODE = "PAIR_GENE_KEY_NOT_FOUND";

    private final int geneKey;

    public PairGeneKeyNotFoundException(int geneKey, String pairId) {
        super(ERROR_CODE, "Unknown gene key " + geneKey + " in pair '" + pairId + "'");
        this.geneKey = geneKey;
    }

    public int getGeneKey() {
        return geneKey;
    }
}
