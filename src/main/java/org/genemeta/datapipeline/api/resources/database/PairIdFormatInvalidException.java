package org.genemeta.datapipeline.api.resources.database;

/**
 * Thrown when an external pair identifier is not two distinct integer gene keys
 * joined by an underscore.
 */
public class PairIdFormatInvalidException extends AggregationPreconditionException {

    public static final String ERROR_CODE = "PAIR_ID_FORMAT_INVALID";

    private final String pairId;

    public PairIdFormatInvalidException(String pairId, String reason) {
        super(ERROR_CODE, "Invalid pair id '" + pairId + "': " + reason);
        this.pairId = pairId;
    }

    public String getPairId() {
        return pairId;
    }
}
