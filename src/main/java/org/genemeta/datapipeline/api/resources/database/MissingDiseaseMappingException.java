package org.genemeta.datapipeline.api.resources.database;

/**
 * Thrown when a study has no active disease assignment (or only one to an inactive disease).
 */
public class MissingDiseaseMappingException extends AggregationPreconditionException {

    public static final String ERROR_CODE = "MISSING_DISEASE_MAPPING";

    private final int studyKey;

    public MissingDiseaseMappingException(int studyKey, String detail) {
        super(ERROR_CODE, "No active disease mapping for study " + studyKey + ": " + detail);
        this.studyKey = studyKey;
    }

    public int getStudyKey() {
        return studyKey;
    }
}
