package org.genemeta.datapipeline.api.resources.database;

import java.util.List;

/**
 * Thrown when a study has more than one active disease assignment.
 * <p>
 * The mapping table is supposed to make this impossible, so this signals a data-integrity bug
 * upstream. It is escalated, never resolved by picking one of the rows.
 */
public class MultiDiseaseMappingException extends AggregationPreconditionException {

    public static final String ERROR_CODE = "MULTI_DISEASE_MAPPING";

    private final int studyKey;
    private final List<Integer> diseaseKeys;

    public MultiDiseaseMappingException(int studyKey, List<Integer> diseaseKeys) {
        super(ERROR_CODE, "Study " + studyKey + " has " + diseaseKeys.size()
            + " active disease mappings " + diseaseKeys + "; the mapping table must hold at most one");
        this.studyKey = studyKey;
        this.diseaseKeys = List.copyOf(diseaseKeys);
    }

    public int getStudyKey() {
        return studyKey;
    }

    public List<Integer> getDiseaseKeys() {
        return diseaseKeys;
    }
}
