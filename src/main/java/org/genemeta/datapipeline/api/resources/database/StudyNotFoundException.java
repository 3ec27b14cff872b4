package org.genemeta.datapipeline.api.resources.database;

/**
 * Thrown when an aggregation is triggered for a study that is not in the study reference set.
 */
public class StudyNotFoundException extends AggregationPreconditionException {

    public static final String ERROR_CODE = "STUDY_NOT_FOUND";

    public StudyNotFoundException(int studyKey) {
        super(ERROR_CODE, "Study " + studyKey + " not found");
    }
}
