package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * Resolved slice of an aggregation run: the study together with its single active
 * disease assignment and its measurement technology.
 *
 * @param studyKey     The study being folded in.
 * @param diseaseKey   The disease the study is assigned to.
 * @param diseaseLabel Label of that disease.
 * @param technology   Measurement technology of the study.
 */
public record StudyContext(int studyKey, int diseaseKey, String diseaseLabel, String technology) {

    /**
     * Returns the lock key of the {@code (disease, technology)} slice this study writes to.
     */
    public String sliceKey() {
        return diseaseKey + "/" + technology;
    }
}
