package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * Study reference row.
 *
 * @param studyKey   Surrogate key.
 * @param accession  External accession code.
 * @param technology Measurement technology inferred upstream (e.g. {@code MICROARRAY}).
 */
public record StudyInfo(int studyKey, String accession, String technology) {
}
