package org.genemeta.datapipeline.api.resources.database.dto;

import java.time.Instant;

/**
 * One row of the study to disease assignment table, joined with its disease.
 *
 * @param studyKey      The mapped study.
 * @param diseaseKey    The assigned disease.
 * @param diseaseLabel  Label of the assigned disease.
 * @param diseaseActive Whether the assigned disease itself is active.
 * @param active        Whether the mapping row is active.
 * @param effectiveFrom Start of validity (inclusive).
 * @param effectiveTo   End of validity (exclusive), or null if open-ended.
 */
public record StudyDiseaseMapping(int studyKey,
                                  int diseaseKey,
                                  String diseaseLabel,
                                  boolean diseaseActive,
                                  boolean active,
                                  Instant effectiveFrom,
                                  Instant effectiveTo) {
}
