package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * Disease reference row. Created by an administrator, only read by the engine.
 *
 * @param diseaseKey Surrogate key.
 * @param label      Unique label such as {@code SEPSIS} or {@code SEPTIC_SHOCK}.
 * @param active     Whether the disease may receive new contributions.
 */
public record DiseaseInfo(int diseaseKey, String label, boolean active) {
}
