package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * Lifecycle of a feature run record. SUCCESS and FAILED are terminal.
 */
public enum FeatureRunStatus {
    RUNNING,
    SUCCESS,
    FAILED
}
