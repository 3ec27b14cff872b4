package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * Verdict of an external reviewer on a ranked pair.
 */
public enum ReviewVerdict {
    CONFIRMED,
    REJECTED,
    NEEDS_FOLLOWUP
}
