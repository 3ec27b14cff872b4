package org.genemeta.datapipeline.api.resources.database;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import org.genemeta.datapipeline.api.resources.database.dto.FeatureRun;
import org.genemeta.datapipeline.api.resources.database.dto.ValidationWarning;

/**
 * Provenance of aggregation runs and the data-quality warnings they raised.
 * <p>
 * Writes are committed immediately and independently of the aggregation transaction, so a
 * failed run is still recorded.
 */
public interface IRunProvenanceLog {

    /**
     * Inserts or replaces a run record.
     */
    void recordRun(FeatureRun run) throws SQLException;

    /**
     * Appends data-quality warnings of a run.
     */
    void recordWarnings(List<ValidationWarning> warnings) throws SQLException;

    /**
     * Looks up a run.
     */
    Optional<FeatureRun> findRun(String featureRunId) throws SQLException;

    /**
     * Returns the warnings recorded for a run, in insertion order.
     */
    List<ValidationWarning> findWarnings(String featureRunId) throws SQLException;
}
