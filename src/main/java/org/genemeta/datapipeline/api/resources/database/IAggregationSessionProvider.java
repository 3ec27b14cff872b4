package org.genemeta.datapipeline.api.resources.database;

import java.sql.SQLException;

/**
 * Opens transactional aggregation sessions on the statistics store.
 */
public interface IAggregationSessionProvider {

    /**
     * Opens a new session on a dedicated connection with auto-commit disabled.
     *
     * @return A new session; the caller must close it.
     * @throws SQLException if no connection can be obtained.
     */
    IAggregationSession openSession() throws SQLException;
}
