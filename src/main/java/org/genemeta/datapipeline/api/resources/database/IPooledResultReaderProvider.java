package org.genemeta.datapipeline.api.resources.database;

import java.sql.SQLException;

/**
 * Creates per-request readers of the pooled fact table.
 */
public interface IPooledResultReaderProvider {

    /**
     * Creates a reader holding its own connection; the caller must close it.
     */
    IPooledResultReader createReader() throws SQLException;
}
