package org.genemeta.datapipeline.api.resources.database;

import java.sql.SQLTransientException;

import org.genemeta.datapipeline.api.resources.database.dto.StatisticsKey;

/**
 * Thrown when a sufficient-statistics row was changed by another writer between read and write
 * (row version mismatch or concurrent first insert).
 * <p>
 * Transient: the whole study update is retried.
 */
public class ConcurrentUpdateException extends SQLTransientException {

    private final StatisticsKey key;

    public ConcurrentUpdateException(StatisticsKey key, long expectedVersion) {
        super("Concurrent update of " + key + " (expected row version " + expectedVersion + ")");
        this.key = key;
    }

    public StatisticsKey getKey() {
        return key;
    }
}
