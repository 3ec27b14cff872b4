package org.genemeta.datapipeline.api.resources.database;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import org.genemeta.datapipeline.api.resources.database.dto.AnnotatedPooledResult;
import org.genemeta.datapipeline.api.resources.database.dto.DiseaseInfo;
import org.genemeta.datapipeline.api.resources.database.dto.GenePair;
import org.genemeta.datapipeline.api.resources.database.dto.StatisticsKey;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics;

/**
 * Read-only access to the pooled fact table and the reference data needed to present it.
 * <p>
 * Readers never take locks beyond the store's normal read consistency.
 */
public interface IPooledResultReader extends AutoCloseable {

    /**
     * Looks up a disease by its label (case-insensitive).
     */
    Optional<DiseaseInfo> findDiseaseByLabel(String label) throws SQLException;

    /**
     * Looks up a pair by key.
     */
    Optional<GenePair> findPair(long pairKey) throws SQLException;

    /**
     * Reads all pooled rows of a {@code (disease, technology)} slice, ordered by pair key and metric.
     */
    List<AnnotatedPooledResult> readSlice(int diseaseKey, String technology) throws SQLException;

    /**
     * Reads the pooled rows of one pair, optionally restricted to a disease and a technology.
     *
     * @param pairKey    The pair.
     * @param diseaseKey Disease filter, or null for all diseases.
     * @param technology Technology filter, or null for all technologies.
     */
    List<AnnotatedPooledResult> readPair(long pairKey, Integer diseaseKey, String technology) throws SQLException;

    /**
     * Reads a sufficient-statistics row outside of any aggregation transaction.
     */
    Optional<SufficientStatistics> readStatistics(StatisticsKey key) throws SQLException;

    @Override
    void close() throws SQLException;
}
