package org.genemeta.datapipeline.api.resources.database;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.genemeta.datapipeline.api.resources.database.dto.PooledMetricResult;
import org.genemeta.datapipeline.api.resources.database.dto.StatisticsKey;
import org.genemeta.datapipeline.api.resources.database.dto.StudyDiseaseMapping;
import org.genemeta.datapipeline.api.resources.database.dto.StudyInfo;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics;

/**
 * Transactional unit of work of one aggregation attempt.
 * <p>
 * Everything written through a session becomes visible only on {@link #commit()}. Closing a
 * session that was not committed rolls it back, so an attempt that fails part-way leaves no
 * partial pair updates behind.
 * <p>
 * <strong>Thread Safety:</strong> A session holds one dedicated connection and must be used by
 * one thread only.
 */
public interface IAggregationSession extends AutoCloseable {

    /**
     * Looks up a study of the reference set.
     *
     * @param studyKey Study to look up.
     * @return The study, or empty if unknown.
     * @throws SQLException if the read fails.
     */
    Optional<StudyInfo> findStudy(int studyKey) throws SQLException;

    /**
     * Returns all study to disease mappings of a study that are active at {@code at}.
     * <p>
     * Callers decide what zero or several rows mean; this method never filters them down.
     *
     * @param studyKey Study whose mappings are read.
     * @param at       Reference time for the validity window.
     * @return Active mappings, possibly empty.
     * @throws SQLException if the read fails.
     */
    List<StudyDiseaseMapping> findActiveDiseaseMappings(int studyKey, Instant at) throws SQLException;

    /**
     * Checks whether a gene key is in the gene reference set.
     */
    boolean geneExists(int geneKey) throws SQLException;

    /**
     * Returns the pair key of a canonically ordered pair, creating the pair if it is absent.
     *
     * @param geneAKey The smaller gene key.
     * @param geneBKey The larger gene key.
     * @return The pair key.
     * @throws SQLException if the read or insert fails.
     */
    long findOrCreatePair(int geneAKey, int geneBKey) throws SQLException;

    /**
     * Loads a sufficient-statistics row together with its ledger and row version.
     *
     * @param key Row key.
     * @return The row, or empty if no study has contributed to this key yet.
     * @throws SQLException if the read fails or the stored row is corrupted.
     */
    Optional<SufficientStatistics> loadStatistics(StatisticsKey key) throws SQLException;

    /**
     * Writes a sufficient-statistics row with an optimistic version check and marks it persisted
     * with its new version.
     *
     * @param statistics Row to write.
     * @throws ConcurrentUpdateException if another writer changed or created the row meanwhile.
     * @throws SQLException              if the write fails.
     */
    void saveStatistics(SufficientStatistics statistics) throws SQLException;

    /**
     * Inserts or replaces the pooled fact row of a key.
     */
    void upsertPooledResult(PooledMetricResult result) throws SQLException;

    /**
     * Commits everything written through this session.
     */
    void commit() throws SQLException;

    /**
     * Discards everything written through this session.
     */
    void rollback() throws SQLException;

    @Override
    void close() throws SQLException;
}
