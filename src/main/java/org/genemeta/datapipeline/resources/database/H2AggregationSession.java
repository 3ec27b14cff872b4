package org.genemeta.datapipeline.resources.database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.genemeta.datapipeline.api.resources.database.ConcurrentUpdateException;
import org.genemeta.datapipeline.api.resources.database.IAggregationSession;
import org.genemeta.datapipeline.api.resources.database.dto.PooledMetricResult;
import org.genemeta.datapipeline.api.resources.database.dto.StatisticsKey;
import org.genemeta.datapipeline.api.resources.database.dto.StudyDiseaseMapping;
import org.genemeta.datapipeline.api.resources.database.dto.StudyInfo;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * H2 aggregation session on one dedicated connection with auto-commit disabled.
 * <p>
 * Sufficient-statistics rows are written with an optimistic {@code row_version} check. A row
 * that another writer created or changed since it was loaded makes the write fail with
 * {@link ConcurrentUpdateException}.
 */
class H2AggregationSession implements IAggregationSession {

    private static final Logger log = LoggerFactory.getLogger(H2AggregationSession.class);

    private final Connection connection;
    private final LedgerJsonCodec ledgerCodec;
    private final Clock clock;
    private boolean committed = false;
    private boolean closed = false;

    H2AggregationSession(Connection connection, LedgerJsonCodec ledgerCodec, Clock clock) {
        this.connection = connection;
        this.ledgerCodec = ledgerCodec;
        this.clock = clock;
    }

    @Override
    public Optional<StudyInfo> findStudy(int studyKey) throws SQLException {
        ensureOpen();
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT study_key, accession, technology FROM study WHERE study_key = ?")) {
            stmt.setInt(1, studyKey);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new StudyInfo(rs.getInt("study_key"), rs.getString("accession"),
                    rs.getString("technology")));
            }
        }
    }

    @Override
    public List<StudyDiseaseMapping> findActiveDiseaseMappings(int studyKey, Instant at) throws SQLException {
        ensureOpen();
        String sql = "SELECT m.study_key, m.disease_key, d.disease_label, d.is_active AS disease_active,"
            + " m.is_active, m.effective_from, m.effective_to"
            + " FROM study_disease_mapping m JOIN disease d ON d.disease_key = m.disease_key"
            + " WHERE m.study_key = ? AND m.is_active = TRUE"
            + " AND m.effective_from <= ? AND (m.effective_to IS NULL OR m.effective_to > ?)"
            + " ORDER BY m.disease_key";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setInt(1, studyKey);
            H2Rows.setInstant(stmt, 2, at);
            H2Rows.setInstant(stmt, 3, at);
            List<StudyDiseaseMapping> mappings = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    mappings.add(new StudyDiseaseMapping(
                        rs.getInt("study_key"),
                        rs.getInt("disease_key"),
                        rs.getString("disease_label"),
                        rs.getBoolean("disease_active"),
                        rs.getBoolean("is_active"),
                        H2Rows.getInstant(rs, "effective_from"),
                        H2Rows.getInstant(rs, "effective_to")));
                }
            }
            return mappings;
        }
    }

    @Override
    public boolean geneExists(int geneKey) throws SQLException {
        ensureOpen();
        try (PreparedStatement stmt = connection.prepareStatement("SELECT 1 FROM gene WHERE gene_key = ?")) {
            stmt.setInt(1, geneKey);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public long findOrCreatePair(int geneAKey, int geneBKey) throws SQLException {
        ensureOpen();
        if (geneAKey >= geneBKey) {
            throw new IllegalArgumentException("Pair must be canonically ordered: " + geneAKey + " >= " + geneBKey);
        }
        Optional<Long> existing = selectPair(geneAKey, geneBKey);
        if (existing.isPresent()) {
            return existing.get();
        }
        // Key-based MERGE: a concurrent first sighting of the same pair updates instead of duplicating
        try (PreparedStatement stmt = connection.prepareStatement(
                "MERGE INTO gene_pair (gene_a_key, gene_b_key) KEY (gene_a_key, gene_b_key) VALUES (?, ?)")) {
            stmt.setInt(1, geneAKey);
            stmt.setInt(2, geneBKey);
            stmt.executeUpdate();
        }
        long pairKey = selectPair(geneAKey, geneBKey)
            .orElseThrow(() -> new SQLException("Pair " + geneAKey + "_" + geneBKey + " missing after merge"));
        log.debug("Created gene pair {}_{} with key {}", geneAKey, geneBKey, pairKey);
        return pairKey;
    }

    private Optional<Long> selectPair(int geneAKey, int geneBKey) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT pair_key FROM gene_pair WHERE gene_a_key = ? AND gene_b_key = ?")) {
            stmt.setInt(1, geneAKey);
            stmt.setInt(2, geneBKey);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<SufficientStatistics> loadStatistics(StatisticsKey key) throws SQLException {
        ensureOpen();
        return selectStatistics(connection, key, ledgerCodec);
    }

    static Optional<SufficientStatistics> selectStatistics(Connection conn, StatisticsKey key,
                                                           LedgerJsonCodec codec) throws SQLException {
        String sql = "SELECT " + H2Rows.STATISTICS_COLUMNS + " FROM sufficient_statistics"
            + " WHERE pair_key = ? AND disease_key = ? AND technology = ? AND metric_name = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            bindKey(stmt, 1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(H2Rows.readStatistics(rs, key, codec)) : Optional.empty();
            }
        }
    }

    @Override
    public void saveStatistics(SufficientStatistics statistics) throws SQLException {
        ensureOpen();
        StatisticsKey key = statistics.getKey();
        long expectedVersion = statistics.getRowVersion();
        long newVersion = expectedVersion + 1;
        String ledgerJson = ledgerCodec.toJson(statistics.getLedger());

        if (!statistics.isPersisted()) {
            String sql = "INSERT INTO sufficient_statistics (pair_key, disease_key, technology, metric_name, "
                + H2Rows.STATISTICS_COLUMNS + ", updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                int i = bindKey(stmt, 1, key);
                stmt.setString(i++, statistics.getMetricKind().name());
                i = bindSums(stmt, i, statistics);
                stmt.setString(i++, ledgerJson);
                stmt.setLong(i++, newVersion);
                H2Rows.setInstant(stmt, i, clock.instant());
                stmt.executeUpdate();
            } catch (SQLException e) {
                if (H2Rows.isDuplicateKey(e)) {
                    ConcurrentUpdateException conflict = new ConcurrentUpdateException(key, expectedVersion);
                    conflict.initCause(e);
                    throw conflict;
                }
                throw e;
            }
        } else {
            String sql = "UPDATE sufficient_statistics SET sum_w = ?, sum_w2 = ?, sum_w_theta = ?, sum_w_theta2 = ?,"
                + " study_count = ?, ledger_json = ?, row_version = ?, updated_at = ?"
                + " WHERE pair_key = ? AND disease_key = ? AND technology = ? AND metric_name = ? AND row_version = ?";
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                int i = bindSums(stmt, 1, statistics);
                stmt.setString(i++, ledgerJson);
                stmt.setLong(i++, newVersion);
                H2Rows.setInstant(stmt, i++, clock.instant());
                i = bindKey(stmt, i, key);
                stmt.setLong(i, expectedVersion);
                if (stmt.executeUpdate() != 1) {
                    throw new ConcurrentUpdateException(key, expectedVersion);
                }
            }
        }
        statistics.markPersisted(newVersion);
    }

    private static int bindSums(PreparedStatement stmt, int index, SufficientStatistics statistics)
            throws SQLException {
        stmt.setDouble(index++, statistics.getSumW());
        stmt.setDouble(index++, statistics.getSumW2());
        stmt.setDouble(index++, statistics.getSumWTheta());
        stmt.setDouble(index++, statistics.getSumWTheta2());
        stmt.setInt(index++, statistics.getStudyCount());
        return index;
    }

    static int bindKey(PreparedStatement stmt, int index, StatisticsKey key) throws SQLException {
        stmt.setLong(index++, key.pairKey());
        stmt.setInt(index++, key.diseaseKey());
        stmt.setString(index++, key.technology());
        stmt.setString(index++, key.metricName());
        return index;
    }

    @Override
    public void upsertPooledResult(PooledMetricResult result) throws SQLException {
        ensureOpen();
        String sql = "MERGE INTO pooled_metric_result (pair_key, disease_key, technology, metric_name, metric_kind,"
            + " theta_pooled, theta_fixed, se_pooled, ci_lower, ci_upper, tau2, cochran_q, i2, z_value, p_value,"
            + " included_study_count, total_samples, feature_run_id, updated_at)"
            + " KEY (pair_key, disease_key, technology, metric_name)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            int i = bindKey(stmt, 1, result.key);
            stmt.setString(i++, result.metricKind.name());
            stmt.setDouble(i++, result.thetaPooled);
            stmt.setDouble(i++, result.thetaFixed);
            stmt.setDouble(i++, result.sePooled);
            stmt.setDouble(i++, result.ciLower);
            stmt.setDouble(i++, result.ciUpper);
            stmt.setDouble(i++, result.tau2);
            stmt.setDouble(i++, result.q);
            H2Rows.setNullableDouble(stmt, i++, result.i2);
            stmt.setDouble(i++, result.z);
            stmt.setDouble(i++, result.p);
            stmt.setInt(i++, result.includedStudyCount);
            H2Rows.setNullableLong(stmt, i++, result.totalSamples);
            stmt.setString(i++, result.featureRunId);
            H2Rows.setInstant(stmt, i, result.updatedAt);
            stmt.executeUpdate();
        }
    }

    @Override
    public void commit() throws SQLException {
        ensureOpen();
        connection.commit();
        committed = true;
    }

    @Override
    public void rollback() throws SQLException {
        ensureOpen();
        connection.rollback();
    }

    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!committed) {
                try {
                    connection.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
                }
            }
            // Pooled connections are shared; leave them in the pool's default mode
            connection.setAutoCommit(true);
        } finally {
            connection.close();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Aggregation session already closed");
        }
    }
}
