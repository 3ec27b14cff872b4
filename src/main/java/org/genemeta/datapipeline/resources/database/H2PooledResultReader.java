package org.genemeta.datapipeline.resources.database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.genemeta.datapipeline.api.resources.database.IPooledResultReader;
import org.genemeta.datapipeline.api.resources.database.dto.AnnotatedPooledResult;
import org.genemeta.datapipeline.api.resources.database.dto.DiseaseInfo;
import org.genemeta.datapipeline.api.resources.database.dto.GenePair;
import org.genemeta.datapipeline.api.resources.database.dto.StatisticsKey;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-request reader of the pooled fact table.
 * <p>
 * Holds a dedicated auto-commit connection; pooled rows are joined with the gene reference
 * table so callers get gene identifiers and symbols alongside the numbers.
 */
class H2PooledResultReader implements IPooledResultReader {

    private static final Logger log = LoggerFactory.getLogger(H2PooledResultReader.class);

    private static final String ANNOTATED_SELECT = "SELECT " + H2Rows.POOLED_COLUMNS + ","
        + " p.gene_a_key, p.gene_b_key, ga.gene_id AS gene_a_id, ga.gene_symbol AS gene_a_symbol,"
        + " gb.gene_id AS gene_b_id, gb.gene_symbol AS gene_b_symbol"
        + " FROM pooled_metric_result r"
        + " JOIN gene_pair p ON p.pair_key = r.pair_key"
        + " LEFT JOIN gene ga ON ga.gene_key = p.gene_a_key"
        + " LEFT JOIN gene gb ON gb.gene_key = p.gene_b_key";

    private final Connection connection;
    private final LedgerJsonCodec ledgerCodec;
    private boolean closed = false;

    H2PooledResultReader(Connection connection, LedgerJsonCodec ledgerCodec) {
        this.connection = connection;
        this.ledgerCodec = ledgerCodec;
    }

    @Override
    public Optional<DiseaseInfo> findDiseaseByLabel(String label) throws SQLException {
        ensureNotClosed();
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT disease_key, disease_label, is_active FROM disease WHERE LOWER(disease_label) = LOWER(?)")) {
            stmt.setString(1, label);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new DiseaseInfo(rs.getInt("disease_key"), rs.getString("disease_label"),
                    rs.getBoolean("is_active")));
            }
        }
    }

    @Override
    public Optional<GenePair> findPair(long pairKey) throws SQLException {
        ensureNotClosed();
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT pair_key, gene_a_key, gene_b_key FROM gene_pair WHERE pair_key = ?")) {
            stmt.setLong(1, pairKey);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new GenePair(rs.getLong("pair_key"), rs.getInt("gene_a_key"),
                    rs.getInt("gene_b_key")));
            }
        }
    }

    @Override
    public List<AnnotatedPooledResult> readSlice(int diseaseKey, String technology) throws SQLException {
        ensureNotClosed();
        String sql = ANNOTATED_SELECT
            + " WHERE r.disease_key = ? AND r.technology = ?"
            + " ORDER BY r.pair_key, r.metric_name";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setInt(1, diseaseKey);
            stmt.setString(2, technology);
            List<AnnotatedPooledResult> rows = readAnnotated(stmt);
            log.debug("Read {} pooled rows for slice {}/{}", rows.size(), diseaseKey, technology);
            return rows;
        }
    }

    @Override
    public List<AnnotatedPooledResult> readPair(long pairKey, Integer diseaseKey, String technology)
            throws SQLException {
        ensureNotClosed();
        StringBuilder sql = new StringBuilder(ANNOTATED_SELECT).append(" WHERE r.pair_key = ?");
        if (diseaseKey != null) {
            sql.append(" AND r.disease_key = ?");
        }
        if (technology != null) {
            sql.append(" AND r.technology = ?");
        }
        sql.append(" ORDER BY r.disease_key, r.technology, r.metric_name");
        try (PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
            int i = 1;
            stmt.setLong(i++, pairKey);
            if (diseaseKey != null) {
                stmt.setInt(i++, diseaseKey);
            }
            if (technology != null) {
                stmt.setString(i, technology);
            }
            return readAnnotated(stmt);
        }
    }

    private static List<AnnotatedPooledResult> readAnnotated(PreparedStatement stmt) throws SQLException {
        List<AnnotatedPooledResult> rows = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                GenePair pair = new GenePair(rs.getLong("pair_key"), rs.getInt("gene_a_key"), rs.getInt("gene_b_key"));
                rows.add(new AnnotatedPooledResult(
                    H2Rows.readPooled(rs),
                    pair,
                    rs.getString("gene_a_id"),
                    rs.getString("gene_a_symbol"),
                    rs.getString("gene_b_id"),
                    rs.getString("gene_b_symbol")));
            }
        }
        return rows;
    }

    @Override
    public Optional<SufficientStatistics> readStatistics(StatisticsKey key) throws SQLException {
        ensureNotClosed();
        return H2AggregationSession.selectStatistics(connection, key, ledgerCodec);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        try {
            connection.close();
            closed = true;
        } catch (SQLException e) {
            log.warn("Failed to close pooled result reader connection: {}", e.getMessage());
        }
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Reader already closed");
        }
    }
}
