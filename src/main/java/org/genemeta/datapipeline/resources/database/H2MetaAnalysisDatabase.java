package org.genemeta.datapipeline.resources.database;

import java.io.File;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.genemeta.datapipeline.api.resources.database.IAggregationSession;
import org.genemeta.datapipeline.api.resources.database.IAggregationSessionProvider;
import org.genemeta.datapipeline.api.resources.database.IPairReviewLog;
import org.genemeta.datapipeline.api.resources.database.IPooledResultReader;
import org.genemeta.datapipeline.api.resources.database.IPooledResultReaderProvider;
import org.genemeta.datapipeline.api.resources.database.IRunProvenanceLog;
import org.genemeta.datapipeline.api.resources.database.dto.FeatureRun;
import org.genemeta.datapipeline.api.resources.database.dto.PairReview;
import org.genemeta.datapipeline.api.resources.database.dto.ReviewVerdict;
import org.genemeta.datapipeline.api.resources.database.dto.ValidationCode;
import org.genemeta.datapipeline.api.resources.database.dto.ValidationWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * H2 meta-analysis store using HikariCP for connection pooling.
 * <p>
 * Creates its schema idempotently on start-up. Aggregation sessions get a dedicated connection
 * with auto-commit disabled; provenance, validation and review writes use short auto-commit
 * connections so they are independent of any aggregation transaction.
 * <p>
 * Implements {@link AutoCloseable} to ensure proper cleanup of database connections
 * and connection pool resources during shutdown.
 */
public class H2MetaAnalysisDatabase implements IAggregationSessionProvider, IPooledResultReaderProvider,
        IRunProvenanceLog, IPairReviewLog, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(H2MetaAnalysisDatabase.class);

    private final String name;
    private final HikariDataSource dataSource;
    private final LedgerJsonCodec ledgerCodec = new LedgerJsonCodec();
    private final Clock clock;

    public H2MetaAnalysisDatabase(String name, Config options) {
        this(name, options, Clock.systemUTC());
    }

    public H2MetaAnalysisDatabase(String name, Config options, Clock clock) {
        this.name = name;
        this.clock = clock;

        final String jdbcUrl = getJdbcUrl(options);
        final String username = options.hasPath("username") ? options.getString("username") : "sa";
        final String password = options.hasPath("password") ? options.getString("password") : "";

        // Validate database directory exists BEFORE attempting to connect
        validateDatabasePath(name, jdbcUrl);

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver"); // Explicitly set driver for Fat JAR compatibility
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 2);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("H2 database '{}' connection pool started (max={}, minIdle={})",
                name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (Exception e) {
            // Unwrap to find root cause
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";

            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                String dbFilePath = jdbcUrl.replace("jdbc:h2:", "");
                String errorMsg = String.format(
                    "Cannot open H2 database '%s': file already in use by another process. File: %s.mv.db. Stop the other genemeta process or remove stale lock files.",
                    name, dbFilePath);
                log.error(errorMsg);
                throw new RuntimeException(errorMsg, e);
            }

            if (causeMsg.contains("Wrong user name or password")) {
                String errorMsg = String.format("Failed to connect to H2 database '%s': Wrong username/password. URL=%s, User=%s",
                    name, jdbcUrl, username.isEmpty() ? "(empty)" : username);
                log.error(errorMsg);
                throw new RuntimeException(errorMsg, e);
            }

            String errorMsg = String.format("Failed to initialize H2 database '%s': %s. Database: %s. Error: %s",
                name, cause.getClass().getSimpleName(), jdbcUrl, causeMsg);
            log.error(errorMsg);
            throw new RuntimeException(errorMsg, e);
        }

        try (Connection conn = dataSource.getConnection()) {
            MetaAnalysisSchema.createIfNotExists(conn);
        } catch (SQLException e) {
            dataSource.close();
            throw new RuntimeException("Failed to create schema of H2 database '" + name + "': " + e.getMessage(), e);
        }
        log.info("H2 database '{}' ready at {}", name, jdbcUrl);
    }

    private static String getJdbcUrl(Config options) {
        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for H2MetaAnalysisDatabase.");
        }
        return options.getString("jdbcUrl");
    }

    // ========================================================================
    // Aggregation sessions and readers
    // ========================================================================

    @Override
    public IAggregationSession openSession() throws SQLException {
        Connection conn = dataSource.getConnection();
        try {
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return new H2AggregationSession(conn, ledgerCodec, clock);
    }

    @Override
    public IPooledResultReader createReader() throws SQLException {
        return new H2PooledResultReader(dataSource.getConnection(), ledgerCodec);
    }

    /**
     * Returns a pooled auto-commit connection for maintenance tasks such as loading reference data.
     * The caller must close it.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    // ========================================================================
    // IRunProvenanceLog Capability
    // ========================================================================

    @Override
    public void recordRun(FeatureRun run) throws SQLException {
        String sql = "MERGE INTO feature_run (" + H2Rows.RUN_COLUMNS + ") KEY (feature_run_id)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            int i = 1;
            stmt.setString(i++, run.featureRunId());
            stmt.setInt(i++, run.triggeredByStudyKey());
            H2Rows.setNullableInt(stmt, i++, run.diseaseKey());
            stmt.setString(i++, run.technology());
            H2Rows.setInstant(stmt, i++, run.startedAt());
            H2Rows.setInstant(stmt, i++, run.endedAt());
            stmt.setString(i++, run.status().name());
            stmt.setString(i++, run.finalState());
            stmt.setInt(i++, run.attempts());
            stmt.setInt(i++, run.pairsTouched());
            stmt.setInt(i++, run.contributionsApplied());
            stmt.setInt(i++, run.contributionsSkipped());
            stmt.setString(i++, run.errorCode());
            stmt.setString(i, truncate(run.errorMessage(), 4000));
            stmt.executeUpdate();
        }
    }

    @Override
    public void recordWarnings(List<ValidationWarning> warnings) throws SQLException {
        if (warnings.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO data_validation_log (feature_run_id, study_key, pair_id, metric_name,"
            + " validation_code, severity, details) VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (ValidationWarning warning : warnings) {
                    stmt.setString(1, warning.featureRunId());
                    stmt.setInt(2, warning.studyKey());
                    stmt.setString(3, warning.pairId());
                    stmt.setString(4, warning.metricName());
                    stmt.setString(5, warning.code().name());
                    stmt.setString(6, ValidationWarning.SEVERITY);
                    stmt.setString(7, truncate(warning.details(), 2000));
                    stmt.addBatch();
                }
                stmt.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                // Rollback to keep connection clean for pool reuse
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
                }
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        }
    }

    @Override
    public Optional<FeatureRun> findRun(String featureRunId) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT " + H2Rows.RUN_COLUMNS + " FROM feature_run WHERE feature_run_id = ?")) {
            stmt.setString(1, featureRunId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(H2Rows.readRun(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<ValidationWarning> findWarnings(String featureRunId) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT feature_run_id, study_key, pair_id, metric_name, validation_code, details"
                     + " FROM data_validation_log WHERE feature_run_id = ? ORDER BY validation_id")) {
            stmt.setString(1, featureRunId);
            List<ValidationWarning> warnings = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    warnings.add(new ValidationWarning(
                        rs.getString("feature_run_id"),
                        rs.getInt("study_key"),
                        rs.getString("pair_id"),
                        rs.getString("metric_name"),
                        ValidationCode.valueOf(rs.getString("validation_code")),
                        rs.getString("details")));
                }
            }
            return warnings;
        }
    }

    // ========================================================================
    // IPairReviewLog Capability
    // ========================================================================

    @Override
    public long appendReview(PairReview review) throws SQLException {
        String sql = "INSERT INTO pair_review (pair_key, feature_run_id, reviewer, verdict, review_comment, created_at)"
            + " VALUES (?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setLong(1, review.pairKey());
            stmt.setString(2, review.featureRunId());
            stmt.setString(3, review.reviewer());
            stmt.setString(4, review.verdict().name());
            stmt.setString(5, review.comment());
            H2Rows.setInstant(stmt, 6, review.createdAt() != null ? review.createdAt() : clock.instant());
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No review id generated for pair " + review.pairKey());
                }
                return keys.getLong(1);
            }
        }
    }

    @Override
    public List<PairReview> findReviews(long pairKey) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT review_id, pair_key, feature_run_id, reviewer, verdict, review_comment, created_at"
                     + " FROM pair_review WHERE pair_key = ? ORDER BY review_id")) {
            stmt.setLong(1, pairKey);
            List<PairReview> reviews = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    reviews.add(new PairReview(
                        rs.getLong("review_id"),
                        rs.getLong("pair_key"),
                        rs.getString("feature_run_id"),
                        rs.getString("reviewer"),
                        ReviewVerdict.valueOf(rs.getString("verdict")),
                        rs.getString("review_comment"),
                        H2Rows.getInstant(rs, "created_at")));
                }
            }
            return reviews;
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    public String getName() {
        return name;
    }

    /**
     * Shuts the database down and closes the pool.
     * <p>
     * A SQL {@code SHUTDOWN} is issued first so the H2 MVStore flushes all pending writes before
     * the pool releases its connections.
     */
    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            try (Connection conn = dataSource.getConnection();
                 Statement stmt = conn.createStatement()) {
                stmt.execute("SHUTDOWN");
                log.debug("H2 database '{}' shutdown command executed", name);
            } catch (SQLException e) {
                // H2 error code 90121 = "Database is already closed"
                if (e.getErrorCode() == 90121) {
                    log.debug("H2 database '{}' already closed (in-memory or auto-closed)", name);
                } else {
                    log.warn("H2 database '{}' shutdown command failed: {}", name, e.getMessage());
                }
            }
            dataSource.close();
            log.debug("H2 database '{}' connection pool closed", name);
        }
    }

    /**
     * Creates the parent directory of a file-based database so H2 does not fail with a stack trace
     * on a missing directory.
     */
    private static void validateDatabasePath(String name, String jdbcUrl) {
        if (!jdbcUrl.startsWith("jdbc:h2:")) {
            return;
        }
        String dbPath = jdbcUrl.substring(8);
        if (dbPath.startsWith("mem:")) {
            return;
        }
        if (dbPath.startsWith("file:")) {
            dbPath = dbPath.substring(5);
        }
        if (dbPath.startsWith("~")) {
            dbPath = System.getProperty("user.home") + dbPath.substring(1);
        }
        int semicolonIndex = dbPath.indexOf(';');
        if (semicolonIndex > 0) {
            dbPath = dbPath.substring(0, semicolonIndex);
        }
        File parentDir = new File(dbPath).getParentFile();
        if (parentDir != null && !parentDir.exists() && !parentDir.mkdirs()) {
            throw new RuntimeException(String.format(
                "Cannot create H2 database '%s': failed to create directory structure: %s",
                name, parentDir.getAbsolutePath()));
        }
    }
}
