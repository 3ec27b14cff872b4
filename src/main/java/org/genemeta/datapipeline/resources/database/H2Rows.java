package org.genemeta.datapipeline.resources.database;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.genemeta.datapipeline.api.resources.database.dto.FeatureRun;
import org.genemeta.datapipeline.api.resources.database.dto.FeatureRunStatus;
import org.genemeta.datapipeline.api.resources.database.dto.MetricKind;
import org.genemeta.datapipeline.api.resources.database.dto.PooledMetricResult;
import org.genemeta.datapipeline.api.resources.database.dto.StatisticsKey;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics;

/**
 * Row mapping shared by the session, the reader and the database resource.
 */
final class H2Rows {

    static final String STATISTICS_COLUMNS =
        "metric_kind, sum_w, sum_w2, sum_w_theta, sum_w_theta2, study_count, ledger_json, row_version";

    static final String POOLED_COLUMNS =
        "r.pair_key, r.disease_key, r.technology, r.metric_name, r.metric_kind, r.theta_pooled, r.theta_fixed,"
            + " r.se_pooled, r.ci_lower, r.ci_upper, r.tau2, r.cochran_q, r.i2, r.z_value, r.p_value,"
            + " r.included_study_count, r.total_samples, r.feature_run_id, r.updated_at";

    static final String RUN_COLUMNS =
        "feature_run_id, triggered_by_study_key, disease_key, technology, started_at, ended_at, status,"
            + " final_state, attempts, pairs_touched, contributions_applied, contributions_skipped,"
            + " error_code, error_message";

    /** SQLSTATE of a unique or primary key violation. */
    static final String DUPLICATE_KEY_STATE = "23505";

    private H2Rows() {
    }

    static SufficientStatistics readStatistics(ResultSet rs, StatisticsKey key, LedgerJsonCodec codec)
            throws SQLException {
        try {
            return SufficientStatistics.restore(
                key,
                MetricKind.valueOf(rs.getString("metric_kind")),
                rs.getDouble("sum_w"),
                rs.getDouble("sum_w2"),
                rs.getDouble("sum_w_theta"),
                rs.getDouble("sum_w_theta2"),
                rs.getInt("study_count"),
                codec.fromJson(rs.getString("ledger_json")),
                rs.getLong("row_version"));
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new SQLException("Corrupted sufficient statistics row " + key + ": " + e.getMessage(), e);
        }
    }

    static PooledMetricResult readPooled(ResultSet rs) throws SQLException {
        StatisticsKey key = new StatisticsKey(
            rs.getLong("pair_key"),
            rs.getInt("disease_key"),
            rs.getString("technology"),
            rs.getString("metric_name"));
        return new PooledMetricResult(
            key,
            MetricKind.valueOf(rs.getString("metric_kind")),
            rs.getDouble("theta_pooled"),
            rs.getDouble("theta_fixed"),
            rs.getDouble("se_pooled"),
            rs.getDouble("ci_lower"),
            rs.getDouble("ci_upper"),
            rs.getDouble("tau2"),
            rs.getDouble("cochran_q"),
            getNullableDouble(rs, "i2"),
            rs.getDouble("z_value"),
            rs.getDouble("p_value"),
            rs.getInt("included_study_count"),
            getNullableLong(rs, "total_samples"),
            rs.getString("feature_run_id"),
            getInstant(rs, "updated_at"));
    }

    static FeatureRun readRun(ResultSet rs) throws SQLException {
        return new FeatureRun(
            rs.getString("feature_run_id"),
            rs.getInt("triggered_by_study_key"),
            getNullableInt(rs, "disease_key"),
            rs.getString("technology"),
            getInstant(rs, "started_at"),
            getInstant(rs, "ended_at"),
            FeatureRunStatus.valueOf(rs.getString("status")),
            rs.getString("final_state"),
            rs.getInt("attempts"),
            rs.getInt("pairs_touched"),
            rs.getInt("contributions_applied"),
            rs.getInt("contributions_skipped"),
            rs.getString("error_code"),
            rs.getString("error_message"));
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
        }
    }

    static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    static void setNullableDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.DOUBLE);
        } else {
            stmt.setDouble(index, value);
        }
    }

    static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BIGINT);
        } else {
            stmt.setLong(index, value);
        }
    }

    static void setNullableInt(PreparedStatement stmt, int index, Integer value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setInt(index, value);
        }
    }

    static boolean isDuplicateKey(SQLException e) {
        return DUPLICATE_KEY_STATE.equals(e.getSQLState());
    }
}
