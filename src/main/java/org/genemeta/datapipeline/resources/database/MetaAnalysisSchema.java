package org.genemeta.datapipeline.resources.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import org.genemeta.datapipeline.api.resources.database.dto.PairReview;

/**
 * DDL of the meta-analysis store.
 * <p>
 * {@code gene}, {@code disease}, {@code study} and {@code study_disease_mapping} are reference
 * tables owned upstream; they are created here so an empty database is usable, but the engine
 * only reads them. All statements are idempotent.
 */
final class MetaAnalysisSchema {

    private static final List<String> DDL = List.of(
        "CREATE TABLE IF NOT EXISTS gene ("
            + " gene_key INT PRIMARY KEY,"
            + " gene_id VARCHAR(64) NOT NULL,"
            + " gene_symbol VARCHAR(64))",

        "CREATE TABLE IF NOT EXISTS disease ("
            + " disease_key INT PRIMARY KEY,"
            + " disease_label VARCHAR(255) NOT NULL,"
            + " is_active BOOLEAN DEFAULT TRUE NOT NULL,"
            + " CONSTRAINT uq_disease_label UNIQUE (disease_label))",

        "CREATE TABLE IF NOT EXISTS study ("
            + " study_key INT PRIMARY KEY,"
            + " accession VARCHAR(64) NOT NULL,"
            + " technology VARCHAR(64) NOT NULL)",

        "CREATE TABLE IF NOT EXISTS study_disease_mapping ("
            + " mapping_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
            + " study_key INT NOT NULL REFERENCES study (study_key),"
            + " disease_key INT NOT NULL REFERENCES disease (disease_key),"
            + " is_active BOOLEAN DEFAULT TRUE NOT NULL,"
            + " effective_from TIMESTAMP WITH TIME ZONE NOT NULL,"
            + " effective_to TIMESTAMP WITH TIME ZONE)",

        "CREATE INDEX IF NOT EXISTS idx_study_disease_mapping_study ON study_disease_mapping (study_key)",

        "CREATE TABLE IF NOT EXISTS gene_pair ("
            + " pair_key BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
            + " gene_a_key INT NOT NULL REFERENCES gene (gene_key),"
            + " gene_b_key INT NOT NULL REFERENCES gene (gene_key),"
            + " CONSTRAINT uq_gene_pair UNIQUE (gene_a_key, gene_b_key),"
            + " CONSTRAINT ck_gene_pair_order CHECK (gene_a_key < gene_b_key))",

        "CREATE TABLE IF NOT EXISTS sufficient_statistics ("
            + " pair_key BIGINT NOT NULL REFERENCES gene_pair (pair_key),"
            + " disease_key INT NOT NULL,"
            + " technology VARCHAR(64) NOT NULL,"
            + " metric_name VARCHAR(128) NOT NULL,"
            + " metric_kind VARCHAR(16) NOT NULL,"
            + " sum_w DOUBLE PRECISION NOT NULL,"
            + " sum_w2 DOUBLE PRECISION NOT NULL,"
            + " sum_w_theta DOUBLE PRECISION NOT NULL,"
            + " sum_w_theta2 DOUBLE PRECISION NOT NULL,"
            + " study_count INT NOT NULL,"
            + " ledger_json CLOB NOT NULL,"
            + " row_version BIGINT NOT NULL,"
            + " updated_at TIMESTAMP WITH TIME ZONE NOT NULL,"
            + " PRIMARY KEY (pair_key, disease_key, technology, metric_name))",

        "CREATE TABLE IF NOT EXISTS pooled_metric_result ("
            + " pair_key BIGINT NOT NULL REFERENCES gene_pair (pair_key),"
            + " disease_key INT NOT NULL,"
            + " technology VARCHAR(64) NOT NULL,"
            + " metric_name VARCHAR(128) NOT NULL,"
            + " metric_kind VARCHAR(16) NOT NULL,"
            + " theta_pooled DOUBLE PRECISION NOT NULL,"
            + " theta_fixed DOUBLE PRECISION NOT NULL,"
            + " se_pooled DOUBLE PRECISION NOT NULL,"
            + " ci_lower DOUBLE PRECISION NOT NULL,"
            + " ci_upper DOUBLE PRECISION NOT NULL,"
            + " tau2 DOUBLE PRECISION NOT NULL,"
            + " cochran_q DOUBLE PRECISION NOT NULL,"
            + " i2 DOUBLE PRECISION,"
            + " z_value DOUBLE PRECISION NOT NULL,"
            + " p_value DOUBLE PRECISION NOT NULL,"
            + " included_study_count INT NOT NULL,"
            + " total_samples BIGINT,"
            + " feature_run_id VARCHAR(36) NOT NULL,"
            + " updated_at TIMESTAMP WITH TIME ZONE NOT NULL,"
            + " PRIMARY KEY (pair_key, disease_key, technology, metric_name))",

        "CREATE INDEX IF NOT EXISTS idx_pooled_slice ON pooled_metric_result (disease_key, technology)",

        "CREATE TABLE IF NOT EXISTS feature_run ("
            + " feature_run_id VARCHAR(36) PRIMARY KEY,"
            + " triggered_by_study_key INT NOT NULL,"
            + " disease_key INT,"
            + " technology VARCHAR(64),"
            + " started_at TIMESTAMP WITH TIME ZONE NOT NULL,"
            + " ended_at TIMESTAMP WITH TIME ZONE,"
            + " status VARCHAR(16) NOT NULL,"
            + " final_state VARCHAR(32) NOT NULL,"
            + " attempts INT NOT NULL,"
            + " pairs_touched INT NOT NULL,"
            + " contributions_applied INT NOT NULL,"
            + " contributions_skipped INT NOT NULL,"
            + " error_code VARCHAR(64),"
            + " error_message VARCHAR(4000))",

        "CREATE TABLE IF NOT EXISTS data_validation_log ("
            + " validation_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
            + " feature_run_id VARCHAR(36) NOT NULL,"
            + " study_key INT NOT NULL,"
            + " pair_id VARCHAR(64),"
            + " metric_name VARCHAR(128),"
            + " validation_code VARCHAR(64) NOT NULL,"
            + " severity VARCHAR(16) NOT NULL,"
            + " details VARCHAR(2000))",

        "CREATE INDEX IF NOT EXISTS idx_validation_run ON data_validation_log (feature_run_id)",

        "CREATE TABLE IF NOT EXISTS pair_review ("
            + " review_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
            + " pair_key BIGINT NOT NULL REFERENCES gene_pair (pair_key),"
            + " feature_run_id VARCHAR(36) NOT NULL REFERENCES feature_run (feature_run_id),"
            + " reviewer VARCHAR(" + PairReview.MAX_REVIEWER_LENGTH + ") NOT NULL,"
            + " verdict VARCHAR(32) NOT NULL,"
            + " review_comment VARCHAR(" + PairReview.MAX_COMMENT_LENGTH + "),"
            + " created_at TIMESTAMP WITH TIME ZONE NOT NULL)"
    );

    private MetaAnalysisSchema() {
    }

    /**
     * Creates all tables and indexes that do not exist yet and commits.
     */
    static void createIfNotExists(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String ddl : DDL) {
                stmt.execute(ddl);
            }
        }
        if (!conn.getAutoCommit()) {
            conn.commit();
        }
    }
}
