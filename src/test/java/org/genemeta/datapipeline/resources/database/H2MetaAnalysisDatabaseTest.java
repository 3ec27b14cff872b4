package org.genemeta.datapipeline.resources.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.Connection;
import java.sql.SQLTransientException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.genemeta.datapipeline.MetaAnalysisTestData;
import org.genemeta.datapipeline.api.resources.database.ConcurrentUpdateException;
import org.genemeta.datapipeline.api.resources.database.IAggregationSession;
import org.genemeta.datapipeline.api.resources.database.IPooledResultReader;
import org.genemeta.datapipeline.api.resources.database.dto.FeatureRun;
import org.genemeta.datapipeline.api.resources.database.dto.FeatureRunStatus;
import org.genemeta.datapipeline.api.resources.database.dto.LedgerEntry;
import org.genemeta.datapipeline.api.resources.database.dto.MetricKind;
import org.genemeta.datapipeline.api.resources.database.dto.PairReview;
import org.genemeta.datapipeline.api.resources.database.dto.ReviewVerdict;
import org.genemeta.datapipeline.api.resources.database.dto.StatisticsKey;
import org.genemeta.datapipeline.api.resources.database.dto.StudyDiseaseMapping;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics;
import org.genemeta.datapipeline.api.resources.database.dto.ValidationCode;
import org.genemeta.datapipeline.api.resources.database.dto.ValidationWarning;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Integration tests of the H2 store: pair identity, optimistic row versions, provenance and reviews.
 */
@Tag("integration")
class H2MetaAnalysisDatabaseTest {

    private H2MetaAnalysisDatabase database;

    @BeforeEach
    void setUp() throws Exception {
        database = MetaAnalysisTestData.newDatabase("store");
        MetaAnalysisTestData.insertGene(database, 101, "IL6");
        MetaAnalysisTestData.insertGene(database, 205, "TNF");
        MetaAnalysisTestData.insertDisease(database, 1, "septic_shock", true);
        MetaAnalysisTestData.insertStudy(database, 12, "RNA_SEQ");
    }

    @AfterEach
    void tearDown() {
        if (database != null) {
            database.close();
        }
    }

    @Test
    void schemaCreationIsIdempotent() throws Exception {
        try (Connection conn = database.getConnection()) {
            MetaAnalysisSchema.createIfNotExists(conn);
        }
        assertThat(MetaAnalysisTestData.countRows(database, "gene")).isEqualTo(2);
    }

    @Nested
    @DisplayName("Gene pairs")
    class GenePairs {

        @Test
        void findOrCreatePairCreatesOneRowPerPair() throws Exception {
            long first;
            long second;
            try (IAggregationSession session = database.openSession()) {
                first = session.findOrCreatePair(101, 205);
                second = session.findOrCreatePair(101, 205);
                session.commit();
            }
            try (IAggregationSession session = database.openSession()) {
                assertThat(session.findOrCreatePair(101, 205)).isEqualTo(first);
            }

            assertThat(second).isEqualTo(first);
            assertThat(MetaAnalysisTestData.countRows(database, "gene_pair")).isEqualTo(1);
        }

        @Test
        void rejectsNonCanonicalOrder() throws Exception {
            try (IAggregationSession session = database.openSession()) {
                assertThatThrownBy(() -> session.findOrCreatePair(205, 101))
                    .isInstanceOf(IllegalArgumentException.class);
            }
        }

        @Test
        void uncommittedPairIsRolledBackOnClose() throws Exception {
            try (IAggregationSession session = database.openSession()) {
                session.findOrCreatePair(101, 205);
            }
            assertThat(MetaAnalysisTestData.countRows(database, "gene_pair")).isZero();
        }
    }

    @Nested
    @DisplayName("Sufficient statistics")
    class Statistics {

        private StatisticsKey key;

        @BeforeEach
        void createPair() throws Exception {
            try (IAggregationSession session = database.openSession()) {
                key = new StatisticsKey(session.findOrCreatePair(101, 205), 1, "RNA_SEQ", "shock_vs_sepsis_d");
                session.commit();
            }
        }

        private SufficientStatistics saveInitialRow() throws Exception {
            try (IAggregationSession session = database.openSession()) {
                SufficientStatistics stats = SufficientStatistics.empty(key, MetricKind.EFFECT_SIZE);
                stats.apply(new LedgerEntry(12, 25.0, 0.42, 0.2, 80, "run-1"));
                stats.apply(new LedgerEntry(13, 100.0, 0.30, 0.1, null, "run-2"));
                session.saveStatistics(stats);
                session.commit();
                return stats;
            }
        }

        @Test
        void savedRowRoundTripsWithLedger() throws Exception {
            SufficientStatistics saved = saveInitialRow();
            assertThat(saved.getRowVersion()).isEqualTo(1L);

            try (IAggregationSession session = database.openSession()) {
                SufficientStatistics loaded = session.loadStatistics(key).orElseThrow();
                assertThat(loaded.getRowVersion()).isEqualTo(1L);
                assertThat(loaded.getMetricKind()).isEqualTo(MetricKind.EFFECT_SIZE);
                assertThat(loaded.getStudyCount()).isEqualTo(2);
                assertThat(loaded.getSumW()).isEqualTo(saved.getSumW());
                assertThat(loaded.getSumWTheta2()).isEqualTo(saved.getSumWTheta2());
                assertThat(loaded.getLedger()).isEqualTo(saved.getLedger());
            }
        }

        @Test
        void updateIncrementsRowVersion() throws Exception {
            saveInitialRow();
            try (IAggregationSession session = database.openSession()) {
                SufficientStatistics loaded = session.loadStatistics(key).orElseThrow();
                loaded.apply(new LedgerEntry(12, 16.0, 0.5, 0.25, 80, "run-3"));
                session.saveStatistics(loaded);
                session.commit();
                assertThat(loaded.getRowVersion()).isEqualTo(2L);
            }
            try (IPooledResultReader reader = database.createReader()) {
                assertThat(reader.readStatistics(key).orElseThrow().getLedger())
                    .extracting(LedgerEntry::theta).containsExactly(0.5, 0.30);
            }
        }

        @Test
        @DisplayName("A stale row version raises a transient ConcurrentUpdateException")
        void staleVersionConflicts() throws Exception {
            saveInitialRow();
            try (IAggregationSession first = database.openSession();
                 IAggregationSession second = database.openSession()) {
                SufficientStatistics a = first.loadStatistics(key).orElseThrow();
                SufficientStatistics b = second.loadStatistics(key).orElseThrow();

                a.apply(new LedgerEntry(14, 4.0, 0.1, 0.5, null, "run-a"));
                first.saveStatistics(a);
                first.commit();

                b.apply(new LedgerEntry(15, 4.0, 0.2, 0.5, null, "run-b"));
                assertThatThrownBy(() -> second.saveStatistics(b))
                    .isInstanceOf(ConcurrentUpdateException.class)
                    .isInstanceOf(SQLTransientException.class);
            }
        }

        @Test
        void concurrentFirstInsertConflicts() throws Exception {
            try (IAggregationSession first = database.openSession();
                 IAggregationSession second = database.openSession()) {
                SufficientStatistics a = SufficientStatistics.empty(key, MetricKind.EFFECT_SIZE);
                a.apply(new LedgerEntry(12, 25.0, 0.42, 0.2, 80, "run-a"));
                first.saveStatistics(a);
                first.commit();

                SufficientStatistics b = SufficientStatistics.empty(key, MetricKind.EFFECT_SIZE);
                b.apply(new LedgerEntry(13, 25.0, 0.40, 0.2, 80, "run-b"));
                assertThatThrownBy(() -> second.saveStatistics(b)).isInstanceOf(ConcurrentUpdateException.class);
            }
        }
    }

    @Nested
    @DisplayName("Study to disease mappings")
    class Mappings {

        @Test
        void returnsOnlyMappingsEffectiveAtInstant() throws Exception {
            Instant now = MetaAnalysisTestData.NOW;
            MetaAnalysisTestData.insertDisease(database, 2, "sepsis", true);
            MetaAnalysisTestData.insertMapping(database, 12, 1, true, now.minusSeconds(3600), null);
            MetaAnalysisTestData.insertMapping(database, 12, 2, true, now.minusSeconds(7200), now.minusSeconds(3600));
            MetaAnalysisTestData.insertMapping(database, 12, 2, false, now.minusSeconds(7200), null);
            MetaAnalysisTestData.insertMapping(database, 12, 2, true, now.plusSeconds(3600), null);

            try (IAggregationSession session = database.openSession()) {
                List<StudyDiseaseMapping> mappings = session.findActiveDiseaseMappings(12, now);
                assertThat(mappings).extracting(StudyDiseaseMapping::diseaseKey).containsExactly(1);
                assertThat(session.findStudy(12).orElseThrow().technology()).isEqualTo("RNA_SEQ");
                assertThat(session.findStudy(99)).isEmpty();
            }
        }
    }

    @Nested
    @DisplayName("Provenance and reviews")
    class Provenance {

        @Test
        void recordRunUpsertsByRunId() throws Exception {
            Instant start = MetaAnalysisTestData.NOW;
            database.recordRun(FeatureRun.started("run-1", 12, start));
            database.recordRun(new FeatureRun("run-1", 12, 1, "RNA_SEQ", start, start.plusSeconds(2),
                FeatureRunStatus.SUCCESS, "COMMITTED", 1, 3, 4, 1, null, null));

            FeatureRun run = database.findRun("run-1").orElseThrow();
            assertThat(run.status()).isEqualTo(FeatureRunStatus.SUCCESS);
            assertThat(run.diseaseKey()).isEqualTo(1);
            assertThat(run.endedAt()).isEqualTo(start.plusSeconds(2));
            assertThat(MetaAnalysisTestData.countRows(database, "feature_run")).isEqualTo(1);
            assertThat(database.findRun("missing")).isEmpty();
        }

        @Test
        void warningsAreStoredPerRun() throws Exception {
            database.recordRun(FeatureRun.started("run-1", 12, MetaAnalysisTestData.NOW));
            database.recordWarnings(List.of(
                new ValidationWarning("run-1", 12, "101_205", "shock_vs_sepsis_d",
                    ValidationCode.NON_POSITIVE_STANDARD_ERROR, "standard_error=0.0"),
                new ValidationWarning("run-1", 12, "101_205", "coexpr_spearman",
                    ValidationCode.CORRELATION_SAMPLE_TOO_SMALL, "n=3 below minimum 4")));

            assertThat(database.findWarnings("run-1")).extracting(ValidationWarning::code).containsExactly(
                ValidationCode.NON_POSITIVE_STANDARD_ERROR, ValidationCode.CORRELATION_SAMPLE_TOO_SMALL);
            assertThat(database.findWarnings("run-2")).isEmpty();
        }

        @Test
        void reviewsAreAppendOnly() throws Exception {
            long pairKey;
            try (IAggregationSession session = database.openSession()) {
                pairKey = session.findOrCreatePair(101, 205);
                session.commit();
            }
            database.recordRun(FeatureRun.started("run-1", 12, MetaAnalysisTestData.NOW));

            long firstId = database.appendReview(new PairReview(0L, pairKey, "run-1", "alice",
                ReviewVerdict.NEEDS_FOLLOWUP, null, MetaAnalysisTestData.NOW));
            long secondId = database.appendReview(new PairReview(0L, pairKey, "run-1", "bob",
                ReviewVerdict.CONFIRMED, "validated by qPCR", MetaAnalysisTestData.NOW.plusSeconds(60)));

            assertThat(secondId).isGreaterThan(firstId);
            List<PairReview> reviews = database.findReviews(pairKey);
            assertThat(reviews).extracting(PairReview::verdict)
                .containsExactly(ReviewVerdict.NEEDS_FOLLOWUP, ReviewVerdict.CONFIRMED);
            assertThat(reviews.get(1).comment()).isEqualTo("validated by qPCR");
            assertThat(Optional.ofNullable(reviews.get(0).comment())).isEmpty();
        }
    }
}
