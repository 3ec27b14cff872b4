package org.genemeta.node.processes.http.api.pairs;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.util.List;

import org.genemeta.datapipeline.MetaAnalysisTestData;
import org.genemeta.datapipeline.api.resources.database.IPooledResultReader;
import org.genemeta.datapipeline.api.resources.database.dto.AnnotatedPooledResult;
import org.genemeta.datapipeline.api.resources.database.dto.PairReview;
import org.genemeta.datapipeline.api.resources.database.dto.ReviewVerdict;
import org.genemeta.datapipeline.resources.database.H2MetaAnalysisDatabase;
import org.genemeta.datapipeline.services.AggregationOptions;
import org.genemeta.datapipeline.services.AggregationOrchestrator;
import org.genemeta.datapipeline.services.SliceLockRegistry;
import org.genemeta.datapipeline.services.ranking.PairRankingService;
import org.genemeta.datapipeline.services.ranking.RankingCriteria;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.typesafe.config.ConfigFactory;

import io.javalin.Javalin;
import io.restassured.http.ContentType;
import io.restassured.specification.RequestSpecification;

/**
 * Integration test of the pair endpoints.
 * <p>
 * Aggregates three studies into a real in-memory H2 store, then queries it over HTTP.
 */
@Tag("integration")
class PairControllerIntegrationTest {

    private H2MetaAnalysisDatabase database;
    private Javalin app;
    private String lastRunId;
    private long strongPairKey;

    @BeforeEach
    void setUp() throws Exception {
        database = MetaAnalysisTestData.newDatabase("pair-controller");
        MetaAnalysisTestData.seedSepticShockSlice(database);
        AggregationOrchestrator orchestrator = new AggregationOrchestrator(database, database,
            MetaAnalysisTestData.septicShockComponents(), new AggregationOptions(3, 1L, 2.0, 1000L, 4),
            new SliceLockRegistry(), MetaAnalysisTestData.fixedClock());
        for (int study : new int[]{12, 13, 14}) {
            lastRunId = orchestrator.run(study).featureRunId();
        }
        strongPairKey = pairKey("101_205");

        PairController controller = new PairController(database, database, database,
            ConfigFactory.parseString("cache.expire-after-write-seconds = 1"), MetaAnalysisTestData.fixedClock());
        app = Javalin.create(config -> config.showJavalinBanner = false);
        controller.registerRoutes(app, "/api");
        app.start(0);
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.stop();
        }
        if (database != null) {
            database.close();
        }
    }

    private RequestSpecification api() {
        return given().port(app.port()).basePath("/api");
    }

    private long pairKey(String pairId) throws SQLException {
        try (IPooledResultReader reader = database.createReader()) {
            return reader.readSlice(1, "RNA_SEQ").stream()
                .map(AnnotatedPooledResult::pair)
                .filter(pair -> pair.pairId().equals(pairId))
                .findFirst()
                .orElseThrow()
                .pairKey();
        }
    }

    @Nested
    @DisplayName("GET /pairs/top")
    class TopPairs {

        @Test
        void returnsRankedPairsPassingDefaultFilter() {
            api()
                .queryParam("disease", "septic_shock")
                .queryParam("technology", "RNA_SEQ")
            .when()
                .get("/pairs/top")
            .then()
                .statusCode(200)
                .contentType(ContentType.JSON)
                .body("disease", equalTo("septic_shock"))
                .body("disease_key", equalTo(1))
                .body("k_min", equalTo(3))
                .body("scored_pairs", equalTo(2))
                .body("pairs", hasSize(1))
                .body("pairs[0].rank", equalTo(1))
                .body("pairs[0].pair_id", equalTo("101_205"))
                .body("pairs[0].gene_a_symbol", equalTo("G101"))
                .body("pairs[0].gene_b_symbol", equalTo("G205"))
                .body("pairs[0].included_study_count", equalTo(3))
                .body("pairs[0].power_score", equalTo(5))
                .body("pairs[0].metrics", hasSize(2))
                .body("pairs[0].metrics[0].metric_name", equalTo("coexpr_spearman"));
        }

        @Test
        void looserThresholdsAdmitMorePairs() {
            api()
                .queryParam("disease", "SEPTIC_SHOCK")
                .queryParam("technology", "RNA_SEQ")
                .queryParam("q", "1")
                .queryParam("k_min", "1")
                .queryParam("i2_max", "100")
            .when()
                .get("/pairs/top")
            .then()
                .statusCode(200)
                .body("pairs", hasSize(2))
                .body("pairs[0].pair_id", equalTo("101_205"))
                .body("pairs[1].pair_id", equalTo("205_310"))
                .body("pairs[1].rank", equalTo(2));
        }

        @Test
        void limitTruncatesResult() {
            api()
                .queryParam("disease", "septic_shock")
                .queryParam("technology", "RNA_SEQ")
                .queryParam("q", "1")
                .queryParam("k_min", "1")
                .queryParam("i2_max", "100")
                .queryParam("limit", "1")
            .when()
                .get("/pairs/top")
            .then()
                .statusCode(200)
                .body("limit", equalTo(1))
                .body("pairs", hasSize(1));
        }

        @Test
        void unknownTechnologyGivesEmptyRanking() {
            api()
                .queryParam("disease", "septic_shock")
                .queryParam("technology", "MICROARRAY")
            .when()
                .get("/pairs/top")
            .then()
                .statusCode(200)
                .body("scored_pairs", equalTo(0))
                .body("pairs", hasSize(0));
        }

        @Test
        void unknownDiseaseIsNotFound() {
            api()
                .queryParam("disease", "influenza")
                .queryParam("technology", "RNA_SEQ")
            .when()
                .get("/pairs/top")
            .then()
                .statusCode(404)
                .body("status", equalTo(404))
                .body("message", containsString("influenza"));
        }

        @Test
        void missingDiseaseIsBadRequest() {
            api()
                .queryParam("technology", "RNA_SEQ")
            .when()
                .get("/pairs/top")
            .then()
                .statusCode(400)
                .body("message", containsString("disease"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"q=abc", "q=1.5", "k_min=0", "k_min=two", "i2_max=101", "limit=0", "limit=1001"})
        void malformedOrOutOfRangeParametersAreBadRequest(String parameter) {
            String[] parts = parameter.split("=");
            api()
                .queryParam("disease", "septic_shock")
                .queryParam("technology", "RNA_SEQ")
                .queryParam(parts[0], parts[1])
            .when()
                .get("/pairs/top")
            .then()
                .statusCode(400)
                .body("status", equalTo(400));
        }
    }

    @Nested
    @DisplayName("GET /pairs/{pair_key}/metrics")
    class PairMetrics {

        @Test
        void returnsPooledRowsOfPair() {
            api()
                .queryParam("disease", "septic_shock")
            .when()
                .get("/pairs/" + strongPairKey + "/metrics")
            .then()
                .statusCode(200)
                .body("pair_id", equalTo("101_205"))
                .body("metrics", hasSize(2))
                .body("metrics.metric_kind", containsInAnyOrder("EFFECT_SIZE", "CORRELATION"));
        }

        @Test
        void unknownPairIsNotFound() {
            api().when().get("/pairs/999999/metrics").then().statusCode(404);
        }

        @Test
        void nonNumericPairKeyIsBadRequest() {
            api().when().get("/pairs/abc/metrics").then().statusCode(400);
        }
    }

    @Nested
    @DisplayName("POST /pairs/{pair_key}/review")
    class Reviews {

        private String body(String runId, String reviewer, String verdict) {
            return "{\"feature_run_id\":\"" + runId + "\",\"reviewer\":\"" + reviewer
                + "\",\"verdict\":\"" + verdict + "\",\"comment\":\"matches literature\"}";
        }

        @Test
        void storesReviewAndAnswersCreated() throws Exception {
            api()
                .contentType(ContentType.JSON)
                .body(body(lastRunId, "curator-1", "confirmed"))
            .when()
                .post("/pairs/" + strongPairKey + "/review")
            .then()
                .statusCode(201)
                .body("review_id", greaterThan(0))
                .body("pair_key", equalTo((int) strongPairKey))
                .body("verdict", equalTo("CONFIRMED"))
                .body("created_at", equalTo("2026-03-01T12:00:00Z"));

            List<PairReview> stored = database.findReviews(strongPairKey);
            assertThat(stored).hasSize(1);
            assertThat(stored.get(0).verdict()).isEqualTo(ReviewVerdict.CONFIRMED);
            assertThat(stored.get(0).featureRunId()).isEqualTo(lastRunId);
        }

        @Test
        @DisplayName("A second verdict is appended, never replacing the first")
        void reviewsAreAppendOnly() throws Exception {
            api().contentType(ContentType.JSON).body(body(lastRunId, "curator-1", "CONFIRMED"))
                .post("/pairs/" + strongPairKey + "/review").then().statusCode(201);
            api().contentType(ContentType.JSON).body(body(lastRunId, "curator-2", "REJECTED"))
                .post("/pairs/" + strongPairKey + "/review").then().statusCode(201);

            assertThat(database.findReviews(strongPairKey))
                .extracting(PairReview::verdict)
                .containsExactly(ReviewVerdict.CONFIRMED, ReviewVerdict.REJECTED);
        }

        @Test
        void unknownRunIsNotFound() throws Exception {
            api().contentType(ContentType.JSON).body(body("no-such-run", "curator-1", "CONFIRMED"))
                .post("/pairs/" + strongPairKey + "/review")
                .then().statusCode(404).body("message", containsString("no-such-run"));
            assertThat(database.findReviews(strongPairKey)).isEmpty();
        }

        @Test
        void unknownPairIsNotFound() {
            api().contentType(ContentType.JSON).body(body(lastRunId, "curator-1", "CONFIRMED"))
                .post("/pairs/999999/review")
                .then().statusCode(404);
        }

        @Test
        void invalidVerdictIsBadRequest() {
            api().contentType(ContentType.JSON).body(body(lastRunId, "curator-1", "MAYBE"))
                .post("/pairs/" + strongPairKey + "/review")
                .then().statusCode(400).body("message", containsString("MAYBE"));
        }

        @Test
        void missingReviewerIsBadRequest() {
            api().contentType(ContentType.JSON)
                .body("{\"feature_run_id\":\"" + lastRunId + "\",\"verdict\":\"CONFIRMED\"}")
                .post("/pairs/" + strongPairKey + "/review")
                .then().statusCode(400).body("message", containsString("reviewer"));
        }

        @Test
        void malformedJsonIsBadRequest() {
            api().contentType(ContentType.JSON).body("{not json")
                .post("/pairs/" + strongPairKey + "/review")
                .then().statusCode(400);
        }

        @Test
        void reviewerAtColumnLimitIsStored() throws Exception {
            String reviewer = "r".repeat(PairReview.MAX_REVIEWER_LENGTH);
            api().contentType(ContentType.JSON).body(body(lastRunId, reviewer, "CONFIRMED"))
                .post("/pairs/" + strongPairKey + "/review")
                .then().statusCode(201);

            assertThat(database.findReviews(strongPairKey)).extracting(PairReview::reviewer).containsExactly(reviewer);
        }

        @Test
        void overlongReviewerIsBadRequest() throws Exception {
            api().contentType(ContentType.JSON)
                .body(body(lastRunId, "r".repeat(PairReview.MAX_REVIEWER_LENGTH + 1), "CONFIRMED"))
                .post("/pairs/" + strongPairKey + "/review")
                .then().statusCode(400).body("message", containsString("reviewer"));

            assertThat(database.findReviews(strongPairKey)).isEmpty();
        }

        @Test
        void overlongCommentIsBadRequest() throws Exception {
            api().contentType(ContentType.JSON)
                .body("{\"feature_run_id\":\"" + lastRunId + "\",\"reviewer\":\"curator-1\","
                    + "\"verdict\":\"CONFIRMED\",\"comment\":\"" + "c".repeat(PairReview.MAX_COMMENT_LENGTH + 1) + "\"}")
                .post("/pairs/" + strongPairKey + "/review")
                .then().statusCode(400).body("message", containsString("comment"));

            assertThat(database.findReviews(strongPairKey)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Error mapping")
    class ErrorMapping {

        private Javalin failingApp;

        @AfterEach
        void stopFailingApp() {
            if (failingApp != null) {
                failingApp.stop();
            }
        }

        @Test
        @DisplayName("An IllegalArgumentException from the ranking layer is a server error, not a client error")
        void internalIllegalArgumentIsServerError() throws Exception {
            PairRankingService ranking = mock(PairRankingService.class);
            when(ranking.topPairs(anyString(), anyString(), any(RankingCriteria.class)))
                .thenThrow(new IllegalArgumentException("p-value must lie in [0, 1], got NaN"));
            PairController controller = new PairController(database, database, database, ranking,
                ConfigFactory.empty(), MetaAnalysisTestData.fixedClock());
            failingApp = Javalin.create(config -> config.showJavalinBanner = false);
            controller.registerRoutes(failingApp, "/api");
            failingApp.start(0);

            given().port(failingApp.port()).basePath("/api")
                .queryParam("disease", "septic_shock")
                .queryParam("technology", "RNA_SEQ")
            .when()
                .get("/pairs/top")
            .then()
                .statusCode(500)
                .body("message", equalTo("Internal error"));
        }

        @Test
        void outOfRangeThresholdStillReportsItsReason() {
            api()
                .queryParam("disease", "septic_shock")
                .queryParam("technology", "RNA_SEQ")
                .queryParam("q", "1.5")
            .when()
                .get("/pairs/top")
            .then()
                .statusCode(400)
                .body("message", containsString("q must lie in [0, 1]"));
        }
    }
}
