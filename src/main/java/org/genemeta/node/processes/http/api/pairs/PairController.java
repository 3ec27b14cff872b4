package org.genemeta.node.processes.http.api.pairs;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.genemeta.datapipeline.api.resources.database.IPairReviewLog;
import org.genemeta.datapipeline.api.resources.database.IPooledResultReader;
import org.genemeta.datapipeline.api.resources.database.IPooledResultReaderProvider;
import org.genemeta.datapipeline.api.resources.database.IRunProvenanceLog;
import org.genemeta.datapipeline.api.resources.database.dto.AnnotatedPooledResult;
import org.genemeta.datapipeline.api.resources.database.dto.DiseaseInfo;
import org.genemeta.datapipeline.api.resources.database.dto.GenePair;
import org.genemeta.datapipeline.api.resources.database.dto.PairReview;
import org.genemeta.datapipeline.api.resources.database.dto.ReviewVerdict;
import org.genemeta.datapipeline.services.ranking.DiseaseNotFoundException;
import org.genemeta.datapipeline.services.ranking.PairRankingService;
import org.genemeta.datapipeline.services.ranking.RankedPair;
import org.genemeta.datapipeline.services.ranking.RankingCriteria;
import org.genemeta.node.processes.http.api.AbstractApiController;
import org.genemeta.node.processes.http.api.pairs.dto.PairMetricsResponseDto;
import org.genemeta.node.processes.http.api.pairs.dto.PooledMetricDto;
import org.genemeta.node.processes.http.api.pairs.dto.RankedPairDto;
import org.genemeta.node.processes.http.api.pairs.dto.ReviewRequestDto;
import org.genemeta.node.processes.http.api.pairs.dto.ReviewResponseDto;
import org.genemeta.node.processes.http.api.pairs.dto.TopPairsResponseDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;

/**
 * HTTP controller for ranked gene pairs and reviewer verdicts.
 * <p>
 * Routes (relative to the base path):
 * <ul>
 *   <li>{@code GET /pairs/top?disease=&technology=&q=&k_min=&i2_max=&limit=}: ranked, filtered pairs
 *       of one slice. Missing thresholds fall back to the configured defaults.</li>
 *   <li>{@code GET /pairs/{pair_key}/metrics?disease=&technology=}: the pooled rows of one pair.</li>
 *   <li>{@code POST /pairs/{pair_key}/review}: appends a reviewer verdict for a pair and run.</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe; readers are created per request.
 */
public class PairController extends AbstractApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(PairController.class);

    private final IPooledResultReaderProvider readers;
    private final IRunProvenanceLog provenance;
    private final IPairReviewLog reviews;
    private final PairRankingService rankingService;
    private final RankingCriteria defaults;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Creates the controller.
     *
     * @param readers    Pooled fact readers.
     * @param provenance Run provenance, used to validate review run ids.
     * @param reviews    Review log.
     * @param options    The {@code genemeta.ranking} block (thresholds, weighting, cache).
     * @param clock      Clock stamping reviews.
     */
    public PairController(final IPooledResultReaderProvider readers,
                          final IRunProvenanceLog provenance,
                          final IPairReviewLog reviews,
                          final Config options,
                          final Clock clock) {
        this(readers, provenance, reviews, new PairRankingService(readers, options), options, clock);
    }

    /**
     * Creates the controller on a shared ranking service, e.g. one evicted by the orchestrator.
     */
    public PairController(final IPooledResultReaderProvider readers,
                          final IRunProvenanceLog provenance,
                          final IPairReviewLog reviews,
                          final PairRankingService rankingService,
                          final Config options,
                          final Clock clock) {
        super(options);
        this.readers = readers;
        this.provenance = provenance;
        this.reviews = reviews;
        this.rankingService = rankingService;
        this.defaults = RankingCriteria.fromConfig(options);
        this.clock = clock;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String topPath = path(basePath, "/pairs/top");
        final String metricsPath = path(basePath, "/pairs/{pair_key}/metrics");
        final String reviewPath = path(basePath, "/pairs/{pair_key}/review");

        LOGGER.debug("Registering pair endpoints: top={}, metrics={}, review={}", topPath, metricsPath, reviewPath);

        app.get(topPath, this::getTopPairs);
        app.get(metricsPath, this::getPairMetrics);
        app.post(reviewPath, this::postReview);

        setupExceptionHandlers(app);
    }

    /**
     * Handles {@code GET /pairs/top}.
     */
    void getTopPairs(final Context ctx) throws SQLException, DiseaseNotFoundException {
        final String disease = requireQueryParam(ctx, "disease");
        final String technology = requireQueryParam(ctx, "technology");
        final RankingCriteria criteria = parseCriteria(ctx);

        LOGGER.debug("Ranking pairs: disease={}, technology={}, criteria={}", disease, technology, criteria);
        final PairRankingService.TopPairs top = rankingService.topPairs(disease, technology, criteria);

        final List<RankedPairDto> pairs = new ArrayList<>(top.pairs().size());
        int rank = 1;
        for (final RankedPair pair : top.pairs()) {
            pairs.add(RankedPairDto.from(rank++, pair));
        }
        final DiseaseInfo info = top.disease();
        ctx.status(HttpStatus.OK).json(new TopPairsResponseDto(info.label(), info.diseaseKey(), technology,
            criteria.qThreshold(), criteria.kMin(), criteria.i2Max(), criteria.limit(), top.scoredPairs(), pairs));
    }

    /**
     * Builds criteria from the query string on top of the configured defaults.
     *
     * @throws BadRequestException on malformed or out-of-range values.
     */
    RankingCriteria parseCriteria(final Context ctx) {
        try {
            return applyQueryParams(ctx, defaults);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage());
        }
    }

    private static RankingCriteria applyQueryParams(final Context ctx, final RankingCriteria defaults) {
        RankingCriteria criteria = defaults;
        final String q = ctx.queryParam("q");
        if (q != null) {
            criteria = criteria.withQThreshold(parseDouble("q", q));
        }
        final String kMin = ctx.queryParam("k_min");
        if (kMin != null) {
            criteria = criteria.withKMin(parseInt("k_min", kMin));
        }
        final String i2Max = ctx.queryParam("i2_max");
        if (i2Max != null) {
            criteria = criteria.withI2Max(parseDouble("i2_max", i2Max));
        }
        final String limit = ctx.queryParam("limit");
        if (limit != null) {
            criteria = criteria.withLimit(parseInt("limit", limit));
        }
        return criteria;
    }

    /**
     * Handles {@code GET /pairs/{pair_key}/metrics}.
     */
    void getPairMetrics(final Context ctx) throws SQLException, DiseaseNotFoundException {
        final long pairKey = parseLong("pair_key", ctx.pathParam("pair_key"));
        final String diseaseLabel = ctx.queryParam("disease");
        final String technology = ctx.queryParam("technology");

        try (IPooledResultReader reader = readers.createReader()) {
            final GenePair pair = reader.findPair(pairKey)
                .orElseThrow(() -> new NotFoundException("Unknown pair " + pairKey));
            Integer diseaseKey = null;
            if (diseaseLabel != null && !diseaseLabel.isBlank()) {
                diseaseKey = reader.findDiseaseByLabel(diseaseLabel.trim())
                    .orElseThrow(() -> new DiseaseNotFoundException(diseaseLabel))
                    .diseaseKey();
            }
            final List<AnnotatedPooledResult> rows = reader.readPair(pairKey, diseaseKey,
                technology != null && !technology.isBlank() ? technology.trim() : null);
            final String symbolA = rows.isEmpty() ? null : rows.get(0).geneASymbol();
            final String symbolB = rows.isEmpty() ? null : rows.get(0).geneBSymbol();
            ctx.status(HttpStatus.OK).json(new PairMetricsResponseDto(pair.pairKey(), pair.pairId(), symbolA, symbolB,
                rows.stream().map(PooledMetricDto::from).collect(Collectors.toList())));
        }
    }

    /**
     * Handles {@code POST /pairs/{pair_key}/review}.
     * <p>
     * Body: {@code {"feature_run_id": "...", "reviewer": "...", "verdict": "CONFIRMED", "comment": "..."}}.
     * Responds 201 with the stored review.
     */
    void postReview(final Context ctx) throws SQLException {
        final long pairKey = parseLong("pair_key", ctx.pathParam("pair_key"));
        final ReviewRequestDto request = parseReviewRequest(ctx.body());

        if (request.featureRunId() == null || request.featureRunId().isBlank()) {
            throw new BadRequestException("'feature_run_id' is required");
        }
        if (request.reviewer() == null || request.reviewer().isBlank()) {
            throw new BadRequestException("'reviewer' is required");
        }
        final String reviewer = request.reviewer().trim();
        if (reviewer.length() > PairReview.MAX_REVIEWER_LENGTH) {
            throw new BadRequestException("'reviewer' must be at most " + PairReview.MAX_REVIEWER_LENGTH
                + " characters, got " + reviewer.length());
        }
        if (request.comment() != null && request.comment().length() > PairReview.MAX_COMMENT_LENGTH) {
            throw new BadRequestException("'comment' must be at most " + PairReview.MAX_COMMENT_LENGTH
                + " characters, got " + request.comment().length());
        }
        final ReviewVerdict verdict = parseVerdict(request.verdict());

        try (IPooledResultReader reader = readers.createReader()) {
            if (reader.findPair(pairKey).isEmpty()) {
                throw new NotFoundException("Unknown pair " + pairKey);
            }
        }
        if (provenance.findRun(request.featureRunId()).isEmpty()) {
            throw new NotFoundException("Unknown feature run " + request.featureRunId());
        }

        final Instant createdAt = clock.instant();
        final PairReview review = new PairReview(0L, pairKey, request.featureRunId(), reviewer,
            verdict, request.comment(), createdAt);
        final long reviewId = reviews.appendReview(review);
        LOGGER.info("Review {} stored for pair {} (run {}): {} by {}", reviewId, pairKey, request.featureRunId(),
            verdict, review.reviewer());

        ctx.status(HttpStatus.CREATED).json(new ReviewResponseDto(reviewId, pairKey, review.featureRunId(),
            review.reviewer(), verdict.name(), review.comment(), createdAt.toString()));
    }

    private ReviewRequestDto parseReviewRequest(final String body) {
        if (body == null || body.isBlank()) {
            throw new BadRequestException("Request body is required");
        }
        try {
            final ReviewRequestDto request = objectMapper.readValue(body, ReviewRequestDto.class);
            if (request == null) {
                throw new BadRequestException("Request body must be a JSON object");
            }
            return request;
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Malformed request body: " + e.getOriginalMessage());
        }
    }

    private static ReviewVerdict parseVerdict(final String value) {
        if (value == null || value.isBlank()) {
            throw new BadRequestException("'verdict' is required");
        }
        try {
            return ReviewVerdict.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Unknown verdict '" + value + "', expected one of CONFIRMED, REJECTED, NEEDS_FOLLOWUP");
        }
    }
}
