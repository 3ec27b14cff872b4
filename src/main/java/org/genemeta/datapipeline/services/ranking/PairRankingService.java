package org.genemeta.datapipeline.services.ranking;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import org.genemeta.datapipeline.api.resources.database.IPooledResultReader;
import org.genemeta.datapipeline.api.resources.database.IPooledResultReaderProvider;
import org.genemeta.datapipeline.api.resources.database.dto.DiseaseInfo;
import org.genemeta.datapipeline.statistics.StoufferWeighting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.typesafe.config.Config;

/**
 * Answers top-pair queries for a disease label and technology.
 * <p>
 * Scored slices are kept in a short-lived Caffeine cache so repeated queries with different
 * thresholds do not re-read the fact table. Filtering is applied per query. A committed aggregation
 * run evicts its slice through {@link #invalidate(int, String)}; entries also expire after
 * {@code cache.expire-after-write-seconds}, which bounds staleness from writers in other processes.
 * Slices are loaded through the cache, so an eviction racing a load waits for it and discards
 * the result.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe.
 */
public class PairRankingService {

    private static final Logger log = LoggerFactory.getLogger(PairRankingService.class);

    /**
     * A ranked query result.
     *
     * @param disease     Resolved disease.
     * @param technology  Queried technology.
     * @param criteria    Applied criteria.
     * @param scoredPairs Number of pairs in the slice before filtering.
     * @param pairs       Ranked pairs passing the filter.
     */
    public record TopPairs(DiseaseInfo disease, String technology, RankingCriteria criteria, int scoredPairs,
                           List<RankedPair> pairs) {
    }

    private record SliceKey(int diseaseKey, String technology) {
    }

    private final IPooledResultReaderProvider readers;
    private final PairRankingView view;
    private final Cache<SliceKey, List<RankedPair>> scoredSlices;

    public PairRankingService(IPooledResultReaderProvider readers, Config options) {
        this.readers = readers;
        StoufferWeighting weighting = options.hasPath("stouffer-weighting")
            ? StoufferWeighting.fromConfigName(options.getString("stouffer-weighting"))
            : StoufferWeighting.SQRT_N;
        this.view = new PairRankingView(weighting);

        long maxSize = options.hasPath("cache.maximum-size") ? options.getLong("cache.maximum-size") : 64;
        long expireSeconds = options.hasPath("cache.expire-after-write-seconds")
            ? options.getLong("cache.expire-after-write-seconds")
            : 30;
        this.scoredSlices = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofSeconds(expireSeconds))
            .build();
        log.debug("PairRankingService initialized: weighting={}, cache maxSize={}, expireAfterWrite={}s",
            weighting.getConfigName(), maxSize, expireSeconds);
    }

    /**
     * Returns the top pairs of a slice.
     *
     * @param diseaseLabel Disease label (case-insensitive).
     * @param technology   Measurement technology.
     * @param criteria     Filter and limit.
     * @throws DiseaseNotFoundException if the label is unknown.
     * @throws SQLException             if the store fails.
     */
    public TopPairs topPairs(String diseaseLabel, String technology, RankingCriteria criteria)
            throws DiseaseNotFoundException, SQLException {
        try (IPooledResultReader reader = readers.createReader()) {
            DiseaseInfo disease = reader.findDiseaseByLabel(diseaseLabel)
                .orElseThrow(() -> new DiseaseNotFoundException(diseaseLabel));
            List<RankedPair> scored = getOrScoreSlice(reader, new SliceKey(disease.diseaseKey(), technology));
            return new TopPairs(disease, technology, criteria, scored.size(), PairRankingView.filter(scored, criteria));
        }
    }

    private List<RankedPair> getOrScoreSlice(final IPooledResultReader reader, final SliceKey sliceKey) throws SQLException {
        try {
            return scoredSlices.get(sliceKey, key -> {
                try {
                    List<RankedPair> scored = view.score(reader.readSlice(key.diseaseKey(), key.technology()));
                    log.debug("Scored slice {}/{}: {} pairs", key.diseaseKey(), key.technology(), scored.size());
                    return scored;
                } catch (SQLException e) {
                    throw new RuntimeException("Failed to read slice " + key.diseaseKey() + "/" + key.technology(), e);
                }
            });
        } catch (RuntimeException e) {
            if (e.getCause() instanceof SQLException sql) {
                throw sql;
            }
            throw e;
        }
    }

    /**
     * Drops the cached ranking of one slice.
     */
    public void invalidate(final int diseaseKey, final String technology) {
        scoredSlices.invalidate(new SliceKey(diseaseKey, technology));
        log.debug("Invalidated ranking cache for slice {}/{}", diseaseKey, technology);
    }

    /**
     * Drops all cached slices.
     */
    public void invalidateAll() {
        scoredSlices.invalidateAll();
    }
}
