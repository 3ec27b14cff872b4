package org.genemeta.datapipeline.services.ranking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.genemeta.datapipeline.api.resources.database.dto.AnnotatedPooledResult;
import org.genemeta.datapipeline.api.resources.database.dto.GenePair;
import org.genemeta.datapipeline.api.resources.database.dto.PooledMetricResult;
import org.genemeta.datapipeline.statistics.BenjaminiHochberg;
import org.genemeta.datapipeline.statistics.StoufferCombiner;
import org.genemeta.datapipeline.statistics.StoufferWeighting;

/**
 * FDR-first, heterogeneity-bounded ranking of the gene pairs of one {@code (disease, technology)} slice.
 * <p>
 * A pure function of the slice's pooled rows: nothing is stored, so the view can be recomputed at
 * any time from the fact table alone.
 * <ol>
 *   <li>Per-metric q-values: Benjamini–Hochberg over the p-values of each metric across the slice.</li>
 *   <li>Per pair: Stouffer combination of its metrics ({@code z_i} signed by the pooled effect,
 *       weighted by total samples), then Benjamini–Hochberg over the combined p across pairs.</li>
 *   <li>{@code q_star = min(q_combined, q_metric..., 1)}, {@code i2_star = min(I2..., 100)}; an
 *       unknown I² counts as 100.</li>
 * </ol>
 * Pairs pass the filter when {@code k ≥ k_min}, {@code q_star ≤ q} and {@code i2_star ≤ i2_max};
 * survivors are ordered by {@link #RANK_ORDER}.
 * <p>
 * <strong>Thread Safety:</strong> Stateless and thread-safe.
 */
public class PairRankingView {

    /**
     * {@code q_star} ascending, composite score descending, power descending, {@code i2_star}
     * ascending, consistency descending, {@code |combined effect|} descending, pair key ascending.
     */
    public static final Comparator<RankedPair> RANK_ORDER = Comparator
        .comparingDouble(RankedPair::qStar)
        .thenComparing(Comparator.comparingDouble(RankedPair::compositeScore).reversed())
        .thenComparing(Comparator.comparingLong(RankedPair::powerScore).reversed())
        .thenComparingDouble(RankedPair::i2Star)
        .thenComparing(Comparator.comparingDouble(RankedPair::consistencyScore).reversed())
        .thenComparing(Comparator.comparingDouble((RankedPair r) -> Math.abs(r.combinedEffectSize())).reversed())
        .thenComparingLong(RankedPair::pairKey);

    private final StoufferCombiner combiner;

    public PairRankingView(StoufferWeighting weighting) {
        this.combiner = new StoufferCombiner(weighting);
    }

    /**
     * Scores every pair of the slice and returns them in rank order, unfiltered.
     *
     * @param slice Pooled rows of one disease and technology.
     */
    public List<RankedPair> score(List<AnnotatedPooledResult> slice) {
        if (slice.isEmpty()) {
            return List.of();
        }
        Map<AnnotatedPooledResult, Double> metricQ = metricQValues(slice);

        Map<Long, List<AnnotatedPooledResult>> byPair = slice.stream()
            .collect(Collectors.groupingBy(r -> r.pair().pairKey(), LinkedHashMap::new, Collectors.toList()));

        List<PairScore> scores = new ArrayList<>(byPair.size());
        for (List<AnnotatedPooledResult> rows : byPair.values()) {
            List<StoufferCombiner.Input> inputs = new ArrayList<>(rows.size());
            for (AnnotatedPooledResult row : rows) {
                PooledMetricResult r = row.result();
                inputs.add(new StoufferCombiner.Input(r.p, r.thetaPooled, r.totalSamples));
            }
            scores.add(new PairScore(rows, combiner.combine(inputs)));
        }

        double[] combinedP = scores.stream().mapToDouble(s -> s.combined.p()).toArray();
        double[] combinedQ = BenjaminiHochberg.adjust(combinedP);

        List<RankedPair> ranked = new ArrayList<>(scores.size());
        for (int i = 0; i < scores.size(); i++) {
            ranked.add(toRankedPair(scores.get(i), combinedQ[i], metricQ));
        }
        ranked.sort(RANK_ORDER);
        return ranked;
    }

    /**
     * Scores the slice, applies the filter predicate and truncates to {@code criteria.limit()}.
     */
    public List<RankedPair> rank(List<AnnotatedPooledResult> slice, RankingCriteria criteria) {
        return filter(score(slice), criteria);
    }

    /**
     * Applies the filter predicate and limit to already scored pairs, keeping their order.
     */
    public static List<RankedPair> filter(List<RankedPair> scored, RankingCriteria criteria) {
        return scored.stream()
            .filter(pair -> passes(pair, criteria))
            .limit(criteria.limit())
            .collect(Collectors.toList());
    }

    public static boolean passes(RankedPair pair, RankingCriteria criteria) {
        return pair.includedStudyCount() >= criteria.kMin()
            && pair.qStar() <= criteria.qThreshold()
            && pair.i2Star() <= criteria.i2Max();
    }

    private static Map<AnnotatedPooledResult, Double> metricQValues(List<AnnotatedPooledResult> slice) {
        Map<String, List<AnnotatedPooledResult>> byMetric = slice.stream()
            .collect(Collectors.groupingBy(r -> r.result().key.metricName(), LinkedHashMap::new, Collectors.toList()));
        Map<AnnotatedPooledResult, Double> q = new IdentityHashMap<>();
        for (List<AnnotatedPooledResult> rows : byMetric.values()) {
            double[] p = rows.stream().mapToDouble(r -> r.result().p).toArray();
            double[] adjusted = BenjaminiHochberg.adjust(p);
            for (int i = 0; i < rows.size(); i++) {
                q.put(rows.get(i), adjusted[i]);
            }
        }
        return q;
    }

    private static RankedPair toRankedPair(PairScore score, double qCombined, Map<AnnotatedPooledResult, Double> metricQ) {
        AnnotatedPooledResult first = score.rows.get(0);
        GenePair pair = first.pair();
        double zCombined = score.combined.z();
        double combinedSign = Math.signum(zCombined);

        double qStar = Math.min(1.0, qCombined);
        double i2Star = 100.0;
        long power = 0;
        int maxK = 0;
        int agreeing = 0;
        AnnotatedPooledResult strongest = first;
        AnnotatedPooledResult latest = first;
        List<MetricSummary> metrics = new ArrayList<>(score.rows.size());

        for (AnnotatedPooledResult row : score.rows) {
            PooledMetricResult r = row.result();
            double q = metricQ.get(row);
            qStar = Math.min(qStar, q);
            i2Star = Math.min(i2Star, r.i2 != null ? r.i2 : 100.0);
            power += r.includedStudyCount;
            maxK = Math.max(maxK, r.includedStudyCount);
            if (combinedSign != 0.0 && Math.signum(r.thetaPooled) == combinedSign) {
                agreeing++;
            }
            if (Math.abs(r.z) > Math.abs(strongest.result().z)) {
                strongest = row;
            }
            if (r.updatedAt != null && (latest.result().updatedAt == null || r.updatedAt.isAfter(latest.result().updatedAt))) {
                latest = row;
            }
            metrics.add(new MetricSummary(r.key.metricName(), r.metricKind, r.thetaPooled, r.sePooled,
                r.ciLower, r.ciUpper, r.tau2, r.i2, r.z, r.p, q, r.includedStudyCount, r.totalSamples,
                r.featureRunId));
        }
        metrics.sort(Comparator.comparing(MetricSummary::metricName));

        return new RankedPair(
            pair.pairKey(),
            pair.pairId(),
            pair.geneAKey(),
            first.geneAId(),
            first.geneASymbol(),
            pair.geneBKey(),
            first.geneBId(),
            first.geneBSymbol(),
            first.result().key.diseaseKey(),
            first.result().key.technology(),
            qStar,
            i2Star,
            zCombined,
            score.combined.p(),
            qCombined,
            Math.abs(zCombined),
            power,
            (double) agreeing / score.rows.size(),
            strongest.result().thetaPooled,
            maxK,
            latest.result().featureRunId,
            List.copyOf(metrics));
    }

    private static final class PairScore {
        final List<AnnotatedPooledResult> rows;
        final StoufferCombiner.Result combined;

        PairScore(List<AnnotatedPooledResult> rows, StoufferCombiner.Result combined) {
            this.rows = rows;
            this.combined = combined;
        }
    }
}
