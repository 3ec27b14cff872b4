package org.genemeta.datapipeline.services.ranking;

import java.util.List;

/**
 * A gene pair scored across all of its pooled metrics within one {@code (disease, technology)} slice.
 *
 * @param pairKey            Surrogate pair key.
 * @param pairId             Canonical {@code <geneA_key>_<geneB_key>}.
 * @param geneAKey           Smaller gene key.
 * @param geneAId            Gene A identifier.
 * @param geneASymbol        Gene A symbol.
 * @param geneBKey           Larger gene key.
 * @param geneBId            Gene B identifier.
 * @param geneBSymbol        Gene B symbol.
 * @param diseaseKey         Slice disease.
 * @param technology         Slice technology.
 * @param qStar              {@code min(q_combined, q_metric..., 1)}.
 * @param i2Star             {@code min(I2_metric..., 100)}.
 * @param zCombined          Stouffer z over the pair's metrics.
 * @param pCombined          Two-sided p of {@code zCombined}.
 * @param qCombined          Benjamini–Hochberg q of {@code pCombined} across the slice's pairs.
 * @param compositeScore     {@code |zCombined|}.
 * @param powerScore         Sum of included study counts over the pair's metrics.
 * @param consistencyScore   Fraction of metrics whose effect sign agrees with {@code zCombined}.
 * @param combinedEffectSize Pooled estimate of the metric with the largest {@code |z|}.
 * @param includedStudyCount Largest included study count over the pair's metrics.
 * @param latestFeatureRunId Most recent run among the pair's metrics.
 * @param metrics            Per-metric summaries, ordered by metric name.
 */
public record RankedPair(long pairKey,
                         String pairId,
                         int geneAKey,
                         String geneAId,
                         String geneASymbol,
                         int geneBKey,
                         String geneBId,
                         String geneBSymbol,
                         int diseaseKey,
                         String technology,
                         double qStar,
                         double i2Star,
                         double zCombined,
                         double pCombined,
                         double qCombined,
                         double compositeScore,
                         long powerScore,
                         double consistencyScore,
                         double combinedEffectSize,
                         int includedStudyCount,
                         String latestFeatureRunId,
                         List<MetricSummary> metrics) {
}
