package org.genemeta.datapipeline.api.resources.database.dto;

/**
 * Pooled fact row joined with the gene annotations of its pair.
 *
 * @param result      The pooled fact row.
 * @param pair        The canonical pair.
 * @param geneAId     External id of gene A.
 * @param geneASymbol Symbol of gene A, may be null.
 * @param geneBId     External id of gene B.
 * @param geneBSymbol Symbol of gene B, may be null.
 */
public record AnnotatedPooledResult(PooledMetricResult result,
                                    GenePair pair,
                                    String geneAId,
                                    String geneASymbol,
                                    String geneBId,
                                    String geneBSymbol) {
}
