package org.genemeta.datapipeline.services;

import java.sql.SQLException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.genemeta.datapipeline.api.resources.database.IAggregationSession;
import org.genemeta.datapipeline.api.resources.database.PairGeneKeyNotFoundException;
import org.genemeta.datapipeline.api.resources.database.PairIdFormatInvalidException;
import org.genemeta.datapipeline.api.resources.database.dto.GenePair;

/**
 * Maps an unordered pair of gene keys to its canonical {@link GenePair}.
 * <p>
 * The smaller gene key always becomes gene A, so {@code resolve(a, b)} and {@code resolve(b, a)}
 * return the same pair key. Resolved pairs and known genes are memoized for the lifetime of the
 * resolver, which is one aggregation attempt.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe; bound to one session.
 */
public class PairIdentityResolver {

    private static final Pattern PAIR_ID = Pattern.compile("^(\\d+)_(\\d+)$");

    private final IAggregationSession session;
    private final Map<String, GenePair> resolvedPairs = new HashMap<>();
    private final Set<Integer> knownGenes = new HashSet<>();

    public PairIdentityResolver(IAggregationSession session) {
        this.session = session;
    }

    /**
     * Resolves a pair given as two gene keys in any order, creating it if absent.
     *
     * @throws PairIdFormatInvalidException if both keys are the same gene.
     * @throws PairGeneKeyNotFoundException if a key is not in the gene reference set.
     * @throws SQLException                 if the store fails.
     */
    public GenePair resolve(int geneKeyA, int geneKeyB)
            throws PairIdFormatInvalidException, PairGeneKeyNotFoundException, SQLException {
        String rawId = geneKeyA + "_" + geneKeyB;
        if (geneKeyA == geneKeyB) {
            throw new PairIdFormatInvalidException(rawId, "a gene cannot pair with itself");
        }
        int a = Math.min(geneKeyA, geneKeyB);
        int b = Math.max(geneKeyA, geneKeyB);
        String canonicalId = a + "_" + b;

        GenePair cached = resolvedPairs.get(canonicalId);
        if (cached != null) {
            return cached;
        }
        requireGene(a, rawId);
        requireGene(b, rawId);
        GenePair pair = new GenePair(session.findOrCreatePair(a, b), a, b);
        resolvedPairs.put(canonicalId, pair);
        return pair;
    }

    /**
     * Resolves an external composite identifier {@code <geneA_key>_<geneB_key>}.
     *
     * @throws PairIdFormatInvalidException if the identifier is not two integer keys.
     */
    public GenePair resolvePairId(String pairId)
            throws PairIdFormatInvalidException, PairGeneKeyNotFoundException, SQLException {
        int[] keys = parsePairId(pairId);
        return resolve(keys[0], keys[1]);
    }

    /**
     * Splits a composite pair identifier into its two gene keys, in the order given.
     *
     * @throws PairIdFormatInvalidException if the identifier is not exactly two non-negative
     *                                      integers joined by one underscore.
     */
    public static int[] parsePairId(String pairId) throws PairIdFormatInvalidException {
        if (pairId == null) {
            throw new PairIdFormatInvalidException(null, "pair id is missing");
        }
        Matcher matcher = PAIR_ID.matcher(pairId.trim());
        if (!matcher.matches()) {
            throw new PairIdFormatInvalidException(pairId, "expected '<geneA_key>_<geneB_key>'");
        }
        try {
            return new int[] {Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))};
        } catch (NumberFormatException e) {
            throw new PairIdFormatInvalidException(pairId, "gene key out of integer range");
        }
    }

    private void requireGene(int geneKey, String pairId) throws PairGeneKeyNotFoundException, SQLException {
        if (knownGenes.contains(geneKey)) {
            return;
        }
        if (!session.geneExists(geneKey)) {
            throw new PairGeneKeyNotFoundException(geneKey, pairId);
        }
        knownGenes.add(geneKey);
    }
}
