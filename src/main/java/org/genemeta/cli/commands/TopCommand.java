package org.genemeta.cli.commands;

import java.io.PrintWriter;
import java.sql.SQLException;
import java.util.concurrent.Callable;

import org.genemeta.cli.CommandLineInterface;
import org.genemeta.datapipeline.services.ranking.DiseaseNotFoundException;
import org.genemeta.datapipeline.services.ranking.PairRankingService;
import org.genemeta.datapipeline.services.ranking.RankedPair;
import org.genemeta.datapipeline.services.ranking.RankingCriteria;
import org.genemeta.node.GeneMetaNode;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the ranked pairs of one (disease, technology) slice.
 */
@Command(
    name = "top",
    description = "Print the top ranked gene pairs of a disease and technology"
)
public class TopCommand implements Callable<Integer> {

    @Option(names = {"--disease"}, required = true, description = "Disease label")
    private String disease;

    @Option(names = {"--technology"}, required = true, description = "Measurement technology, e.g. RNA_SEQ")
    private String technology;

    @Option(names = {"--q"}, description = "Maximum q* (default: genemeta.ranking.q-threshold)")
    private Double qThreshold;

    @Option(names = {"--k-min"}, description = "Minimum included study count (default: genemeta.ranking.k-min)")
    private Integer kMin;

    @Option(names = {"--i2-max"}, description = "Maximum I2* in percent (default: genemeta.ranking.i2-max)")
    private Double i2Max;

    @Option(names = {"--limit"}, description = "Number of pairs, 1..1000 (default: genemeta.ranking.default-limit)")
    private Integer limit;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Config config;
        final RankingCriteria criteria;
        try {
            config = parent.getConfig();
            criteria = buildCriteria(config.hasPath("ranking") ? config.getConfig("ranking") : ConfigFactory.empty());
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try (GeneMetaNode node = new GeneMetaNode(config)) {
            final PairRankingService service = node.getRankingService();
            final PairRankingService.TopPairs top = service.topPairs(disease, technology, criteria);
            out.printf("%s / %s: %d of %d scored pairs pass (q<=%s, k>=%d, I2<=%s)%n",
                top.disease().label(), technology, top.pairs().size(), top.scoredPairs(),
                criteria.qThreshold(), criteria.kMin(), criteria.i2Max());
            out.printf("%-5s %-16s %-12s %-12s %10s %10s %8s %4s %8s%n",
                "rank", "pair_id", "gene_a", "gene_b", "|Z|", "q*", "I2*", "k", "effect");
            int rank = 1;
            for (final RankedPair pair : top.pairs()) {
                out.printf("%-5d %-16s %-12s %-12s %10.4f %10.3e %8.2f %4d %8.4f%n",
                    rank++, pair.pairId(), orDash(pair.geneASymbol()), orDash(pair.geneBSymbol()),
                    pair.compositeScore(), pair.qStar(), pair.i2Star(), pair.includedStudyCount(),
                    pair.combinedEffectSize());
            }
            out.flush();
            return 0;
        } catch (DiseaseNotFoundException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (SQLException e) {
            err.println("Database error: " + e.getMessage());
            return 2;
        }
    }

    private RankingCriteria buildCriteria(final Config rankingOptions) {
        RankingCriteria criteria = RankingCriteria.fromConfig(rankingOptions);
        if (qThreshold != null) {
            criteria = criteria.withQThreshold(qThreshold);
        }
        if (kMin != null) {
            criteria = criteria.withKMin(kMin);
        }
        if (i2Max != null) {
            criteria = criteria.withI2Max(i2Max);
        }
        if (limit != null) {
            criteria = criteria.withLimit(limit);
        }
        return criteria;
    }

    private static String orDash(final String value) {
        return value != null ? value : "-";
    }
}
