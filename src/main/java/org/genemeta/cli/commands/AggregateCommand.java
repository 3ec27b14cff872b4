package org.genemeta.cli.commands;

import java.io.File;
import java.io.PrintWriter;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

import org.genemeta.cli.CommandLineInterface;
import org.genemeta.datapipeline.api.sources.IStudyComponentSource;
import org.genemeta.datapipeline.resources.sources.JsonComponentFileSource;
import org.genemeta.datapipeline.services.AggregationRunResult;
import org.genemeta.node.GeneMetaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs the aggregation of one or more completed studies synchronously, in the order given.
 * <p>
 * Exit code 0 when every run committed, 2 when at least one failed, 1 on configuration errors.
 */
@Command(
    name = "aggregate",
    description = "Fold completed studies into the pooled pair statistics"
)
public class AggregateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AggregateCommand.class);

    @Option(
        names = {"-s", "--study"},
        required = true,
        split = ",",
        description = "Study key(s) to aggregate, comma separated or repeated"
    )
    private List<Integer> studyKeys;

    @Option(
        names = {"--components-dir"},
        description = "Directory holding <study_key>.json component files (overrides genemeta.components.directory)"
    )
    private File componentsDir;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        final IStudyComponentSource source = componentsDir != null
            ? new JsonComponentFileSource(componentsDir.toPath())
            : JsonComponentFileSource.fromConfig(config.hasPath("components")
                ? config.getConfig("components") : ConfigFactory.empty());

        int failed = 0;
        try (GeneMetaNode node = new GeneMetaNode(config, source, Clock.systemUTC())) {
            for (final int studyKey : studyKeys) {
                final AggregationRunResult result = node.getOrchestrator().run(studyKey);
                out.println(describe(result));
                if (!result.isCommitted()) {
                    failed++;
                }
            }
        }
        out.flush();
        if (failed > 0) {
            log.warn("{} of {} aggregation run(s) failed", failed, studyKeys.size());
            return 2;
        }
        return 0;
    }

    static String describe(final AggregationRunResult result) {
        if (result.isCommitted()) {
            return String.format("study %d: COMMITTED run=%s pairs=%d applied=%d unchanged=%d skipped=%d attempts=%d",
                result.studyKey(), result.featureRunId(), result.pairsTouched(), result.contributionsApplied(),
                result.contributionsUnchanged(), result.contributionsSkipped(), result.attempts());
        }
        return String.format("study %d: FAILED run=%s error=%s (%s) attempts=%d",
            result.studyKey(), result.featureRunId(), result.errorCode(), result.errorMessage(), result.attempts());
    }
}
