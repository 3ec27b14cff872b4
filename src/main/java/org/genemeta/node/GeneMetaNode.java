package org.genemeta.node;

import java.time.Clock;
import java.util.List;

import org.genemeta.datapipeline.api.sources.IStudyComponentSource;
import org.genemeta.datapipeline.resources.database.H2MetaAnalysisDatabase;
import org.genemeta.datapipeline.resources.sources.JsonComponentFileSource;
import org.genemeta.datapipeline.services.AggregationOptions;
import org.genemeta.datapipeline.services.AggregationOrchestrator;
import org.genemeta.datapipeline.services.SliceLockRegistry;
import org.genemeta.datapipeline.services.StudyLoadWorker;
import org.genemeta.datapipeline.services.ranking.PairRankingService;
import org.genemeta.node.processes.http.HttpServerProcess;
import org.genemeta.node.processes.http.api.pairs.PairController;
import org.genemeta.node.processes.http.api.runs.RunController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Wires the engine from the {@code genemeta} configuration block.
 * <p>
 * The database, the orchestrator and the ranking service are created eagerly. The study-load worker and the HTTP
 * server exist only after {@link #startServing()}. {@link #close()} stops them in reverse order.
 */
public class GeneMetaNode implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GeneMetaNode.class);

    private final Config config;
    private final Clock clock;
    private final H2MetaAnalysisDatabase database;
    private final AggregationOrchestrator orchestrator;
    private final PairRankingService rankingService;
    private StudyLoadWorker worker;
    private HttpServerProcess httpServer;

    public GeneMetaNode(final Config config) {
        this(config, JsonComponentFileSource.fromConfig(section(config, "components")), Clock.systemUTC());
    }

    /**
     * @param config          The {@code genemeta} block.
     * @param componentSource Source of per-study components.
     * @param clock           Clock for run and review timestamps.
     */
    public GeneMetaNode(final Config config, final IStudyComponentSource componentSource, final Clock clock) {
        this.config = config;
        this.clock = clock;
        this.database = new H2MetaAnalysisDatabase("genemeta-db", section(config, "database"), clock);
        this.orchestrator = new AggregationOrchestrator(database, database, componentSource,
            AggregationOptions.fromConfig(section(config, "aggregation")), new SliceLockRegistry(), clock);
        this.rankingService = new PairRankingService(database, section(config, "ranking"));
        orchestrator.addCommitListener((runId, slice) -> rankingService.invalidate(slice.diseaseKey(), slice.technology()));
    }

    /**
     * Starts the study-load worker and the HTTP server.
     *
     * @throws IllegalStateException if already serving.
     */
    public synchronized void startServing() {
        if (worker != null) {
            throw new IllegalStateException("Node is already serving");
        }
        worker = new StudyLoadWorker("study-load-worker", orchestrator, section(config, "worker"));
        worker.start();

        final Config rankingOptions = section(config, "ranking");
        httpServer = new HttpServerProcess("http-server", section(config, "http"), List.of(
            new PairController(database, database, database, rankingService, rankingOptions, clock),
            new RunController(database, worker, ConfigFactory.empty())));
        httpServer.start();
        log.info("Node serving on port {}", httpServer.getPort());
    }

    public H2MetaAnalysisDatabase getDatabase() {
        return database;
    }

    public AggregationOrchestrator getOrchestrator() {
        return orchestrator;
    }

    /**
     * Returns the ranking service over this node's database. Its cache is evicted whenever the
     * node's orchestrator commits a slice.
     */
    public PairRankingService getRankingService() {
        return rankingService;
    }

    public synchronized StudyLoadWorker getWorker() {
        return worker;
    }

    public synchronized HttpServerProcess getHttpServer() {
        return httpServer;
    }

    @Override
    public synchronized void close() {
        if (httpServer != null) {
            httpServer.stop();
        }
        if (worker != null) {
            worker.stop();
        }
        database.close();
    }

    private static Config section(final Config config, final String path) {
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }
}
