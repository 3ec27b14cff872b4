package org.genemeta.node.processes.http.api.runs;

import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

import org.genemeta.datapipeline.api.resources.database.IRunProvenanceLog;
import org.genemeta.datapipeline.api.resources.database.dto.FeatureRun;
import org.genemeta.datapipeline.services.StudyLoadWorker;
import org.genemeta.node.processes.http.api.AbstractApiController;
import org.genemeta.node.processes.http.api.runs.dto.AggregationAcceptedDto;
import org.genemeta.node.processes.http.api.runs.dto.FeatureRunDto;
import org.genemeta.node.processes.http.api.runs.dto.ValidationWarningDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;

/**
 * HTTP controller for aggregation runs.
 * <p>
 * Routes (relative to the base path):
 * <ul>
 *   <li>{@code GET /runs/{feature_run_id}}: provenance of one run and its warnings.</li>
 *   <li>{@code POST /studies/{study_key}/aggregations}: queues a study-load event and answers 202.
 *       Answers 503 when the worker is not running or its queue is full.</li>
 * </ul>
 */
public class RunController extends AbstractApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunController.class);

    private final IRunProvenanceLog provenance;
    private final StudyLoadWorker worker;

    /**
     * Creates the controller.
     *
     * @param provenance Run provenance log.
     * @param worker     Worker receiving study-load events.
     * @param options    Controller options (currently unused).
     */
    public RunController(final IRunProvenanceLog provenance, final StudyLoadWorker worker, final Config options) {
        super(options);
        this.provenance = provenance;
        this.worker = worker;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String runPath = path(basePath, "/runs/{feature_run_id}");
        final String aggregationPath = path(basePath, "/studies/{study_key}/aggregations");

        LOGGER.debug("Registering run endpoints: run={}, aggregation={}", runPath, aggregationPath);

        app.get(runPath, this::getRun);
        app.post(aggregationPath, this::postAggregation);

        setupExceptionHandlers(app);
    }

    void getRun(final Context ctx) throws SQLException {
        final String featureRunId = ctx.pathParam("feature_run_id");
        final FeatureRun run = provenance.findRun(featureRunId)
            .orElseThrow(() -> new NotFoundException("Unknown feature run " + featureRunId));
        final List<ValidationWarningDto> warnings = provenance.findWarnings(featureRunId).stream()
            .map(ValidationWarningDto::from)
            .collect(Collectors.toList());
        ctx.status(HttpStatus.OK).json(FeatureRunDto.from(run, warnings));
    }

    void postAggregation(final Context ctx) {
        final int studyKey = parseInt("study_key", ctx.pathParam("study_key"));
        if (worker.getCurrentState() != StudyLoadWorker.State.RUNNING) {
            sendError(ctx, HttpStatus.SERVICE_UNAVAILABLE, "Study-load worker is " + worker.getCurrentState());
            return;
        }
        if (!worker.submit(studyKey)) {
            sendError(ctx, HttpStatus.SERVICE_UNAVAILABLE, "Study-load queue is full, retry later");
            return;
        }
        LOGGER.info("Queued aggregation of study {}", studyKey);
        ctx.status(HttpStatus.ACCEPTED).json(new AggregationAcceptedDto(studyKey, worker.getQueuedCount()));
    }
}
