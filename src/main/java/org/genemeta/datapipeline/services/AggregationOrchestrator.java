package org.genemeta.datapipeline.services;

import java.io.IOException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import org.genemeta.datapipeline.api.resources.database.AggregationPreconditionException;
import org.genemeta.datapipeline.api.resources.database.IAggregationSession;
import org.genemeta.datapipeline.api.resources.database.IAggregationSessionProvider;
import org.genemeta.datapipeline.api.resources.database.IRunProvenanceLog;
import org.genemeta.datapipeline.api.resources.database.dto.FeatureRun;
import org.genemeta.datapipeline.api.resources.database.dto.FeatureRunStatus;
import org.genemeta.datapipeline.api.resources.database.dto.GenePair;
import org.genemeta.datapipeline.api.resources.database.dto.PerStudyComponent;
import org.genemeta.datapipeline.api.resources.database.dto.PooledMetricResult;
import org.genemeta.datapipeline.api.resources.database.dto.StatisticsKey;
import org.genemeta.datapipeline.api.resources.database.dto.StudyContext;
import org.genemeta.datapipeline.api.resources.database.dto.SufficientStatistics;
import org.genemeta.datapipeline.api.resources.database.dto.ValidationWarning;
import org.genemeta.datapipeline.api.sources.IStudyComponentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one study's contribution through disease resolution, statistics update and pooled
 * recomputation, committing all of it or none of it.
 * <p>
 * Each attempt runs in its own store session under the in-process lock of the study's
 * {@code (disease, technology)} slice. Precondition failures fail the run at once. Transient
 * store failures (lock timeouts, row-version conflicts, lost connections) roll the attempt back
 * and retry the whole study with exponential backoff, up to
 * {@link AggregationOptions#maxAttempts()} attempts.
 * <p>
 * Every run is recorded in the provenance log, including failed ones. Registered
 * {@link IAggregationCommitListener}s hear about a committed slice before its run is recorded
 * as successful.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe. Runs for different slices proceed in parallel.
 */
public class AggregationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AggregationOrchestrator.class);

    public static final String ERROR_RETRIES_EXHAUSTED = "TRANSIENT_RETRIES_EXHAUSTED";
    public static final String ERROR_STORE = "STORE_ERROR";
    public static final String ERROR_COMPONENT_SOURCE = "COMPONENT_SOURCE_ERROR";
    public static final String ERROR_INTERRUPTED = "INTERRUPTED";
    public static final String ERROR_INTERNAL = "INTERNAL_ERROR";

    private final IAggregationSessionProvider sessions;
    private final IRunProvenanceLog provenance;
    private final IStudyComponentSource componentSource;
    private final AggregationOptions options;
    private final SliceLockRegistry sliceLocks;
    private final Clock clock;
    private final StudyDiseaseResolver diseaseResolver = new StudyDiseaseResolver();
    private final PooledResultCalculator pooledCalculator = new PooledResultCalculator();
    private final List<IAggregationCommitListener> commitListeners = new CopyOnWriteArrayList<>();

    public AggregationOrchestrator(IAggregationSessionProvider sessions,
                                   IRunProvenanceLog provenance,
                                   IStudyComponentSource componentSource,
                                   AggregationOptions options,
                                   SliceLockRegistry sliceLocks,
                                   Clock clock) {
        this.sessions = sessions;
        this.provenance = provenance;
        this.componentSource = componentSource;
        this.options = options;
        this.sliceLocks = sliceLocks;
        this.clock = clock;
    }

    public void addCommitListener(IAggregationCommitListener listener) {
        commitListeners.add(listener);
    }

    /**
     * Aggregates one study's components.
     * <p>
     * Never throws for a failed run; the failure is reported in the result and the provenance log.
     *
     * @param studyKey The completed study.
     * @return The outcome of the run.
     */
    public AggregationRunResult run(int studyKey) {
        RunTracker tracker = new RunTracker(UUID.randomUUID().toString(), studyKey, clock.instant());
        tracker.enter(AggregationState.PENDING);
        recordRun(FeatureRun.started(tracker.featureRunId, studyKey, tracker.startedAt));
        log.info("Aggregation run {} started for study {}", tracker.featureRunId, studyKey);

        while (true) {
            try {
                attempt(tracker);
                return finish(tracker, null, null);
            } catch (AggregationPreconditionException e) {
                logFailure(tracker, e.getMessage());
                return finish(tracker, e.getErrorCode(), e.getMessage());
            } catch (IOException e) {
                logFailure(tracker, "cannot read components: " + e.getMessage());
                return finish(tracker, ERROR_COMPONENT_SOURCE, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logFailure(tracker, "interrupted");
                return finish(tracker, ERROR_INTERRUPTED, "Run interrupted");
            } catch (SQLException | SliceLockTimeoutException e) {
                if (!isTransient(e)) {
                    logFailure(tracker, "store error: " + e.getMessage());
                    return finish(tracker, ERROR_STORE, e.getMessage());
                }
                if (tracker.attempts >= options.maxAttempts()) {
                    logFailure(tracker, "transient failure persisted after " + tracker.attempts + " attempts: " + e.getMessage());
                    return finish(tracker, ERROR_RETRIES_EXHAUSTED, e.getMessage());
                }
                long backoff = options.backoffMillis(tracker.attempts);
                log.warn("Transient failure in run {} for study {} (attempt {}/{}), retrying in {} ms: {}",
                    tracker.featureRunId, studyKey, tracker.attempts, options.maxAttempts(), backoff, e.getMessage());
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logFailure(tracker, "interrupted during backoff");
                    return finish(tracker, ERROR_INTERRUPTED, "Run interrupted during retry backoff");
                }
            } catch (RuntimeException e) {
                log.error("Aggregation run {} for study {} failed unexpectedly", tracker.featureRunId, studyKey, e);
                return finish(tracker, ERROR_INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    private void attempt(RunTracker tracker) throws AggregationPreconditionException, IOException,
            SQLException, SliceLockTimeoutException, InterruptedException {
        tracker.startAttempt();
        try (IAggregationSession session = sessions.openSession()) {
            tracker.enter(AggregationState.RESOLVING_DISEASE);
            StudyContext context = diseaseResolver.resolve(session, tracker.studyKey, clock.instant());
            tracker.context = context;
            if (tracker.components == null) {
                tracker.components = componentSource.fetchComponents(tracker.studyKey);
            }

            String slice = context.sliceKey();
            if (!sliceLocks.tryLock(slice, options.sliceLockTimeoutMs())) {
                throw new SliceLockTimeoutException(slice, options.sliceLockTimeoutMs());
            }
            try {
                tracker.enter(AggregationState.UPDATING_STATS);
                PairIdentityResolver pairs = new PairIdentityResolver(session);
                SufficientStatisticsUpdater updater = new SufficientStatisticsUpdater(session,
                    options.minCorrelationN(), tracker.featureRunId);
                for (PerStudyComponent component : tracker.components) {
                    tracker.current = component;
                    GenePair pair = pairs.resolvePairId(component.pairId());
                    StatisticsKey key = new StatisticsKey(pair.pairKey(), context.diseaseKey(),
                        context.technology(), component.metricName());
                    updater.fold(component, key);
                }
                tracker.current = null;
                List<SufficientStatistics> changed = updater.persistChanged();

                tracker.enter(AggregationState.RECOMPUTING_POOLED);
                Instant now = clock.instant();
                Set<Long> pairsTouched = new HashSet<>();
                for (SufficientStatistics statistics : changed) {
                    Optional<PooledMetricResult> pooled = pooledCalculator.calculate(statistics, tracker.featureRunId, now);
                    if (pooled.isPresent()) {
                        session.upsertPooledResult(pooled.get());
                    }
                    pairsTouched.add(statistics.getKey().pairKey());
                }
                session.commit();
                tracker.completeAttempt(updater, pairsTouched.size());
            } finally {
                sliceLocks.unlock(slice);
            }
        }
    }

    private AggregationRunResult finish(RunTracker tracker, String errorCode, String errorMessage) {
        AggregationState finalState = errorCode == null ? AggregationState.COMMITTED : AggregationState.FAILED;
        tracker.enter(finalState);
        Instant endedAt = clock.instant();
        if (finalState == AggregationState.COMMITTED) {
            notifyCommitted(tracker);
        }

        recordRun(new FeatureRun(
            tracker.featureRunId,
            tracker.studyKey,
            tracker.context != null ? tracker.context.diseaseKey() : null,
            tracker.context != null ? tracker.context.technology() : null,
            tracker.startedAt,
            endedAt,
            finalState == AggregationState.COMMITTED ? FeatureRunStatus.SUCCESS : FeatureRunStatus.FAILED,
            finalState.name(),
            tracker.attempts,
            tracker.pairsTouched,
            tracker.applied,
            tracker.skipped,
            errorCode,
            errorMessage));
        if (!tracker.warnings.isEmpty()) {
            try {
                provenance.recordWarnings(tracker.warnings);
            } catch (SQLException e) {
                log.error("Failed to record {} validation warnings of run {}: {}",
                    tracker.warnings.size(), tracker.featureRunId, e.getMessage());
            }
        }

        if (finalState == AggregationState.COMMITTED) {
            log.info("Aggregation run {} committed for study {} on slice {}: {} pairs touched, {} applied, {} unchanged, {} skipped, {} attempt(s)",
                tracker.featureRunId, tracker.studyKey, tracker.context.sliceKey(), tracker.pairsTouched,
                tracker.applied, tracker.unchanged, tracker.skipped, tracker.attempts);
        }
        return new AggregationRunResult(
            tracker.featureRunId,
            tracker.studyKey,
            tracker.context,
            finalState,
            List.copyOf(tracker.states),
            tracker.attempts,
            tracker.pairsTouched,
            tracker.applied,
            tracker.unchanged,
            tracker.skipped,
            List.copyOf(tracker.warnings),
            errorCode,
            errorMessage);
    }

    private void notifyCommitted(RunTracker tracker) {
        for (IAggregationCommitListener listener : commitListeners) {
            try {
                listener.onCommitted(tracker.featureRunId, tracker.context);
            } catch (RuntimeException e) {
                log.error("Commit listener failed for run {} on slice {}", tracker.featureRunId,
                    tracker.context.sliceKey(), e);
            }
        }
    }

    private void logFailure(RunTracker tracker, String reason) {
        if (tracker.current != null) {
            log.error("Aggregation run {} failed for study {} at pair '{}' metric '{}' in state {}: {}",
                tracker.featureRunId, tracker.studyKey, tracker.current.pairId(), tracker.current.metricName(),
                tracker.currentState(), reason);
        } else {
            log.error("Aggregation run {} failed for study {} in state {}: {}",
                tracker.featureRunId, tracker.studyKey, tracker.currentState(), reason);
        }
    }

    private void recordRun(FeatureRun run) {
        try {
            provenance.recordRun(run);
        } catch (SQLException e) {
            log.error("Failed to record provenance of run {} ({}): {}", run.featureRunId(), run.status(), e.getMessage());
        }
    }

    /**
     * Whether a failure is worth retrying the whole study for.
     */
    static boolean isTransient(Exception e) {
        if (e instanceof SliceLockTimeoutException) {
            return true;
        }
        Throwable t = e;
        while (t != null) {
            if (t instanceof SQLTransientException || t instanceof SQLRecoverableException) {
                return true;
            }
            // SQLSTATE class 40: transaction rollback (serialization failure, deadlock)
            if (t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("40")) {
                return true;
            }
            t = t.getCause() != t ? t.getCause() : null;
        }
        return false;
    }

    /**
     * Mutable bookkeeping of one run.
     */
    private static final class RunTracker {
        final String featureRunId;
        final int studyKey;
        final Instant startedAt;
        final List<AggregationState> states = new ArrayList<>();
        StudyContext context;
        List<PerStudyComponent> components;
        PerStudyComponent current;
        int attempts;
        int pairsTouched;
        int applied;
        int unchanged;
        int skipped;
        List<ValidationWarning> warnings = List.of();

        RunTracker(String featureRunId, int studyKey, Instant startedAt) {
            this.featureRunId = featureRunId;
            this.studyKey = studyKey;
            this.startedAt = startedAt;
        }

        void enter(AggregationState state) {
            states.add(state);
        }

        AggregationState currentState() {
            return states.get(states.size() - 1);
        }

        void startAttempt() {
            attempts++;
            current = null;
            pairsTouched = 0;
            applied = 0;
            unchanged = 0;
            skipped = 0;
            warnings = List.of();
        }

        void completeAttempt(SufficientStatisticsUpdater updater, int touched) {
            pairsTouched = touched;
            applied = updater.getAppliedCount();
            unchanged = updater.getUnchangedCount();
            skipped = updater.getSkippedCount();
            warnings = new ArrayList<>(updater.getWarnings());
        }
    }
}
