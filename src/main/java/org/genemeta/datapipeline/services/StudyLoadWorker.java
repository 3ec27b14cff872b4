package org.genemeta.datapipeline.services;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Background worker consuming study-load events and running one aggregation per event.
 * <p>
 * Events are plain study keys on a bounded queue. The worker thread takes one at a time and hands
 * it to the {@link AggregationOrchestrator}; a failed run is recorded and the worker moves on.
 * Several workers may share an orchestrator; runs on the same slice serialize on its lock.
 * <p>
 * Shutdown is phase-aware: a worker waiting for an event is interrupted at once, a worker in the
 * middle of a run gets the full shutdown timeout to finish it.
 */
public class StudyLoadWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StudyLoadWorker.class);

    /** Maximum number of recent run results kept in memory. */
    private static final int MAX_RECENT_RESULTS = 1000;

    public enum State {
        STOPPED,
        RUNNING,
        ERROR
    }

    private enum ShutdownPhase {
        WAITING,
        PROCESSING
    }

    private final String name;
    private final AggregationOrchestrator orchestrator;
    private final BlockingQueue<Integer> queue;
    private final long pollTimeoutMs;
    private final int shutdownTimeoutSeconds;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong committedRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();
    private final ConcurrentLinkedDeque<AggregationRunResult> recentResults = new ConcurrentLinkedDeque<>();
    private volatile ShutdownPhase shutdownPhase = ShutdownPhase.WAITING;
    private Thread workerThread;

    /**
     * Creates a worker.
     *
     * @param name         Thread name.
     * @param orchestrator Orchestrator running the aggregations.
     * @param options      The {@code genemeta.worker} block: {@code queue-capacity},
     *                     {@code poll-timeout-ms}, {@code shutdown-timeout-seconds}.
     */
    public StudyLoadWorker(String name, AggregationOrchestrator orchestrator, Config options) {
        this.name = name;
        this.orchestrator = orchestrator;
        int capacity = options.hasPath("queue-capacity") ? options.getInt("queue-capacity") : 10_000;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.pollTimeoutMs = options.hasPath("poll-timeout-ms") ? options.getLong("poll-timeout-ms") : 500L;
        this.shutdownTimeoutSeconds = options.hasPath("shutdown-timeout-seconds")
            ? options.getInt("shutdown-timeout-seconds")
            : 30;
    }

    /**
     * Enqueues a study-load event.
     *
     * @return false if the queue is full.
     */
    public boolean submit(int studyKey) {
        boolean accepted = queue.offer(studyKey);
        if (accepted) {
            log.debug("Queued study {} ({} pending)", studyKey, queue.size());
        } else {
            log.warn("Study-load queue of {} is full, rejected study {}", name, studyKey);
        }
        return accepted;
    }

    public void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start worker '%s' as it is already in state %s", name, currentState.get()));
        }
        stopRequested.set(false);
        workerThread = new Thread(this::runWorker);
        workerThread.setName(name);
        workerThread.start();
        log.info("{} started", name);
    }

    public void stop() {
        if (currentState.get() != State.RUNNING) {
            return;
        }
        stopRequested.set(true);
        if (shutdownPhase == ShutdownPhase.WAITING) {
            workerThread.interrupt();
        }
        try {
            workerThread.join(TimeUnit.SECONDS.toMillis(shutdownTimeoutSeconds));
            if (workerThread.isAlive()) {
                log.warn("{} did not stop within {}s, forcing interrupt", name, shutdownTimeoutSeconds);
                workerThread.interrupt();
                workerThread.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for worker shutdown", name);
        }
        if (workerThread.isAlive()) {
            log.error("{} thread did not stop within {} seconds! Forcing ERROR state.", name, shutdownTimeoutSeconds);
            currentState.set(State.ERROR);
            return;
        }
        log.info("{} stopped ({} committed, {} failed, {} still queued)", name, committedRuns.get(),
            failedRuns.get(), queue.size());
    }

    private void runWorker() {
        try {
            while (!stopRequested.get()) {
                Integer studyKey = queue.poll(pollTimeoutMs, TimeUnit.MILLISECONDS);
                if (studyKey == null) {
                    continue;
                }
                shutdownPhase = ShutdownPhase.PROCESSING;
                Thread.interrupted(); // Clear interrupt flag from WAITING→PROCESSING race
                try {
                    record(orchestrator.run(studyKey));
                } finally {
                    shutdownPhase = ShutdownPhase.WAITING;
                }
            }
        } catch (InterruptedException e) {
            log.debug("Worker thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("{} stopped with ERROR due to {}", name, e.getClass().getSimpleName(), e);
            currentState.set(State.ERROR);
        } finally {
            if (currentState.get() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Worker thread for {} has terminated.", name);
        }
    }

    private void record(AggregationRunResult result) {
        if (result.isCommitted()) {
            committedRuns.incrementAndGet();
        } else {
            failedRuns.incrementAndGet();
        }
        recentResults.addLast(result);
        while (recentResults.size() > MAX_RECENT_RESULTS) {
            recentResults.pollFirst();
        }
    }

    public State getCurrentState() {
        return currentState.get();
    }

    public long getCommittedRuns() {
        return committedRuns.get();
    }

    public long getFailedRuns() {
        return failedRuns.get();
    }

    public int getQueuedCount() {
        return queue.size();
    }

    /**
     * Returns the most recent run results, oldest first.
     */
    public List<AggregationRunResult> getRecentResults() {
        return new ArrayList<>(recentResults);
    }

    @Override
    public void close() {
        stop();
    }
}
