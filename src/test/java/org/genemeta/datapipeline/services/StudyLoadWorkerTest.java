package org.genemeta.datapipeline.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class StudyLoadWorkerTest {

    @Mock
    private AggregationOrchestrator orchestrator;

    private StudyLoadWorker worker;

    @BeforeEach
    void setUp() {
        worker = new StudyLoadWorker("test-worker", orchestrator,
            ConfigFactory.parseString("queue-capacity = 2\npoll-timeout-ms = 20\nshutdown-timeout-seconds = 5"));
    }

    @AfterEach
    void tearDown() {
        worker.close();
    }

    private static AggregationRunResult result(int studyKey, AggregationState finalState) {
        return new AggregationRunResult("run-" + studyKey, studyKey, null, finalState,
            List.of(AggregationState.PENDING, finalState), 1, 0, 0, 0, 0, List.of(),
            finalState == AggregationState.FAILED ? "STUDY_NOT_FOUND" : null, null);
    }

    @Test
    void runsEveryQueuedStudyOnce() {
        when(orchestrator.run(anyInt())).thenAnswer(invocation -> {
            int studyKey = invocation.getArgument(0);
            return result(studyKey, studyKey == 13 ? AggregationState.FAILED : AggregationState.COMMITTED);
        });
        worker.start();

        assertThat(worker.submit(12)).isTrue();
        assertThat(worker.submit(13)).isTrue();

        await().atMost(Duration.ofSeconds(5)).until(() -> worker.getRecentResults().size() == 2);
        assertThat(worker.getCommittedRuns()).isEqualTo(1);
        assertThat(worker.getFailedRuns()).isEqualTo(1);
        assertThat(worker.getRecentResults()).extracting(AggregationRunResult::studyKey).containsExactly(12, 13);
        verify(orchestrator).run(12);
        verify(orchestrator).run(13);
    }

    @Test
    void rejectsEventsWhenQueueIsFull() {
        assertThat(worker.submit(1)).isTrue();
        assertThat(worker.submit(2)).isTrue();
        assertThat(worker.submit(3)).isFalse();
        assertThat(worker.getQueuedCount()).isEqualTo(2);
    }

    @Test
    void stopWaitsForRunningAggregation() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(orchestrator.run(12)).thenAnswer(invocation -> {
            started.countDown();
            Thread.sleep(200);
            return result(12, AggregationState.COMMITTED);
        });
        worker.start();
        worker.submit(12);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        worker.stop();

        assertThat(worker.getCurrentState()).isEqualTo(StudyLoadWorker.State.STOPPED);
        assertThat(worker.getCommittedRuns()).isEqualTo(1);
    }

    @Test
    void cannotStartTwice() {
        worker.start();

        assertThatThrownBy(() -> worker.start()).isInstanceOf(IllegalStateException.class);
    }
}
