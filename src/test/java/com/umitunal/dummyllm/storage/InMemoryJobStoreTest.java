package com.umitunal.dummyllm.storage;

import com.umitunal.dummyllm.core.AlreadyTerminalException;
import com.umitunal.dummyllm.core.DuplicateJobIdException;
import com.umitunal.dummyllm.core.InvalidTransitionException;
import com.umitunal.dummyllm.core.Job;
import com.umitunal.dummyllm.core.JobNotFoundException;
import com.umitunal.dummyllm.core.Mode;
import com.umitunal.dummyllm.core.StoreMetrics;
import com.umitunal.dummyllm.model.JobError;
import com.umitunal.dummyllm.model.JobRecord;
import com.umitunal.dummyllm.model.JobResult;
import com.umitunal.dummyllm.model.Usage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class InMemoryJobStoreTest {

    private InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
    }

    private static JobRecord queued(String id) {
        return JobRecord.newBuilder(id, Mode.OK, "llm.chat").withCreatedAt(1000).build();
    }

    private static JobResult result() {
        return new JobResult("done", new Usage(1, 1));
    }

    @Test
    @DisplayName("Should create and get a job")
    void testCreateAndGet() {
        // When
        String id = store.create(queued("job-1"));

        // Then
        JobRecord stored = store.get(id);
        assertThat(id).isEqualTo("job-1");
        assertThat(stored.getState()).isEqualTo(Job.State.QUEUED);
        assertThat(stored.getMode()).isEqualTo(Mode.OK);
    }

    @Test
    @DisplayName("Should reject duplicate ids and keep the first record")
    void testDuplicateId() {
        JobRecord first = queued("job-1");
        store.create(first);

        assertThatThrownBy(() -> store.create(queued("job-1")))
                .isInstanceOf(DuplicateJobIdException.class)
                .extracting("jobId").isEqualTo("job-1");
        assertThat(store.get("job-1")).isSameAs(first);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail with NotFound for unknown ids")
    void testNotFound() {
        assertThatThrownBy(() -> store.get("missing")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> store.requestCancel("missing")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> store.transition("missing", r -> true, r -> r.start(1)))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Should only accept queued records on create")
    void testCreateRequiresQueued() {
        JobRecord running = queued("job-1").start(2000);

        assertThatThrownBy(() -> store.create(running)).isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("Should walk queued -> running -> ok")
    void testHappyPath() {
        // Given
        store.create(queued("job-1"));

        // When
        JobRecord running = store.transition("job-1", r -> r.getState() == Job.State.QUEUED, r -> r.start(2000));
        JobRecord done = store.transition("job-1", r -> true, r -> r.complete(result(), 3000));

        // Then
        assertThat(running.getState()).isEqualTo(Job.State.RUNNING);
        assertThat(running.getUpdatedAt()).isEqualTo(2000);
        assertThat(done.getState()).isEqualTo(Job.State.OK);
        assertThat(done.getResult()).isEqualTo(result());
        assertThat(done.getError()).isNull();
        assertThat(done.getUpdatedAt()).isEqualTo(3000);
        assertThat(done.getCreatedAt()).isEqualTo(1000);
        assertThat(done.getVersion()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should never leave a terminal state")
    void testTerminalMonotonicity() {
        // Given
        store.create(queued("job-1"));
        store.transition("job-1", r -> true, r -> r.start(2000));
        JobRecord failed = store.transition("job-1", r -> true,
                r -> r.terminate(Job.State.FAIL, JobError.simulatedFailure("boom"), 3000));

        // Then
        assertThatThrownBy(() -> store.transition("job-1", r -> true, r -> r.complete(result(), 4000)))
                .isInstanceOf(AlreadyTerminalException.class)
                .extracting("state").isEqualTo(Job.State.FAIL);
        assertThatThrownBy(() -> store.requestCancel("job-1"))
                .isInstanceOf(AlreadyTerminalException.class);
        assertThat(store.get("job-1")).isSameAs(failed);
    }

    @Test
    @DisplayName("Should reject transitions off the state graph")
    void testInvalidEdges() {
        store.create(queued("job-1"));

        // queued -> ok skips running
        assertThatThrownBy(() -> store.transition("job-1", r -> true, r -> r.complete(result(), 2000)))
                .isInstanceOf(InvalidTransitionException.class);
        // failed precondition
        assertThatThrownBy(() -> store.transition("job-1", r -> r.getState() == Job.State.RUNNING, r -> r.start(2000)))
                .isInstanceOf(InvalidTransitionException.class);

        assertThat(store.get("job-1").getState()).isEqualTo(Job.State.QUEUED);
        assertThat(store.get("job-1").getVersion()).isZero();
    }

    @Test
    @DisplayName("Should allow cancelling a queued job directly")
    void testQueuedToCancelled() {
        store.create(queued("job-1"));

        JobRecord cancelled = store.transition("job-1", r -> true,
                r -> r.terminate(Job.State.CANCELLED, JobError.cancelledByClient(), 2000));

        assertThat(cancelled.getState()).isEqualTo(Job.State.CANCELLED);
        assertThat(cancelled.getError().getCode()).isEqualTo(JobError.CANCELLED);
    }

    @Test
    @DisplayName("Should set the cancel flag idempotently while not terminal")
    void testRequestCancel() {
        // Given
        store.create(queued("job-1"));
        store.transition("job-1", r -> true, r -> r.start(2000));

        // When
        JobRecord first = store.requestCancel("job-1");
        JobRecord second = store.requestCancel("job-1");

        // Then
        assertThat(first.isCancelRequested()).isTrue();
        assertThat(second).isSameAs(first);
        assertThat(first.getState()).isEqualTo(Job.State.RUNNING);
        assertThat(first.getUpdatedAt()).isEqualTo(2000);
    }

    @Test
    @DisplayName("Should let exactly one of many concurrent terminal transitions win")
    void testConcurrentTerminalRace() throws Exception {
        // Given
        store.create(queued("job-1"));
        store.transition("job-1", r -> true, r -> r.start(2000));
        int contenders = 16;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger losers = new AtomicInteger();

        // When
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            boolean cancel = i % 2 == 0;
            futures.add(pool.submit(() -> {
                go.await();
                try {
                    store.transition("job-1", r -> true, r -> cancel
                            ? r.terminate(Job.State.CANCELLED, JobError.cancelledByClient(), 3000)
                            : r.complete(result(), 3000));
                    winners.incrementAndGet();
                } catch (AlreadyTerminalException e) {
                    losers.incrementAndGet();
                }
                return null;
            }));
        }
        go.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        assertThat(winners.get()).isEqualTo(1);
        assertThat(losers.get()).isEqualTo(contenders - 1);
        JobRecord finalRecord = store.get("job-1");
        assertThat(finalRecord.getVersion()).isEqualTo(2);
        assertThat(finalRecord.getResult() == null).isNotEqualTo(finalRecord.getError() == null);
    }

    @Test
    @DisplayName("Should count jobs per state and list in creation order")
    void testMetricsAndList() {
        // Given
        store.create(queued("a"));
        store.create(queued("b"));
        store.create(queued("c"));
        store.transition("b", r -> true, r -> r.start(2000));
        store.transition("c", r -> true, r -> r.terminate(Job.State.CANCELLED, JobError.cancelledByClient(), 2000));

        // When
        StoreMetrics metrics = store.getMetrics();

        // Then
        assertThat(metrics.getTotalJobs()).isEqualTo(3);
        assertThat(metrics.getQueuedJobs()).isEqualTo(1);
        assertThat(metrics.getRunningJobs()).isEqualTo(1);
        assertThat(metrics.getCancelledJobs()).isEqualTo(1);
        assertThat(metrics.getTerminalJobs()).isEqualTo(1);
        assertThat(store.list()).extracting(JobRecord::getId).containsExactly("a", "b", "c");
    }
}
