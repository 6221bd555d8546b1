package com.umitunal.dummyllm.worker;

import com.umitunal.dummyllm.core.AlreadyTerminalException;
import com.umitunal.dummyllm.core.Job;
import com.umitunal.dummyllm.core.JobStore;
import com.umitunal.dummyllm.model.JobError;
import com.umitunal.dummyllm.model.JobRecord;
import com.umitunal.dummyllm.model.JobResult;
import com.umitunal.dummyllm.response.ResponseGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Drives each job from QUEUED through its simulated latency to one terminal state.
 *
 * <p>Every job is an independent unit on a shared scheduler. The latency wait is a
 * timer future raced against the job's cancellation signal, so no thread is held
 * while a job waits and a HANG job costs nothing until it is cancelled.</p>
 *
 * <p>All commits go through {@link JobStore#transition}. Losing a race there
 * ({@link AlreadyTerminalException}) is expected and ends the unit quietly.</p>
 */
public class JobExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    /** Latency value meaning the wait never elapses on its own. */
    public static final long NEVER = -1;

    static final int SLOW_FACTOR = 6;
    static final long FAIL_DELAY_CAP_MS = 200;
    static final long TIMEOUT_FLOOR_MS = 50;

    private final JobStore store;
    private final ResponseGenerator responses;
    private final String failMessage;
    private final ScheduledExecutorService scheduler;
    private final Map<String, CompletableFuture<Void>> cancelSignals = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<JobRecord>> completions = new ConcurrentHashMap<>();
    private final AtomicBoolean running;
    private final AtomicLong completedCount;
    private final AtomicLong cancelledCount;
    private final AtomicLong lostRaceCount;

    private JobExecutor(Builder builder) {
        this.store = builder.store;
        this.responses = builder.responses;
        this.failMessage = builder.failMessage;
        this.scheduler = Executors.newScheduledThreadPool(builder.threads, new ExecutorThreadFactory(builder.name));
        this.running = new AtomicBoolean(true);
        this.completedCount = new AtomicLong(0);
        this.cancelledCount = new AtomicLong(0);
        this.lostRaceCount = new AtomicLong(0);
    }

    /**
     * Schedule execution of a stored job.
     *
     * @param jobId a job in state QUEUED
     * @return a future completed with the terminal record; never completes for
     *         a HANG job that is not cancelled
     */
    public CompletableFuture<JobRecord> execute(String jobId) {
        if (!running.get()) {
            throw new IllegalStateException("Executor is closed");
        }
        CompletableFuture<Void> cancelSignal = new CompletableFuture<>();
        CompletableFuture<JobRecord> completion = new CompletableFuture<>();
        cancelSignals.put(jobId, cancelSignal);
        completions.put(jobId, completion);
        completion.whenComplete((record, error) -> completions.remove(jobId, completion));
        try {
            scheduler.execute(() -> start(jobId, cancelSignal, completion));
        } catch (RejectedExecutionException e) {
            cancelSignals.remove(jobId);
            completions.remove(jobId);
            throw new IllegalStateException("Executor is closed", e);
        }
        return completion;
    }

    /**
     * Wake the unit waiting on this job. Returns immediately.
     */
    public void signalCancel(String jobId) {
        CompletableFuture<Void> signal = cancelSignals.get(jobId);
        if (signal != null) {
            signal.complete(null);
        }
    }

    /**
     * Future of a job still in flight here, or null once it finished or if
     * this executor never saw the id.
     */
    public CompletableFuture<JobRecord> completion(String jobId) {
        return completions.get(jobId);
    }

    /**
     * Simulated latency for a job in milliseconds, or {@link #NEVER}.
     */
    public static long latencyFor(JobRecord record) {
        long base = record.getBaseLatencyMs();
        return switch (record.getMode()) {
            case OK, ECHO -> base;
            case SLOW -> base * SLOW_FACTOR;
            case FAIL -> Math.min(FAIL_DELAY_CAP_MS, base);
            case TIMEOUT -> Math.min(Math.max(TIMEOUT_FLOOR_MS, base), Math.max(TIMEOUT_FLOOR_MS, record.getTimeoutMs()));
            case HANG -> NEVER;
            default -> throw new IllegalStateException("Unresolved mode on job " + record.getId() + ": " + record.getMode());
        };
    }

    private void start(String jobId, CompletableFuture<Void> cancelSignal, CompletableFuture<JobRecord> completion) {
        JobRecord started;
        try {
            started = store.transition(jobId,
                    r -> r.getState() == Job.State.QUEUED,
                    r -> r.start(System.currentTimeMillis()));
        } catch (AlreadyTerminalException e) {
            // Cancelled before it was ever in flight
            lostRace(jobId, e);
            finish(jobId, completion);
            return;
        } catch (RuntimeException e) {
            fault(jobId, completion, e);
            return;
        }

        try {
            awaitOutcome(started, cancelSignal, completion);
        } catch (RuntimeException e) {
            fault(jobId, completion, e);
        }
    }

    private void awaitOutcome(JobRecord started, CompletableFuture<Void> cancelSignal,
                              CompletableFuture<JobRecord> completion) {
        String jobId = started.getId();
        long latency = latencyFor(started);
        CompletableFuture<Void> timer = new CompletableFuture<>();
        ScheduledFuture<?> tick = latency == NEVER
                ? null
                : scheduler.schedule(() -> timer.complete(null), latency, TimeUnit.MILLISECONDS);

        if (started.isCancelRequested()) {
            cancelSignal.complete(null);
        }

        CompletableFuture.anyOf(timer, cancelSignal).whenCompleteAsync((ignored, error) -> {
            if (tick != null) {
                tick.cancel(false);
            }
            try {
                if (cancelSignal.isDone()) {
                    commit(jobId, r -> r.terminate(Job.State.CANCELLED, JobError.cancelledByClient(), System.currentTimeMillis()));
                } else {
                    commitElapsed(started);
                }
                finish(jobId, completion);
            } catch (AlreadyTerminalException e) {
                lostRace(jobId, e);
                finish(jobId, completion);
            } catch (RuntimeException e) {
                fault(jobId, completion, e);
            }
        }, scheduler);
    }

    private void commitElapsed(JobRecord started) {
        UnaryOperator<JobRecord> outcome;
        switch (started.getMode()) {
            case OK, ECHO, SLOW -> {
                JobResult result = responses.generate(started);
                outcome = r -> r.complete(result, System.currentTimeMillis());
            }
            case FAIL -> outcome = r -> r.terminate(Job.State.FAIL, JobError.simulatedFailure(failMessage), System.currentTimeMillis());
            case TIMEOUT -> outcome = r -> r.terminate(Job.State.TIMEOUT, JobError.simulatedTimeout(), System.currentTimeMillis());
            default -> throw new IllegalStateException("Mode " + started.getMode() + " cannot elapse");
        }
        // A cancel flag raised after the timer fired still wins if it is already on the record
        commit(started.getId(), r -> r.isCancelRequested()
                ? r.terminate(Job.State.CANCELLED, JobError.cancelledByClient(), System.currentTimeMillis())
                : outcome.apply(r));
    }

    private void commit(String jobId, UnaryOperator<JobRecord> mutator) {
        JobRecord terminal = store.transition(jobId, r -> r.getState() == Job.State.RUNNING, mutator);
        if (terminal.getState() == Job.State.CANCELLED) {
            cancelledCount.incrementAndGet();
        } else {
            completedCount.incrementAndGet();
        }
        log.info("Job {} finished: state={} mode={}", jobId, terminal.getState().wireName(), terminal.getMode().wireName());
    }

    private void finish(String jobId, CompletableFuture<JobRecord> completion) {
        cancelSignals.remove(jobId);
        completion.complete(store.get(jobId));
    }

    private void lostRace(String jobId, AlreadyTerminalException e) {
        lostRaceCount.incrementAndGet();
        log.debug("Job {} already terminal ({}), nothing to commit", jobId, e.getState().wireName());
    }

    private void fault(String jobId, CompletableFuture<JobRecord> completion, RuntimeException e) {
        log.warn("Execution of job {} failed unexpectedly", jobId, e);
        cancelSignals.remove(jobId);
        completion.completeExceptionally(e);
    }

    public long getCompletedCount() { return completedCount.get(); }
    public long getCancelledCount() { return cancelledCount.get(); }
    public long getLostRaceCount() { return lostRaceCount.get(); }
    public boolean isRunning() { return running.get(); }

    /**
     * Stop the scheduler. Jobs still waiting stay in their current state.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Executor threads did not stop within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public static Builder builder(JobStore store, ResponseGenerator responses) {
        return new Builder(store, responses);
    }

    public static class Builder {
        private final JobStore store;
        private final ResponseGenerator responses;
        private String name = "dummyllm";
        private int threads = 4;
        private String failMessage = "simulated error";

        private Builder(JobStore store, ResponseGenerator responses) {
            this.store = Objects.requireNonNull(store, "store");
            this.responses = Objects.requireNonNull(responses, "responses");
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be positive");
            }
            this.threads = threads;
            return this;
        }

        public Builder withFailMessage(String failMessage) {
            this.failMessage = Objects.requireNonNull(failMessage, "failMessage");
            return this;
        }

        public JobExecutor build() {
            return new JobExecutor(this);
        }
    }

    private static final class ExecutorThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private ExecutorThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "JobExecutor-" + prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
