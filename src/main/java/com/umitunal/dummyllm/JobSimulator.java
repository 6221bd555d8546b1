package com.umitunal.dummyllm;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.umitunal.dummyllm.config.ModeWeights;
import com.umitunal.dummyllm.config.SimulatorConfig;
import com.umitunal.dummyllm.core.AlreadyTerminalException;
import com.umitunal.dummyllm.core.Job;
import com.umitunal.dummyllm.core.JobStore;
import com.umitunal.dummyllm.core.Mode;
import com.umitunal.dummyllm.core.StoreMetrics;
import com.umitunal.dummyllm.model.HealthSnapshot;
import com.umitunal.dummyllm.model.JobError;
import com.umitunal.dummyllm.model.JobInspection;
import com.umitunal.dummyllm.model.JobRecord;
import com.umitunal.dummyllm.model.JobRequest;
import com.umitunal.dummyllm.response.ResponseGenerator;
import com.umitunal.dummyllm.selection.DrawSource;
import com.umitunal.dummyllm.selection.ModeResolver;
import com.umitunal.dummyllm.selection.SplitMixDrawSource;
import com.umitunal.dummyllm.serialization.JsonCodec;
import com.umitunal.dummyllm.storage.InMemoryJobStore;
import com.umitunal.dummyllm.worker.JobExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Entry point for collaborators such as an HTTP layer: submit, poll, cancel and
 * inspect simulated jobs.
 *
 * <p>Mode draws, record creation and scheduling happen under one lock in
 * submission order, which fixes the draw sequence independently of how
 * executions interleave later. {@link #close()} takes the same lock, so a job is
 * either scheduled or never stored.</p>
 *
 * <pre>{@code
 * SimulatorConfig config = SimulatorConfig.newBuilder()
 *         .withPolicy(Mode.RANDOM)
 *         .withSeed(42)
 *         .build();
 * try (JobSimulator simulator = new JobSimulator(config)) {
 *     JobRecord job = simulator.submit("llm.chat", args, 8000, "trace-1");
 *     JobRecord current = simulator.get(job.getId());
 * }
 * }</pre>
 */
public class JobSimulator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobSimulator.class);

    public static final String NAME = "dummyLLM";

    private final SimulatorConfig config;
    private final JobStore store;
    private final JobExecutor executor;
    private final ModeResolver resolver;
    private final DrawSource draws;
    private final JsonCodec codec;
    private final Supplier<String> idGenerator;
    private final Object creationLock = new Object();

    public JobSimulator(SimulatorConfig config) {
        this(config, new InMemoryJobStore(), JobSimulator::newJobId);
    }

    public JobSimulator(SimulatorConfig config, JobStore store, Supplier<String> idGenerator) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.codec = new JsonCodec();
        this.resolver = new ModeResolver(config.getFlakySplit());
        this.draws = new SplitMixDrawSource(config.getSeed());
        this.executor = JobExecutor.builder(store, new ResponseGenerator())
                .withThreads(config.getExecutorThreads())
                .withFailMessage(config.getFailMessage())
                .build();
        log.info("Simulator started: {}", config);
    }

    /**
     * Submit a job. The mode is resolved before this returns.
     *
     * @param op operation name, required
     * @param args request arguments, may be null
     * @param timeoutMs client-declared timeout, non-negative
     * @param traceId optional client trace id
     * @return the created record in state QUEUED
     */
    public JobRecord submit(String op, ObjectNode args, long timeoutMs, String traceId) {
        if (op == null || op.isBlank()) {
            throw new IllegalArgumentException("Missing op");
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeout_ms must be >= 0, got " + timeoutMs);
        }

        JobRecord record;
        synchronized (creationLock) {
            if (!executor.isRunning()) {
                throw new IllegalStateException("Simulator is closed");
            }
            Mode mode = resolver.resolve(config.getPolicy(), config.getWeights(), draws);
            record = JobRecord.newBuilder(idGenerator.get(), mode, op)
                    .withArgs(args)
                    .withTimeoutMs(timeoutMs)
                    .withTraceId(traceId)
                    .withBaseLatencyMs(config.getBaseLatencyMs())
                    .withSeed(config.getSeed())
                    .build();
            store.create(record);
            executor.execute(record.getId());
        }

        log.info("Submitted job {} op={} mode={} trace={}", record.getId(), op, record.getMode().wireName(), traceId);
        return record;
    }

    public JobRecord submit(JobRequest request) {
        return submit(request.getOp(), request.getArgs(), request.getTimeoutMs(), request.getTraceId());
    }

    /**
     * Submit a job from a JSON body {@code {op, args, timeout_ms?, trace_id?}}.
     */
    public JobRecord submitJson(String json) {
        return submit(codec.decode(json, JobRequest.class));
    }

    /**
     * @throws com.umitunal.dummyllm.core.JobNotFoundException if the id is unknown
     */
    public JobRecord get(String id) {
        return store.get(id);
    }

    /**
     * Cancel a job. Returns once the job is recorded as cancelled; the executor
     * is signalled but not waited for.
     *
     * @return the record in state CANCELLED
     * @throws com.umitunal.dummyllm.core.JobNotFoundException if the id is unknown
     * @throws AlreadyTerminalException if the job already finished or was cancelled
     */
    public JobRecord cancel(String id) {
        store.requestCancel(id);
        JobRecord cancelled;
        try {
            cancelled = store.transition(id, r -> true,
                    r -> r.terminate(Job.State.CANCELLED, JobError.cancelledByClient(), System.currentTimeMillis()));
        } catch (AlreadyTerminalException e) {
            // The executor saw the flag and committed the cancellation itself
            JobRecord current = store.get(id);
            if (current.getState() != Job.State.CANCELLED) {
                throw e;
            }
            cancelled = current;
        }
        executor.signalCancel(id);
        log.info("Cancelled job {}", id);
        return cancelled;
    }

    /**
     * Debug view of the request and resolved mode of a job.
     */
    public JobInspection inspect(String id) {
        return new JobInspection(store.get(id), weightsIfRandom());
    }

    public HealthSnapshot health() {
        return new HealthSnapshot(NAME, System.currentTimeMillis(), config.getPolicy(),
                config.getBaseLatencyMs(), config.getSeed(), weightsIfRandom(), store.getMetrics());
    }

    /**
     * Future completed with the terminal record of a submitted job. Already
     * finished jobs get a completed future.
     */
    public CompletableFuture<JobRecord> completion(String id) {
        CompletableFuture<JobRecord> completion = executor.completion(id);
        if (completion != null) {
            return completion;
        }
        JobRecord record = store.get(id);
        if (record.isTerminal()) {
            return CompletableFuture.completedFuture(record);
        }
        throw new IllegalStateException("Job " + id + " is not being executed by this simulator");
    }

    public List<JobRecord> list() {
        return store.list();
    }

    public StoreMetrics getMetrics() {
        return store.getMetrics();
    }

    public SimulatorConfig getConfig() {
        return config;
    }

    /**
     * Draws consumed so far by mode resolution.
     */
    public long drawCount() {
        synchronized (creationLock) {
            return draws.drawCount();
        }
    }

    private ModeWeights weightsIfRandom() {
        return config.getPolicy() == Mode.RANDOM ? config.getWeights() : null;
    }

    static String newJobId() {
        return "job_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    @Override
    public void close() {
        synchronized (creationLock) {
            executor.close();
        }
        log.info("Simulator stopped: {}", store.getMetrics());
    }
}
