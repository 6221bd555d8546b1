package com.umitunal.dummyllm.storage;

import com.umitunal.dummyllm.core.AlreadyTerminalException;
import com.umitunal.dummyllm.core.DuplicateJobIdException;
import com.umitunal.dummyllm.core.InvalidTransitionException;
import com.umitunal.dummyllm.core.Job;
import com.umitunal.dummyllm.core.JobNotFoundException;
import com.umitunal.dummyllm.core.JobStore;
import com.umitunal.dummyllm.core.StoreMetrics;
import com.umitunal.dummyllm.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-memory JobStore backed by a ConcurrentHashMap.
 *
 * Records are immutable snapshots; a transition replaces the snapshot inside
 * {@link ConcurrentHashMap#compute}, which serializes competing writers on the
 * same id without any store-wide lock.
 */
public class InMemoryJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    private final ConcurrentHashMap<String, JobRecord> records = new ConcurrentHashMap<>();
    private final Queue<String> creationOrder = new ConcurrentLinkedQueue<>();

    @Override
    public String create(JobRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.getState() != Job.State.QUEUED) {
            throw new InvalidTransitionException(record.getId(), record.getState(), Job.State.QUEUED);
        }
        JobRecord existing = records.putIfAbsent(record.getId(), record);
        if (existing != null) {
            throw new DuplicateJobIdException(record.getId());
        }
        creationOrder.add(record.getId());
        return record.getId();
    }

    @Override
    public JobRecord get(String id) {
        JobRecord record = records.get(id);
        if (record == null) {
            throw new JobNotFoundException(id);
        }
        return record;
    }

    @Override
    public JobRecord transition(String id, Predicate<JobRecord> precondition, UnaryOperator<JobRecord> mutator) {
        JobRecord committed = records.computeIfPresent(id, (key, current) -> {
            if (current.isTerminal()) {
                throw new AlreadyTerminalException(key, current.getState());
            }
            if (!precondition.test(current)) {
                throw new InvalidTransitionException(key, current.getState(), null);
            }
            JobRecord next = mutator.apply(current);
            if (next == null || !key.equals(next.getId())) {
                throw new IllegalStateException("Mutator must return a record for job " + key);
            }
            if (next.getState() != current.getState() && !current.getState().canTransitionTo(next.getState())) {
                throw new InvalidTransitionException(key, current.getState(), next.getState());
            }
            return next;
        });
        if (committed == null) {
            throw new JobNotFoundException(id);
        }
        log.debug("Job {} -> {} (v{})", id, committed.getState().wireName(), committed.getVersion());
        return committed;
    }

    @Override
    public JobRecord requestCancel(String id) {
        JobRecord flagged = records.computeIfPresent(id, (key, current) -> {
            if (current.isTerminal()) {
                throw new AlreadyTerminalException(key, current.getState());
            }
            return current.withCancelRequested();
        });
        if (flagged == null) {
            throw new JobNotFoundException(id);
        }
        return flagged;
    }

    @Override
    public List<JobRecord> list() {
        List<JobRecord> snapshot = new ArrayList<>();
        for (String id : creationOrder) {
            JobRecord record = records.get(id);
            if (record != null) {
                snapshot.add(record);
            }
        }
        return snapshot;
    }

    @Override
    public StoreMetrics getMetrics() {
        long total = 0;
        long queued = 0;
        long running = 0;
        long ok = 0;
        long failed = 0;
        long timedOut = 0;
        long cancelled = 0;

        for (JobRecord record : records.values()) {
            total++;
            switch (record.getState()) {
                case QUEUED -> queued++;
                case RUNNING -> running++;
                case OK -> ok++;
                case FAIL -> failed++;
                case TIMEOUT -> timedOut++;
                case CANCELLED -> cancelled++;
            }
        }

        return new StoreMetrics(total, queued, running, ok, failed, timedOut, cancelled);
    }

    public int size() {
        return records.size();
    }
}
