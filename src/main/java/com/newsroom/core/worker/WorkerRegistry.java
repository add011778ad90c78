package com.newsroom.core.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory registry of external worker pools.
 * <p>
 * Worker types that have no registered worker do not constrain admission: the registry only
 * answers "unavailable" for a type it knows about and whose workers are all offline, erroring
 * or at capacity. Thread-safe; all methods synchronize on the registry.
 */
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final Clock clock;
    private final Map<String, WorkerDescriptor> workers = new LinkedHashMap<>();

    public WorkerRegistry(Clock clock) {
        this.clock = clock;
    }

    public synchronized void register(WorkerDescriptor worker) {
        workers.put(worker.workerId(), worker);
        log.info("Registered worker {} [{}] status={} capacity={}",
                worker.workerId(), worker.workerType(), worker.status(), worker.maxConcurrentTasks());
    }

    public synchronized void deregister(String workerId) {
        if (workers.remove(workerId) != null) {
            log.info("Deregistered worker {}", workerId);
        }
    }

    public synchronized void heartbeat(String workerId) {
        workers.computeIfPresent(workerId, (id, w) -> w.withHeartbeat(clock.instant()));
    }

    public synchronized void updateStatus(String workerId, WorkerStatus status) {
        var updated = workers.computeIfPresent(workerId, (id, w) -> w.withStatus(status));
        if (updated != null) {
            log.info("Worker {} status -> {}", workerId, status);
        }
    }

    /**
     * True when the task type can be served right now. Unknown types are always available.
     */
    public synchronized boolean isAvailable(String workerType) {
        if (workerType == null) {
            return true;
        }
        boolean known = false;
        for (var w : workers.values()) {
            if (workerType.equals(w.workerType())) {
                known = true;
                if (w.isAvailable()) {
                    return true;
                }
            }
        }
        return !known;
    }

    /**
     * Free task slots across available workers of the type, or {@link Integer#MAX_VALUE} when
     * the type is not registered.
     */
    public synchronized int availableCapacity(String workerType) {
        if (workerType == null) {
            return Integer.MAX_VALUE;
        }
        boolean known = false;
        int free = 0;
        for (var w : workers.values()) {
            if (workerType.equals(w.workerType())) {
                known = true;
                if (w.isAvailable()) {
                    free += w.maxConcurrentTasks() - w.currentTaskCount();
                }
            }
        }
        return known ? free : Integer.MAX_VALUE;
    }

    /**
     * Assigns one unit of load to the least loaded available worker of the given type.
     *
     * @return the chosen worker id, or empty when the type is unregistered or saturated
     */
    public synchronized Optional<String> acquire(String workerType) {
        if (workerType == null) {
            return Optional.empty();
        }
        var chosen = workers.values().stream()
                .filter(w -> workerType.equals(w.workerType()))
                .filter(WorkerDescriptor::isAvailable)
                .min(Comparator.comparingDouble(WorkerDescriptor::load));
        chosen.ifPresent(w -> workers.put(w.workerId(), w.withLoad(w.currentTaskCount() + 1)));
        return chosen.map(WorkerDescriptor::workerId);
    }

    public synchronized void release(String workerId, boolean success, String error) {
        workers.computeIfPresent(workerId, (id, w) ->
                w.withLoad(Math.max(0, w.currentTaskCount() - 1)).withResult(success, error));
    }

    public synchronized void resetHourlyErrorCounts() {
        workers.replaceAll((id, w) -> new WorkerDescriptor(w.workerId(), w.workerType(), w.status(),
                w.supportedTaskTypes(), w.maxConcurrentTasks(), w.currentTaskCount(), 0,
                w.lastHeartbeat(), w.lastError(), w.tasksCompleted(), w.tasksFailed()));
    }

    public synchronized Optional<WorkerDescriptor> find(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    public synchronized List<WorkerDescriptor> all() {
        return new ArrayList<>(workers.values());
    }

    public synchronized boolean isEmpty() {
        return workers.isEmpty();
    }
}
