package com.newsroom.core.scheduler;

import com.newsroom.core.model.Task;
import com.newsroom.core.model.TaskDependency;
import com.newsroom.core.model.TaskStatus;
import com.newsroom.core.scheduler.TaskStore.Partition;
import com.newsroom.core.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns every task lifecycle transition: admission, ready-set computation, completion, and
 * retry with backoff.
 * <p>
 * A task is ready when it is pending, its {@code scheduledFor} time has passed, every
 * dependency is terminal with the required status, and its worker type (if registered) has
 * capacity. Ready tasks are ordered by priority (highest first), then by earliest
 * {@code scheduledFor} (unset counts as now), then by submission order.
 * <p>
 * All public methods synchronize on the scheduler, so concurrent submitters and the execution
 * loop never interleave mutations.
 */
public class Scheduler {

    /** Upper bound on a single retry delay. */
    public static final Duration MAX_RETRY_DELAY = Duration.ofDays(7);

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    static final Duration HEALTH_WINDOW = Duration.ofHours(1);

    private final TaskStore store = new TaskStore();
    private final OutcomeWindow outcomes = new OutcomeWindow(HEALTH_WINDOW);
    private final TaskIdGenerator idGenerator;
    private final WorkerRegistry workers;
    private final Clock clock;
    private long nextSequence;

    public Scheduler(TaskIdGenerator idGenerator, WorkerRegistry workers, Clock clock) {
        this.idGenerator = idGenerator;
        this.workers = workers;
        this.clock = clock;
    }

    public Scheduler(Clock clock) {
        this(new TaskIdGenerator(), null, clock);
    }

    // -- Submission -------------------------------------------------------------------------

    public synchronized Task submit(Task task) {
        return submitAll(List.of(task)).get(0);
    }

    /**
     * Validates and enqueues a batch. Dependencies may point at tasks already held by the
     * scheduler or at other tasks of the same batch. Tasks without an id get a generated one.
     *
     * @return the accepted tasks, in batch order, as stored
     * @throws InvalidTaskException if any task in the batch is malformed; nothing is enqueued
     */
    public synchronized List<Task> submitAll(List<Task> tasks) {
        var batch = new ArrayList<Task>(tasks.size());
        for (var task : tasks) {
            if (task == null) {
                throw new InvalidTaskException("Null task in submission batch");
            }
            batch.add(task.id() == null || task.id().isBlank()
                    ? task.toBuilder().id(idGenerator.nextId()).build()
                    : task);
        }

        var batchIds = new HashSet<String>();
        for (var task : batch) {
            if (!batchIds.add(task.id()) || store.contains(task.id())) {
                throw new InvalidTaskException("Duplicate task id: " + task.id());
            }
        }
        for (var task : batch) {
            validate(task, batchIds);
        }
        detectCycles(batch);

        Instant now = clock.instant();
        var accepted = new ArrayList<Task>(batch.size());
        for (var task : batch) {
            var stored = task.toBuilder()
                    .status(TaskStatus.PENDING)
                    .createdAt(task.createdAt() != null ? task.createdAt() : now)
                    .sequence(nextSequence++)
                    .build();
            store.put(stored);
            accepted.add(stored);
            log.debug("Submitted {} [{}] priority={} deps={}",
                    stored.id(), stored.taskType(), stored.priority(), stored.dependencies().size());
        }
        // A dependency that is already terminal in the wrong status can never be satisfied.
        for (var task : accepted) {
            for (var dep : task.dependencies()) {
                store.find(dep.taskId()).filter(Task::isTerminal).ifPresent(d -> cascade(d.id()));
            }
        }
        log.info("Accepted {} task(s), {} pending", accepted.size(), store.count(Partition.PENDING));
        return accepted.stream().map(t -> store.find(t.id()).orElse(t)).toList();
    }

    private void validate(Task task, Set<String> batchIds) {
        if (task.taskType() == null || task.taskType().isBlank()) {
            throw new InvalidTaskException("Task " + task.id() + " has no task type");
        }
        if (task.priority() == null) {
            throw new InvalidTaskException("Task " + task.id() + " has no recognized priority");
        }
        if (task.maxRetries() < 0) {
            throw new InvalidTaskException("Task " + task.id() + " has negative max retries: " + task.maxRetries());
        }
        if (task.retryCount() < 0 || task.retryCount() > task.maxRetries()) {
            throw new InvalidTaskException("Task " + task.id() + " retry count " + task.retryCount()
                    + " outside [0, " + task.maxRetries() + "]");
        }
        if (task.retryDelay().isNegative()) {
            throw new InvalidTaskException("Task " + task.id() + " has negative retry delay");
        }
        for (TaskDependency dep : task.dependencies()) {
            if (dep.taskId() == null || dep.taskId().equals(task.id())) {
                throw new InvalidTaskException("Task " + task.id() + " has an invalid dependency: " + dep.taskId());
            }
            if (!dep.requiredStatus().isTerminal()) {
                throw new InvalidTaskException("Task " + task.id() + " requires non-terminal status "
                        + dep.requiredStatus() + " of " + dep.taskId());
            }
            if (!store.contains(dep.taskId()) && !batchIds.contains(dep.taskId())) {
                throw new InvalidTaskException("Task " + task.id() + " depends on unknown task " + dep.taskId());
            }
        }
    }

    private void detectCycles(List<Task> batch) {
        var byId = new HashMap<String, Task>();
        batch.forEach(t -> byId.put(t.id(), t));
        var visiting = new HashSet<String>();
        var done = new HashSet<String>();
        for (var task : batch) {
            visit(task.id(), byId, visiting, done);
        }
    }

    private void visit(String id, Map<String, Task> byId, Set<String> visiting, Set<String> done) {
        if (done.contains(id) || !byId.containsKey(id)) {
            return;
        }
        if (!visiting.add(id)) {
            throw new InvalidTaskException("Dependency cycle through task " + id);
        }
        for (var dep : byId.get(id).dependencies()) {
            visit(dep.taskId(), byId, visiting, done);
        }
        visiting.remove(id);
        done.add(id);
    }

    // -- Ready set --------------------------------------------------------------------------

    public synchronized List<Task> readyTasks() {
        return readyTasks(Integer.MAX_VALUE);
    }

    /**
     * Returns up to {@code limit} ready tasks in dispatch order and admits them: they leave the
     * pending set with status SCHEDULED. Ready tasks beyond the limit stay pending. Callers must
     * finalize every returned task with {@link #complete}, {@link #fail} or {@link #cancel}.
     */
    public synchronized List<Task> readyTasks(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        var candidates = store.tasksIn(Partition.PENDING).stream()
                .filter(t -> isReady(t, now))
                .sorted(readyOrder(now))
                .toList();

        // Worker capacity is shared by every task of a type admitted in this call.
        var capacity = new HashMap<String, Integer>();
        var admitted = new ArrayList<Task>(Math.min(limit, candidates.size()));
        for (var task : candidates) {
            if (admitted.size() >= limit) {
                break;
            }
            String workerType = task.resources().workerType();
            if (workers != null && workerType != null) {
                int free = capacity.computeIfAbsent(workerType, workers::availableCapacity);
                if (free <= 0) {
                    continue;
                }
                capacity.put(workerType, free == Integer.MAX_VALUE ? free : free - 1);
            }
            var scheduled = task.toBuilder().status(TaskStatus.SCHEDULED).build();
            store.put(scheduled);
            outcomes.recordQueueWait(now, Duration.between(readySince(task), now));
            admitted.add(scheduled);
        }
        if (!admitted.isEmpty()) {
            log.debug("readyTasks: admitted {} of {} pending (limit {})",
                    admitted.size(), admitted.size() + store.count(Partition.PENDING), limit);
        }
        return admitted;
    }

    static Comparator<Task> readyOrder(Instant now) {
        return Comparator.comparing(Task::priority, Comparator.reverseOrder())
                .thenComparing(t -> t.scheduledFor() != null ? t.scheduledFor() : now)
                .thenComparingLong(Task::sequence);
    }

    private boolean isReady(Task task, Instant now) {
        if (task.scheduledFor() != null && task.scheduledFor().isAfter(now)) {
            return false;
        }
        if (!dependenciesSatisfied(task)) {
            log.trace("  {} [{}] deps unsatisfied: {}", task.id(), task.taskType(), task.dependencies());
            return false;
        }
        if (workers != null && !workers.isAvailable(task.resources().workerType())) {
            log.debug("  {} [{}] no available worker of type {}",
                    task.id(), task.taskType(), task.resources().workerType());
            return false;
        }
        return true;
    }

    private boolean dependenciesSatisfied(Task task) {
        for (var dep : task.dependencies()) {
            var upstream = store.find(dep.taskId());
            if (upstream.isEmpty() || upstream.get().status() != dep.requiredStatus()) {
                return false;
            }
        }
        return true;
    }

    private Instant readySince(Task task) {
        Instant since = task.createdAt();
        if (task.scheduledFor() != null && task.scheduledFor().isAfter(since)) {
            since = task.scheduledFor();
        }
        for (var dep : task.dependencies()) {
            var upstreamDone = store.find(dep.taskId()).map(Task::completedAt).orElse(null);
            if (upstreamDone != null && upstreamDone.isAfter(since)) {
                since = upstreamDone;
            }
        }
        return since;
    }

    // -- Lifecycle transitions --------------------------------------------------------------

    /**
     * Marks an admitted task as running. Called by the execution engine once it holds a slot.
     */
    public synchronized Task markRunning(String taskId) {
        var task = require(taskId);
        if (task.status() != TaskStatus.SCHEDULED) {
            throw new IllegalStateException("Task " + taskId + " is " + task.status() + ", expected SCHEDULED");
        }
        var running = task.toBuilder().status(TaskStatus.RUNNING).startedAt(clock.instant()).build();
        store.put(running);
        return running;
    }

    public synchronized Task complete(String taskId, Object result) {
        return complete(taskId, result, 0.0);
    }

    /**
     * Moves an admitted task to the completed set.
     *
     * @throws AlreadyFinalizedException if the task is already terminal
     */
    public synchronized Task complete(String taskId, Object result, double cost) {
        var task = requireAdmitted(taskId);
        Instant now = clock.instant();
        var completed = task.toBuilder()
                .status(TaskStatus.COMPLETED)
                .completedAt(now)
                .result(result)
                .actualCost(cost)
                .actualDuration(task.startedAt() != null ? Duration.between(task.startedAt(), now) : Duration.ZERO)
                .build();
        store.put(completed);
        outcomes.recordSuccess(now);
        log.info("Task {} [{}] completed in {}ms", taskId, task.taskType(), completed.actualDuration().toMillis());
        cascade(taskId);
        return completed;
    }

    public synchronized Task fail(String taskId, String error) {
        return fail(taskId, error, 0.0);
    }

    /**
     * Records a failed attempt. While retries remain the task goes back to pending with
     * {@code scheduledFor = now + retryDelay * 2^retryCount} (or a flat {@code retryDelay}
     * without exponential backoff), capped at {@link #MAX_RETRY_DELAY}; otherwise it fails
     * terminally.
     *
     * @throws AlreadyFinalizedException if the task is already terminal
     */
    public synchronized Task fail(String taskId, String error, double cost) {
        var task = requireAdmitted(taskId);
        Instant now = clock.instant();
        outcomes.recordFailure(now);

        if (task.retryCount() < task.maxRetries()) {
            int attempt = task.retryCount() + 1;
            Duration delay = backoff(task.retryDelay(), attempt, task.exponentialBackoff());
            var retrying = task.toBuilder()
                    .status(TaskStatus.RETRYING)
                    .retryCount(attempt)
                    .lastRetryAt(now)
                    .scheduledFor(now.plus(delay))
                    .errorMessage(error)
                    .actualCost(task.actualCost() + cost)
                    .build();
            store.put(retrying);
            log.warn("Task {} [{}] failed ({}), retry {}/{} in {}s",
                    taskId, task.taskType(), error, attempt, task.maxRetries(), delay.toSeconds());
            return retrying;
        }
        return finalizeFailure(task, error, cost, now);
    }

    /**
     * Fails an admitted task terminally, ignoring any remaining retries.
     */
    public synchronized Task failPermanently(String taskId, String error) {
        var task = requireAdmitted(taskId);
        Instant now = clock.instant();
        outcomes.recordFailure(now);
        return finalizeFailure(task, error, 0.0, now);
    }

    private Task finalizeFailure(Task task, String error, double cost, Instant now) {
        var failed = task.toBuilder()
                .status(TaskStatus.FAILED)
                .completedAt(now)
                .errorMessage(error)
                .actualCost(task.actualCost() + cost)
                .build();
        store.put(failed);
        log.warn("Task {} [{}] failed terminally after {} retries: {}",
                task.id(), task.taskType(), task.retryCount(), error);
        cascade(task.id());
        return failed;
    }

    /**
     * Cancels a pending or admitted task.
     *
     * @return false when the task was already terminal
     */
    public synchronized boolean cancel(String taskId, String reason) {
        var task = require(taskId);
        if (task.isTerminal()) {
            return false;
        }
        var cancelled = task.toBuilder()
                .status(TaskStatus.CANCELLED)
                .completedAt(clock.instant())
                .errorMessage(reason)
                .build();
        store.put(cancelled);
        log.info("Task {} [{}] cancelled: {}", taskId, task.taskType(), reason);
        cascade(taskId);
        return true;
    }

    /**
     * Delay before retry number {@code attempt}, never above {@link #MAX_RETRY_DELAY}.
     */
    static Duration backoff(Duration retryDelay, int attempt, boolean exponential) {
        if (!exponential) {
            return retryDelay.compareTo(MAX_RETRY_DELAY) > 0 ? MAX_RETRY_DELAY : retryDelay;
        }
        // Saturate before the shift or the multiplication can overflow.
        if (attempt >= Long.SIZE - 1
                || retryDelay.compareTo(MAX_RETRY_DELAY.dividedBy(1L << attempt)) > 0) {
            return MAX_RETRY_DELAY;
        }
        return retryDelay.multipliedBy(1L << attempt);
    }

    /**
     * Cancels pending dependents whose requirement on the now-terminal task cannot be met.
     */
    private void cascade(String taskId) {
        var upstream = store.find(taskId).orElseThrow();
        for (String dependentId : List.copyOf(store.dependentsOf(taskId))) {
            var dependent = store.find(dependentId).orElse(null);
            if (dependent == null || store.partitionOf(dependentId) != Partition.PENDING) {
                continue;
            }
            boolean blocked = dependent.dependencies().stream()
                    .anyMatch(d -> d.taskId().equals(taskId) && d.requiredStatus() != upstream.status());
            if (blocked) {
                cancel(dependentId, "Dependency " + taskId + " finished " + upstream.status());
            }
        }
    }

    private Task require(String taskId) {
        return store.find(taskId).orElseThrow(() -> new UnknownTaskException("Unknown task: " + taskId));
    }

    private Task requireAdmitted(String taskId) {
        var task = require(taskId);
        if (task.isTerminal()) {
            throw new AlreadyFinalizedException("Task " + taskId + " already finalized as " + task.status());
        }
        if (store.partitionOf(taskId) != Partition.RUNNING) {
            throw new IllegalStateException("Task " + taskId + " has not been admitted (status " + task.status() + ")");
        }
        return task;
    }

    // -- Queries ----------------------------------------------------------------------------

    public synchronized Optional<Task> find(String taskId) {
        return store.find(taskId);
    }

    public synchronized List<Task> tasks() {
        return store.all();
    }

    public synchronized List<Task> pendingTasks() {
        return List.copyOf(store.tasksIn(Partition.PENDING));
    }

    public synchronized int pendingCount() {
        return store.count(Partition.PENDING);
    }

    /** Admitted tasks, both SCHEDULED and RUNNING. */
    public synchronized int runningCount() {
        return store.count(Partition.RUNNING);
    }

    public synchronized int completedCount() {
        return store.count(Partition.COMPLETED);
    }

    public synchronized int failedCount() {
        return store.count(Partition.FAILED);
    }

    public synchronized int cancelledCount() {
        return store.count(Partition.CANCELLED);
    }

    public synchronized boolean isSettled(Collection<String> taskIds) {
        for (String id : taskIds) {
            var task = store.find(id);
            if (task.isPresent() && !task.get().isTerminal()) {
                return false;
            }
        }
        return true;
    }

    public synchronized boolean isIdle() {
        return store.count(Partition.PENDING) == 0 && store.count(Partition.RUNNING) == 0;
    }

    public synchronized List<Task> overdueTasks() {
        Instant now = clock.instant();
        var overdue = new ArrayList<Task>();
        for (var task : store.tasksIn(Partition.PENDING)) {
            if (task.isOverdue(now)) overdue.add(task);
        }
        for (var task : store.tasksIn(Partition.RUNNING)) {
            if (task.isOverdue(now)) overdue.add(task);
        }
        return overdue;
    }

    public synchronized double errorRate() {
        return outcomes.errorRate(clock.instant());
    }

    public synchronized long recentFailures() {
        return outcomes.failures(clock.instant());
    }

    public synchronized long recentSuccesses() {
        return outcomes.successes(clock.instant());
    }

    public synchronized Duration averageQueueWait() {
        return outcomes.averageWait(clock.instant());
    }

    public synchronized Duration maxQueueWait() {
        return outcomes.maxWait(clock.instant());
    }

    public Clock clock() {
        return clock;
    }
}
