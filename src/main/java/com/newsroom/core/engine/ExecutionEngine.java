package com.newsroom.core.engine;

import com.newsroom.core.events.EventBus;
import com.newsroom.core.events.NewsroomEvent;
import com.newsroom.core.logging.MdcContext;
import com.newsroom.core.metrics.NewsroomMetrics;
import com.newsroom.core.model.ErrorKind;
import com.newsroom.core.model.Task;
import com.newsroom.core.model.TaskOutcome;
import com.newsroom.core.model.TaskStatus;
import com.newsroom.core.scheduler.AlreadyFinalizedException;
import com.newsroom.core.scheduler.Scheduler;
import com.newsroom.core.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Drives tasks from the {@link Scheduler} through a {@link TaskRouter} under a fixed
 * concurrency budget.
 * <p>
 * Each {@link #runOnce()} iteration processes finished dispatches, times out in-flight tasks
 * past their deadline, and admits up to {@code maxConcurrentTasks - inFlight} ready tasks
 * unless the engine is cancelled or the {@link AdmissionGate} is closed. Handlers run on a
 * fixed worker pool and report back through a completion queue; only the loop thread touches
 * the scheduler.
 */
public class ExecutionEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String TIMEOUT_ERROR = "timeout";

    private record InFlight(Task task, FutureTask<Void> future, Instant deadline, String workerId) {}

    private record Completion(String taskId, TaskOutcome outcome, Duration elapsed) {}

    private final Scheduler scheduler;
    private final TaskRouter router;
    private final EngineProperties properties;
    private final AdmissionGate admissionGate;
    private final WorkerRegistry workers;
    private final EventBus eventBus;
    private final NewsroomMetrics metrics;
    private final String runId;

    private final ExecutorService pool;
    private final LinkedBlockingDeque<Completion> completions = new LinkedBlockingDeque<>();
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private final Set<String> reportedOverdue = new HashSet<>();

    private volatile boolean cancelled;
    private volatile Instant cancelledAt;
    private volatile boolean stopped;
    private Thread loopThread;

    public ExecutionEngine(Scheduler scheduler, TaskRouter router, EngineProperties properties,
                           AdmissionGate admissionGate, WorkerRegistry workers,
                           EventBus eventBus, NewsroomMetrics metrics, String runId) {
        if (properties.getMaxConcurrentTasks() < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be at least 1");
        }
        this.scheduler = scheduler;
        this.router = router;
        this.properties = properties;
        this.admissionGate = admissionGate != null ? admissionGate : AdmissionGate.ALWAYS_OPEN;
        this.workers = workers;
        this.eventBus = eventBus != null ? eventBus : new EventBus();
        this.metrics = metrics;
        this.runId = runId;
        this.pool = Executors.newFixedThreadPool(properties.effectiveWorkerThreads(), workerThreadFactory(runId));
    }

    public ExecutionEngine(Scheduler scheduler, TaskRouter router, EngineProperties properties) {
        this(scheduler, router, properties, null, null, null, null, null);
    }

    private static ThreadFactory workerThreadFactory(String runId) {
        var counter = new AtomicInteger();
        String prefix = runId != null ? "worker-" + runId + "-" : "worker-";
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // -- Loop -------------------------------------------------------------------------------

    /**
     * One iteration of the execution loop.
     *
     * @return the number of tasks dispatched in this iteration
     */
    public synchronized int runOnce() {
        drainCompletions();
        reapCancelled();
        Instant now = scheduler.clock().instant();
        applyTimeouts(now);
        if (cancelled && !inFlight.isEmpty()
                && !now.isBefore(cancelledAt.plus(properties.getCancellationGrace()))) {
            log.warn("Cancellation grace elapsed, timing out {} in-flight task(s)", inFlight.size());
            for (String taskId : List.copyOf(inFlight.keySet())) {
                timeOut(taskId);
            }
        }
        reportOverdue();
        return admit(now);
    }

    private void drainCompletions() {
        Completion completion;
        while ((completion = completions.poll()) != null) {
            InFlight flight = inFlight.remove(completion.taskId());
            if (flight == null) {
                log.debug("Late completion for {} ignored, task already finalized", completion.taskId());
                continue;
            }
            finish(flight, completion.outcome(), completion.elapsed());
        }
    }

    private void finish(InFlight flight, TaskOutcome outcome, Duration elapsed) {
        Task task = flight.task();
        if (outcome == null) {
            outcome = TaskOutcome.failure("Handler returned no outcome");
        }
        releaseWorker(flight, outcome.success(), outcome.error());
        try {
            if (outcome.success()) {
                scheduler.complete(task.id(), outcome.result(), outcome.cost());
                recordDuration(task, "success", elapsed);
                publish("task.completed", task, Map.of("cost", outcome.cost()));
            } else if (outcome.kind() == ErrorKind.UNROUTABLE) {
                scheduler.failPermanently(task.id(), outcome.error());
                recordDuration(task, "unroutable", elapsed);
                publish("task.failed", task, Map.of("error", String.valueOf(outcome.error()), "retrying", false, "cost", outcome.cost()));
            } else {
                Task after = scheduler.fail(task.id(), outcome.error(), outcome.cost());
                boolean retrying = after.status() == TaskStatus.RETRYING;
                if (retrying && metrics != null) {
                    metrics.recordRetry(task.taskType());
                }
                recordDuration(task, "failure", elapsed);
                publish("task.failed", task, Map.of("error", String.valueOf(outcome.error()), "retrying", retrying, "cost", outcome.cost()));
            }
        } catch (AlreadyFinalizedException e) {
            log.debug("Task {} finalized while running: {}", task.id(), e.getMessage());
        } catch (RuntimeException e) {
            failAfterEngineError(task, e);
        }
    }

    /**
     * Fails a task whose outcome could not be applied, so it does not stay in the running
     * partition after its slot was released.
     */
    private void failAfterEngineError(Task task, RuntimeException cause) {
        log.error("Could not record outcome of task {} [{}]", task.id(), task.taskType(), cause);
        String error = "Engine error: " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        try {
            scheduler.failPermanently(task.id(), error);
        } catch (AlreadyFinalizedException e) {
            log.debug("Task {} already finalized: {}", task.id(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Could not fail task {} after engine error", task.id(), e);
            return;
        }
        publish("task.failed", task, Map.of("error", error, "retrying", false));
    }

    /** Frees slots held by tasks cancelled through the scheduler while their handler was running. */
    private void reapCancelled() {
        for (var flight : List.copyOf(inFlight.values())) {
            var current = scheduler.find(flight.task().id());
            if (current.isPresent() && current.get().isTerminal()) {
                inFlight.remove(flight.task().id());
                flight.future().cancel(true);
                releaseWorker(flight, false, "cancelled");
                log.info("Released slot of cancelled task {} [{}]", flight.task().id(), flight.task().taskType());
            }
        }
    }

    private void applyTimeouts(Instant now) {
        for (var flight : List.copyOf(inFlight.values())) {
            if (!now.isBefore(flight.deadline())) {
                timeOut(flight.task().id());
            }
        }
    }

    private void timeOut(String taskId) {
        InFlight flight = inFlight.remove(taskId);
        if (flight == null) {
            return;
        }
        flight.future().cancel(true);
        releaseWorker(flight, false, TIMEOUT_ERROR);
        Task task = flight.task();
        log.warn("Task {} [{}] timed out at {}", task.id(), task.taskType(), flight.deadline());
        if (metrics != null) {
            metrics.recordTimeout(task.taskType());
        }
        try {
            Task after = scheduler.fail(task.id(), TIMEOUT_ERROR);
            publish("task.timeout", task, Map.of("retrying", after.status() == TaskStatus.RETRYING));
        } catch (AlreadyFinalizedException e) {
            log.debug("Task {} finalized before timeout: {}", task.id(), e.getMessage());
        } catch (RuntimeException e) {
            failAfterEngineError(task, e);
        }
    }

    private void reportOverdue() {
        List<Task> overdue = scheduler.overdueTasks();
        // Finalized and cancelled tasks drop out of the overdue list, and out of this set with them.
        reportedOverdue.retainAll(overdue.stream().map(Task::id).collect(Collectors.toSet()));
        for (Task task : overdue) {
            if (reportedOverdue.add(task.id())) {
                log.warn("Task {} [{}] is overdue: deadline {} passed, status {}",
                        task.id(), task.taskType(), task.deadline(), task.status());
            }
        }
    }

    int reportedOverdueCount() {
        return reportedOverdue.size();
    }

    private int admit(Instant now) {
        if (cancelled) {
            return 0;
        }
        if (!admissionGate.isAdmitting()) {
            log.debug("Admission paused by health gate, {} in flight", inFlight.size());
            if (metrics != null) {
                metrics.recordAdmissionPaused();
            }
            return 0;
        }
        int free = properties.getMaxConcurrentTasks() - inFlight.size();
        if (free <= 0) {
            return 0;
        }
        List<Task> ready = scheduler.readyTasks(free);
        for (Task task : ready) {
            dispatch(task, now);
        }
        return ready.size();
    }

    private void dispatch(Task admitted, Instant now) {
        Task task = scheduler.markRunning(admitted.id());
        Instant deadline = task.deadline() != null ? task.deadline() : now.plus(properties.getDefaultTaskTimeout());
        String workerId = null;
        if (workers != null && task.resources().workerType() != null) {
            workerId = workers.acquire(task.resources().workerType()).orElse(null);
        }

        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        var future = new FutureTask<Void>(() -> execute(task, callerContext), null);
        inFlight.put(task.id(), new InFlight(task, future, deadline, workerId));

        log.info("Dispatching task {} [{}] priority={} deadline={}",
                task.id(), task.taskType(), task.priority(), deadline);
        if (metrics != null) {
            metrics.recordDispatch(task.taskType());
            Instant readySince = task.scheduledFor() != null && task.scheduledFor().isAfter(task.createdAt())
                    ? task.scheduledFor() : task.createdAt();
            metrics.recordQueueWait(Duration.between(readySince, now).abs());
        }
        publish("task.started", task, Map.of("priority", task.priority().name()));
        pool.execute(future);
    }

    private void execute(Task task, Map<String, String> callerContext) {
        if (callerContext != null) {
            MDC.setContextMap(callerContext);
        }
        MdcContext.setTask(task.id(), task.taskType());
        long startNanos = System.nanoTime();
        TaskOutcome outcome;
        try {
            outcome = router.route(task.taskType(), task.parameters());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = TaskOutcome.failure(ErrorKind.CANCELLED, "interrupted");
        } catch (Exception e) {
            log.warn("Handler for {} [{}] threw: {}", task.id(), task.taskType(), e.getMessage(), e);
            outcome = TaskOutcome.failure(ErrorKind.HANDLER,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            MDC.clear();
        }
        completions.add(new Completion(task.id(), outcome, Duration.ofNanos(System.nanoTime() - startNanos)));
    }

    private void releaseWorker(InFlight flight, boolean success, String error) {
        if (workers != null && flight.workerId() != null) {
            workers.release(flight.workerId(), success, error);
        }
    }

    private void recordDuration(Task task, String outcome, Duration elapsed) {
        if (metrics != null) {
            metrics.recordTaskDuration(task.taskType(), outcome, elapsed);
        }
    }

    private void publish(String eventType, Task task, Map<String, Object> extra) {
        var payload = new HashMap<String, Object>(extra);
        payload.put("taskType", task.taskType());
        payload.put("name", task.name());
        eventBus.publish(new NewsroomEvent(eventType, runId, task.id(), payload, scheduler.clock().instant()));
    }

    // -- Drivers ----------------------------------------------------------------------------

    /**
     * Drives the loop in the calling thread until {@code condition} holds or {@code timeout}
     * of wall time passes. Wakes early whenever a handler finishes.
     *
     * @return true if the condition was met
     */
    public boolean runUntil(BooleanSupplier condition, Duration timeout) {
        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        while (true) {
            runOnce();
            if (condition.getAsBoolean()) {
                return true;
            }
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0 || stopped) {
                return false;
            }
            try {
                awaitCompletion(Math.min(remaining, properties.getPollInterval().toNanos()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private void runOnceSafely() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Execution engine iteration failed", e);
        }
    }

    private void awaitCompletion(long nanos) throws InterruptedException {
        Completion next = completions.poll(nanos, TimeUnit.NANOSECONDS);
        if (next != null) {
            completions.putFirst(next);
        }
    }

    /**
     * Runs the loop on a dedicated thread until {@link #cancel()} and in-flight work drains,
     * or until {@link #close()}.
     */
    public synchronized void start() {
        if (loopThread != null) {
            throw new IllegalStateException("Engine already started");
        }
        loopThread = new Thread(this::loop, runId != null ? "engine-" + runId : "engine");
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("Execution engine started: maxConcurrentTasks={} workerThreads={}",
                properties.getMaxConcurrentTasks(), properties.effectiveWorkerThreads());
    }

    private void loop() {
        while (!stopped) {
            runOnceSafely();
            if (cancelled && inFlight.isEmpty()) {
                break;
            }
            try {
                awaitCompletion(properties.getPollInterval().toNanos());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Execution engine loop exited");
    }

    /**
     * Stops admission. In-flight tasks may finish within the cancellation grace period, after
     * which they are timed out.
     */
    public void cancel() {
        if (!cancelled) {
            cancelledAt = scheduler.clock().instant();
            cancelled = true;
            log.info("Execution engine cancelled, {} task(s) in flight", inFlight.size());
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public List<String> inFlightTaskIds() {
        return new ArrayList<>(inFlight.keySet());
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        cancel();
        stopped = true;
        Thread thread;
        synchronized (this) {
            thread = loopThread;
        }
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
