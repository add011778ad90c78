package com.newsroom.core.engine;

import com.newsroom.core.MutableClock;
import com.newsroom.core.events.EventBus;
import com.newsroom.core.events.NewsroomEvent;
import com.newsroom.core.logging.MdcContext;
import com.newsroom.core.metrics.NewsroomMetrics;
import com.newsroom.core.model.Task;
import com.newsroom.core.model.TaskOutcome;
import com.newsroom.core.model.TaskPriority;
import com.newsroom.core.model.TaskResource;
import com.newsroom.core.model.TaskStatus;
import com.newsroom.core.scheduler.Scheduler;
import com.newsroom.core.scheduler.TaskIdGenerator;
import com.newsroom.core.worker.WorkerDescriptor;
import com.newsroom.core.worker.WorkerRegistry;
import com.newsroom.core.worker.WorkerStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class ExecutionEngineTest {

    private static final String TYPE = "news_discovery";

    private MutableClock clock;
    private Scheduler scheduler;
    private EngineProperties properties;
    private SimpleMeterRegistry registry;
    private NewsroomMetrics metrics;
    private EventBus eventBus;
    private CountDownLatch release;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T08:00:00Z");
        scheduler = new Scheduler(clock);
        properties = new EngineProperties();
        properties.setMaxConcurrentTasks(3);
        properties.setPollInterval(Duration.ofMillis(10));
        registry = new SimpleMeterRegistry();
        metrics = new NewsroomMetrics(registry);
        eventBus = new EventBus();
        release = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        MDC.clear();
    }

    private ExecutionEngine engine(TaskRouter router) {
        return new ExecutionEngine(scheduler, router, properties, null, null, eventBus, metrics, "RUN-T");
    }

    private static RoutingTable route(TaskHandler handler) {
        return RoutingTable.builder().register(TYPE, handler).build();
    }

    private TaskHandler blockingHandler() {
        return params -> {
            release.await(10, TimeUnit.SECONDS);
            return TaskOutcome.success(params.get("n"));
        };
    }

    private void submit(int count) {
        for (int i = 0; i < count; i++) {
            scheduler.submit(Task.builder(TYPE).id("T" + i).parameters(Map.of("n", i))
                    .maxRetries(0).build());
        }
    }

    @Test
    @DisplayName("rejects a concurrency budget below one")
    void rejectsZeroBudget() {
        properties.setMaxConcurrentTasks(0);
        assertThrows(IllegalArgumentException.class,
                () -> new ExecutionEngine(scheduler, route(params -> TaskOutcome.success(null)), properties));
    }

    @Nested
    @DisplayName("concurrency budget")
    class ConcurrencyBudget {

        @Test
        @DisplayName("never runs more than maxConcurrentTasks at once")
        void runningNeverExceedsBudget() {
            var concurrent = new AtomicInteger();
            var peak = new AtomicInteger();
            TaskHandler handler = params -> {
                peak.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                try {
                    release.await(10, TimeUnit.SECONDS);
                    return TaskOutcome.success(params.get("n"));
                } finally {
                    concurrent.decrementAndGet();
                }
            };
            submit(10);

            try (var engine = engine(route(handler))) {
                assertEquals(3, engine.runOnce());
                assertEquals(3, engine.inFlightCount());
                assertEquals(3, scheduler.runningCount());
                assertEquals(0, engine.runOnce(), "no slot is free while all handlers block");

                release.countDown();
                var overBudget = new AtomicBoolean();
                boolean done = engine.runUntil(() -> {
                    if (scheduler.runningCount() > 3) overBudget.set(true);
                    return scheduler.completedCount() == 10;
                }, Duration.ofSeconds(10));

                assertTrue(done);
                assertFalse(overBudget.get());
                assertTrue(peak.get() <= 3, "peak concurrency " + peak.get());
                assertEquals(0, engine.inFlightCount());
            }
        }

        @Test
        @DisplayName("dispatches in ready order")
        void dispatchesInReadyOrder() {
            properties.setMaxConcurrentTasks(1);
            var order = new CopyOnWriteArrayList<Object>();
            scheduler.submit(Task.builder(TYPE).id("A").parameters(Map.of("n", "A")).build());
            scheduler.submit(Task.builder(TYPE).id("B").parameters(Map.of("n", "B"))
                    .priority(TaskPriority.HIGH).build());
            scheduler.submit(Task.builder(TYPE).id("C").parameters(Map.of("n", "C")).build());

            try (var engine = engine(route(params -> {
                order.add(params.get("n"));
                return TaskOutcome.success(null);
            }))) {
                assertTrue(engine.runUntil(() -> scheduler.completedCount() == 3, Duration.ofSeconds(10)));
            }
            assertEquals(List.of("B", "A", "C"), order);
        }
    }

    @Nested
    @DisplayName("outcomes")
    class Outcomes {

        @Test
        @DisplayName("a success completes the task with its result and cost")
        void successCompletes() {
            scheduler.submit(Task.builder(TYPE).id("A").build());

            try (var engine = engine(route(params -> TaskOutcome.success(Map.of("articles", 12), 0.4)))) {
                assertTrue(engine.runUntil(() -> scheduler.isIdle(), Duration.ofSeconds(10)));
            }

            Task a = scheduler.find("A").orElseThrow();
            assertEquals(TaskStatus.COMPLETED, a.status());
            assertEquals(Map.of("articles", 12), a.result());
            assertEquals(0.4, a.actualCost());
            assertEquals(1.0, registry.get("newsroom.tasks.dispatched").tag("type", TYPE).counter().count());
            assertEquals(1, registry.get("newsroom.task.duration").tag("outcome", "success").timer().count());
        }

        @Test
        @DisplayName("a throwing handler becomes a retryable failure")
        void throwingHandlerIsRetried() {
            var calls = new AtomicInteger();
            scheduler.submit(Task.builder(TYPE).id("A").maxRetries(1).retryDelay(Duration.ZERO).build());

            try (var engine = engine(route(params -> {
                calls.incrementAndGet();
                throw new IllegalStateException("feed unreachable");
            }))) {
                assertTrue(engine.runUntil(() -> scheduler.failedCount() == 1, Duration.ofSeconds(10)));
            }

            Task a = scheduler.find("A").orElseThrow();
            assertEquals(2, calls.get());
            assertEquals(1, a.retryCount());
            assertEquals("feed unreachable", a.errorMessage());
            assertEquals(1.0, registry.get("newsroom.tasks.retries").counter().count());
        }

        @Test
        @DisplayName("an unroutable task fails terminally without retries")
        void unroutableFailsPermanently() {
            scheduler.submit(Task.builder("report_generation").id("R").maxRetries(3).build());

            try (var engine = engine(route(params -> TaskOutcome.success(null)))) {
                assertTrue(engine.runUntil(() -> scheduler.failedCount() == 1, Duration.ofSeconds(10)));
            }

            Task r = scheduler.find("R").orElseThrow();
            assertEquals(TaskStatus.FAILED, r.status());
            assertEquals(0, r.retryCount());
            assertTrue(r.errorMessage().contains("No handler registered for task type: report_generation"));
        }

        @Test
        @DisplayName("publishes task lifecycle events with the handler cost")
        void publishesEvents() {
            var events = new CopyOnWriteArrayList<NewsroomEvent>();
            eventBus.subscribe("RUN-T", events::add);
            scheduler.submit(Task.builder(TYPE).id("A").build());

            try (var engine = engine(route(params -> TaskOutcome.success("ok", 0.02)))) {
                assertTrue(engine.runUntil(() -> scheduler.isIdle(), Duration.ofSeconds(10)));
            }

            assertEquals(List.of("task.started", "task.completed"),
                    events.stream().map(NewsroomEvent::eventType).toList());
            assertEquals(0.02, events.get(1).payload().get("cost"));
            assertEquals(TYPE, events.get(1).payload().get("taskType"));
        }

        @Test
        @DisplayName("handlers run with the caller's MDC plus the task keys")
        void handlersSeeMdc() {
            var seen = new CopyOnWriteArrayList<String>();
            scheduler.submit(Task.builder(TYPE).id("A").build());
            MdcContext.setRun("RUN-2026-0001");

            try (var engine = engine(route(params -> {
                seen.add(MDC.get(MdcContext.RUN_ID));
                seen.add(MDC.get(MdcContext.TASK_ID));
                seen.add(MDC.get(MdcContext.TASK_TYPE));
                return TaskOutcome.success(null);
            }))) {
                assertTrue(engine.runUntil(() -> scheduler.isIdle(), Duration.ofSeconds(10)));
            }

            assertEquals(List.of("RUN-2026-0001", "A", TYPE), seen);
        }
    }

    @Nested
    @DisplayName("timeouts and cancellation")
    class TimeoutsAndCancellation {

        @Test
        @DisplayName("a task past its deadline fails with timeout and frees its slot")
        void timeoutFreesSlot() {
            properties.setDefaultTaskTimeout(Duration.ofMinutes(1));
            submit(1);

            try (var engine = engine(route(blockingHandler()))) {
                assertEquals(1, engine.runOnce());
                clock.advance(Duration.ofSeconds(61));
                engine.runOnce();

                assertEquals(0, engine.inFlightCount());
            }

            Task t = scheduler.find("T0").orElseThrow();
            assertEquals(TaskStatus.FAILED, t.status());
            assertEquals(ExecutionEngine.TIMEOUT_ERROR, t.errorMessage());
            assertEquals(1.0, registry.get("newsroom.tasks.timeouts").counter().count());
        }

        @Test
        @DisplayName("an explicit task deadline overrides the default timeout")
        void explicitDeadline() {
            scheduler.submit(Task.builder(TYPE).id("A").maxRetries(0)
                    .deadline(clock.instant().plusSeconds(5)).build());

            try (var engine = engine(route(blockingHandler()))) {
                engine.runOnce();
                clock.advance(Duration.ofSeconds(5));
                engine.runOnce();
            }

            assertEquals(ExecutionEngine.TIMEOUT_ERROR, scheduler.find("A").orElseThrow().errorMessage());
        }

        @Test
        @DisplayName("cancel stops admission and times out stragglers after the grace period")
        void cancelWithGrace() {
            properties.setMaxConcurrentTasks(2);
            properties.setCancellationGrace(Duration.ofSeconds(5));
            submit(3);

            try (var engine = engine(route(blockingHandler()))) {
                assertEquals(2, engine.runOnce());
                engine.cancel();
                assertTrue(engine.isCancelled());

                assertEquals(0, engine.runOnce());
                assertEquals(2, engine.inFlightCount());
                assertEquals(1, scheduler.pendingCount());

                clock.advance(Duration.ofSeconds(5));
                engine.runOnce();
                assertEquals(0, engine.inFlightCount());
            }
            assertEquals(2, scheduler.failedCount());
        }

        @Test
        @DisplayName("a task cancelled on the scheduler while running releases its slot")
        void schedulerCancelReleasesSlot() {
            properties.setMaxConcurrentTasks(1);
            submit(2);

            try (var engine = engine(route(blockingHandler()))) {
                engine.runOnce();
                assertEquals(List.of("T0"), engine.inFlightTaskIds());

                scheduler.cancel("T0", "run aborted");
                assertEquals(1, engine.runOnce(), "the freed slot admits the next task");
                assertEquals(List.of("T1"), engine.inFlightTaskIds());
            }
            assertEquals(TaskStatus.CANCELLED, scheduler.find("T0").orElseThrow().status());
        }

        @Test
        @DisplayName("an overdue task is reported once and forgotten when it settles")
        void overdueReportedOnce() {
            scheduler.submit(Task.builder(TYPE).id("A").deadline(clock.instant().plusSeconds(5)).build());

            try (var engine = new ExecutionEngine(scheduler, route(params -> TaskOutcome.success(null)),
                    properties, () -> false, null, eventBus, metrics, null)) {
                engine.runOnce();
                assertEquals(0, engine.reportedOverdueCount());

                clock.advance(Duration.ofSeconds(6));
                engine.runOnce();
                engine.runOnce();
                assertEquals(1, engine.reportedOverdueCount());

                scheduler.cancel("A", "deadline missed");
                engine.runOnce();
                assertEquals(0, engine.reportedOverdueCount());
            }
        }
    }

    @Nested
    @DisplayName("scheduler errors")
    class SchedulerErrors {

        @Test
        @DisplayName("an outcome the scheduler cannot record fails the task and frees its slot")
        void unrecordableOutcome() {
            var events = new CopyOnWriteArrayList<NewsroomEvent>();
            eventBus.subscribe("RUN-T", events::add);
            scheduler = spy(scheduler);
            doThrow(new IllegalStateException("store unavailable"))
                    .when(scheduler).complete(eq("A"), any(), anyDouble());
            scheduler.submit(Task.builder(TYPE).id("A").maxRetries(3).build());

            try (var engine = engine(route(params -> TaskOutcome.success("ok")))) {
                assertTrue(engine.runUntil(() -> scheduler.failedCount() == 1, Duration.ofSeconds(10)));
                assertEquals(0, engine.inFlightCount());
            }

            Task a = scheduler.find("A").orElseThrow();
            assertEquals(TaskStatus.FAILED, a.status());
            assertEquals("Engine error: store unavailable", a.errorMessage());
            assertEquals(0, scheduler.runningCount());
            assertEquals("task.failed", events.get(events.size() - 1).eventType());
        }

        @Test
        @DisplayName("a timeout the scheduler cannot record still settles the task")
        void unrecordableTimeout() {
            properties.setDefaultTaskTimeout(Duration.ofMinutes(1));
            scheduler = spy(scheduler);
            doThrow(new IllegalStateException("store unavailable"))
                    .when(scheduler).fail(eq("T0"), eq(ExecutionEngine.TIMEOUT_ERROR));
            submit(1);

            try (var engine = engine(route(blockingHandler()))) {
                engine.runOnce();
                clock.advance(Duration.ofSeconds(61));
                engine.runOnce();
                assertEquals(0, engine.inFlightCount());
            }

            assertEquals(TaskStatus.FAILED, scheduler.find("T0").orElseThrow().status());
        }

        @Test
        @DisplayName("the background loop survives a failing iteration")
        void loopSurvivesFailure() throws InterruptedException {
            var done = new CountDownLatch(1);
            scheduler = spy(scheduler);
            doThrow(new IllegalStateException("store unavailable"))
                    .doCallRealMethod()
                    .when(scheduler).overdueTasks();
            submit(1);

            try (var engine = engine(route(params -> {
                done.countDown();
                return TaskOutcome.success(null);
            }))) {
                engine.start();
                assertTrue(done.await(10, TimeUnit.SECONDS));
            }
        }
    }

    @Nested
    @DisplayName("admission")
    class Admission {

        @Test
        @DisplayName("a closed admission gate dispatches nothing")
        void closedGate() {
            submit(2);
            var open = new AtomicBoolean(false);

            try (var engine = new ExecutionEngine(scheduler, route(params -> TaskOutcome.success(null)),
                    properties, open::get, null, eventBus, metrics, null)) {
                assertEquals(0, engine.runOnce());
                assertEquals(2, scheduler.pendingCount());
                assertEquals(1.0, registry.get("newsroom.admission.paused").counter().count());

                open.set(true);
                assertTrue(engine.runUntil(() -> scheduler.completedCount() == 2, Duration.ofSeconds(10)));
            }
        }

        @Test
        @DisplayName("acquires and releases the registered worker of the task's type")
        void workerLoadFollowsDispatch() {
            var workers = new WorkerRegistry(clock);
            workers.register(WorkerDescriptor.online("relay-1", "mail", 1, clock.instant()));
            scheduler = new Scheduler(new TaskIdGenerator(), workers, clock);
            for (String id : List.of("M1", "M2")) {
                scheduler.submit(Task.builder(TYPE).id(id)
                        .resources(new TaskResource("mail", Duration.ofMinutes(1), 0.0, 1)).build());
            }

            try (var engine = new ExecutionEngine(scheduler, route(blockingHandler()), properties,
                    null, workers, eventBus, metrics, null)) {
                assertEquals(1, engine.runOnce(), "the only relay has capacity for one task");
                var busy = workers.find("relay-1").orElseThrow();
                assertEquals(1, busy.currentTaskCount());
                assertEquals(WorkerStatus.BUSY, busy.status());

                release.countDown();
                assertTrue(engine.runUntil(() -> scheduler.completedCount() == 2, Duration.ofSeconds(10)));
            }

            var idle = workers.find("relay-1").orElseThrow();
            assertEquals(0, idle.currentTaskCount());
            assertEquals(2, idle.tasksCompleted());
            assertEquals(WorkerStatus.ONLINE, idle.status());
        }
    }

    @Test
    @DisplayName("start runs the loop in the background until closed")
    void backgroundLoop() throws InterruptedException {
        var done = new CountDownLatch(3);
        submit(3);

        try (var engine = engine(route(params -> {
            done.countDown();
            return TaskOutcome.success(null);
        }))) {
            engine.start();
            assertThrows(IllegalStateException.class, engine::start);
            assertTrue(done.await(10, TimeUnit.SECONDS));
        }
    }
}
