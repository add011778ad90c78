package com.newsroom.core.scheduler;

import com.newsroom.core.MutableClock;
import com.newsroom.core.model.Task;
import com.newsroom.core.model.TaskDependency;
import com.newsroom.core.model.TaskPriority;
import com.newsroom.core.model.TaskResource;
import com.newsroom.core.model.TaskStatus;
import com.newsroom.core.worker.WorkerDescriptor;
import com.newsroom.core.worker.WorkerRegistry;
import com.newsroom.core.worker.WorkerStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private MutableClock clock;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T08:00:00Z");
        scheduler = new Scheduler(clock);
    }

    private static Task.Builder task(String id) {
        return Task.builder("news_discovery").id(id).name(id);
    }

    private List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }

    @Nested
    @DisplayName("submit")
    class Submit {

        @Test
        @DisplayName("accepted tasks are pending with a creation time and sequence")
        void acceptedTasksArePending() {
            Task a = scheduler.submit(task("A").build());
            Task b = scheduler.submit(task("B").build());

            assertEquals(TaskStatus.PENDING, a.status());
            assertEquals(clock.instant(), a.createdAt());
            assertTrue(b.sequence() > a.sequence());
            assertEquals(2, scheduler.pendingCount());
        }

        @Test
        @DisplayName("generates an id when none is given")
        void generatesId() {
            Task t = scheduler.submit(Task.builder("content_analysis").build());
            assertEquals("TASK-000001", t.id());
        }

        @Test
        @DisplayName("rejects a duplicate id")
        void rejectsDuplicateId() {
            scheduler.submit(task("A").build());
            assertThrows(InvalidTaskException.class, () -> scheduler.submit(task("A").build()));
        }

        @Test
        @DisplayName("rejects negative max retries")
        void rejectsNegativeMaxRetries() {
            var ex = assertThrows(InvalidTaskException.class,
                    () -> scheduler.submit(task("A").maxRetries(-1).build()));
            assertTrue(ex.getMessage().contains("negative max retries"));
        }

        @Test
        @DisplayName("rejects a missing priority")
        void rejectsMissingPriority() {
            assertThrows(InvalidTaskException.class,
                    () -> scheduler.submit(task("A").priority(null).build()));
        }

        @Test
        @DisplayName("rejects a blank task type")
        void rejectsBlankTaskType() {
            assertThrows(InvalidTaskException.class,
                    () -> scheduler.submit(Task.builder(" ").id("A").build()));
        }

        @Test
        @DisplayName("rejects a dependency on an unknown task")
        void rejectsUnknownDependency() {
            var ex = assertThrows(InvalidTaskException.class,
                    () -> scheduler.submit(task("B").dependsOn("missing").build()));
            assertTrue(ex.getMessage().contains("unknown task missing"));
        }

        @Test
        @DisplayName("rejects a self dependency")
        void rejectsSelfDependency() {
            assertThrows(InvalidTaskException.class,
                    () -> scheduler.submit(task("A").dependsOn("A").build()));
        }

        @Test
        @DisplayName("rejects a non-terminal required status")
        void rejectsNonTerminalRequiredStatus() {
            scheduler.submit(task("A").build());
            var dep = new TaskDependency("A", TaskStatus.RUNNING, null, null);
            assertThrows(InvalidTaskException.class,
                    () -> scheduler.submit(task("B").dependsOn(dep).build()));
        }

        @Test
        @DisplayName("a cycle inside a batch rejects the whole batch")
        void cycleRejectsBatch() {
            var a = task("A").dependsOn("C").build();
            var b = task("B").dependsOn("A").build();
            var c = task("C").dependsOn("B").build();

            assertThrows(InvalidTaskException.class, () -> scheduler.submitAll(List.of(a, b, c)));
            assertEquals(0, scheduler.pendingCount());
            assertTrue(scheduler.tasks().isEmpty());
        }

        @Test
        @DisplayName("one invalid task rejects the whole batch")
        void invalidTaskRejectsBatch() {
            var good = task("A").build();
            var bad = task("B").maxRetries(-2).build();

            assertThrows(InvalidTaskException.class, () -> scheduler.submitAll(List.of(good, bad)));
            assertTrue(scheduler.find("A").isEmpty());
        }

        @Test
        @DisplayName("dependencies may point at tasks of the same batch")
        void dependenciesWithinBatch() {
            var accepted = scheduler.submitAll(List.of(
                    task("B").dependsOn("A").build(),
                    task("A").build()));
            assertEquals(List.of("B", "A"), ids(accepted));
        }
    }

    @Nested
    @DisplayName("readyTasks")
    class ReadyTasks {

        @Test
        @DisplayName("a dependent is not ready until its dependency completes")
        void dependencyGating() {
            scheduler.submit(task("A").build());
            scheduler.submit(task("B").dependsOn("A").build());

            assertEquals(List.of("A"), ids(scheduler.readyTasks()));
            assertTrue(scheduler.readyTasks().isEmpty(), "B must wait while A runs");

            scheduler.complete("A", "done");
            assertEquals(List.of("B"), ids(scheduler.readyTasks()));
        }

        @Test
        @DisplayName("orders by priority, then scheduled time, then submission order")
        void priorityThenFifo() {
            scheduler.submit(task("A").priority(TaskPriority.NORMAL).build());
            scheduler.submit(task("B").priority(TaskPriority.HIGH).build());
            scheduler.submit(task("C").priority(TaskPriority.NORMAL).build());

            assertEquals(List.of("B", "A", "C"), ids(scheduler.readyTasks()));
        }

        @Test
        @DisplayName("an earlier scheduled time goes first within a priority")
        void earlierScheduledTimeFirst() {
            scheduler.submit(task("A").build());
            scheduler.submit(task("B").scheduledFor(clock.instant().minusSeconds(30)).build());

            assertEquals(List.of("B", "A"), ids(scheduler.readyTasks()));
        }

        @Test
        @DisplayName("a task scheduled in the future is held back")
        void futureScheduledTaskHeldBack() {
            scheduler.submit(task("A").scheduledFor(clock.instant().plusSeconds(60)).build());

            assertTrue(scheduler.readyTasks().isEmpty());
            clock.advance(Duration.ofSeconds(60));
            assertEquals(List.of("A"), ids(scheduler.readyTasks()));
        }

        @Test
        @DisplayName("returned tasks are SCHEDULED and leave the pending set")
        void returnedTasksAreScheduled() {
            scheduler.submit(task("A").build());

            Task a = scheduler.readyTasks().get(0);
            assertEquals(TaskStatus.SCHEDULED, a.status());
            assertEquals(0, scheduler.pendingCount());
            assertEquals(1, scheduler.runningCount());
        }

        @Test
        @DisplayName("with a limit, the remaining ready tasks stay pending")
        void limitLeavesRestPending() {
            scheduler.submit(task("A").build());
            scheduler.submit(task("B").build());
            scheduler.submit(task("C").build());

            assertEquals(List.of("A"), ids(scheduler.readyTasks(1)));
            assertEquals(2, scheduler.pendingCount());
            assertEquals(List.of("B", "C"), ids(scheduler.readyTasks(5)));
            assertTrue(scheduler.readyTasks(0).isEmpty());
        }

        @Test
        @DisplayName("a dependency requiring FAILED is satisfied by a terminal failure")
        void requiredFailedStatus() {
            scheduler.submit(task("A").maxRetries(0).build());
            scheduler.submit(task("cleanup")
                    .dependsOn(new TaskDependency("A", TaskStatus.FAILED, "on-failure", null)).build());

            scheduler.readyTasks();
            scheduler.fail("A", "boom");

            assertEquals(List.of("cleanup"), ids(scheduler.readyTasks()));
        }

        @Test
        @DisplayName("records queue wait from the moment a task became ready")
        void recordsQueueWait() {
            scheduler.submit(task("A").build());
            clock.advance(Duration.ofSeconds(90));
            scheduler.readyTasks();

            assertEquals(Duration.ofSeconds(90), scheduler.averageQueueWait());
            assertEquals(Duration.ofSeconds(90), scheduler.maxQueueWait());
        }
    }

    @Nested
    @DisplayName("worker availability")
    class WorkerAvailability {

        private WorkerRegistry workers;

        @BeforeEach
        void setUp() {
            workers = new WorkerRegistry(clock);
            scheduler = new Scheduler(new TaskIdGenerator(), workers, clock);
        }

        private Task mailTask(String id) {
            return Task.builder("email_delivery").id(id)
                    .resources(new TaskResource("mail", Duration.ofMinutes(1), 0.0, 1)).build();
        }

        @Test
        @DisplayName("an unregistered worker type does not constrain admission")
        void unregisteredTypeIsAvailable() {
            scheduler.submit(mailTask("M1"));
            assertEquals(1, scheduler.readyTasks().size());
        }

        @Test
        @DisplayName("holds back tasks whose registered workers are all offline")
        void offlineWorkersHoldBack() {
            workers.register(WorkerDescriptor.online("relay-1", "mail", 2, clock.instant()));
            workers.updateStatus("relay-1", WorkerStatus.OFFLINE);
            scheduler.submit(mailTask("M1"));
            scheduler.submit(task("A").build());

            assertEquals(List.of("A"), ids(scheduler.readyTasks()));

            workers.updateStatus("relay-1", WorkerStatus.ONLINE);
            assertEquals(List.of("M1"), ids(scheduler.readyTasks()));
        }
    }

    @Nested
    @DisplayName("complete")
    class Complete {

        @Test
        @DisplayName("stores result, cost and duration")
        void storesResult() {
            scheduler.submit(task("A").build());
            scheduler.readyTasks();
            scheduler.markRunning("A");
            clock.advance(Duration.ofSeconds(3));

            Task done = scheduler.complete("A", "report.html", 0.25);

            assertEquals(TaskStatus.COMPLETED, done.status());
            assertEquals("report.html", done.result());
            assertEquals(0.25, done.actualCost());
            assertEquals(Duration.ofSeconds(3), done.actualDuration());
            assertEquals(1, scheduler.completedCount());
        }

        @Test
        @DisplayName("completing twice throws and leaves statistics unchanged")
        void completeTwiceThrows() {
            scheduler.submit(task("A").build());
            scheduler.readyTasks();
            scheduler.complete("A", "first");

            assertThrows(AlreadyFinalizedException.class, () -> scheduler.complete("A", "second"));
            assertEquals(1, scheduler.completedCount());
            assertEquals(1, scheduler.recentSuccesses());
            assertEquals(0.0, scheduler.errorRate());
            assertEquals("first", scheduler.find("A").orElseThrow().result());
        }

        @Test
        @DisplayName("rejects a task that was never admitted")
        void rejectsUnadmittedTask() {
            scheduler.submit(task("A").build());
            assertThrows(IllegalStateException.class, () -> scheduler.complete("A", "x"));
        }

        @Test
        @DisplayName("rejects an unknown id")
        void rejectsUnknownId() {
            assertThrows(UnknownTaskException.class, () -> scheduler.complete("nope", "x"));
        }

        @Test
        @DisplayName("markRunning requires a scheduled task")
        void markRunningRequiresScheduled() {
            scheduler.submit(task("A").build());
            assertThrows(IllegalStateException.class, () -> scheduler.markRunning("A"));

            scheduler.readyTasks();
            Task running = scheduler.markRunning("A");
            assertEquals(TaskStatus.RUNNING, running.status());
            assertEquals(clock.instant(), running.startedAt());
        }
    }

    @Nested
    @DisplayName("fail and retry")
    class FailAndRetry {

        /** Fails the task {@code times} times, re-admitting it whenever it is eligible again. */
        private Task failRepeatedly(String id, int times) {
            Task last = null;
            for (int i = 0; i < times; i++) {
                var found = scheduler.find(id).orElseThrow();
                if (found.isTerminal()) {
                    break;
                }
                if (found.scheduledFor() != null) {
                    clock.set(found.scheduledFor());
                }
                assertEquals(List.of(id), ids(scheduler.readyTasks()));
                last = scheduler.fail(id, "attempt " + (i + 1) + " failed");
            }
            return last;
        }

        @ParameterizedTest(name = "{0} failure(s)")
        @ValueSource(ints = {1, 2, 3, 4, 6})
        @DisplayName("retry count is min(failures, maxRetries)")
        void retryCountIsBounded(int failures) {
            int maxRetries = 3;
            scheduler.submit(task("A").maxRetries(maxRetries).retryDelay(Duration.ofSeconds(5)).build());

            failRepeatedly("A", failures);

            Task a = scheduler.find("A").orElseThrow();
            assertEquals(Math.min(failures, maxRetries), a.retryCount());
            if (failures > maxRetries) {
                assertEquals(TaskStatus.FAILED, a.status());
                assertEquals(1, scheduler.failedCount());
            } else {
                assertEquals(TaskStatus.RETRYING, a.status());
                assertEquals(1, scheduler.pendingCount());
            }
        }

        @Test
        @DisplayName("exponential backoff schedules the k-th retry at fail time + delay * 2^k")
        void exponentialBackoff() {
            Duration delay = Duration.ofSeconds(10);
            scheduler.submit(task("A").maxRetries(3).retryDelay(delay).exponentialBackoff(true).build());

            for (int k = 1; k <= 3; k++) {
                Task current = scheduler.find("A").orElseThrow();
                if (current.scheduledFor() != null) {
                    clock.set(current.scheduledFor());
                }
                scheduler.readyTasks();
                clock.advance(Duration.ofSeconds(1));
                Instant failTime = clock.instant();

                Task retrying = scheduler.fail("A", "boom");

                assertEquals(k, retrying.retryCount());
                assertEquals(failTime, retrying.lastRetryAt());
                assertEquals(failTime.plus(delay.multipliedBy(1L << k)), retrying.scheduledFor());
            }
        }

        @Test
        @DisplayName("exponential backoff grows monotonically and saturates at the cap")
        void backoffSaturates() {
            scheduler.submit(task("A").maxRetries(70).retryDelay(Duration.ofNanos(1)).exponentialBackoff(true).build());

            Duration previous = Duration.ZERO;
            for (int k = 1; k <= 70; k++) {
                Task current = scheduler.find("A").orElseThrow();
                if (current.scheduledFor() != null) {
                    clock.set(current.scheduledFor());
                }
                scheduler.readyTasks();
                Instant failTime = clock.instant();

                Task retrying = scheduler.fail("A", "boom");

                Duration delay = Duration.between(failTime, retrying.scheduledFor());
                assertFalse(delay.isNegative(), "attempt " + k);
                assertTrue(delay.compareTo(previous) >= 0, "attempt " + k);
                assertTrue(delay.compareTo(Scheduler.MAX_RETRY_DELAY) <= 0, "attempt " + k);
                previous = delay;
            }
            assertEquals(Scheduler.MAX_RETRY_DELAY, previous);
        }

        @Test
        @DisplayName("a long retry budget never overflows and fails terminally once spent")
        void longRetryBudget() {
            scheduler.submit(task("A").maxRetries(60).retryDelay(Duration.ofSeconds(60)).build());

            Task last = failRepeatedly("A", 60);

            assertEquals(TaskStatus.RETRYING, last.status());
            assertEquals(60, last.retryCount());
            assertEquals(last.lastRetryAt().plus(Scheduler.MAX_RETRY_DELAY), last.scheduledFor());

            clock.set(last.scheduledFor());
            scheduler.readyTasks();
            assertEquals(TaskStatus.FAILED, scheduler.fail("A", "boom").status());
        }

        @Test
        @DisplayName("a flat retry delay above the cap is clamped")
        void flatBackoffClamped() {
            scheduler.submit(task("A").maxRetries(1).retryDelay(Duration.ofDays(30)).exponentialBackoff(false).build());
            scheduler.readyTasks();

            Task retrying = scheduler.fail("A", "boom");

            assertEquals(clock.instant().plus(Scheduler.MAX_RETRY_DELAY), retrying.scheduledFor());
        }

        @Test
        @DisplayName("flat backoff uses the retry delay unconditionally")
        void flatBackoff() {
            Duration delay = Duration.ofSeconds(30);
            scheduler.submit(task("A").maxRetries(2).retryDelay(delay).exponentialBackoff(false).build());

            scheduler.readyTasks();
            Task first = scheduler.fail("A", "boom");
            assertEquals(clock.instant().plus(delay), first.scheduledFor());

            clock.set(first.scheduledFor());
            scheduler.readyTasks();
            Task second = scheduler.fail("A", "boom");
            assertEquals(clock.instant().plus(delay), second.scheduledFor());
        }

        @Test
        @DisplayName("a retrying task is not ready before its backoff elapses")
        void retryWaitsForBackoff() {
            scheduler.submit(task("A").maxRetries(1).retryDelay(Duration.ofSeconds(10)).build());
            scheduler.readyTasks();
            scheduler.fail("A", "boom");

            clock.advance(Duration.ofSeconds(19));
            assertTrue(scheduler.readyTasks().isEmpty());
            clock.advance(Duration.ofSeconds(1));
            assertEquals(List.of("A"), ids(scheduler.readyTasks()));
        }

        @Test
        @DisplayName("accumulates cost across failed attempts")
        void accumulatesCost() {
            scheduler.submit(task("A").maxRetries(1).retryDelay(Duration.ZERO).build());
            scheduler.readyTasks();
            scheduler.fail("A", "boom", 0.1);
            scheduler.readyTasks();
            Task failed = scheduler.fail("A", "boom", 0.2);

            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals(0.3, failed.actualCost(), 1e-9);
        }

        @Test
        @DisplayName("failPermanently ignores remaining retries")
        void failPermanently() {
            scheduler.submit(task("A").maxRetries(5).build());
            scheduler.readyTasks();

            Task failed = scheduler.failPermanently("A", "No handler registered for task type: news_discovery");
            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals(0, failed.retryCount());
        }

        @Test
        @DisplayName("every failure counts towards the error rate")
        void failuresCountTowardsErrorRate() {
            scheduler.submit(task("A").maxRetries(1).retryDelay(Duration.ZERO).build());
            scheduler.submit(task("B").build());
            scheduler.readyTasks();
            scheduler.fail("A", "boom");
            scheduler.complete("B", "ok");

            assertEquals(0.5, scheduler.errorRate(), 1e-9);
            assertEquals(1, scheduler.recentFailures());
        }
    }

    @Nested
    @DisplayName("cancel and cascade")
    class CancelAndCascade {

        @Test
        @DisplayName("cancelling a pending task makes it terminal")
        void cancelPending() {
            scheduler.submit(task("A").build());

            assertTrue(scheduler.cancel("A", "operator request"));
            Task a = scheduler.find("A").orElseThrow();
            assertEquals(TaskStatus.CANCELLED, a.status());
            assertEquals("operator request", a.errorMessage());
            assertFalse(scheduler.cancel("A", "again"));
        }

        @Test
        @DisplayName("a terminal failure cancels dependents waiting for completion")
        void failureCascades() {
            scheduler.submit(task("A").maxRetries(0).build());
            scheduler.submit(task("B").dependsOn("A").build());
            scheduler.submit(task("C").dependsOn("B").build());

            scheduler.readyTasks();
            scheduler.fail("A", "feed unreachable");

            assertEquals(TaskStatus.CANCELLED, scheduler.find("B").orElseThrow().status());
            assertEquals(TaskStatus.CANCELLED, scheduler.find("C").orElseThrow().status());
            assertTrue(scheduler.find("B").orElseThrow().errorMessage().contains("A finished FAILED"));
            assertTrue(scheduler.isIdle());
        }

        @Test
        @DisplayName("a dependency that is already terminal in the wrong status cancels on submit")
        void alreadyTerminalDependencyCascades() {
            scheduler.submit(task("A").build());
            scheduler.cancel("A", "no longer needed");

            Task b = scheduler.submit(task("B").dependsOn("A").build());

            assertEquals(TaskStatus.CANCELLED, b.status());
        }

        @Test
        @DisplayName("a retrying task does not cascade")
        void retryDoesNotCascade() {
            scheduler.submit(task("A").maxRetries(1).build());
            scheduler.submit(task("B").dependsOn("A").build());
            scheduler.readyTasks();
            scheduler.fail("A", "flaky");

            assertEquals(TaskStatus.PENDING, scheduler.find("B").orElseThrow().status());
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("overdue tasks are those past their deadline and not done")
        void overdueTasks() {
            scheduler.submit(task("A").deadline(clock.instant().plusSeconds(10)).build());
            scheduler.submit(task("B").build());

            assertTrue(scheduler.overdueTasks().isEmpty());
            clock.advance(Duration.ofSeconds(11));
            assertEquals(List.of("A"), ids(scheduler.overdueTasks()));
        }

        @Test
        @DisplayName("isSettled is true once every listed task is terminal")
        void isSettled() {
            scheduler.submit(task("A").build());
            scheduler.submit(task("B").build());
            scheduler.readyTasks();
            scheduler.complete("A", "ok");

            assertFalse(scheduler.isSettled(List.of("A", "B")));
            scheduler.cancel("B", "stop");
            assertTrue(scheduler.isSettled(List.of("A", "B")));
        }
    }
}
