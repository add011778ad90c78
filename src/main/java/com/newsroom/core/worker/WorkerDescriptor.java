package com.newsroom.core.worker;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Capacity and health of one named external worker (a news discovery agent, a model client
 * pool, a mail relay, ...).
 *
 * @param workerId           unique worker identifier
 * @param workerType         worker pool name tasks ask for through their resource hint
 * @param status             current operational status
 * @param supportedTaskTypes task types this worker can handle
 * @param maxConcurrentTasks capacity
 * @param currentTaskCount   tasks currently assigned
 * @param errorCountLastHour recent error count
 * @param lastHeartbeat      time of the latest heartbeat
 * @param lastError          latest reported error, or null
 * @param tasksCompleted     lifetime successes
 * @param tasksFailed        lifetime failures
 */
public record WorkerDescriptor(
    String workerId,
    String workerType,
    WorkerStatus status,
    Set<String> supportedTaskTypes,
    int maxConcurrentTasks,
    int currentTaskCount,
    int errorCountLastHour,
    Instant lastHeartbeat,
    String lastError,
    int tasksCompleted,
    int tasksFailed
) {

    static final Duration HEARTBEAT_TIMEOUT = Duration.ofMinutes(5);
    static final int MAX_HOURLY_ERRORS = 10;

    public WorkerDescriptor {
        supportedTaskTypes = supportedTaskTypes == null ? Set.of() : Set.copyOf(supportedTaskTypes);
        if (maxConcurrentTasks < 1) maxConcurrentTasks = 1;
    }

    public static WorkerDescriptor online(String workerId, String workerType, int maxConcurrentTasks, Instant now) {
        return new WorkerDescriptor(workerId, workerType, WorkerStatus.ONLINE, Set.of(workerType),
                maxConcurrentTasks, 0, 0, now, null, 0, 0);
    }

    public boolean isAvailable() {
        return status == WorkerStatus.ONLINE && currentTaskCount < maxConcurrentTasks;
    }

    public boolean isHealthy(Instant now) {
        boolean live = status == WorkerStatus.ONLINE || status == WorkerStatus.BUSY;
        return live
                && lastHeartbeat != null
                && Duration.between(lastHeartbeat, now).compareTo(HEARTBEAT_TIMEOUT) < 0
                && errorCountLastHour < MAX_HOURLY_ERRORS;
    }

    public double load() {
        return (double) currentTaskCount / maxConcurrentTasks;
    }

    public double successRate() {
        int total = tasksCompleted + tasksFailed;
        return total == 0 ? 1.0 : (double) tasksCompleted / total;
    }

    WorkerDescriptor withStatus(WorkerStatus newStatus) {
        return new WorkerDescriptor(workerId, workerType, newStatus, supportedTaskTypes, maxConcurrentTasks,
                currentTaskCount, errorCountLastHour, lastHeartbeat, lastError, tasksCompleted, tasksFailed);
    }

    WorkerDescriptor withHeartbeat(Instant at) {
        return new WorkerDescriptor(workerId, workerType, status, supportedTaskTypes, maxConcurrentTasks,
                currentTaskCount, errorCountLastHour, at, lastError, tasksCompleted, tasksFailed);
    }

    WorkerDescriptor withLoad(int taskCount) {
        WorkerStatus next = status;
        if (status == WorkerStatus.ONLINE && taskCount >= maxConcurrentTasks) {
            next = WorkerStatus.BUSY;
        } else if (status == WorkerStatus.BUSY && taskCount < maxConcurrentTasks) {
            next = WorkerStatus.ONLINE;
        }
        return new WorkerDescriptor(workerId, workerType, next, supportedTaskTypes, maxConcurrentTasks,
                taskCount, errorCountLastHour, lastHeartbeat, lastError, tasksCompleted, tasksFailed);
    }

    WorkerDescriptor withResult(boolean success, String error) {
        return new WorkerDescriptor(workerId, workerType, status, supportedTaskTypes, maxConcurrentTasks,
                currentTaskCount,
                success ? errorCountLastHour : errorCountLastHour + 1,
                lastHeartbeat,
                success ? lastError : error,
                success ? tasksCompleted + 1 : tasksCompleted,
                success ? tasksFailed : tasksFailed + 1);
    }
}
