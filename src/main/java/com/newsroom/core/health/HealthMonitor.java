package com.newsroom.core.health;

import com.newsroom.core.cost.CostTracker;
import com.newsroom.core.engine.AdmissionGate;
import com.newsroom.core.events.EventBus;
import com.newsroom.core.events.NewsroomEvent;
import com.newsroom.core.scheduler.Scheduler;
import com.newsroom.core.worker.WorkerDescriptor;
import com.newsroom.core.worker.WorkerRegistry;
import com.newsroom.core.worker.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically samples the scheduler, worker registry and cost ledger into a
 * {@link HealthSnapshot}, and serves as the engine's {@link AdmissionGate}.
 * <p>
 * Classification, worst first:
 * <ul>
 *   <li>DOWN: workers are registered and none is online or busy</li>
 *   <li>CRITICAL: error rate or average queue wait above the critical thresholds</li>
 *   <li>WARNING: error rate or queue wait above the warning thresholds, too many workers in
 *       error, a pending backlog, or the daily budget exceeded</li>
 *   <li>HEALTHY otherwise</li>
 * </ul>
 * Before the first sample the monitor admits.
 */
public class HealthMonitor implements AdmissionGate {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final Scheduler scheduler;
    private final WorkerRegistry workers;
    private final CostTracker costs;
    private final HealthProperties properties;
    private final EventBus eventBus;
    private final Clock clock;

    private volatile HealthSnapshot latest;
    private volatile SystemMetrics latestMetrics;
    private ScheduledExecutorService sampler;

    public HealthMonitor(Scheduler scheduler, WorkerRegistry workers, CostTracker costs,
                         HealthProperties properties, EventBus eventBus, Clock clock) {
        this.scheduler = scheduler;
        this.workers = workers;
        this.costs = costs;
        this.properties = properties;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /** Classification result: overall health plus the reasons behind it. */
    record Assessment(SystemHealth health, List<String> issues, List<String> warnings) {}

    public HealthSnapshot sample() {
        SystemMetrics metrics = collect();
        Assessment assessment = classify(metrics, properties);

        var workerLoads = new LinkedHashMap<String, HealthSnapshot.WorkerLoad>();
        if (workers != null) {
            for (WorkerDescriptor w : workers.all()) {
                workerLoads.put(w.workerId(), new HealthSnapshot.WorkerLoad(w.status().name(), w.load()));
            }
        }
        var snapshot = new HealthSnapshot(
                metrics.timestamp(),
                assessment.health(),
                metrics.pendingTasks(),
                metrics.runningTasks(),
                metrics.failedTasks(),
                workerLoads,
                new HealthSnapshot.CostSummary(metrics.hourlyCost(), metrics.dailyCost()),
                metrics.averageQueueWait().toMillis() / 1000.0,
                assessment.issues(),
                assessment.warnings());

        HealthSnapshot previous = latest;
        latest = snapshot;
        latestMetrics = metrics;
        if (previous == null || previous.health() != snapshot.health()) {
            logTransition(previous, snapshot);
            if (eventBus != null) {
                eventBus.publish(new NewsroomEvent("health.changed", null, null,
                        Map.of("health", snapshot.health().name(),
                               "issues", snapshot.issues(),
                               "warnings", snapshot.warnings()),
                        snapshot.timestamp()));
            }
        }
        return snapshot;
    }

    private void logTransition(HealthSnapshot previous, HealthSnapshot current) {
        String from = previous == null ? "UNKNOWN" : previous.health().name();
        switch (current.health()) {
            case HEALTHY -> log.info("System health {} -> HEALTHY", from);
            case WARNING -> log.warn("System health {} -> WARNING: {}", from, current.warnings());
            case CRITICAL, DOWN -> log.error("System health {} -> {}: {}", from, current.health(), current.issues());
        }
    }

    SystemMetrics collect() {
        Instant now = clock.instant();
        int registered = 0;
        int online = 0;
        int busy = 0;
        int error = 0;
        int unhealthy = 0;
        if (workers != null) {
            for (WorkerDescriptor w : workers.all()) {
                registered++;
                if (w.status() == WorkerStatus.ONLINE) online++;
                if (w.status() == WorkerStatus.BUSY) busy++;
                if (w.status() == WorkerStatus.ERROR) error++;
                if (!w.isHealthy(now)) unhealthy++;
            }
        }
        return new SystemMetrics(
                now,
                scheduler.pendingCount(),
                scheduler.runningCount(),
                scheduler.failedCount(),
                scheduler.recentFailures(),
                scheduler.errorRate(),
                scheduler.averageQueueWait(),
                scheduler.maxQueueWait(),
                scheduler.overdueTasks().size(),
                registered,
                online,
                busy,
                error,
                unhealthy,
                costs != null ? costs.hourlyCost() : 0.0,
                costs != null ? costs.dailyCost() : 0.0,
                costs != null ? costs.monthlyProjection() : 0.0);
    }

    static Assessment classify(SystemMetrics m, HealthProperties p) {
        var issues = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        if (m.workersRegistered() > 0 && m.workersOnline() + m.workersBusy() == 0) {
            issues.add("No workers online (" + m.workersRegistered() + " registered)");
            return new Assessment(SystemHealth.DOWN, issues, warnings);
        }

        if (m.errorRate() > p.getCriticalErrorRate()) {
            issues.add(String.format("Error rate %.0f%% exceeds %.0f%%", m.errorRate() * 100, p.getCriticalErrorRate() * 100));
        }
        if (m.averageQueueWait().compareTo(p.getCriticalQueueWait()) > 0) {
            issues.add("Average queue wait " + m.averageQueueWait().toSeconds() + "s exceeds "
                    + p.getCriticalQueueWait().toSeconds() + "s");
        }
        if (!issues.isEmpty()) {
            return new Assessment(SystemHealth.CRITICAL, issues, warnings);
        }

        if (m.errorRate() > p.getWarningErrorRate()) {
            warnings.add(String.format("Elevated error rate %.0f%%", m.errorRate() * 100));
        }
        if (m.averageQueueWait().compareTo(p.getWarningQueueWait()) > 0) {
            warnings.add("Average queue wait " + m.averageQueueWait().toSeconds() + "s");
        }
        if (m.workersError() > m.workersOnline() * p.getWorkerErrorRatio()) {
            warnings.add(m.workersError() + " worker(s) in error state");
        }
        if (m.pendingTasks() > p.getWarningBacklog()) {
            warnings.add("High pending backlog: " + m.pendingTasks() + " tasks");
        }
        if (m.dailyCost() > p.getDailyCostBudget()) {
            warnings.add(String.format("Daily cost $%.2f exceeds budget $%.2f", m.dailyCost(), p.getDailyCostBudget()));
        }
        if (m.overdueTasks() > 0) {
            log.debug("{} overdue task(s) at sample time", m.overdueTasks());
        }
        return new Assessment(warnings.isEmpty() ? SystemHealth.HEALTHY : SystemHealth.WARNING, issues, warnings);
    }

    /**
     * The latest snapshot, or null before the first sample.
     */
    public HealthSnapshot latest() {
        return latest;
    }

    @Override
    public boolean isAdmitting() {
        HealthSnapshot snapshot = latest;
        return snapshot == null || snapshot.health().isAdmitting();
    }

    /**
     * Per-component view of the latest sample, taking a fresh one if none exists yet.
     */
    public List<HealthStatus> componentStatuses() {
        HealthSnapshot snapshot = latest != null ? latest : sample();
        SystemMetrics m = latestMetrics;
        var results = new ArrayList<HealthStatus>();

        HealthStatus.Status schedulerStatus = m.errorRate() > properties.getCriticalErrorRate()
                ? HealthStatus.Status.DOWN
                : m.errorRate() > properties.getWarningErrorRate() ? HealthStatus.Status.DEGRADED : HealthStatus.Status.UP;
        results.add(new HealthStatus("scheduler", schedulerStatus,
                String.format("%d pending, %d running, error rate %.0f%%",
                        m.pendingTasks(), m.runningTasks(), m.errorRate() * 100),
                Map.of("failed", String.valueOf(m.failedTasks()),
                       "overdue", String.valueOf(m.overdueTasks()))));

        if (m.workersRegistered() == 0) {
            results.add(new HealthStatus("workers", HealthStatus.Status.UP,
                    "No external workers registered", Map.of()));
        } else {
            HealthStatus.Status workerStatus = m.workersOnline() + m.workersBusy() == 0
                    ? HealthStatus.Status.DOWN
                    : m.workersUnhealthy() > 0 ? HealthStatus.Status.DEGRADED : HealthStatus.Status.UP;
            results.add(new HealthStatus("workers", workerStatus,
                    String.format("%d online, %d busy, %d error of %d",
                            m.workersOnline(), m.workersBusy(), m.workersError(), m.workersRegistered()),
                    Map.of("unhealthy", String.valueOf(m.workersUnhealthy()))));
        }

        boolean overBudget = m.dailyCost() > properties.getDailyCostBudget();
        results.add(new HealthStatus("cost", overBudget ? HealthStatus.Status.DEGRADED : HealthStatus.Status.UP,
                String.format("$%.2f today of $%.2f budget", m.dailyCost(), properties.getDailyCostBudget()),
                Map.of("hourly", String.format("%.4f", m.hourlyCost()),
                       "monthlyProjection", String.format("%.2f", m.monthlyProjection()))));

        HealthStatus.Status overall = switch (snapshot.health()) {
            case HEALTHY -> HealthStatus.Status.UP;
            case WARNING -> HealthStatus.Status.DEGRADED;
            case CRITICAL, DOWN -> HealthStatus.Status.DOWN;
        };
        results.add(new HealthStatus("system", overall, snapshot.health().name(), Map.of()));
        return results;
    }

    public synchronized void start() {
        if (sampler != null) {
            return;
        }
        sampler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-monitor");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = properties.getSampleInterval().toMillis();
        sampler.scheduleAtFixedRate(this::sampleSafely, 0, intervalMs, TimeUnit.MILLISECONDS);
        if (workers != null) {
            sampler.scheduleAtFixedRate(workers::resetHourlyErrorCounts, 1, 1, TimeUnit.HOURS);
        }
        log.info("Health monitor started, sampling every {}s", properties.getSampleInterval().toSeconds());
    }

    private void sampleSafely() {
        try {
            sample();
        } catch (RuntimeException e) {
            log.error("Health sample failed: {}", e.getMessage(), e);
        }
    }

    public synchronized void stop() {
        if (sampler != null) {
            sampler.shutdownNow();
            sampler = null;
            log.info("Health monitor stopped");
        }
    }
}
