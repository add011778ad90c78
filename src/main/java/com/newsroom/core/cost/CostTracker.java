package com.newsroom.core.cost;

import com.newsroom.core.events.EventBus;
import com.newsroom.core.events.NewsroomEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rolling in-memory cost ledger. Days and months are UTC calendar periods.
 */
public class CostTracker {

    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);

    static final Duration RETENTION = Duration.ofDays(90);

    private final Clock clock;
    private final Deque<CostEntry> entries = new ArrayDeque<>();

    public CostTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records the cost carried by {@code task.completed} and {@code task.failed} events.
     */
    public EventBus.Subscription attach(EventBus eventBus) {
        return eventBus.subscribeAll(this::onEvent);
    }

    private void onEvent(NewsroomEvent event) {
        if (!"task.completed".equals(event.eventType()) && !"task.failed".equals(event.eventType())) {
            return;
        }
        if (event.payload().get("cost") instanceof Number cost && cost.doubleValue() > 0) {
            Object type = event.payload().get("taskType");
            record(type != null ? type.toString() : "unknown", cost.doubleValue());
        }
    }

    public synchronized void record(String operation, double amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Cost must not be negative: " + amount);
        }
        Instant now = clock.instant();
        entries.addLast(new CostEntry(now, operation, amount));
        log.debug("Recorded ${} for {}", String.format("%.4f", amount), operation);
        Instant cutoff = now.minus(RETENTION);
        while (!entries.isEmpty() && entries.peekFirst().timestamp().isBefore(cutoff)) {
            entries.removeFirst();
        }
    }

    /** Spend over the trailing hour. */
    public synchronized double hourlyCost() {
        return sumSince(clock.instant().minus(Duration.ofHours(1)));
    }

    /** Spend since midnight UTC. */
    public synchronized double dailyCost() {
        return sumSince(clock.instant().truncatedTo(ChronoUnit.DAYS));
    }

    /** Spend since the first day of the current UTC month. */
    public synchronized double monthlyCost() {
        LocalDate firstOfMonth = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).withDayOfMonth(1);
        return sumSince(firstOfMonth.atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    /**
     * Month-end estimate extrapolated from the average daily spend so far this month.
     */
    public synchronized double monthlyProjection() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        double perDay = monthlyCost() / today.getDayOfMonth();
        return perDay * today.lengthOfMonth();
    }

    public synchronized boolean isDailyBudgetExceeded(double dailyBudget) {
        return dailyCost() > dailyBudget;
    }

    public synchronized double remainingDailyBudget(double dailyBudget) {
        return Math.max(0.0, dailyBudget - dailyCost());
    }

    /** Spend per operation over the trailing {@code days}. */
    public synchronized Map<String, Double> costByOperation(int days) {
        Instant since = clock.instant().minus(Duration.ofDays(days));
        var totals = new LinkedHashMap<String, Double>();
        for (var entry : entries) {
            if (!entry.timestamp().isBefore(since)) {
                totals.merge(entry.operation(), entry.amount(), Double::sum);
            }
        }
        return totals;
    }

    private double sumSince(Instant since) {
        double total = 0.0;
        for (var entry : entries) {
            if (!entry.timestamp().isBefore(since)) {
                total += entry.amount();
            }
        }
        return total;
    }
}
