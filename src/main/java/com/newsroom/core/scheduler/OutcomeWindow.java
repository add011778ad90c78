package com.newsroom.core.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling window of task outcomes and queue-wait samples, used for error-rate and
 * queue-health figures. Samples older than the window are discarded lazily.
 */
class OutcomeWindow {

    private record Outcome(Instant at, boolean success) {}

    private record Wait(Instant at, Duration duration) {}

    private final Duration window;
    private final Deque<Outcome> outcomes = new ArrayDeque<>();
    private final Deque<Wait> waits = new ArrayDeque<>();

    OutcomeWindow(Duration window) {
        this.window = window;
    }

    void recordSuccess(Instant at) {
        outcomes.addLast(new Outcome(at, true));
    }

    void recordFailure(Instant at) {
        outcomes.addLast(new Outcome(at, false));
    }

    void recordQueueWait(Instant at, Duration wait) {
        waits.addLast(new Wait(at, wait.isNegative() ? Duration.ZERO : wait));
    }

    double errorRate(Instant now) {
        trim(now);
        if (outcomes.isEmpty()) {
            return 0.0;
        }
        long failures = outcomes.stream().filter(o -> !o.success()).count();
        return (double) failures / outcomes.size();
    }

    long failures(Instant now) {
        trim(now);
        return outcomes.stream().filter(o -> !o.success()).count();
    }

    long successes(Instant now) {
        trim(now);
        return outcomes.stream().filter(Outcome::success).count();
    }

    Duration averageWait(Instant now) {
        trim(now);
        if (waits.isEmpty()) {
            return Duration.ZERO;
        }
        long totalMs = waits.stream().mapToLong(w -> w.duration().toMillis()).sum();
        return Duration.ofMillis(totalMs / waits.size());
    }

    Duration maxWait(Instant now) {
        trim(now);
        return waits.stream().map(Wait::duration).max(Duration::compareTo).orElse(Duration.ZERO);
    }

    private void trim(Instant now) {
        Instant cutoff = now.minus(window);
        while (!outcomes.isEmpty() && outcomes.peekFirst().at().isBefore(cutoff)) {
            outcomes.removeFirst();
        }
        while (!waits.isEmpty() && waits.peekFirst().at().isBefore(cutoff)) {
            waits.removeFirst();
        }
    }
}
