package com.newsroom.core.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in {@link QualityGate} predicates.
 */
public final class QualityGates {

    private QualityGates() {}

    public static QualityGate always() {
        return result -> GateResult.pass("No gate");
    }

    public static QualityGate minSuccessfulTasks(int min) {
        return result -> {
            long ok = result.completedCount();
            return ok >= min
                    ? GateResult.pass(ok + " task(s) succeeded")
                    : GateResult.fail("Only " + ok + " of required " + min + " task(s) succeeded");
        };
    }

    public static QualityGate minSuccessRate(double min) {
        return result -> {
            double rate = result.successRate();
            return rate >= min
                    ? GateResult.pass(String.format("Success rate %.0f%%", rate * 100))
                    : GateResult.fail(String.format("Success rate %.0f%% below %.0f%%", rate * 100, min * 100));
        };
    }

    /**
     * Passes when the average of {@code key} across artifacts meets {@code threshold}. Fails
     * when no artifact carries the field.
     */
    public static QualityGate minAverageScore(String key, double threshold) {
        return result -> {
            double avg = result.averageOf(key);
            if (Double.isNaN(avg)) {
                return GateResult.fail("No artifact reports " + key);
            }
            return avg >= threshold
                    ? GateResult.pass(String.format("Average %s %.2f", key, avg))
                    : GateResult.fail(String.format("Average %s %.2f below %.2f", key, avg, threshold));
        };
    }

    /** Passes when no task of the attempt failed or was cancelled. */
    public static QualityGate noHardErrors() {
        return result -> {
            long bad = result.failedCount() + result.cancelledCount();
            return bad == 0
                    ? GateResult.pass("No task errors")
                    : GateResult.fail(bad + " task(s) failed");
        };
    }

    public static QualityGate minArtifacts(int min) {
        return result -> result.artifacts().size() >= min
                ? GateResult.pass(result.artifacts().size() + " artifact(s)")
                : GateResult.fail("Only " + result.artifacts().size() + " of required " + min + " artifact(s)");
    }

    /** Passes when every gate passes; the reason lists every failure. */
    public static QualityGate allOf(QualityGate... gates) {
        List<QualityGate> all = List.of(gates);
        return result -> {
            var failures = new ArrayList<String>();
            for (QualityGate gate : all) {
                GateResult r = gate.evaluate(result);
                if (!r.passed()) {
                    failures.add(r.reason());
                }
            }
            return failures.isEmpty()
                    ? GateResult.pass("All gates passed")
                    : GateResult.fail(String.join("; ", failures));
        };
    }
}
