package com.newsroom.core.pipeline;

import com.newsroom.core.metrics.NewsroomMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a stage's gate verdict and the run's budgets into a continue, retry or error decision.
 * <p>
 * Rules, in order:
 * <ol>
 *   <li>Run cost above its ceiling: ERROR, regardless of remaining retries</li>
 *   <li>Gate passed: CONTINUE</li>
 *   <li>Gate failed with run retries left: RETRY the same stage</li>
 *   <li>Otherwise: ERROR</li>
 * </ol>
 */
public class QualityGateEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(QualityGateEvaluationService.class);

    private final NewsroomMetrics metrics;

    public QualityGateEvaluationService(NewsroomMetrics metrics) {
        this.metrics = metrics;
    }

    public QualityGateEvaluationService() {
        this(null);
    }

    /**
     * @param run    the run, with the attempt's cost already added to its totals
     * @param stage  the stage just attempted
     * @param result the attempt's outcome
     */
    public QualityGateDecision evaluate(WorkflowRun run, StageDescriptor stage, StageResult result) {
        QualityGateDecision decision = decide(run, stage, result);
        if (metrics != null) {
            metrics.recordGateDecision(stage.stageId(), decision.outcome().name().toLowerCase());
        }
        return decision;
    }

    private QualityGateDecision decide(WorkflowRun run, StageDescriptor stage, StageResult result) {
        if (run.totalCost() > run.maxCost()) {
            String reason = String.format("Run cost $%.2f exceeds budget $%.2f during stage %s",
                    run.totalCost(), run.maxCost(), stage.stageId());
            log.warn("Gate ERROR for {} attempt {}: {}", stage.stageId(), result.attempt(), reason);
            return QualityGateDecision.error(reason);
        }

        GateResult gate = stage.gate().evaluate(result);
        if (result.aborted() == null && gate.passed()) {
            log.info("Gate CONTINUE for {} attempt {}: {}", stage.stageId(), result.attempt(), gate.reason());
            return QualityGateDecision.proceed(gate.reason());
        }

        String reason = result.aborted() != null ? result.aborted() : gate.reason();
        if (run.totalRetries() < run.maxRetries()) {
            log.info("Gate RETRY for {} attempt {}: {} (retry {}/{})", stage.stageId(), result.attempt(),
                    reason, run.totalRetries() + 1, run.maxRetries());
            return QualityGateDecision.retry(reason);
        }

        String exhausted = String.format("Stage %s failed its quality gate after %d attempt(s), run retries exhausted (%d/%d): %s",
                stage.stageId(), result.attempt(), run.totalRetries(), run.maxRetries(), reason);
        log.warn("Gate ERROR for {} attempt {}: {}", stage.stageId(), result.attempt(), exhausted);
        return QualityGateDecision.error(exhausted);
    }
}
