package com.newsroom.core.pipeline;

import com.newsroom.core.engine.AdmissionGate;
import com.newsroom.core.engine.EngineProperties;
import com.newsroom.core.engine.ExecutionEngine;
import com.newsroom.core.engine.RoutingTable;
import com.newsroom.core.events.EventBus;
import com.newsroom.core.metrics.NewsroomMetrics;
import com.newsroom.core.scheduler.Scheduler;
import com.newsroom.core.scheduler.TaskIdGenerator;
import com.newsroom.core.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for pipeline runs. Every run gets its own {@link Scheduler} and
 * {@link ExecutionEngine}, so concurrent runs never share task state; they share only the
 * router, the worker registry, the admission gate and the event bus.
 */
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final AtomicInteger runCounter = new AtomicInteger();

    private final RoutingTable router;
    private final EngineProperties engineProperties;
    private final PipelineProperties pipelineProperties;
    private final AdmissionGate admissionGate;
    private final WorkerRegistry workers;
    private final QualityGateEvaluationService gates;
    private final EventBus eventBus;
    private final NewsroomMetrics metrics;
    private final Clock clock;

    public PipelineService(RoutingTable router, EngineProperties engineProperties,
                           PipelineProperties pipelineProperties, AdmissionGate admissionGate,
                           WorkerRegistry workers, QualityGateEvaluationService gates,
                           EventBus eventBus, NewsroomMetrics metrics, Clock clock) {
        this.router = router;
        this.engineProperties = engineProperties;
        this.pipelineProperties = pipelineProperties;
        this.admissionGate = admissionGate;
        this.workers = workers;
        this.gates = gates;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs a template to completion in the calling thread.
     *
     * @throws com.newsroom.core.engine.UnroutableTaskException if a stage's task type has no
     *         handler; no task is submitted in that case
     */
    public RunSummary run(WorkflowTemplate template, Map<String, Object> parameters) {
        router.validate(template.taskTypes());

        String runId = generateRunId();
        var scheduler = new Scheduler(new TaskIdGenerator(runId), workers, clock);
        var workflowRun = new WorkflowRun(runId, template, parameters,
                pipelineProperties.getMaxRetries(), pipelineProperties.getMaxCostPerRun(), clock.instant());

        try (var engine = new ExecutionEngine(scheduler, router, engineProperties, admissionGate,
                workers, eventBus, metrics, runId)) {
            var machine = new PipelineStateMachine(workflowRun, scheduler, engine, gates,
                    pipelineProperties, eventBus, clock);
            RunSummary summary = machine.execute();
            if (metrics != null) {
                metrics.recordRunResult(template.name(), summary.success());
                metrics.recordRunCost(template.name(), summary.totalCost());
            }
            return summary;
        }
    }

    public RunSummary run(String templateName, Map<String, Object> parameters) {
        WorkflowTemplate template = StandardWorkflowTemplates.find(templateName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow template: " + templateName));
        log.info("Running standard template {}", templateName);
        return run(template, parameters);
    }

    /**
     * Generates a unique run ID in the format RUN-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = runCounter.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("RUN-%d-%04d", year, count);
    }
}
