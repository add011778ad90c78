package com.newsroom.core.config;

import com.newsroom.core.coordination.CoordinationService;
import com.newsroom.core.cost.CostTracker;
import com.newsroom.core.engine.EngineProperties;
import com.newsroom.core.engine.ExecutionEngine;
import com.newsroom.core.engine.RoutingTable;
import com.newsroom.core.engine.TaskHandler;
import com.newsroom.core.events.EventBus;
import com.newsroom.core.health.HealthMonitor;
import com.newsroom.core.health.HealthProperties;
import com.newsroom.core.metrics.NewsroomMetrics;
import com.newsroom.core.pipeline.PipelineProperties;
import com.newsroom.core.pipeline.PipelineService;
import com.newsroom.core.pipeline.QualityGateEvaluationService;
import com.newsroom.core.scheduler.Scheduler;
import com.newsroom.core.scheduler.TaskIdGenerator;
import com.newsroom.core.worker.WorkerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Map;

/**
 * Spring {@link Configuration} that wires the orchestration core.
 * <p>
 * Core classes carry no Spring annotations; every instance is created here and passed by
 * reference. Task handlers are contributed as {@link TaskHandler} beans whose bean name is the
 * task type they serve.
 */
@Configuration
public class OrchestrationConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConfigurationProperties(prefix = "newsroom.engine")
    public EngineProperties engineProperties() {
        return new EngineProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "newsroom.health")
    public HealthProperties healthProperties() {
        return new HealthProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "newsroom.pipeline")
    public PipelineProperties pipelineProperties() {
        return new PipelineProperties();
    }

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    public NewsroomMetrics newsroomMetrics(MeterRegistry registry) {
        return new NewsroomMetrics(registry);
    }

    @Bean
    public WorkerRegistry workerRegistry(Clock clock) {
        return new WorkerRegistry(clock);
    }

    @Bean
    public CostTracker costTracker(Clock clock, EventBus eventBus) {
        var tracker = new CostTracker(clock);
        tracker.attach(eventBus);
        return tracker;
    }

    @Bean
    public RoutingTable routingTable(ListableBeanFactory beanFactory) {
        var builder = RoutingTable.builder();
        Map<String, TaskHandler> handlers = beanFactory.getBeansOfType(TaskHandler.class);
        handlers.forEach(builder::register);
        RoutingTable table = builder.build();
        log.info("Routing table built with {} task type(s): {}", table.taskTypes().size(), table.taskTypes());
        return table;
    }

    /** Shared scheduler for standalone tasks and coordinated workflows. */
    @Bean
    public Scheduler scheduler(WorkerRegistry workers, Clock clock) {
        return new Scheduler(new TaskIdGenerator(), workers, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public HealthMonitor healthMonitor(Scheduler scheduler, WorkerRegistry workers, CostTracker costs,
                                       HealthProperties properties, EventBus eventBus, Clock clock) {
        return new HealthMonitor(scheduler, workers, costs, properties, eventBus, clock);
    }

    /** Dispatches tasks submitted through {@link CoordinationService} for the life of the context. */
    @Bean(initMethod = "start", destroyMethod = "close")
    public ExecutionEngine executionEngine(Scheduler scheduler, RoutingTable router, EngineProperties properties,
                                           HealthMonitor healthMonitor, WorkerRegistry workers,
                                           EventBus eventBus, NewsroomMetrics metrics) {
        return new ExecutionEngine(scheduler, router, properties, healthMonitor, workers, eventBus, metrics, null);
    }

    @Bean
    public QualityGateEvaluationService qualityGateEvaluationService(NewsroomMetrics metrics) {
        return new QualityGateEvaluationService(metrics);
    }

    @Bean
    public PipelineService pipelineService(RoutingTable router, EngineProperties engineProperties,
                                           PipelineProperties pipelineProperties, HealthMonitor healthMonitor,
                                           WorkerRegistry workers, QualityGateEvaluationService gates,
                                           EventBus eventBus, NewsroomMetrics metrics, Clock clock) {
        return new PipelineService(router, engineProperties, pipelineProperties, healthMonitor,
                workers, gates, eventBus, metrics, clock);
    }

    @Bean
    public CoordinationService coordinationService(Scheduler scheduler, RoutingTable router,
                                                   HealthMonitor healthMonitor, Clock clock) {
        return new CoordinationService(scheduler, router, healthMonitor, clock);
    }
}
