package com.newsroom.core.pipeline;

import com.newsroom.core.model.TaskPriority;

import java.time.Duration;
import java.util.Map;

/**
 * One stage of a {@link WorkflowTemplate}.
 *
 * @param stageId           stable stage identifier, unique within the template
 * @param name              human-readable name
 * @param taskType          routing tag of the stage's tasks
 * @param priority          priority of the stage's tasks
 * @param estimatedDuration expected duration of one task
 * @param estimatedCost     expected cost of one task in USD
 * @param taskMaxRetries    task-level retries before a task fails terminally
 * @param retryDelay        base task retry delay
 * @param dependsOnPrevious whether each task waits on the previous stage's completed tasks
 * @param parameters        stage parameters, overlaid on the run parameters
 * @param planner           builds the stage's task parameter maps
 * @param gate              predicate evaluated after each attempt
 */
public record StageDescriptor(
    String stageId,
    String name,
    String taskType,
    TaskPriority priority,
    Duration estimatedDuration,
    double estimatedCost,
    int taskMaxRetries,
    Duration retryDelay,
    boolean dependsOnPrevious,
    Map<String, Object> parameters,
    StageTaskPlanner planner,
    QualityGate gate
) {

    public StageDescriptor {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        if (planner == null) planner = StageTaskPlanner.single();
        if (gate == null) gate = QualityGates.noHardErrors();
    }

    public static Builder builder(String stageId, String taskType) {
        return new Builder(stageId, taskType);
    }

    public static final class Builder {
        private final String stageId;
        private final String taskType;
        private String name;
        private TaskPriority priority = TaskPriority.NORMAL;
        private Duration estimatedDuration = Duration.ofMinutes(5);
        private double estimatedCost = 0.01;
        private int taskMaxRetries = 0;
        private Duration retryDelay = Duration.ofSeconds(60);
        private boolean dependsOnPrevious = true;
        private Map<String, Object> parameters = Map.of();
        private StageTaskPlanner planner;
        private QualityGate gate;

        private Builder(String stageId, String taskType) {
            this.stageId = stageId;
            this.taskType = taskType;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder priority(TaskPriority priority) { this.priority = priority; return this; }
        public Builder estimatedDuration(Duration estimatedDuration) { this.estimatedDuration = estimatedDuration; return this; }
        public Builder estimatedCost(double estimatedCost) { this.estimatedCost = estimatedCost; return this; }
        public Builder taskMaxRetries(int taskMaxRetries) { this.taskMaxRetries = taskMaxRetries; return this; }
        public Builder retryDelay(Duration retryDelay) { this.retryDelay = retryDelay; return this; }
        public Builder dependsOnPrevious(boolean dependsOnPrevious) { this.dependsOnPrevious = dependsOnPrevious; return this; }
        public Builder parameters(Map<String, Object> parameters) { this.parameters = parameters; return this; }
        public Builder planner(StageTaskPlanner planner) { this.planner = planner; return this; }
        public Builder gate(QualityGate gate) { this.gate = gate; return this; }

        public StageDescriptor build() {
            return new StageDescriptor(stageId, name != null ? name : stageId, taskType, priority,
                    estimatedDuration, estimatedCost, taskMaxRetries, retryDelay, dependsOnPrevious,
                    parameters, planner, gate);
        }
    }
}
