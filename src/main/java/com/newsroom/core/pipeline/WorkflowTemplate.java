package com.newsroom.core.pipeline;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered list of stages run by a {@link PipelineStateMachine}.
 *
 * @param name              template name, used as its lookup key
 * @param description       what the workflow does
 * @param version           template version
 * @param stages            stages in execution order
 * @param defaultParameters run parameters used when the caller supplies none
 * @param tags              free-form labels
 */
public record WorkflowTemplate(
    String name,
    String description,
    String version,
    List<StageDescriptor> stages,
    Map<String, Object> defaultParameters,
    List<String> tags
) {

    public WorkflowTemplate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Template name must not be blank");
        }
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("Template " + name + " has no stages");
        }
        var ids = new HashSet<String>();
        for (StageDescriptor stage : stages) {
            if (!ids.add(stage.stageId())) {
                throw new IllegalArgumentException("Template " + name + " repeats stage " + stage.stageId());
            }
        }
        stages = List.copyOf(stages);
        defaultParameters = defaultParameters == null ? Map.of() : Map.copyOf(defaultParameters);
        tags = tags == null ? List.of() : List.copyOf(tags);
        if (version == null) version = "1.0";
    }

    public WorkflowTemplate(String name, String description, List<StageDescriptor> stages) {
        this(name, description, "1.0", stages, Map.of(), List.of());
    }

    public Optional<StageDescriptor> stage(String stageId) {
        return stages.stream().filter(s -> s.stageId().equals(stageId)).findFirst();
    }

    public Set<String> taskTypes() {
        var types = new LinkedHashSet<String>();
        stages.forEach(s -> types.add(s.taskType()));
        return types;
    }

    /** Sum of per-stage estimates, assuming one task per stage. */
    public Duration estimatedTotalDuration() {
        return stages.stream().map(StageDescriptor::estimatedDuration).reduce(Duration.ZERO, Duration::plus);
    }

    public double estimatedTotalCost() {
        return stages.stream().mapToDouble(StageDescriptor::estimatedCost).sum();
    }
}
