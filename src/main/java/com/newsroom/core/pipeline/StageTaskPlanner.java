package com.newsroom.core.pipeline;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the parameter maps of a stage's tasks, one map per task. Planners may read earlier
 * stages' artifacts from the run.
 */
@FunctionalInterface
public interface StageTaskPlanner {

    List<Map<String, Object>> plan(WorkflowRun run, StageDescriptor stage);

    /** One task carrying the run parameters overlaid with the stage parameters. */
    static StageTaskPlanner single() {
        return (run, stage) -> List.of(merge(run.parameters(), stage.parameters()));
    }

    /**
     * {@code count} identical tasks, each with an {@code index} parameter.
     */
    static StageTaskPlanner fanOut(int count) {
        return (run, stage) -> {
            var plans = new ArrayList<Map<String, Object>>(count);
            for (int i = 0; i < count; i++) {
                var params = merge(run.parameters(), stage.parameters());
                params.put("index", i);
                plans.add(params);
            }
            return plans;
        };
    }

    private static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overlay) {
        var merged = new HashMap<String, Object>(base);
        merged.putAll(overlay);
        return merged;
    }
}
