package com.newsroom.core.engine;

import com.newsroom.core.model.ErrorKind;
import com.newsroom.core.model.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Closed registration table from task type to {@link TaskHandler}. The table is fixed once
 * built; {@link #validate(Collection)} lets callers reject a workflow before any of its tasks run.
 */
public class RoutingTable implements TaskRouter {

    private static final Logger log = LoggerFactory.getLogger(RoutingTable.class);

    private final Map<String, TaskHandler> handlers;

    private RoutingTable(Map<String, TaskHandler> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public TaskOutcome route(String taskType, Map<String, Object> parameters) throws Exception {
        TaskHandler handler = handlers.get(taskType);
        if (handler == null) {
            log.warn("No handler registered for task type {}", taskType);
            return TaskOutcome.failure(ErrorKind.UNROUTABLE, "No handler registered for task type: " + taskType);
        }
        return handler.handle(parameters);
    }

    @Override
    public boolean canRoute(String taskType) {
        return handlers.containsKey(taskType);
    }

    public Set<String> taskTypes() {
        return handlers.keySet();
    }

    /**
     * @throws UnroutableTaskException naming every type without a handler
     */
    public void validate(Collection<String> requiredTypes) {
        var missing = new ArrayList<String>();
        for (String type : requiredTypes) {
            if (!handlers.containsKey(type) && !missing.contains(type)) {
                missing.add(type);
            }
        }
        if (!missing.isEmpty()) {
            throw new UnroutableTaskException("No handler registered for task type(s): " + String.join(", ", missing));
        }
    }

    public static final class Builder {
        private final Map<String, TaskHandler> handlers = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(String taskType, TaskHandler handler) {
            if (taskType == null || taskType.isBlank()) {
                throw new IllegalArgumentException("Task type must not be blank");
            }
            if (handlers.putIfAbsent(taskType, handler) != null) {
                throw new IllegalArgumentException("Handler already registered for task type: " + taskType);
            }
            return this;
        }

        public RoutingTable build() {
            return new RoutingTable(handlers);
        }
    }
}
