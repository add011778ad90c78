package com.newsroom.core.engine;

import com.newsroom.core.model.TaskOutcome;

import java.util.Map;

/**
 * Boundary between orchestration and the work itself. The engine never inspects task
 * parameters or results; it only hands them across this interface.
 */
public interface TaskRouter {

    /**
     * Runs the handler registered for {@code taskType}. An unknown type yields an
     * {@link com.newsroom.core.model.ErrorKind#UNROUTABLE} failure rather than an exception.
     */
    TaskOutcome route(String taskType, Map<String, Object> parameters) throws Exception;

    boolean canRoute(String taskType);
}
