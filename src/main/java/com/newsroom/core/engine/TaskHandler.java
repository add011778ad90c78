package com.newsroom.core.engine;

import com.newsroom.core.model.TaskOutcome;

import java.util.Map;

/**
 * Performs the real work behind one task type. Handlers run on engine worker threads and must
 * not touch the scheduler; anything they throw is reported as a HANDLER failure.
 */
@FunctionalInterface
public interface TaskHandler {

    TaskOutcome handle(Map<String, Object> parameters) throws Exception;
}
