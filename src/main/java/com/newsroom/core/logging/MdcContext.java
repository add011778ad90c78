package com.newsroom.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing newsroom-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String STAGE_ID = "stageId";
    public static final String TASK_ID = "taskId";
    public static final String TASK_TYPE = "taskType";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setStage(String runId, String stageId) {
        MDC.put(RUN_ID, runId);
        MDC.put(STAGE_ID, stageId);
    }

    public static void setTask(String taskId, String taskType) {
        MDC.put(TASK_ID, taskId);
        MDC.put(TASK_TYPE, taskType);
    }

    public static void clearTask() {
        MDC.remove(TASK_ID);
        MDC.remove(TASK_TYPE);
    }

    public static void clearStage() {
        MDC.remove(STAGE_ID);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(STAGE_ID);
        MDC.remove(TASK_ID);
        MDC.remove(TASK_TYPE);
    }
}
