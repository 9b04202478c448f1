package com.crewmind.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys used by the engine: {@code runId}, {@code taskId}, {@code agentRole}.
 * Worker threads set them per task and clear them afterwards.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TASK_ID = "taskId";
    public static final String AGENT_ROLE = "agentRole";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTask(String runId, String taskId, String agentRole) {
        MDC.put(RUN_ID, runId);
        MDC.put(TASK_ID, taskId);
        MDC.put(AGENT_ROLE, agentRole);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_ROLE);
    }
}
