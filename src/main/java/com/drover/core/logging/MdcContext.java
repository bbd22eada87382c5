package com.drover.core.logging;

import org.slf4j.MDC;

/**
 * Drover-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String MISSION_ID = "missionId";
    public static final String TASK_ID = "taskId";
    public static final String AGENT_ID = "agentId";

    private MdcContext() {}

    public static void setMission(String missionId) {
        MDC.put(MISSION_ID, missionId);
    }

    public static void setTask(String missionId, String taskId, String agentId) {
        MDC.put(MISSION_ID, missionId);
        MDC.put(TASK_ID, taskId);
        if (agentId != null) {
            MDC.put(AGENT_ID, agentId);
        }
    }

    public static void clear() {
        MDC.remove(MISSION_ID);
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_ID);
    }
}
