package com.drover.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setMission puts missionId in MDC")
    void setMission() {
        MdcContext.setMission("bg-1a2b3c");
        assertEquals("bg-1a2b3c", MDC.get("missionId"));
    }

    @Test
    @DisplayName("setTask puts missionId, taskId and agentId in MDC")
    void setTask() {
        MdcContext.setTask("m1", "t2", "hermes");
        assertEquals("m1", MDC.get("missionId"));
        assertEquals("t2", MDC.get("taskId"));
        assertEquals("hermes", MDC.get("agentId"));
    }

    @Test
    @DisplayName("setTask without an agent leaves agentId unset")
    void setTaskWithoutAgent() {
        MdcContext.setTask("m1", "t2", null);
        assertNull(MDC.get("agentId"));
    }

    @Test
    @DisplayName("clear removes all drover MDC keys")
    void clear() {
        MDC.put("requestId", "keep");
        MdcContext.setTask("m1", "t2", "hermes");
        MdcContext.clear();
        assertNull(MDC.get("missionId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("agentId"));
        assertEquals("keep", MDC.get("requestId"));
        MDC.remove("requestId");
    }
}
