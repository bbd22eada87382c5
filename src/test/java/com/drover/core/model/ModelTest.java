package com.drover.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    @DisplayName("plan normalisation numbers tasks by position")
    void normalize() {
        List<PlanTask> plan = PlanTask.normalize(List.of(
                PlanTask.of(null, "a", "first", null),
                PlanTask.of("custom", "b", "second", null),
                PlanTask.of(" ", "c", "third", null)));
        assertEquals(List.of("t1", "custom", "t3"), plan.stream().map(PlanTask::id).toList());
    }

    @Test
    @DisplayName("security consultation becomes a capability hint")
    void securityHint() {
        var planned = new PlanTask("t1", "hermes", "audit", true, List.of("t0"), true, false, null);
        Task task = planned.toTask();
        assertEquals(PlanTask.SECURITY_CAPABILITY, task.capability());
        assertEquals(Set.of("t0"), task.dependsOn());
        assertEquals(TaskStatus.PENDING, task.status());
        assertTrue(task.toolsNeeded());

        var explicit = new PlanTask("t1", "hermes", "audit", false, null, true, false, "review");
        assertEquals("review", explicit.toTask().capability());
    }

    @Test
    @DisplayName("redirecting a task clears its escalation flag")
    void redirect() {
        var task = new Task("t1", "hermes", "hard", null, false, null, true, TaskStatus.PENDING, null);
        Task redirected = task.redirectTo("specialist");
        assertEquals("specialist", redirected.target());
        assertFalse(redirected.needsEscalation());
        assertEquals(Set.of(), redirected.dependsOn());
    }

    @Test
    @DisplayName("replies are addressed back to the sender")
    void reply() {
        var message = AgentMessage.create(MessageType.TASK, "scheduler:m1", "hermes", "m1", "do it",
                Map.of("tools_needed", "true"));
        AgentMessage reply = message.reply(MessageType.RESULT, "done", null);

        assertEquals("hermes", reply.sender());
        assertEquals("scheduler:m1", reply.recipient());
        assertEquals(message.id(), reply.parentId());
        assertEquals("m1", reply.missionId());
        assertTrue(message.payloadFlag("tools_needed"));
        assertFalse(reply.payloadFlag("tools_needed"));
    }

    @Test
    @DisplayName("messages are immutable once created")
    void immutablePayload() {
        var payload = new HashMap<String, Object>();
        payload.put("k", "v");
        var message = AgentMessage.create(MessageType.TASK, "a", "b", "m1", null, payload);
        payload.put("k", "changed");

        assertEquals("v", message.payloadString("k"));
        assertEquals("", message.content());
        assertThrows(UnsupportedOperationException.class, () -> message.payload().put("x", 1));
        assertEquals("w", message.withPayloadEntry("k", "w").payloadString("k"));
    }

    @Test
    @DisplayName("escalation findings are truncated")
    void truncatesFindings() {
        var escalation = new Escalation("e1", "m1", null, "why", "x".repeat(5000), null,
                EscalationStatus.PENDING, null, Instant.now());
        assertEquals(Escalation.MAX_FINDINGS, escalation.findingsSoFar().length());

        Escalation resolved = escalation.resolve("user");
        assertEquals(EscalationStatus.RESOLVED, resolved.status());
        assertEquals("user", resolved.chosenTarget());
    }

    @Test
    @DisplayName("mission snapshots copy their inputs")
    void missionSnapshot() {
        var tasks = new ArrayList<Task>();
        tasks.add(new Task("t1", null, "a", null, false, null, false, TaskStatus.DONE, "ok"));
        var mission = new Mission("m1", tasks, MissionStatus.COMPLETED, null, null, Instant.now(), null);
        tasks.clear();

        assertEquals(1, mission.tasks().size());
        assertEquals(1, mission.countByStatus(TaskStatus.DONE));
        assertNull(mission.task("t9"));
        assertTrue(MissionStatus.PARTIAL.isTerminal());
        assertFalse(MissionStatus.RUNNING.isTerminal());
        assertTrue(TaskStatus.SKIPPED.blocksDependents());
        assertFalse(TaskStatus.DONE.blocksDependents());
    }
}
