package com.drover.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a mission runs, consumed by listeners such as the CLI progress view.
 *
 * @param eventType event name (e.g. "mission.created", "task.started", "escalation.requested")
 * @param missionId the mission this event belongs to
 * @param taskId    the task it relates to (nullable for mission-level events)
 * @param payload   event data
 * @param timestamp when the event occurred
 */
public record DroverEvent(
    String eventType,
    String missionId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static DroverEvent of(String eventType, String missionId, String taskId, Map<String, Object> payload) {
        return new DroverEvent(eventType, missionId, taskId, payload == null ? Map.of() : payload, Instant.now());
    }
}
