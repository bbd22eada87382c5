package com.drover.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An immutable unit of communication between the scheduler and agents.
 * <p>
 * Consumed once by its recipient and retained in the mission log for inspection.
 *
 * @param id        unique message id
 * @param type      message kind
 * @param sender    agent id (or "scheduler") that produced the message
 * @param recipient agent id the message is addressed to
 * @param missionId mission this message belongs to
 * @param content   free-text body
 * @param payload   open key/value data
 * @param priority  delivery priority
 * @param parentId  id of the message this one answers (nullable)
 * @param createdAt creation time
 */
public record AgentMessage(
    String id,
    MessageType type,
    String sender,
    String recipient,
    @JsonProperty("mission_id") String missionId,
    String content,
    Map<String, Object> payload,
    Priority priority,
    @JsonProperty("parent_msg_id") String parentId,
    @JsonProperty("created_at") Instant createdAt
) {

    public AgentMessage {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        content = content == null ? "" : content;
        priority = priority == null ? Priority.NORMAL : priority;
    }

    public static AgentMessage create(MessageType type, String sender, String recipient,
                                      String missionId, String content, Map<String, Object> payload) {
        return new AgentMessage(UUID.randomUUID().toString().substring(0, 12), type, sender, recipient,
                missionId, content, payload, Priority.NORMAL, null, Instant.now());
    }

    /**
     * Builds a reply addressed back to this message's sender.
     */
    public AgentMessage reply(MessageType replyType, String content, Map<String, Object> payload) {
        return new AgentMessage(UUID.randomUUID().toString().substring(0, 12), replyType, recipient, sender,
                missionId, content, payload, priority, id, Instant.now());
    }

    /**
     * Returns a copy with one extra payload entry.
     */
    public AgentMessage withPayloadEntry(String key, Object value) {
        var copy = new LinkedHashMap<>(payload);
        copy.put(key, value);
        return new AgentMessage(id, type, sender, recipient, missionId, content, copy, priority, parentId, createdAt);
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }

    public boolean payloadFlag(String key) {
        Object value = payload.get(key);
        return value instanceof Boolean b ? b : value != null && Boolean.parseBoolean(value.toString());
    }
}
