package com.drover.core.model;

/**
 * Kind of an {@link AgentMessage} exchanged on the message bus.
 */
public enum MessageType {
    TASK,
    DIRECTIVE,
    CANCEL,
    REQUEST,
    QUERY,
    RESPONSE,
    OBSERVATION,
    RESULT,
    PROGRESS,
    ESCALATION_REQUEST,
    AUDIT,
    CHANNEL
}
