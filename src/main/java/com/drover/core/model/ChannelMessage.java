package com.drover.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message posted to a named agent channel.
 *
 * @param id        message id
 * @param channel   channel name
 * @param sender    posting agent
 * @param content   body text
 * @param timestamp post time
 * @param payload   structured extras
 */
public record ChannelMessage(
    String id,
    String channel,
    String sender,
    String content,
    Instant timestamp,
    Map<String, Object> payload
) {

    public ChannelMessage {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
