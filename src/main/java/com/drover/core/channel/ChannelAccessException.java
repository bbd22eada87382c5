package com.drover.core.channel;

public class ChannelAccessException extends RuntimeException {

    public ChannelAccessException(String agentId, String channel) {
        super("Agent '%s' is not allowed on channel '%s'".formatted(agentId, channel));
    }
}
