package com.drover.core.channel;

import com.drover.core.model.ChannelMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Named broadcast channels between agents. Each channel keeps its newest
 * {@code bufferSize} messages and only admits its allowed agents.
 */
@Service
public class ChannelManager {

    private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);

    /**
     * Public view of a channel.
     *
     * @param name          channel name
     * @param description   purpose
     * @param allowedAgents agents admitted (empty for all)
     * @param messageCount  buffered messages
     */
    public record ChannelInfo(String name, String description, Set<String> allowedAgents, int messageCount) {}

    private final int bufferSize;
    private final Map<String, Channel> channels = new LinkedHashMap<>();

    public ChannelManager(ChannelProperties properties) {
        this.bufferSize = properties.getBufferSize();
        for (var def : properties.getDefinitions()) {
            channels.put(def.getName(), new Channel(def.getName(), def.getDescription(), Set.copyOf(def.getAllowedAgents())));
        }
        log.info("Channels configured: {}", channels.keySet());
    }

    /**
     * Posts to a channel.
     *
     * @throws IllegalArgumentException if the channel does not exist
     * @throws ChannelAccessException   if the sender is not allowed on it
     */
    public ChannelMessage post(String channel, String sender, String content, Map<String, Object> payload) {
        Channel ch = require(channel);
        ch.checkAccess(sender);
        var message = new ChannelMessage(UUID.randomUUID().toString().substring(0, 12), channel, sender, content,
                Instant.now(), payload);
        synchronized (ch) {
            ch.messages.addLast(message);
            while (ch.messages.size() > bufferSize) {
                ch.messages.removeFirst();
            }
        }
        log.debug("{} posted to #{}", sender, channel);
        return message;
    }

    /**
     * Reads buffered messages, oldest first.
     *
     * @param since only messages strictly after this time (nullable for all)
     * @param limit maximum number of newest messages returned; zero or less returns nothing
     */
    public List<ChannelMessage> read(String channel, String agentId, Instant since, int limit) {
        Channel ch = require(channel);
        ch.checkAccess(agentId);
        synchronized (ch) {
            List<ChannelMessage> matching = ch.messages.stream()
                    .filter(m -> since == null || m.timestamp().isAfter(since))
                    .toList();
            int from = Math.max(0, matching.size() - Math.max(0, limit));
            return List.copyOf(matching.subList(from, matching.size()));
        }
    }

    public List<ChannelInfo> channelsFor(String agentId) {
        return channels.values().stream()
                .filter(ch -> ch.allows(agentId))
                .map(Channel::info)
                .toList();
    }

    public List<ChannelInfo> allChannels() {
        return channels.values().stream().map(Channel::info).toList();
    }

    private Channel require(String channel) {
        Channel ch = channels.get(channel);
        if (ch == null) {
            throw new IllegalArgumentException("Unknown channel: " + channel);
        }
        return ch;
    }

    private static final class Channel {
        private final String name;
        private final String description;
        private final Set<String> allowedAgents;
        private final Deque<ChannelMessage> messages = new ArrayDeque<>();

        private Channel(String name, String description, Set<String> allowedAgents) {
            this.name = name;
            this.description = description;
            this.allowedAgents = allowedAgents;
        }

        private boolean allows(String agentId) {
            return allowedAgents.isEmpty() || allowedAgents.contains(agentId);
        }

        private void checkAccess(String agentId) {
            if (!allows(agentId)) {
                throw new ChannelAccessException(agentId, name);
            }
        }

        private synchronized ChannelInfo info() {
            return new ChannelInfo(name, description, allowedAgents, messages.size());
        }
    }
}
