package com.drover.core.bus;

import com.drover.core.model.AgentMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers messages between the scheduler and agents.
 * <p>
 * Each recipient has its own FIFO queue, so messages to one recipient are taken in send order;
 * nothing is promised across recipients. Every message is also appended to its mission's log,
 * which is kept until the bus retains more than {@code maxRetained} messages, at which point the
 * oldest missions' logs are dropped.
 */
@Service
public class MessageBus {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    public static final String INJECTION_WARNING = "_injection_warning";

    private final ConcurrentHashMap<String, Queue<AgentMessage>> queues = new ConcurrentHashMap<>();
    private final LinkedHashMap<String, List<AgentMessage>> missionLogs = new LinkedHashMap<>();
    private final CopyOnWriteArrayList<Consumer<AgentMessage>> monitors = new CopyOnWriteArrayList<>();
    private final int maxRetained;
    private int retained;

    @Autowired
    public MessageBus(@Value("${drover.bus.max-retained:5000}") int maxRetained) {
        this.maxRetained = maxRetained;
    }

    /**
     * Enqueues a message for its recipient. Suspicious content is tagged with
     * {@value #INJECTION_WARNING} but still delivered.
     */
    public AgentMessage send(AgentMessage message) {
        List<String> matches = InjectionScanner.scan(message);
        if (!matches.isEmpty()) {
            log.warn("Injection patterns in message {} from {} to {}: {}",
                    message.id(), message.sender(), message.recipient(), matches);
            message = message.withPayloadEntry(INJECTION_WARNING, matches);
        }

        queues.computeIfAbsent(message.recipient(), k -> new ConcurrentLinkedQueue<>()).add(message);
        appendToLog(message);

        for (Consumer<AgentMessage> monitor : monitors) {
            try {
                monitor.accept(message);
            } catch (Exception e) {
                log.error("Message monitor failed on {}: {}", message.id(), e.getMessage(), e);
            }
        }
        return message;
    }

    /**
     * Registers a hook that sees every message after it is enqueued.
     */
    public void addMonitor(Consumer<AgentMessage> monitor) {
        monitors.add(monitor);
    }

    /** Takes the next message for the agent, if any. */
    public Optional<AgentMessage> poll(String agentId) {
        Queue<AgentMessage> queue = queues.get(agentId);
        return queue == null ? Optional.empty() : Optional.ofNullable(queue.poll());
    }

    /** Snapshot of the agent's queue without consuming it. */
    public List<AgentMessage> getPending(String agentId) {
        Queue<AgentMessage> queue = queues.get(agentId);
        return queue == null ? List.of() : List.copyOf(queue);
    }

    /** Removes and returns every queued message for the agent, in send order. */
    public List<AgentMessage> drain(String agentId) {
        var drained = new ArrayList<AgentMessage>();
        Queue<AgentMessage> queue = queues.get(agentId);
        if (queue != null) {
            AgentMessage next;
            while ((next = queue.poll()) != null) {
                drained.add(next);
            }
        }
        return drained;
    }

    /**
     * Forgets a recipient that will never poll again and returns what was still queued for it.
     * A later send to the same address starts a fresh queue.
     */
    public List<AgentMessage> removeQueue(String recipient) {
        Queue<AgentMessage> queue = queues.remove(recipient);
        return queue == null ? List.of() : List.copyOf(queue);
    }

    public boolean hasQueue(String recipient) {
        return queues.containsKey(recipient);
    }

    public boolean hasPending(String agentId) {
        Queue<AgentMessage> queue = queues.get(agentId);
        return queue != null && !queue.isEmpty();
    }

    public List<String> agentsWithPending() {
        return queues.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .toList();
    }

    public synchronized List<AgentMessage> missionMessages(String missionId) {
        return List.copyOf(missionLogs.getOrDefault(missionId, List.of()));
    }

    private synchronized void appendToLog(AgentMessage message) {
        String missionId = message.missionId() == null ? "" : message.missionId();
        missionLogs.computeIfAbsent(missionId, k -> new ArrayList<>()).add(message);
        retained++;
        Iterator<Map.Entry<String, List<AgentMessage>>> it = missionLogs.entrySet().iterator();
        while (retained > maxRetained && missionLogs.size() > 1 && it.hasNext()) {
            var eldest = it.next();
            if (eldest.getKey().equals(missionId)) continue;
            retained -= eldest.getValue().size();
            it.remove();
            log.debug("Evicted message log of mission {}", eldest.getKey());
        }
    }
}
