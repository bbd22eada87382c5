package com.drover.core.agents;

import com.drover.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The set of runnable agents and the rules for picking one for a task.
 * <p>
 * Routing order: exact agent id, then an agent's model key, then a capability hint (the task's
 * own hint, or a target that names a capability), then the default agent.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();
    private final String defaultAgentId;

    public AgentRegistry(String defaultAgentId) {
        this.defaultAgentId = defaultAgentId;
    }

    /**
     * @throws IllegalArgumentException if an agent with the same id is already registered
     */
    public void register(Agent agent) {
        if (agents.putIfAbsent(agent.agentId(), agent) != null) {
            throw new IllegalArgumentException("Agent already registered: " + agent.agentId());
        }
        order.add(agent.agentId());
        log.info("Registered agent {} (model={}, capabilities={})", agent.agentId(), agent.modelKey(),
                agent.capabilities());
    }

    public Optional<Agent> get(String agentId) {
        return Optional.ofNullable(agentId == null ? null : agents.get(agentId));
    }

    /** Agents in registration order. */
    public List<Agent> all() {
        return order.stream().map(agents::get).toList();
    }

    public List<Agent> byCapability(String capability) {
        return all().stream().filter(a -> a.capabilities().contains(capability)).toList();
    }

    public List<String> ids() {
        return List.copyOf(order);
    }

    public String defaultAgentId() {
        return defaultAgentId;
    }

    public <T extends Agent> Optional<T> firstOfType(Class<T> type) {
        return all().stream().filter(type::isInstance).map(type::cast).findFirst();
    }

    /**
     * Picks the agent for a task.
     *
     * @throws RoutingException if nothing matches and no default agent is registered
     */
    public Agent routeTask(Task task) {
        String target = task.target();
        if (target != null) {
            Agent exact = agents.get(target);
            if (exact != null) {
                return exact;
            }
            Optional<Agent> byModel = all().stream().filter(a -> target.equals(a.modelKey())).findFirst();
            if (byModel.isPresent()) {
                return byModel.get();
            }
        }
        for (String hint : capabilityHints(task)) {
            List<Agent> capable = byCapability(hint);
            if (!capable.isEmpty()) {
                log.debug("Task {} routed by capability '{}' to {}", task.id(), hint, capable.get(0).agentId());
                return capable.get(0);
            }
        }
        Agent fallback = agents.get(defaultAgentId);
        if (fallback == null) {
            throw new RoutingException(task.id(), target);
        }
        if (target != null) {
            log.debug("Task {} target '{}' unmatched, using default agent {}", task.id(), target, defaultAgentId);
        }
        return fallback;
    }

    private static Collection<String> capabilityHints(Task task) {
        if (task.capability() != null && task.target() != null) {
            return List.of(task.capability(), task.target());
        }
        if (task.capability() != null) {
            return List.of(task.capability());
        }
        return task.target() != null ? List.of(task.target()) : List.of();
    }
}
