package com.drover.core.agents;

import com.drover.core.model.AgentMessage;
import com.drover.core.model.AgentState;
import com.drover.core.model.MessageKeys;
import com.drover.core.model.MessageType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Agent whose behaviour is a plain function, for scheduler and supervisor tests.
 */
public class StubAgent implements Agent {

    private final String agentId;
    private final String modelKey;
    private final Set<String> capabilities;
    private final Function<AgentMessage, AgentMessage> behaviour;
    private final List<String> handledTasks = new CopyOnWriteArrayList<>();

    public StubAgent(String agentId, Set<String> capabilities, Function<AgentMessage, AgentMessage> behaviour) {
        this.agentId = agentId;
        this.modelKey = agentId + "-model";
        this.capabilities = capabilities;
        this.behaviour = behaviour;
    }

    /** Answers every task with "&lt;agentId&gt;: &lt;description&gt;". */
    public static StubAgent echo(String agentId, String... capabilities) {
        return new StubAgent(agentId, Set.of(capabilities),
                m -> result(m, agentId + ": " + m.content()));
    }

    public static AgentMessage result(AgentMessage message, String text) {
        return message.reply(MessageType.RESULT, text, payload(message, false));
    }

    public static AgentMessage error(AgentMessage message, String text) {
        return message.reply(MessageType.RESULT, text, payload(message, true));
    }

    private static LinkedHashMap<String, Object> payload(AgentMessage message, boolean error) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put(MessageKeys.TASK_ID, message.payloadString(MessageKeys.TASK_ID));
        payload.put(MessageKeys.ERROR, error);
        return payload;
    }

    /** Task ids in the order this agent started them. */
    public List<String> handledTasks() {
        return Collections.unmodifiableList(handledTasks);
    }

    @Override
    public String agentId() {
        return agentId;
    }

    @Override
    public String modelKey() {
        return modelKey;
    }

    @Override
    public Set<String> capabilities() {
        return capabilities;
    }

    @Override
    public boolean canUseTools() {
        return false;
    }

    @Override
    public AgentState state() {
        return AgentState.IDLE;
    }

    @Override
    public AgentMessage run(AgentMessage message) {
        handledTasks.add(message.payloadString(MessageKeys.TASK_ID));
        return behaviour.apply(message);
    }
}
