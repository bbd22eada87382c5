package com.drover.core.agents;

import com.drover.core.inference.AdmissionRejectedException;
import com.drover.core.inference.ChatMessage;
import com.drover.core.inference.ChatRequest;
import com.drover.core.inference.InferenceException;
import com.drover.core.inference.InferenceRouter;
import com.drover.core.inference.ModelLifecycleManager;
import com.drover.core.logging.MdcContext;
import com.drover.core.model.AgentMessage;
import com.drover.core.model.AgentState;
import com.drover.core.model.MessageKeys;
import com.drover.core.model.MessageType;
import com.drover.core.workspace.SharedWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base for agents backed by one model key.
 * <p>
 * Every run holds one of the model's slots for its whole duration; when none is free the run is
 * rejected with {@link AdmissionRejectedException} before any work is done. Inference failures
 * become error RESULT messages, so a failing backend fails the task and not the caller.
 */
public abstract class AbstractLlmAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(AbstractLlmAgent.class);

    /** Marker a model answers with when a request is beyond what the local fleet can do. */
    public static final String NEEDS_ESCALATION = "NEEDS_ESCALATION";

    protected final AgentDefinition definition;
    protected final InferenceRouter router;
    protected final ModelLifecycleManager lifecycle;
    protected final SharedWorkspace workspace;

    private final AtomicInteger activeRuns = new AtomicInteger();
    private volatile AgentState state = AgentState.IDLE;
    private volatile boolean suspended;

    protected AbstractLlmAgent(AgentDefinition definition, InferenceRouter router,
                               ModelLifecycleManager lifecycle, SharedWorkspace workspace) {
        this.definition = definition;
        this.router = router;
        this.lifecycle = lifecycle;
        this.workspace = workspace;
    }

    @Override
    public String agentId() {
        return definition.agentId();
    }

    @Override
    public String modelKey() {
        return definition.modelKey();
    }

    @Override
    public Set<String> capabilities() {
        return definition.capabilities();
    }

    @Override
    public boolean canUseTools() {
        return definition.canUseTools();
    }

    @Override
    public AgentState state() {
        return suspended ? AgentState.SUSPENDED : state;
    }

    public AgentDefinition definition() {
        return definition;
    }

    /** Stops the agent from taking new work until {@link #resume()}. */
    public void suspend() {
        suspended = true;
        log.info("Agent {} suspended", agentId());
    }

    public void resume() {
        suspended = false;
        log.info("Agent {} resumed", agentId());
    }

    @Override
    public final AgentMessage run(AgentMessage message) {
        if (suspended) {
            return errorResult(message, "Agent " + agentId() + " is suspended");
        }
        if (!router.acquireSlot(modelKey())) {
            throw new AdmissionRejectedException(modelKey());
        }
        activeRuns.incrementAndGet();
        state = AgentState.RUNNING;
        String previousAgent = MDC.get(MdcContext.AGENT_ID);
        MDC.put(MdcContext.AGENT_ID, agentId());
        boolean failed = false;
        try {
            if (lifecycle != null && !lifecycle.ensureLoaded(modelKey())) {
                log.warn("Model {} for agent {} is not loaded; sending the request anyway", modelKey(), agentId());
            }
            return execute(message);
        } catch (InferenceException e) {
            failed = true;
            log.warn("Agent {} failed on message {}: {}", agentId(), message.id(), e.getMessage());
            return errorResult(message, e.getMessage());
        } catch (RuntimeException e) {
            failed = true;
            throw e;
        } finally {
            router.releaseSlot(modelKey());
            if (lifecycle != null) {
                lifecycle.release(modelKey());
            }
            if (activeRuns.decrementAndGet() == 0) {
                state = failed ? AgentState.ERROR : AgentState.IDLE;
            }
            if (previousAgent == null) {
                MDC.remove(MdcContext.AGENT_ID);
            } else {
                MDC.put(MdcContext.AGENT_ID, previousAgent);
            }
        }
    }

    /**
     * Does the agent's work while a model slot is held.
     */
    protected abstract AgentMessage execute(AgentMessage message);

    protected ChatRequest request(List<ChatMessage> messages) {
        return ChatRequest.of(messages).withSampling(definition.maxTokens(), definition.temperature());
    }

    /**
     * System prompt plus the mission's earlier findings, followed by the task itself.
     */
    protected List<ChatMessage> conversation(AgentMessage message) {
        var messages = new ArrayList<ChatMessage>();
        if (!definition.systemPrompt().isBlank()) {
            messages.add(ChatMessage.system(definition.systemPrompt()));
        }
        String findings = priorFindings(message.missionId());
        if (!findings.isBlank()) {
            messages.add(ChatMessage.system("Findings from other agents so far:\n\n" + findings));
        }
        messages.add(ChatMessage.user(message.content()));
        return messages;
    }

    protected String priorFindings(String missionId) {
        return workspace == null || missionId == null ? "" : workspace.missionSummary(missionId);
    }

    /**
     * Turns model output into a RESULT, or an ESCALATION_REQUEST when the model answered with
     * {@link #NEEDS_ESCALATION}. Results are recorded in the shared workspace.
     */
    protected AgentMessage finish(AgentMessage message, String text) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.startsWith(NEEDS_ESCALATION)) {
            String reason = trimmed.substring(NEEDS_ESCALATION.length()).replaceFirst("^[:\\s]+", "");
            return message.reply(MessageType.ESCALATION_REQUEST,
                    reason.isBlank() ? "Agent " + agentId() + " requested escalation" : reason,
                    Map.of(MessageKeys.TASK_ID, taskId(message), MessageKeys.FINDINGS, priorFindings(message.missionId())));
        }
        if (workspace != null && message.missionId() != null) {
            workspace.add(message.missionId(), agentId(), "result", "Task " + taskId(message), trimmed,
                    List.of(agentId()), List.of());
        }
        return message.reply(MessageType.RESULT, trimmed, resultPayload(message, false));
    }

    protected AgentMessage errorResult(AgentMessage message, String error) {
        state = AgentState.ERROR;
        return message.reply(MessageType.RESULT, error == null ? "unknown error" : error, resultPayload(message, true));
    }

    private static Map<String, Object> resultPayload(AgentMessage message, boolean error) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put(MessageKeys.TASK_ID, taskId(message));
        payload.put(MessageKeys.ERROR, error);
        return payload;
    }

    protected static String taskId(AgentMessage message) {
        String id = message.payloadString(MessageKeys.TASK_ID);
        return id == null ? message.id() : id;
    }
}
