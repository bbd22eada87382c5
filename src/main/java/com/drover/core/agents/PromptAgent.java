package com.drover.core.agents;

import com.drover.core.events.DroverEvent;
import com.drover.core.events.EventBus;
import com.drover.core.inference.ChatRequest;
import com.drover.core.inference.InferenceRouter;
import com.drover.core.inference.ModelLifecycleManager;
import com.drover.core.model.AgentMessage;
import com.drover.core.workspace.SharedWorkspace;

import java.util.Map;

/**
 * Answers a task with one completion under its configured system prompt.
 * <p>
 * With an {@link EventBus} the completion is streamed and every fragment is published as an
 * {@value #OUTPUT_EVENT} event for the task; without one it is a single blocking call.
 */
public class PromptAgent extends AbstractLlmAgent {

    public static final String OUTPUT_EVENT = "agent.output";

    private final EventBus eventBus;

    public PromptAgent(AgentDefinition definition, InferenceRouter router,
                       ModelLifecycleManager lifecycle, SharedWorkspace workspace) {
        this(definition, router, lifecycle, workspace, null);
    }

    public PromptAgent(AgentDefinition definition, InferenceRouter router, ModelLifecycleManager lifecycle,
                       SharedWorkspace workspace, EventBus eventBus) {
        super(definition, router, lifecycle, workspace);
        this.eventBus = eventBus;
    }

    @Override
    protected AgentMessage execute(AgentMessage message) {
        ChatRequest request = request(conversation(message));
        if (eventBus == null) {
            return finish(message, router.callLlm(modelKey(), request).text());
        }
        String taskId = taskId(message);
        String text = router.callLlmStream(modelKey(), request, fragment -> eventBus.publish(
                DroverEvent.of(OUTPUT_EVENT, message.missionId(), taskId,
                        Map.of("agent_id", agentId(), "text", fragment))));
        return finish(message, text);
    }
}
