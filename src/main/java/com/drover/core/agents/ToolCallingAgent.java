package com.drover.core.agents;

import com.drover.core.inference.ChatMessage;
import com.drover.core.inference.ChatRequest;
import com.drover.core.inference.ChatResponse;
import com.drover.core.inference.InferenceRouter;
import com.drover.core.inference.ModelLifecycleManager;
import com.drover.core.inference.ToolCall;
import com.drover.core.inference.ToolDefinition;
import com.drover.core.model.AgentMessage;
import com.drover.core.model.MessageKeys;
import com.drover.core.workspace.SharedWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * General-purpose executor agent that may call tools in a bounded loop.
 * <p>
 * Each round the model either answers or asks for tools; results are fed back as tool messages.
 * A call identical to an earlier one in the same task is not repeated. Once the round limit is hit
 * the model is asked for a final answer without tools.
 */
public class ToolCallingAgent extends AbstractLlmAgent {

    private static final Logger log = LoggerFactory.getLogger(ToolCallingAgent.class);

    private final ToolExecutor toolExecutor;

    public ToolCallingAgent(AgentDefinition definition, InferenceRouter router, ModelLifecycleManager lifecycle,
                            SharedWorkspace workspace, ToolExecutor toolExecutor) {
        super(definition, router, lifecycle, workspace);
        this.toolExecutor = toolExecutor;
    }

    @Override
    protected AgentMessage execute(AgentMessage message) {
        List<ToolDefinition> offered = offeredTools();
        boolean useTools = message.payloadFlag(MessageKeys.TOOLS_NEEDED) && !offered.isEmpty();
        var conversation = new ArrayList<>(conversation(message));
        if (!useTools) {
            return finish(message, router.callLlm(modelKey(), request(conversation)).text());
        }

        Set<String> seen = new HashSet<>();
        for (int round = 0; round < Math.max(1, definition.maxToolRounds()); round++) {
            ChatRequest request = request(conversation).withTools(offered, "auto");
            ChatResponse response = router.callLlm(modelKey(), request);
            if (!response.hasToolCalls()) {
                return finish(message, response.text());
            }
            conversation.add(ChatMessage.assistant(response.text(), response.toolCalls()));
            for (ToolCall call : response.toolCalls()) {
                conversation.add(ChatMessage.tool(call.id(), runTool(message, call, seen)));
            }
        }

        log.info("Agent {} hit the tool round limit ({}) on task {}", agentId(), definition.maxToolRounds(), taskId(message));
        ChatResponse last = router.callLlm(modelKey(), request(conversation).withTools(List.of(), null));
        return finish(message, last.text());
    }

    private List<ToolDefinition> offeredTools() {
        if (!canUseTools() || toolExecutor == null) {
            return List.of();
        }
        return toolExecutor.definitions().stream()
                .filter(t -> definition.allowsTool(t.name()))
                .toList();
    }

    private String runTool(AgentMessage message, ToolCall call, Set<String> seen) {
        if (!definition.allowsTool(call.name())) {
            return "Tool " + call.name() + " is not permitted for " + agentId();
        }
        if (!seen.add(call.signature())) {
            return "Duplicate call to " + call.name() + " skipped; use the earlier result.";
        }
        try {
            return toolExecutor.execute(agentId(), message.missionId(), call);
        } catch (RuntimeException e) {
            log.warn("Tool {} failed for agent {}: {}", call.name(), agentId(), e.getMessage());
            return "Tool error: " + e.getMessage();
        }
    }
}
