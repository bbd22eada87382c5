package com.drover.core.agents;

import com.drover.core.channel.ChannelManager;
import com.drover.core.inference.ToolCall;
import com.drover.core.inference.ToolDefinition;
import com.drover.core.workspace.SharedWorkspace;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registered tools and their handlers. Comes with tools over the shared workspace and channels.
 */
@Service
public class ToolRegistry implements ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    public static final String READ_WORKSPACE = "read_workspace";
    public static final String POST_TO_CHANNEL = "post_to_channel";

    private record RegisteredTool(ToolDefinition definition, Function<ToolInvocation, String> handler) {}

    private final Map<String, RegisteredTool> tools = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public ToolRegistry(ObjectMapper objectMapper, SharedWorkspace workspace, ChannelManager channels) {
        this.objectMapper = objectMapper;

        register(new ToolDefinition(READ_WORKSPACE,
                "Read the findings other agents have recorded for this mission",
                Map.of("type", "object", "properties", Map.of())),
                inv -> {
                    String summary = workspace.missionSummary(inv.missionId());
                    return summary.isBlank() ? "No findings recorded yet." : summary;
                });

        register(new ToolDefinition(POST_TO_CHANNEL,
                "Post a message to a named agent channel",
                Map.of("type", "object",
                        "properties", Map.of(
                                "channel", Map.of("type", "string"),
                                "content", Map.of("type", "string")),
                        "required", List.of("channel", "content"))),
                inv -> {
                    var posted = channels.post(inv.argument("channel", ""), inv.agentId(),
                            inv.argument("content", ""), Map.of("mission_id", String.valueOf(inv.missionId())));
                    return "Posted message " + posted.id() + " to #" + posted.channel();
                });
    }

    public void register(ToolDefinition definition, Function<ToolInvocation, String> handler) {
        tools.put(definition.name(), new RegisteredTool(definition, handler));
        log.debug("Registered tool {}", definition.name());
    }

    @Override
    public List<ToolDefinition> definitions() {
        var sorted = new LinkedHashMap<String, ToolDefinition>();
        tools.keySet().stream().sorted().forEach(name -> sorted.put(name, tools.get(name).definition()));
        return List.copyOf(sorted.values());
    }

    @Override
    public String execute(String agentId, String missionId, ToolCall call) {
        RegisteredTool tool = tools.get(call.name());
        if (tool == null) {
            throw new IllegalArgumentException("Unknown tool: " + call.name());
        }
        JsonNode arguments;
        try {
            arguments = objectMapper.readTree(call.arguments() == null || call.arguments().isBlank() ? "{}" : call.arguments());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed arguments for " + call.name() + ": " + e.getOriginalMessage(), e);
        }
        log.debug("Agent {} calling tool {}", agentId, call.name());
        return tool.handler().apply(new ToolInvocation(agentId, missionId, arguments));
    }
}
