package com.drover.core.agents;

import com.drover.core.events.EventBus;
import com.drover.core.inference.InferenceRouter;
import com.drover.core.inference.ModelLifecycleManager;
import com.drover.core.workspace.SharedWorkspace;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the agent fleet once at startup from {@link AgentProperties}.
 */
@Configuration
public class AgentConfig {

    @Bean
    public AgentRegistry agentRegistry(AgentProperties properties, InferenceRouter router,
                                       ModelLifecycleManager lifecycle, SharedWorkspace workspace,
                                       ToolRegistry toolRegistry, ObjectMapper objectMapper,
                                       EventBus eventBus) {
        var registry = new AgentRegistry(properties.getDefaultAgent());
        for (var def : properties.getDefinitions()) {
            AgentDefinition definition = def.toDefinition();
            Agent agent = switch (def.getKind()) {
                case PROMPT -> new PromptAgent(definition, router, lifecycle, workspace, eventBus);
                case TOOLS -> new ToolCallingAgent(definition, router, lifecycle, workspace, toolRegistry);
                case PLANNER -> new PlannerAgent(definition, router, lifecycle, workspace, objectMapper);
            };
            registry.register(agent);
        }
        return registry;
    }
}
