package com.drover.dispatch.cli;

import com.drover.core.agents.Agent;
import com.drover.core.agents.AgentRegistry;
import com.drover.core.inference.InferenceRouter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: drover agents
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List the configured agent fleet")
@Component
public class AgentsCommand implements Runnable {

    private final AgentRegistry agentRegistry;
    private final InferenceRouter router;

    public AgentsCommand(AgentRegistry agentRegistry, InferenceRouter router) {
        this.agentRegistry = agentRegistry;
        this.router = router;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (agentRegistry.all().isEmpty()) {
            ConsoleOutput.error("No agents configured (drover.agents.definitions)");
            return;
        }
        for (Agent agent : agentRegistry.all()) {
            String marker = agent.agentId().equals(agentRegistry.defaultAgentId()) ? " (default)" : "";
            System.out.printf("  %-12s model=%-12s tools=%-5s slot=%-5s %s%s%n",
                    agent.agentId(), agent.modelKey(), agent.canUseTools(), router.hasSlot(agent.modelKey()),
                    String.join(",", agent.capabilities()), marker);
        }
    }
}
