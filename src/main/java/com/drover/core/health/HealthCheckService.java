package com.drover.core.health;

import com.drover.core.agents.Agent;
import com.drover.core.agents.AgentRegistry;
import com.drover.core.inference.InferenceBackend;
import com.drover.core.inference.InferenceRouter;
import com.drover.core.inference.ModelInventory;
import com.drover.core.model.AgentState;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final InferenceRouter router;
    private final AgentRegistry agentRegistry;

    public HealthCheckService(InferenceRouter router, @Autowired(required = false) AgentRegistry agentRegistry) {
        this.router = router;
        this.agentRegistry = agentRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        ModelInventory inventory = router.discoverModels();
        for (InferenceBackend backend : router.backends()) {
            results.add(checkBackend(backend, inventory));
        }
        results.add(checkAgents());
        return results;
    }

    private HealthStatus checkBackend(InferenceBackend backend, ModelInventory inventory) {
        String component = "backend:" + backend.name();
        String error = inventory.errors().get(backend.name());
        if (error != null) {
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    "Unreachable: " + error, Map.of("type", backend.type()));
        }
        int models = inventory.forBackend(backend.name()).size();
        if (models == 0) {
            return new HealthStatus(component, HealthStatus.Status.DEGRADED,
                    "Reachable but serving no models", Map.of("type", backend.type()));
        }
        return new HealthStatus(component, HealthStatus.Status.UP,
                models + " model(s) available", Map.of("type", backend.type(), "models", String.valueOf(models)));
    }

    private HealthStatus checkAgents() {
        if (agentRegistry == null || agentRegistry.all().isEmpty()) {
            return new HealthStatus("agents", HealthStatus.Status.DOWN, "No agents registered", Map.of());
        }
        List<Agent> agents = agentRegistry.all();
        List<String> unhealthy = agents.stream()
                .filter(a -> a.state() == AgentState.ERROR || a.state() == AgentState.SUSPENDED)
                .map(a -> a.agentId() + "=" + a.state())
                .toList();
        var metadata = Map.of("count", String.valueOf(agents.size()), "default", agentRegistry.defaultAgentId());
        if (agentRegistry.get(agentRegistry.defaultAgentId()).isEmpty()) {
            return new HealthStatus("agents", HealthStatus.Status.DEGRADED,
                    "Default agent " + agentRegistry.defaultAgentId() + " is not registered", metadata);
        }
        if (!unhealthy.isEmpty()) {
            return new HealthStatus("agents", HealthStatus.Status.DEGRADED,
                    "Agents not ready: " + String.join(", ", unhealthy), metadata);
        }
        return new HealthStatus("agents", HealthStatus.Status.UP, agents.size() + " agent(s) registered", metadata);
    }
}
