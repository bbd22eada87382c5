package com.drover.core.escalation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Escalation targets bound from {@code drover.escalation.*}.
 */
@Component
@ConfigurationProperties(prefix = "drover.escalation")
public class EscalationProperties {

    public static final String USER_TARGET = "user";

    private List<Target> targets = new ArrayList<>(List.of(
            new Target(USER_TARGET, "Handle it yourself", "Take the findings so far and finish manually",
                    0, true, null)));

    /** Resolved or discarded escalations kept for inspection before the oldest are evicted. */
    private int maxRetained = 200;

    public int getMaxRetained() {
        return maxRetained;
    }

    public void setMaxRetained(int maxRetained) {
        this.maxRetained = maxRetained;
    }

    public List<Target> getTargets() {
        return targets;
    }

    public void setTargets(List<Target> targets) {
        this.targets = targets;
    }

    public static class Target {
        private String key;
        private String label;
        private String description = "";
        private double memoryCost;
        /** Available regardless of which agents are registered. */
        private boolean alwaysAvailable;
        /** Agent the task is redirected to when this target is chosen (nullable). */
        private String agentId;

        public Target() {}

        public Target(String key, String label, String description, double memoryCost,
                      boolean alwaysAvailable, String agentId) {
            this.key = key;
            this.label = label;
            this.description = description;
            this.memoryCost = memoryCost;
            this.alwaysAvailable = alwaysAvailable;
            this.agentId = agentId;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public double getMemoryCost() {
            return memoryCost;
        }

        public void setMemoryCost(double memoryCost) {
            this.memoryCost = memoryCost;
        }

        public boolean isAlwaysAvailable() {
            return alwaysAvailable;
        }

        public void setAlwaysAvailable(boolean alwaysAvailable) {
            this.alwaysAvailable = alwaysAvailable;
        }

        public String getAgentId() {
            return agentId;
        }

        public void setAgentId(String agentId) {
            this.agentId = agentId;
        }
    }
}
