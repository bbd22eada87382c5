package com.drover.core.agents;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Agent fleet bound from {@code drover.agents.*}.
 */
@Component
@ConfigurationProperties(prefix = "drover.agents")
public class AgentProperties {

    /** Agent that takes tasks no other rule routes. */
    private String defaultAgent = "hermes";
    private List<Definition> definitions = new ArrayList<>();

    public String getDefaultAgent() {
        return defaultAgent;
    }

    public void setDefaultAgent(String defaultAgent) {
        this.defaultAgent = defaultAgent;
    }

    public List<Definition> getDefinitions() {
        return definitions;
    }

    public void setDefinitions(List<Definition> definitions) {
        this.definitions = definitions;
    }

    public enum Kind { PROMPT, TOOLS, PLANNER }

    public static class Definition {
        private String id;
        private Kind kind = Kind.PROMPT;
        private String modelKey = "primary";
        private List<String> capabilities = new ArrayList<>();
        private boolean canUseTools;
        private List<String> allowedTools = new ArrayList<>();
        private Integer maxTokens;
        private Double temperature;
        private String systemPrompt = "";
        private int maxToolRounds = 5;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public Kind getKind() {
            return kind;
        }

        public void setKind(Kind kind) {
            this.kind = kind;
        }

        public String getModelKey() {
            return modelKey;
        }

        public void setModelKey(String modelKey) {
            this.modelKey = modelKey;
        }

        public List<String> getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(List<String> capabilities) {
            this.capabilities = capabilities;
        }

        public boolean isCanUseTools() {
            return canUseTools;
        }

        public void setCanUseTools(boolean canUseTools) {
            this.canUseTools = canUseTools;
        }

        public List<String> getAllowedTools() {
            return allowedTools;
        }

        public void setAllowedTools(List<String> allowedTools) {
            this.allowedTools = allowedTools;
        }

        public Integer getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public String getSystemPrompt() {
            return systemPrompt;
        }

        public void setSystemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
        }

        public int getMaxToolRounds() {
            return maxToolRounds;
        }

        public void setMaxToolRounds(int maxToolRounds) {
            this.maxToolRounds = maxToolRounds;
        }

        AgentDefinition toDefinition() {
            return new AgentDefinition(id, modelKey, new LinkedHashSet<>(capabilities), canUseTools,
                    allowedTools, maxTokens, temperature, systemPrompt, maxToolRounds);
        }
    }
}
