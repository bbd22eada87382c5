package com.drover.core.channel;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "drover.channels")
public class ChannelProperties {

    private int bufferSize = 200;
    private List<Definition> definitions = new ArrayList<>();

    public int getBufferSize() {
        return bufferSize;
    }

    public void setBufferSize(int bufferSize) {
        this.bufferSize = bufferSize;
    }

    public List<Definition> getDefinitions() {
        return definitions;
    }

    public void setDefinitions(List<Definition> definitions) {
        this.definitions = definitions;
    }

    public static class Definition {
        private String name;
        private String description = "";
        /** Agents allowed to post and read; empty means every agent. */
        private List<String> allowedAgents = new ArrayList<>();

        public Definition() {}

        public Definition(String name, String description, List<String> allowedAgents) {
            this.name = name;
            this.description = description;
            this.allowedAgents = allowedAgents;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public List<String> getAllowedAgents() {
            return allowedAgents;
        }

        public void setAllowedAgents(List<String> allowedAgents) {
            this.allowedAgents = allowedAgents;
        }
    }
}
