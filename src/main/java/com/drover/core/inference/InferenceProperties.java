package com.drover.core.inference;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Backends, model-key mappings and lifecycle settings bound from {@code drover.inference.*}.
 */
@Component
@ConfigurationProperties(prefix = "drover.inference")
public class InferenceProperties {

    private List<Backend> backends = new ArrayList<>();
    private List<ModelMapping> models = new ArrayList<>();
    private int defaultMaxTokens = 2048;
    private double defaultTemperature = 0.7;
    private Lifecycle lifecycle = new Lifecycle();

    public List<Backend> getBackends() {
        return backends;
    }

    public void setBackends(List<Backend> backends) {
        this.backends = backends;
    }

    public List<ModelMapping> getModels() {
        return models;
    }

    public void setModels(List<ModelMapping> models) {
        this.models = models;
    }

    public int getDefaultMaxTokens() {
        return defaultMaxTokens;
    }

    public void setDefaultMaxTokens(int defaultMaxTokens) {
        this.defaultMaxTokens = defaultMaxTokens;
    }

    public double getDefaultTemperature() {
        return defaultTemperature;
    }

    public void setDefaultTemperature(double defaultTemperature) {
        this.defaultTemperature = defaultTemperature;
    }

    public Lifecycle getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(Lifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    public static class Backend {
        private String name = "default";
        /** openai, ollama or llamacpp */
        private String type = OpenAiCompatBackend.TYPE;
        private String url = "http://localhost:1234";
        private String apiKey = "";
        private boolean enabled = true;
        private int maxSlots = ModelSlots.DEFAULT_CAPACITY;
        private Duration timeout = Duration.ofSeconds(120);

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxSlots() {
            return maxSlots;
        }

        public void setMaxSlots(int maxSlots) {
            this.maxSlots = maxSlots;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    /**
     * Maps a logical model key (primary, classifier, ...) to a backend and model id.
     */
    public static class ModelMapping {
        private String key;
        private String backend = "default";
        private String modelId;
        private Integer maxTokens;
        private Double temperature;

        public ModelMapping() {}

        public ModelMapping(String key, String backend, String modelId) {
            this.key = key;
            this.backend = backend;
            this.modelId = modelId;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
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
    }

    public static class Lifecycle {
        /** Model keys loaded at startup and never unloaded. */
        private List<String> alwaysLoaded = new ArrayList<>();
        /** Model keys unloaded once idle for {@link #unloadAfter}. */
        private List<String> managed = new ArrayList<>();
        private Duration unloadAfter = Duration.ofSeconds(300);

        public List<String> getAlwaysLoaded() {
            return alwaysLoaded;
        }

        public void setAlwaysLoaded(List<String> alwaysLoaded) {
            this.alwaysLoaded = alwaysLoaded;
        }

        public List<String> getManaged() {
            return managed;
        }

        public void setManaged(List<String> managed) {
            this.managed = managed;
        }

        public Duration getUnloadAfter() {
            return unloadAfter;
        }

        public void setUnloadAfter(Duration unloadAfter) {
            this.unloadAfter = unloadAfter;
        }
    }
}
