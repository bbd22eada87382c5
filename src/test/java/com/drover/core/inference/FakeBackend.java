package com.drover.core.inference;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory backend with scripted completions, recording every request it receives.
 */
public class FakeBackend implements InferenceBackend {

    private final String name;
    private final ModelSlots slots;
    private final Deque<ChatResponse> responses = new LinkedList<>();
    private final List<ChatRequest> requests = new CopyOnWriteArrayList<>();
    private final List<String> calledModels = new CopyOnWriteArrayList<>();
    private final Map<String, String> states = new ConcurrentHashMap<>();
    private final List<String> loads = new CopyOnWriteArrayList<>();
    private final List<String> unloads = new CopyOnWriteArrayList<>();
    private List<ModelInfo> models = List.of();
    private RuntimeException failure;

    public FakeBackend(String name, int slotCapacity) {
        this.name = name;
        this.slots = new ModelSlots(slotCapacity);
    }

    public FakeBackend(String name) {
        this(name, ModelSlots.DEFAULT_CAPACITY);
    }

    public synchronized FakeBackend reply(String text) {
        responses.add(ChatResponse.ofText(text));
        return this;
    }

    public synchronized FakeBackend reply(ChatResponse response) {
        responses.add(response);
        return this;
    }

    public FakeBackend failWith(RuntimeException e) {
        this.failure = e;
        return this;
    }

    public FakeBackend withModels(ModelInfo... infos) {
        this.models = List.of(infos);
        return this;
    }

    public List<ChatRequest> requests() {
        return Collections.unmodifiableList(requests);
    }

    public List<String> calledModels() {
        return Collections.unmodifiableList(calledModels);
    }

    public List<String> loads() {
        return loads;
    }

    public List<String> unloads() {
        return unloads;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String type() {
        return "fake";
    }

    @Override
    public List<ModelInfo> discoverModels() {
        if (failure != null) {
            throw failure;
        }
        return models;
    }

    @Override
    public synchronized ChatResponse call(String modelId, ChatRequest request) {
        requests.add(request);
        calledModels.add(modelId);
        if (failure != null) {
            throw failure;
        }
        ChatResponse next = responses.poll();
        return next != null ? next : ChatResponse.ofText("");
    }

    @Override
    public TokenStream stream(String modelId, ChatRequest request) {
        String text = call(modelId, request).text();
        var fragments = new ArrayList<String>();
        for (String word : text.split("(?<= )")) {
            fragments.add(word);
        }
        return TokenStream.ofFragments(name, fragments);
    }

    @Override
    public List<float[]> embed(String modelId, List<String> texts, Duration timeout) {
        return texts.stream().map(t -> new float[]{t.length()}).toList();
    }

    @Override
    public boolean load(String modelId, Integer ttlSeconds) {
        loads.add(modelId);
        states.put(modelId, "loaded");
        return true;
    }

    @Override
    public boolean unload(String modelId) {
        unloads.add(modelId);
        states.put(modelId, "unloaded");
        return true;
    }

    @Override
    public String modelState(String modelId) {
        return states.getOrDefault(modelId, "unknown");
    }

    @Override
    public ModelSlots slots() {
        return slots;
    }

    /** Router over this backend with the given key to model id mappings. */
    public InferenceRouter router(InferenceProperties.ModelMapping... mappings) {
        var properties = new InferenceProperties();
        properties.setModels(List.of(mappings));
        return new InferenceRouter(List.of(this), properties);
    }
}
