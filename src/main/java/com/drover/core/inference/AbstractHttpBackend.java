package com.drover.core.inference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared plumbing for backends: model-state cache, slot counters, and plain JSON requests over
 * {@link HttpClient} for the server routes Spring AI's model APIs do not cover.
 */
public abstract class AbstractHttpBackend implements InferenceBackend {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpBackend.class);

    protected static final Duration DISCOVERY_TIMEOUT = Duration.ofSeconds(10);
    protected static final Duration LOAD_TIMEOUT = Duration.ofSeconds(120);

    private final String name;
    protected final String baseUrl;
    private final String apiKey;
    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    private final Duration defaultTimeout;
    private final ModelSlots slots;
    protected final ConcurrentHashMap<String, String> modelStates = new ConcurrentHashMap<>();

    protected AbstractHttpBackend(String name, String baseUrl, String apiKey, int maxSlots,
                                  Duration defaultTimeout, HttpClient httpClient, ObjectMapper objectMapper) {
        this.name = name;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.defaultTimeout = defaultTimeout;
        this.slots = new ModelSlots(maxSlots);
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    protected static HttpClient defaultHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ModelSlots slots() {
        return slots;
    }

    @Override
    public String modelState(String modelId) {
        return modelStates.getOrDefault(modelId, "unknown");
    }

    // --- HTTP helpers ---

    protected JsonNode getJson(String path, Duration timeout) {
        var request = requestBuilder(path, timeout).GET().build();
        return readJson(path, send(request, HttpResponse.BodyHandlers.ofString()));
    }

    protected JsonNode postJson(String path, JsonNode body, Duration timeout) {
        var request = requestBuilder(path, timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        return readJson(path, send(request, HttpResponse.BodyHandlers.ofString()));
    }

    /**
     * Posts a body and returns the raw line stream of the response.
     */
    protected TokenStream postStream(String path, JsonNode body, Duration timeout, TokenStream.ChunkDecoder decoder) {
        var request = requestBuilder(path, timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        HttpResponse<InputStream> response = send(request, HttpResponse.BodyHandlers.ofInputStream());
        if (response.statusCode() >= 400) {
            String detail = drain(response.body());
            throw new BackendUnavailableException(name, response.statusCode(),
                    "%s stream request to %s failed (HTTP %d): %s".formatted(name, path, response.statusCode(), detail),
                    null);
        }
        var reader = new BufferedReader(new InputStreamReader(response.body(), StandardCharsets.UTF_8));
        return new TokenStream(name, reader.lines().iterator(), reader, decoder);
    }

    /**
     * Best-effort POST that only reports whether the server accepted it.
     */
    protected boolean postAccepted(String path, JsonNode body, Duration timeout) {
        try {
            postJson(path, body, timeout);
            return true;
        } catch (InferenceException e) {
            log.debug("{} POST {} not accepted: {}", name, path, e.getMessage());
            return false;
        }
    }

    /** True when GET on the path answers below 400. */
    protected boolean reachable(String path) {
        try {
            getJson(path, DISCOVERY_TIMEOUT);
            return true;
        } catch (InferenceException e) {
            return false;
        }
    }

    protected Duration timeoutOr(Duration timeout) {
        return timeout != null ? timeout : defaultTimeout;
    }

    private HttpRequest.Builder requestBuilder(String path, Duration timeout) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeoutOr(timeout));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (HttpTimeoutException e) {
            throw new InferenceTimeoutException(
                    "%s request to %s timed out".formatted(name, request.uri().getPath()), e);
        } catch (IOException e) {
            throw new BackendUnavailableException(name, -1,
                    "Cannot reach %s at %s: %s".formatted(name, baseUrl, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException("Interrupted calling " + name, e);
        }
    }

    private JsonNode readJson(String path, HttpResponse<String> response) {
        if (response.statusCode() >= 400) {
            throw new BackendUnavailableException(name, response.statusCode(),
                    "%s request to %s failed (HTTP %d): %s".formatted(name, path, response.statusCode(), response.body()),
                    null);
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InferenceException("%s returned malformed JSON from %s".formatted(name, path), e);
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return e.getMessage();
        }
    }

    protected static float[] toVector(JsonNode array) {
        float[] vector = new float[array.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) array.get(i).asDouble();
        }
        return vector;
    }
}
