package com.drover.core.inference;

import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.model.ApiKey;
import org.springframework.ai.model.NoopApiKey;
import org.springframework.ai.model.SimpleApiKey;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.DefaultResponseErrorHandler;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Spring AI OpenAI chat and embedding models for one OpenAI-compatible server. A separate
 * {@link OpenAiApi} is kept per read timeout, since the timeout belongs to the HTTP client.
 */
final class OpenAiModels {

    /** One attempt per call. Retrying is left to the scheduler. */
    private static final RetryTemplate SINGLE_ATTEMPT = RetryTemplate.builder().maxAttempts(1).build();

    private final String backend;
    private final String baseUrl;
    private final ApiKey apiKey;
    private final ClientBuilders clients;
    private final Map<Duration, Models> byTimeout = new ConcurrentHashMap<>();

    private record Models(OpenAiChatModel chat, OpenAiEmbeddingModel embedding) {
    }

    OpenAiModels(String backend, String baseUrl, String apiKey, ClientBuilders clients) {
        this.backend = backend;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey == null || apiKey.isBlank() ? new NoopApiKey() : new SimpleApiKey(apiKey);
        this.clients = clients;
    }

    ChatResponse call(String modelId, ChatRequest request, Duration timeout) {
        try {
            return SpringAiBridge.fromSpringAi(models(timeout).chat().call(prompt(modelId, request)));
        } catch (RuntimeException e) {
            throw SpringAiBridge.translate(backend, e);
        }
    }

    TokenStream stream(String modelId, ChatRequest request, Duration timeout) {
        return SpringAiBridge.stream(backend,
                Flux.defer(() -> models(timeout).chat().stream(prompt(modelId, request))), timeout);
    }

    List<float[]> embed(String modelId, List<String> texts, Duration timeout) {
        var options = OpenAiEmbeddingOptions.builder().model(modelId).build();
        try {
            return SpringAiBridge.vectors(models(timeout).embedding().call(new EmbeddingRequest(texts, options)));
        } catch (RuntimeException e) {
            throw SpringAiBridge.translate(backend, e);
        }
    }

    private static Prompt prompt(String modelId, ChatRequest request) {
        var options = OpenAiChatOptions.builder()
                .model(modelId)
                .maxTokens(request.maxTokens())
                .temperature(request.temperature())
                .toolCallbacks(SpringAiBridge.toolCallbacks(request))
                .internalToolExecutionEnabled(false)
                .build();
        return new Prompt(SpringAiBridge.toMessages(request.messages()), options);
    }

    private Models models(Duration timeout) {
        return byTimeout.computeIfAbsent(timeout, t -> {
            OpenAiApi api = OpenAiApi.builder()
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .restClientBuilder(clients.rest(t))
                    .webClientBuilder(clients.web())
                    .responseErrorHandler(new DefaultResponseErrorHandler())
                    .build();
            OpenAiChatModel chat = OpenAiChatModel.builder()
                    .openAiApi(api)
                    .defaultOptions(OpenAiChatOptions.builder().internalToolExecutionEnabled(false).build())
                    .retryTemplate(SINGLE_ATTEMPT)
                    .build();
            OpenAiEmbeddingModel embedding = new OpenAiEmbeddingModel(api, MetadataMode.EMBED,
                    OpenAiEmbeddingOptions.builder().build(), SINGLE_ATTEMPT);
            return new Models(chat, embedding);
        });
    }
}
