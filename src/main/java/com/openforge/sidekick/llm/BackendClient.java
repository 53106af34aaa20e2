package com.openforge.sidekick.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.sidekick.error.ErrorKind;
import com.openforge.sidekick.error.SidekickException;
import com.openforge.sidekick.llm.model.ChatRequest;
import com.openforge.sidekick.llm.model.ChatResponse;
import com.openforge.sidekick.llm.model.LoadModelRequest;
import com.openforge.sidekick.llm.model.ModelList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Stateless HTTP client for the OpenAI-compatible backend.
 *
 * Every call uses {@link HttpClient#sendAsync} so no caller thread waits on
 * backend I/O; the returned futures fail with a {@link SidekickException}:
 *
 *   connection refused / reset / timeout → BACKEND_UNREACHABLE
 *   non-2xx status or unparsable body    → BACKEND_BAD_STATUS(code)
 *
 * Content-level checks (empty choices etc.) belong to {@link CompletionGateway}.
 * This class is only meant to be called through the gateway.
 */
@Slf4j
@Component
@EnableConfigurationProperties(BackendProperties.class)
public class BackendClient {

    private final HttpClient        httpClient;
    private final ObjectMapper      objectMapper;
    private final BackendProperties config;

    public BackendClient(HttpClient httpClient,
                         ObjectMapper objectMapper,
                         BackendProperties config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /** {@code POST /chat/completions} with the given per-request timeout. */
    public CompletableFuture<ChatResponse> chat(ChatRequest request, Duration timeout) {
        String requestBody = serialize(request);
        log.debug("[Backend:{}] → chat POST body-length={}", config.address(), requestBody.length());

        HttpRequest httpRequest = requestBuilder("/chat/completions", timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        return send(httpRequest).thenApply(response -> parse(response, ChatResponse.class));
    }

    /** {@code GET /models}, bounded by the health timeout. */
    public CompletableFuture<ModelList> listModels() {
        HttpRequest httpRequest = requestBuilder("/models", config.healthTimeout())
                .GET()
                .build();
        return send(httpRequest).thenApply(response -> parse(response, ModelList.class));
    }

    /**
     * {@code POST /models/load}.  Completes with the raw HTTP status because
     * 404 ("not supported by this version") is an expected answer, not a fault.
     */
    public CompletableFuture<Integer> loadModel(String modelName) {
        HttpRequest httpRequest = requestBuilder("/models/load", config.generationTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(serialize(new LoadModelRequest(modelName))))
                .build();
        return send(httpRequest).thenApply(HttpResponse::statusCode);
    }

    public BackendProperties config() {
        return config;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest.Builder requestBuilder(String path, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.apiBase() + path))
                .timeout(timeout);
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.apiKey());
        }
        return builder;
    }

    private CompletableFuture<HttpResponse<String>> send(HttpRequest request) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, failure) -> {
                    if (failure != null) {
                        Throwable cause = SidekickException.unwrap(failure);
                        log.warn("[Backend:{}] {} {} failed: {}", config.address(),
                                request.method(), request.uri().getPath(), cause.toString());
                        throw new SidekickException(ErrorKind.BACKEND_UNREACHABLE,
                                "Cannot reach backend at %s: %s".formatted(config.address(), cause.getMessage()),
                                cause);
                    }
                    log.debug("[Backend:{}] ← HTTP {} {}", config.address(),
                            response.statusCode(), request.uri().getPath());
                    return response;
                });
    }

    private <T> T parse(HttpResponse<String> response, Class<T> type) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status < 200 || status >= 300) {
            throw SidekickException.badStatus(status,
                    "Backend at %s returned HTTP %d".formatted(config.address(), status));
        }
        if (body == null || body.isBlank()) {
            throw SidekickException.badStatus(status,
                    "Backend at %s returned an empty body".formatted(config.address()));
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw SidekickException.badStatus(status,
                    "Failed to parse response from backend at %s".formatted(config.address()), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize backend request", e);
        }
    }
}
