package com.openforge.sidekick.llm;

import com.openforge.sidekick.error.ErrorKind;
import com.openforge.sidekick.error.SidekickException;
import com.openforge.sidekick.llm.model.ChatRequest;
import com.openforge.sidekick.llm.model.ChatResponse;
import com.openforge.sidekick.llm.model.Message;
import com.openforge.sidekick.ratelimit.SlidingWindowRateLimiter;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * The only path to the backend.
 *
 * Call graph for {@link #complete}:
 *
 *   complete(clientId, request)
 *     └─ rateLimiter.admit(clientId)          → RATE_LIMITED when rejected
 *     └─ backendCircuitBreaker                → BACKEND_UNREACHABLE while OPEN
 *           └─ backendClient.chat(...)        → BACKEND_UNREACHABLE / BACKEND_BAD_STATUS
 *     └─ first choice content                 → EMPTY_COMPLETION when missing
 *
 * Budget is spent on the attempt: an admitted call that later fails still
 * counts against the client's window, and nothing is retried here.
 *
 * The remaining operations (model list, current-model probe, model load)
 * are operational probes and bypass the rate limiter.
 */
@Slf4j
@Component
public class CompletionGateway {

    private final BackendClient            backendClient;
    private final SlidingWindowRateLimiter rateLimiter;
    private final CircuitBreaker           circuitBreaker;

    public CompletionGateway(BackendClient backendClient,
                             SlidingWindowRateLimiter rateLimiter,
                             CircuitBreaker backendCircuitBreaker) {
        this.backendClient  = backendClient;
        this.rateLimiter    = rateLimiter;
        this.circuitBreaker = backendCircuitBreaker;
    }

    // ── Completions ──────────────────────────────────────────────────────────

    /**
     * Rate-limited completion.  The returned future completes with the
     * generated text or fails with a {@link SidekickException}.
     */
    public CompletableFuture<String> complete(String clientId, CompletionRequest request) {
        if (!rateLimiter.admit(clientId)) {
            return CompletableFuture.failedFuture(SidekickException.rateLimited(clientId));
        }

        List<Message> messages = new ArrayList<>(2);
        if (request.hasSystemPrompt()) {
            messages.add(Message.system(request.systemPrompt()));
        }
        messages.add(Message.user(request.prompt()));

        ChatRequest chatRequest = ChatRequest.builder()
                .messages(messages)
                .temperature(request.temperature())
                .maxTokens(request.maxTokens())
                .build();

        log.info("[Gateway] → client={} messages={} temperature={} max_tokens={}",
                clientId, messages.size(), request.temperature(), request.maxTokens());

        return guarded(() -> backendClient.chat(chatRequest, backendClient.config().generationTimeout()))
                .thenApply(response -> {
                    String content = response.firstContent()
                            .orElseThrow(() -> new SidekickException(ErrorKind.EMPTY_COMPLETION,
                                    "Backend returned no completion content"));
                    log.info("[Gateway] ← client={} content-length={}", clientId, content.length());
                    return content;
                });
    }

    // ── Operational probes (not rate limited) ────────────────────────────────

    /** Ids of every model the backend reports. */
    public CompletableFuture<List<String>> listModels() {
        return guarded(backendClient::listModels).thenApply(list -> list.ids());
    }

    /**
     * Sends a 5-token "Hi" completion and returns the model name the
     * backend reports, or "Unknown" when it omits one.
     */
    public CompletableFuture<String> probeCurrentModel() {
        ChatRequest probe = ChatRequest.builder()
                .messages(List.of(Message.user("Hi")))
                .temperature(0.1)
                .maxTokens(5)
                .build();
        return guarded(() -> backendClient.chat(probe, backendClient.config().probeTimeout()))
                .thenApply(ChatResponse::model)
                .thenApply(model -> model == null || model.isBlank() ? "Unknown" : model);
    }

    /** Best-effort remote load; many backend versions answer 404. */
    public CompletableFuture<LoadOutcome> loadModel(String modelName) {
        log.info("[Gateway] Requesting model load: {}", modelName);
        return guarded(() -> backendClient.loadModel(modelName))
                .thenApply(LoadOutcome::fromStatusCode);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Runs a backend call through the circuit breaker.  An OPEN breaker
     * surfaces as BACKEND_UNREACHABLE so callers only ever see typed failures.
     */
    private <T> CompletableFuture<T> guarded(Supplier<CompletableFuture<T>> call) {
        Supplier<CompletionStage<T>> decorated =
                CircuitBreaker.decorateCompletionStage(circuitBreaker, call::get);
        CompletableFuture<T> result;
        try {
            result = decorated.get().toCompletableFuture();
        } catch (CallNotPermittedException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.handle((value, failure) -> {
            if (failure == null) return value;
            Throwable cause = SidekickException.unwrap(failure);
            if (cause instanceof SidekickException se) throw se;
            if (cause instanceof CallNotPermittedException) {
                log.warn("[Gateway] Circuit breaker '{}' is {}, failing fast",
                        circuitBreaker.getName(), circuitBreaker.getState());
                throw new SidekickException(ErrorKind.BACKEND_UNREACHABLE,
                        "Backend temporarily unavailable (circuit open)", cause);
            }
            throw new SidekickException(ErrorKind.BACKEND_UNREACHABLE,
                    "Backend call failed: " + cause.getMessage(), cause);
        });
    }
}
