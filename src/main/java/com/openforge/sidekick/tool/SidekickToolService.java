package com.openforge.sidekick.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.sidekick.batch.BatchDispatcher;
import com.openforge.sidekick.batch.BatchResult;
import com.openforge.sidekick.context.ContextEntry;
import com.openforge.sidekick.context.ContextStore;
import com.openforge.sidekick.context.DeriveOperation;
import com.openforge.sidekick.error.ErrorKind;
import com.openforge.sidekick.error.SidekickException;
import com.openforge.sidekick.llm.BackendProperties;
import com.openforge.sidekick.llm.CompletionGateway;
import com.openforge.sidekick.llm.CompletionRequest;
import com.openforge.sidekick.llm.LoadOutcome;
import com.openforge.sidekick.ratelimit.SlidingWindowRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The tool boundary.  Every tool returns plain text; every failure below this
 * layer is turned into descriptive text here and nowhere else.
 *
 * Leading symbols:
 *   ✅ success   ⚠️ warning (rate limit, too large, unsupported)   ❌ failure
 * plus informational ones (📋 📝 🔍 🧹 📊 🤖 🎯) for specific tools.
 *
 * Every method completes normally: the returned future never fails.
 */
@Slf4j
@Service
public class SidekickToolService {

    static final String RATE_LIMIT_TEXT = "⚠️ Rate limit exceeded. Please wait a moment before trying again.";

    private static final Set<String> MODEL_TYPES = Set.of("coding", "database", "os", "general");
    private static final int STATS_CONTEXT_PREVIEW = 5;

    private static final double TASK_TEMPERATURE = 0.3;
    private static final int    TASK_MAX_TOKENS  = 2048;

    private final CompletionGateway        gateway;
    private final ContextStore             contextStore;
    private final BatchDispatcher          batchDispatcher;
    private final SlidingWindowRateLimiter rateLimiter;
    private final BackendProperties        backend;
    private final ObjectMapper             objectMapper;
    private final Clock                    clock;
    private final Instant                  startedAt;

    public SidekickToolService(CompletionGateway gateway,
                               ContextStore contextStore,
                               BatchDispatcher batchDispatcher,
                               SlidingWindowRateLimiter rateLimiter,
                               BackendProperties backend,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.gateway         = gateway;
        this.contextStore    = contextStore;
        this.batchDispatcher = batchDispatcher;
        this.rateLimiter     = rateLimiter;
        this.backend         = backend;
        this.objectMapper    = objectMapper;
        this.clock           = clock;
        this.startedAt       = clock.instant();
    }

    // ── Backend status ───────────────────────────────────────────────────────

    public CompletableFuture<String> healthCheck() {
        log.info("[Tools] Checking LM Studio at {}", backend.apiBase());
        return gateway.listModels()
                .thenApply(ids -> {
                    boolean hasRecommended = ids.stream().anyMatch(id -> id.contains(backend.recommendedModel()));
                    String status = "✅ LM Studio API is running and accessible at %s\n📊 %d models available\n"
                            .formatted(backend.address(), ids.size());
                    return status + (hasRecommended
                            ? "✨ Recommended model '%s' is available!".formatted(backend.recommendedModel())
                            : "ℹ️ Recommended model '%s' not found. Consider loading it for optimal performance."
                                    .formatted(backend.recommendedModel()));
                })
                .exceptionally(failure -> renderFailure(failure, "connecting to LM Studio API", se -> switch (se.kind()) {
                    case BACKEND_BAD_STATUS -> "⚠️ LM Studio API at %s returned status code %d."
                            .formatted(backend.address(), se.statusCode());
                    case BACKEND_UNREACHABLE -> "❌ Cannot connect to LM Studio at %s. Make sure LM Studio is running and the server is started."
                            .formatted(backend.address());
                    default -> null;
                }));
    }

    public CompletableFuture<String> listModels() {
        return gateway.listModels()
                .thenApply(ids -> ids.isEmpty()
                        ? "No models found in LM Studio at %s.".formatted(backend.address())
                        : ModelCatalog.render(ids, backend.address(), backend.recommendedModel()))
                .exceptionally(failure -> renderFailure(failure, "listing models", se ->
                        se.is(ErrorKind.BACKEND_BAD_STATUS)
                                ? "❌ Failed to fetch models from %s. Status code: %d"
                                        .formatted(backend.address(), se.statusCode())
                                : null));
    }

    public CompletableFuture<String> getCurrentModel() {
        return gateway.probeCurrentModel()
                .thenApply(model -> "🎯 Currently loaded model at %s: %s\n\n%s"
                        .formatted(backend.address(), model, ModelCatalog.capabilities(model)))
                .exceptionally(failure -> renderFailure(failure, "identifying current model", se ->
                        se.is(ErrorKind.BACKEND_BAD_STATUS)
                                ? "❌ No model currently loaded at %s. Status code: %d"
                                        .formatted(backend.address(), se.statusCode())
                                : null));
    }

    public CompletableFuture<String> loadModel(String modelName) {
        return gateway.loadModel(modelName)
                .thenApply(outcome -> renderLoad(outcome, modelName))
                .exceptionally(failure -> {
                    Throwable cause = SidekickException.unwrap(failure);
                    log.error("[Tools] Error in load_model: {}", cause.getMessage());
                    return "❌ Model loading failed: %s\n\nPlease load the model manually through LM Studio."
                            .formatted(cause.getMessage());
                });
    }

    // ── Generation ───────────────────────────────────────────────────────────

    public CompletableFuture<String> chatCompletion(String clientId,
                                                    String prompt,
                                                    String systemPrompt,
                                                    Double temperature,
                                                    Integer maxTokens,
                                                    String modelType) {
        String type = modelType == null ? "general" : modelType;
        if (!MODEL_TYPES.contains(type)) {
            log.debug("[Tools] Unrecognised model_type '{}', treating as general", type);
        }
        return safely("generating completion", () -> gateway.complete(clientId, CompletionRequest.builder()
                .prompt(prompt)
                .systemPrompt(systemPrompt)
                .temperature(temperature != null ? temperature : CompletionRequest.DEFAULT_TEMPERATURE)
                .maxTokens(maxTokens != null ? maxTokens : CompletionRequest.DEFAULT_MAX_TOKENS)
                .build()));
    }

    public CompletableFuture<String> automateMenialTask(String clientId,
                                                        String taskType,
                                                        String taskData,
                                                        String outputFormat) {
        String format = outputFormat == null ? "text" : outputFormat;
        return safely("automating task", () -> {
            TaskType task = TaskType.parse(taskType);
            return gateway.complete(clientId, CompletionRequest.builder()
                    .prompt("Task: %s\n\nData:\n%s".formatted(task.wireName(), taskData))
                    .systemPrompt(task.systemPrompt(format))
                    .temperature(TASK_TEMPERATURE)
                    .maxTokens(TASK_MAX_TOKENS)
                    .build());
        });
    }

    // ── Context offloading ───────────────────────────────────────────────────

    public CompletableFuture<String> offloadContext(String clientId,
                                                    String contextId,
                                                    String contextData,
                                                    String operation) {
        return safely("processing context", () -> {
            ContextOperation op = ContextOperation.parse(operation == null ? "store" : operation);
            return switch (op) {
                case STORE -> {
                    int tokens = contextStore.store(contextId, contextData);
                    yield CompletableFuture.completedFuture(
                            "✅ Context stored successfully. ID: %s (%d tokens)".formatted(contextId, tokens));
                }
                case RETRIEVE -> {
                    ContextEntry entry = contextStore.retrieve(contextId);
                    yield CompletableFuture.completedFuture("📋 Context retrieved:\n\n%s\n\n(Stored: %s, %d tokens)"
                            .formatted(entry.data(), entry.createdAt(), entry.tokenCount()));
                }
                case SUMMARIZE -> contextStore.derive(clientId, contextId, DeriveOperation.SUMMARIZE)
                        .thenApply(summary -> "📝 Summary created:\n\n" + summary);
                case ANALYZE -> contextStore.derive(clientId, contextId, DeriveOperation.ANALYZE)
                        .thenApply(analysis -> "🔍 Analysis:\n\n" + analysis);
            };
        });
    }

    public CompletableFuture<String> clearContexts(String pattern) {
        return safely("clearing contexts", () -> {
            String effective = pattern == null || pattern.isEmpty() ? ContextStore.CLEAR_ALL : pattern;
            int removed = contextStore.clear(effective);
            return CompletableFuture.completedFuture(ContextStore.CLEAR_ALL.equals(effective)
                    ? "🧹 Cleared all %d stored contexts.".formatted(removed)
                    : "🧹 Cleared %d contexts matching '%s'.".formatted(removed, effective));
        });
    }

    // ── Batch ────────────────────────────────────────────────────────────────

    public CompletableFuture<String> batchProcess(String clientId,
                                                  List<String> items,
                                                  String operation,
                                                  Integer batchSize,
                                                  Boolean combineResults) {
        int size = batchSize != null ? batchSize : batchDispatcher.defaultBatchSize();
        boolean combine = combineResults == null || combineResults;
        return safely("batch processing", () -> batchDispatcher.process(clientId, items, operation, size)
                .thenApply(result -> combine ? result.combined() : toJson(result)));
    }

    // ── Stats ────────────────────────────────────────────────────────────────

    public CompletableFuture<String> stats() {
        return safely("generating statistics", () -> {
            SlidingWindowRateLimiter.Snapshot usage = rateLimiter.snapshot();
            List<ContextEntry> contexts = contextStore.list();
            long totalTokens = contexts.stream().mapToLong(ContextEntry::tokenCount).sum();

            StringBuilder sb = new StringBuilder()
                    .append("📊 **LM Studio Sidekick Statistics**\n\n")
                    .append("🏠 **Connection**: ").append(backend.address()).append('\n')
                    .append("⏰ **Uptime**: ").append(formatUptime(Duration.between(startedAt, clock.instant()))).append("\n\n")
                    .append("📈 **Usage Metrics**:\n")
                    .append("  • Total Requests: ").append(usage.totalAdmitted()).append('\n')
                    .append("  • Recent Requests (last ").append(usage.windowSeconds()).append("s): ")
                    .append(usage.recentRequests()).append('\n')
                    .append("  • Rate Limit: ").append(usage.maxRequests()).append(" per ")
                    .append(usage.windowSeconds()).append("s\n\n")
                    .append("💾 **Context Storage**:\n")
                    .append("  • Stored Contexts: ").append(contexts.size()).append('\n')
                    .append("  • Total Tokens: ").append(grouped(totalTokens)).append('\n')
                    .append("  • Max Context Size: ").append(grouped(contextStore.maxTokens())).append(" tokens\n\n");

            if (!contexts.isEmpty()) {
                sb.append("📝 **Stored Contexts**:\n");
                contexts.stream().limit(STATS_CONTEXT_PREVIEW).forEach(ctx -> sb
                        .append("  • ").append(ctx.id()).append(": ").append(ctx.tokenCount())
                        .append(" tokens (stored: ").append(ctx.createdAt()).append(")\n"));
                if (contexts.size() > STATS_CONTEXT_PREVIEW) {
                    sb.append("  • ... and ").append(contexts.size() - STATS_CONTEXT_PREVIEW).append(" more\n");
                }
            }
            return CompletableFuture.completedFuture(sb.toString());
        });
    }

    // ── Rendering helpers ────────────────────────────────────────────────────

    /**
     * Runs {@code call} and renders any failure, whether thrown synchronously
     * or delivered through the future, with the shared error texts.
     */
    private CompletableFuture<String> safely(String action, Supplier<CompletableFuture<String>> call) {
        CompletableFuture<String> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(failure -> renderFailure(failure, action, se -> null));
    }

    /**
     * Renders a failure.  {@code specific} may return a tool-specific text for
     * a typed failure, or null to fall back to the shared texts.
     */
    private String renderFailure(Throwable failure, String action, Function<SidekickException, String> specific) {
        Throwable cause = SidekickException.unwrap(failure);
        if (!(cause instanceof SidekickException se)) {
            log.error("[Tools] Error {}: {}", action, cause.getMessage(), cause);
            return "❌ Error %s: %s".formatted(action, cause.getMessage());
        }
        String text = specific.apply(se);
        if (text != null) return text;

        log.warn("[Tools] {} failed: {} {}", action, se.kind(), se.getMessage());
        return switch (se.kind()) {
            case RATE_LIMITED        -> RATE_LIMIT_TEXT;
            case BACKEND_UNREACHABLE -> "❌ Cannot connect to LM Studio at %s: %s"
                    .formatted(backend.address(), se.getMessage());
            case BACKEND_BAD_STATUS  -> "❌ Error: LM Studio at %s returned status code %d"
                    .formatted(backend.address(), se.statusCode());
            case EMPTY_COMPLETION    -> "❌ Error: Empty response from model";
            case CONTEXT_TOO_LARGE   -> "⚠️ " + se.getMessage();
            case CONTEXT_NOT_FOUND, UNKNOWN_OPERATION, UNKNOWN_TASK_TYPE, EMPTY_INPUT, INVALID_ARGUMENT
                    -> "❌ " + se.getMessage();
        };
    }

    private String renderLoad(LoadOutcome outcome, String modelName) {
        return switch (outcome.status()) {
            case LOADED -> "✅ Model '%s' loaded successfully at %s!".formatted(modelName, backend.address());
            case UNSUPPORTED -> ("⚠️ Model loading not supported in this LM Studio version. "
                    + "Please load '%s' manually through the LM Studio UI.").formatted(modelName);
            case FAILED -> "❌ Failed to load model. Status: %d".formatted(outcome.statusCode());
        };
    }

    private String toJson(BatchResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize batch result", e);
        }
    }

    /** {@code H:MM:SS}, prefixed with "N day(s), " once uptime passes a day. */
    static String formatUptime(Duration uptime) {
        long seconds = Math.max(0, uptime.getSeconds());
        long days = seconds / 86_400;
        String hms = "%d:%02d:%02d".formatted((seconds % 86_400) / 3600, (seconds % 3600) / 60, seconds % 60);
        if (days == 0) return hms;
        return days + (days == 1 ? " day, " : " days, ") + hms;
    }

    private static String grouped(long value) {
        return String.format(Locale.ROOT, "%,d", value);
    }
}
