package com.openforge.sidekick.tool;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP surface for the sidekick tools.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                               Tool                         │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  POST /api/tools/health_check           backend reachability         │
 * │  POST /api/tools/list_models            categorized model listing    │
 * │  POST /api/tools/get_current_model      loaded model + hints         │
 * │  POST /api/tools/load_model             best-effort remote load      │
 * │  POST /api/tools/chat_completion        rate-limited completion      │
 * │  POST /api/tools/automate_menial_task   task-prompted completion     │
 * │  POST /api/tools/offload_context        store/retrieve/summarize/... │
 * │  POST /api/tools/clear_contexts         remove stored contexts       │
 * │  POST /api/tools/batch_process          chunked batch dispatch       │
 * │  POST /api/tools/get_sidekick_stats     usage counters               │
 * └──────────────────────────────────────────────────────────────────────┘
 *
 * Request bodies use snake_case field names.  The optional X-Client-Id
 * header selects the rate-limit budget ("default" when absent).
 *
 * Tool failures come back as HTTP 200 with descriptive text; only a
 * malformed request body is rejected with 400.  Handlers return futures so
 * the servlet thread is released while the backend works.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class SidekickToolController {

    static final String CLIENT_HEADER = "X-Client-Id";

    private final SidekickToolService tools;

    // ── Backend status ───────────────────────────────────────────────────────

    @PostMapping("/health_check")
    public CompletableFuture<ToolResponse> healthCheck() {
        return tools.healthCheck().thenApply(text -> new ToolResponse("health_check", text));
    }

    @PostMapping("/list_models")
    public CompletableFuture<ToolResponse> listModels() {
        return tools.listModels().thenApply(text -> new ToolResponse("list_models", text));
    }

    @PostMapping("/get_current_model")
    public CompletableFuture<ToolResponse> getCurrentModel() {
        return tools.getCurrentModel().thenApply(text -> new ToolResponse("get_current_model", text));
    }

    @PostMapping("/load_model")
    public CompletableFuture<ToolResponse> loadModel(@Valid @RequestBody LoadModelBody body) {
        return tools.loadModel(body.modelName()).thenApply(text -> new ToolResponse("load_model", text));
    }

    // ── Generation ───────────────────────────────────────────────────────────

    @PostMapping("/chat_completion")
    public CompletableFuture<ToolResponse> chatCompletion(
            @RequestHeader(name = CLIENT_HEADER, required = false) String clientId,
            @Valid @RequestBody ChatCompletionBody body) {
        return tools.chatCompletion(clientId, body.prompt(), body.systemPrompt(),
                        body.temperature(), body.maxTokens(), body.modelType())
                .thenApply(text -> new ToolResponse("chat_completion", text));
    }

    @PostMapping("/automate_menial_task")
    public CompletableFuture<ToolResponse> automateMenialTask(
            @RequestHeader(name = CLIENT_HEADER, required = false) String clientId,
            @Valid @RequestBody MenialTaskBody body) {
        return tools.automateMenialTask(clientId, body.taskType(), body.taskData(), body.outputFormat())
                .thenApply(text -> new ToolResponse("automate_menial_task", text));
    }

    // ── Context ──────────────────────────────────────────────────────────────

    @PostMapping("/offload_context")
    public CompletableFuture<ToolResponse> offloadContext(
            @RequestHeader(name = CLIENT_HEADER, required = false) String clientId,
            @Valid @RequestBody OffloadContextBody body) {
        return tools.offloadContext(clientId, body.contextId(), body.contextData(), body.operation())
                .thenApply(text -> new ToolResponse("offload_context", text));
    }

    @PostMapping("/clear_contexts")
    public CompletableFuture<ToolResponse> clearContexts(@RequestBody(required = false) ClearContextsBody body) {
        String pattern = body != null ? body.contextPattern() : null;
        return tools.clearContexts(pattern).thenApply(text -> new ToolResponse("clear_contexts", text));
    }

    // ── Batch & stats ────────────────────────────────────────────────────────

    @PostMapping("/batch_process")
    public CompletableFuture<ToolResponse> batchProcess(
            @RequestHeader(name = CLIENT_HEADER, required = false) String clientId,
            @Valid @RequestBody BatchProcessBody body) {
        return tools.batchProcess(clientId, body.items(), body.operation(), body.batchSize(), body.combineResults())
                .thenApply(text -> new ToolResponse("batch_process", text));
    }

    @PostMapping("/get_sidekick_stats")
    public CompletableFuture<ToolResponse> stats() {
        return tools.stats().thenApply(text -> new ToolResponse("get_sidekick_stats", text));
    }

    // ── Inner DTOs ────────────────────────────────────────────────────────────

    public record ToolResponse(String tool, String text) {}

    public record LoadModelBody(@NotBlank String modelName) {}

    public record ChatCompletionBody(
            @NotBlank String prompt,
            String systemPrompt,
            @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
            @Min(1) Integer maxTokens,
            String modelType
    ) {}

    public record MenialTaskBody(
            @NotBlank String taskType,
            @NotBlank String taskData,
            String outputFormat
    ) {}

    public record OffloadContextBody(
            @NotBlank String contextId,
            String contextData,
            String operation
    ) {}

    public record ClearContextsBody(String contextPattern) {}

    public record BatchProcessBody(
            List<String> items,
            @NotBlank String operation,
            Integer batchSize,
            Boolean combineResults
    ) {}
}
