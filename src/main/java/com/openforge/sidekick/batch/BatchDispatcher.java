package com.openforge.sidekick.batch;

import com.openforge.sidekick.error.ErrorKind;
import com.openforge.sidekick.error.SidekickException;
import com.openforge.sidekick.llm.CompletionGateway;
import com.openforge.sidekick.llm.CompletionRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Splits an ordered list of items into fixed-size chunks and sends one
 * completion per chunk, strictly in order.
 *
 * Flow per chunk:
 *   build numbered prompt → gateway.complete (temperature 0.3)
 *     ├─ success      → record "**Batch b/B:**" output, pause, next chunk
 *     ├─ RATE_LIMITED → append the notice, stop, return what was processed so far
 *     └─ other error  → record "**Batch b/B:**" error text, pause, next chunk
 *
 * Items of a failed chunk are not counted as processed.
 *
 * The pause between chunks is a scheduled continuation on the shared
 * executor; no thread sleeps while a batch waits.
 */
@Slf4j
@Service
@EnableConfigurationProperties(BatchProperties.class)
public class BatchDispatcher {

    static final String SYSTEM_PROMPT =
            "You are a batch processing assistant. Process each item according to the "
                    + "specified operation. Be consistent across all items.";
    static final double TEMPERATURE = 0.3;
    static final int    MAX_TOKENS  = 1024;

    private final CompletionGateway gateway;
    private final BatchProperties   properties;
    private final Executor          pacingExecutor;

    public BatchDispatcher(CompletionGateway gateway,
                           BatchProperties properties,
                           ExecutorService sidekickExecutor) {
        this.gateway        = gateway;
        this.properties     = properties;
        this.pacingExecutor = CompletableFuture.delayedExecutor(
                properties.pacingMillis(), TimeUnit.MILLISECONDS, sidekickExecutor);
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Runs the batch.  Fails immediately with EMPTY_INPUT for an empty item
     * list and INVALID_ARGUMENT for a batch size below 1.
     */
    public CompletableFuture<BatchResult> process(String clientId,
                                                  List<String> items,
                                                  String operation,
                                                  int batchSize) {
        if (items == null || items.isEmpty()) {
            return CompletableFuture.failedFuture(new SidekickException(ErrorKind.EMPTY_INPUT,
                    "No items provided for batch processing."));
        }
        if (batchSize < 1) {
            return CompletableFuture.failedFuture(new SidekickException(ErrorKind.INVALID_ARGUMENT,
                    "batch_size must be at least 1, got " + batchSize));
        }

        List<List<String>> chunks = partition(items, batchSize);
        log.info("[Batch] client={} starting {} items in {} chunks of {}",
                clientId, items.size(), chunks.size(), batchSize);

        Run run = new Run(clientId, operation, chunks, items.size());
        return runFrom(run, 0);
    }

    public int defaultBatchSize() {
        return properties.defaultBatchSize();
    }

    /** Consecutive chunks of {@code size}; only the last may be shorter. */
    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            chunks.add(Collections.unmodifiableList(
                    new ArrayList<>(items.subList(from, Math.min(from + size, items.size())))));
        }
        return chunks;
    }

    static String chunkPrompt(List<String> chunk, String operation) {
        StringBuilder sb = new StringBuilder()
                .append("Process these ").append(chunk.size())
                .append(" items with operation: ").append(operation).append("\n\n");
        for (int i = 0; i < chunk.size(); i++) {
            sb.append(i + 1).append(". ").append(chunk.get(i)).append('\n');
        }
        return sb.toString();
    }

    // ── Chunk loop ───────────────────────────────────────────────────────────

    private CompletableFuture<BatchResult> runFrom(Run run, int index) {
        List<String> chunk = run.chunks.get(index);
        int batchNumber = index + 1;

        CompletionRequest request = CompletionRequest.builder()
                .prompt(chunkPrompt(chunk, run.operation))
                .systemPrompt(SYSTEM_PROMPT)
                .temperature(TEMPERATURE)
                .maxTokens(MAX_TOKENS)
                .build();

        return gateway.complete(run.clientId, request)
                .handle(ChunkOutcome::of)
                .thenCompose(outcome -> {
                    if (outcome.rateLimited()) {
                        log.warn("[Batch] client={} rate limit hit at batch {}/{}, processed {} items",
                                run.clientId, batchNumber, run.chunks.size(), run.processed);
                        run.results.add("⚠️ Rate limit hit at batch %d. Processed %d items."
                                .formatted(batchNumber, run.processed));
                        return CompletableFuture.completedFuture(run.finish(true));
                    }
                    if (outcome.error() != null) {
                        log.warn("[Batch] client={} batch {}/{} failed: {}",
                                run.clientId, batchNumber, run.chunks.size(), outcome.error());
                        run.results.add("**Batch %d/%d:**\n❌ Error: %s"
                                .formatted(batchNumber, run.chunks.size(), outcome.error()));
                    } else {
                        run.results.add("**Batch %d/%d:**\n%s"
                                .formatted(batchNumber, run.chunks.size(), outcome.output()));
                        run.processed += chunk.size();
                    }

                    if (batchNumber == run.chunks.size()) {
                        log.info("[Batch] client={} finished {}/{} items",
                                run.clientId, run.processed, run.totalItems);
                        return CompletableFuture.completedFuture(run.finish(false));
                    }
                    return CompletableFuture.runAsync(() -> {}, pacingExecutor)
                            .thenCompose(ignored -> runFrom(run, index + 1));
                });
    }

    /** What one chunk produced: its output, an error message, or a rate-limit stop. */
    private record ChunkOutcome(String output, String error, boolean rateLimited) {

        static ChunkOutcome of(String output, Throwable failure) {
            if (failure == null) return new ChunkOutcome(output, null, false);
            if (SidekickException.isKind(failure, ErrorKind.RATE_LIMITED)) {
                return new ChunkOutcome(null, null, true);
            }
            Throwable cause = SidekickException.unwrap(failure);
            return new ChunkOutcome(null, String.valueOf(cause.getMessage()), false);
        }
    }

    /**
     * Mutable state of one batch run.  Chunks execute one after another, so
     * only one continuation touches it at a time.
     */
    private static final class Run {
        final String             clientId;
        final String             operation;
        final List<List<String>> chunks;
        final int                totalItems;
        final List<String>       results = new ArrayList<>();
        int                      processed;

        Run(String clientId, String operation, List<List<String>> chunks, int totalItems) {
            this.clientId   = clientId;
            this.operation  = operation;
            this.chunks     = chunks;
            this.totalItems = totalItems;
        }

        BatchResult finish(boolean rateLimited) {
            return new BatchResult(totalItems, processed, results, rateLimited);
        }
    }
}
