package com.openforge.sidekick.context;

import com.openforge.sidekick.error.ErrorKind;
import com.openforge.sidekick.error.SidekickException;
import com.openforge.sidekick.llm.CompletionGateway;
import com.openforge.sidekick.llm.CompletionRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token-bounded, in-memory store for offloaded context.
 *
 * Responsibilities:
 *   - store / retrieve / clear entries keyed by caller-chosen ids
 *   - reject anything whose estimated size exceeds {@code sidekick.context.max-tokens}
 *   - derive summaries and analyses through the rate-limited gateway
 *
 * Entries never expire; they live until {@link #clear(String)} removes them
 * or the process stops.
 *
 * derive() is two steps (gateway call, then persist of the summary) and is
 * not atomic with clear(): a clear that lands while a summary is in flight
 * can be followed by the summary being written.
 */
@Slf4j
@Service
@EnableConfigurationProperties(ContextProperties.class)
public class ContextStore {

    public static final String CLEAR_ALL      = "*";
    public static final String SUMMARY_SUFFIX = "_summary";

    private final CompletionGateway gateway;
    private final ContextProperties properties;
    private final Clock             clock;

    private final Map<String, ContextEntry> entries = new ConcurrentHashMap<>();

    public ContextStore(CompletionGateway gateway, ContextProperties properties, Clock clock) {
        this.gateway    = gateway;
        this.properties = properties;
        this.clock      = clock;
    }

    // ── Store / retrieve ─────────────────────────────────────────────────────

    /**
     * Inserts or overwrites {@code id}.
     *
     * @return the estimated token count of {@code data}
     * @throws SidekickException CONTEXT_TOO_LARGE; the store is left untouched
     */
    public int store(String id, String data) {
        ContextEntry entry = ContextEntry.of(id, data == null ? "" : data, clock.instant());
        if (entry.tokenCount() > properties.maxTokens()) {
            log.warn("[ContextStore] Rejected id={} tokens={} max={}",
                    id, entry.tokenCount(), properties.maxTokens());
            throw new SidekickException(ErrorKind.CONTEXT_TOO_LARGE,
                    "Context too large (%d tokens). Maximum is %d tokens."
                            .formatted(entry.tokenCount(), properties.maxTokens()));
        }
        entries.put(id, entry);
        log.debug("[ContextStore] Stored id={} tokens={}", id, entry.tokenCount());
        return entry.tokenCount();
    }

    /** @throws SidekickException CONTEXT_NOT_FOUND */
    public ContextEntry retrieve(String id) {
        ContextEntry entry = entries.get(id);
        if (entry == null) {
            throw new SidekickException(ErrorKind.CONTEXT_NOT_FOUND,
                    "Context ID '%s' not found.".formatted(id));
        }
        return entry;
    }

    // ── Derived operations ───────────────────────────────────────────────────

    /**
     * Summarizes or analyzes a stored entry via the gateway (temperature 0.3).
     * A summary is additionally stored under {@code <id>_summary}; when it
     * would exceed the size limit it is still returned but not stored.
     */
    public CompletableFuture<String> derive(String clientId, String id, DeriveOperation operation) {
        ContextEntry source;
        try {
            source = retrieve(id);
        } catch (SidekickException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletionRequest request = CompletionRequest.builder()
                .prompt(operation.prompt(source.data()))
                .systemPrompt(operation.systemPrompt())
                .temperature(DeriveOperation.TEMPERATURE)
                .maxTokens(operation.maxTokens())
                .build();

        log.info("[ContextStore] {} id={} tokens={}", operation, id, source.tokenCount());

        return gateway.complete(clientId, request).thenApply(result -> {
            if (operation == DeriveOperation.SUMMARIZE) {
                persistSummary(id + SUMMARY_SUFFIX, result);
            }
            return result;
        });
    }

    // ── Clear ────────────────────────────────────────────────────────────────

    /**
     * {@code "*"} removes every entry; any other pattern removes the entries
     * whose id contains it as a plain substring.  A null pattern means "*".
     *
     * @return number of entries removed
     */
    public int clear(String pattern) {
        boolean all = pattern == null || CLEAR_ALL.equals(pattern);
        int removed = 0;
        for (Iterator<String> it = entries.keySet().iterator(); it.hasNext(); ) {
            String id = it.next();
            if (all || id.contains(pattern)) {
                it.remove();
                removed++;
            }
        }
        log.info("[ContextStore] Cleared {} entries matching '{}'", removed, pattern);
        return removed;
    }

    // ── Introspection ────────────────────────────────────────────────────────

    /** Snapshot of all entries, most recently written first. */
    public List<ContextEntry> list() {
        return entries.values().stream()
                .sorted(Comparator.comparing(ContextEntry::createdAt).reversed()
                        .thenComparing(ContextEntry::id))
                .toList();
    }

    public int size() {
        return entries.size();
    }

    public long totalTokens() {
        return entries.values().stream().mapToLong(ContextEntry::tokenCount).sum();
    }

    public int maxTokens() {
        return properties.maxTokens();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void persistSummary(String summaryId, String summary) {
        try {
            store(summaryId, summary);
        } catch (SidekickException e) {
            log.warn("[ContextStore] Summary for {} not stored: {}", summaryId, e.getMessage());
        }
    }
}
