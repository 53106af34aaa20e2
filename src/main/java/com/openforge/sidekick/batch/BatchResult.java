package com.openforge.sidekick.batch;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Outcome of one batch run.  A run cut short by the rate limiter is still a
 * result: {@code processedItems < totalItems} and the last entry of
 * {@code results} is the rate-limit notice.
 *
 * Serialized as-is (snake_case) for the structured, non-combined output:
 * {@code {total_items, processed_items, results}}.
 *
 * @param totalItems     number of input items
 * @param processedItems items whose chunk was answered by the backend
 * @param results        per-chunk sections in input order, each headed "**Batch b/B:**",
 *                       followed by the rate-limit notice when the run stopped early
 * @param rateLimited    true when the run stopped at the rate limit
 */
public record BatchResult(
        int          totalItems,
        int          processedItems,
        List<String> results,
        @JsonIgnore boolean rateLimited
) {

    static final String SEPARATOR = "\n\n---\n\n";

    public BatchResult {
        results = List.copyOf(results);
    }

    /** Every section joined by a horizontal rule. */
    public String combined() {
        return String.join(SEPARATOR, results);
    }
}
