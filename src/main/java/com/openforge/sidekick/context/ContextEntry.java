package com.openforge.sidekick.context;

import java.time.Instant;

/**
 * One offloaded context.  Instances are immutable; overwriting an id
 * replaces the whole entry.
 *
 * @param id         caller-chosen key
 * @param data       the stored text, exactly as given
 * @param createdAt  when this version of the entry was written
 * @param tokenCount {@link TokenEstimator#estimate(String)} of {@code data}
 */
public record ContextEntry(
        String  id,
        String  data,
        Instant createdAt,
        int     tokenCount
) {

    static ContextEntry of(String id, String data, Instant createdAt) {
        return new ContextEntry(id, data, createdAt, TokenEstimator.estimate(data));
    }
}
