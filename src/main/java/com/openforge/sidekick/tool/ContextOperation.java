package com.openforge.sidekick.tool;

import com.openforge.sidekick.error.ErrorKind;
import com.openforge.sidekick.error.SidekickException;

import java.util.Arrays;
import java.util.Locale;

/** Operations of the {@code offload_context} tool. */
enum ContextOperation {
    STORE, RETRIEVE, SUMMARIZE, ANALYZE;

    /** @throws SidekickException UNKNOWN_OPERATION */
    static ContextOperation parse(String value) {
        return Arrays.stream(values())
                .filter(op -> op.name().toLowerCase(Locale.ROOT).equals(value))
                .findFirst()
                .orElseThrow(() -> new SidekickException(ErrorKind.UNKNOWN_OPERATION,
                        "Unknown operation: %s. Use 'store', 'retrieve', 'summarize', or 'analyze'."
                                .formatted(value)));
    }
}
