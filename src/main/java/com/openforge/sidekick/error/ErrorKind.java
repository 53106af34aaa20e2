package com.openforge.sidekick.error;

/**
 * Failure classes that internal components propagate to each other.
 *
 * Callers branch on the kind (e.g. the batch dispatcher stops early on
 * RATE_LIMITED) instead of inspecting message text.  Only the tool layer
 * turns a kind into human-readable output.
 */
public enum ErrorKind {
    RATE_LIMITED,
    BACKEND_UNREACHABLE,
    BACKEND_BAD_STATUS,
    EMPTY_COMPLETION,
    CONTEXT_NOT_FOUND,
    CONTEXT_TOO_LARGE,
    UNKNOWN_OPERATION,
    UNKNOWN_TASK_TYPE,
    EMPTY_INPUT,
    INVALID_ARGUMENT
}
