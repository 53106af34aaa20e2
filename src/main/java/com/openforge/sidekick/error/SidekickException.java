package com.openforge.sidekick.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * The single typed failure raised by the gateway, the context store and the
 * batch dispatcher.
 *
 * {@link #statusCode()} is only meaningful for {@link ErrorKind#BACKEND_BAD_STATUS};
 * it is 0 for every other kind.
 */
public class SidekickException extends RuntimeException {

    private final ErrorKind kind;
    private final int       statusCode;

    public SidekickException(ErrorKind kind, String message) {
        this(kind, 0, message, null);
    }

    public SidekickException(ErrorKind kind, String message, Throwable cause) {
        this(kind, 0, message, cause);
    }

    private SidekickException(ErrorKind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    public ErrorKind kind() {
        return kind;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean is(ErrorKind other) {
        return kind == other;
    }

    // ── Factories ────────────────────────────────────────────────────────────

    public static SidekickException rateLimited(String clientId) {
        return new SidekickException(ErrorKind.RATE_LIMITED,
                "Rate limit exceeded for client [%s]".formatted(clientId));
    }

    public static SidekickException badStatus(int statusCode, String message) {
        return new SidekickException(ErrorKind.BACKEND_BAD_STATUS, statusCode, message, null);
    }

    public static SidekickException badStatus(int statusCode, String message, Throwable cause) {
        return new SidekickException(ErrorKind.BACKEND_BAD_STATUS, statusCode, message, cause);
    }

    /**
     * Strips the wrappers that {@code CompletableFuture} puts around a failure.
     * Returns the innermost cause that is not a completion/execution wrapper.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /** True when {@code failure} (possibly wrapped) is a SidekickException of the given kind. */
    public static boolean isKind(Throwable failure, ErrorKind kind) {
        return unwrap(failure) instanceof SidekickException se && se.kind == kind;
    }
}
