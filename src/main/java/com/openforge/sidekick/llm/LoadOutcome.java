package com.openforge.sidekick.llm;

/**
 * Result of a best-effort remote model load.
 *
 * @param status     LOADED, UNSUPPORTED (endpoint missing, HTTP 404) or FAILED
 * @param statusCode raw HTTP status returned by the backend
 */
public record LoadOutcome(Status status, int statusCode) {

    public enum Status { LOADED, UNSUPPORTED, FAILED }

    static LoadOutcome fromStatusCode(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) return new LoadOutcome(Status.LOADED, statusCode);
        if (statusCode == 404)                     return new LoadOutcome(Status.UNSUPPORTED, statusCode);
        return new LoadOutcome(Status.FAILED, statusCode);
    }
}
