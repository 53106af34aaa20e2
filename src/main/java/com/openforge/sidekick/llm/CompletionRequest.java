package com.openforge.sidekick.llm;

import lombok.Builder;

/**
 * What a caller asks the gateway for: one prompt, an optional system
 * prompt, and the sampling parameters forwarded verbatim to the backend.
 */
@Builder
public record CompletionRequest(
        String prompt,
        String systemPrompt,
        double temperature,
        int    maxTokens
) {

    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int    DEFAULT_MAX_TOKENS  = 1024;

    public CompletionRequest {
        if (prompt == null) throw new IllegalArgumentException("prompt must not be null");
        if (maxTokens <= 0) throw new IllegalArgumentException("maxTokens must be > 0");
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isBlank();
    }
}
