package com.openforge.sidekick.context;

/**
 * Backend-derived views of a stored context.
 *
 * SUMMARIZE — concise summary, also stored back under {@code <id>_summary}
 * ANALYZE   — key points, entities and action items; not stored
 */
public enum DeriveOperation {

    SUMMARIZE(
            "You are a helpful assistant that creates concise summaries. "
                    + "Summarize the following context, preserving key information.",
            "Please summarize this context:\n\n",
            500),

    ANALYZE(
            "You are an analytical assistant. "
                    + "Extract key points, entities, and actionable items from the context.",
            "Analyze this context and extract key information:\n\n",
            800);

    static final double TEMPERATURE = 0.3;

    private final String systemPrompt;
    private final String promptPrefix;
    private final int    maxTokens;

    DeriveOperation(String systemPrompt, String promptPrefix, int maxTokens) {
        this.systemPrompt = systemPrompt;
        this.promptPrefix = promptPrefix;
        this.maxTokens    = maxTokens;
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public String prompt(String data) {
        return promptPrefix + data;
    }

    public int maxTokens() {
        return maxTokens;
    }
}
