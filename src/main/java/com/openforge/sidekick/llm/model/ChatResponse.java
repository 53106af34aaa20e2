package com.openforge.sidekick.llm.model;

import java.util.List;
import java.util.Optional;

/**
 * Top-level response from /chat/completions.  Every field is optional on
 * the wire; callers go through {@link #firstContent()} instead of
 * dereferencing choices directly.
 */
public record ChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** Text of the first choice, empty when choices or content are missing/blank. */
    public Optional<String> firstContent() {
        if (choices == null || choices.isEmpty()) return Optional.empty();
        Choice first = choices.get(0);
        if (first == null || first.message() == null) return Optional.empty();
        String content = first.message().content();
        return content == null || content.isBlank() ? Optional.empty() : Optional.of(content);
    }

    public record Choice(
            int index,
            Message message,
            String finishReason
    ) {}

    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
