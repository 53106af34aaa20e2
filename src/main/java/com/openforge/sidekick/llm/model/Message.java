package com.openforge.sidekick.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single entry in the chat message list.
 *
 * role variants used here:
 *   "system"    — task instructions
 *   "user"      — the prompt
 *   "assistant" — the backend's reply (inside ChatResponse)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content
) {

    public static Message system(String content) {
        return new Message("system", content);
    }

    public static Message user(String content) {
        return new Message("user", content);
    }
}
