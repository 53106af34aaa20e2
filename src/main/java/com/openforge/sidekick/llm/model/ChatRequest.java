package com.openforge.sidekick.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to {@code POST /v1/chat/completions}.
 *
 * model is left null: LM Studio answers with whatever model is loaded.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        Double temperature,
        Integer maxTokens
) {}
