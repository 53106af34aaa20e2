package com.openforge.sidekick.llm.model;

/** Body of {@code POST /v1/models/load}; only newer LM Studio versions expose it. */
public record LoadModelRequest(String model) {}
