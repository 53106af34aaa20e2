package com.openforge.sidekick.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Externalised backend (LM Studio) configuration.
 *
 * Reads from application.yml under the "sidekick.backend" prefix:
 *
 * sidekick:
 *   backend:
 *     host: ${LMSTUDIO_HOST:localhost}
 *     port: ${LMSTUDIO_PORT:1234}
 *     api-key:                        # optional, sent as Bearer token when set
 *     recommended-model: qwen2.5-coder-32b-instruct-q4_k_m
 *     health-timeout-seconds: 5       # GET /models
 *     probe-timeout-seconds: 10       # current-model probe
 *     generation-timeout-seconds: 30  # completions and model load
 */
@ConfigurationProperties(prefix = "sidekick.backend")
public record BackendProperties(
        @DefaultValue("localhost") String host,
        @DefaultValue("1234")      int    port,
        @DefaultValue("")          String apiKey,
        @DefaultValue("qwen2.5-coder-32b-instruct-q4_k_m") String recommendedModel,
        @DefaultValue("5")  int healthTimeoutSeconds,
        @DefaultValue("10") int probeTimeoutSeconds,
        @DefaultValue("30") int generationTimeoutSeconds
) {

    /** e.g. {@code http://localhost:1234/v1} */
    public String apiBase() {
        return "http://" + host + ":" + port + "/v1";
    }

    /** {@code host:port}, used in every user-facing status line. */
    public String address() {
        return host + ":" + port;
    }

    public Duration healthTimeout() {
        return Duration.ofSeconds(healthTimeoutSeconds);
    }

    public Duration probeTimeout() {
        return Duration.ofSeconds(probeTimeoutSeconds);
    }

    public Duration generationTimeout() {
        return Duration.ofSeconds(generationTimeoutSeconds);
    }
}
