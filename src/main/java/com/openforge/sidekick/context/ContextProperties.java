package com.openforge.sidekick.context;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * application.yml:
 *
 * sidekick:
 *   context:
 *     max-tokens: ${MAX_CONTEXT_SIZE:32000}
 */
@ConfigurationProperties(prefix = "sidekick.context")
public record ContextProperties(
        @DefaultValue("32000") int maxTokens
) {}
