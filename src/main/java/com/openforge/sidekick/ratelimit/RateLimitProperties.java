package com.openforge.sidekick.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Per-client admission limits.
 *
 * application.yml:
 *
 * sidekick:
 *   rate-limit:
 *     window-seconds: ${RATE_LIMIT_WINDOW:60}
 *     max-requests: ${RATE_LIMIT_MAX_REQUESTS:30}
 */
@ConfigurationProperties(prefix = "sidekick.rate-limit")
public record RateLimitProperties(
        @DefaultValue("60") int windowSeconds,
        @DefaultValue("30") int maxRequests
) {

    public RateLimitProperties {
        if (windowSeconds <= 0) throw new IllegalArgumentException("window-seconds must be > 0");
        if (maxRequests <= 0)   throw new IllegalArgumentException("max-requests must be > 0");
    }
}
