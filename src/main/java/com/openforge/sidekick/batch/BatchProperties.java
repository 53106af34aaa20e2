package com.openforge.sidekick.batch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * application.yml:
 *
 * sidekick:
 *   batch:
 *     default-batch-size: 5
 *     pacing-millis: 500     # pause between consecutive chunks
 */
@ConfigurationProperties(prefix = "sidekick.batch")
public record BatchProperties(
        @DefaultValue("5")   int  defaultBatchSize,
        @DefaultValue("500") long pacingMillis
) {

    public Duration pacing() {
        return Duration.ofMillis(pacingMillis);
    }
}
