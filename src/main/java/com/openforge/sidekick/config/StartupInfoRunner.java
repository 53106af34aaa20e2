package com.openforge.sidekick.config;

import com.openforge.sidekick.batch.BatchProperties;
import com.openforge.sidekick.context.ContextProperties;
import com.openforge.sidekick.llm.BackendProperties;
import com.openforge.sidekick.ratelimit.RateLimitProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Reports:
 *   - Backend: address, recommended model, timeouts (API key is masked)
 *   - Limits: rate-limit window, context size, batch pacing
 *   - Runtime: Java version, server port
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final BackendProperties   backendProperties;
    private final RateLimitProperties rateLimitProperties;
    private final ContextProperties   contextProperties;
    private final BatchProperties     batchProperties;
    private final Environment         env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            LM Studio Sidekick  —  Startup Summary        ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Backend                                                 ║
                ║    Address        : {}{}
                ║    Recommended    : {}
                ║    Timeouts (s)   : health={} probe={} generation={}
                ║    API key        : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Limits                                                  ║
                ║    Rate limit     : {} requests per {}s
                ║    Context size   : {} tokens
                ║    Batch pacing   : {} ms
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                backendProperties.apiBase(),
                "localhost".equals(backendProperties.host()) ? "" : "  (remote)",
                backendProperties.recommendedModel(),
                backendProperties.healthTimeoutSeconds(),
                backendProperties.probeTimeoutSeconds(),
                backendProperties.generationTimeoutSeconds(),
                maskKey(backendProperties.apiKey()),

                rateLimitProperties.maxRequests(), rateLimitProperties.windowSeconds(),
                contextProperties.maxTokens(),
                batchProperties.pacingMillis()
        );
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" when no key is configured.
     */
    private static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
