package com.openforge.sidekick.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - sidekickExecutor  → runs HttpClient callbacks and batch pacing continuations
 *  - Java HttpClient   → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, Java time, tolerant deserialization
 *  - Clock             → single time source for rate windows and context timestamps
 */
@Configuration
public class AppConfig {

    private static final int EXECUTOR_THREADS = Math.max(4, Runtime.getRuntime().availableProcessors());

    /**
     * Small fixed pool: it only runs completion callbacks and pacing
     * continuations, never blocking I/O, so a handful of threads serves
     * any number of concurrent tool calls.
     */
    @Bean
    public ExecutorService sidekickExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "sidekick-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(EXECUTOR_THREADS, EXECUTOR_THREADS,
                60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), factory);
    }

    /**
     * Single, shared HttpClient instance.
     * - async responses are delivered on sidekickExecutor
     * - 10 s connect timeout; per-request timeouts are set at call site
     */
    @Bean
    public HttpClient httpClient(ExecutorService sidekickExecutor) {
        return HttpClient.newBuilder()
                .executor(sidekickExecutor)
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON:
     *  - snake_case property names (max_tokens, finish_reason …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (backends add fields freely)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
