package com.openforge.sidekick.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-client sliding-window admission control.
 *
 * Algorithm for {@link #admit(String)}:
 *   1. drop every timestamp at or before {@code now - window}
 *   2. if the remaining count is already {@code maxRequests}, reject (nothing recorded)
 *   3. otherwise record {@code now} and admit
 *
 * Windows are created on first use and live for the whole process; there
 * is no persistence, so a restart resets every budget.
 */
@Slf4j
@Component
@EnableConfigurationProperties(RateLimitProperties.class)
public class SlidingWindowRateLimiter {

    public static final String DEFAULT_CLIENT = "default";

    private final Clock               clock;
    private final RateLimitProperties properties;
    private final long                windowMillis;

    private final Map<String, RateWindow> windows = new ConcurrentHashMap<>();
    private final AtomicLong              admittedTotal = new AtomicLong();

    public SlidingWindowRateLimiter(Clock clock, RateLimitProperties properties) {
        this.clock        = clock;
        this.properties   = properties;
        this.windowMillis = properties.windowSeconds() * 1000L;
    }

    /**
     * Admits or rejects one request for {@code clientId}.  A blank id is
     * treated as {@link #DEFAULT_CLIENT}.
     */
    public boolean admit(String clientId) {
        String key = normalize(clientId);
        RateWindow window = windows.computeIfAbsent(key, k -> new RateWindow());
        boolean admitted = window.tryAdmit(clock.millis(), windowMillis, properties.maxRequests());
        if (admitted) {
            admittedTotal.incrementAndGet();
        } else {
            log.warn("[RateLimiter] Rejected client={} ({} per {}s)",
                    key, properties.maxRequests(), properties.windowSeconds());
        }
        return admitted;
    }

    /** Aggregate counters for the stats tool. */
    public Snapshot snapshot() {
        long now = clock.millis();
        int recent = windows.values().stream()
                .mapToInt(w -> w.countWithin(now, windowMillis))
                .sum();
        return new Snapshot(admittedTotal.get(), recent, windows.size(),
                properties.maxRequests(), properties.windowSeconds());
    }

    public RateLimitProperties properties() {
        return properties;
    }

    static String normalize(String clientId) {
        return clientId == null || clientId.isBlank() ? DEFAULT_CLIENT : clientId;
    }

    /**
     * @param totalAdmitted  admissions since process start, all clients
     * @param recentRequests admissions inside the current window, all clients
     * @param clients        number of client ids seen so far
     */
    public record Snapshot(
            long totalAdmitted,
            int  recentRequests,
            int  clients,
            int  maxRequests,
            int  windowSeconds
    ) {}
}
