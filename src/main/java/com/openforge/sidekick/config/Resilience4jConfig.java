package com.openforge.sidekick.config;

import com.openforge.sidekick.error.ErrorKind;
import com.openforge.sidekick.error.SidekickException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named breaker, "backend", guards every call to LM Studio.  While it
 * is OPEN the gateway fails fast instead of waiting out connection timeouts
 * against a backend that is down.
 *
 * No Retry is wired: a retried completion would be a second backend call
 * on a single rate-limit admission.
 */
@Configuration
public class Resilience4jConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                // allow 2 probe calls while HALF-OPEN
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(15))
                // only an unreachable backend or a 5xx counts; 4xx and empty answers are the caller's problem
                .recordException(Resilience4jConfig::isBackendFailure)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker("backend");
        return registry;
    }

    @Bean
    public CircuitBreaker backendCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("backend");
    }

    static boolean isBackendFailure(Throwable failure) {
        if (!(SidekickException.unwrap(failure) instanceof SidekickException se)) {
            return true;
        }
        return se.is(ErrorKind.BACKEND_UNREACHABLE)
                || (se.is(ErrorKind.BACKEND_BAD_STATUS) && se.statusCode() >= 500);
    }
}
