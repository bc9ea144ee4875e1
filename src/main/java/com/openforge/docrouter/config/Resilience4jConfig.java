package com.openforge.docrouter.config;

import com.openforge.docrouter.memory.ExperienceProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Programmatic Resilience4j wiring for the similarity capability.
 *
 *   • "similarityLookup" - TimeLimiter + CircuitBreaker around recall
 *   • "similarityIndex"  - Retry around background index writes
 *
 * Recall is on the routing hot path: it is cut off after the configured
 * lookup timeout, and repeated timeouts open the circuit so later
 * attachments skip the lookup entirely until it recovers.
 */
@Configuration
public class Resilience4jConfig {

    static final String LOOKUP = "similarityLookup";
    static final String INDEX  = "similarityIndex";

    // ── Time Limiter ─────────────────────────────────────────────────────────

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(ExperienceProperties experience) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(experience.lookupTimeoutMillis()))
                .cancelRunningFuture(true)
                .build();
        TimeLimiterRegistry registry = TimeLimiterRegistry.of(config);
        registry.timeLimiter(LOOKUP);
        return registry;
    }

    @Bean
    public TimeLimiter similarityLookupTimeLimiter(TimeLimiterRegistry registry) {
        return registry.timeLimiter(LOOKUP);
    }

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 20 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .failureRateThreshold(50)
                // allow 2 probe calls while HALF-OPEN
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(TimeoutException.class, IOException.class, RuntimeException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(LOOKUP);
        return registry;
    }

    @Bean
    public CircuitBreaker similarityLookupCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(LOOKUP);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(500))
                .retryExceptions(IOException.class, RuntimeException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(INDEX);
        return registry;
    }

    @Bean
    public Retry similarityIndexRetry(RetryRegistry registry) {
        return registry.retry(INDEX);
    }
}
