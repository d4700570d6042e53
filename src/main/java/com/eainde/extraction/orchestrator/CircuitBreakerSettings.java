package com.eainde.extraction.orchestrator;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;

import java.time.Duration;

/**
 * Per-run circuit breaker around the extraction service.
 *
 * @param enabled                  false disables the breaker entirely
 * @param failureRateThreshold     failure percentage that opens the circuit
 * @param slidingWindowSize        calls considered by the count-based window
 * @param minimumNumberOfCalls     calls needed before the rate is evaluated
 * @param waitDurationInOpenState  how long the circuit stays open
 * @param minimumFailingSegments   distinct segments that must have failed before an open circuit rejects calls
 */
public record CircuitBreakerSettings(
        boolean enabled,
        float failureRateThreshold,
        int slidingWindowSize,
        int minimumNumberOfCalls,
        Duration waitDurationInOpenState,
        int minimumFailingSegments
) {

    public static final CircuitBreakerSettings DEFAULTS =
            new CircuitBreakerSettings(true, 50.0f, 20, 10, Duration.ofSeconds(30), 3);

    public static final CircuitBreakerSettings DISABLED =
            new CircuitBreakerSettings(false, 50.0f, 20, 10, Duration.ofSeconds(30), 3);

    public CircuitBreakerSettings {
        if (failureRateThreshold <= 0 || failureRateThreshold > 100) {
            throw new IllegalArgumentException("failureRateThreshold must be in (0, 100]");
        }
        if (slidingWindowSize < 1) throw new IllegalArgumentException("slidingWindowSize must be >= 1");
        if (minimumNumberOfCalls < 1) throw new IllegalArgumentException("minimumNumberOfCalls must be >= 1");
        if (waitDurationInOpenState == null || waitDurationInOpenState.isNegative()
                || waitDurationInOpenState.isZero()) {
            throw new IllegalArgumentException("waitDurationInOpenState must be positive");
        }
        if (minimumFailingSegments < 1) throw new IllegalArgumentException("minimumFailingSegments must be >= 1");
    }

    /**
     * @return a fresh breaker, or {@code null} when disabled
     */
    CircuitBreaker newBreaker(String name) {
        if (!enabled) return null;
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(minimumNumberOfCalls)
                .waitDurationInOpenState(waitDurationInOpenState)
                .build();
        return CircuitBreaker.of(name, config);
    }
}
