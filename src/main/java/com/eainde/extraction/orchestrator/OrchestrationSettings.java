package com.eainde.extraction.orchestrator;

import java.time.Duration;

/**
 * Limits for one orchestrated run.
 *
 * @param concurrency                      worker pool size
 * @param maxAttempts                      calls per job, first attempt included
 * @param initialBackoff                   wait before the first retry
 * @param maxBackoff                       cap on the doubled backoff
 * @param runBudget                        wall-clock budget; no call starts after it runs out
 * @param skipExpensivePassesAboveSegments expensive passes are skipped when the run has more segments
 * @param circuitBreaker                   per-run circuit breaker settings
 */
public record OrchestrationSettings(
        int concurrency,
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        Duration runBudget,
        int skipExpensivePassesAboveSegments,
        CircuitBreakerSettings circuitBreaker
) {

    public static final OrchestrationSettings DEFAULTS = new OrchestrationSettings(5, 3,
            Duration.ofMillis(500), Duration.ofSeconds(4), Duration.ofMinutes(5), 20,
            CircuitBreakerSettings.DEFAULTS);

    public OrchestrationSettings {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (runBudget == null || runBudget.isNegative() || runBudget.isZero()) {
            throw new IllegalArgumentException("runBudget must be positive");
        }
        if (skipExpensivePassesAboveSegments < 0) {
            throw new IllegalArgumentException("skipExpensivePassesAboveSegments must be >= 0");
        }
        if (circuitBreaker == null) circuitBreaker = CircuitBreakerSettings.DISABLED;
    }

    /**
     * Backoff before retry number {@code retry} (1-based): doubled each time, capped.
     */
    public Duration backoffBefore(int retry) {
        long millis = initialBackoff.toMillis();
        for (int i = 1; i < retry && millis < maxBackoff.toMillis(); i++) {
            millis *= 2;
        }
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }
}
