package com.eainde.extraction.orchestrator;

import java.time.Duration;

/**
 * Wall-clock budget of one run, started when the run starts.
 */
public final class RunBudget {

    private final long deadlineNanos;
    private final Duration total;

    private RunBudget(Duration total) {
        this.total = total;
        this.deadlineNanos = System.nanoTime() + total.toNanos();
    }

    public static RunBudget start(Duration total) {
        if (total == null || total.isNegative() || total.isZero()) {
            throw new IllegalArgumentException("run budget must be positive");
        }
        return new RunBudget(total);
    }

    public boolean isExhausted() {
        return System.nanoTime() - deadlineNanos >= 0;
    }

    public Duration remaining() {
        long remaining = deadlineNanos - System.nanoTime();
        return remaining <= 0 ? Duration.ZERO : Duration.ofNanos(remaining);
    }

    public Duration total() {
        return total;
    }
}
