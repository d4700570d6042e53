package com.eainde.extraction.orchestrator;

/**
 * Lifecycle of one (segment, pass) job:
 * {@code PENDING -> DISPATCHED -> (SUCCEEDED | RETRYING -> DISPATCHED | FAILED)}.
 * A job that never gets dispatched (budget exhausted, circuit open) goes
 * straight from {@code PENDING} to {@code FAILED}.
 */
public enum JobState {
    PENDING,
    DISPATCHED,
    RETRYING,
    SUCCEEDED,
    FAILED;

    boolean canMoveTo(JobState next) {
        return switch (this) {
            case PENDING, RETRYING -> next == DISPATCHED || next == FAILED;
            case DISPATCHED -> next == SUCCEEDED || next == RETRYING || next == FAILED;
            case SUCCEEDED, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
