package com.eainde.extraction.adapter;

/**
 * Raised by an {@link ExtractionService} when the remote call fails.
 * {@code transientFailure} marks failures worth retrying (rate limits,
 * 5xx responses, connection resets, remote timeouts).
 */
public class ExtractionServiceException extends RuntimeException {

    private final boolean transientFailure;

    public ExtractionServiceException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public ExtractionServiceException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
