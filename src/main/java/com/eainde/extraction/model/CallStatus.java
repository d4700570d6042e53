package com.eainde.extraction.model;

/**
 * Outcome of one (segment, pass) extraction call.
 */
public enum CallStatus {
    OK,
    TIMEOUT,
    SERVICE_ERROR,
    MALFORMED,
    /** Never sent: run budget exhausted or the pass did not apply to the segment. */
    SKIPPED;

    public boolean isSuccess() {
        return this == OK;
    }
}
