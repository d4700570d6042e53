package com.eainde.extraction.model;

/**
 * Per-segment summary across all passes run for it.
 */
public enum SegmentOutcome {
    /** Every attempted pass returned OK. */
    SUCCEEDED,
    /** At least one pass OK and at least one failed. */
    PARTIAL,
    /** Attempted, but no pass returned OK. */
    FAILED,
    /** Gated out by the classifier; never sent. */
    EXCLUDED,
    /** Never sent, e.g. the run budget ran out first. */
    NOT_ATTEMPTED
}
