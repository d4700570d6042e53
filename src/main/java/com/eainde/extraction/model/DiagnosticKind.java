package com.eainde.extraction.model;

/**
 * Degraded conditions recorded during a run. None of them aborts the run.
 */
public enum DiagnosticKind {
    EMPTY_DOCUMENT,
    SEGMENTATION_DEGRADED,
    SEGMENT_EXCLUDED,
    CALL_TIMEOUT,
    CALL_SERVICE_ERROR,
    CALL_MALFORMED_RESPONSE,
    CALL_TRUNCATED,
    CIRCUIT_OPEN,
    PASS_SKIPPED,
    RUN_BUDGET_EXHAUSTED
}
