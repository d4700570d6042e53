package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;

/**
 * Result of extracting one segment in one pass. Immutable.
 *
 * <p>Only {@link CallStatus#OK} results carry fields; every other status has an
 * empty field list and a failure detail.</p>
 *
 * @param segmentId     segment the call covered
 * @param passName      pass the call belonged to
 * @param fields        extracted fields, in the order the service returned them
 * @param status        call outcome
 * @param attempts      number of calls made, retries included; 0 when never sent
 * @param elapsed       wall-clock time across all attempts
 * @param truncated     true when the request text was cut to the size ceiling
 * @param failureDetail why the call did not succeed, {@code null} on success
 * @param retryable     true when the failure is transient and may succeed on retry
 */
public record ExtractionResult(
        @JsonProperty("segment_id")     String segmentId,
        @JsonProperty("pass")           String passName,
        @JsonProperty("fields")         List<ExtractedField> fields,
        @JsonProperty("status")         CallStatus status,
        @JsonProperty("attempts")       int attempts,
        @JsonProperty("elapsed")        Duration elapsed,
        @JsonProperty("truncated")      boolean truncated,
        @JsonProperty("failure_detail") String failureDetail,
        @JsonProperty("retryable")      boolean retryable
) {

    public ExtractionResult {
        fields = fields == null ? List.of() : List.copyOf(fields);
        if (elapsed == null) elapsed = Duration.ZERO;
        if (status != CallStatus.OK && !fields.isEmpty()) {
            throw new IllegalArgumentException("only OK results may carry fields");
        }
    }

    public static ExtractionResult ok(String segmentId, String passName, List<ExtractedField> fields,
                                      Duration elapsed, boolean truncated) {
        return new ExtractionResult(segmentId, passName, fields, CallStatus.OK, 1, elapsed, truncated, null, false);
    }

    public static ExtractionResult failure(String segmentId, String passName, CallStatus status,
                                           String detail, boolean retryable, Duration elapsed, boolean truncated) {
        return new ExtractionResult(segmentId, passName, List.of(), status, 1, elapsed, truncated, detail, retryable);
    }

    public static ExtractionResult skipped(String segmentId, String passName, String reason) {
        return new ExtractionResult(segmentId, passName, List.of(), CallStatus.SKIPPED, 0, Duration.ZERO,
                false, reason, false);
    }

    public boolean isSuccess() {
        return status == CallStatus.OK;
    }

    /**
     * Copy carrying the totals of a multi-attempt job.
     */
    public ExtractionResult withAttempts(int attempts, Duration totalElapsed) {
        return new ExtractionResult(segmentId, passName, fields, status, attempts, totalElapsed, truncated,
                failureDetail, retryable);
    }
}
