package com.eainde.extraction.model;

import com.eainde.extraction.segment.PageSpan;
import com.eainde.extraction.segment.SegmentCategory;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status of one segment after the run.
 *
 * @param segmentId      segment id
 * @param classification category tag
 * @param outcome        summary across passes
 * @param passStatuses   pass name to final call status, in pass order
 * @param attempts       calls made for this segment across all passes
 * @param truncated      true when any call for this segment was truncated
 * @param pageHint       pages the segment lies on, may be {@code null}
 */
public record SegmentDiagnostic(
        @JsonProperty("segment_id")     String segmentId,
        @JsonProperty("classification") SegmentCategory classification,
        @JsonProperty("outcome")        SegmentOutcome outcome,
        @JsonProperty("pass_statuses")  Map<String, CallStatus> passStatuses,
        @JsonProperty("attempts")       int attempts,
        @JsonProperty("truncated")      boolean truncated,
        @JsonProperty("page_hint")      PageSpan pageHint
) {

    public SegmentDiagnostic {
        passStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(passStatuses));
    }

    /**
     * True when at least one job was scheduled for the segment, whether or not it ran.
     * Such segments form the denominator of the completeness score.
     */
    public boolean scheduled() {
        return outcome != SegmentOutcome.EXCLUDED && !passStatuses.isEmpty();
    }
}
