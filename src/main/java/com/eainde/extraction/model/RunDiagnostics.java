package com.eainde.extraction.model;

import com.eainde.extraction.segment.SegmentationMode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;

/**
 * Everything the controller reports about a run besides the extraction itself.
 *
 * @param runId                 run identifier, also set as MDC {@code runId}
 * @param sizeTier              size class of the document
 * @param segmentationMode      strategy that produced the segments
 * @param segmentationDegraded  true when the requested strategy failed
 * @param segments              per-segment status, in document order
 * @param passesRun             passes executed, in execution order
 * @param skippedPasses         passes skipped for this run
 * @param truncatedCalls        number of calls whose request was truncated
 * @param completenessScore     same score as the aggregated extraction
 * @param elapsed               wall-clock time of the run
 * @param events                event trail in recording order
 */
public record RunDiagnostics(
        @JsonProperty("run_id")                String runId,
        @JsonProperty("size_tier")             SizeTier sizeTier,
        @JsonProperty("segmentation_mode")     SegmentationMode segmentationMode,
        @JsonProperty("segmentation_degraded") boolean segmentationDegraded,
        @JsonProperty("segments")              List<SegmentDiagnostic> segments,
        @JsonProperty("passes_run")            List<String> passesRun,
        @JsonProperty("skipped_passes")        List<String> skippedPasses,
        @JsonProperty("truncated_calls")       int truncatedCalls,
        @JsonProperty("completeness_score")    double completenessScore,
        @JsonProperty("elapsed")               Duration elapsed,
        @JsonProperty("events")                List<DiagnosticEvent> events
) {

    public RunDiagnostics {
        segments = List.copyOf(segments);
        passesRun = List.copyOf(passesRun);
        skippedPasses = List.copyOf(skippedPasses);
        events = List.copyOf(events);
    }

    public long countSegments(SegmentOutcome outcome) {
        return segments.stream().filter(s -> s.outcome() == outcome).count();
    }

    public long countEvents(DiagnosticKind kind) {
        return events.stream().filter(e -> e.kind() == kind).count();
    }

    public SegmentDiagnostic segment(String segmentId) {
        return segments.stream()
                .filter(s -> s.segmentId().equals(segmentId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown segment " + segmentId));
    }
}
