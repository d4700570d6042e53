package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a pipeline run returns: the merged extraction and how the run went.
 */
public record ExtractionOutcome(
        @JsonProperty("extraction")  AggregatedExtraction extraction,
        @JsonProperty("diagnostics") RunDiagnostics diagnostics
) {}
