package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a resolved value came from.
 *
 * @param segmentId   segment the value was extracted from
 * @param passName    pass that produced it
 * @param excerpt     verbatim excerpt returned with the value
 * @param confidence  service-reported confidence
 * @param firstPage   first page of the segment, {@code null} without page information
 * @param lastPage    last page of the segment, {@code null} without page information
 * @param startOffset document offset where the segment's own span starts
 * @param endOffset   document offset where the segment's own span ends
 */
public record SourceAttribution(
        @JsonProperty("segment_id")   String segmentId,
        @JsonProperty("pass")         String passName,
        @JsonProperty("excerpt")      String excerpt,
        @JsonProperty("confidence")   double confidence,
        @JsonProperty("first_page")   Integer firstPage,
        @JsonProperty("last_page")    Integer lastPage,
        @JsonProperty("start_offset") int startOffset,
        @JsonProperty("end_offset")   int endOffset
) {}
