package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One entry of a run's event trail.
 *
 * @param kind    what happened
 * @param subject what it happened to: a segment id, a pass name, {@code S-004/direct_extraction}, or the run
 * @param detail  human-readable detail
 * @param at      when it was recorded
 */
public record DiagnosticEvent(
        @JsonProperty("kind")    DiagnosticKind kind,
        @JsonProperty("subject") String subject,
        @JsonProperty("detail")  String detail,
        @JsonProperty("at")      Instant at
) {

    public static DiagnosticEvent of(DiagnosticKind kind, String subject, String detail) {
        return new DiagnosticEvent(kind, subject, detail, Instant.now());
    }
}
