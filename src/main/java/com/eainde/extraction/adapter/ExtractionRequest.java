package com.eainde.extraction.adapter;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One bounded request to the extraction service.
 *
 * @param segmentId     segment the text came from
 * @param passName      pass the request belongs to
 * @param instructions  pass instructions, sent as the system message
 * @param text          segment text, already truncated to the request ceiling
 * @param priorContext  resolved values of the passes this pass depends on, field name to value
 * @param allowedFields field names the response may contain; empty means any
 * @param pageHint      human-readable page hint, e.g. {@code pp.4-5}, or {@code null}
 * @param timeout       per-call timeout
 */
public record ExtractionRequest(
        String segmentId,
        String passName,
        String instructions,
        String text,
        Map<String, String> priorContext,
        Set<String> allowedFields,
        String pageHint,
        Duration timeout
) {

    public ExtractionRequest {
        priorContext = priorContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(priorContext));
        allowedFields = allowedFields == null ? Set.of() : Set.copyOf(allowedFields);
    }
}
