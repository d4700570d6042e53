package com.eainde.extraction.model;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Thread-safe event trail for one run. Worker threads record into it while a
 * pass is in flight; the controller snapshots it into {@link RunDiagnostics}.
 */
@Slf4j
public class DiagnosticLog {

    private final List<DiagnosticEvent> events = new ArrayList<>();

    public void record(DiagnosticKind kind, String subject, String detail) {
        DiagnosticEvent event = DiagnosticEvent.of(kind, subject, detail);
        synchronized (events) {
            events.add(event);
        }
        log.debug("Diagnostic {} [{}]: {}", kind, subject, detail);
    }

    public List<DiagnosticEvent> snapshot() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public long count(DiagnosticKind kind) {
        synchronized (events) {
            return events.stream().filter(e -> e.kind() == kind).count();
        }
    }

    public boolean contains(DiagnosticKind kind) {
        return count(kind) > 0;
    }
}
