package com.eainde.extraction.orchestrator;

import com.eainde.extraction.model.ExtractionResult;
import com.eainde.extraction.pass.ExtractionPass;
import com.eainde.extraction.segment.Segment;

/**
 * One (segment, pass) unit of work and its result slot. Only the worker that
 * runs the job writes to it; readers look after the pass barrier.
 */
public final class ExtractionJob {

    private final Segment segment;
    private final ExtractionPass pass;
    private volatile JobState state = JobState.PENDING;
    private volatile int attempts;
    private volatile ExtractionResult result;

    ExtractionJob(Segment segment, ExtractionPass pass) {
        this.segment = segment;
        this.pass = pass;
    }

    public Segment segment() {
        return segment;
    }

    public ExtractionPass pass() {
        return pass;
    }

    public JobState state() {
        return state;
    }

    public int attempts() {
        return attempts;
    }

    public ExtractionResult result() {
        return result;
    }

    public String key() {
        return segment.id() + "/" + pass.name();
    }

    void moveTo(JobState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Job " + key() + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    void dispatched() {
        moveTo(JobState.DISPATCHED);
        attempts++;
    }

    void complete(JobState terminal, ExtractionResult result) {
        moveTo(terminal);
        this.result = result;
    }

    @Override
    public String toString() {
        return "Job[" + key() + ", " + state + ", attempts=" + attempts + "]";
    }
}
