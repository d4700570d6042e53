package com.eainde.extraction.orchestrator;

import com.eainde.extraction.model.ExtractionResult;

import java.util.List;

/**
 * Everything the orchestrator produced for one run.
 *
 * @param results       one result per job, sorted by pass order then segment order
 * @param jobs          final job snapshots, same order as {@code results}
 * @param passesRun     passes that dispatched at least one job, in execution order
 * @param skippedPasses passes not run, in plan order
 */
public record OrchestrationResult(
        List<ExtractionResult> results,
        List<ExtractionJob> jobs,
        List<String> passesRun,
        List<String> skippedPasses
) {

    public OrchestrationResult {
        results = List.copyOf(results);
        jobs = List.copyOf(jobs);
        passesRun = List.copyOf(passesRun);
        skippedPasses = List.copyOf(skippedPasses);
    }

    public static OrchestrationResult empty(List<String> skippedPasses) {
        return new OrchestrationResult(List.of(), List.of(), List.of(), skippedPasses);
    }
}
