package com.eainde.extraction.orchestrator;

import com.eainde.extraction.adapter.ExtractionCallAdapter;
import com.eainde.extraction.adapter.ExtractionServiceException;
import com.eainde.extraction.aggregate.ResultAggregator;
import com.eainde.extraction.model.CallStatus;
import com.eainde.extraction.model.DiagnosticKind;
import com.eainde.extraction.model.DiagnosticLog;
import com.eainde.extraction.model.ExtractionResult;
import com.eainde.extraction.pass.ExtractionPass;
import com.eainde.extraction.pass.PassPlan;
import com.eainde.extraction.segment.Segment;
import com.eainde.extraction.thread.MdcAwareExecutor;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs every pass of a plan over the segments of one document.
 *
 * <h3>Execution model:</h3>
 * <pre>
 * execute(segments, plan)
 *   │
 *   ├── segments &gt; skip threshold?  → drop expensive passes (decided once)
 *   │
 *   └── for each pass, in plan order:
 *         1. context  = aggregated values of the passes it depends on
 *         2. dispatch = one job per applicable segment on the fixed worker pool
 *         3. barrier  = wait for every job of the pass before the next pass
 * </pre>
 *
 * <h3>Per job:</h3>
 * <ul>
 *   <li>Timeouts, transient service errors and malformed payloads are retried up to
 *       {@code maxAttempts} with capped exponential backoff. Permanent errors are not.</li>
 *   <li>No attempt starts once the run budget is exhausted; the job fails with its last
 *       result, or a {@link CallStatus#SKIPPED} result if it never ran. Calls already in
 *       flight finish.</li>
 *   <li>When the per-run circuit breaker is open and failures span several segments,
 *       a job that has not yet called fails fast.</li>
 *   <li>A failing job never affects other jobs; nothing is thrown past this class.</li>
 * </ul>
 *
 * <p>Each {@link #execute} call owns its pool, breaker and result slots, so concurrent
 * runs share nothing.</p>
 */
@Slf4j
public class ExtractionOrchestrator {

    private final ExtractionCallAdapter adapter;
    private final ResultAggregator aggregator;
    private final OrchestrationSettings settings;

    public ExtractionOrchestrator(ExtractionCallAdapter adapter, ResultAggregator aggregator,
                                  OrchestrationSettings settings) {
        this.adapter = adapter;
        this.aggregator = aggregator;
        this.settings = settings;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param runId       used to name the worker threads and the circuit breaker
     * @param segments    segments to extract, in document order; excluded segments already removed
     * @param plan        passes to run
     * @param diagnostics event trail of the run
     */
    public OrchestrationResult execute(String runId, List<Segment> segments, PassPlan plan,
                                       DiagnosticLog diagnostics) {
        List<String> skippedPasses = new ArrayList<>();
        PassPlan effective = plan;
        if (segments.size() > settings.skipExpensivePassesAboveSegments()) {
            effective = plan.retain(pass -> !pass.expensive());
            for (ExtractionPass pass : plan.passes()) {
                if (pass.expensive()) {
                    skippedPasses.add(pass.name());
                    diagnostics.record(DiagnosticKind.PASS_SKIPPED, pass.name(), String.format(
                            "%d segments exceed %d, expensive pass skipped",
                            segments.size(), settings.skipExpensivePassesAboveSegments()));
                }
            }
            log.info("Skipping expensive passes {} for {} segments", skippedPasses, segments.size());
        }
        if (segments.isEmpty() || effective.isEmpty()) {
            return OrchestrationResult.empty(skippedPasses);
        }

        RunContext run = new RunContext(RunBudget.start(settings.runBudget()),
                settings.circuitBreaker().newBreaker("extraction-" + runId),
                settings.circuitBreaker().minimumFailingSegments(), diagnostics);
        List<ExtractionJob> allJobs = new ArrayList<>();
        List<ExtractionResult> allResults = new ArrayList<>();
        List<String> passesRun = new ArrayList<>();

        try (MdcAwareExecutor pool = MdcAwareExecutor.fixed(settings.concurrency(), "extraction-" + runId + "-")) {
            for (ExtractionPass pass : effective.passes()) {

                // ── Step 1: context from the passes this one depends on ─────
                Map<String, String> context = aggregator.priorContext(pass, allResults, segments, effective);

                // ── Step 2: one job per applicable segment ──────────────────
                List<ExtractionJob> jobs = new ArrayList<>();
                for (Segment segment : segments) {
                    if (pass.appliesTo(segment.classification())) jobs.add(new ExtractionJob(segment, pass));
                }
                if (jobs.isEmpty()) {
                    log.info("Pass {} applies to no segment", pass.name());
                    continue;
                }
                if (run.budget.isExhausted()) {
                    skippedPasses.add(pass.name());
                    diagnostics.record(DiagnosticKind.PASS_SKIPPED, pass.name(), "run budget exhausted");
                } else {
                    passesRun.add(pass.name());
                }
                log.info("Pass {} started: {} jobs, {} context values, concurrency {}",
                        pass.name(), jobs.size(), context.size(), settings.concurrency());

                CompletableFuture<?>[] futures = new CompletableFuture<?>[jobs.size()];
                for (int i = 0; i < jobs.size(); i++) {
                    ExtractionJob job = jobs.get(i);
                    futures[i] = CompletableFuture.runAsync(() -> runJob(job, context, run), pool);
                }

                // ── Step 3: barrier ─────────────────────────────────────────
                CompletableFuture.allOf(futures).join();

                long succeeded = jobs.stream().filter(j -> j.state() == JobState.SUCCEEDED).count();
                log.info("Pass {} finished: {}/{} jobs succeeded", pass.name(), succeeded, jobs.size());
                for (ExtractionJob job : jobs) {
                    allJobs.add(job);
                    allResults.add(job.result());
                }
            }
        }

        return new OrchestrationResult(allResults, allJobs, passesRun, skippedPasses);
    }

    // =========================================================================
    //  Job execution
    // =========================================================================

    private void runJob(ExtractionJob job, Map<String, String> context, RunContext run) {
        try {
            attemptUntilDone(job, context, run);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in job {}", job.key(), e);
            ExtractionResult failure = ExtractionResult.failure(job.segment().id(), job.pass().name(),
                    CallStatus.SERVICE_ERROR, "unexpected failure: " + e.getMessage(), false, Duration.ZERO, false);
            if (!job.state().isTerminal()) job.complete(JobState.FAILED, failure.withAttempts(job.attempts(),
                    Duration.ZERO));
        }
    }

    private void attemptUntilDone(ExtractionJob job, Map<String, String> context, RunContext run) {
        Segment segment = job.segment();
        ExtractionPass pass = job.pass();
        long started = System.nanoTime();
        ExtractionResult last = null;
        boolean truncationRecorded = false;

        while (true) {
            if (run.budget.isExhausted()) {
                run.budgetExhausted();
                if (last != null) {
                    finish(job, JobState.FAILED, last, run, started);
                } else {
                    job.complete(JobState.FAILED, ExtractionResult.skipped(segment.id(), pass.name(),
                            "run budget exhausted"));
                }
                return;
            }
            if (last == null && run.rejectsCalls()) {
                run.diagnostics.record(DiagnosticKind.CIRCUIT_OPEN, job.key(), "extraction service circuit is open");
                ExtractionResult open = ExtractionResult.failure(segment.id(), pass.name(), CallStatus.SERVICE_ERROR,
                        "circuit open", false, Duration.ZERO, false);
                job.complete(JobState.FAILED, open.withAttempts(job.attempts(), since(started)));
                return;
            }

            job.dispatched();
            ExtractionResult result = adapter.call(segment, pass, context);
            last = result;

            if (result.truncated() && !truncationRecorded) {
                run.diagnostics.record(DiagnosticKind.CALL_TRUNCATED, job.key(), "request text truncated");
                truncationRecorded = true;
            }
            if (result.isSuccess()) {
                finish(job, JobState.SUCCEEDED, result, run, started);
                return;
            }
            run.diagnostics.record(kindOf(result.status()), job.key(),
                    "attempt " + job.attempts() + ": " + result.failureDetail());

            if (!result.retryable() || job.attempts() >= settings.maxAttempts()) {
                log.warn("Job {} failed after {} attempt(s): {} {}", job.key(), job.attempts(),
                        result.status(), result.failureDetail());
                finish(job, JobState.FAILED, result, run, started);
                return;
            }

            Duration backoff = settings.backoffBefore(job.attempts());
            if (backoff.compareTo(run.budget.remaining()) >= 0) {
                run.budgetExhausted();
                finish(job, JobState.FAILED, result, run, started);
                return;
            }
            job.moveTo(JobState.RETRYING);
            log.debug("Retrying job {} in {} ms after {}", job.key(), backoff.toMillis(), result.status());
            if (!sleep(backoff)) {
                finish(job, JobState.FAILED, result, run, started);
                return;
            }
        }
    }

    /**
     * Completes a job that reached the service and reports its final outcome to the
     * breaker. Retries of the same job count once.
     */
    private static void finish(ExtractionJob job, JobState terminal, ExtractionResult result, RunContext run,
                               long started) {
        Duration elapsed = since(started);
        job.complete(terminal, result.withAttempts(job.attempts(), elapsed));
        run.recordOutcome(job.segment(), result, elapsed);
    }

    private static DiagnosticKind kindOf(CallStatus status) {
        return switch (status) {
            case TIMEOUT -> DiagnosticKind.CALL_TIMEOUT;
            case MALFORMED -> DiagnosticKind.CALL_MALFORMED_RESPONSE;
            default -> DiagnosticKind.CALL_SERVICE_ERROR;
        };
    }

    private static boolean sleep(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Duration since(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    /**
     * State shared by the jobs of one run.
     *
     * <p>The breaker sees one outcome per finished job. An open circuit only rejects
     * new jobs once failures span {@code minimumFailingSegments} distinct segments,
     * so a single broken segment cannot starve its siblings.</p>
     */
    private static final class RunContext {
        private final RunBudget budget;
        private final CircuitBreaker breaker;
        private final int minimumFailingSegments;
        private final DiagnosticLog diagnostics;
        private final Set<String> failingSegments = ConcurrentHashMap.newKeySet();
        private final AtomicBoolean budgetReported = new AtomicBoolean();

        private RunContext(RunBudget budget, CircuitBreaker breaker, int minimumFailingSegments,
                           DiagnosticLog diagnostics) {
            this.budget = budget;
            this.breaker = breaker;
            this.minimumFailingSegments = minimumFailingSegments;
            this.diagnostics = diagnostics;
        }

        private boolean rejectsCalls() {
            if (breaker == null || failingSegments.size() < minimumFailingSegments) return false;
            return !breaker.tryAcquirePermission();
        }

        private void recordOutcome(Segment segment, ExtractionResult result, Duration elapsed) {
            if (breaker == null) return;
            if (result.status() == CallStatus.TIMEOUT || result.status() == CallStatus.SERVICE_ERROR) {
                failingSegments.add(segment.id());
                breaker.onError(elapsed.toNanos(), TimeUnit.NANOSECONDS,
                        new ExtractionServiceException(String.valueOf(result.failureDetail()), result.retryable()));
            } else {
                breaker.onSuccess(elapsed.toNanos(), TimeUnit.NANOSECONDS);
            }
        }

        private void budgetExhausted() {
            if (budgetReported.compareAndSet(false, true)) {
                log.warn("Run budget of {} exhausted, no further calls will start", budget.total());
                diagnostics.record(DiagnosticKind.RUN_BUDGET_EXHAUSTED, "run",
                        "budget of " + budget.total().toMillis() + " ms exhausted");
            }
        }
    }
}
