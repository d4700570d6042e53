package com.eainde.extraction.pipeline;

import com.eainde.extraction.adapter.ExtractionCallAdapter;
import com.eainde.extraction.aggregate.ResultAggregator;
import com.eainde.extraction.classify.ClassificationDecision;
import com.eainde.extraction.classify.SegmentClassifier;
import com.eainde.extraction.model.AggregatedExtraction;
import com.eainde.extraction.model.CallStatus;
import com.eainde.extraction.model.DiagnosticKind;
import com.eainde.extraction.model.DiagnosticLog;
import com.eainde.extraction.model.DocumentCategory;
import com.eainde.extraction.model.ExtractionOutcome;
import com.eainde.extraction.model.ExtractionResult;
import com.eainde.extraction.model.RunDiagnostics;
import com.eainde.extraction.model.SegmentDiagnostic;
import com.eainde.extraction.model.SegmentOutcome;
import com.eainde.extraction.model.SizeTier;
import com.eainde.extraction.orchestrator.ExtractionOrchestrator;
import com.eainde.extraction.orchestrator.OrchestrationResult;
import com.eainde.extraction.pass.ExtractionPass;
import com.eainde.extraction.pass.PassPlan;
import com.eainde.extraction.segment.DocumentSegmenter;
import com.eainde.extraction.segment.Segment;
import com.eainde.extraction.segment.SegmentationResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * End-to-end controller: segmentation, classification, orchestration, aggregation.
 *
 * <h3>Decision logic:</h3>
 * <pre>
 * run(text, category[, settings])
 *   │
 *   ├── blank text? → empty extraction, score 0, EMPTY_DOCUMENT
 *   │
 *   └── tier = SMALL | MEDIUM | LARGE by character count (decided once)
 *         1. segment with the tier's strategy (degrades, never fails)
 *         2. classify; short signature blocks are excluded
 *         3. passes = plan ∩ category applicability ∩ tier (LARGE drops expensive passes)
 *         4. orchestrate passes over the remaining segments
 *         5. aggregate, score, collect diagnostics
 * </pre>
 *
 * <p>Every run gets its own id, put in the MDC as {@code runId} for the duration of the run.
 * The output always succeeds structurally; call failures surface in the diagnostics.</p>
 */
@Slf4j
public class ExtractionPipeline {

    public static final String RUN_ID_MDC_KEY = "runId";

    private final ExtractionCallAdapter adapter;
    private final PipelineSettings defaultSettings;

    public ExtractionPipeline(ExtractionCallAdapter adapter, PipelineSettings defaultSettings) {
        this.adapter = adapter;
        this.defaultSettings = defaultSettings;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public ExtractionOutcome run(String documentText, DocumentCategory category) {
        return run(documentText, category, defaultSettings);
    }

    public ExtractionOutcome run(String documentText, DocumentCategory category, PipelineSettings settings) {
        DocumentCategory declared = category == null ? DocumentCategory.GENERAL : category;
        String runId = UUID.randomUUID().toString().substring(0, 8);
        String previousRunId = MDC.get(RUN_ID_MDC_KEY);
        MDC.put(RUN_ID_MDC_KEY, runId);
        long started = System.nanoTime();
        try {
            return execute(runId, documentText, declared, settings, started);
        } finally {
            if (previousRunId != null) MDC.put(RUN_ID_MDC_KEY, previousRunId);
            else MDC.remove(RUN_ID_MDC_KEY);
        }
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private ExtractionOutcome execute(String runId, String text, DocumentCategory category,
                                      PipelineSettings settings, long started) {
        DiagnosticLog diagnostics = new DiagnosticLog();
        ResultAggregator aggregator = new ResultAggregator(settings.aggregation());

        if (text == null || text.isBlank()) {
            log.warn("Empty document, nothing to extract");
            diagnostics.record(DiagnosticKind.EMPTY_DOCUMENT, "run", "document text is empty or blank");
            AggregatedExtraction empty = AggregatedExtraction.empty(
                    settings.aggregation().expectedFieldsFor(category));
            TierStrategy strategy = TierStrategy.forTier(SizeTier.SMALL);
            return new ExtractionOutcome(empty, new RunDiagnostics(runId, SizeTier.SMALL,
                    strategy.segmentationMode(), false, List.of(), List.of(), List.of(), 0, 0.0,
                    since(started), diagnostics.snapshot()));
        }

        // ── Step 1: tier and segmentation ───────────────────────────────
        SizeTier tier = settings.tierOf(text.length());
        TierStrategy strategy = TierStrategy.forTier(tier);
        log.info("Run {} started: {} chars, {} lease, tier {}", runId, text.length(), category, tier);

        SegmentationResult segmentation = DocumentSegmenter.of(settings.segmentation())
                .segment(text, strategy.segmentationMode());
        if (segmentation.degraded()) {
            diagnostics.record(DiagnosticKind.SEGMENTATION_DEGRADED, "run", segmentation.usedMode()
                    + " used instead of " + segmentation.requestedMode() + ": " + segmentation.reason());
        }

        // ── Step 2: classification and exclusion ────────────────────────
        List<ClassificationDecision> decisions = new SegmentClassifier(settings.classification())
                .classifyAll(segmentation.segments(), category);
        List<Segment> segments = new ArrayList<>(decisions.size());
        List<Segment> included = new ArrayList<>(decisions.size());
        for (ClassificationDecision decision : decisions) {
            segments.add(decision.segment());
            if (decision.excluded()) {
                diagnostics.record(DiagnosticKind.SEGMENT_EXCLUDED, decision.segment().id(), decision.reason());
            } else {
                included.add(decision.segment());
            }
        }

        // ── Step 3: pass selection ──────────────────────────────────────
        List<String> skippedPasses = new ArrayList<>();
        PassPlan plan = selectPasses(settings.passes(), category, strategy, tier, diagnostics, skippedPasses);

        // ── Step 4: orchestration ───────────────────────────────────────
        OrchestrationResult orchestration = new ExtractionOrchestrator(adapter, aggregator, settings.orchestration())
                .execute(runId, included, plan, diagnostics);
        skippedPasses.addAll(orchestration.skippedPasses());

        // ── Step 5: aggregation and diagnostics ─────────────────────────
        List<SegmentDiagnostic> segmentDiagnostics = segmentDiagnostics(decisions, orchestration.results(), plan);
        int succeeded = 0;
        int scheduled = 0;
        for (SegmentDiagnostic diagnostic : segmentDiagnostics) {
            if (diagnostic.scheduled()) scheduled++;
            if (diagnostic.outcome() == SegmentOutcome.SUCCEEDED || diagnostic.outcome() == SegmentOutcome.PARTIAL) {
                succeeded++;
            }
        }
        AggregatedExtraction extraction = aggregator.aggregate(orchestration.results(), segments, plan, category,
                succeeded, scheduled);
        int truncatedCalls = (int) orchestration.results().stream().filter(ExtractionResult::truncated).count();

        Duration elapsed = since(started);
        RunDiagnostics runDiagnostics = new RunDiagnostics(runId, tier, segmentation.usedMode(),
                segmentation.degraded(), segmentDiagnostics, orchestration.passesRun(), skippedPasses,
                truncatedCalls, extraction.completenessScore(), elapsed, diagnostics.snapshot());

        log.info("Run {} finished in {} ms: {} segments ({} excluded, {} succeeded, {} failed), "
                        + "{} fields, completeness {}", runId, elapsed.toMillis(), segments.size(),
                runDiagnostics.countSegments(SegmentOutcome.EXCLUDED), succeeded,
                runDiagnostics.countSegments(SegmentOutcome.FAILED), extraction.resolvedFieldCount(),
                String.format("%.2f", extraction.completenessScore()));
        return new ExtractionOutcome(extraction, runDiagnostics);
    }

    private PassPlan selectPasses(PassPlan passes, DocumentCategory category, TierStrategy strategy, SizeTier tier,
                                  DiagnosticLog diagnostics, List<String> skippedPasses) {
        for (ExtractionPass pass : passes.passes()) {
            if (!pass.appliesTo(category)) {
                skippedPasses.add(pass.name());
                diagnostics.record(DiagnosticKind.PASS_SKIPPED, pass.name(), "not applicable to " + category);
            } else if (pass.expensive() && !strategy.expensivePasses()) {
                skippedPasses.add(pass.name());
                diagnostics.record(DiagnosticKind.PASS_SKIPPED, pass.name(), "expensive pass excluded for " + tier);
            }
        }
        return passes.retain(pass -> pass.appliesTo(category) && (!pass.expensive() || strategy.expensivePasses()));
    }

    private static List<SegmentDiagnostic> segmentDiagnostics(List<ClassificationDecision> decisions,
                                                              List<ExtractionResult> results, PassPlan plan) {
        Map<String, List<ExtractionResult>> bySegment = new LinkedHashMap<>();
        for (ExtractionResult result : results) {
            bySegment.computeIfAbsent(result.segmentId(), id -> new ArrayList<>()).add(result);
        }

        List<SegmentDiagnostic> diagnostics = new ArrayList<>(decisions.size());
        for (ClassificationDecision decision : decisions) {
            Segment segment = decision.segment();
            List<ExtractionResult> own = bySegment.getOrDefault(segment.id(), List.of());
            Map<String, CallStatus> statuses = new LinkedHashMap<>();
            int attempts = 0;
            boolean truncated = false;
            for (String passName : plan.names()) {
                for (ExtractionResult result : own) {
                    if (result.passName().equals(passName)) {
                        statuses.put(passName, result.status());
                        attempts += result.attempts();
                        truncated |= result.truncated();
                    }
                }
            }
            SegmentOutcome outcome = decision.excluded() ? SegmentOutcome.EXCLUDED : outcomeOf(statuses);
            diagnostics.add(new SegmentDiagnostic(segment.id(), segment.classification(), outcome, statuses,
                    attempts, truncated, segment.pageHint()));
        }
        return diagnostics;
    }

    static SegmentOutcome outcomeOf(Map<String, CallStatus> statuses) {
        long ok = statuses.values().stream().filter(CallStatus::isSuccess).count();
        long skipped = statuses.values().stream().filter(s -> s == CallStatus.SKIPPED).count();
        if (statuses.isEmpty() || skipped == statuses.size()) return SegmentOutcome.NOT_ATTEMPTED;
        if (ok == statuses.size()) return SegmentOutcome.SUCCEEDED;
        if (ok > 0) return SegmentOutcome.PARTIAL;
        return SegmentOutcome.FAILED;
    }

    private static Duration since(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
