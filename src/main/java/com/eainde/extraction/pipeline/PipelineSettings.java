package com.eainde.extraction.pipeline;

import com.eainde.extraction.aggregate.AggregationSettings;
import com.eainde.extraction.classify.ClassifierSettings;
import com.eainde.extraction.model.SizeTier;
import com.eainde.extraction.orchestrator.OrchestrationSettings;
import com.eainde.extraction.pass.PassCatalog;
import com.eainde.extraction.pass.PassPlan;
import com.eainde.extraction.segment.SegmentationPolicy;

/**
 * Immutable, validated settings handed to {@link ExtractionPipeline} at run start.
 *
 * @param segmentation          segment size limits
 * @param smallDocumentMaxChars documents up to this size are {@link SizeTier#SMALL}
 * @param largeDocumentMinChars documents from this size on are {@link SizeTier#LARGE}
 * @param classification        classifier keywords and signature gate
 * @param orchestration         concurrency, retry, budget and circuit breaker limits
 * @param aggregation           completeness weights and expected fields
 * @param passes                pass plan
 */
public record PipelineSettings(
        SegmentationPolicy segmentation,
        int smallDocumentMaxChars,
        int largeDocumentMinChars,
        ClassifierSettings classification,
        OrchestrationSettings orchestration,
        AggregationSettings aggregation,
        PassPlan passes
) {

    public PipelineSettings {
        if (segmentation == null || classification == null || orchestration == null
                || aggregation == null || passes == null) {
            throw new IllegalArgumentException("all pipeline settings must be present");
        }
        if (smallDocumentMaxChars < 0) throw new IllegalArgumentException("smallDocumentMaxChars must be >= 0");
        if (largeDocumentMinChars <= smallDocumentMaxChars) {
            throw new IllegalArgumentException("largeDocumentMinChars (" + largeDocumentMinChars
                    + ") must be > smallDocumentMaxChars (" + smallDocumentMaxChars + ")");
        }
        if (passes.isEmpty()) throw new IllegalArgumentException("at least one pass is required");
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(SegmentationPolicy.DEFAULTS, 20_000, 150_000,
                ClassifierSettings.defaults(), OrchestrationSettings.DEFAULTS, AggregationSettings.defaults(),
                PassCatalog.defaultPlan());
    }

    public SizeTier tierOf(int documentChars) {
        if (documentChars <= smallDocumentMaxChars) return SizeTier.SMALL;
        if (documentChars >= largeDocumentMinChars) return SizeTier.LARGE;
        return SizeTier.MEDIUM;
    }

    public PipelineSettings withOrchestration(OrchestrationSettings orchestration) {
        return new PipelineSettings(segmentation, smallDocumentMaxChars, largeDocumentMinChars, classification,
                orchestration, aggregation, passes);
    }

    public PipelineSettings withPasses(PassPlan passes) {
        return new PipelineSettings(segmentation, smallDocumentMaxChars, largeDocumentMinChars, classification,
                orchestration, aggregation, passes);
    }

    public PipelineSettings withSegmentation(SegmentationPolicy segmentation) {
        return new PipelineSettings(segmentation, smallDocumentMaxChars, largeDocumentMinChars, classification,
                orchestration, aggregation, passes);
    }
}
