package com.eainde.extraction.config;

import com.eainde.extraction.aggregate.AggregationSettings;
import com.eainde.extraction.classify.ClassifierSettings;
import com.eainde.extraction.model.DocumentCategory;
import com.eainde.extraction.orchestrator.CircuitBreakerSettings;
import com.eainde.extraction.orchestrator.OrchestrationSettings;
import com.eainde.extraction.pass.ExtractionPass;
import com.eainde.extraction.pass.PassCatalog;
import com.eainde.extraction.pass.PassPlan;
import com.eainde.extraction.pipeline.PipelineSettings;
import com.eainde.extraction.segment.SegmentCategory;
import com.eainde.extraction.segment.SegmentationPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Binds {@code lease.extraction.*}.
 *
 * <h3>Configuration (application.yml):</h3>
 * <pre>
 * lease:
 *   extraction:
 *     segmentation:
 *       target-chars: 5000
 *       max-chars: 10000
 *       overlap-chars: 200
 *     orchestration:
 *       concurrency: 5
 *       run-budget: 5m
 *     passes:
 *       - name: direct_extraction
 *         instructions: "..."
 *         timeout: 60s
 * </pre>
 *
 * <p>Empty keyword lists, expected-field maps and pass lists fall back to the built-in
 * defaults. {@link #toSettings()} validates everything and throws
 * {@link IllegalArgumentException} on the first invalid value.</p>
 */
@Data
@ConfigurationProperties(prefix = "lease.extraction")
public class ExtractionProperties {

    private Segmentation segmentation = new Segmentation();
    private Classification classification = new Classification();
    private Orchestration orchestration = new Orchestration();
    private Adapter adapter = new Adapter();
    private Aggregation aggregation = new Aggregation();
    private List<Pass> passes = new ArrayList<>();

    public PipelineSettings toSettings() {
        SegmentationPolicy policy = new SegmentationPolicy(segmentation.targetChars, segmentation.maxChars,
                segmentation.overlapChars, segmentation.tableMinRows, segmentation.smallParagraphChars);
        return new PipelineSettings(policy, segmentation.smallDocumentMaxChars, segmentation.largeDocumentMinChars,
                classification.toSettings(), orchestration.toSettings(), aggregation.toSettings(), passPlan());
    }

    PassPlan passPlan() {
        if (passes.isEmpty()) return PassCatalog.defaultPlan();
        List<ExtractionPass> built = new ArrayList<>(passes.size());
        for (Pass pass : passes) built.add(pass.toPass());
        return PassPlan.of(built);
    }

    // =========================================================================
    //  Sections
    // =========================================================================

    @Data
    public static class Segmentation {
        private int targetChars = 5_000;
        private int maxChars = 10_000;
        private int overlapChars = 200;
        private int smallDocumentMaxChars = 20_000;
        private int largeDocumentMinChars = 150_000;
        private int tableMinRows = 3;
        private int smallParagraphChars = 500;
    }

    @Data
    public static class Classification {
        private int exclusionMaxChars = 1_500;
        private double signatureDominanceRatio = 0.6;
        private boolean excludeSignatureSegments = true;
        /** Category key to keywords; a configured category replaces its default list. */
        private Map<String, List<String>> keywords = new LinkedHashMap<>();
        private List<String> signatureKeywords = new ArrayList<>();

        ClassifierSettings toSettings() {
            Map<SegmentCategory, List<String>> merged = new EnumMap<>(ClassifierSettings.DEFAULT_KEYWORDS);
            keywords.forEach((key, words) -> merged.put(segmentCategory(key), words));
            return new ClassifierSettings(merged, ClassifierSettings.DEFAULT_DOCUMENT_KEYWORDS,
                    signatureKeywords.isEmpty() ? ClassifierSettings.DEFAULT_SIGNATURE_KEYWORDS : signatureKeywords,
                    exclusionMaxChars, signatureDominanceRatio, excludeSignatureSegments);
        }
    }

    @Data
    public static class Orchestration {
        private int concurrency = 5;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration maxBackoff = Duration.ofSeconds(4);
        private Duration runBudget = Duration.ofMinutes(5);
        private int skipExpensivePassesAboveSegments = 20;
        private CircuitBreaker circuitBreaker = new CircuitBreaker();

        OrchestrationSettings toSettings() {
            return new OrchestrationSettings(concurrency, maxAttempts, initialBackoff, maxBackoff, runBudget,
                    skipExpensivePassesAboveSegments, circuitBreaker.toSettings());
        }
    }

    @Data
    public static class CircuitBreaker {
        private boolean enabled = true;
        private float failureRateThreshold = 50.0f;
        private int slidingWindowSize = 20;
        private int minimumNumberOfCalls = 10;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
        private int minimumFailingSegments = 3;

        CircuitBreakerSettings toSettings() {
            return new CircuitBreakerSettings(enabled, failureRateThreshold, slidingWindowSize,
                    minimumNumberOfCalls, waitDurationInOpenState, minimumFailingSegments);
        }
    }

    @Data
    public static class Adapter {
        private int maxRequestChars = 12_000;
        private Cache cache = new Cache();
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(2);
        private long maximumSize = 1_000;
    }

    @Data
    public static class Aggregation {
        private double segmentWeight = 0.5;
        private double fieldWeight = 0.5;
        /** Document category key to expected field names; a configured category replaces its defaults. */
        private Map<String, List<String>> expectedFields = new LinkedHashMap<>();

        AggregationSettings toSettings() {
            Map<DocumentCategory, List<String>> merged = new EnumMap<>(AggregationSettings.defaultExpectedFields());
            expectedFields.forEach((key, fields) -> merged.put(documentCategory(key), fields));
            return new AggregationSettings(segmentWeight, fieldWeight, merged);
        }
    }

    @Data
    public static class Pass {
        private String name;
        private List<String> dependsOn = new ArrayList<>();
        private String instructions;
        private Duration timeout = Duration.ofSeconds(60);
        private boolean expensive;
        private List<String> segmentCategories = new ArrayList<>();
        private List<String> allowedFields = new ArrayList<>();
        private List<String> documentCategories = new ArrayList<>();

        ExtractionPass toPass() {
            Set<SegmentCategory> segments = EnumSet.noneOf(SegmentCategory.class);
            segmentCategories.forEach(key -> segments.add(segmentCategory(key)));
            Set<DocumentCategory> documents = EnumSet.noneOf(DocumentCategory.class);
            documentCategories.forEach(key -> documents.add(documentCategory(key)));
            return ExtractionPass.builder(name)
                    .dependsOn(dependsOn)
                    .instructions(instructions)
                    .callTimeout(timeout)
                    .expensive(expensive)
                    .segmentCategories(segments)
                    .allowedFields(new LinkedHashSet<>(allowedFields))
                    .documentCategories(documents)
                    .build();
        }
    }

    private static SegmentCategory segmentCategory(String key) {
        SegmentCategory category = SegmentCategory.fromKey(key);
        if (category == null) throw new IllegalArgumentException("Unknown segment category '" + key + "'");
        return category;
    }

    private static DocumentCategory documentCategory(String key) {
        String normalized = key == null ? "" : key.trim().toUpperCase(Locale.ROOT);
        for (DocumentCategory category : DocumentCategory.values()) {
            if (category.name().equals(normalized)) return category;
        }
        throw new IllegalArgumentException("Unknown document category '" + key + "'");
    }
}
