package com.eainde.extraction.pipeline;

import com.eainde.extraction.LeaseTexts;
import com.eainde.extraction.adapter.ExtractionCallAdapter;
import com.eainde.extraction.aggregate.AggregationSettings;
import com.eainde.extraction.model.CallStatus;
import com.eainde.extraction.model.DiagnosticKind;
import com.eainde.extraction.model.DocumentCategory;
import com.eainde.extraction.model.ExtractedField;
import com.eainde.extraction.model.ExtractionOutcome;
import com.eainde.extraction.model.ExtractionResult;
import com.eainde.extraction.model.RunDiagnostics;
import com.eainde.extraction.model.SegmentDiagnostic;
import com.eainde.extraction.model.SegmentOutcome;
import com.eainde.extraction.model.SizeTier;
import com.eainde.extraction.orchestrator.CircuitBreakerSettings;
import com.eainde.extraction.orchestrator.OrchestrationSettings;
import com.eainde.extraction.pass.ExtractionPass;
import com.eainde.extraction.pass.PassPlan;
import com.eainde.extraction.segment.SegmentationMode;
import com.eainde.extraction.segment.SegmentationPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionPipelineTest {

    private static final ExtractionPass DIRECT = ExtractionPass.builder("direct").instructions("Extract.").build();
    private static final ExtractionPass RESOLVE = ExtractionPass.builder("resolve")
            .instructions("Resolve.").dependsOn("direct").build();
    private static final ExtractionPass DERIVE = ExtractionPass.builder("derive")
            .instructions("Derive.").dependsOn("direct").expensive(true).build();

    private static final OrchestrationSettings FAST = new OrchestrationSettings(4, 2, Duration.ofMillis(1),
            Duration.ofMillis(2), Duration.ofMinutes(1), 20, CircuitBreakerSettings.DISABLED);

    private static final PipelineSettings SETTINGS = PipelineSettings.defaults()
            .withOrchestration(FAST)
            .withPasses(PassPlan.of(List.of(DIRECT, RESOLVE)));

    private static final String SIGNATURE_BLOCK = "IN WITNESS WHEREOF, the parties have executed this lease.\n\n"
            + "Signed and sealed in the presence of a witness.\n\n"
            + "Notary Public. My commission expires December 31, 2027.\n";

    private final List<String> calledSegments = new CopyOnWriteArrayList<>();

    private final ExtractionCallAdapter echo = (segment, pass, context) -> {
        calledSegments.add(segment.id());
        List<ExtractedField> fields = segment.index() == 0 && pass.name().equals("direct")
                ? List.of(new ExtractedField("tenant", "Acme Corp", "the Tenant, Acme Corp", 0.9, "parties"))
                : List.of();
        return ExtractionResult.ok(segment.id(), pass.name(), fields, Duration.ofMillis(1), false);
    };

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    // =========================================================================
    //  Empty input
    // =========================================================================

    @ParameterizedTest(name = "[{index}] \"{0}\"")
    @ValueSource(strings = {"", "   ", "\n\n\t"})
    @DisplayName("blank document yields an empty extraction without calls")
    void blankDocument(String text) {
        ExtractionOutcome outcome = new ExtractionPipeline(echo, SETTINGS).run(text, DocumentCategory.GENERAL);

        assertThat(outcome.extraction().resolvedFieldCount()).isZero();
        assertThat(outcome.extraction().completenessScore()).isZero();
        assertThat(outcome.extraction().missingExpectedFields()).isEqualTo(AggregationSettings.ESSENTIAL_FIELDS);
        assertThat(outcome.diagnostics().countEvents(DiagnosticKind.EMPTY_DOCUMENT)).isEqualTo(1);
        assertThat(outcome.diagnostics().segments()).isEmpty();
        assertThat(calledSegments).isEmpty();
    }

    // =========================================================================
    //  Failure isolation
    // =========================================================================

    @Nested
    @DisplayName("failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("a segment that always times out fails alone")
        void oneSegmentTimesOut() {
            ExtractionCallAdapter adapter = (segment, pass, context) -> segment.id().equals("S-003")
                    ? ExtractionResult.failure(segment.id(), pass.name(), CallStatus.TIMEOUT, "timed out", true,
                            Duration.ofMillis(1), false)
                    : echo.call(segment, pass, context);

            ExtractionOutcome outcome = new ExtractionPipeline(adapter, SETTINGS)
                    .run(LeaseTexts.lease(40_000), DocumentCategory.OFFICE);

            RunDiagnostics diagnostics = outcome.diagnostics();
            assertThat(diagnostics.sizeTier()).isEqualTo(SizeTier.MEDIUM);
            assertThat(diagnostics.segments()).hasSizeGreaterThanOrEqualTo(4);
            assertThat(diagnostics.countSegments(SegmentOutcome.FAILED)).isEqualTo(1);
            assertThat(diagnostics.segment("S-003").outcome()).isEqualTo(SegmentOutcome.FAILED);
            assertThat(diagnostics.segment("S-003").passStatuses())
                    .containsEntry("direct", CallStatus.TIMEOUT)
                    .containsEntry("resolve", CallStatus.TIMEOUT);
            assertThat(diagnostics.segment("S-003").attempts()).isEqualTo(4);
            assertThat(diagnostics.countEvents(DiagnosticKind.CALL_TIMEOUT)).isPositive();
            assertThat(diagnostics.passesRun()).containsExactly("direct", "resolve");

            int total = diagnostics.segments().size();
            assertThat(diagnostics.countSegments(SegmentOutcome.SUCCEEDED)).isEqualTo(total - 1);
            assertThat(outcome.extraction().field("tenant")).hasValueSatisfying(field ->
                    assertThat(field.value()).isEqualTo("Acme Corp"));
            double expected = 0.5 * (total - 1) / total + 0.5 * 1 / (AggregationSettings.ESSENTIAL_FIELDS.size() + 3.0);
            assertThat(diagnostics.completenessScore())
                    .isEqualTo(outcome.extraction().completenessScore())
                    .isBetween(expected - 1e-9, expected + 1e-9);
        }

        @Test
        @DisplayName("the default circuit breaker keeps a single timing-out segment isolated")
        void oneSegmentTimesOutWithDefaultBreaker() {
            ExtractionCallAdapter adapter = (segment, pass, context) -> segment.id().equals("S-002")
                    ? ExtractionResult.failure(segment.id(), pass.name(), CallStatus.TIMEOUT, "timed out", true,
                            Duration.ofMillis(1), false)
                    : echo.call(segment, pass, context);
            PipelineSettings settings = SETTINGS.withOrchestration(new OrchestrationSettings(4, 3,
                    Duration.ofMillis(1), Duration.ofMillis(4), Duration.ofMinutes(1), 20,
                    CircuitBreakerSettings.DEFAULTS));

            ExtractionOutcome outcome = new ExtractionPipeline(adapter, settings)
                    .run(LeaseTexts.lease(16_000), DocumentCategory.GENERAL);

            RunDiagnostics diagnostics = outcome.diagnostics();
            assertThat(diagnostics.segments()).hasSizeGreaterThanOrEqualTo(3);
            assertThat(diagnostics.countSegments(SegmentOutcome.FAILED)).isEqualTo(1);
            assertThat(diagnostics.segment("S-002").outcome()).isEqualTo(SegmentOutcome.FAILED);
            assertThat(diagnostics.countSegments(SegmentOutcome.SUCCEEDED))
                    .isEqualTo(diagnostics.segments().size() - 1);
            assertThat(diagnostics.countEvents(DiagnosticKind.CIRCUIT_OPEN)).isZero();
        }
    }

    // =========================================================================
    //  Size tiers
    // =========================================================================

    @Nested
    @DisplayName("size tiers")
    class Tiers {

        @Test
        @DisplayName("small documents are segmented layout-aware")
        void smallUsesLayout() {
            ExtractionOutcome outcome = new ExtractionPipeline(echo, SETTINGS)
                    .run(LeaseTexts.lease(3_000), DocumentCategory.GENERAL);

            assertThat(outcome.diagnostics().sizeTier()).isEqualTo(SizeTier.SMALL);
            assertThat(outcome.diagnostics().segmentationMode()).isEqualTo(SegmentationMode.LAYOUT_AWARE);
            assertThat(outcome.diagnostics().segmentationDegraded()).isFalse();
        }

        @Test
        @DisplayName("large documents skip expensive passes")
        void largeSkipsExpensivePasses() {
            PipelineSettings settings = new PipelineSettings(SegmentationPolicy.DEFAULTS, 1_000, 5_000,
                    SETTINGS.classification(), FAST, SETTINGS.aggregation(),
                    PassPlan.of(List.of(DIRECT, DERIVE)));

            ExtractionOutcome outcome = new ExtractionPipeline(echo, SETTINGS)
                    .run(LeaseTexts.lease(8_000), DocumentCategory.GENERAL, settings);

            RunDiagnostics diagnostics = outcome.diagnostics();
            assertThat(diagnostics.sizeTier()).isEqualTo(SizeTier.LARGE);
            assertThat(diagnostics.segmentationMode()).isEqualTo(SegmentationMode.PARAGRAPH);
            assertThat(diagnostics.passesRun()).containsExactly("direct");
            assertThat(diagnostics.skippedPasses()).containsExactly("derive");
            assertThat(diagnostics.countEvents(DiagnosticKind.PASS_SKIPPED)).isEqualTo(1);
        }

        @Test
        @DisplayName("passes not applicable to the lease category are skipped")
        void categoryApplicability() {
            ExtractionPass retailOnly = ExtractionPass.builder("percentage_rent").instructions("Extract.")
                    .documentCategories(EnumSet.of(DocumentCategory.RETAIL)).build();

            ExtractionOutcome outcome = new ExtractionPipeline(echo, SETTINGS.withPasses(
                    PassPlan.of(List.of(DIRECT, retailOnly)))).run(LeaseTexts.lease(3_000), DocumentCategory.OFFICE);

            assertThat(outcome.diagnostics().passesRun()).containsExactly("direct");
            assertThat(outcome.diagnostics().skippedPasses()).containsExactly("percentage_rent");
        }
    }

    // =========================================================================
    //  Classification gate and run context
    // =========================================================================

    @Nested
    @DisplayName("classification gate and run context")
    class GateAndContext {

        @Test
        @DisplayName("a short signature block is excluded and never sent")
        void signatureExcluded() {
            String text = LeaseTexts.lease(3_000) + LeaseTexts.rentTable(5) + "\n" + SIGNATURE_BLOCK;
            PipelineSettings settings = SETTINGS.withSegmentation(SegmentationPolicy.of(2_000, 4_000, 100));

            ExtractionOutcome outcome = new ExtractionPipeline(echo, settings).run(text, DocumentCategory.GENERAL);

            RunDiagnostics diagnostics = outcome.diagnostics();
            List<SegmentDiagnostic> excluded = diagnostics.segments().stream()
                    .filter(s -> s.outcome() == SegmentOutcome.EXCLUDED)
                    .toList();
            assertThat(excluded).hasSize(1);
            assertThat(excluded.get(0).passStatuses()).isEmpty();
            assertThat(calledSegments).doesNotContain(excluded.get(0).segmentId());
            assertThat(diagnostics.countEvents(DiagnosticKind.SEGMENT_EXCLUDED)).isEqualTo(1);
            assertThat(diagnostics.countSegments(SegmentOutcome.SUCCEEDED))
                    .isEqualTo(diagnostics.segments().size() - 1);
        }

        @Test
        @DisplayName("every call sees the run id in the MDC, and the MDC is restored afterwards")
        void runIdInMdc() {
            Set<String> seen = ConcurrentHashMap.newKeySet();
            ExtractionCallAdapter adapter = (segment, pass, context) -> {
                seen.add(String.valueOf(MDC.get(ExtractionPipeline.RUN_ID_MDC_KEY)));
                return echo.call(segment, pass, context);
            };
            MDC.put(ExtractionPipeline.RUN_ID_MDC_KEY, "outer");

            ExtractionOutcome outcome = new ExtractionPipeline(adapter, SETTINGS)
                    .run(LeaseTexts.lease(12_000), DocumentCategory.GENERAL);

            assertThat(seen).containsExactly(outcome.diagnostics().runId());
            assertThat(MDC.get(ExtractionPipeline.RUN_ID_MDC_KEY)).isEqualTo("outer");
        }

        @Test
        @DisplayName("two runs get different ids")
        void distinctRunIds() {
            ExtractionPipeline pipeline = new ExtractionPipeline(echo, SETTINGS);

            String first = pipeline.run("Base rent is $1,000.", DocumentCategory.GENERAL).diagnostics().runId();
            String second = pipeline.run("Base rent is $1,000.", DocumentCategory.GENERAL).diagnostics().runId();

            assertThat(first).isNotEqualTo(second);
            assertThat(MDC.get(ExtractionPipeline.RUN_ID_MDC_KEY)).isNull();
        }
    }

    @Test
    @DisplayName("segment outcome summarizes pass statuses")
    void outcomeOf() {
        assertThat(ExtractionPipeline.outcomeOf(Map.of())).isEqualTo(SegmentOutcome.NOT_ATTEMPTED);
        assertThat(ExtractionPipeline.outcomeOf(Map.of("a", CallStatus.OK, "b", CallStatus.TIMEOUT)))
                .isEqualTo(SegmentOutcome.PARTIAL);
        assertThat(ExtractionPipeline.outcomeOf(Map.of("a", CallStatus.SKIPPED)))
                .isEqualTo(SegmentOutcome.NOT_ATTEMPTED);
        assertThat(ExtractionPipeline.outcomeOf(Map.of("a", CallStatus.MALFORMED)))
                .isEqualTo(SegmentOutcome.FAILED);
    }
}
