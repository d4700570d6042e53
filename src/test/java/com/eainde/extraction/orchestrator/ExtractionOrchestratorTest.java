package com.eainde.extraction.orchestrator;

import com.eainde.extraction.adapter.ExtractionCallAdapter;
import com.eainde.extraction.aggregate.ResultAggregator;
import com.eainde.extraction.model.CallStatus;
import com.eainde.extraction.model.DiagnosticKind;
import com.eainde.extraction.model.DiagnosticLog;
import com.eainde.extraction.model.ExtractedField;
import com.eainde.extraction.model.ExtractionResult;
import com.eainde.extraction.pass.ExtractionPass;
import com.eainde.extraction.pass.PassPlan;
import com.eainde.extraction.segment.Segment;
import com.eainde.extraction.segment.SegmentCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionOrchestratorTest {

    private static final ExtractionPass DIRECT = ExtractionPass.builder("direct").instructions("Extract.").build();
    private static final ExtractionPass RESOLVE = ExtractionPass.builder("resolve")
            .instructions("Resolve.").dependsOn("direct").build();

    private final DiagnosticLog diagnostics = new DiagnosticLog();

    private static OrchestrationSettings settings(int concurrency, int maxAttempts, Duration budget) {
        return new OrchestrationSettings(concurrency, maxAttempts, Duration.ofMillis(10), Duration.ofMillis(40),
                budget, 20, CircuitBreakerSettings.DISABLED);
    }

    private static List<Segment> segments(int count) {
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String text = "Segment text " + i;
            segments.add(new Segment(Segment.idFor(i), i, text, i * 100, i * 100 + text.length(), 0,
                    i % 2 == 0 ? SegmentCategory.FINANCIAL : SegmentCategory.PARTIES, null, false));
        }
        return segments;
    }

    private static ExtractionResult ok(Segment segment, ExtractionPass pass, ExtractedField... fields) {
        return ExtractionResult.ok(segment.id(), pass.name(), List.of(fields), Duration.ofMillis(1), false);
    }

    private OrchestrationResult run(ExtractionCallAdapter adapter, OrchestrationSettings settings,
                                    List<Segment> segments, PassPlan plan) {
        return new ExtractionOrchestrator(adapter, ResultAggregator.withDefaults(), settings)
                .execute("test", segments, plan, diagnostics);
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // =========================================================================
    //  Concurrency and barrier
    // =========================================================================

    @Nested
    @DisplayName("concurrency and pass barrier")
    class ConcurrencyAndBarrier {

        @Test
        @DisplayName("never more calls in flight than the concurrency limit")
        void boundedConcurrency() {
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger maxInFlight = new AtomicInteger();
            AtomicInteger calls = new AtomicInteger();
            ExtractionCallAdapter probe = (segment, pass, context) -> {
                int now = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(now, Math::max);
                calls.incrementAndGet();
                pause(30);
                inFlight.decrementAndGet();
                return ok(segment, pass);
            };

            OrchestrationResult result = run(probe, settings(3, 1, Duration.ofMinutes(1)), segments(12),
                    PassPlan.of(List.of(DIRECT)));

            assertThat(calls.get()).isEqualTo(12);
            assertThat(maxInFlight.get()).isBetween(1, 3);
            assertThat(result.jobs()).allMatch(job -> job.state() == JobState.SUCCEEDED);
            assertThat(result.passesRun()).containsExactly("direct");
        }

        @Test
        @DisplayName("a pass starts only after every job of the previous pass, and receives its values")
        void barrierAndContext() {
            List<Segment> segments = segments(6);
            AtomicInteger directDone = new AtomicInteger();
            List<Integer> directDoneSeenByResolve = new CopyOnWriteArrayList<>();
            Map<String, Map<String, String>> contexts = new ConcurrentHashMap<>();
            ExtractionCallAdapter adapter = (segment, pass, context) -> {
                if (pass.name().equals("direct")) {
                    pause(20);
                    directDone.incrementAndGet();
                    return segment.index() == 0
                            ? ok(segment, pass, new ExtractedField("tenant", "Acme Corp", "Acme Corp", 0.9, "parties"))
                            : ok(segment, pass);
                }
                directDoneSeenByResolve.add(directDone.get());
                contexts.put(segment.id(), context);
                return ok(segment, pass);
            };

            OrchestrationResult result = run(adapter, settings(4, 1, Duration.ofMinutes(1)), segments,
                    PassPlan.of(List.of(RESOLVE, DIRECT)));

            assertThat(result.passesRun()).containsExactly("direct", "resolve");
            assertThat(directDoneSeenByResolve).hasSize(6).allMatch(seen -> seen == 6);
            assertThat(contexts.values()).allSatisfy(context -> assertThat(context).containsEntry("tenant", "Acme Corp"));
        }

        @Test
        @DisplayName("a pass limited to some categories only gets jobs for those segments")
        void categoryApplicability() {
            ExtractionPass financialOnly = ExtractionPass.builder("calc").instructions("Calculate.")
                    .segmentCategories(EnumSet.of(SegmentCategory.FINANCIAL)).build();
            List<String> called = new CopyOnWriteArrayList<>();

            OrchestrationResult result = run((segment, pass, context) -> {
                called.add(segment.id());
                return ok(segment, pass);
            }, settings(2, 1, Duration.ofMinutes(1)), segments(5), PassPlan.of(List.of(financialOnly)));

            assertThat(called).containsExactlyInAnyOrder("S-001", "S-003", "S-005");
            assertThat(result.results()).hasSize(3);
        }
    }

    // =========================================================================
    //  Retry and failure isolation
    // =========================================================================

    @Nested
    @DisplayName("retry and failure isolation")
    class RetryAndIsolation {

        @Test
        @DisplayName("a segment that always times out fails alone after max attempts")
        void failureIsolation() {
            ExtractionCallAdapter adapter = (segment, pass, context) -> segment.id().equals("S-003")
                    ? ExtractionResult.failure(segment.id(), pass.name(), CallStatus.TIMEOUT, "timed out", true,
                            Duration.ofMillis(5), false)
                    : ok(segment, pass);

            OrchestrationResult result = run(adapter, settings(3, 3, Duration.ofMinutes(1)), segments(6),
                    PassPlan.of(List.of(DIRECT)));

            assertThat(result.jobs()).filteredOn(job -> job.state() == JobState.FAILED)
                    .singleElement()
                    .satisfies(job -> {
                        assertThat(job.segment().id()).isEqualTo("S-003");
                        assertThat(job.attempts()).isEqualTo(3);
                        assertThat(job.result().status()).isEqualTo(CallStatus.TIMEOUT);
                        assertThat(job.result().attempts()).isEqualTo(3);
                    });
            assertThat(result.jobs()).filteredOn(job -> job.state() == JobState.SUCCEEDED).hasSize(5);
            assertThat(diagnostics.count(DiagnosticKind.CALL_TIMEOUT)).isEqualTo(3);
        }

        @Test
        @DisplayName("with the default circuit breaker one stuck segment does not block later passes of its siblings")
        void isolationWithDefaultBreaker() {
            ExtractionPass first = ExtractionPass.builder("first").instructions("Extract.").build();
            ExtractionPass second = ExtractionPass.builder("second").instructions("Resolve.").dependsOn("first").build();
            ExtractionPass third = ExtractionPass.builder("third").instructions("Derive.").dependsOn("second").build();
            ExtractionCallAdapter adapter = (segment, pass, context) -> segment.id().equals("S-002")
                    ? ExtractionResult.failure(segment.id(), pass.name(), CallStatus.TIMEOUT, "timed out", true,
                            Duration.ofMillis(1), false)
                    : ok(segment, pass);
            OrchestrationSettings withDefaultBreaker = new OrchestrationSettings(2, 3, Duration.ofMillis(1),
                    Duration.ofMillis(4), Duration.ofMinutes(1), 20, CircuitBreakerSettings.DEFAULTS);

            OrchestrationResult result = run(adapter, withDefaultBreaker, segments(3),
                    PassPlan.of(List.of(first, second, third)));

            assertThat(result.passesRun()).containsExactly("first", "second", "third");
            assertThat(result.jobs()).hasSize(9);
            assertThat(result.jobs()).filteredOn(job -> !job.segment().id().equals("S-002"))
                    .hasSize(6)
                    .allSatisfy(job -> {
                        assertThat(job.state()).isEqualTo(JobState.SUCCEEDED);
                        assertThat(job.attempts()).isEqualTo(1);
                    });
            assertThat(result.jobs()).filteredOn(job -> job.segment().id().equals("S-002"))
                    .hasSize(3)
                    .allSatisfy(job -> {
                        assertThat(job.state()).isEqualTo(JobState.FAILED);
                        assertThat(job.attempts()).isEqualTo(3);
                        assertThat(job.result().status()).isEqualTo(CallStatus.TIMEOUT);
                    });
            assertThat(result.results()).noneMatch(r -> "circuit open".equals(r.failureDetail()));
            assertThat(diagnostics.count(DiagnosticKind.CIRCUIT_OPEN)).isZero();
        }

        @Test
        @DisplayName("a transient error followed by success succeeds on the second attempt")
        void retryThenSucceed() {
            AtomicInteger calls = new AtomicInteger();
            ExtractionCallAdapter adapter = (segment, pass, context) -> calls.incrementAndGet() == 1
                    ? ExtractionResult.failure(segment.id(), pass.name(), CallStatus.SERVICE_ERROR, "503", true,
                            Duration.ZERO, false)
                    : ok(segment, pass);

            OrchestrationResult result = run(adapter, settings(1, 3, Duration.ofMinutes(1)), segments(1),
                    PassPlan.of(List.of(DIRECT)));

            ExtractionJob job = result.jobs().get(0);
            assertThat(job.state()).isEqualTo(JobState.SUCCEEDED);
            assertThat(job.attempts()).isEqualTo(2);
            assertThat(job.result().attempts()).isEqualTo(2);
        }

        @Test
        @DisplayName("permanent errors are not retried")
        void permanentNotRetried() {
            AtomicInteger calls = new AtomicInteger();
            ExtractionCallAdapter adapter = (segment, pass, context) -> {
                calls.incrementAndGet();
                return ExtractionResult.failure(segment.id(), pass.name(), CallStatus.SERVICE_ERROR, "400", false,
                        Duration.ZERO, false);
            };

            OrchestrationResult result = run(adapter, settings(1, 3, Duration.ofMinutes(1)), segments(1),
                    PassPlan.of(List.of(DIRECT)));

            assertThat(calls.get()).isEqualTo(1);
            assertThat(result.jobs().get(0).state()).isEqualTo(JobState.FAILED);
        }

        @Test
        @DisplayName("an adapter that throws fails only its own job")
        void unexpectedException() {
            ExtractionCallAdapter adapter = (segment, pass, context) -> {
                if (segment.index() == 1) throw new IllegalStateException("adapter bug");
                return ok(segment, pass);
            };

            OrchestrationResult result = run(adapter, settings(2, 3, Duration.ofMinutes(1)), segments(3),
                    PassPlan.of(List.of(DIRECT)));

            assertThat(result.results()).extracting(ExtractionResult::status)
                    .containsExactlyInAnyOrder(CallStatus.OK, CallStatus.SERVICE_ERROR, CallStatus.OK);
        }

        @Test
        @DisplayName("the circuit opens after repeated failures and later jobs fail fast")
        void circuitOpens() {
            AtomicInteger calls = new AtomicInteger();
            ExtractionCallAdapter adapter = (segment, pass, context) -> {
                calls.incrementAndGet();
                return ExtractionResult.failure(segment.id(), pass.name(), CallStatus.SERVICE_ERROR, "500", false,
                        Duration.ZERO, false);
            };
            OrchestrationSettings withBreaker = new OrchestrationSettings(1, 1, Duration.ofMillis(10),
                    Duration.ofMillis(40), Duration.ofMinutes(1), 20,
                    new CircuitBreakerSettings(true, 50.0f, 4, 4, Duration.ofMinutes(1), 3));

            OrchestrationResult result = run(adapter, withBreaker, segments(10), PassPlan.of(List.of(DIRECT)));

            assertThat(calls.get()).isEqualTo(4);
            assertThat(result.jobs()).allMatch(job -> job.state() == JobState.FAILED);
            assertThat(result.results()).filteredOn(r -> "circuit open".equals(r.failureDetail())).hasSize(6);
            assertThat(diagnostics.count(DiagnosticKind.CIRCUIT_OPEN)).isEqualTo(6);
        }
    }

    // =========================================================================
    //  Budget and pass skipping
    // =========================================================================

    @Nested
    @DisplayName("budget and pass skipping")
    class BudgetAndSkipping {

        @Test
        @DisplayName("no call starts after the run budget is exhausted")
        void budget() {
            AtomicInteger calls = new AtomicInteger();
            ExtractionPass other = ExtractionPass.builder("other").instructions("Other.").build();
            ExtractionCallAdapter slow = (segment, pass, context) -> {
                calls.incrementAndGet();
                pause(150);
                return ok(segment, pass);
            };

            OrchestrationResult result = run(slow, settings(1, 1, Duration.ofMillis(200)), segments(4),
                    PassPlan.of(List.of(DIRECT, other)));

            assertThat(calls.get()).isLessThan(4);
            assertThat(result.results()).anyMatch(r -> r.status() == CallStatus.SKIPPED && r.attempts() == 0);
            assertThat(result.skippedPasses()).contains("other");
            assertThat(result.results()).filteredOn(r -> r.passName().equals("other"))
                    .hasSize(4)
                    .allMatch(r -> r.status() == CallStatus.SKIPPED);
            assertThat(diagnostics.count(DiagnosticKind.RUN_BUDGET_EXHAUSTED)).isEqualTo(1);
        }

        @Test
        @DisplayName("expensive passes are dropped above the segment threshold")
        void expensivePassSkipped() {
            ExtractionPass expensive = ExtractionPass.builder("derive").instructions("Derive.")
                    .dependsOn("direct").expensive(true).build();
            OrchestrationSettings lowThreshold = new OrchestrationSettings(2, 1, Duration.ofMillis(10),
                    Duration.ofMillis(40), Duration.ofMinutes(1), 2, CircuitBreakerSettings.DISABLED);
            List<String> passesCalled = new CopyOnWriteArrayList<>();

            OrchestrationResult result = run((segment, pass, context) -> {
                passesCalled.add(pass.name());
                return ok(segment, pass);
            }, lowThreshold, segments(3), PassPlan.of(List.of(DIRECT, expensive)));

            assertThat(passesCalled).containsOnly("direct");
            assertThat(result.passesRun()).containsExactly("direct");
            assertThat(result.skippedPasses()).containsExactly("derive");
            assertThat(diagnostics.count(DiagnosticKind.PASS_SKIPPED)).isEqualTo(1);
        }

        @Test
        @DisplayName("no segments means no jobs")
        void noSegments() {
            OrchestrationResult result = run((segment, pass, context) -> ok(segment, pass),
                    settings(2, 1, Duration.ofMinutes(1)), List.of(), PassPlan.of(List.of(DIRECT)));

            assertThat(result.results()).isEmpty();
            assertThat(result.passesRun()).isEmpty();
        }
    }

    @Test
    @DisplayName("backoff doubles and is capped")
    void backoff() {
        OrchestrationSettings settings = new OrchestrationSettings(1, 5, Duration.ofMillis(500),
                Duration.ofSeconds(4), Duration.ofMinutes(5), 20, CircuitBreakerSettings.DISABLED);

        assertThat(settings.backoffBefore(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(settings.backoffBefore(2)).isEqualTo(Duration.ofSeconds(1));
        assertThat(settings.backoffBefore(3)).isEqualTo(Duration.ofSeconds(2));
        assertThat(settings.backoffBefore(5)).isEqualTo(Duration.ofSeconds(4));
    }
}
