package com.eainde.extraction.aggregate;

import com.eainde.extraction.model.AggregatedExtraction;
import com.eainde.extraction.model.DocumentCategory;
import com.eainde.extraction.model.ExtractedField;
import com.eainde.extraction.model.ExtractionResult;
import com.eainde.extraction.model.FieldConflict;
import com.eainde.extraction.model.ResolvedField;
import com.eainde.extraction.model.SourceAttribution;
import com.eainde.extraction.pass.ExtractionPass;
import com.eainde.extraction.pass.PassPlan;
import com.eainde.extraction.segment.Segment;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges per-segment, per-pass results into one {@link AggregatedExtraction}.
 *
 * <h3>Merge rules:</h3>
 * <ol>
 *   <li>Only {@code OK} results contribute. Results are sorted by pass order, then
 *       segment order, so the outcome never depends on completion order.</li>
 *   <li>Passes are applied in plan order; a value from a later pass OVERRIDES the
 *       value an earlier pass resolved for the same field.</li>
 *   <li>Within one pass, equal values (after normalization) MERGE into one candidate
 *       carrying every attribution.</li>
 *   <li>Within one pass, differing values are a CONFLICT: all candidates are kept and
 *       the winner is picked by higher confidence, then longer excerpt, then earliest
 *       segment.</li>
 * </ol>
 *
 * <h3>Completeness:</h3>
 * <pre>
 * score = w1 * segmentsSucceeded / segmentsScheduled
 *       + w2 * expectedResolved  / expectedTotal
 * </pre>
 * <p>with {@code w1 + w2} normalized to 1. A category without expected fields drops
 * the second term.</p>
 */
@Slf4j
public class ResultAggregator {

    private static final Comparator<Candidate> TIE_BREAK = Comparator
            .comparingDouble(Candidate::confidence).reversed()
            .thenComparing(Comparator.comparingInt(Candidate::longestExcerpt).reversed())
            .thenComparingInt(Candidate::firstSegmentIndex);

    private final AggregationSettings settings;

    public ResultAggregator(AggregationSettings settings) {
        this.settings = settings;
    }

    public static ResultAggregator withDefaults() {
        return new ResultAggregator(AggregationSettings.defaults());
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param results           results of every job, in any order
     * @param segments          segments of the run, for ordering and attribution
     * @param plan              plan the results were produced under
     * @param category          declared document category
     * @param segmentsSucceeded segments with at least one OK pass
     * @param segmentsScheduled segments that had at least one job
     */
    public AggregatedExtraction aggregate(List<ExtractionResult> results, List<Segment> segments, PassPlan plan,
                                          DocumentCategory category, int segmentsSucceeded, int segmentsScheduled) {
        Resolution resolution = resolve(results, segments, plan);

        Map<String, Map<String, ResolvedField>> byCategory = new TreeMap<>();
        resolution.fields.forEach((name, field) ->
                byCategory.computeIfAbsent(field.category(), c -> new TreeMap<>()).put(name, field));

        List<String> expected = settings.expectedFieldsFor(category);
        List<String> missing = expected.stream().filter(name -> !resolution.fields.containsKey(name)).toList();
        double score = completenessScore(segmentsSucceeded, segmentsScheduled,
                expected.size() - missing.size(), expected.size());

        log.info("Aggregated {} fields in {} categories, {} conflicts, {} missing expected fields, score {}",
                resolution.fields.size(), byCategory.size(), resolution.conflicts.size(), missing.size(),
                String.format("%.2f", score));
        return new AggregatedExtraction(byCategory, resolution.conflicts, missing, score);
    }

    /**
     * Resolved values of the passes {@code pass} depends on, as field name to value.
     */
    public Map<String, String> priorContext(ExtractionPass pass, List<ExtractionResult> results,
                                            List<Segment> segments, PassPlan plan) {
        if (pass.dependsOn().isEmpty() || results.isEmpty()) return Map.of();
        Set<String> dependencies = new HashSet<>(pass.dependsOn());
        List<ExtractionResult> relevant = results.stream()
                .filter(r -> dependencies.contains(r.passName()))
                .toList();
        Map<String, String> context = new TreeMap<>();
        resolve(relevant, segments, plan).fields.forEach((name, field) -> context.put(name, field.value()));
        return context;
    }

    /**
     * Weighted completeness in {@code [0, 1]}.
     */
    public double completenessScore(int segmentsSucceeded, int segmentsScheduled,
                                    int expectedResolved, int expectedTotal) {
        double segmentRate = segmentsScheduled <= 0 ? 0.0 : (double) segmentsSucceeded / segmentsScheduled;
        double score;
        if (expectedTotal <= 0) {
            score = segmentRate;
        } else {
            double fieldRate = (double) expectedResolved / expectedTotal;
            double weights = settings.segmentWeight() + settings.fieldWeight();
            score = (settings.segmentWeight() * segmentRate + settings.fieldWeight() * fieldRate) / weights;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private Resolution resolve(List<ExtractionResult> results, List<Segment> segments, PassPlan plan) {
        Map<String, Segment> segmentsById = new HashMap<>();
        for (Segment segment : segments) segmentsById.put(segment.id(), segment);

        List<ExtractionResult> ordered = results.stream()
                .filter(ExtractionResult::isSuccess)
                .filter(r -> plan.positionOf(r.passName()) >= 0 && segmentsById.containsKey(r.segmentId()))
                .sorted(Comparator.comparingInt((ExtractionResult r) -> plan.positionOf(r.passName()))
                        .thenComparingInt(r -> segmentsById.get(r.segmentId()).index()))
                .toList();

        Map<String, ResolvedField> resolved = new LinkedHashMap<>();
        List<FieldConflict> conflicts = new ArrayList<>();

        int i = 0;
        while (i < ordered.size()) {
            String passName = ordered.get(i).passName();
            Map<String, Map<String, Candidate>> candidatesByField = new TreeMap<>();
            for (; i < ordered.size() && ordered.get(i).passName().equals(passName); i++) {
                ExtractionResult result = ordered.get(i);
                Segment segment = segmentsById.get(result.segmentId());
                for (ExtractedField field : result.fields()) {
                    candidatesByField
                            .computeIfAbsent(field.name(), n -> new LinkedHashMap<>())
                            .computeIfAbsent(ValueNormalizer.normalize(field.value()),
                                    v -> new Candidate(field.value(), field.category(), segment.index()))
                            .add(attribution(field, passName, segment));
                }
            }

            candidatesByField.forEach((name, byValue) -> {
                List<Candidate> candidates = new ArrayList<>(byValue.values());
                candidates.sort(TIE_BREAK);
                Candidate winner = candidates.get(0);
                boolean conflicted = candidates.size() > 1;
                if (conflicted) {
                    conflicts.add(conflictOf(name, passName, candidates));
                    log.debug("Conflict on {} in pass {}: {} candidates, chose '{}'", name, passName,
                            candidates.size(), winner.value);
                }
                ResolvedField previous = resolved.put(name, new ResolvedField(name, winner.value, winner.category,
                        passName, winner.confidence(), winner.attributions, conflicted));
                if (previous != null && !previous.passName().equals(passName)) {
                    log.debug("Pass {} overrides {} for field {}", passName, previous.passName(), name);
                }
            });
        }
        return new Resolution(resolved, conflicts);
    }

    private static FieldConflict conflictOf(String name, String passName, List<Candidate> candidates) {
        Candidate winner = candidates.get(0);
        Candidate runnerUp = candidates.get(1);
        String rule;
        if (Double.compare(winner.confidence(), runnerUp.confidence()) != 0) {
            rule = "higher confidence";
        } else if (winner.longestExcerpt() != runnerUp.longestExcerpt()) {
            rule = "longer excerpt";
        } else {
            rule = "earliest segment";
        }
        List<FieldConflict.Candidate> retained = candidates.stream()
                .map(c -> new FieldConflict.Candidate(c.value, c.confidence(), c.attributions))
                .toList();
        return new FieldConflict(name, passName, winner.value, rule, retained);
    }

    private static SourceAttribution attribution(ExtractedField field, String passName, Segment segment) {
        return new SourceAttribution(segment.id(), passName, field.excerpt(), field.confidence(),
                segment.hasPageHint() ? segment.pageHint().firstPage() : null,
                segment.hasPageHint() ? segment.pageHint().lastPage() : null,
                segment.startOffset(), segment.endOffset());
    }

    /**
     * One distinct value of a field within a pass.
     */
    private static final class Candidate {
        private final String value;
        private final String category;
        private final int firstSegmentIndex;
        private final List<SourceAttribution> attributions = new ArrayList<>();
        private double confidence;
        private int longestExcerpt;

        private Candidate(String value, String category, int firstSegmentIndex) {
            this.value = value;
            this.category = category;
            this.firstSegmentIndex = firstSegmentIndex;
        }

        private void add(SourceAttribution attribution) {
            attributions.add(attribution);
            confidence = Math.max(confidence, attribution.confidence());
            longestExcerpt = Math.max(longestExcerpt, attribution.excerpt().length());
        }

        double confidence() {
            return confidence;
        }

        int longestExcerpt() {
            return longestExcerpt;
        }

        int firstSegmentIndex() {
            return firstSegmentIndex;
        }
    }

    private static final class Resolution {
        private final Map<String, ResolvedField> fields;
        private final List<FieldConflict> conflicts;

        private Resolution(Map<String, ResolvedField> fields, List<FieldConflict> conflicts) {
            this.fields = fields;
            this.conflicts = conflicts;
        }
    }
}
