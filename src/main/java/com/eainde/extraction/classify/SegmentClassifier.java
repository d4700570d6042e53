package com.eainde.extraction.classify;

import com.eainde.extraction.model.DocumentCategory;
import com.eainde.extraction.segment.HeadingPatterns;
import com.eainde.extraction.segment.Segment;
import com.eainde.extraction.segment.SegmentCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based segment classifier.
 *
 * <h3>Signals</h3>
 * <ul>
 *   <li><b>Keywords</b>: whole-word hits per category; multi-word phrases count double.</li>
 *   <li><b>Heading</b>: keywords found in a leading section heading add {@value #HEADING_WEIGHT} each.</li>
 *   <li><b>Position</b>: the first segment gets {@value #OPENING_PARTIES_BOOST} extra toward
 *       {@link SegmentCategory#PARTIES} when it mentions any party keyword.</li>
 * </ul>
 *
 * <h3>Signature gate</h3>
 * <p>A segment is tagged {@link SegmentCategory#SIGNATURE} only when signature terms make
 * up at least the configured share of all keyword hits and the segment is shorter than
 * {@code exclusionMaxChars}. Only those segments can be excluded. A long segment that
 * is signature-dominated keeps its best substantive category and is always extracted.</p>
 *
 * <p>Decisions depend only on the segment's own text and index, so classifying a
 * classified segment again yields the same decision.</p>
 */
@Slf4j
public class SegmentClassifier {

    static final int HEADING_WEIGHT = 5;
    static final int OPENING_PARTIES_BOOST = 2;
    private static final double UNCLASSIFIED_CONFIDENCE = 0.3;

    private final ClassifierSettings settings;
    private final Map<DocumentCategory, Map<SegmentCategory, List<Keyword>>> keywordsByDocument =
            new EnumMap<>(DocumentCategory.class);
    private final List<Keyword> signatureKeywords;

    public SegmentClassifier(ClassifierSettings settings) {
        this.settings = settings;
        for (DocumentCategory document : DocumentCategory.values()) {
            Map<SegmentCategory, List<Keyword>> compiled = new EnumMap<>(SegmentCategory.class);
            settings.keywords().forEach((category, words) -> compiled.put(category, compile(words)));
            settings.documentKeywords().getOrDefault(document, Map.of()).forEach((category, words) ->
                    compiled.computeIfAbsent(category, c -> new ArrayList<>()).addAll(compile(words)));
            keywordsByDocument.put(document, compiled);
        }
        this.signatureKeywords = compile(settings.signatureKeywords());
    }

    public static SegmentClassifier withDefaults() {
        return new SegmentClassifier(ClassifierSettings.defaults());
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param document declared lease category; {@code null} means {@link DocumentCategory#GENERAL}
     */
    public List<ClassificationDecision> classifyAll(List<Segment> segments, DocumentCategory document) {
        List<ClassificationDecision> decisions = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            decisions.add(classify(segment, document));
        }
        long excluded = decisions.stream().filter(ClassificationDecision::excluded).count();
        log.info("Classified {} segments ({} excluded) for {} lease", segments.size(), excluded, document);
        return decisions;
    }

    public ClassificationDecision classify(Segment segment, DocumentCategory document) {
        if (document == null) document = DocumentCategory.GENERAL;
        String text = segment.ownText();
        String lower = text.toLowerCase(Locale.ROOT);
        String heading = HeadingPatterns.leadingHeading(text);
        String headingLower = heading == null ? null : heading.toLowerCase(Locale.ROOT);

        Map<SegmentCategory, Integer> scores = new LinkedHashMap<>();
        Map<SegmentCategory, List<String>> matches = new LinkedHashMap<>();
        keywordsByDocument.get(document).forEach((category, keywords) -> {
            List<String> matched = new ArrayList<>();
            int score = score(keywords, lower, headingLower, matched);
            if (score > 0) {
                scores.put(category, score);
                matches.put(category, matched);
            }
        });
        if (segment.index() == 0 && scores.containsKey(SegmentCategory.PARTIES)) {
            scores.merge(SegmentCategory.PARTIES, OPENING_PARTIES_BOOST, Integer::sum);
        }

        List<String> signatureMatched = new ArrayList<>();
        int signatureScore = score(signatureKeywords, lower, headingLower, signatureMatched);
        int substantiveTotal = scores.values().stream().mapToInt(Integer::intValue).sum();
        int total = signatureScore + substantiveTotal;
        boolean signatureDominated = signatureScore > 0
                && signatureScore >= settings.signatureDominanceRatio() * total;

        SegmentCategory best = best(scores);
        ClassificationDecision decision;
        if (signatureDominated && text.length() < settings.exclusionMaxChars()) {
            boolean excluded = settings.excludeSignatureSegments();
            decision = new ClassificationDecision(segment.withClassification(SegmentCategory.SIGNATURE), excluded,
                    confidence(signatureScore), signatureMatched,
                    String.format("signature terms %d of %d hits, %d chars%s", signatureScore, total,
                            text.length(), excluded ? ", excluded" : ""));
        } else if (best != null) {
            decision = new ClassificationDecision(segment.withClassification(best), false,
                    confidence(scores.get(best)), matches.get(best),
                    signatureDominated
                            ? String.format("signature terms dominate but %d chars is too long to exclude",
                                    text.length())
                            : "keyword score " + scores.get(best) + (heading != null ? ", heading '" + heading + "'" : ""));
        } else {
            decision = new ClassificationDecision(segment.withClassification(SegmentCategory.UNCLASSIFIED), false,
                    signatureDominated ? confidence(signatureScore) : UNCLASSIFIED_CONFIDENCE,
                    List.of(), signatureDominated
                            ? String.format("signature terms only but %d chars is too long to exclude", text.length())
                            : "no keyword matched");
        }

        log.debug("Segment {} classified as {} (confidence={}, excluded={}): {}",
                segment.id(), decision.category(), decision.confidence(), decision.excluded(), decision.reason());
        return decision;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private static int score(List<Keyword> keywords, String text, String heading, List<String> matched) {
        int score = 0;
        for (Keyword keyword : keywords) {
            int hits = 0;
            Matcher matcher = keyword.pattern().matcher(text);
            while (matcher.find()) hits++;
            if (hits > 0) {
                score += hits * keyword.weight();
                if (!matched.contains(keyword.text())) matched.add(keyword.text());
            }
            if (heading != null && keyword.pattern().matcher(heading).find()) {
                score += HEADING_WEIGHT;
            }
        }
        return score;
    }

    /**
     * Highest score; ties go to the category declared first.
     */
    private static SegmentCategory best(Map<SegmentCategory, Integer> scores) {
        SegmentCategory best = null;
        int bestScore = 0;
        for (SegmentCategory category : SegmentCategory.values()) {
            int score = scores.getOrDefault(category, 0);
            if (score > bestScore) {
                best = category;
                bestScore = score;
            }
        }
        return best;
    }

    private static double confidence(int score) {
        return Math.min(1.0, score / 10.0);
    }

    private static List<Keyword> compile(List<String> words) {
        List<Keyword> keywords = new ArrayList<>(words.size());
        for (String word : words) {
            String normalized = word.trim().toLowerCase(Locale.ROOT);
            if (normalized.isEmpty()) continue;
            Pattern pattern = Pattern.compile("(?<![\\w-])" + Pattern.quote(normalized) + "(?![\\w-])");
            keywords.add(new Keyword(normalized, pattern, normalized.contains(" ") ? 2 : 1));
        }
        return keywords;
    }

    private record Keyword(String text, Pattern pattern, int weight) {}
}
