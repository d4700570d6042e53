package com.eainde.extraction.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Greedy paragraph accumulation.
 *
 * <p>Paragraphs (separated by blank lines) are appended to the current segment
 * until it reaches the target size. A paragraph is split only when it alone
 * exceeds the maximum, at the sentence boundary nearest the maximum. When a
 * segment reaches target and the next paragraph is short, that paragraph is
 * pulled in so a trailing clause is not stranded.</p>
 */
final class ParagraphStrategy implements SegmentationStrategy {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\r?\\n[ \\t\\r]*\\n\\s*");

    @Override
    public SegmentationMode mode() {
        return SegmentationMode.PARAGRAPH;
    }

    @Override
    public List<TextSpan> split(String text, SegmentationPolicy policy) {
        List<TextSpan> paragraphs = paragraphs(text);
        List<TextSpan> spans = new ArrayList<>();

        int start = -1;
        int end = -1;
        for (int i = 0; i < paragraphs.size(); i++) {
            TextSpan paragraph = paragraphs.get(i);

            if (paragraph.length() > policy.maxChars()) {
                if (start >= 0) spans.add(new TextSpan(start, end));
                int pos = paragraph.start();
                while (paragraph.end() - pos > policy.maxChars()) {
                    int cut = Boundaries.cutNearMaximum(text, pos, pos + policy.maxChars());
                    spans.add(new TextSpan(pos, cut));
                    pos = cut;
                }
                start = pos;
                end = paragraph.end();
            } else if (start >= 0 && (paragraph.end() - start) > policy.maxChars()) {
                spans.add(new TextSpan(start, end));
                start = paragraph.start();
                end = paragraph.end();
            } else {
                if (start < 0) start = paragraph.start();
                end = paragraph.end();
            }

            if (end - start >= policy.targetChars()) {
                if (i + 1 < paragraphs.size()) {
                    TextSpan next = paragraphs.get(i + 1);
                    if (next.length() < policy.smallParagraphChars() && next.end() - start <= policy.maxChars()) {
                        end = next.end();
                        i++;
                    }
                }
                spans.add(new TextSpan(start, end));
                start = -1;
                end = -1;
            }
        }
        if (start >= 0) spans.add(new TextSpan(start, end));
        return spans;
    }

    /**
     * Paragraph spans including their trailing separator, tiling the text.
     */
    static List<TextSpan> paragraphs(String text) {
        List<TextSpan> paragraphs = new ArrayList<>();
        Matcher matcher = PARAGRAPH_BREAK.matcher(text);
        int start = 0;
        while (matcher.find()) {
            if (matcher.start() > start) {
                paragraphs.add(new TextSpan(start, matcher.end()));
                start = matcher.end();
            }
        }
        if (start < text.length()) paragraphs.add(new TextSpan(start, text.length()));
        return paragraphs;
    }
}
