package com.eainde.extraction.segment;

import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Detects structural boundaries in lease text. A boundary is the offset of a
 * line start where a new unit of layout begins:
 * <ul>
 *   <li>a heading: {@code ARTICLE 5}, {@code Section 12}, {@code 7.2 Rent Escalation},
 *       an ALL CAPS line, {@code EXHIBIT B} or {@code SCHEDULE 1}</li>
 *   <li>the first non-blank line after a run of blank lines</li>
 *   <li>a line whose indentation differs from the previous non-blank line by four or more columns</li>
 *   <li>a page marker</li>
 * </ul>
 */
final class BoundaryDetector {

    private static final int INDENT_CHANGE = 4;

    private BoundaryDetector() {
    }

    static NavigableSet<Integer> detect(String text) {
        NavigableSet<Integer> boundaries = new TreeSet<>();
        boolean previousBlank = false;
        int previousIndent = -1;

        int lineStart = 0;
        while (lineStart < text.length()) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? text.length() : newline + 1;
            String line = text.substring(lineStart, newline < 0 ? text.length() : newline);

            if (line.isBlank()) {
                previousBlank = true;
            } else {
                int indent = indentOf(line);
                boolean indentChanged = previousIndent >= 0 && Math.abs(indent - previousIndent) >= INDENT_CHANGE;
                if (lineStart > 0 && (previousBlank || indentChanged || HeadingPatterns.isHeading(line)
                        || PageIndex.isPageMarker(line))) {
                    boundaries.add(lineStart);
                }
                previousBlank = false;
                previousIndent = indent;
            }
            lineStart = lineEnd;
        }
        return boundaries;
    }

    private static int indentOf(String line) {
        int indent = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') indent++;
            else if (c == '\t') indent += 4;
            else break;
        }
        return indent;
    }
}
