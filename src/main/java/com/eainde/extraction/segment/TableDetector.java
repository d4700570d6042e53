package com.eainde.extraction.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds table regions: runs of consecutive table-like lines.
 *
 * <p>A line is table-like when it has aligned columns (a gap of two or more
 * spaces between non-blank cells, or a tab), at least two {@code |}
 * separators, or two or more currency amounts. Blank lines end a run.</p>
 */
final class TableDetector {

    private static final Pattern COLUMN_GAP = Pattern.compile("\\S( {2,}|\\t+)\\S");
    private static final Pattern CURRENCY = Pattern.compile("\\$\\s?\\d[\\d,]*(?:\\.\\d{2})?");

    /** Prose lines are longer than this; aligned columns are only trusted on shorter lines. */
    private static final int MAX_ALIGNED_LINE = 200;

    private TableDetector() {
    }

    /**
     * @return table regions as character spans, each starting at a line start and
     *         ending after the newline of its last row, in document order
     */
    static List<TextSpan> detect(String text, int minRows) {
        List<TextSpan> tables = new ArrayList<>();
        int runStart = -1;
        int runEnd = -1;
        int rows = 0;

        int lineStart = 0;
        while (lineStart < text.length()) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? text.length() : newline + 1;
            String line = text.substring(lineStart, newline < 0 ? text.length() : newline);

            if (isTableRow(line)) {
                if (runStart < 0) runStart = lineStart;
                runEnd = lineEnd;
                rows++;
            } else {
                if (rows >= minRows) tables.add(new TextSpan(runStart, runEnd, true));
                runStart = -1;
                rows = 0;
            }
            lineStart = lineEnd;
        }
        if (rows >= minRows) tables.add(new TextSpan(runStart, runEnd, true));
        return tables;
    }

    static boolean isTableRow(String line) {
        if (line.isBlank()) return false;
        if (count(line, '|') >= 2) return true;

        int amounts = 0;
        Matcher currency = CURRENCY.matcher(line);
        while (currency.find()) amounts++;
        if (amounts >= 2) return true;

        return line.strip().length() <= MAX_ALIGNED_LINE && COLUMN_GAP.matcher(line.strip()).find();
    }

    private static int count(String line, char c) {
        int n = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == c) n++;
        }
        return n;
    }
}
