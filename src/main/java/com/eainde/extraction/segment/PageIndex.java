package com.eainde.extraction.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps character offsets to page numbers.
 *
 * <p>Explicit markers win: {@code --- PAGE n ---} first, then stand-alone
 * {@code Page n} lines. Without markers, form feeds separate pages. A document
 * with neither has no page information and every lookup returns {@code null}.
 * Text before the first marker is attributed to that marker's page.</p>
 */
final class PageIndex {

    private static final Pattern DASHED_MARKER =
            Pattern.compile("(?im)^[ \\t]*-{2,}[ \\t]*PAGE[ \\t]*(\\d{1,6})[ \\t]*-{2,}[ \\t]*$");
    private static final Pattern PLAIN_MARKER =
            Pattern.compile("(?m)^[ \\t]*Page[ \\t]+(\\d{1,6})(?:[ \\t]+of[ \\t]+\\d+)?[ \\t]*$");

    private static final PageIndex NONE = new PageIndex(new int[0], new int[0]);

    private final int[] offsets;
    private final int[] pages;

    private PageIndex(int[] offsets, int[] pages) {
        this.offsets = offsets;
        this.pages = pages;
    }

    static PageIndex of(String text) {
        PageIndex index = fromMarkers(text, DASHED_MARKER);
        if (index.isEmpty()) index = fromMarkers(text, PLAIN_MARKER);
        if (index.isEmpty()) index = fromFormFeeds(text);
        return index;
    }

    static boolean isPageMarker(String line) {
        return DASHED_MARKER.matcher(line).matches() || PLAIN_MARKER.matcher(line).matches();
    }

    boolean isEmpty() {
        return offsets.length == 0;
    }

    int pageCount() {
        return offsets.length;
    }

    /**
     * @return the page the offset lies on, or {@code null} without page information
     */
    Integer pageAt(int offset) {
        if (isEmpty()) return null;
        int found = pages[0];
        for (int i = 0; i < offsets.length && offsets[i] <= offset; i++) {
            found = pages[i];
        }
        return found;
    }

    /**
     * @return pages covered by {@code [start, end)}, or {@code null} without page information
     */
    PageSpan spanOf(int start, int end) {
        Integer first = pageAt(start);
        if (first == null) return null;
        Integer last = pageAt(Math.max(start, end - 1));
        return new PageSpan(first, Math.max(first, last));
    }

    private static PageIndex fromMarkers(String text, Pattern marker) {
        List<int[]> found = new ArrayList<>();
        Matcher matcher = marker.matcher(text);
        while (matcher.find()) {
            int page = Integer.parseInt(matcher.group(1));
            if (page >= 1) found.add(new int[]{matcher.start(), page});
        }
        return build(found);
    }

    private static PageIndex fromFormFeeds(String text) {
        if (text.indexOf('\f') < 0) return NONE;
        List<int[]> found = new ArrayList<>();
        found.add(new int[]{0, 1});
        int page = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\f') found.add(new int[]{i + 1, ++page});
        }
        return build(found);
    }

    private static PageIndex build(List<int[]> found) {
        if (found.isEmpty()) return NONE;
        int[] offsets = new int[found.size()];
        int[] pages = new int[found.size()];
        for (int i = 0; i < found.size(); i++) {
            offsets[i] = found.get(i)[0];
            pages[i] = found.get(i)[1];
        }
        return new PageIndex(offsets, pages);
    }
}
