package com.eainde.extraction.segment;

/**
 * First and last page (1-based, inclusive) a span of text was found on.
 * Carried through for traceability only.
 */
public record PageSpan(int firstPage, int lastPage) {

    public PageSpan {
        if (firstPage < 1 || lastPage < firstPage) {
            throw new IllegalArgumentException("Invalid page span " + firstPage + "-" + lastPage);
        }
    }

    public boolean isSinglePage() {
        return firstPage == lastPage;
    }

    @Override
    public String toString() {
        return isSinglePage() ? "p." + firstPage : "pp." + firstPage + "-" + lastPage;
    }
}
