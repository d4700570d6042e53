package com.eainde.extraction.segment;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognizes lease section headings: {@code ARTICLE 5}, {@code Section 12},
 * numbered titles such as {@code 7.2 Rent Escalation}, {@code EXHIBIT B},
 * {@code SCHEDULE 1} and short ALL CAPS lines.
 */
public final class HeadingPatterns {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("^\\s*(?:ARTICLE|Article|SECTION|Section)\\s+[\\dIVXLC]+\\b.*"),
            Pattern.compile("^\\s*\\d+(?:\\.\\d+)+\\.?\\s+[A-Z].*"),
            Pattern.compile("^\\s*(?:EXHIBIT|Exhibit|SCHEDULE|Schedule|ADDENDUM|Addendum)\\s+[\\w-]+.*")
    );

    private static final int MAX_CAPS_HEADING = 80;

    private HeadingPatterns() {
    }

    public static boolean isHeading(String line) {
        if (line == null || line.isBlank()) return false;
        for (Pattern pattern : PATTERNS) {
            if (pattern.matcher(line).matches()) return true;
        }
        return isAllCaps(line.strip());
    }

    /**
     * @return the first non-blank line of {@code text} when it is a heading, otherwise {@code null}
     */
    public static String leadingHeading(String text) {
        if (text == null) return null;
        for (String line : text.split("\\R", 20)) {
            if (line.isBlank()) continue;
            return isHeading(line) ? line.strip() : null;
        }
        return null;
    }

    private static boolean isAllCaps(String line) {
        if (line.length() < 4 || line.length() > MAX_CAPS_HEADING) return false;
        int letters = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isLowerCase(c)) return false;
            if (Character.isLetter(c)) letters++;
        }
        return letters >= 3 && letters * 2 >= line.replace(" ", "").length();
    }
}
