package dev.mdtree.parser;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw generator output into lines whose indentation can be compared
 * by counting spaces.
 */
public final class LineNormalizer {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|[\\r\\n\\u0085\\u2028\\u2029]");

    private LineNormalizer() {}

    /**
     * Normalize with the default tab width.
     */
    public static List<String> normalize(String raw) {
        return normalize(raw, ParserOptions.DEFAULT_TAB_WIDTH);
    }

    /**
     * Replace non-breaking spaces with spaces, expand every tab to {@code tabWidth} spaces,
     * drop blank lines at both ends and split into lines. Besides CR and LF, the Unicode
     * separators U+0085, U+2028 and U+2029 end a line. Interior lines are kept as they are,
     * including their leading whitespace.
     *
     * @param raw      generator output, may be null
     * @param tabWidth number of spaces a tab stands for
     * @return the lines, empty for null or blank input
     */
    public static List<String> normalize(String raw, int tabWidth) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }

        String text = raw
            .replace('\u00A0', ' ')
            .replace('\u202F', ' ')
            .replace("\t", " ".repeat(tabWidth));

        List<String> lines = Arrays.asList(LINE_BREAK.split(text, -1));
        int first = 0;
        int last = lines.size() - 1;
        while (first <= last && lines.get(first).isBlank()) {
            first++;
        }
        while (last >= first && lines.get(last).isBlank()) {
            last--;
        }
        return List.copyOf(lines.subList(first, last + 1));
    }
}
