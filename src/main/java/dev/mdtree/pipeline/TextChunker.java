package dev.mdtree.pipeline;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits article text into paragraph chunks small enough to extract from one at a time.
 */
public final class TextChunker {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\r?\\n\\s*\\r?\\n");

    private TextChunker() {}

    /**
     * Split on blank lines, trimming each paragraph and dropping empty ones.
     */
    public static List<String> chunk(String fullText) {
        if (fullText == null || fullText.isBlank()) {
            return List.of();
        }
        return Arrays.stream(PARAGRAPH_BREAK.split(fullText))
            .map(String::strip)
            .filter(p -> !p.isEmpty())
            .toList();
    }
}
