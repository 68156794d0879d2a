package dev.mdtree.parser;

/**
 * Limits and whitespace rules applied while parsing.
 */
public record ParserOptions(
    int tabWidth,
    int maxDepth
) {
    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final int DEFAULT_MAX_DEPTH = 200;

    /** Upper bound for {@code maxDepth}; deeper recursion risks exhausting the thread stack. */
    public static final int MAX_DEPTH_LIMIT = 1000;

    public ParserOptions {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
        }
        if (maxDepth < 1 || maxDepth > MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException(
                "maxDepth must be between 1 and %d: %d".formatted(MAX_DEPTH_LIMIT, maxDepth));
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(DEFAULT_TAB_WIDTH, DEFAULT_MAX_DEPTH);
    }

    public ParserOptions withMaxDepth(int maxDepth) {
        return new ParserOptions(tabWidth, maxDepth);
    }

    public ParserOptions withTabWidth(int tabWidth) {
        return new ParserOptions(tabWidth, maxDepth);
    }
}
