package dev.mdtree.parser;

/**
 * Thrown when decision points nest deeper than the configured limit.
 * This is the only condition that aborts a parse.
 */
public class MalformedInputException extends RuntimeException {

    private final int lineNumber;
    private final int maxDepth;

    public MalformedInputException(int lineNumber, int maxDepth) {
        super("Decision points nest deeper than %d levels at line %d".formatted(maxDepth, lineNumber));
        this.lineNumber = lineNumber;
        this.maxDepth = maxDepth;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
