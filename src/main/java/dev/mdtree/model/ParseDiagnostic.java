package dev.mdtree.model;

/**
 * A non-fatal anomaly observed while parsing. Line numbers are 1-based and refer to
 * the normalized input (leading blank lines removed).
 */
public record ParseDiagnostic(Kind kind, int lineNumber, String detail) {

    public enum Kind {
        /** The input has content but no decision line. */
        NO_DECISION,
        /** A branch line not followed by an outcome or a nested decision. */
        DROPPED_BRANCH,
        /** A condition label repeated under one decision; the later branch replaced the earlier one. */
        DUPLICATE_CONDITION,
        /** A decision or outcome line that no branch line introduced. */
        STRAY_LINE
    }

    @Override
    public String toString() {
        return "line %d: %s %s".formatted(lineNumber, kind, detail);
    }
}
