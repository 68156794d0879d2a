package dev.mdtree.model;

import java.util.Objects;

/**
 * A classified line: its kind, its indentation in spaces, and its payload
 * (question, condition label or outcome text; empty for blank and unrecognized lines).
 */
public record LineToken(LineKind kind, int indent, String text) {

    public LineToken {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
    }

    public boolean is(LineKind other) {
        return kind == other;
    }
}
