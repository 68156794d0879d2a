package dev.mdtree.model;

/**
 * Classification of a single line of generator output.
 */
public enum LineKind {
    DECISION,
    BRANCH,
    OUTCOME,
    BLANK,
    UNRECOGNIZED;

    /** Decision, branch and outcome lines carry tree structure; the rest is noise. */
    public boolean isStructural() {
        return this == DECISION || this == BRANCH || this == OUTCOME;
    }
}
