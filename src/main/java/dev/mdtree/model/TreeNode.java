package dev.mdtree.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node in an extracted decision tree. Exactly one of two forms:
 * a decision point with labelled branches, or a terminal outcome.
 */
public sealed interface TreeNode {

    /**
     * A question with branches keyed by condition label. Branch order is the order
     * in which the branches appeared in the source text.
     */
    record Decision(String question, Map<String, TreeNode> branches) implements TreeNode {

        public Decision {
            Objects.requireNonNull(question, "question");
            branches = branches == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(branches));
        }

        public Decision(String question) {
            this(question, Map.of());
        }

        public boolean isEmpty() {
            return branches.isEmpty();
        }

        /** Number of decision points on the longest path from this node, counting this one. */
        public int depth() {
            int deepest = 0;
            for (TreeNode child : branches.values()) {
                if (child instanceof Decision decision) {
                    deepest = Math.max(deepest, decision.depth());
                }
            }
            return deepest + 1;
        }
    }

    /** A leaf: the recommendation reached by following branches to completion. */
    record Outcome(String text) implements TreeNode {

        public Outcome {
            Objects.requireNonNull(text, "text");
        }
    }
}
