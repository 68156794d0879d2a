package dev.mdtree.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeNodeTest {

    @Test
    void decisionKeepsBranchOrder() {
        var branches = new LinkedHashMap<String, TreeNode>();
        branches.put("Zeta", new TreeNode.Outcome("z"));
        branches.put("Alpha", new TreeNode.Outcome("a"));
        branches.put("Mid", new TreeNode.Outcome("m"));

        var decision = new TreeNode.Decision("q", branches);

        assertThat(decision.branches().keySet()).containsExactly("Zeta", "Alpha", "Mid");
    }

    @Test
    void decisionIsNotAffectedByLaterChangesToSourceMap() {
        var branches = new LinkedHashMap<String, TreeNode>();
        branches.put("Yes", new TreeNode.Outcome("a"));
        var decision = new TreeNode.Decision("q", branches);

        branches.put("No", new TreeNode.Outcome("b"));

        assertThat(decision.branches()).hasSize(1);
        assertThatThrownBy(() -> decision.branches().put("No", new TreeNode.Outcome("b")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void depthCountsDecisionLevels() {
        var leaf = new TreeNode.Decision("q");
        var tree = new TreeNode.Decision("root", Map.of(
            "a", new TreeNode.Outcome("x"),
            "b", new TreeNode.Decision("mid", Map.of("c", new TreeNode.Outcome("y")))));

        assertThat(leaf.depth()).isEqualTo(1);
        assertThat(leaf.isEmpty()).isTrue();
        assertThat(tree.depth()).isEqualTo(2);
    }

    @Test
    void lineTokenRejectsNegativeIndent() {
        assertThatThrownBy(() -> new LineToken(LineKind.BLANK, -1, ""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
