package dev.mdtree.parser;

import dev.mdtree.model.LineKind;
import dev.mdtree.model.LineToken;
import dev.mdtree.model.ParseDiagnostic;
import dev.mdtree.model.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent builder over normalized lines. Nesting is recovered from indentation
 * alone: a decision owns the structural lines indented deeper than itself, up to the first
 * structural line that is not. Branch lines at the decision's own depth also belong to it,
 * unless its first branch was indented deeper; then such a line is a branch of the parent.
 *
 * <p>Lines are classified lazily as the cursor reaches them. A builder is single-use and
 * not thread-safe; {@link DecisionTreeParser} creates one per parse.
 */
public final class TreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    private final List<String> lines;
    private final LineToken[] tokens;
    private final int maxDepth;
    private final List<ParseDiagnostic> diagnostics = new ArrayList<>();

    /**
     * A built decision and the index of the first line it did not consume.
     */
    public record Built(TreeNode.Decision node, int nextIndex) {}

    public TreeBuilder(List<String> lines, ParserOptions options) {
        this.lines = List.copyOf(lines);
        this.tokens = new LineToken[this.lines.size()];
        this.maxDepth = options.maxDepth();
    }

    public int size() {
        return lines.size();
    }

    public LineToken tokenAt(int index) {
        LineToken token = tokens[index];
        if (token == null) {
            token = LineClassifier.classify(lines.get(index));
            tokens[index] = token;
        }
        return token;
    }

    /**
     * @return index of the first decision line at or after {@code from}, or -1 if there is none
     */
    public int findDecision(int from) {
        for (int i = from; i < lines.size(); i++) {
            if (tokenAt(i).is(LineKind.DECISION)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Build the decision that starts at {@code startIndex} together with everything nested under it.
     *
     * @throws IllegalArgumentException if the line at {@code startIndex} is not a decision line
     * @throws MalformedInputException  if decisions nest deeper than the configured maximum
     */
    public Built buildNode(int startIndex) {
        return buildNode(startIndex, 1);
    }

    public List<ParseDiagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    private Built buildNode(int startIndex, int depth) {
        LineToken head = tokenAt(startIndex);
        if (!head.is(LineKind.DECISION)) {
            throw new IllegalArgumentException(
                "Line %d is not a decision line: %s".formatted(startIndex + 1, head.kind()));
        }
        if (depth > maxDepth) {
            throw new MalformedInputException(startIndex + 1, maxDepth);
        }

        int baseIndent = head.indent();
        int branchIndent = -1;
        Map<String, TreeNode> branches = new LinkedHashMap<>();
        int cursor = startIndex + 1;

        while (cursor < lines.size()) {
            LineToken token = tokenAt(cursor);

            // Blank lines and commentary never end a node
            if (!token.kind().isStructural()) {
                cursor++;
                continue;
            }
            if (endsNode(token, baseIndent, branchIndent)) {
                break;
            }
            if (!token.is(LineKind.BRANCH)) {
                report(ParseDiagnostic.Kind.STRAY_LINE, cursor,
                    "%s line without a preceding branch".formatted(token.kind()));
                cursor++;
                continue;
            }

            if (branchIndent < 0) {
                branchIndent = token.indent();
            }

            int childIndex = nextStructural(cursor + 1);
            LineToken child = childIndex < lines.size() ? tokenAt(childIndex) : null;

            if (child != null && child.indent() > baseIndent && child.is(LineKind.OUTCOME)) {
                attach(branches, token.text(), new TreeNode.Outcome(child.text()), cursor);
                cursor = childIndex + 1;
            } else if (child != null && child.indent() > baseIndent && child.is(LineKind.DECISION)) {
                Built nested = buildNode(childIndex, depth + 1);
                attach(branches, token.text(), nested.node(), cursor);
                cursor = nested.nextIndex();
            } else {
                report(ParseDiagnostic.Kind.DROPPED_BRANCH, cursor,
                    "branch '%s' has no outcome or decision under it".formatted(token.text()));
                cursor++;
            }
        }

        return new Built(new TreeNode.Decision(head.text(), branches), cursor);
    }

    // Branch lines may share their decision's indentation, but only when its branches are laid out that way
    private static boolean endsNode(LineToken token, int baseIndent, int branchIndent) {
        if (token.indent() != baseIndent) {
            return token.indent() < baseIndent;
        }
        return !token.is(LineKind.BRANCH) || branchIndent > baseIndent;
    }

    private int nextStructural(int from) {
        int index = from;
        while (index < lines.size() && !tokenAt(index).kind().isStructural()) {
            index++;
        }
        return index;
    }

    // Later branches replace earlier ones with the same label.
    private void attach(Map<String, TreeNode> branches, String condition, TreeNode child, int branchIndex) {
        if (branches.put(condition, child) != null) {
            report(ParseDiagnostic.Kind.DUPLICATE_CONDITION, branchIndex,
                "condition '%s' repeated; keeping the later branch".formatted(condition));
        }
    }

    private void report(ParseDiagnostic.Kind kind, int index, String detail) {
        var diagnostic = new ParseDiagnostic(kind, index + 1, detail);
        log.debug("Skipped {}", diagnostic);
        diagnostics.add(diagnostic);
    }
}
