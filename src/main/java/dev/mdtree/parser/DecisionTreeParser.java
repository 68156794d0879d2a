package dev.mdtree.parser;

import dev.mdtree.model.ParseDiagnostic;
import dev.mdtree.model.ParseResult;
import dev.mdtree.model.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts semi-structured generator output into a decision tree.
 *
 * <p>Parsing never fails on content: unrecognized lines are ignored, branches without a usable
 * child are dropped, and input without any decision line yields an empty result. The one hard
 * failure is nesting deeper than {@link ParserOptions#maxDepth()}, reported as
 * {@link MalformedInputException}.
 *
 * <p>Instances hold only immutable options and may be shared between threads.
 */
public final class DecisionTreeParser {

    private static final Logger log = LoggerFactory.getLogger(DecisionTreeParser.class);

    private final ParserOptions options;

    public DecisionTreeParser() {
        this(ParserOptions.defaults());
    }

    public DecisionTreeParser(ParserOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public ParserOptions options() {
        return options;
    }

    /**
     * Parse generator output into its root decision.
     *
     * @param rawText generator output, may be null
     * @return the root decision, or empty if the text contains no decision line
     */
    public Optional<TreeNode.Decision> parse(String rawText) {
        return parseWithDiagnostics(rawText).root();
    }

    /**
     * Parse generator output, keeping the anomalies that were skipped.
     * Lines after the root decision's subtree are ignored.
     */
    public ParseResult parseWithDiagnostics(String rawText) {
        List<String> lines = LineNormalizer.normalize(rawText, options.tabWidth());
        if (lines.isEmpty()) {
            return ParseResult.empty(List.of());
        }

        TreeBuilder builder = new TreeBuilder(lines, options);
        int start = builder.findDecision(0);
        if (start < 0) {
            log.debug("No decision line in {} lines of input", lines.size());
            return ParseResult.empty(List.of(new ParseDiagnostic(
                ParseDiagnostic.Kind.NO_DECISION, 1, "no decision line found")));
        }

        TreeBuilder.Built built = builder.buildNode(start);
        List<ParseDiagnostic> diagnostics = new ArrayList<>(builder.diagnostics());

        if (built.nextIndex() < lines.size()) {
            log.debug("Ignoring {} lines after the root decision", lines.size() - built.nextIndex());
        }
        log.debug("Parsed {} lines into a tree of depth {} with {} diagnostics",
            lines.size(), built.node().depth(), diagnostics.size());

        return new ParseResult(Optional.of(built.node()), diagnostics);
    }
}
