package dev.mdtree.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of parsing generator output: the root decision, if any was found,
 * and the anomalies skipped on the way.
 */
public record ParseResult(Optional<TreeNode.Decision> root, List<ParseDiagnostic> diagnostics) {

    public ParseResult {
        root = root == null ? Optional.empty() : root;
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static ParseResult empty(List<ParseDiagnostic> diagnostics) {
        return new ParseResult(Optional.empty(), diagnostics);
    }

    public boolean hasTree() {
        return root.isPresent();
    }

    public List<ParseDiagnostic> diagnostics(ParseDiagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}
