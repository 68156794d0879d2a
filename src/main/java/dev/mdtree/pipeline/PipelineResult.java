package dev.mdtree.pipeline;

import dev.mdtree.model.ParseResult;
import dev.mdtree.model.TreeNode;

import java.util.List;
import java.util.Optional;

/**
 * Everything the pipeline produced for one article.
 *
 * @param partialTexts    generator responses that contained tree markers, in chunk order
 * @param partialTrees    the trees parsed from those responses
 * @param synthesizedText the merged tree text, empty when there was nothing to merge
 * @param result          the parse of the merged tree text
 */
public record PipelineResult(
    List<String> partialTexts,
    List<TreeNode.Decision> partialTrees,
    Optional<String> synthesizedText,
    ParseResult result
) {
    public PipelineResult {
        partialTexts = List.copyOf(partialTexts);
        partialTrees = List.copyOf(partialTrees);
    }

    public static PipelineResult empty() {
        return new PipelineResult(List.of(), List.of(), Optional.empty(), ParseResult.empty(List.of()));
    }

    public Optional<TreeNode.Decision> tree() {
        return result.root();
    }
}
