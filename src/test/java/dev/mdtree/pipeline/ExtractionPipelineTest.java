package dev.mdtree.pipeline;

import dev.mdtree.backend.Message;
import dev.mdtree.backend.TreeTextGenerator;
import dev.mdtree.config.ExtractionConfig;
import dev.mdtree.model.TreeNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionPipelineTest {

    private static final String ARTICLE = """
        For patients with generalized tonic-clonic seizures, valproic acid is applicable.

        The history of epilepsy treatment spans centuries.

        If the patient has myoclonic seizures, carbamazepine should not be used.
        """;

    private static final String VALPROIC_TREE = """
        DECISION POINT: Is valproic acid applicable?
            IF 'Yes':
                OUTCOME: Prescribe valproic acid.
        """;

    private static final String MYOCLONIC_TREE = """
        DECISION POINT: Does the patient have myoclonic seizures?
            IF 'Yes':
                OUTCOME: Do not use carbamazepine.
        """;

    private static final String MERGED_TREE = """
        Here is the merged tree:
        DECISION POINT: Does the patient have generalized tonic-clonic seizures?
            IF 'Yes':
                OUTCOME: Prescribe valproic acid.
            IF 'No':
                DECISION POINT: Does the patient have myoclonic seizures?
                    IF 'Yes':
                        OUTCOME: Do not use carbamazepine.
        """;

    /** Replays canned responses keyed by a word found in the prompt. */
    private static final class TranscriptGenerator implements TreeTextGenerator {
        private final Queue<String> prompts = new ConcurrentLinkedQueue<>();

        @Override
        public String generate(List<Message> messages) {
            String prompt = messages.get(0).content();
            prompts.add(prompt);
            if (prompt.contains("consolidating")) {
                return MERGED_TREE;
            }
            if (prompt.contains("\"For patients with generalized")) {
                return VALPROIC_TREE;
            }
            if (prompt.contains("\"If the patient has myoclonic")) {
                return MYOCLONIC_TREE;
            }
            if (prompt.contains("\"Boom")) {
                throw new IllegalStateException("model unavailable");
            }
            return "This paragraph contains no decision logic.";
        }

        @Override
        public String getName() {
            return "transcript";
        }
    }

    @Test
    void extractsPartialsAndParsesSynthesizedTree() {
        var generator = new TranscriptGenerator();
        var pipeline = new ExtractionPipeline(generator, ExtractionConfig.defaults());

        PipelineResult result = pipeline.run(ARTICLE);

        assertThat(result.partialTexts()).containsExactly(VALPROIC_TREE, MYOCLONIC_TREE);
        assertThat(result.partialTrees()).extracting(TreeNode.Decision::question)
            .containsExactly("Is valproic acid applicable?", "Does the patient have myoclonic seizures?");
        assertThat(result.synthesizedText()).contains(MERGED_TREE);
        assertThat(result.tree()).hasValueSatisfying(tree -> {
            assertThat(tree.question()).isEqualTo("Does the patient have generalized tonic-clonic seizures?");
            assertThat(tree.branches().get("No")).isEqualTo(new TreeNode.Decision(
                "Does the patient have myoclonic seizures?",
                Map.of("Yes", new TreeNode.Outcome("Do not use carbamazepine."))));
        });
        assertThat(generator.prompts).hasSize(4);
        assertThat(generator.prompts).anySatisfy(p -> assertThat(p)
            .contains(VALPROIC_TREE + PromptBuilder.PARTIAL_SEPARATOR + MYOCLONIC_TREE));
    }

    @Test
    void skipsSynthesisWhenNoChunkHasATree() {
        var generator = new TranscriptGenerator();
        var pipeline = new ExtractionPipeline(generator, ExtractionConfig.defaults());

        PipelineResult result = pipeline.run("Nothing clinical here.\n\nStill nothing.");

        assertThat(result.tree()).isEmpty();
        assertThat(result.synthesizedText()).isEmpty();
        assertThat(generator.prompts).hasSize(2);
    }

    @Test
    void continuesWhenGeneratorFailsOnAChunk() {
        var generator = new TranscriptGenerator();
        var pipeline = new ExtractionPipeline(generator, ExtractionConfig.defaults());

        PipelineResult result = pipeline.run("Boom goes the model.\n\n" + ARTICLE);

        assertThat(result.partialTexts()).containsExactly(VALPROIC_TREE, MYOCLONIC_TREE);
        assertThat(result.tree()).isPresent();
    }

    @Test
    void keepsMarkerlessResponsesWhenMarkersAreNotRequired() {
        var generator = new TranscriptGenerator();
        var config = new ExtractionConfig(null, null, 1, false);
        var pipeline = new ExtractionPipeline(generator, config);

        PipelineResult result = pipeline.run(ARTICLE);

        assertThat(result.partialTexts()).hasSize(3);
        assertThat(result.partialTrees()).hasSize(2);
        assertThat(pipeline.containsTree("   ")).isFalse();
    }

    @Test
    void nullSynthesisResponseYieldsNoTree() {
        var transcript = new TranscriptGenerator();
        TreeTextGenerator generator = new TreeTextGenerator() {
            @Override
            public String generate(List<Message> messages) {
                String response = transcript.generate(messages);
                return MERGED_TREE.equals(response) ? null : response;
            }

            @Override
            public String getName() {
                return "silent-synthesis";
            }
        };

        PipelineResult result = new ExtractionPipeline(generator, ExtractionConfig.defaults()).run(ARTICLE);

        assertThat(result.partialTrees()).hasSize(2);
        assertThat(result.synthesizedText()).isEmpty();
        assertThat(result.tree()).isEmpty();
    }

    @Test
    void emptyArticleMakesNoGeneratorCalls() {
        var generator = new TranscriptGenerator();

        PipelineResult result = new ExtractionPipeline(generator, ExtractionConfig.defaults()).run("  ");

        assertThat(result).isEqualTo(PipelineResult.empty());
        assertThat(generator.prompts).isEmpty();
    }
}
