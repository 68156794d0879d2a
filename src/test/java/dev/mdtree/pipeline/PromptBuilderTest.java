package dev.mdtree.pipeline;

import dev.mdtree.backend.Message;
import dev.mdtree.parser.DecisionTreeParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    @Test
    void extractionPromptQuotesTextAndShowsFormat() {
        List<Message> messages = PromptBuilder.buildExtractionPrompt("Valproic acid is first line.");

        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).role()).isEqualTo("user");
        assertThat(messages.get(0).content())
            .contains("\"Valproic acid is first line.\"")
            .contains("DECISION POINT:")
            .contains("IF 'Yes':")
            .contains("OUTCOME:");
    }

    @Test
    void formatExampleIsItselfParseable() {
        String prompt = PromptBuilder.buildExtractionPrompt("text").get(0).content();
        String example = prompt.substring(prompt.indexOf("DECISION POINT:"));

        var tree = new DecisionTreeParser().parse(example).orElseThrow();

        assertThat(tree.branches()).hasSize(3);
        assertThat(tree.depth()).isEqualTo(2);
    }

    @Test
    void synthesisPromptJoinsPartialsWithSeparator() {
        List<Message> messages = PromptBuilder.buildSynthesisPrompt(List.of("DECISION POINT: a", "DECISION POINT: b"));

        assertThat(messages.get(0).content()).contains("DECISION POINT: a\n---\nDECISION POINT: b");
    }
}
