package dev.mdtree.parser;

import dev.mdtree.model.LineKind;
import dev.mdtree.model.LineToken;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LineClassifierTest {

    @Test
    void classifiesDecisionLine() {
        LineToken token = LineClassifier.classify("  DECISION POINT:   Is valproic acid applicable?  ");

        assertThat(token.kind()).isEqualTo(LineKind.DECISION);
        assertThat(token.indent()).isEqualTo(2);
        assertThat(token.text()).isEqualTo("Is valproic acid applicable?");
    }

    @Test
    void classifiesBranchLineWithAndWithoutBullet() {
        LineToken plain = LineClassifier.classify("    IF 'Yes':");
        LineToken bulleted = LineClassifier.classify("    - IF 'No':");

        assertThat(plain.kind()).isEqualTo(LineKind.BRANCH);
        assertThat(plain.text()).isEqualTo("Yes");
        assertThat(plain.indent()).isEqualTo(4);
        assertThat(bulleted.kind()).isEqualTo(LineKind.BRANCH);
        assertThat(bulleted.text()).isEqualTo("No");
    }

    @Test
    void branchLabelMayContainApostrophes() {
        LineToken token = LineClassifier.classify("IF 'Patient's pain is sharp':");

        assertThat(token.kind()).isEqualTo(LineKind.BRANCH);
        assertThat(token.text()).isEqualTo("Patient's pain is sharp");
    }

    @Test
    void classifiesOutcomeLine() {
        LineToken token = LineClassifier.classify("        OUTCOME: Refer to neurologist.");

        assertThat(token.kind()).isEqualTo(LineKind.OUTCOME);
        assertThat(token.indent()).isEqualTo(8);
        assertThat(token.text()).isEqualTo("Refer to neurologist.");
    }

    @Test
    void whitespaceOnlyLineIsBlank() {
        assertThat(LineClassifier.classify("     ").kind()).isEqualTo(LineKind.BLANK);
        assertThat(LineClassifier.classify("").kind()).isEqualTo(LineKind.BLANK);
    }

    @Test
    void branchWithTrailingTextIsUnrecognized() {
        assertThat(LineClassifier.classify("IF 'Yes': then treat").kind()).isEqualTo(LineKind.UNRECOGNIZED);
        assertThat(LineClassifier.classify("IF Yes:").kind()).isEqualTo(LineKind.UNRECOGNIZED);
    }

    @Test
    void markerWithoutPayloadIsUnrecognized() {
        assertThat(LineClassifier.classify("DECISION POINT:").kind()).isEqualTo(LineKind.UNRECOGNIZED);
        assertThat(LineClassifier.classify("OUTCOME:   ").kind()).isEqualTo(LineKind.UNRECOGNIZED);
        assertThat(LineClassifier.classify("IF '  ':").kind()).isEqualTo(LineKind.UNRECOGNIZED);
    }

    @Test
    void commentaryIsUnrecognized() {
        LineToken token = LineClassifier.classify("  Here is the decision tree you asked for:");

        assertThat(token.kind()).isEqualTo(LineKind.UNRECOGNIZED);
        assertThat(token.indent()).isEqualTo(2);
        assertThat(token.text()).isEmpty();
    }

    @Test
    void markersAreCaseSensitive() {
        assertThat(LineClassifier.classify("decision point: q").kind()).isEqualTo(LineKind.UNRECOGNIZED);
        assertThat(LineClassifier.classify("Outcome: x").kind()).isEqualTo(LineKind.UNRECOGNIZED);
    }
}
