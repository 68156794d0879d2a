package dev.mdtree.pipeline;

import dev.mdtree.backend.Message;

import java.util.List;

/**
 * Builds the prompts sent to the generator: one to extract a partial tree from a chunk,
 * one to merge the partial trees into a single tree.
 */
public final class PromptBuilder {

    static final String PARTIAL_SEPARATOR = "\n---\n";

    private static final String EXAMPLE_TEXT = "For a patient presenting with acute chest pain, the initial"
        + " assessment must prioritize life-threatening conditions. If the pain is crushing and radiates to"
        + " the arm or jaw, suspect Acute Myocardial Infarction (AMI) and begin MONA protocol; however, if the"
        + " patient has a known aspirin allergy, use clopidogrel instead. If the pain is sharp, pleuritic, and"
        + " accompanied by shortness of breath, a Pulmonary Embolism (PE) is a primary concern, and a CT"
        + " angiogram should be ordered. For all other presentations of chest pain, a standard workup with an"
        + " EKG and cardiac enzymes is warranted.";

    private static final String EXAMPLE_TREE = """
        DECISION POINT: What are the characteristics of the patient's acute chest pain?
            IF 'Crushing and radiating to the arm or jaw':
                DECISION POINT: Does the patient have a known aspirin allergy?
                    IF 'Yes':
                        OUTCOME: Use clopidogrel and begin MONA protocol for suspected AMI.
                    IF 'No':
                        OUTCOME: Use aspirin and begin MONA protocol for suspected AMI.
            IF 'Sharp, pleuritic, and with shortness of breath':
                OUTCOME: Order a CT angiogram to investigate for Pulmonary Embolism.
            IF 'Other':
                OUTCOME: Perform a standard workup with an EKG and cardiac enzymes.
        """;

    private PromptBuilder() {}

    /**
     * Build the extraction prompt for one chunk of medical text.
     */
    public static List<Message> buildExtractionPrompt(String medicalText) {
        var sb = new StringBuilder();
        sb.append("You are an expert at extracting medical decision trees from text and formatting them.\n\n");
        sb.append("Here is the medical text:\n\"").append(medicalText).append("\"\n\n");
        sb.append("Follow these steps carefully:\n");
        sb.append("1. Identify all decision points (questions to be asked) and final outcomes (conclusions or actions).\n");
        sb.append("2. Structure this logic into a tree. Indent each branch under its decision point");
        sb.append(" and each outcome or nested decision under its branch.\n\n");
        sb.append(buildFormatBlock());
        sb.append("\nIf the text contains no decision logic, answer with a single line saying so.");
        return List.of(Message.user(sb.toString()));
    }

    /**
     * Build the prompt that merges partial trees extracted from different chunks of one article.
     */
    public static List<Message> buildSynthesisPrompt(List<String> partialTrees) {
        var sb = new StringBuilder();
        sb.append("You are an expert at consolidating multiple partial medical decision trees");
        sb.append(" into a single, comprehensive version.\n\n");
        sb.append("Here are the partial decision trees extracted from different sections of a single medical article:\n");
        sb.append(String.join(PARTIAL_SEPARATOR, partialTrees));
        sb.append("\n\nCombine the logic from these partial trees into one logically correct, de-duplicated");
        sb.append(" master decision tree. Connect related branches and resolve redundancies.\n\n");
        sb.append(buildFormatBlock());
        return List.of(Message.user(sb.toString()));
    }

    private static String buildFormatBlock() {
        var sb = new StringBuilder();
        sb.append("Use exactly this format, one marker per line:\n\n");
        sb.append("Text: \"").append(EXAMPLE_TEXT).append("\"\n");
        sb.append("Output:\n");
        sb.append(EXAMPLE_TREE);
        return sb.toString();
    }
}
