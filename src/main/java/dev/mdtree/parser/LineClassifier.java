package dev.mdtree.parser;

import dev.mdtree.model.LineKind;
import dev.mdtree.model.LineToken;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies one line of generator output. Stateless; the patterns are compiled once
 * and shared by every parse.
 *
 * <pre>
 * DECISION POINT: Is valproic acid applicable?
 *     IF 'Yes':            (a leading "- " bullet is accepted)
 *         OUTCOME: Prescribe valproic acid.
 * </pre>
 */
public final class LineClassifier {

    private static final Pattern DECISION = Pattern.compile("^\\s*DECISION POINT:(.*)$");
    private static final Pattern BRANCH = Pattern.compile("^\\s*(?:-\\s*)?IF\\s*'(.*)'\\s*:\\s*$");
    private static final Pattern OUTCOME = Pattern.compile("^\\s*OUTCOME:(.*)$");

    private LineClassifier() {}

    public static LineToken classify(String line) {
        if (line == null) {
            return new LineToken(LineKind.BLANK, 0, "");
        }
        int indent = indentOf(line);
        if (line.isBlank()) {
            return new LineToken(LineKind.BLANK, indent, "");
        }

        String payload = payload(DECISION, line);
        if (payload != null) {
            return token(LineKind.DECISION, indent, payload);
        }
        payload = payload(BRANCH, line);
        if (payload != null) {
            return token(LineKind.BRANCH, indent, payload);
        }
        payload = payload(OUTCOME, line);
        if (payload != null) {
            return token(LineKind.OUTCOME, indent, payload);
        }
        return unrecognized(indent);
    }

    /** Number of leading space characters. Tabs are expected to be expanded already. */
    public static int indentOf(String line) {
        int indent = 0;
        while (indent < line.length() && line.charAt(indent) == ' ') {
            indent++;
        }
        return indent;
    }

    private static String payload(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.matches() ? matcher.group(1).strip() : null;
    }

    // A marker with nothing after it cannot be placed in the tree.
    private static LineToken token(LineKind kind, int indent, String payload) {
        return payload.isEmpty() ? unrecognized(indent) : new LineToken(kind, indent, payload);
    }

    private static LineToken unrecognized(int indent) {
        return new LineToken(LineKind.UNRECOGNIZED, indent, "");
    }
}
