package dev.mdtree.condition;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing helpers behind {@link ConditionKey}.
 */
final class ConditionKeys {

    private static final Pattern RANGE = Pattern.compile("^(\\d+)\\s*-\\s*(\\d+)$");
    private static final Pattern AT_LEAST = Pattern.compile("^>=\\s*(\\d+)$");
    private static final Pattern BELOW = Pattern.compile("^<\\s*(\\d+)$");

    private ConditionKeys() {}

    static ConditionKey parse(String label) {
        String key = label == null ? "" : label.strip();
        try {
            Matcher m = RANGE.matcher(key);
            if (m.matches()) {
                int lower = Integer.parseInt(m.group(1));
                int upper = Integer.parseInt(m.group(2));
                if (lower <= upper) {
                    return new ConditionKey.Range(lower, upper);
                }
                return new ConditionKey.Label(key);
            }
            m = AT_LEAST.matcher(key);
            if (m.matches()) {
                return new ConditionKey.AtLeast(Integer.parseInt(m.group(1)));
            }
            m = BELOW.matcher(key);
            if (m.matches()) {
                return new ConditionKey.Below(Integer.parseInt(m.group(1)));
            }
        } catch (NumberFormatException e) {
            // digits beyond int range: keep the label as text
            return new ConditionKey.Label(key);
        }
        return new ConditionKey.Label(key);
    }

    static Integer parseInteger(String answer) {
        if (answer == null) {
            return null;
        }
        try {
            return Integer.valueOf(answer.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
