package dev.mdtree.condition;

import java.util.Locale;
import java.util.Objects;

/**
 * Interpretation of a branch's condition label. Numeric labels such as {@code "130-139"},
 * {@code ">= 180"} or {@code "< 120"} become comparisons; any other label is matched as text.
 */
public sealed interface ConditionKey {

    /** Inclusive integer range, written {@code "lower-upper"}. */
    record Range(int lower, int upper) implements ConditionKey {
        public Range {
            if (upper < lower) {
                throw new IllegalArgumentException("Empty range: %d-%d".formatted(lower, upper));
            }
        }

        @Override
        public boolean matches(String answer) {
            Integer value = ConditionKeys.parseInteger(answer);
            return value != null && value >= lower && value <= upper;
        }
    }

    /** Written {@code ">= n"}. */
    record AtLeast(int threshold) implements ConditionKey {
        @Override
        public boolean matches(String answer) {
            Integer value = ConditionKeys.parseInteger(answer);
            return value != null && value >= threshold;
        }
    }

    /** Written {@code "< n"}. */
    record Below(int threshold) implements ConditionKey {
        @Override
        public boolean matches(String answer) {
            Integer value = ConditionKeys.parseInteger(answer);
            return value != null && value < threshold;
        }
    }

    /** A free-text label such as {@code "Yes"}; compared ignoring case and surrounding whitespace. */
    record Label(String text) implements ConditionKey {
        public Label {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public boolean matches(String answer) {
            return answer != null
                && text.strip().toLowerCase(Locale.ROOT).equals(answer.strip().toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Whether an answer to the owning question satisfies this condition.
     *
     * @param answer the answer text, may be null
     */
    boolean matches(String answer);

    /**
     * Interpret a condition label. Never throws: labels that do not parse as a numeric
     * condition are returned as {@link Label}.
     */
    static ConditionKey parse(String label) {
        return ConditionKeys.parse(label);
    }
}
