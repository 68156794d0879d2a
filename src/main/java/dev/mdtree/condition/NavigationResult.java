package dev.mdtree.condition;

import java.util.List;
import java.util.Optional;

/**
 * Where a walk through a decision tree ended.
 *
 * @param outcome    the outcome reached, empty if the walk stopped at a question
 * @param unresolved the question that had no answer or no matching branch, empty if an outcome was reached
 * @param path       the steps taken, in order
 */
public record NavigationResult(Optional<String> outcome, Optional<String> unresolved, List<Step> path) {

    /** One answered question and the condition label of the branch that was followed. */
    public record Step(String question, String answer, String condition) {}

    public NavigationResult {
        path = List.copyOf(path);
    }

    public static NavigationResult reached(String outcome, List<Step> path) {
        return new NavigationResult(Optional.of(outcome), Optional.empty(), path);
    }

    public static NavigationResult stoppedAt(String question, List<Step> path) {
        return new NavigationResult(Optional.empty(), Optional.of(question), path);
    }

    public boolean isComplete() {
        return outcome.isPresent();
    }
}
