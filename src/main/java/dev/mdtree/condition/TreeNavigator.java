package dev.mdtree.condition;

import dev.mdtree.model.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Walks a decision tree by answering its questions.
 */
public final class TreeNavigator {

    private static final Logger log = LoggerFactory.getLogger(TreeNavigator.class);

    private TreeNavigator() {}

    /**
     * Follow the tree from {@code root}. At each decision the answer function is asked the
     * question; the first branch (in branch order) whose condition matches the answer is taken.
     *
     * @param root    the decision to start from
     * @param answers maps a question to its answer; returning null stops the walk
     * @return the outcome reached, or the question where the walk stopped
     */
    public static NavigationResult navigate(TreeNode.Decision root, Function<String, String> answers) {
        List<NavigationResult.Step> path = new ArrayList<>();
        TreeNode.Decision current = root;

        while (true) {
            String answer = answers.apply(current.question());
            if (answer == null) {
                log.debug("No answer for '{}'", current.question());
                return NavigationResult.stoppedAt(current.question(), path);
            }

            Map.Entry<String, TreeNode> taken = null;
            for (var branch : current.branches().entrySet()) {
                if (ConditionKey.parse(branch.getKey()).matches(answer)) {
                    taken = branch;
                    break;
                }
            }
            if (taken == null) {
                log.debug("Answer '{}' matches no branch of '{}'", answer, current.question());
                return NavigationResult.stoppedAt(current.question(), path);
            }

            path.add(new NavigationResult.Step(current.question(), answer, taken.getKey()));
            TreeNode next = taken.getValue();
            if (next instanceof TreeNode.Outcome outcome) {
                return NavigationResult.reached(outcome.text(), path);
            }
            current = (TreeNode.Decision) next;
        }
    }

    /**
     * Follow the tree using a fixed question-to-answer map.
     */
    public static NavigationResult navigate(TreeNode.Decision root, Map<String, String> answers) {
        return navigate(root, answers::get);
    }
}
