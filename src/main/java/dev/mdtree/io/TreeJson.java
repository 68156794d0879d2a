package dev.mdtree.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mdtree.model.TreeNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes decision trees as JSON: a decision is
 * {@code {"question": "...", "branches": {"<condition>": <child>}}} and an outcome is a bare string.
 * An absent tree is written as {@code {}}.
 */
public final class TreeJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private static final String EMPTY_TREE = "{}";

    private TreeJson() {}

    public static String write(TreeNode node) {
        try {
            return MAPPER.writeValueAsString(toJsonNode(node));
        } catch (JsonProcessingException e) {
            // a tree of strings and objects always serializes
            throw new IllegalStateException("Failed to serialize tree", e);
        }
    }

    public static String write(Optional<TreeNode.Decision> root) {
        return root.map(decision -> write((TreeNode) decision)).orElse(EMPTY_TREE);
    }

    public static void write(Optional<TreeNode.Decision> root, Path path) throws IOException {
        Files.writeString(path, write(root) + System.lineSeparator());
    }

    public static JsonNode toJsonNode(TreeNode node) {
        if (node instanceof TreeNode.Outcome outcome) {
            return JsonNodeFactory.instance.textNode(outcome.text());
        }
        TreeNode.Decision decision = (TreeNode.Decision) node;
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("question", decision.question());
        ObjectNode branches = json.putObject("branches");
        decision.branches().forEach((condition, child) -> branches.set(condition, toJsonNode(child)));
        return json;
    }

    /**
     * Read a tree from JSON text.
     *
     * @return the root decision, or empty for {@code {}}
     * @throws IOException              if the text is not valid JSON
     * @throws IllegalArgumentException if the JSON is not a decision tree
     */
    public static Optional<TreeNode.Decision> read(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || (root.isObject() && root.isEmpty())) {
            return Optional.empty();
        }
        return Optional.of(parseDecision(root, "$"));
    }

    public static Optional<TreeNode.Decision> read(Path path) throws IOException {
        return read(Files.readString(path));
    }

    private static TreeNode.Decision parseDecision(JsonNode node, String location) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected a decision object at " + location);
        }
        JsonNode question = node.get("question");
        if (question == null || !question.isTextual()) {
            throw new IllegalArgumentException("Missing or non-string 'question' at " + location);
        }

        Map<String, TreeNode> branches = new LinkedHashMap<>();
        JsonNode branchesNode = node.get("branches");
        if (branchesNode != null && !branchesNode.isNull()) {
            if (!branchesNode.isObject()) {
                throw new IllegalArgumentException("'branches' must be an object at " + location);
            }
            for (var entry : branchesNode.properties()) {
                String childLocation = location + ".branches['" + entry.getKey() + "']";
                branches.put(entry.getKey(), parseChild(entry.getValue(), childLocation));
            }
        }
        return new TreeNode.Decision(question.asText(), branches);
    }

    private static TreeNode parseChild(JsonNode node, String location) {
        if (node.isTextual()) {
            return new TreeNode.Outcome(node.asText());
        }
        return parseDecision(node, location);
    }
}
