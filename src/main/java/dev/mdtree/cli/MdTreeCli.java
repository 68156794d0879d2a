package dev.mdtree.cli;

import dev.mdtree.condition.NavigationResult;
import dev.mdtree.condition.TreeNavigator;
import dev.mdtree.config.ConfigLoader;
import dev.mdtree.config.ExtractionConfig;
import dev.mdtree.io.TreeJson;
import dev.mdtree.model.ParseDiagnostic;
import dev.mdtree.model.ParseResult;
import dev.mdtree.parser.DecisionTreeParser;
import dev.mdtree.parser.MalformedInputException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point: parse decision-tree text into JSON, or walk the parsed tree with given answers.
 */
@Command(
    name = "mdtree",
    mixinStandardHelpOptions = true,
    version = "mdtree 0.1.0",
    description = "Parse DECISION POINT / IF / OUTCOME text into a JSON decision tree."
)
public class MdTreeCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Input text file (default: standard input)")
    private String input;

    @Option(names = "--output", description = "Write the tree JSON to this file instead of standard output")
    private Path output;

    @Option(names = "--config", description = "YAML configuration file (default: mdtree.yaml on the classpath)")
    private Path configPath;

    @Option(names = "--tab-width", description = "Spaces per tab when measuring indentation")
    private Integer tabWidth;

    @Option(names = "--max-depth", description = "Deepest allowed nesting of decision points")
    private Integer maxDepth;

    @Option(names = "--diagnostics", description = "Print skipped branches and stray lines to standard error")
    private boolean diagnostics;

    @Option(names = "--answer", description = "Answer a question (QUESTION=VALUE) and print the outcome reached")
    private Map<String, String> answers = new LinkedHashMap<>();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ExtractionConfig config = resolveConfig();
        DecisionTreeParser parser = new DecisionTreeParser(config.parserOptions());

        ParseResult result;
        try {
            result = parser.parseWithDiagnostics(readInput());
        } catch (IOException e) {
            err.println("Error: cannot read input: " + e.getMessage());
            return 1;
        } catch (MalformedInputException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (diagnostics) {
            for (ParseDiagnostic diagnostic : result.diagnostics()) {
                err.println(diagnostic);
            }
        }

        if (!answers.isEmpty()) {
            if (result.root().isEmpty()) {
                err.println("Error: no decision tree found in input");
                return 1;
            }
            NavigationResult walk = TreeNavigator.navigate(result.root().get(), answers);
            if (walk.isComplete()) {
                out.println(walk.outcome().get());
                return 0;
            }
            err.println("Stopped at unanswered question: " + walk.unresolved().get());
            return 1;
        }

        try {
            if (output != null) {
                TreeJson.write(result.root(), output);
                out.println("Tree written to " + output);
            } else {
                out.println(TreeJson.write(result.root()));
            }
        } catch (IOException e) {
            err.println("Error: cannot write " + output + ": " + e.getMessage());
            return 1;
        }
        return 0;
    }

    private ExtractionConfig resolveConfig() {
        ExtractionConfig config = new ConfigLoader().load(configPath);
        try {
            if (tabWidth != null) {
                config = config.withTabWidth(tabWidth);
            }
            if (maxDepth != null) {
                config = config.withMaxDepth(maxDepth);
            }
            config.parserOptions();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }
        return config;
    }

    private String readInput() throws IOException {
        if (input == null || "-".equals(input)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        // Decoded leniently like stdin; malformed bytes become U+FFFD
        return new String(Files.readAllBytes(Path.of(input)), StandardCharsets.UTF_8);
    }
}
