package dev.mdtree.pipeline;

import dev.mdtree.backend.TreeTextGenerator;
import dev.mdtree.config.ExtractionConfig;
import dev.mdtree.model.ParseResult;
import dev.mdtree.model.TreeNode;
import dev.mdtree.parser.DecisionTreeParser;
import dev.mdtree.parser.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chunk, extract, synthesize: splits an article into paragraphs, asks the generator for a
 * partial tree per paragraph, merges the partial trees with one more generator call and
 * parses the result.
 */
public final class ExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private static final List<String> MARKERS = List.of("DECISION POINT", "OUTCOME");

    private final TreeTextGenerator generator;
    private final DecisionTreeParser parser;
    private final ExtractionConfig config;

    public ExtractionPipeline(TreeTextGenerator generator, ExtractionConfig config) {
        this.generator = generator;
        this.config = config;
        this.parser = new DecisionTreeParser(config.parserOptions());
    }

    /**
     * Run the full pipeline over one article.
     *
     * @param fullText the article as plain text
     * @return the partial and merged results; empty if no chunk yielded tree text
     * @throws MalformedInputException if the merged tree nests too deeply
     */
    public PipelineResult run(String fullText) {
        List<String> chunks = TextChunker.chunk(fullText);
        log.info("Extracting from {} chunks with {}", chunks.size(), generator.getName());
        if (chunks.isEmpty()) {
            return PipelineResult.empty();
        }

        List<String> partialTexts = extractPartials(chunks);
        if (partialTexts.isEmpty()) {
            log.info("No decision tree found in any chunk");
            return PipelineResult.empty();
        }

        List<TreeNode.Decision> partialTrees = new ArrayList<>();
        for (String text : partialTexts) {
            try {
                parser.parse(text).ifPresent(partialTrees::add);
            } catch (MalformedInputException e) {
                log.warn("Skipping partial tree: {}", e.getMessage());
            }
        }

        log.info("Synthesizing {} partial trees", partialTexts.size());
        String synthesized = generator.generate(PromptBuilder.buildSynthesisPrompt(partialTexts));
        ParseResult result = parser.parseWithDiagnostics(synthesized);

        return new PipelineResult(partialTexts, partialTrees, Optional.ofNullable(synthesized), result);
    }

    /**
     * Whether a generator response looks like it contains a tree at all.
     */
    public boolean containsTree(String response) {
        if (!config.requireMarkers()) {
            return response != null && !response.isBlank();
        }
        return response != null && MARKERS.stream().anyMatch(response::contains);
    }

    private List<String> extractPartials(List<String> chunks) {
        ExecutorService executor = newExecutor(Math.min(config.workers(), chunks.size()));
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (String chunk : chunks) {
                futures.add(executor.submit(() -> extractChunk(chunk)));
            }

            List<String> partials = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    String response = futures.get(i).get();
                    if (response != null) {
                        partials.add(response);
                    }
                } catch (ExecutionException e) {
                    log.warn("Generator failed on chunk {}: {}", i + 1, e.getCause().getMessage());
                }
            }
            return partials;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while extracting partial trees", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private String extractChunk(String chunk) {
        log.info("Processing chunk ({} chars)", chunk.length());
        String response = generator.generate(PromptBuilder.buildExtractionPrompt(chunk));
        if (!containsTree(response)) {
            log.info("No decision tree found in chunk");
            return null;
        }
        return response;
    }

    private static ExecutorService newExecutor(int size) {
        return Executors.newFixedThreadPool(size, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "mdtree-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }
}
