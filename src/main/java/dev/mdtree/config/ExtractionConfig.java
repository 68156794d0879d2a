package dev.mdtree.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.mdtree.parser.ParserOptions;

/**
 * Settings for parsing and for the extraction pipeline.
 *
 * @param tabWidth       spaces per tab when measuring indentation
 * @param maxDepth       deepest allowed nesting of decision points
 * @param workers        concurrent generator calls in the pipeline
 * @param requireMarkers discard chunk responses that contain no decision or outcome marker
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionConfig(
    Integer tabWidth,
    Integer maxDepth,
    Integer workers,
    Boolean requireMarkers
) {
    public static final int DEFAULT_WORKERS = 4;
    public static final boolean DEFAULT_REQUIRE_MARKERS = true;

    public ExtractionConfig {
        tabWidth = tabWidth != null ? tabWidth : ParserOptions.DEFAULT_TAB_WIDTH;
        maxDepth = maxDepth != null ? maxDepth : ParserOptions.DEFAULT_MAX_DEPTH;
        workers = workers != null ? workers : DEFAULT_WORKERS;
        requireMarkers = requireMarkers != null ? requireMarkers : DEFAULT_REQUIRE_MARKERS;
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
    }

    public static ExtractionConfig defaults() {
        return new ExtractionConfig(null, null, null, null);
    }

    public ParserOptions parserOptions() {
        return new ParserOptions(tabWidth, maxDepth);
    }

    public ExtractionConfig withTabWidth(int tabWidth) {
        return new ExtractionConfig(tabWidth, maxDepth, workers, requireMarkers);
    }

    public ExtractionConfig withMaxDepth(int maxDepth) {
        return new ExtractionConfig(tabWidth, maxDepth, workers, requireMarkers);
    }
}
