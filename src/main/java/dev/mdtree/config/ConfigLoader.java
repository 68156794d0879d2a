package dev.mdtree.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ExtractionConfig} from YAML. An explicit file wins over {@code mdtree.yaml}
 * on the classpath; keys missing from the file keep their defaults.
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CLASSPATH_RESOURCE = "mdtree.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ExtractionConfig load() {
        return load(null);
    }

    public ExtractionConfig load(Path configPath) {
        try {
            if (configPath != null) {
                if (Files.exists(configPath)) {
                    return read(Files.newInputStream(configPath), configPath.toString());
                }
                log.warn("Config file {} not found, trying classpath", configPath);
            }

            InputStream resource = getClass().getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE);
            if (resource != null) {
                return read(resource, "classpath:" + CLASSPATH_RESOURCE);
            }

            log.debug("No {} found, using default configuration", CLASSPATH_RESOURCE);
            return ExtractionConfig.defaults();
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return ExtractionConfig.defaults();
        }
    }

    private ExtractionConfig read(InputStream in, String source) throws IOException {
        try (in) {
            ExtractionConfig config = yamlMapper.readValue(in, ExtractionConfig.class);
            if (config == null) {
                return ExtractionConfig.defaults();
            }
            // Validates tabWidth and maxDepth
            config.parserOptions();
            log.debug("Loaded configuration from {}", source);
            return config;
        }
    }
}
