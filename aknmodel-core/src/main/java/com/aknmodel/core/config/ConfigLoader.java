package com.aknmodel.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading the model configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code aknmodel.yaml} into a {@link ModelConfig}.
 * If the file is missing or invalid, returns {@link ModelConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ModelConfig config = ConfigLoader.loadFromDirectory(Paths.get("."));
 * Act act = Act.TYPE.newDocument(config);
 * }</pre>
 */
public class ConfigLoader {

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "aknmodel.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads {@value #DEFAULT_FILE_NAME} from a directory.
     *
     * @param directory directory expected to hold the configuration file
     * @return loaded configuration or defaults if unavailable
     * @see #load(Path)
     */
    public static ModelConfig loadFromDirectory(Path directory) {
        return load(directory.resolve(DEFAULT_FILE_NAME));
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs and returns
     * {@link ModelConfig#defaults()}.
     *
     * @param configPath path to {@code aknmodel.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ModelConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ModelConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ModelConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ModelConfig config = YAML_MAPPER.readValue(configPath.toFile(), ModelConfig.class);
            if (config == null) {
                // YAML document with no content, e.g. "---"
                return ModelConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ModelConfig.defaults();
        }
    }
}
