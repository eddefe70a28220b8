package com.diagramforge.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading engine configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code diagramforge.yaml} into {@link EngineConfig}.
 * If the file is missing or invalid, returns {@link EngineConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EngineConfig config = ConfigLoader.load(Paths.get("diagramforge.yaml"));
 * int cap = config.repair().maxIterations();
 * }</pre>
 */
public class ConfigLoader {

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "diagramforge.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link EngineConfig#defaults()}.
     *
     * @param configPath path to {@code diagramforge.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static EngineConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            EngineConfig config = YAML_MAPPER.readValue(configPath.toFile(), EngineConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return EngineConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return EngineConfig.defaults();
        }
    }

    /**
     * Loads {@code diagramforge.yaml} from the given directory, or defaults.
     *
     * @param directory directory expected to contain the file
     * @return loaded configuration or defaults
     */
    public static EngineConfig loadFromDirectory(Path directory) {
        return load(directory.resolve(DEFAULT_FILE_NAME));
    }
}
