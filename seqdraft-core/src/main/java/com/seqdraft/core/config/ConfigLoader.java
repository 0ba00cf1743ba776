package com.seqdraft.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading seqdraft configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code seqdraft.yaml} into {@link SeqDraftConfig} records.
 * If the config file is missing, empty or invalid, returns {@link SeqDraftConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SeqDraftConfig config = ConfigLoader.load(Paths.get("seqdraft.yaml"));
 * GeneratorConfig generatorConfig = config.generator().toGeneratorConfig();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "seqdraft.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * <p>Never throws: if the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link SeqDraftConfig#defaults()}.
     *
     * @param configPath path to {@code seqdraft.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static SeqDraftConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return SeqDraftConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return SeqDraftConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            SeqDraftConfig config = YAML_MAPPER.readValue(configPath.toFile(), SeqDraftConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return SeqDraftConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return SeqDraftConfig.defaults();
        }
    }
}
