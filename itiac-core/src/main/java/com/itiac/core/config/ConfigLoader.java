package com.itiac.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading impact analysis configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code itiac.yaml} into {@link ImpactConfig} records.
 * If the config file is missing, unparseable or describes an invalid scoring policy, returns
 * {@link ImpactConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ImpactConfig config = ConfigLoader.load(Path.of("itiac.yaml"));
 * ImpactAnalysisEngine engine = new ImpactAnalysisEngine(config.scoringPolicy());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Conventional configuration file name */
    public static final String DEFAULT_FILE_NAME = "itiac.yaml";

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist, can't be parsed or holds inconsistent scoring values, logs
     * the problem and returns {@link ImpactConfig#defaults()}.
     *
     * @param configPath path to {@code itiac.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ImpactConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using default scoring.", configPath);
            return ImpactConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ImpactConfig.defaults();
        }

        ImpactConfig config;
        try {
            log.debug("Loading configuration from: {}", configPath);
            config = YAML_MAPPER.readValue(configPath.toFile(), ImpactConfig.class);
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ImpactConfig.defaults();
        }

        if (config == null) {
            log.warn("Configuration file is empty: {}. Using defaults.", configPath);
            return ImpactConfig.defaults();
        }

        try {
            config.scoringPolicy();
            config.defaultScope();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration in {}: {}. Using defaults.", configPath, e.getMessage());
            return ImpactConfig.defaults();
        }

        log.info("Loaded configuration from: {}", configPath);
        return config;
    }
}
