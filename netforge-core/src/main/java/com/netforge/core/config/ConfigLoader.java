package com.netforge.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading NetForge configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code netforge.yaml} into {@link ExportConfig} records.
 * If the config file is missing or invalid, returns {@link ExportConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ExportConfig config = ConfigLoader.load(Path.of("netforge.yaml"));
 *
 * if (config.flattenOrDefault().isEnabled()) {
 *     // chips are expanded
 * }
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Configuration file looked up when none is given. */
    public static final String DEFAULT_CONFIG_FILE = "netforge.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist, is empty or can't be parsed, logs a warning
     * and returns {@link ExportConfig#defaults()}.
     *
     * @param configPath path to {@code netforge.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ExportConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ExportConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ExportConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ExportConfig config = YAML_MAPPER.readValue(configPath.toFile(), ExportConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ExportConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ExportConfig.defaults();
        }
    }
}
