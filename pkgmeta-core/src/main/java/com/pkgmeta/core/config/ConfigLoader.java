package com.pkgmeta.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code pkgmeta.yaml} into an {@link ExtractionConfig}.
 *
 * <p>Configuration is optional: a missing, unreadable, empty or malformed file
 * yields {@link ExtractionConfig#defaults()}, so a scan never fails on it.
 */
public final class ConfigLoader {

    /** Configuration file looked up in the scanned directory. */
    public static final String DEFAULT_FILE_NAME = "pkgmeta.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads the configuration of a scanned project.
     *
     * @param projectRoot scanned directory
     * @param configPath configuration file; a relative path resolves against {@code projectRoot}
     * @return configuration, or defaults when the file cannot be used
     */
    public static ExtractionConfig forProject(Path projectRoot, Path configPath) {
        return load(configPath.isAbsolute() ? configPath : projectRoot.resolve(configPath));
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code pkgmeta.yaml}
     * @return configuration, or defaults when the file cannot be used
     */
    public static ExtractionConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("No configuration at {}, using defaults", configPath);
            return ExtractionConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            return fallback(configPath, "not a readable file");
        }

        try {
            ExtractionConfig config = YAML_MAPPER.readValue(configPath.toFile(), ExtractionConfig.class);
            if (config == null) {
                return fallback(configPath, "empty file");
            }
            log.info("Loaded configuration from {}", configPath);
            return config;
        } catch (IOException e) {
            return fallback(configPath, e.getMessage());
        }
    }

    private static ExtractionConfig fallback(Path configPath, String reason) {
        log.warn("Ignoring configuration {} ({}), using defaults", configPath, reason);
        return ExtractionConfig.defaults();
    }
}
