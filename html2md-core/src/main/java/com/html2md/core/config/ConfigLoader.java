package com.html2md.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads html2md configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code html2md.yaml} into {@link ProjectConfig}.
 * A missing, unreadable or invalid file yields {@link ProjectConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.load(Paths.get("html2md.yaml"));
 *
 * if (config.converter().keepDataUris()) {
 *     // data: image sources are emitted verbatim
 * }
 * }</pre>
 */
public final class ConfigLoader {

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "html2md.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>Never throws: problems are logged and defaults are returned.
     *
     * @param configPath path to {@code html2md.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ProjectConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("No {} at {}, converter and output sections use their defaults", DEFAULT_FILE_NAME, configPath);
            return ProjectConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Cannot read {}, ignoring it and converting with default converter and output settings", configPath);
            return ProjectConfig.defaults();
        }

        ProjectConfig config;
        try {
            config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
        } catch (IOException e) {
            log.error("Invalid html2md configuration in {} ({}), ignoring it and converting with defaults",
                configPath, e.getMessage());
            return ProjectConfig.defaults();
        }

        if (config == null) {
            log.warn("{} has no converter or output section, using defaults", configPath);
            return ProjectConfig.defaults();
        }

        log.info("Loaded {}: converter(keepDataUris={}, maxDepth={}), output(format={}, directory={})",
            configPath,
            config.converter().keepDataUris(),
            config.converter().maxDepth(),
            config.output().format(),
            config.output().directory());
        return config;
    }
}
