package com.codemeter.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ProjectConfig} from YAML.
 *
 * <p>A missing, unreadable or malformed file is not an error: a warning is logged and
 * {@link ProjectConfig#defaults()} is returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.load(root.resolve(ConfigLoader.DEFAULT_FILE_NAME));
 * RevisionResult result = engine.run(root, config.revision());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * File name looked up in the scanned root when no configuration file is given.
     */
    public static final String DEFAULT_FILE_NAME = "codemeter.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to the configuration file
     * @return loaded configuration, or defaults if unavailable
     */
    public static ProjectConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ProjectConfig config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ProjectConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ProjectConfig.defaults();
        }
    }

    /**
     * Loads {@value #DEFAULT_FILE_NAME} from a directory. For a file root, the file's parent
     * directory is used.
     *
     * @param root scanned root
     * @return loaded configuration, or defaults if unavailable
     */
    public static ProjectConfig loadFromRoot(Path root) {
        Path directory = Files.isDirectory(root) ? root : root.toAbsolutePath().getParent();
        if (directory == null) {
            return ProjectConfig.defaults();
        }
        return load(directory.resolve(DEFAULT_FILE_NAME));
    }
}
