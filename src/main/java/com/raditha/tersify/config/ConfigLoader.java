package com.raditha.tersify.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link TersifyConfig} from YAML files.
 * <p>
 * A missing, unreadable or invalid file is logged and replaced by {@link TersifyConfig#defaults()}.
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "tersify.yml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        /* this is only a utility class */
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to the YAML file
     * @return loaded configuration or defaults if unavailable
     */
    public static TersifyConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return TersifyConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return TersifyConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            TersifyConfig config = YAML_MAPPER.readValue(configPath.toFile(), TersifyConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return TersifyConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                    configPath, e.getMessage());
            return TersifyConfig.defaults();
        }
    }

    /**
     * Loads {@value #DEFAULT_FILE_NAME} from a directory, or defaults if there is none.
     */
    public static TersifyConfig loadFromDirectory(Path directory) {
        return load(directory.resolve(DEFAULT_FILE_NAME));
    }
}
