package com.piscanner.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class AppConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(AppConfigLoader.class);

    private final ObjectMapper mapper;

    public AppConfigLoader() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    AppConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Reads YAML (or JSON, which the YAML parser accepts) into an {@link AppConfig}. A missing file yields
     * the defaults.
     */
    public AppConfig load(Path config) throws IOException {
        if (!Files.exists(config)) {
            log.warn("Config file {} not found, using defaults", config);
            return new AppConfig();
        }
        try {
            AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
            return loaded == null ? new AppConfig() : loaded;
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed configuration file " + config + ": " + e.getOriginalMessage(), e);
        }
    }
}
