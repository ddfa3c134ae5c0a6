package com.example.siteengine;

import com.example.siteengine.config.AppConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link AppConfig} as TOML. Parsing is strict: unknown keys, missing keys
 * and out-of-range values are rejected instead of defaulted.
 */
public class ConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

    private final TomlMapper mapper;

    public ConfigLoader() {
        mapper = TomlMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .build();
    }

    public AppConfig load(Path path) throws IOException {
        LOGGER.debug("Loading site configuration from {}", path);
        String toml;
        try {
            toml = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IOException("failed reading '" + path + "'", ex);
        }

        LOGGER.trace("Parsing configuration TOML");
        try {
            return parse(toml);
        } catch (JsonProcessingException ex) {
            throw new IOException("failed to parse TOML from '" + path + "'", ex);
        }
    }

    public AppConfig parse(String toml) throws JsonProcessingException {
        return mapper.readValue(toml, AppConfig.class);
    }

    public String render(AppConfig config) throws JsonProcessingException {
        return mapper.writeValueAsString(config);
    }
}
