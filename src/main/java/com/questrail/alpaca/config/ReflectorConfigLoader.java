package com.questrail.alpaca.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a {@link ReflectorConfig} from YAML and validates it.
 *
 * <p>Keys are snake_case ({@code listen_address}, {@code discovery_port}).
 * Durations are ISO-8601 ({@code PT30S}) or a number of seconds. Unknown keys
 * are ignored.</p>
 */
public final class ReflectorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ReflectorConfigLoader.class);

    private final ObjectMapper mapper;

    public ReflectorConfigLoader() {
        this.mapper = YAMLMapper.builder()
                .addModule(new JavaTimeModule())
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public ReflectorConfig load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("configuration file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            ReflectorConfig config = load(in);
            log.info("Loaded configuration from {} ({} devices)", path, config.devices().size());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("failed to read configuration file " + path, e);
        }
    }

    public ReflectorConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        ReflectorConfig raw;
        try {
            raw = mapper.readValue(in, ReflectorConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("malformed configuration: " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new ConfigurationException("configuration is empty");
        }
        return raw.validate();
    }

    public ReflectorConfig parse(String yaml) {
        Objects.requireNonNull(yaml, "yaml");
        try {
            ReflectorConfig raw = mapper.readValue(yaml, ReflectorConfig.class);
            if (raw == null) {
                throw new ConfigurationException("configuration is empty");
            }
            return raw.validate();
        } catch (IOException e) {
            throw new ConfigurationException("malformed configuration: " + e.getMessage(), e);
        }
    }
}
