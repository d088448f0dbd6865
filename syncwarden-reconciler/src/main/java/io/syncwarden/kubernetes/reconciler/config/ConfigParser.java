/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.ConstructorDetector;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.syncwarden.tag.VisibleForTesting;

/**
 * Reads the YAML configuration of the reconciler process.
 */
public class ConfigParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigParser.class);

    public static final String CONFIG_PATH_VAR_NAME = "SYNCWARDEN_CONFIG";
    public static final Path DEFAULT_CONFIG_PATH = Path.of("/etc/syncwarden/reconciler.yaml");

    private static final ObjectMapper MAPPER = createObjectMapper();

    public ReconcilerConfiguration parseConfiguration(String configuration) {
        try {
            return MAPPER.readValue(configuration, ReconcilerConfiguration.class);
        }
        catch (IOException e) {
            throw new ReconcilerConfigurationException("Couldn't parse configuration", e);
        }
    }

    public ReconcilerConfiguration parseConfiguration(InputStream configuration) {
        try {
            return MAPPER.readValue(configuration, ReconcilerConfiguration.class);
        }
        catch (IOException e) {
            throw new ReconcilerConfigurationException("Couldn't parse configuration", e);
        }
    }

    /**
     * Reads the configuration from the file named by {@value #CONFIG_PATH_VAR_NAME}, or from
     * {@link #DEFAULT_CONFIG_PATH} when that is unset.
     *
     * @param env the environment
     * @return the configuration
     * @throws ReconcilerConfigurationException if the file is missing or invalid
     */
    public ReconcilerConfiguration loadConfiguration(Map<String, String> env) {
        Path path = configPath(env);
        LOGGER.info("Loading reconciler configuration from {}", path);
        try (var in = Files.newInputStream(path)) {
            return parseConfiguration(in);
        }
        catch (NoSuchFileException e) {
            throw new ReconcilerConfigurationException("Configuration file " + path + " does not exist", e);
        }
        catch (IOException e) {
            throw new ReconcilerConfigurationException("Couldn't read configuration file " + path, e);
        }
    }

    @VisibleForTesting
    static Path configPath(Map<String, String> env) {
        String configured = env.get(CONFIG_PATH_VAR_NAME);
        return configured == null || configured.isBlank() ? DEFAULT_CONFIG_PATH : Path.of(configured);
    }

    public String toYaml(ReconcilerConfiguration configuration) {
        try {
            return MAPPER.writeValueAsString(configuration);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode configuration as YAML", e);
        }
    }

    @VisibleForTesting
    static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new ParameterNamesModule())
                .registerModule(new Jdk8Module())
                .registerModule(new SimpleModule().addSerializer(Path.class, new ToStringSerializer()))
                .setConstructorDetector(ConstructorDetector.USE_PROPERTIES_BASED)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .setSerializationInclusion(JsonInclude.Include.NON_DEFAULT);
    }
}
