package com.diffdash.extractor.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads the optional {@code diffdash.json}. Keys left out keep their defaults;
 * keys that are present must hold non-blank names.
 */
public class ExtractorConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * @throws ConfigReadException if the file cannot be read, is not a JSON object,
     *                             or lists a blank receiver, namespace, trait or path
     */
    public ExtractorConfig read(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigReadException("No diffdash config at " + configPath);
        }

        String json;
        try {
            json = Files.readString(configPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigReadException("Cannot read diffdash config " + configPath + ": " + e.getMessage(), e);
        }
        if (json.isBlank()) {
            throw new ConfigReadException("diffdash config " + configPath + " is empty; use {} for defaults");
        }

        ExtractorConfig config;
        try {
            config = GSON.fromJson(json, ExtractorConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigReadException("diffdash config " + configPath + " is not a JSON object: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigReadException("diffdash config " + configPath + " is not a JSON object");
        }

        validateNames(configPath, Map.of(
            "metric_receivers", new ArrayList<>(config.getMetricReceivers()),
            "log_namespaces", new ArrayList<>(config.getLogNamespaces()),
            "logging_traits", new ArrayList<>(config.getLoggingTraits()),
            "metric_definition_paths", config.getMetricDefinitionPaths()
        ));
        return config;
    }

    private static void validateNames(Path configPath, Map<String, List<String>> entriesByKey) {
        for (Map.Entry<String, List<String>> entry : entriesByKey.entrySet()) {
            for (String name : entry.getValue()) {
                if (name == null || name.isBlank()) {
                    throw new ConfigReadException("diffdash config " + configPath + ": \""
                        + entry.getKey() + "\" contains a blank entry");
                }
            }
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
