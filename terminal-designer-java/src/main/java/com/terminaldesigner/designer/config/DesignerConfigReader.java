package com.terminaldesigner.designer.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public class DesignerConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes designer.json from the given path, checking the values that have a valid range.
     *
     * @throws ConfigReadException if the file is missing, malformed or out of range
     */
    public DesignerConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        DesignerConfig config;
        try (FileReader reader = new FileReader(configPath.toFile(), StandardCharsets.UTF_8)) {
            config = GSON.fromJson(reader, DesignerConfig.class);
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath, e);
        }
        if (config == null) {
            throw new ConfigReadException("Config file is empty: " + configPath);
        }
        check(config, configPath);
        return config;
    }

    private void check(DesignerConfig config, Path configPath) {
        try {
            config.getVtVersion();
        } catch (IllegalArgumentException e) {
            throw new ConfigReadException(e.getMessage() + " in " + configPath, e);
        }
        if (config.getPoolHistoryLimit() < 1 || config.getSelectionHistoryLimit() < 1) {
            throw new ConfigReadException("History limits must be at least 1 in " + configPath);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
