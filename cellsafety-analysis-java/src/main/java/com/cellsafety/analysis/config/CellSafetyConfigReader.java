package com.cellsafety.analysis.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class CellSafetyConfigReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CellSafetyConfigReader.class);
    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a configuration document.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public CellSafetyConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            CellSafetyConfig config = GSON.fromJson(reader, CellSafetyConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            LOGGER.debug("loaded config from {}", configPath);
            return config;
        } catch (NoSuchFileException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Reads {@code configPath} if it exists, otherwise returns the defaults. */
    public CellSafetyConfig readOrDefaults(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            LOGGER.debug("no config at {}, using defaults", configPath);
            return CellSafetyConfig.defaults();
        }
        return read(configPath);
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
