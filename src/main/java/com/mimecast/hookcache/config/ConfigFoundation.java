package com.mimecast.hookcache.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Loads a JSON5 file into the underlying configuration map.
 * <br>Gson parses leniently so comments, single quotes and unquoted keys are accepted.
 */
@SuppressWarnings("rawtypes")
public class ConfigFoundation extends BasicConfig {

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
        super();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(load(Paths.get(path)));
    }

    /**
     * Reads and parses a JSON5 file.
     *
     * @param path File path.
     * @return Map instance, empty if the file holds no object.
     * @throws IOException Unable to read or parse file.
     */
    static Map load(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            return new Gson().fromJson(content, Map.class);
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration file: " + path, e);
        }
    }
}
