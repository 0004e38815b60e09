package com.mimecast.hookcache.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration map container.
 *
 * <p>Wraps a raw configuration map as parsed from JSON5 and provides type safe accessors.
 * <p>Numbers parsed by Gson arrive as {@link Double} so numeric getters accept any {@link Number}.
 */
@SuppressWarnings("rawtypes")
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new BasicConfig instance.
     */
    public BasicConfig() {
    }

    /**
     * Constructs a new BasicConfig instance with given map.
     *
     * @param map Configuration map, may be null.
     */
    @SuppressWarnings("unchecked")
    public BasicConfig(Map map) {
        if (map != null) {
            this.map = (Map<String, Object>) map;
        }
    }

    /**
     * Gets configuration map.
     *
     * @return Map of String, Object.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name);
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets string property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets long property.
     *
     * @param name Property name.
     * @return Long or null.
     */
    public Long getLongProperty(String name) {
        return getLongProperty(name, null);
    }

    /**
     * Gets long property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String && !((String) value).isEmpty()) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property " + name + " is not a number: " + value, e);
            }
        }
        return defaultValue;
    }

    /**
     * Gets boolean property.
     *
     * @param name Property name.
     * @return Boolean, false if missing.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets boolean property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = map.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty if missing.
     */
    public Map getMapProperty(String name) {
        Object value = map.get(name);
        return value instanceof Map ? (Map) value : new HashMap<>();
    }

    /**
     * Gets list property.
     *
     * @param name Property name.
     * @return List, empty if missing.
     */
    public List getListProperty(String name) {
        Object value = map.get(name);
        return value instanceof List ? (List) value : new ArrayList<>();
    }
}
