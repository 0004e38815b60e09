package com.mimecast.hookcache.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * HookCache configuration.
 *
 * <p>This class provides type safe access to the REST client, fetch coordination and metrics settings.
 *
 * <p>Example <i>hookcache.json5</i>:
 * <pre>
 * {
 *   apiBaseUrl: "https://discord.com/api/v10",
 *   botToken: "/run/secrets/bot-token",
 *   fetchTimeout: 10,
 *   metrics: { enabled: true }
 * }
 * </pre>
 */
public class HookCacheConfig extends ConfigFoundation {
    private static final Logger log = LogManager.getLogger(HookCacheConfig.class);

    /**
     * Constructs a new HookCacheConfig instance with defaults only.
     */
    public HookCacheConfig() {
        super();
    }

    /**
     * Constructs a new HookCacheConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public HookCacheConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new HookCacheConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public HookCacheConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets REST API base URL without trailing slash.
     *
     * @return URL string.
     */
    public String getApiBaseUrl() {
        String url = getStringProperty("apiBaseUrl", "https://discord.com/api/v10");
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Gets bot token.
     * <p>If the configured value is a path to a readable file, the trimmed file content is used.
     *
     * @return Token string, empty if not configured.
     */
    public String getBotToken() {
        return resolveSecret(getStringProperty("botToken", ""));
    }

    /**
     * Gets User-Agent header value.
     *
     * @return User agent string.
     */
    public String getUserAgent() {
        return getStringProperty("userAgent", "DiscordBot (hookcache, 1.0)");
    }

    /**
     * Gets connect timeout in seconds.
     *
     * @return Timeout value.
     */
    public int getConnectTimeout() {
        return Math.toIntExact(getLongProperty("connectTimeout", 30L));
    }

    /**
     * Gets read timeout in seconds.
     *
     * @return Timeout value.
     */
    public int getReadTimeout() {
        return Math.toIntExact(getLongProperty("readTimeout", 30L));
    }

    /**
     * Gets write timeout in seconds.
     *
     * @return Timeout value.
     */
    public int getWriteTimeout() {
        return Math.toIntExact(getLongProperty("writeTimeout", 30L));
    }

    /**
     * Gets how long a caller waits on a coalesced fetch, in seconds.
     * <p>Zero means wait until the fetch completes.
     *
     * @return Timeout value.
     */
    public long getFetchTimeout() {
        long timeout = getLongProperty("fetchTimeout", 0L);
        if (timeout < 0) {
            throw new IllegalArgumentException("fetchTimeout must not be negative: " + timeout);
        }
        return timeout;
    }

    /**
     * Whether Micrometer meters are registered.
     *
     * @return Boolean.
     */
    public boolean isMetricsEnabled() {
        return new BasicConfig(getMapProperty("metrics")).getBooleanProperty("enabled", true);
    }

    /**
     * Resolves a secret value that may be a file path or direct value.
     *
     * @param value Value or file path.
     * @return Resolved secret value.
     */
    private static String resolveSecret(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }

        Path path;
        try {
            path = Paths.get(value);
        } catch (RuntimeException e) {
            return value;
        }

        if (Files.isRegularFile(path) && Files.isReadable(path)) {
            try {
                return Files.readString(path, StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                log.warn("Failed to read secret from file: {}", value, e);
                return value;
            }
        }

        return value;
    }
}
