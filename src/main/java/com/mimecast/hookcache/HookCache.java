package com.mimecast.hookcache;

import com.mimecast.hookcache.cache.WebhookCache;
import com.mimecast.hookcache.config.HookCacheConfig;
import com.mimecast.hookcache.events.WebhookEvent;
import com.mimecast.hookcache.events.WebhookEventHandler;
import com.mimecast.hookcache.execute.ChannelWebhookResolver;
import com.mimecast.hookcache.execute.WebhookExecutor;
import com.mimecast.hookcache.http.DiscordRestClient;
import com.mimecast.hookcache.metrics.CacheMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Application context wiring a webhook cache to the platform REST API.
 *
 * <p>Instances are constructed and owned by the application. Nothing here is process wide.
 *
 * <p>Example usage:
 * <pre>
 * HookCache hooks = HookCache.load("cfg/hookcache.json5");
 *
 * gateway.onWebhookEvent(hooks::handle);
 * hooks.getExecutor().execute(id, null, WebhookMessage.of("Deployed"));
 * </pre>
 */
public class HookCache {
    private static final Logger log = LogManager.getLogger(HookCache.class);

    private final HookCacheConfig config;
    private final CacheMetrics metrics;
    private final WebhookCache cache;
    private final DiscordRestClient restClient;
    private final WebhookExecutor executor;
    private final WebhookEventHandler eventHandler;
    private final ChannelWebhookResolver channelResolver;

    /**
     * Constructs a new HookCache with a private meter registry.
     *
     * @param config HookCacheConfig instance.
     */
    public HookCache(HookCacheConfig config) {
        this(config, new SimpleMeterRegistry());
    }

    /**
     * Constructs a new HookCache.
     * <p>Meters are registered with the given registry unless disabled in configuration.
     *
     * @param config   HookCacheConfig instance.
     * @param registry MeterRegistry instance.
     */
    public HookCache(HookCacheConfig config, MeterRegistry registry) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(registry, "registry must not be null");

        this.metrics = config.isMetricsEnabled() ? new CacheMetrics(registry) : new CacheMetrics();
        this.cache = new WebhookCache(metrics);
        this.restClient = new DiscordRestClient.Builder()
                .withBaseUrl(config.getApiBaseUrl())
                .withBotToken(config.getBotToken())
                .withUserAgent(config.getUserAgent())
                .withConnectTimeout(config.getConnectTimeout())
                .withReadTimeout(config.getReadTimeout())
                .withWriteTimeout(config.getWriteTimeout())
                .build();
        this.executor = new WebhookExecutor(cache, restClient, restClient, metrics,
                Duration.ofSeconds(config.getFetchTimeout()));
        this.eventHandler = new WebhookEventHandler(cache, restClient);
        this.channelResolver = new ChannelWebhookResolver(cache, restClient);

        log.info("Webhook cache ready against {} (fetch timeout {}s, metrics {})", config.getApiBaseUrl(),
                config.getFetchTimeout(), config.isMetricsEnabled() ? "enabled" : "disabled");
    }

    /**
     * Loads configuration from a JSON5 file and wires a new HookCache.
     *
     * @param path Path to configuration file.
     * @return HookCache instance.
     * @throws IOException Unable to read file.
     */
    public static HookCache load(String path) throws IOException {
        return new HookCache(new HookCacheConfig(path));
    }

    /**
     * Applies a platform event to the cache.
     *
     * @param event WebhookEvent instance.
     */
    public void handle(WebhookEvent event) {
        eventHandler.handle(event);
    }

    public HookCacheConfig getConfig() {
        return config;
    }

    public CacheMetrics getMetrics() {
        return metrics;
    }

    public WebhookCache getCache() {
        return cache;
    }

    public DiscordRestClient getRestClient() {
        return restClient;
    }

    public WebhookExecutor getExecutor() {
        return executor;
    }

    public WebhookEventHandler getEventHandler() {
        return eventHandler;
    }

    public ChannelWebhookResolver getChannelResolver() {
        return channelResolver;
    }
}
