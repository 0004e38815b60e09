package com.mimecast.hookcache.execute;

import com.mimecast.hookcache.cache.WebhookCache;
import com.mimecast.hookcache.model.Webhook;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

/**
 * Finds or creates an executable webhook for a channel.
 *
 * <p>Lookup order:
 * <ol>
 *   <li>a cached webhook of the channel carrying a token;</li>
 *   <li>the channel's webhooks as listed by the platform, all of which are cached;</li>
 *   <li>a newly created webhook.</li>
 * </ol>
 * <p>Concurrent resolutions for the same channel share one lookup.
 */
public class ChannelWebhookResolver {
    private static final Logger log = LogManager.getLogger(ChannelWebhookResolver.class);

    private final WebhookCache cache;
    private final ChannelWebhookSource source;
    private final ConcurrentMap<Long, CompletableFuture<Webhook>> inFlight = new ConcurrentHashMap<>();

    /**
     * Constructs a new ChannelWebhookResolver.
     *
     * @param cache  WebhookCache instance.
     * @param source ChannelWebhookSource instance.
     */
    public ChannelWebhookResolver(WebhookCache cache, ChannelWebhookSource source) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * Resolves an executable webhook for a channel.
     *
     * @param channelId Channel identifier.
     * @param name      Name of the webhook to create if the channel has none usable.
     * @return Webhook carrying a token.
     * @throws ExecuteException With reason FETCH if listing or creating failed.
     */
    public Webhook resolve(long channelId, String name) throws ExecuteException {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Webhook name must not be empty");
        }

        Optional<Webhook> cached = cache.findExecutable(channelId);
        if (cached.isPresent()) {
            return cached.get();
        }

        CompletableFuture<Webhook> future = new CompletableFuture<>();
        CompletableFuture<Webhook> existing = inFlight.putIfAbsent(channelId, future);
        if (existing != null) {
            log.debug("Joining in-flight resolution for channel {}", channelId);
            return await(channelId, existing);
        }

        try {
            future.complete(lookup(channelId, name));
        } catch (Exception e) {
            future.completeExceptionally(e);
        } finally {
            inFlight.remove(channelId, future);
        }

        return await(channelId, future);
    }

    /**
     * Lists then creates as needed.
     *
     * @param channelId Channel identifier.
     * @param name      Webhook name.
     * @return Webhook instance.
     * @throws Exception If the platform call failed.
     */
    private Webhook lookup(long channelId, String name) throws Exception {
        Optional<Webhook> cached = cache.findExecutable(channelId);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<Webhook> listed = source.listChannelWebhooks(channelId);
        Webhook usable = null;
        for (Webhook webhook : listed) {
            cache.insert(webhook);
            if (usable == null && webhook.hasToken()) {
                usable = webhook;
            }
        }
        if (usable != null) {
            log.debug("Using existing webhook {} of channel {}", usable.getId(), channelId);
            return usable;
        }

        Webhook created = source.createWebhook(channelId, name);
        if (created == null || !created.hasToken()) {
            throw new IllegalStateException("Created webhook for channel " + channelId + " carries no token");
        }
        cache.insert(created);
        log.info("Created webhook {} in channel {}", created.getId(), channelId);
        return created;
    }

    private Webhook await(long channelId, CompletableFuture<Webhook> future) throws ExecuteException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new ExecuteException(ExecuteException.Reason.FETCH, null,
                    "Failed to resolve a webhook for channel " + channelId + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecuteException(ExecuteException.Reason.FETCH, null,
                    "Interrupted while resolving a webhook for channel " + channelId, e);
        }
    }
}
