package com.mimecast.hookcache.events;

import com.mimecast.hookcache.cache.FetchException;
import com.mimecast.hookcache.cache.WebhookCache;
import com.mimecast.hookcache.cache.WebhookFetcher;
import com.mimecast.hookcache.model.Webhook;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Applies platform events to a webhook cache.
 *
 * <p>Events for one webhook must be handed over in arrival order.
 * <br>Events for different webhooks may be handled concurrently from any thread.
 *
 * <p>{@link WebhookEventType#WEBHOOKS_UPDATED} only names a channel. With a fetcher, every cached webhook of
 * that channel is refreshed and one that cannot be refreshed is evicted. Without a fetcher the channel's
 * webhooks are evicted and reloaded on next use.
 */
public class WebhookEventHandler {
    private static final Logger log = LogManager.getLogger(WebhookEventHandler.class);

    private final WebhookCache cache;
    private final WebhookFetcher fetcher;

    /**
     * Constructs a new WebhookEventHandler without revalidation.
     *
     * @param cache WebhookCache instance.
     */
    public WebhookEventHandler(WebhookCache cache) {
        this(cache, null);
    }

    /**
     * Constructs a new WebhookEventHandler.
     *
     * @param cache   WebhookCache instance.
     * @param fetcher Fetch capability used to revalidate channels, may be null.
     */
    public WebhookEventHandler(WebhookCache cache, WebhookFetcher fetcher) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.fetcher = fetcher;
    }

    /**
     * Applies one event.
     *
     * @param event WebhookEvent instance.
     */
    public void handle(WebhookEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        log.trace("Handling {}", event);

        switch (event.getType()) {
            case CREATED:
                cache.insert(event.getWebhook());
                break;

            case UPDATED:
                cache.update(event.getWebhookId(), event.getPatch());
                break;

            case DELETED:
                cache.remove(event.getWebhookId());
                break;

            case CHANNEL_DELETED:
                cache.removeChannel(event.getChannelId());
                break;

            case GUILD_DELETED:
                cache.removeGuild(event.getGuildId());
                break;

            case WEBHOOKS_UPDATED:
                revalidateChannel(event.getChannelId());
                break;

            default:
                log.warn("Unsupported event type: {}", event.getType());
        }
    }

    /**
     * Revalidates the cached webhooks of a channel.
     *
     * @param channelId Channel identifier.
     */
    private void revalidateChannel(long channelId) {
        if (fetcher == null) {
            int removed = cache.removeChannel(channelId);
            log.debug("Evicted {} webhooks of channel {} pending reload", removed, channelId);
            return;
        }

        List<Webhook> cached = cache.getByChannel(channelId);
        for (Webhook webhook : cached) {
            try {
                if (cache.refresh(webhook.getId(), fetcher).isEmpty()) {
                    log.debug("Webhook {} of channel {} was deleted", webhook.getId(), channelId);
                }
            } catch (FetchException e) {
                cache.remove(webhook.getId());
                log.warn("Evicted webhook {} of channel {} after failed revalidation: {}",
                        webhook.getId(), channelId, e.getMessage());
            }
        }
    }
}
