package com.mimecast.hookcache.events;

import com.mimecast.hookcache.model.Webhook;
import com.mimecast.hookcache.model.WebhookId;
import com.mimecast.hookcache.model.WebhookPatch;

import java.util.Objects;

/**
 * Immutable platform event as delivered by the gateway collaborator.
 *
 * <p>Only the fields relevant to the event's {@link WebhookEventType} are set.
 */
public final class WebhookEvent {
    private final WebhookEventType type;
    private final Webhook webhook;
    private final WebhookId webhookId;
    private final WebhookPatch patch;
    private final long channelId;
    private final long guildId;

    private WebhookEvent(WebhookEventType type, Webhook webhook, WebhookId webhookId, WebhookPatch patch,
                         long channelId, long guildId) {
        this.type = type;
        this.webhook = webhook;
        this.webhookId = webhookId;
        this.patch = patch;
        this.channelId = channelId;
        this.guildId = guildId;
    }

    /**
     * Webhook created.
     *
     * @param webhook Created webhook.
     * @return WebhookEvent instance.
     */
    public static WebhookEvent created(Webhook webhook) {
        Objects.requireNonNull(webhook, "webhook must not be null");
        return new WebhookEvent(WebhookEventType.CREATED, webhook, webhook.getId(), null,
                webhook.getChannelId(), webhook.getGuildId().orElse(0L));
    }

    /**
     * Webhook updated.
     *
     * @param id    Webhook identity.
     * @param patch Changed fields.
     * @return WebhookEvent instance.
     */
    public static WebhookEvent updated(WebhookId id, WebhookPatch patch) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(patch, "patch must not be null");
        return new WebhookEvent(WebhookEventType.UPDATED, null, id, patch, 0L, 0L);
    }

    /**
     * Webhook deleted.
     *
     * @param id Webhook identity.
     * @return WebhookEvent instance.
     */
    public static WebhookEvent deleted(WebhookId id) {
        Objects.requireNonNull(id, "id must not be null");
        return new WebhookEvent(WebhookEventType.DELETED, null, id, null, 0L, 0L);
    }

    /**
     * Channel deleted, taking its webhooks with it.
     *
     * @param channelId Channel identifier.
     * @return WebhookEvent instance.
     */
    public static WebhookEvent channelDeleted(long channelId) {
        return new WebhookEvent(WebhookEventType.CHANNEL_DELETED, null, null, null, channelId, 0L);
    }

    /**
     * Guild deleted or left, taking its webhooks with it.
     *
     * @param guildId Guild identifier.
     * @return WebhookEvent instance.
     */
    public static WebhookEvent guildDeleted(long guildId) {
        return new WebhookEvent(WebhookEventType.GUILD_DELETED, null, null, null, 0L, guildId);
    }

    /**
     * Something changed about the webhooks of a channel.
     * <p>The platform does not say what, cached webhooks of the channel must be revalidated.
     *
     * @param channelId Channel identifier.
     * @return WebhookEvent instance.
     */
    public static WebhookEvent webhooksUpdated(long channelId) {
        return new WebhookEvent(WebhookEventType.WEBHOOKS_UPDATED, null, null, null, channelId, 0L);
    }

    public WebhookEventType getType() {
        return type;
    }

    /**
     * Gets created webhook.
     *
     * @return Webhook for {@link WebhookEventType#CREATED}, null otherwise.
     */
    public Webhook getWebhook() {
        return webhook;
    }

    /**
     * Gets webhook identity.
     *
     * @return WebhookId for webhook events, null for channel and guild events.
     */
    public WebhookId getWebhookId() {
        return webhookId;
    }

    /**
     * Gets update patch.
     *
     * @return WebhookPatch for {@link WebhookEventType#UPDATED}, null otherwise.
     */
    public WebhookPatch getPatch() {
        return patch;
    }

    public long getChannelId() {
        return channelId;
    }

    public long getGuildId() {
        return guildId;
    }

    @Override
    public String toString() {
        switch (type) {
            case CREATED:
            case UPDATED:
            case DELETED:
                return type + "(" + webhookId + ")";
            case GUILD_DELETED:
                return type + "(guild " + guildId + ")";
            default:
                return type + "(channel " + channelId + ")";
        }
    }
}
