package com.mimecast.hookcache.events;

/**
 * Platform events relevant to the webhook cache.
 */
public enum WebhookEventType {
    CREATED,
    UPDATED,
    DELETED,
    CHANNEL_DELETED,
    GUILD_DELETED,
    WEBHOOKS_UPDATED
}
