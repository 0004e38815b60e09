package com.mimecast.hookcache.cache;

import com.mimecast.hookcache.model.WebhookId;

/**
 * Thrown by fetch and send capabilities when the platform reports the webhook as unknown.
 *
 * <p>The cache treats it as proof of deletion and evicts the entry.
 */
public class UnknownWebhookException extends Exception {
    private final transient WebhookId webhookId;

    /**
     * Constructs a new UnknownWebhookException.
     *
     * @param webhookId Webhook identity.
     */
    public UnknownWebhookException(WebhookId webhookId) {
        super("Unknown webhook: " + webhookId);
        this.webhookId = webhookId;
    }

    /**
     * Gets the webhook identity.
     *
     * @return WebhookId instance.
     */
    public WebhookId getWebhookId() {
        return webhookId;
    }
}
