package com.mimecast.hookcache.cache;

import com.mimecast.hookcache.model.WebhookId;

/**
 * Thrown when a webhook could not be fetched from the platform.
 *
 * <p>The cause is the fetch capability's own failure. A failed fetch leaves the cache unchanged,
 * except that a webhook the platform reports as unknown is evicted.
 */
public class FetchException extends Exception {
    private final transient WebhookId webhookId;

    /**
     * Constructs a new FetchException.
     *
     * @param webhookId Webhook identity.
     * @param message   Error message.
     */
    public FetchException(WebhookId webhookId, String message) {
        super(message);
        this.webhookId = webhookId;
    }

    /**
     * Constructs a new FetchException with cause.
     *
     * @param webhookId Webhook identity.
     * @param message   Error message.
     * @param cause     Underlying cause.
     */
    public FetchException(WebhookId webhookId, String message, Throwable cause) {
        super(message, cause);
        this.webhookId = webhookId;
    }

    /**
     * Constructs a new FetchException wrapping a fetch capability failure.
     *
     * @param webhookId Webhook identity.
     * @param cause     Underlying cause.
     */
    public FetchException(WebhookId webhookId, Throwable cause) {
        this(webhookId, "Failed to fetch webhook " + webhookId + ": " + cause.getMessage(), cause);
    }

    /**
     * Gets the webhook identity.
     *
     * @return WebhookId instance.
     */
    public WebhookId getWebhookId() {
        return webhookId;
    }

    /**
     * Checks if the platform reported the webhook as unknown.
     *
     * @return Boolean.
     */
    public boolean isUnknownWebhook() {
        return getCause() instanceof UnknownWebhookException;
    }
}
