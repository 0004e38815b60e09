package com.mimecast.hookcache.execute;

import com.mimecast.hookcache.model.WebhookId;

/**
 * Thrown when a webhook could not be executed.
 *
 * <p>{@link #getReason()} tells which step failed. Nothing is retried.
 */
public class ExecuteException extends Exception {

    /**
     * Failure reasons.
     */
    public enum Reason {
        /**
         * Neither the caller nor the cached webhook supplied a token. Not retryable.
         */
        MISSING_TOKEN,

        /**
         * The webhook could not be resolved. Cause is a {@link com.mimecast.hookcache.cache.FetchException}.
         */
        FETCH,

        /**
         * The send capability failed. Cause is the sender's own failure.
         */
        SEND
    }

    private final Reason reason;
    private final transient WebhookId webhookId;

    /**
     * Constructs a new ExecuteException.
     *
     * @param reason    Failure reason.
     * @param webhookId Webhook identity.
     * @param message   Error message.
     * @param cause     Underlying cause, may be null.
     */
    public ExecuteException(Reason reason, WebhookId webhookId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.webhookId = webhookId;
    }

    /**
     * No token available.
     *
     * @param webhookId Webhook identity.
     * @return ExecuteException instance.
     */
    public static ExecuteException missingToken(WebhookId webhookId) {
        return new ExecuteException(Reason.MISSING_TOKEN, webhookId,
                "No token available to execute webhook " + webhookId, null);
    }

    /**
     * Webhook resolution failed.
     *
     * @param webhookId Webhook identity.
     * @param cause     Fetch failure.
     * @return ExecuteException instance.
     */
    public static ExecuteException fetch(WebhookId webhookId, Throwable cause) {
        return new ExecuteException(Reason.FETCH, webhookId,
                "Failed to resolve webhook " + webhookId + ": " + cause.getMessage(), cause);
    }

    /**
     * Send failed.
     *
     * @param webhookId Webhook identity.
     * @param cause     Sender failure.
     * @return ExecuteException instance.
     */
    public static ExecuteException send(WebhookId webhookId, Throwable cause) {
        return new ExecuteException(Reason.SEND, webhookId,
                "Failed to execute webhook " + webhookId + ": " + cause.getMessage(), cause);
    }

    public Reason getReason() {
        return reason;
    }

    public WebhookId getWebhookId() {
        return webhookId;
    }
}
