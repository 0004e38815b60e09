package com.mimecast.hookcache.execute;

import com.mimecast.hookcache.model.WebhookId;

/**
 * Send capability.
 *
 * <p>Performs the actual invocation of a webhook, posting one message.
 * <br>Implementations signal a webhook the platform does not know with
 * {@link com.mimecast.hookcache.cache.UnknownWebhookException}.
 */
@FunctionalInterface
public interface WebhookSender {

    /**
     * Executes a webhook.
     *
     * @param id      Webhook identity.
     * @param token   Webhook token.
     * @param message Message to post.
     * @return WebhookResponse instance.
     * @throws Exception If the invocation fails.
     */
    WebhookResponse send(WebhookId id, String token, WebhookMessage message) throws Exception;
}
