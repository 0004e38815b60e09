package com.mimecast.hookcache.cache;

import com.mimecast.hookcache.model.Webhook;
import com.mimecast.hookcache.model.WebhookId;

/**
 * Fetch capability.
 *
 * <p>Queries the remote platform for the current state of one webhook.
 * <br>Implementations signal a webhook the platform does not know with {@link UnknownWebhookException}.
 */
@FunctionalInterface
public interface WebhookFetcher {

    /**
     * Fetches a webhook.
     *
     * @param id Webhook identity.
     * @return Webhook instance, never null.
     * @throws Exception If the platform request fails.
     */
    Webhook fetch(WebhookId id) throws Exception;
}
