package com.mimecast.hookcache.execute;

import com.mimecast.hookcache.model.Webhook;

import java.util.List;

/**
 * Channel level webhook capability.
 */
public interface ChannelWebhookSource {

    /**
     * Lists the webhooks of a channel.
     *
     * @param channelId Channel identifier.
     * @return List of Webhook.
     * @throws Exception If the listing fails.
     */
    List<Webhook> listChannelWebhooks(long channelId) throws Exception;

    /**
     * Creates a webhook in a channel.
     *
     * @param channelId Channel identifier.
     * @param name      Webhook name.
     * @return Created Webhook, carrying its token.
     * @throws Exception If creation fails.
     */
    Webhook createWebhook(long channelId, String name) throws Exception;
}
