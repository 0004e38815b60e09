/**
 * Webhook execution.
 *
 * <p>{@link com.mimecast.hookcache.execute.WebhookExecutor} resolves webhooks through the cache and posts
 * {@link com.mimecast.hookcache.execute.WebhookMessage}s with a {@link com.mimecast.hookcache.execute.WebhookSender}.
 */
package com.mimecast.hookcache.execute;
