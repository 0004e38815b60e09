/**
 * Concurrent in-memory webhook store.
 *
 * <p>{@link com.mimecast.hookcache.cache.WebhookCache} maps webhook identities to their last observed state,
 * fills itself from a {@link com.mimecast.hookcache.cache.WebhookFetcher} on misses and coalesces concurrent
 * misses for one identity into a single fetch.
 *
 * <p>The cache is an ordinary object owned by the application. It holds no static state.
 */
package com.mimecast.hookcache.cache;
