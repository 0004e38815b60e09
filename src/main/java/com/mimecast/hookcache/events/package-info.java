/**
 * Platform event feed.
 *
 * <p>The gateway collaborator turns platform dispatches into {@link com.mimecast.hookcache.events.WebhookEvent}s
 * and hands them to a {@link com.mimecast.hookcache.events.WebhookEventHandler} which keeps the cache current.
 */
package com.mimecast.hookcache.events;
