package com.mimecast.hookcache.cache;

import com.mimecast.hookcache.metrics.CacheMetrics;
import com.mimecast.hookcache.model.Webhook;
import com.mimecast.hookcache.model.WebhookId;
import com.mimecast.hookcache.model.WebhookPatch;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WebhookCache single threaded behaviour.
 */
class WebhookCacheTest {

    private SimpleMeterRegistry registry;
    private WebhookCache cache;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        cache = new WebhookCache(new CacheMetrics(registry));
    }

    private static Webhook webhook(long id, long channelId, Long guildId, String name, String token) {
        return Webhook.builder(WebhookId.of(id))
                .channelId(channelId)
                .guildId(guildId)
                .name(name)
                .token(token)
                .build();
    }

    @Test
    void testInsertUpdateRemove() {
        WebhookId id = WebhookId.of(1);
        cache.insert(webhook(1, 100, null, "Alpha", null));

        assertEquals("Alpha", cache.get(id).map(Webhook::getName).orElse(null));

        assertTrue(cache.update(id, WebhookPatch.builder().name("Beta").build()));
        Webhook updated = cache.get(id).orElseThrow();
        assertEquals("Beta", updated.getName());
        assertEquals(id, updated.getId());

        assertEquals(Optional.of(updated), cache.remove(id));
        assertEquals(Optional.empty(), cache.get(id));
    }

    @Test
    void testFoldingOrder() {
        WebhookId id = WebhookId.of(2);

        cache.insert(webhook(2, 100, 10L, "one", "T1"));
        cache.update(id, WebhookPatch.builder().name("two").build());
        cache.update(id, WebhookPatch.builder().clearToken().build());
        cache.insert(webhook(2, 200, 10L, "three", "T3"));
        cache.update(id, WebhookPatch.builder().channelId(300).build());

        Webhook current = cache.get(id).orElseThrow();
        assertEquals("three", current.getName());
        assertEquals(300L, current.getChannelId());
        assertEquals(Optional.of("T3"), current.getToken());

        cache.remove(id);
        cache.update(id, WebhookPatch.builder().name("ghost").build());
        assertEquals(Optional.empty(), cache.get(id));
    }

    @Test
    void testRemoveIsIdempotent() {
        WebhookId id = WebhookId.of(3);
        cache.insert(webhook(3, 100, null, "x", null));

        assertTrue(cache.remove(id).isPresent());
        assertEquals(Optional.empty(), cache.remove(id));
        assertEquals(Optional.empty(), cache.remove(WebhookId.of(999)));
    }

    @Test
    void testUpdateMissIsIgnored() {
        assertFalse(cache.update(WebhookId.of(4), WebhookPatch.builder().name("x").build()));
        assertEquals(0, cache.size());
        assertEquals(1.0, registry.get("hookcache.updates.missed").counter().count());
    }

    @Test
    void testGetOrFetchCachesResult() throws FetchException {
        AtomicInteger calls = new AtomicInteger();
        WebhookFetcher fetcher = id -> {
            calls.incrementAndGet();
            return webhook(id.asLong(), 100, null, "fetched", "T");
        };

        Webhook first = cache.getOrFetch(WebhookId.of(5), fetcher);
        Webhook second = cache.getOrFetch(WebhookId.of(5), fetcher);

        assertEquals("fetched", first.getName());
        assertSame(first, second);
        assertEquals(1, calls.get());
        assertEquals(1.0, registry.get("hookcache.lookups").tag("result", "miss").counter().count());
        assertEquals(1.0, registry.get("hookcache.lookups").tag("result", "hit").counter().count());
        assertEquals(1.0, registry.get("hookcache.fetches").tag("outcome", "success").counter().count());
    }

    @Test
    void testGetOrFetchFailureLeavesCacheUntouched() {
        WebhookFetcher fetcher = id -> {
            throw new IllegalStateException("boom");
        };

        FetchException e = assertThrows(FetchException.class, () -> cache.getOrFetch(WebhookId.of(6), fetcher));
        assertEquals(WebhookId.of(6), e.getWebhookId());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertFalse(e.isUnknownWebhook());
        assertEquals(0, cache.size());
        assertEquals(0, cache.pendingFetches());
    }

    @Test
    void testGetOrFetchRejectsMismatchedResult() {
        WebhookFetcher fetcher = id -> webhook(77, 100, null, "other", null);

        assertThrows(FetchException.class, () -> cache.getOrFetch(WebhookId.of(7), fetcher));
        assertEquals(0, cache.size());
    }

    @Test
    void testGetOrFetchRejectsNullResult() {
        assertThrows(FetchException.class, () -> cache.getOrFetch(WebhookId.of(8), id -> null));
        assertEquals(0, cache.pendingFetches());
    }

    @Test
    void testRefreshReplacesEntry() throws FetchException {
        cache.insert(webhook(9, 100, null, "old", "T"));

        Optional<Webhook> refreshed = cache.refresh(WebhookId.of(9), id -> webhook(9, 100, null, "new", "T"));

        assertEquals("new", refreshed.map(Webhook::getName).orElse(null));
        assertEquals("new", cache.get(WebhookId.of(9)).map(Webhook::getName).orElse(null));
    }

    @Test
    void testRefreshUnknownEvicts() throws FetchException {
        WebhookId id = WebhookId.of(10);
        cache.insert(webhook(10, 100, null, "gone", "T"));

        Optional<Webhook> refreshed = cache.refresh(id, fetchId -> {
            throw new UnknownWebhookException(fetchId);
        });

        assertEquals(Optional.empty(), refreshed);
        assertEquals(Optional.empty(), cache.get(id));
    }

    @Test
    void testRefreshFailureKeepsEntry() {
        WebhookId id = WebhookId.of(11);
        cache.insert(webhook(11, 100, null, "kept", "T"));

        assertThrows(FetchException.class, () -> cache.refresh(id, fetchId -> {
            throw new java.io.IOException("unreachable");
        }));
        assertEquals("kept", cache.get(id).map(Webhook::getName).orElse(null));
    }

    @Test
    void testRemoveChannelAndGuild() {
        cache.insert(webhook(20, 100, 10L, "a", null));
        cache.insert(webhook(21, 100, 10L, "b", null));
        cache.insert(webhook(22, 200, 10L, "c", null));
        cache.insert(webhook(23, 300, 11L, "d", null));
        cache.insert(webhook(24, 400, null, "e", null));

        assertEquals(2, cache.removeChannel(100));
        assertEquals(3, cache.size());

        assertEquals(1, cache.removeGuild(10));
        assertEquals(2, cache.size());
        assertTrue(cache.get(WebhookId.of(23)).isPresent());
        assertTrue(cache.get(WebhookId.of(24)).isPresent());

        assertEquals(0, cache.removeGuild(99));
    }

    @Test
    void testChannelQueries() {
        cache.insert(webhook(32, 100, null, "c", "T32"));
        cache.insert(webhook(30, 100, null, "a", null));
        cache.insert(webhook(31, 100, null, "b", "T31"));
        cache.insert(webhook(33, 200, null, "d", "T33"));

        List<Webhook> channel = cache.getByChannel(100);
        assertEquals(3, channel.size());
        assertEquals(WebhookId.of(30), channel.get(0).getId());
        assertEquals(WebhookId.of(32), channel.get(2).getId());

        assertEquals(WebhookId.of(31), cache.findExecutable(100).map(Webhook::getId).orElse(null));
        assertEquals(Optional.empty(), cache.findExecutable(500));
    }

    @Test
    void testClearAndSnapshot() {
        cache.insert(webhook(40, 100, null, "a", null));
        cache.insert(webhook(41, 100, null, "b", null));

        Map<WebhookId, Webhook> snapshot = cache.snapshot();
        assertEquals(2, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove(WebhookId.of(40)));

        cache.clear();
        assertEquals(0, cache.size());
        assertEquals(2, snapshot.size());
        assertEquals(0.0, registry.get("hookcache.entries").gauge().value());
    }

    @Test
    void testNullArguments() {
        assertThrows(NullPointerException.class, () -> cache.get(null));
        assertThrows(NullPointerException.class, () -> cache.insert(null));
        assertThrows(NullPointerException.class, () -> cache.update(WebhookId.of(1), null));
        assertThrows(NullPointerException.class, () -> cache.getOrFetch(WebhookId.of(1), null));
    }
}
