package com.mimecast.hookcache.execute;

import com.mimecast.hookcache.cache.WebhookCache;
import com.mimecast.hookcache.model.Webhook;
import com.mimecast.hookcache.model.WebhookId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ChannelWebhookResolverTest {

    private static final long CHANNEL = 100L;

    private WebhookCache cache;
    private ChannelWebhookSource source;
    private ChannelWebhookResolver resolver;

    @BeforeEach
    void setUp() {
        cache = new WebhookCache();
        source = mock(ChannelWebhookSource.class);
        resolver = new ChannelWebhookResolver(cache, source);
    }

    private static Webhook webhook(long id, String token) {
        return Webhook.builder(WebhookId.of(id)).channelId(CHANNEL).name("hook-" + id).token(token).build();
    }

    @Test
    void testCachedWebhookUsed() throws Exception {
        cache.insert(webhook(1, "T"));

        assertEquals(WebhookId.of(1), resolver.resolve(CHANNEL, "relay").getId());
        verifyNoInteractions(source);
    }

    @Test
    void testListedWebhookCached() throws Exception {
        when(source.listChannelWebhooks(CHANNEL)).thenReturn(Arrays.asList(webhook(1, null), webhook(2, "T2")));

        Webhook resolved = resolver.resolve(CHANNEL, "relay");

        assertEquals(WebhookId.of(2), resolved.getId());
        assertEquals(2, cache.size());
        verify(source, never()).createWebhook(anyLong(), anyString());

        resolver.resolve(CHANNEL, "relay");
        verify(source, times(1)).listChannelWebhooks(CHANNEL);
    }

    @Test
    void testCreatesWhenNoneUsable() throws Exception {
        when(source.listChannelWebhooks(CHANNEL)).thenReturn(Collections.singletonList(webhook(1, null)));
        when(source.createWebhook(CHANNEL, "relay")).thenReturn(webhook(3, "T3"));

        Webhook resolved = resolver.resolve(CHANNEL, "relay");

        assertEquals(WebhookId.of(3), resolved.getId());
        assertTrue(cache.get(WebhookId.of(3)).isPresent());
    }

    @Test
    void testFailureSurfacesAsFetch() throws Exception {
        when(source.listChannelWebhooks(CHANNEL)).thenThrow(new IOException("missing permissions"));

        ExecuteException e = assertThrows(ExecuteException.class, () -> resolver.resolve(CHANNEL, "relay"));

        assertEquals(ExecuteException.Reason.FETCH, e.getReason());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void testCreatedWithoutTokenRejected() throws Exception {
        when(source.listChannelWebhooks(CHANNEL)).thenReturn(Collections.emptyList());
        when(source.createWebhook(CHANNEL, "relay")).thenReturn(webhook(4, null));

        assertThrows(ExecuteException.class, () -> resolver.resolve(CHANNEL, "relay"));
    }

    @Test
    void testConcurrentResolutionsCoalesce() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(source.listChannelWebhooks(CHANNEL)).thenAnswer(invocation -> {
            assertTrue(release.await(10, TimeUnit.SECONDS));
            return Collections.emptyList();
        });
        when(source.createWebhook(CHANNEL, "relay")).thenReturn(webhook(5, "T5"));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Webhook>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> resolver.resolve(CHANNEL, "relay")));
            }
            verify(source, timeout(5000).times(1)).listChannelWebhooks(CHANNEL);
            Thread.sleep(100);
            release.countDown();

            for (Future<Webhook> future : futures) {
                assertEquals(WebhookId.of(5), future.get(10, TimeUnit.SECONDS).getId());
            }
            verify(source, times(1)).createWebhook(CHANNEL, "relay");
        } finally {
            pool.shutdownNow();
        }
    }
}
