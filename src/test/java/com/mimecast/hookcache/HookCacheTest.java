package com.mimecast.hookcache;

import com.mimecast.hookcache.config.HookCacheConfig;
import com.mimecast.hookcache.events.WebhookEvent;
import com.mimecast.hookcache.execute.WebhookMessage;
import com.mimecast.hookcache.execute.WebhookResponse;
import com.mimecast.hookcache.model.WebhookId;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end wiring tests against a mock platform.
 */
class HookCacheTest {

    private MockWebServer mockWebServer;
    private SimpleMeterRegistry registry;
    private HookCache hooks;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        Map<String, Object> map = new HashMap<>();
        map.put("apiBaseUrl", mockWebServer.url("/api/v10").toString());
        map.put("botToken", "bot-token");
        map.put("fetchTimeout", 5);

        registry = new SimpleMeterRegistry();
        hooks = new HookCache(new HookCacheConfig(map), registry);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void testFetchThenExecute() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"id\":\"5\",\"type\":1,\"channel_id\":\"100\",\"name\":\"relay\",\"token\":\"T\"}"));
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"id\":\"900\"}"));
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"id\":\"901\"}"));

        WebhookId id = WebhookId.of(5);
        WebhookResponse first = hooks.getExecutor().execute(id, null, WebhookMessage.of("one"));
        WebhookResponse second = hooks.getExecutor().execute(id, null, WebhookMessage.of("two"));

        assertTrue(first.isSuccess());
        assertTrue(second.isSuccess());
        assertEquals(3, mockWebServer.getRequestCount());

        RecordedRequest fetch = mockWebServer.takeRequest();
        assertEquals("/api/v10/webhooks/5", fetch.getPath());
        assertEquals("/api/v10/webhooks/5/T?wait=true", mockWebServer.takeRequest().getPath());
        assertEquals("/api/v10/webhooks/5/T?wait=true", mockWebServer.takeRequest().getPath());

        assertEquals(1.0, registry.get("hookcache.lookups").tag("result", "hit").counter().count());
        assertEquals(2.0, registry.get("hookcache.executions").tag("outcome", "success").counter().count());
    }

    @Test
    void testDeleteEventEvicts() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"id\":\"6\",\"type\":1,\"channel_id\":\"100\",\"token\":\"T\"}"));

        hooks.getCache().getOrFetch(WebhookId.of(6), hooks.getRestClient());
        assertTrue(hooks.getCache().get(WebhookId.of(6)).isPresent());

        hooks.handle(WebhookEvent.deleted(WebhookId.of(6)));
        assertEquals(Optional.empty(), hooks.getCache().get(WebhookId.of(6)));
    }

    @Test
    void testChannelResolverCreatesWebhook() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));
        mockWebServer.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"id\":\"7\",\"type\":1,\"channel_id\":\"100\",\"name\":\"relay\",\"token\":\"T7\"}"));

        assertEquals(WebhookId.of(7), hooks.getChannelResolver().resolve(100L, "relay").getId());
        assertTrue(hooks.getCache().get(WebhookId.of(7)).isPresent());
    }

    @Test
    void testMetricsDisabled() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("enabled", false);
        Map<String, Object> map = new HashMap<>();
        map.put("metrics", metrics);

        SimpleMeterRegistry external = new SimpleMeterRegistry();
        HookCache quiet = new HookCache(new HookCacheConfig(map), external);

        assertNull(external.find("hookcache.lookups").counter());
        assertNotSame(external, quiet.getMetrics().getRegistry());
    }

    @Test
    void testLoadFromFile() throws IOException {
        HookCache loaded = HookCache.load("src/test/resources/cfg/hookcache.json5");

        assertEquals("test-bot-token", loaded.getConfig().getBotToken());
        assertNotNull(loaded.getExecutor());
        assertNotNull(loaded.getEventHandler());
    }
}
