package com.mimecast.hookcache.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CacheMetrics.
 */
class CacheMetricsTest {

    private SimpleMeterRegistry registry;
    private CacheMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CacheMetrics(registry);
    }

    @Test
    void testCountersRegistered() {
        assertNotNull(registry.find("hookcache.lookups").tag("result", "hit").counter());
        assertNotNull(registry.find("hookcache.lookups").tag("result", "miss").counter());
        assertNotNull(registry.find("hookcache.fetches").tag("outcome", "success").counter());
        assertNotNull(registry.find("hookcache.fetches").tag("outcome", "failure").counter());
        assertNotNull(registry.find("hookcache.fetches.coalesced").counter());
        assertNotNull(registry.find("hookcache.updates.missed").counter());
        assertEquals(4, registry.find("hookcache.executions").counters().size());
    }

    @Test
    void testRecording() {
        metrics.recordHit();
        metrics.recordHit();
        metrics.recordMiss();
        metrics.recordCoalesced();
        metrics.recordExecuteSendFailure();

        assertEquals(2.0, registry.get("hookcache.lookups").tag("result", "hit").counter().count());
        assertEquals(1.0, registry.get("hookcache.lookups").tag("result", "miss").counter().count());
        assertEquals(1.0, registry.get("hookcache.fetches.coalesced").counter().count());
        assertEquals(1.0, registry.get("hookcache.executions").tag("outcome", "send").counter().count());
        assertEquals(0.0, registry.get("hookcache.executions").tag("outcome", "success").counter().count());
    }

    @Test
    void testEntriesGauge() {
        ConcurrentHashMap<String, String> entries = new ConcurrentHashMap<>();
        metrics.bindEntries(entries);

        entries.put("a", "1");
        entries.put("b", "2");

        assertEquals(2.0, registry.get("hookcache.entries").gauge().value());
    }

    @Test
    void testDefaultRegistry() {
        CacheMetrics own = new CacheMetrics();

        own.recordFetchFailure();
        assertEquals(1.0, own.getRegistry().get("hookcache.fetches").tag("outcome", "failure").counter().count());
    }
}
