package com.mimecast.hookcache.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;

/**
 * Webhook cache Micrometer metrics.
 *
 * <p>Provides counters for cache lookups, fetches, coalesced waits, update misses and executions.
 * <br>Meters are registered once at construction against the supplied registry.
 */
public class CacheMetrics {
    private static final Logger log = LogManager.getLogger(CacheMetrics.class);

    private final MeterRegistry registry;

    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter fetchSuccessCounter;
    private final Counter fetchFailureCounter;
    private final Counter coalescedCounter;
    private final Counter updateMissCounter;
    private final Counter executeSuccessCounter;
    private final Counter executeMissingTokenCounter;
    private final Counter executeFetchCounter;
    private final Counter executeSendCounter;

    /**
     * Constructs a new CacheMetrics instance backed by a private in-memory registry.
     */
    public CacheMetrics() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Constructs a new CacheMetrics instance.
     *
     * @param registry MeterRegistry instance.
     */
    public CacheMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");

        hitCounter = counter("hookcache.lookups", "Webhook cache lookups", "result", "hit");
        missCounter = counter("hookcache.lookups", "Webhook cache lookups", "result", "miss");
        fetchSuccessCounter = counter("hookcache.fetches", "Webhook fetches issued to the platform", "outcome", "success");
        fetchFailureCounter = counter("hookcache.fetches", "Webhook fetches issued to the platform", "outcome", "failure");
        coalescedCounter = Counter.builder("hookcache.fetches.coalesced")
                .description("Callers that joined an in-flight fetch")
                .register(registry);
        updateMissCounter = Counter.builder("hookcache.updates.missed")
                .description("Update events for webhooks not in the cache")
                .register(registry);
        executeSuccessCounter = counter("hookcache.executions", "Webhook executions", "outcome", "success");
        executeMissingTokenCounter = counter("hookcache.executions", "Webhook executions", "outcome", "missing_token");
        executeFetchCounter = counter("hookcache.executions", "Webhook executions", "outcome", "fetch");
        executeSendCounter = counter("hookcache.executions", "Webhook executions", "outcome", "send");

        log.debug("Webhook cache metrics registered with {}", registry.getClass().getSimpleName());
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(name)
                .description(description)
                .tag(tagKey, tagValue)
                .register(registry);
    }

    /**
     * Registers the cache size gauge.
     *
     * @param entries Map whose size is reported.
     */
    public void bindEntries(Map<?, ?> entries) {
        Gauge.builder("hookcache.entries", entries, Map::size)
                .description("Webhooks currently cached")
                .register(registry);
    }

    /**
     * Gets the underlying registry.
     *
     * @return MeterRegistry instance.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public void recordHit() {
        hitCounter.increment();
    }

    public void recordMiss() {
        missCounter.increment();
    }

    public void recordFetchSuccess() {
        fetchSuccessCounter.increment();
    }

    public void recordFetchFailure() {
        fetchFailureCounter.increment();
    }

    public void recordCoalesced() {
        coalescedCounter.increment();
    }

    public void recordUpdateMiss() {
        updateMissCounter.increment();
    }

    public void recordExecuteSuccess() {
        executeSuccessCounter.increment();
    }

    public void recordExecuteMissingToken() {
        executeMissingTokenCounter.increment();
    }

    public void recordExecuteFetchFailure() {
        executeFetchCounter.increment();
    }

    public void recordExecuteSendFailure() {
        executeSendCounter.increment();
    }
}
