package com.mimecast.hookcache.cache;

import com.mimecast.hookcache.metrics.CacheMetrics;
import com.mimecast.hookcache.model.Webhook;
import com.mimecast.hookcache.model.WebhookId;
import com.mimecast.hookcache.model.WebhookPatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory webhook cache keyed by webhook identity.
 *
 * <p>Thread-safe implementation using concurrent data structures:
 * <ul>
 *   <li>Entries live in a {@link ConcurrentHashMap}. Every mutation is a per-key atomic compute,
 *       so mutations of one identity are serialized while unrelated identities never contend.</li>
 *   <li>Reads take no lock and never wait for fetches.</li>
 *   <li>Misses are coalesced: the first caller registers a shared {@link CompletableFuture} for the identity
 *       and runs the fetch, concurrent callers for the same identity wait on that future.
 *       The registration is dropped once the fetch completes, fails or is cancelled.</li>
 * </ul>
 *
 * <p>A mutation observed while a fetch for the same identity is outstanding supersedes that fetch:
 * its result is handed to the waiters but not written to the cache.
 * <br>Channel and guild removals supersede every outstanding fetch, since a fetch's channel is only known once it returns.
 * <br>Events for a single identity must be applied in arrival order; this class does not reorder them.
 *
 * <p>There is no capacity or time based eviction. Entries live until removed.
 */
public class WebhookCache {
    private static final Logger log = LogManager.getLogger(WebhookCache.class);

    private static final Executor DIRECT = Runnable::run;

    private final ConcurrentMap<WebhookId, Webhook> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<WebhookId, PendingFetch> inFlight = new ConcurrentHashMap<>();
    private final CacheMetrics metrics;

    /**
     * Constructs a new WebhookCache with private metrics.
     */
    public WebhookCache() {
        this(new CacheMetrics());
    }

    /**
     * Constructs a new WebhookCache.
     *
     * @param metrics CacheMetrics instance.
     */
    public WebhookCache(CacheMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        metrics.bindEntries(entries);
    }

    /**
     * Gets a cached webhook.
     * <p>Never performs I/O and never blocks on in-flight fetches.
     *
     * @param id Webhook identity.
     * @return Optional of Webhook.
     */
    public Optional<Webhook> get(WebhookId id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(entries.get(id));
    }

    /**
     * Gets a cached webhook, fetching and caching it on a miss.
     * <p>The fetch runs at most once among concurrent callers for the same identity.
     * <br>The first caller runs it on its own thread, the others wait for its outcome.
     *
     * @param id      Webhook identity.
     * @param fetcher Fetch capability.
     * @return Webhook instance.
     * @throws FetchException If the fetch failed, was cancelled or the wait was interrupted.
     */
    public Webhook getOrFetch(WebhookId id, WebhookFetcher fetcher) throws FetchException {
        return await(id, getOrFetchAsync(id, fetcher, DIRECT), null);
    }

    /**
     * Gets a cached webhook, fetching and caching it on a miss, waiting at most the given time.
     * <p>The timeout only bounds this caller's wait on a fetch started by another caller.
     * The shared fetch keeps running for everyone else.
     *
     * @param id      Webhook identity.
     * @param fetcher Fetch capability.
     * @param timeout Maximum wait.
     * @return Webhook instance.
     * @throws FetchException If the fetch failed or the wait timed out.
     */
    public Webhook getOrFetch(WebhookId id, WebhookFetcher fetcher, Duration timeout) throws FetchException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        return await(id, getOrFetchAsync(id, fetcher, DIRECT), timeout);
    }

    /**
     * Gets a cached webhook, fetching it on the given executor on a miss.
     * <p>Every concurrent caller for the same identity receives the same future.
     * <br>Cancelling it, or completing it through a timeout, fails every waiter and leaves the cache untouched.
     * Callers may then retry.
     *
     * @param id       Webhook identity.
     * @param fetcher  Fetch capability.
     * @param executor Executor that runs the fetch.
     * @return CompletableFuture of Webhook, failing with {@link FetchException}.
     */
    public CompletableFuture<Webhook> getOrFetchAsync(WebhookId id, WebhookFetcher fetcher, Executor executor) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(fetcher, "fetcher must not be null");
        Objects.requireNonNull(executor, "executor must not be null");

        Webhook cached = entries.get(id);
        if (cached != null) {
            metrics.recordHit();
            return CompletableFuture.completedFuture(cached);
        }

        PendingFetch pending = new PendingFetch();
        PendingFetch existing = inFlight.putIfAbsent(id, pending);
        if (existing != null) {
            metrics.recordCoalesced();
            log.debug("Joining in-flight fetch for webhook {}", id);
            return existing.future;
        }

        // Filled between the lookup and the registration.
        cached = entries.get(id);
        if (cached != null) {
            inFlight.remove(id, pending);
            pending.future.complete(cached);
            metrics.recordHit();
            return pending.future;
        }

        metrics.recordMiss();
        pending.future.whenComplete((webhook, error) -> inFlight.remove(id, pending));
        try {
            executor.execute(() -> runFetch(id, fetcher, pending));
        } catch (RejectedExecutionException e) {
            fail(id, pending, new FetchException(id, "Fetch for webhook " + id + " rejected by executor", e));
        }

        return pending.future;
    }

    /**
     * Re-fetches a webhook regardless of its cached state.
     * <p>A webhook the platform reports as unknown is evicted.
     * <br>If a fetch for the identity is already in flight it is joined instead of issuing another.
     *
     * @param id      Webhook identity.
     * @param fetcher Fetch capability.
     * @return Optional of the webhook now cached, empty if it no longer exists.
     * @throws FetchException If the fetch failed for any reason other than an unknown webhook.
     */
    public Optional<Webhook> refresh(WebhookId id, WebhookFetcher fetcher) throws FetchException {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(fetcher, "fetcher must not be null");

        PendingFetch pending = new PendingFetch();
        PendingFetch existing = inFlight.putIfAbsent(id, pending);
        CompletableFuture<Webhook> future;
        if (existing != null) {
            metrics.recordCoalesced();
            log.debug("Refresh joining in-flight fetch for webhook {}", id);
            future = existing.future;
        } else {
            pending.future.whenComplete((webhook, error) -> inFlight.remove(id, pending));
            runFetch(id, fetcher, pending);
            future = pending.future;
        }

        try {
            await(id, future, null);
        } catch (FetchException e) {
            if (!e.isUnknownWebhook()) {
                throw e;
            }
            log.info("Webhook {} no longer exists on the platform", id);
        }

        return get(id);
    }

    /**
     * Creates or overwrites the entry for the webhook's identity.
     *
     * @param webhook Webhook instance.
     */
    public void insert(Webhook webhook) {
        Objects.requireNonNull(webhook, "webhook must not be null");
        entries.compute(webhook.getId(), (key, current) -> {
            supersedePending(key);
            return webhook;
        });
        log.debug("Cached webhook {}", webhook.getId());
    }

    /**
     * Merges a partial update into the cached webhook.
     * <p>An update for a webhook that is not cached is ignored: the platform may deliver updates
     * for webhooks this cache has not seen yet.
     *
     * @param id    Webhook identity.
     * @param patch WebhookPatch instance.
     * @return True if a cached webhook was updated, false on a miss.
     */
    public boolean update(WebhookId id, WebhookPatch patch) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(patch, "patch must not be null");

        AtomicBoolean applied = new AtomicBoolean(false);
        entries.compute(id, (key, current) -> {
            supersedePending(key);
            if (current == null) {
                return null;
            }
            applied.set(true);
            return current.apply(patch);
        });

        if (applied.get()) {
            log.debug("Updated webhook {} with {}", id, patch);
        } else {
            metrics.recordUpdateMiss();
            log.debug("Ignoring update for uncached webhook {}", id);
        }
        return applied.get();
    }

    /**
     * Removes a cached webhook.
     * <p>Idempotent: removing an absent identity returns empty.
     *
     * @param id Webhook identity.
     * @return Optional of the removed Webhook.
     */
    public Optional<Webhook> remove(WebhookId id) {
        Objects.requireNonNull(id, "id must not be null");

        AtomicReference<Webhook> removed = new AtomicReference<>();
        entries.compute(id, (key, current) -> {
            supersedePending(key);
            removed.set(current);
            return null;
        });

        if (removed.get() != null) {
            log.debug("Removed webhook {}", id);
        }
        return Optional.ofNullable(removed.get());
    }

    /**
     * Removes every webhook of a channel.
     * <p>Outstanding fetches are superseded and their results are not cached.
     *
     * @param channelId Channel identifier.
     * @return Number of webhooks removed.
     */
    public int removeChannel(long channelId) {
        inFlight.values().forEach(PendingFetch::supersede);
        int removed = removeMatching(webhook -> webhook.getChannelId() == channelId);
        if (removed > 0) {
            log.info("Removed {} webhooks of deleted channel {}", removed, channelId);
        }
        return removed;
    }

    /**
     * Removes every webhook of a guild.
     * <p>Outstanding fetches are superseded and their results are not cached.
     *
     * @param guildId Guild identifier.
     * @return Number of webhooks removed.
     */
    public int removeGuild(long guildId) {
        inFlight.values().forEach(PendingFetch::supersede);
        int removed = removeMatching(webhook -> webhook.getGuildId().map(id -> id == guildId).orElse(false));
        if (removed > 0) {
            log.info("Removed {} webhooks of deleted guild {}", removed, guildId);
        }
        return removed;
    }

    /**
     * Removes every entry and supersedes every in-flight fetch.
     */
    public void clear() {
        inFlight.values().forEach(PendingFetch::supersede);
        int size = entries.size();
        entries.clear();
        log.info("Cleared webhook cache ({} entries)", size);
    }

    /**
     * Gets cached webhooks of a channel.
     *
     * @param channelId Channel identifier.
     * @return List of Webhook ordered by identity.
     */
    public List<Webhook> getByChannel(long channelId) {
        return entries.values().stream()
                .filter(webhook -> webhook.getChannelId() == channelId)
                .sorted(Comparator.comparing(Webhook::getId))
                .collect(Collectors.toList());
    }

    /**
     * Finds a cached webhook of a channel that can be executed, i.e. carries a token.
     *
     * @param channelId Channel identifier.
     * @return Optional of the executable Webhook with the lowest identity.
     */
    public Optional<Webhook> findExecutable(long channelId) {
        return entries.values().stream()
                .filter(webhook -> webhook.getChannelId() == channelId && webhook.hasToken())
                .min(Comparator.comparing(Webhook::getId));
    }

    /**
     * Gets number of cached webhooks.
     *
     * @return Integer.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Gets a point-in-time copy of the cache.
     *
     * @return Unmodifiable map of WebhookId, Webhook.
     */
    public Map<WebhookId, Webhook> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(entries));
    }

    /**
     * Gets number of fetches currently in flight.
     *
     * @return Integer.
     */
    public int pendingFetches() {
        return inFlight.size();
    }

    /**
     * Runs a registered fetch and completes its shared future.
     *
     * @param id      Webhook identity.
     * @param fetcher Fetch capability.
     * @param pending Registered pending fetch.
     */
    private void runFetch(WebhookId id, WebhookFetcher fetcher, PendingFetch pending) {
        if (pending.future.isDone()) {
            inFlight.remove(id, pending);
            return;
        }

        Webhook fetched;
        try {
            fetched = fetcher.fetch(id);
        } catch (FetchException e) {
            fail(id, pending, e);
            return;
        } catch (Exception e) {
            fail(id, pending, new FetchException(id, e));
            return;
        } catch (Error e) {
            fail(id, pending, new FetchException(id, e));
            throw e;
        }

        if (fetched == null) {
            fail(id, pending, new FetchException(id, "Fetcher returned no webhook for " + id));
            return;
        }
        if (!id.equals(fetched.getId())) {
            fail(id, pending, new FetchException(id, "Fetcher returned webhook " + fetched.getId() + " for " + id));
            return;
        }

        final Webhook result = fetched;
        Webhook stored = entries.compute(id, (key, current) ->
                pending.superseded || pending.future.isDone() ? current : result);
        if (stored != result) {
            log.debug("Fetch for webhook {} superseded while in flight, result not cached", id);
        } else {
            log.debug("Fetched and cached webhook {}", id);
        }

        metrics.recordFetchSuccess();
        inFlight.remove(id, pending);
        pending.future.complete(stored != null ? stored : result);
    }

    /**
     * Fails a registered fetch.
     * <p>A webhook reported unknown is evicted unless a newer mutation superseded the fetch.
     *
     * @param id      Webhook identity.
     * @param pending Registered pending fetch.
     * @param error   FetchException instance.
     */
    private void fail(WebhookId id, PendingFetch pending, FetchException error) {
        if (error.isUnknownWebhook()) {
            entries.computeIfPresent(id, (key, current) -> pending.superseded ? current : null);
        }

        metrics.recordFetchFailure();
        log.debug("Fetch for webhook {} failed: {}", id, error.getMessage());
        inFlight.remove(id, pending);
        pending.future.completeExceptionally(error);
    }

    /**
     * Waits for a fetch outcome.
     *
     * @param id      Webhook identity.
     * @param future  Shared future.
     * @param timeout Maximum wait, null to wait indefinitely.
     * @return Webhook instance.
     * @throws FetchException If the fetch failed or the wait did not complete.
     */
    private Webhook await(WebhookId id, CompletableFuture<Webhook> future, Duration timeout) throws FetchException {
        try {
            return timeout == null ? future.get() : future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchException) {
                throw (FetchException) cause;
            }
            throw new FetchException(id, cause);
        } catch (CancellationException e) {
            throw new FetchException(id, "Fetch for webhook " + id + " was cancelled", e);
        } catch (TimeoutException e) {
            throw new FetchException(id, "Timed out after " + timeout.toMillis() + " ms waiting for webhook " + id, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(id, "Interrupted while waiting for webhook " + id, e);
        }
    }

    /**
     * Removes entries matching a predicate, one atomic compute per identity.
     *
     * @param predicate Webhook predicate.
     * @return Number of entries removed.
     */
    private int removeMatching(Predicate<Webhook> predicate) {
        int removed = 0;
        for (WebhookId id : entries.keySet()) {
            AtomicBoolean matched = new AtomicBoolean(false);
            entries.computeIfPresent(id, (key, current) -> {
                if (!predicate.test(current)) {
                    return current;
                }
                supersedePending(key);
                matched.set(true);
                return null;
            });
            if (matched.get()) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Marks the in-flight fetch for an identity as superseded.
     * <p>Called inside the entry's compute so it is ordered with the fetch's own write.
     *
     * @param id Webhook identity.
     */
    private void supersedePending(WebhookId id) {
        PendingFetch pending = inFlight.get(id);
        if (pending != null) {
            pending.supersede();
        }
    }

    /**
     * In-flight fetch registration.
     */
    private static final class PendingFetch {
        private final CompletableFuture<Webhook> future = new CompletableFuture<>();
        private volatile boolean superseded;

        void supersede() {
            superseded = true;
        }
    }
}
