package com.mimecast.hookcache.execute;

import com.mimecast.hookcache.cache.FetchException;
import com.mimecast.hookcache.cache.UnknownWebhookException;
import com.mimecast.hookcache.cache.WebhookCache;
import com.mimecast.hookcache.cache.WebhookFetcher;
import com.mimecast.hookcache.metrics.CacheMetrics;
import com.mimecast.hookcache.model.Webhook;
import com.mimecast.hookcache.model.WebhookId;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Webhook execution helper.
 *
 * <p>Resolves a webhook through the cache, fetching it at most once among concurrent callers,
 * picks the token to use and hands the message to the send capability.
 * <br>A non-empty caller supplied token wins over the cached one.
 * <br>Nothing is retried. Each failure surfaces as an {@link ExecuteException} carrying its {@link ExecuteException.Reason}.
 */
public class WebhookExecutor {
    private static final Logger log = LogManager.getLogger(WebhookExecutor.class);

    private final WebhookCache cache;
    private final WebhookFetcher fetcher;
    private final WebhookSender sender;
    private final CacheMetrics metrics;
    private final Duration fetchTimeout;

    /**
     * Constructs a new WebhookExecutor without default collaborators.
     * <p>Only the variants taking a fetcher and a sender can be used.
     *
     * @param cache WebhookCache instance.
     */
    public WebhookExecutor(WebhookCache cache) {
        this(cache, null, null, new CacheMetrics(), Duration.ZERO);
    }

    /**
     * Constructs a new WebhookExecutor with default collaborators.
     *
     * @param cache   WebhookCache instance.
     * @param fetcher Default fetch capability.
     * @param sender  Default send capability.
     */
    public WebhookExecutor(WebhookCache cache, WebhookFetcher fetcher, WebhookSender sender) {
        this(cache, fetcher, sender, new CacheMetrics(), Duration.ZERO);
    }

    /**
     * Constructs a new WebhookExecutor.
     *
     * @param cache        WebhookCache instance.
     * @param fetcher      Default fetch capability, may be null.
     * @param sender       Default send capability, may be null.
     * @param metrics      CacheMetrics instance.
     * @param fetchTimeout Maximum wait for a coalesced fetch, zero to wait indefinitely.
     */
    public WebhookExecutor(WebhookCache cache, WebhookFetcher fetcher, WebhookSender sender,
                           CacheMetrics metrics, Duration fetchTimeout) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.fetcher = fetcher;
        this.sender = sender;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout must not be null");
        if (fetchTimeout.isNegative()) {
            throw new IllegalArgumentException("fetchTimeout must not be negative");
        }
    }

    /**
     * Executes a webhook using the default collaborators.
     *
     * @param id        Webhook identity.
     * @param tokenHint Token supplied by the caller, may be null.
     * @param message   Message to post.
     * @return WebhookResponse instance.
     * @throws ExecuteException If the webhook could not be executed.
     * @throws IllegalStateException If no default collaborators were configured.
     */
    public WebhookResponse execute(WebhookId id, String tokenHint, WebhookMessage message) throws ExecuteException {
        if (fetcher == null || sender == null) {
            throw new IllegalStateException("No default fetcher and sender configured");
        }
        return execute(id, tokenHint, message, fetcher, sender);
    }

    /**
     * Executes a webhook.
     *
     * @param id        Webhook identity.
     * @param tokenHint Token supplied by the caller, may be null.
     * @param message   Message to post.
     * @param fetcher   Fetch capability used on a cache miss.
     * @param sender    Send capability.
     * @return WebhookResponse instance.
     * @throws ExecuteException If the webhook could not be resolved, has no token or the send failed.
     */
    public WebhookResponse execute(WebhookId id, String tokenHint, WebhookMessage message,
                                   WebhookFetcher fetcher, WebhookSender sender) throws ExecuteException {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(fetcher, "fetcher must not be null");
        Objects.requireNonNull(sender, "sender must not be null");

        Webhook webhook;
        try {
            webhook = fetchTimeout.isZero()
                    ? cache.getOrFetch(id, fetcher)
                    : cache.getOrFetch(id, fetcher, fetchTimeout);
        } catch (FetchException e) {
            metrics.recordExecuteFetchFailure();
            log.debug("Could not resolve webhook {}: {}", id, e.getMessage());
            throw ExecuteException.fetch(id, e);
        }

        String token = StringUtils.isNotEmpty(tokenHint) ? tokenHint : webhook.getToken().filter(StringUtils::isNotEmpty).orElse(null);
        if (token == null) {
            metrics.recordExecuteMissingToken();
            log.debug("Webhook {} has no token and none was supplied", id);
            throw ExecuteException.missingToken(id);
        }

        WebhookResponse response;
        try {
            response = sender.send(id, token, message);
        } catch (UnknownWebhookException e) {
            cache.remove(id);
            metrics.recordExecuteSendFailure();
            log.warn("Webhook {} no longer exists, evicted from cache", id);
            throw ExecuteException.send(id, e);
        } catch (Exception e) {
            metrics.recordExecuteSendFailure();
            log.debug("Send through webhook {} failed: {}", id, e.getMessage());
            throw ExecuteException.send(id, e);
        }

        if (response == null) {
            metrics.recordExecuteSendFailure();
            throw new ExecuteException(ExecuteException.Reason.SEND, id, "Sender returned no response for webhook " + id, null);
        }

        metrics.recordExecuteSuccess();
        log.debug("Executed webhook {} with status {}", id, response.getStatusCode());
        return response;
    }

    /**
     * Executes a webhook on the given executor using the default collaborators.
     * <p>The returned future fails with a {@link CompletionException} wrapping the {@link ExecuteException}.
     *
     * @param id        Webhook identity.
     * @param tokenHint Token supplied by the caller, may be null.
     * @param message   Message to post.
     * @param executor  Executor to run on.
     * @return CompletableFuture of WebhookResponse.
     */
    public CompletableFuture<WebhookResponse> executeAsync(WebhookId id, String tokenHint, WebhookMessage message,
                                                           Executor executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        return CompletableFuture.supplyAsync(() -> {
            try {
                return execute(id, tokenHint, message);
            } catch (ExecuteException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    public WebhookCache getCache() {
        return cache;
    }
}
