package com.mimecast.hookcache.http;

import com.google.gson.JsonParseException;
import com.mimecast.hookcache.cache.UnknownWebhookException;
import com.mimecast.hookcache.cache.WebhookFetcher;
import com.mimecast.hookcache.execute.ChannelWebhookSource;
import com.mimecast.hookcache.execute.WebhookMessage;
import com.mimecast.hookcache.execute.WebhookResponse;
import com.mimecast.hookcache.execute.WebhookSender;
import com.mimecast.hookcache.model.Webhook;
import com.mimecast.hookcache.model.WebhookId;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Platform REST client for webhooks.
 *
 * <p>Implements the fetch, send and channel capabilities on top of OkHttp.
 * <br>An unknown webhook is reported with {@link UnknownWebhookException}, any other non-successful response
 * with {@link WebhookApiException}.
 *
 * <p>Example usage:
 * <pre>
 * DiscordRestClient client = new DiscordRestClient.Builder()
 *     .withBotToken("MTA...")
 *     .build();
 *
 * Webhook webhook = client.fetch(WebhookId.parse("223704706495545344"));
 * </pre>
 */
public class DiscordRestClient implements WebhookFetcher, WebhookSender, ChannelWebhookSource {
    private static final Logger log = LogManager.getLogger(DiscordRestClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int DEFAULT_TIMEOUT = 30;

    /**
     * Platform error code for an unknown webhook.
     */
    public static final int UNKNOWN_WEBHOOK = 10015;

    private final HttpUrl baseUrl;
    private final String botToken;
    private final String userAgent;
    private final OkHttpClient httpClient;

    /**
     * Constructs a new DiscordRestClient instance.
     *
     * @param builder Builder instance with configuration.
     */
    private DiscordRestClient(Builder builder) {
        this.baseUrl = HttpUrl.get(builder.baseUrl);
        this.botToken = builder.botToken;
        this.userAgent = builder.userAgent;

        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(builder.connectTimeout, TimeUnit.SECONDS)
                .readTimeout(builder.readTimeout, TimeUnit.SECONDS)
                .writeTimeout(builder.writeTimeout, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Fetches a webhook with bot authorization.
     *
     * @param id Webhook identity.
     * @return Webhook instance.
     * @throws UnknownWebhookException If the platform does not know the webhook.
     * @throws IOException             If the request failed.
     */
    @Override
    public Webhook fetch(WebhookId id) throws UnknownWebhookException, IOException {
        Objects.requireNonNull(id, "id must not be null");

        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("webhooks")
                .addPathSegment(id.toString())
                .build();

        log.debug("Fetching webhook {}", id);
        String body;
        try {
            body = call(authorized(url).get().build());
        } catch (WebhookApiException e) {
            checkUnknown(e, id);
            throw e;
        }
        return parse(() -> WebhookJson.parseWebhook(body), "webhook " + id);
    }

    /**
     * Executes a webhook, waiting for the created message.
     *
     * @param id      Webhook identity.
     * @param token   Webhook token.
     * @param message Message to post.
     * @return WebhookResponse with the created message as body.
     * @throws UnknownWebhookException If the platform does not know the webhook.
     * @throws IOException             If the request failed.
     */
    @Override
    public WebhookResponse send(WebhookId id, String token, WebhookMessage message) throws UnknownWebhookException, IOException {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (StringUtils.isEmpty(token)) {
            throw new IllegalArgumentException("token must not be empty");
        }

        HttpUrl.Builder urlBuilder = baseUrl.newBuilder()
                .addPathSegment("webhooks")
                .addPathSegment(id.toString())
                .addPathSegment(token)
                .addQueryParameter("wait", "true");
        message.getThreadId().ifPresent(threadId -> urlBuilder.addQueryParameter("thread_id", Long.toString(threadId)));

        // Token is part of the path, executing needs no bot authorization.
        Request request = new Request.Builder()
                .url(urlBuilder.build())
                .header("User-Agent", userAgent)
                .post(RequestBody.create(WebhookJson.toExecuteBody(message), JSON))
                .build();

        log.debug("Executing webhook {}", id);
        try (Response response = httpClient.newCall(request).execute()) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                WebhookApiException e = error(response, body);
                checkUnknown(e, id);
                throw e;
            }
            return new WebhookResponse(response.code(), body, true);
        }
    }

    /**
     * Lists the webhooks of a channel.
     *
     * @param channelId Channel identifier.
     * @return List of Webhook.
     * @throws IOException If the request failed.
     */
    @Override
    public List<Webhook> listChannelWebhooks(long channelId) throws IOException {
        HttpUrl url = channelWebhooksUrl(channelId);

        log.debug("Listing webhooks of channel {}", channelId);
        String body = call(authorized(url).get().build());
        return parse(() -> WebhookJson.parseWebhooks(body), "webhooks of channel " + channelId);
    }

    /**
     * Creates a webhook in a channel.
     *
     * @param channelId Channel identifier.
     * @param name      Webhook name.
     * @return Created Webhook.
     * @throws IOException If the request failed.
     */
    @Override
    public Webhook createWebhook(long channelId, String name) throws IOException {
        Objects.requireNonNull(name, "name must not be null");
        HttpUrl url = channelWebhooksUrl(channelId);

        log.debug("Creating webhook {} in channel {}", name, channelId);
        Request request = authorized(url)
                .post(RequestBody.create(WebhookJson.toCreateBody(name), JSON))
                .build();
        String body = call(request);
        return parse(() -> WebhookJson.parseWebhook(body), "created webhook in channel " + channelId);
    }

    private HttpUrl channelWebhooksUrl(long channelId) {
        return baseUrl.newBuilder()
                .addPathSegment("channels")
                .addPathSegment(Long.toString(channelId))
                .addPathSegment("webhooks")
                .build();
    }

    private Request.Builder authorized(HttpUrl url) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json");
        if (StringUtils.isNotEmpty(botToken)) {
            builder.header("Authorization", "Bot " + botToken);
        }
        return builder;
    }

    /**
     * Executes a request and returns the successful body.
     *
     * @param request Request instance.
     * @return Response body.
     * @throws WebhookApiException If the platform answered with a non-successful status.
     * @throws IOException         If the request failed.
     */
    private String call(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                throw error(response, body);
            }
            return body;
        }
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    /**
     * Maps a failed response to an exception.
     *
     * @param response Response instance.
     * @param body     Response body.
     * @return WebhookApiException to throw.
     */
    private static WebhookApiException error(Response response, String body) {
        int code = WebhookJson.errorCode(body);
        String message = WebhookJson.errorMessage(body, response.message());

        Double retryAfter = null;
        if (response.code() == 429) {
            retryAfter = parseRetryAfter(response.header("Retry-After"));
            log.warn("Rate limited on {} {}, retry after {}s", response.request().method(),
                    redact(response.request().url()), retryAfter);
        }

        return new WebhookApiException(response.code(), code,
                "Request failed with status: " + response.code() + ", message: " + message, retryAfter);
    }

    /**
     * Raises {@link UnknownWebhookException} if a webhook route failed because the webhook does not exist.
     * <p>The API failure is kept as cause.
     *
     * @param e  WebhookApiException instance.
     * @param id Webhook identity.
     * @throws UnknownWebhookException If the platform does not know the webhook.
     */
    private static void checkUnknown(WebhookApiException e, WebhookId id) throws UnknownWebhookException {
        if (e.getErrorCode() == UNKNOWN_WEBHOOK || (e.getStatus() == 404 && e.getErrorCode() == 0)) {
            UnknownWebhookException unknown = new UnknownWebhookException(id);
            unknown.initCause(e);
            throw unknown;
        }
    }

    /**
     * Renders a request path without the webhook token.
     *
     * @param url Request URL.
     * @return Path string.
     */
    static String redact(HttpUrl url) {
        List<String> segments = url.pathSegments();
        StringBuilder path = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            boolean token = i >= 2 && "webhooks".equals(segments.get(i - 2));
            path.append('/').append(token ? "***" : segments.get(i));
        }
        return path.toString();
    }

    private static Double parseRetryAfter(String header) {
        if (StringUtils.isBlank(header)) {
            return null;
        }
        try {
            return Double.parseDouble(header.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparsable Retry-After header: {}", header);
            return null;
        }
    }

    private static <T> T parse(JsonSupplier<T> supplier, String what) throws IOException {
        try {
            return supplier.get();
        } catch (JsonParseException | NumberFormatException | IllegalStateException | UnsupportedOperationException e) {
            throw new IOException("Malformed response for " + what + ": " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface JsonSupplier<T> {
        T get();
    }

    /**
     * Builder for DiscordRestClient.
     */
    public static class Builder {
        private String baseUrl = "https://discord.com/api/v10";
        private String botToken;
        private String userAgent = "DiscordBot (hookcache, 1.0)";
        private int connectTimeout = DEFAULT_TIMEOUT;
        private int readTimeout = DEFAULT_TIMEOUT;
        private int writeTimeout = DEFAULT_TIMEOUT;

        /**
         * Sets the REST API base URL.
         *
         * @param baseUrl Base URL (e.g., "https://discord.com/api/v10").
         * @return Builder instance.
         */
        public Builder withBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * Sets the bot token used for fetch, list and create calls.
         *
         * @param botToken Bot token.
         * @return Builder instance.
         */
        public Builder withBotToken(String botToken) {
            this.botToken = botToken;
            return this;
        }

        public Builder withUserAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        /**
         * Sets connection timeout.
         *
         * @param timeout Timeout in seconds.
         * @return Builder instance.
         */
        public Builder withConnectTimeout(int timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Sets read timeout.
         *
         * @param timeout Timeout in seconds.
         * @return Builder instance.
         */
        public Builder withReadTimeout(int timeout) {
            this.readTimeout = timeout;
            return this;
        }

        /**
         * Sets write timeout.
         *
         * @param timeout Timeout in seconds.
         * @return Builder instance.
         */
        public Builder withWriteTimeout(int timeout) {
            this.writeTimeout = timeout;
            return this;
        }

        /**
         * Builds the DiscordRestClient instance.
         *
         * @return DiscordRestClient instance.
         * @throws IllegalArgumentException If the base URL is not a valid HTTP URL.
         */
        public DiscordRestClient build() {
            Objects.requireNonNull(baseUrl, "baseUrl must not be null");
            if (HttpUrl.parse(baseUrl) == null) {
                throw new IllegalArgumentException("Invalid base URL: " + baseUrl);
            }
            if (StringUtils.isBlank(userAgent)) {
                throw new IllegalArgumentException("userAgent must not be empty");
            }
            return new DiscordRestClient(this);
        }
    }
}
