package com.mimecast.hookcache.execute;

import org.apache.commons.lang3.StringUtils;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable message posted through a webhook.
 *
 * <p>Built with {@link #builder(String)} and validated on {@link Builder#build()}.
 */
public final class WebhookMessage {
    public static final int MAX_CONTENT_LENGTH = 2000;
    public static final int MAX_USERNAME_LENGTH = 80;

    private final String content;
    private final String username;
    private final String avatarUrl;
    private final Long threadId;
    private final boolean tts;

    private WebhookMessage(Builder builder) {
        this.content = builder.content;
        this.username = builder.username;
        this.avatarUrl = builder.avatarUrl;
        this.threadId = builder.threadId;
        this.tts = builder.tts;
    }

    /**
     * Starts a message with the given content.
     *
     * @param content Message content.
     * @return Builder instance.
     */
    public static Builder builder(String content) {
        return new Builder(content);
    }

    /**
     * Shortcut for a plain text message.
     *
     * @param content Message content.
     * @return WebhookMessage instance.
     */
    public static WebhookMessage of(String content) {
        return builder(content).build();
    }

    public String getContent() {
        return content;
    }

    /**
     * Gets username override.
     *
     * @return Optional of String.
     */
    public Optional<String> getUsername() {
        return Optional.ofNullable(username);
    }

    /**
     * Gets avatar URL override.
     *
     * @return Optional of String.
     */
    public Optional<String> getAvatarUrl() {
        return Optional.ofNullable(avatarUrl);
    }

    /**
     * Gets the thread to post into.
     *
     * @return Optional of Long.
     */
    public Optional<Long> getThreadId() {
        return Optional.ofNullable(threadId);
    }

    public boolean isTts() {
        return tts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WebhookMessage)) return false;
        WebhookMessage that = (WebhookMessage) o;
        return tts == that.tts &&
                content.equals(that.content) &&
                Objects.equals(username, that.username) &&
                Objects.equals(avatarUrl, that.avatarUrl) &&
                Objects.equals(threadId, that.threadId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, username, avatarUrl, threadId, tts);
    }

    @Override
    public String toString() {
        return "WebhookMessage{content=" + content.length() + " chars" +
                (username != null ? ", username=" + username : "") +
                (threadId != null ? ", threadId=" + threadId : "") +
                (tts ? ", tts" : "") + "}";
    }

    /**
     * WebhookMessage builder.
     */
    public static final class Builder {
        private final String content;
        private String username;
        private String avatarUrl;
        private Long threadId;
        private boolean tts;

        private Builder(String content) {
            this.content = content;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder avatarUrl(String avatarUrl) {
            this.avatarUrl = avatarUrl;
            return this;
        }

        /**
         * Posts as the given author, setting both username and avatar.
         *
         * @param author AuthorProfile instance.
         * @return Self.
         */
        public Builder author(AuthorProfile author) {
            Objects.requireNonNull(author, "author must not be null");
            this.username = author.getName();
            this.avatarUrl = author.getAvatarUrl().orElse(null);
            return this;
        }

        public Builder threadId(long threadId) {
            this.threadId = threadId;
            return this;
        }

        public Builder tts(boolean tts) {
            this.tts = tts;
            return this;
        }

        /**
         * Validates and builds.
         *
         * @return WebhookMessage instance.
         * @throws IllegalArgumentException If content or username are not accepted by the platform.
         */
        public WebhookMessage build() {
            if (StringUtils.isBlank(content)) {
                throw new IllegalArgumentException("Message content must not be empty");
            }
            if (content.length() > MAX_CONTENT_LENGTH) {
                throw new IllegalArgumentException("Message content exceeds " + MAX_CONTENT_LENGTH + " characters");
            }
            if (username != null) {
                validateUsername(username);
            }
            if (avatarUrl != null && StringUtils.isBlank(avatarUrl)) {
                avatarUrl = null;
            }
            return new WebhookMessage(this);
        }

        private static void validateUsername(String username) {
            if (username.isEmpty() || username.length() > MAX_USERNAME_LENGTH) {
                throw new IllegalArgumentException("Username must be between 1 and " + MAX_USERNAME_LENGTH + " characters");
            }
            if (StringUtils.containsIgnoreCase(username, "clyde") || StringUtils.containsIgnoreCase(username, "discord")) {
                throw new IllegalArgumentException("Username contains a reserved word: " + username);
            }
        }
    }
}
