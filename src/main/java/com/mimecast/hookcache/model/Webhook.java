package com.mimecast.hookcache.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Cached webhook record.
 *
 * <p>Immutable snapshot of a webhook as last observed through a fetch or an event.
 * <br>Changes produce a new instance via {@link #apply(WebhookPatch)} or {@link #toBuilder()}
 * so the cache can swap entries atomically.
 *
 * <p>{@link #toString()} never renders the token.
 */
public final class Webhook {
    private final WebhookId id;
    private final WebhookType type;
    private final long channelId;
    private final Long guildId;
    private final String name;
    private final String avatar;
    private final String token;
    private final boolean applicationOwned;

    private Webhook(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.type = builder.type != null ? builder.type : WebhookType.INCOMING;
        this.channelId = builder.channelId;
        this.guildId = builder.guildId;
        this.name = builder.name;
        this.avatar = builder.avatar;
        this.token = builder.token;
        this.applicationOwned = builder.applicationOwned;
    }

    /**
     * Gets a new builder.
     *
     * @param id Webhook identity.
     * @return Builder instance.
     */
    public static Builder builder(WebhookId id) {
        return new Builder(id);
    }

    /**
     * Gets a builder pre-filled with this record's values.
     *
     * @return Builder instance.
     */
    public Builder toBuilder() {
        return new Builder(id)
                .type(type)
                .channelId(channelId)
                .guildId(guildId)
                .name(name)
                .avatar(avatar)
                .token(token)
                .applicationOwned(applicationOwned);
    }

    /**
     * Applies a partial update.
     * <p>Unset fields keep this record's values, cleared fields are removed.
     *
     * @param patch WebhookPatch instance.
     * @return New Webhook instance, identity unchanged.
     */
    public Webhook apply(WebhookPatch patch) {
        return new Builder(id)
                .type(patch.getType().apply(type))
                .channelId(patch.getChannelId().apply(channelId))
                .guildId(patch.getGuildId().apply(guildId))
                .name(patch.getName().apply(name))
                .avatar(patch.getAvatar().apply(avatar))
                .token(patch.getToken().apply(token))
                .applicationOwned(patch.getApplicationOwned().apply(applicationOwned))
                .build();
    }

    public WebhookId getId() {
        return id;
    }

    public WebhookType getType() {
        return type;
    }

    public long getChannelId() {
        return channelId;
    }

    /**
     * Gets owning guild identifier.
     *
     * @return Optional of Long, empty for channel-only webhooks.
     */
    public Optional<Long> getGuildId() {
        return Optional.ofNullable(guildId);
    }

    /**
     * Gets display name.
     *
     * @return Name string, may be null.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets avatar hash.
     *
     * @return Optional of String.
     */
    public Optional<String> getAvatar() {
        return Optional.ofNullable(avatar);
    }

    /**
     * Gets security token.
     * <p>Only present for incoming webhooks the caller is allowed to see.
     *
     * @return Optional of String.
     */
    public Optional<String> getToken() {
        return Optional.ofNullable(token);
    }

    /**
     * Checks if a token is present.
     *
     * @return Boolean.
     */
    public boolean hasToken() {
        return token != null && !token.isEmpty();
    }

    public boolean isApplicationOwned() {
        return applicationOwned;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Webhook)) return false;
        Webhook that = (Webhook) o;
        return channelId == that.channelId
                && applicationOwned == that.applicationOwned
                && id.equals(that.id)
                && type == that.type
                && Objects.equals(guildId, that.guildId)
                && Objects.equals(name, that.name)
                && Objects.equals(avatar, that.avatar)
                && Objects.equals(token, that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, channelId, guildId, name, avatar, token, applicationOwned);
    }

    @Override
    public String toString() {
        return "Webhook{" +
                "id=" + id +
                ", type=" + type +
                ", channelId=" + channelId +
                ", guildId=" + guildId +
                ", name='" + name + '\'' +
                ", avatar=" + avatar +
                ", token=" + (token != null ? "***" : "null") +
                ", applicationOwned=" + applicationOwned +
                '}';
    }

    /**
     * Webhook builder.
     */
    public static final class Builder {
        private final WebhookId id;
        private WebhookType type = WebhookType.INCOMING;
        private long channelId;
        private Long guildId;
        private String name;
        private String avatar;
        private String token;
        private boolean applicationOwned;

        private Builder(WebhookId id) {
            this.id = id;
        }

        public Builder type(WebhookType type) {
            this.type = type;
            return this;
        }

        public Builder channelId(long channelId) {
            this.channelId = channelId;
            return this;
        }

        public Builder guildId(Long guildId) {
            this.guildId = guildId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder avatar(String avatar) {
            this.avatar = avatar;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder applicationOwned(boolean applicationOwned) {
            this.applicationOwned = applicationOwned;
            return this;
        }

        /**
         * Builds the Webhook instance.
         *
         * @return Webhook instance.
         */
        public Webhook build() {
            return new Webhook(this);
        }
    }
}
