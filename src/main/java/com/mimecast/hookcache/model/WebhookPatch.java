package com.mimecast.hookcache.model;

import java.util.Objects;

/**
 * Partial webhook update.
 *
 * <p>Each mutable field is a {@link PatchField} so "not mentioned" and "removed" stay distinct.
 * <br>Channel, type and the application flag are always present on a webhook and can only be set.
 * Guild, name, avatar and token may also be cleared.
 */
public final class WebhookPatch {
    private final PatchField<WebhookType> type;
    private final PatchField<Long> channelId;
    private final PatchField<Long> guildId;
    private final PatchField<String> name;
    private final PatchField<String> avatar;
    private final PatchField<String> token;
    private final PatchField<Boolean> applicationOwned;

    private WebhookPatch(Builder builder) {
        this.type = builder.type;
        this.channelId = builder.channelId;
        this.guildId = builder.guildId;
        this.name = builder.name;
        this.avatar = builder.avatar;
        this.token = builder.token;
        this.applicationOwned = builder.applicationOwned;
    }

    /**
     * Gets a new builder with every field unset.
     *
     * @return Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    public PatchField<WebhookType> getType() {
        return type;
    }

    public PatchField<Long> getChannelId() {
        return channelId;
    }

    public PatchField<Long> getGuildId() {
        return guildId;
    }

    public PatchField<String> getName() {
        return name;
    }

    public PatchField<String> getAvatar() {
        return avatar;
    }

    public PatchField<String> getToken() {
        return token;
    }

    public PatchField<Boolean> getApplicationOwned() {
        return applicationOwned;
    }

    /**
     * Checks if the patch changes nothing.
     *
     * @return Boolean.
     */
    public boolean isEmpty() {
        return type.isUnset() && channelId.isUnset() && guildId.isUnset() && name.isUnset()
                && avatar.isUnset() && token.isUnset() && applicationOwned.isUnset();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WebhookPatch)) return false;
        WebhookPatch that = (WebhookPatch) o;
        return type.equals(that.type) && channelId.equals(that.channelId) && guildId.equals(that.guildId)
                && name.equals(that.name) && avatar.equals(that.avatar) && token.equals(that.token)
                && applicationOwned.equals(that.applicationOwned);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, channelId, guildId, name, avatar, token, applicationOwned);
    }

    @Override
    public String toString() {
        return "WebhookPatch{" +
                "type=" + type +
                ", channelId=" + channelId +
                ", guildId=" + guildId +
                ", name=" + name +
                ", avatar=" + avatar +
                ", token=" + (token.isSet() ? "set(***)" : token) +
                ", applicationOwned=" + applicationOwned +
                '}';
    }

    /**
     * WebhookPatch builder.
     */
    public static final class Builder {
        private PatchField<WebhookType> type = PatchField.unset();
        private PatchField<Long> channelId = PatchField.unset();
        private PatchField<Long> guildId = PatchField.unset();
        private PatchField<String> name = PatchField.unset();
        private PatchField<String> avatar = PatchField.unset();
        private PatchField<String> token = PatchField.unset();
        private PatchField<Boolean> applicationOwned = PatchField.unset();

        private Builder() {
        }

        public Builder type(WebhookType type) {
            this.type = PatchField.set(type);
            return this;
        }

        public Builder channelId(long channelId) {
            this.channelId = PatchField.set(channelId);
            return this;
        }

        public Builder guildId(long guildId) {
            this.guildId = PatchField.set(guildId);
            return this;
        }

        public Builder clearGuildId() {
            this.guildId = PatchField.cleared();
            return this;
        }

        public Builder name(String name) {
            this.name = PatchField.set(name);
            return this;
        }

        public Builder clearName() {
            this.name = PatchField.cleared();
            return this;
        }

        public Builder avatar(String avatar) {
            this.avatar = PatchField.set(avatar);
            return this;
        }

        public Builder clearAvatar() {
            this.avatar = PatchField.cleared();
            return this;
        }

        public Builder token(String token) {
            this.token = PatchField.set(token);
            return this;
        }

        public Builder clearToken() {
            this.token = PatchField.cleared();
            return this;
        }

        public Builder applicationOwned(boolean applicationOwned) {
            this.applicationOwned = PatchField.set(applicationOwned);
            return this;
        }

        /**
         * Builds the WebhookPatch instance.
         *
         * @return WebhookPatch instance.
         */
        public WebhookPatch build() {
            return new WebhookPatch(this);
        }
    }
}
