package com.mimecast.hookcache.execute;

import org.apache.commons.lang3.StringUtils;

import java.util.Objects;
import java.util.Optional;

/**
 * Name and avatar used to post through a webhook on behalf of a user or guild member.
 *
 * <p>A member's nick and guild avatar take precedence over the user's name and avatar.
 */
public final class AuthorProfile {
    static final String CDN = "https://cdn.discordapp.com";

    private final String name;
    private final String avatarUrl;

    /**
     * Constructs a new AuthorProfile.
     *
     * @param name      Display name.
     * @param avatarUrl Avatar URL, may be null.
     */
    public AuthorProfile(String name, String avatarUrl) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Author name must not be empty");
        }
        this.name = name;
        this.avatarUrl = StringUtils.isBlank(avatarUrl) ? null : avatarUrl;
    }

    /**
     * Profile of a user outside any guild.
     *
     * @param userId     User identifier.
     * @param username   User name.
     * @param avatarHash User avatar hash, may be null.
     * @return AuthorProfile instance.
     */
    public static AuthorProfile ofUser(long userId, String username, String avatarHash) {
        return new AuthorProfile(username, avatarHash != null ? userAvatarUrl(userId, avatarHash) : null);
    }

    /**
     * Profile of a guild member.
     *
     * @param guildId          Guild identifier.
     * @param userId           User identifier.
     * @param username         User name.
     * @param userAvatarHash   User avatar hash, may be null.
     * @param nick             Member nick, may be null.
     * @param memberAvatarHash Guild avatar hash, may be null.
     * @return AuthorProfile instance.
     */
    public static AuthorProfile ofMember(long guildId, long userId, String username, String userAvatarHash,
                                         String nick, String memberAvatarHash) {
        String name = StringUtils.isNotBlank(nick) ? nick : username;

        String avatar = null;
        if (memberAvatarHash != null) {
            avatar = memberAvatarUrl(guildId, userId, memberAvatarHash);
        } else if (userAvatarHash != null) {
            avatar = userAvatarUrl(userId, userAvatarHash);
        }

        return new AuthorProfile(name, avatar);
    }

    /**
     * Gets user avatar CDN URL.
     * <p>Animated hashes keep the png extension which serves the first frame.
     *
     * @param userId     User identifier.
     * @param avatarHash Avatar hash.
     * @return URL string.
     */
    public static String userAvatarUrl(long userId, String avatarHash) {
        return CDN + "/avatars/" + Long.toString(userId) + "/" + avatarHash + ".png";
    }

    /**
     * Gets guild member avatar CDN URL.
     *
     * @param guildId    Guild identifier.
     * @param userId     User identifier.
     * @param avatarHash Avatar hash.
     * @return URL string.
     */
    public static String memberAvatarUrl(long guildId, long userId, String avatarHash) {
        return CDN + "/guilds/" + Long.toString(guildId) + "/users/" + Long.toString(userId) +
                "/avatars/" + avatarHash + ".png";
    }

    public String getName() {
        return name;
    }

    public Optional<String> getAvatarUrl() {
        return Optional.ofNullable(avatarUrl);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuthorProfile)) return false;
        AuthorProfile that = (AuthorProfile) o;
        return name.equals(that.name) && Objects.equals(avatarUrl, that.avatarUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, avatarUrl);
    }

    @Override
    public String toString() {
        return "AuthorProfile{name=" + name + ", avatarUrl=" + avatarUrl + "}";
    }
}
