package com.mimecast.hookcache.http;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.mimecast.hookcache.execute.WebhookMessage;
import com.mimecast.hookcache.model.Webhook;
import com.mimecast.hookcache.model.WebhookId;
import com.mimecast.hookcache.model.WebhookType;

import java.util.ArrayList;
import java.util.List;

/**
 * Webhook wire format.
 *
 * <p>Snowflakes travel as decimal strings, field names are snake case.
 */
public final class WebhookJson {
    private static final Gson gson = new Gson();

    private WebhookJson() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parses a webhook object.
     *
     * @param json JSON string.
     * @return Webhook instance.
     * @throws JsonParseException If the payload is not a webhook.
     */
    public static Webhook parseWebhook(String json) {
        return toWebhook(parseElement(json));
    }

    /**
     * Parses an array of webhook objects.
     *
     * @param json JSON string.
     * @return List of Webhook.
     * @throws JsonParseException If the payload is not an array of webhooks.
     */
    public static List<Webhook> parseWebhooks(String json) {
        JsonElement element = parseElement(json);
        if (!element.isJsonArray()) {
            throw new JsonParseException("Expected a JSON array of webhooks");
        }

        JsonArray array = element.getAsJsonArray();
        List<Webhook> webhooks = new ArrayList<>(array.size());
        for (JsonElement item : array) {
            webhooks.add(toWebhook(item));
        }
        return webhooks;
    }

    /**
     * Maps a JSON element to a webhook.
     *
     * @param element JsonElement.
     * @return Webhook instance.
     */
    static Webhook toWebhook(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            throw new JsonParseException("Expected a JSON webhook object");
        }
        JsonObject object = element.getAsJsonObject();

        String id = string(object, "id");
        if (id == null) {
            throw new JsonParseException("Webhook object has no id");
        }

        Webhook.Builder builder;
        try {
            builder = Webhook.builder(WebhookId.parse(id));
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("Invalid webhook id: " + id, e);
        }

        if (object.has("type") && !object.get("type").isJsonNull()) {
            builder.type(WebhookType.fromCode(object.get("type").getAsInt()));
        }

        String channelId = string(object, "channel_id");
        if (channelId != null) {
            builder.channelId(snowflake(channelId));
        }

        String guildId = string(object, "guild_id");
        builder.guildId(guildId != null ? snowflake(guildId) : null);

        return builder
                .name(string(object, "name"))
                .avatar(string(object, "avatar"))
                .token(string(object, "token"))
                .applicationOwned(string(object, "application_id") != null)
                .build();
    }

    /**
     * Serializes an execute payload.
     * <p>The thread id travels as a query parameter and is not part of the body.
     *
     * @param message WebhookMessage instance.
     * @return JSON string.
     */
    public static String toExecuteBody(WebhookMessage message) {
        JsonObject body = new JsonObject();
        body.addProperty("content", message.getContent());
        message.getUsername().ifPresent(username -> body.addProperty("username", username));
        message.getAvatarUrl().ifPresent(url -> body.addProperty("avatar_url", url));
        if (message.isTts()) {
            body.addProperty("tts", true);
        }
        return gson.toJson(body);
    }

    /**
     * Serializes a create webhook payload.
     *
     * @param name Webhook name.
     * @return JSON string.
     */
    public static String toCreateBody(String name) {
        JsonObject body = new JsonObject();
        body.addProperty("name", name);
        return gson.toJson(body);
    }

    /**
     * Reads the platform error code from an error body.
     *
     * @param json Error body, may be empty.
     * @return Integer, 0 if absent or unreadable.
     */
    static int errorCode(String json) {
        try {
            JsonElement element = gson.fromJson(json, JsonElement.class);
            if (element != null && element.isJsonObject() && element.getAsJsonObject().has("code")) {
                return element.getAsJsonObject().get("code").getAsInt();
            }
        } catch (JsonParseException | NumberFormatException | IllegalStateException | UnsupportedOperationException e) {
            return 0;
        }
        return 0;
    }

    /**
     * Reads the platform error message from an error body.
     *
     * @param json     Error body, may be empty.
     * @param fallback Message used when the body has none.
     * @return String.
     */
    static String errorMessage(String json, String fallback) {
        try {
            JsonElement element = gson.fromJson(json, JsonElement.class);
            if (element != null && element.isJsonObject()) {
                String message = string(element.getAsJsonObject(), "message");
                if (message != null) {
                    return message;
                }
            }
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            return fallback;
        }
        return fallback;
    }

    private static JsonElement parseElement(String json) {
        JsonElement element = gson.fromJson(json, JsonElement.class);
        if (element == null) {
            throw new JsonParseException("Empty JSON payload");
        }
        return element;
    }

    private static String string(JsonObject object, String name) {
        JsonElement value = object.get(name);
        return value == null || value.isJsonNull() ? null : value.getAsString();
    }

    private static long snowflake(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new JsonParseException("Invalid snowflake: " + value, e);
        }
    }
}
