package com.mimecast.hookcache.model;

/**
 * Webhook kinds as numbered by the platform.
 */
public enum WebhookType {
    /**
     * Incoming webhook, executable with its token.
     */
    INCOMING(1),

    /**
     * Internal webhook used for followed announcement channels.
     */
    CHANNEL_FOLLOWER(2),

    /**
     * Webhook owned by an application, used with interactions.
     */
    APPLICATION(3);

    private final int code;

    WebhookType(int code) {
        this.code = code;
    }

    /**
     * Gets platform type code.
     *
     * @return Integer.
     */
    public int getCode() {
        return code;
    }

    /**
     * Gets WebhookType for platform type code.
     *
     * @param code Type code.
     * @return WebhookType, {@link #INCOMING} for unknown codes.
     */
    public static WebhookType fromCode(int code) {
        for (WebhookType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return INCOMING;
    }
}
