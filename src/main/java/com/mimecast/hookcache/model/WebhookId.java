package com.mimecast.hookcache.model;

/**
 * Webhook identity.
 *
 * <p>Opaque, positive, 64-bit identifier assigned by the platform.
 * <br>The platform transports it as a decimal string which is what {@link #toString()} renders.
 */
public final class WebhookId implements Comparable<WebhookId> {
    private final long value;

    private WebhookId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Webhook id must be positive: " + value);
        }
        this.value = value;
    }

    /**
     * Gets a WebhookId for the given numeric value.
     *
     * @param value Positive identifier.
     * @return WebhookId instance.
     * @throws IllegalArgumentException If value is not positive.
     */
    public static WebhookId of(long value) {
        return new WebhookId(value);
    }

    /**
     * Parses a WebhookId from its decimal string form.
     *
     * @param value Decimal string.
     * @return WebhookId instance.
     * @throws IllegalArgumentException If value is not a positive decimal number.
     */
    public static WebhookId parse(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Webhook id must not be empty");
        }
        try {
            return new WebhookId(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid webhook id: " + value, e);
        }
    }

    /**
     * Gets numeric value.
     *
     * @return Long.
     */
    public long asLong() {
        return value;
    }

    @Override
    public int compareTo(WebhookId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WebhookId)) return false;
        return value == ((WebhookId) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
