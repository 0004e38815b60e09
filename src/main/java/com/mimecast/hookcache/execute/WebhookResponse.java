package com.mimecast.hookcache.execute;

/**
 * Simple immutable container for webhook execution responses.
 */
public class WebhookResponse {
    private final int statusCode;
    private final String body;
    private final boolean success;

    /**
     * Constructs a new WebhookResponse.
     *
     * @param statusCode HTTP status code returned by the platform.
     * @param body       Raw response body, the created message as JSON when the sender waited for it, else empty.
     * @param success    Whether the call is considered successful (2xx range).
     */
    public WebhookResponse(int statusCode, String body, boolean success) {
        this.statusCode = statusCode;
        this.body = body != null ? body : "";
        this.success = success;
    }

    /**
     * Gets the HTTP status code.
     *
     * @return HTTP status code as int.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Gets the raw response body.
     *
     * @return Response body string, never null.
     */
    public String getBody() {
        return body;
    }

    /**
     * Indicates whether the execution was considered successful.
     *
     * @return true if successful, false otherwise.
     */
    public boolean isSuccess() {
        return success;
    }

    @Override
    public String toString() {
        return "WebhookResponse{statusCode=" + statusCode + ", success=" + success + ", body=" + body.length() + " chars}";
    }
}
