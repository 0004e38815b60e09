package com.mimecast.hookcache.http;

import java.io.IOException;
import java.util.OptionalDouble;

/**
 * Non-successful response from the platform REST API.
 */
public class WebhookApiException extends IOException {
    private final int status;
    private final int errorCode;
    private final Double retryAfter;

    /**
     * Constructs a new WebhookApiException.
     *
     * @param status     HTTP status code.
     * @param errorCode  Platform error code, 0 if the body carried none.
     * @param message    Error message.
     * @param retryAfter Seconds to wait before retrying, null if not rate limited.
     */
    public WebhookApiException(int status, int errorCode, String message, Double retryAfter) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
        this.retryAfter = retryAfter;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Gets the platform's JSON error code.
     *
     * @return Integer, 0 if unknown.
     */
    public int getErrorCode() {
        return errorCode;
    }

    /**
     * Gets seconds to wait before retrying.
     *
     * @return OptionalDouble, present for rate limited responses.
     */
    public OptionalDouble getRetryAfter() {
        return retryAfter != null ? OptionalDouble.of(retryAfter) : OptionalDouble.empty();
    }

    public boolean isRateLimited() {
        return status == 429;
    }
}
