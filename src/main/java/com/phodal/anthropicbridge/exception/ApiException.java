package com.phodal.anthropicbridge.exception;

import lombok.Getter;

/**
 * Error returned by, or raised while calling, the OpenAI-compatible service
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorKind kind;

    private final int statusCode;

    /**
     * Raw response body, {@code null} when there was no response
     */
    private final String responseBody;

    public ApiException(String message, int statusCode, String responseBody) {
        this(message, statusCode, responseBody, null);
    }

    public ApiException(String message, int statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.kind = ErrorKind.fromStatus(statusCode);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public boolean isRateLimit() {
        return kind == ErrorKind.RATE_LIMIT;
    }

    public boolean isAuthError() {
        return kind == ErrorKind.AUTHENTICATION || kind == ErrorKind.PERMISSION_DENIED;
    }
}
