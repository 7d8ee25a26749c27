package com.phodal.anthropicbridge.exception;

/**
 * Error classification by upstream HTTP status
 */
public enum ErrorKind {

    BAD_REQUEST,
    AUTHENTICATION,
    PERMISSION_DENIED,
    NOT_FOUND,
    CONFLICT,
    UNPROCESSABLE_ENTITY,
    RATE_LIMIT,
    INTERNAL_SERVER,
    GENERIC;

    public static ErrorKind fromStatus(int statusCode) {
        return switch (statusCode) {
            case 400 -> BAD_REQUEST;
            case 401 -> AUTHENTICATION;
            case 403 -> PERMISSION_DENIED;
            case 404 -> NOT_FOUND;
            case 409 -> CONFLICT;
            case 422 -> UNPROCESSABLE_ENTITY;
            case 429 -> RATE_LIMIT;
            default -> statusCode >= 500 ? INTERNAL_SERVER : GENERIC;
        };
    }
}
