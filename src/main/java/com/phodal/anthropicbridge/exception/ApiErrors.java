package com.phodal.anthropicbridge.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds {@link ApiException}s from upstream error responses and transport failures.
 */
public final class ApiErrors {

    static final String UNKNOWN_ERROR = "Unknown error";

    private final ObjectMapper objectMapper;

    public ApiErrors(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Message comes from {@code {"error":{"message"}}}, {@code {"error":"..."}} or {@code {"message"}},
     * falling back to "Unknown error" when the body is absent or not JSON.
     */
    public ApiException fromResponse(int statusCode, String body) {
        return new ApiException(extractMessage(body), statusCode, body);
    }

    /**
     * Connection errors, timeouts and other failures without a usable response
     */
    public ApiException fromTransportFailure(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ApiException(message, 500, null, cause);
    }

    String extractMessage(String body) {
        if (body == null || body.isBlank()) {
            return UNKNOWN_ERROR;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return UNKNOWN_ERROR;
        }
        if (root == null || !root.isObject()) {
            return UNKNOWN_ERROR;
        }

        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            if (error.isObject()) {
                JsonNode message = error.get("message");
                return message != null && message.isTextual() ? message.asText() : UNKNOWN_ERROR;
            }
            return error.isTextual() ? error.asText() : error.toString();
        }
        JsonNode message = root.get("message");
        if (message != null && !message.isNull()) {
            return message.asText();
        }
        return UNKNOWN_ERROR;
    }
}
