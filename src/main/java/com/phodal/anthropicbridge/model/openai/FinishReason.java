package com.phodal.anthropicbridge.model.openai;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * OpenAI {@code finish_reason} vocabulary
 */
public enum FinishReason {

    STOP("stop"),
    LENGTH("length"),
    TOOL_CALLS("tool_calls"),
    FUNCTION_CALL("function_call"),
    CONTENT_FILTER("content_filter");

    private final String value;

    FinishReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<FinishReason> fromValue(String value) {
        for (FinishReason reason : values()) {
            if (reason.value.equals(value)) {
                return Optional.of(reason);
            }
        }
        return Optional.empty();
    }
}
