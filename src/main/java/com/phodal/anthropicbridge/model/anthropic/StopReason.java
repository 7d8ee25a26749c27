package com.phodal.anthropicbridge.model.anthropic;

import com.fasterxml.jackson.annotation.JsonValue;
import com.phodal.anthropicbridge.model.openai.FinishReason;

/**
 * Anthropic {@code stop_reason} vocabulary and its fixed mapping to OpenAI finish reasons.
 */
public enum StopReason {

    END_TURN("end_turn"),
    MAX_TOKENS("max_tokens"),
    STOP_SEQUENCE("stop_sequence"),
    TOOL_USE("tool_use");

    private final String value;

    StopReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public FinishReason toFinishReason() {
        return switch (this) {
            case MAX_TOKENS -> FinishReason.LENGTH;
            case TOOL_USE -> FinishReason.TOOL_CALLS;
            case END_TURN, STOP_SEQUENCE -> FinishReason.STOP;
        };
    }

    public static StopReason fromFinishReason(FinishReason finishReason) {
        return switch (finishReason) {
            case LENGTH -> MAX_TOKENS;
            case TOOL_CALLS, FUNCTION_CALL -> TOOL_USE;
            case STOP, CONTENT_FILTER -> END_TURN;
        };
    }

    /**
     * Maps a raw OpenAI finish reason. {@code null} stays {@code null}; unknown values map to {@link #END_TURN}.
     */
    public static StopReason fromFinishReasonValue(String finishReason) {
        if (finishReason == null) {
            return null;
        }
        return FinishReason.fromValue(finishReason)
                .map(StopReason::fromFinishReason)
                .orElse(END_TURN);
    }
}
