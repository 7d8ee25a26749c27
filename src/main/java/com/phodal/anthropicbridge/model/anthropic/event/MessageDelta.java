package com.phodal.anthropicbridge.model.anthropic.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.anthropicbridge.model.anthropic.StopReason;
import com.phodal.anthropicbridge.model.anthropic.Usage;

/**
 * Final message-level update. {@code usage} is {@code null} when the finishing chunk carried none.
 */
public record MessageDelta(Delta delta, Usage usage) implements StreamingEvent {

    public static final String TYPE = "message_delta";

    @Override
    public String type() {
        return TYPE;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record Delta(@JsonProperty("stop_reason") StopReason stopReason,
                        @JsonProperty("stop_sequence") String stopSequence) {
    }
}
