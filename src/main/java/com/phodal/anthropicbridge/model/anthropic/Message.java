package com.phodal.anthropicbridge.model.anthropic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Anthropic Messages API Response
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
public class Message {

    String id;

    @Builder.Default
    String role = "assistant";

    @Singular("block")
    List<ContentBlock> content;

    String model;

    @JsonProperty("stop_reason")
    StopReason stopReason;

    @JsonProperty("stop_sequence")
    String stopSequence;

    Usage usage;

    public String getType() {
        return "message";
    }
}
