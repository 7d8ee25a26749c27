package com.phodal.anthropicbridge.model.anthropic;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Usage(@JsonProperty("input_tokens") int inputTokens,
                    @JsonProperty("output_tokens") int outputTokens) {

    public static final Usage ZERO = new Usage(0, 0);

    public Usage {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("token counts must not be negative");
        }
    }
}
