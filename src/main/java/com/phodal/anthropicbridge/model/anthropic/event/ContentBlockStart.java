package com.phodal.anthropicbridge.model.anthropic.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.anthropicbridge.model.anthropic.ContentBlock;

public record ContentBlockStart(int index,
                                @JsonProperty("content_block") ContentBlock contentBlock) implements StreamingEvent {

    public static final String TYPE = "content_block_start";

    @Override
    public String type() {
        return TYPE;
    }
}
