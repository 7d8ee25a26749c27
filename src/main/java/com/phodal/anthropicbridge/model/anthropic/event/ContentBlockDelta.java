package com.phodal.anthropicbridge.model.anthropic.event;

public record ContentBlockDelta(int index, BlockDelta delta) implements StreamingEvent {

    public static final String TYPE = "content_block_delta";

    @Override
    public String type() {
        return TYPE;
    }
}
