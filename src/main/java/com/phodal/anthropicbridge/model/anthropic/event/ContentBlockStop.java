package com.phodal.anthropicbridge.model.anthropic.event;

public record ContentBlockStop(int index) implements StreamingEvent {

    public static final String TYPE = "content_block_stop";

    @Override
    public String type() {
        return TYPE;
    }
}
