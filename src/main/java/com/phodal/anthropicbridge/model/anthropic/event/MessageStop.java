package com.phodal.anthropicbridge.model.anthropic.event;

public record MessageStop() implements StreamingEvent {

    public static final String TYPE = "message_stop";

    @Override
    public String type() {
        return TYPE;
    }
}
