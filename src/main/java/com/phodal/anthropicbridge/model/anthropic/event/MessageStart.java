package com.phodal.anthropicbridge.model.anthropic.event;

import com.phodal.anthropicbridge.model.anthropic.Message;

public record MessageStart(Message message) implements StreamingEvent {

    public static final String TYPE = "message_start";

    @Override
    public String type() {
        return TYPE;
    }
}
