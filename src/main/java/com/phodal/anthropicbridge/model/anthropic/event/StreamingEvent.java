package com.phodal.anthropicbridge.model.anthropic.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Anthropic Streaming Events, in the order a well-formed stream produces them:
 * message_start, then per block content_block_start / content_block_delta* / content_block_stop,
 * then message_delta and message_stop.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MessageStart.class, name = MessageStart.TYPE),
        @JsonSubTypes.Type(value = ContentBlockStart.class, name = ContentBlockStart.TYPE),
        @JsonSubTypes.Type(value = ContentBlockDelta.class, name = ContentBlockDelta.TYPE),
        @JsonSubTypes.Type(value = ContentBlockStop.class, name = ContentBlockStop.TYPE),
        @JsonSubTypes.Type(value = MessageDelta.class, name = MessageDelta.TYPE),
        @JsonSubTypes.Type(value = MessageStop.class, name = MessageStop.TYPE)
})
public sealed interface StreamingEvent
        permits MessageStart, ContentBlockStart, ContentBlockDelta, ContentBlockStop, MessageDelta, MessageStop {

    /**
     * Wire name of the event, also used as the SSE {@code event:} field
     */
    String type();
}
