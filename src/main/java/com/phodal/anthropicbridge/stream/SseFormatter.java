package com.phodal.anthropicbridge.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.phodal.anthropicbridge.model.anthropic.event.StreamingEvent;

/**
 * Re-encodes Anthropic streaming events as SSE, for callers that relay them to Anthropic clients.
 */
public class SseFormatter {

    private final ObjectWriter writer;

    public SseFormatter(ObjectMapper objectMapper) {
        // message_stop has no fields besides its type
        this.writer = objectMapper.writer().without(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Format event as {@code event: <type>\ndata: <json>\n\n}
     */
    public String format(StreamingEvent event) {
        try {
            return "event: " + event.type() + "\ndata: " + writer.writeValueAsString(event) + "\n\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + event.type() + " event", e);
        }
    }
}
