package com.phodal.anthropicbridge.stream;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * One decoded SSE record.
 *
 * @param fields every {@code key: value} line of the record; repeated {@code data} lines joined by {@code \n}
 * @param data   the data payload as JSON, a text node when it was not valid JSON, {@code null} when absent
 * @param done   {@code true} for the {@code [DONE]} sentinel
 */
public record SseEvent(Map<String, String> fields, JsonNode data, boolean done) {

    public static final String DONE_SENTINEL = "[DONE]";

    public static SseEvent doneMarker(Map<String, String> fields) {
        return new SseEvent(fields, null, true);
    }

    public String field(String name) {
        return fields.get(name);
    }

    public boolean hasJsonObject() {
        return data != null && data.isObject();
    }
}
