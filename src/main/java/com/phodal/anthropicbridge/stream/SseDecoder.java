package com.phodal.anthropicbridge.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses one framed SSE record into an {@link SseEvent}.
 */
public class SseDecoder {

    private static final String DATA = "data";

    private final ObjectMapper objectMapper;
    private final Logger log;

    public SseDecoder(ObjectMapper objectMapper) {
        this(objectMapper, LoggerFactory.getLogger(SseDecoder.class));
    }

    public SseDecoder(ObjectMapper objectMapper, Logger log) {
        this.objectMapper = objectMapper;
        this.log = log;
    }

    /**
     * @return the decoded event, or empty for a blank or comment-only record
     */
    public Optional<SseEvent> decode(String record) {
        Map<String, String> fields = new LinkedHashMap<>();
        List<String> dataLines = new ArrayList<>();

        for (String rawLine : record.split("\n", -1)) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith(":")) {
                continue;
            }

            int colon = line.indexOf(':');
            String key = colon >= 0 ? line.substring(0, colon).strip() : line;
            String value = colon >= 0 ? line.substring(colon + 1).strip() : "";
            if (DATA.equals(key)) {
                dataLines.add(value);
            } else {
                fields.put(key, value);
            }
        }

        if (dataLines.isEmpty()) {
            return fields.isEmpty() ? Optional.empty() : Optional.of(new SseEvent(Collections.unmodifiableMap(fields), null, false));
        }

        String data = String.join("\n", dataLines);
        fields.put(DATA, data);
        Map<String, String> view = Collections.unmodifiableMap(fields);
        if (SseEvent.DONE_SENTINEL.equals(data)) {
            return Optional.of(SseEvent.doneMarker(view));
        }
        return Optional.of(new SseEvent(view, parsePayload(data), false));
    }

    private JsonNode parsePayload(String data) {
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            log.debug("SSE data is not JSON, keeping raw text: {}", e.getOriginalMessage());
            return TextNode.valueOf(data);
        }
    }
}
