package com.phodal.anthropicbridge.model.anthropic.event;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload of a content_block_delta. Exactly one of {@code text} (text blocks) or {@code input}
 * (tool-use blocks, the full input parsed so far) is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlockDelta(String text, Map<String, Object> input) {

    public static BlockDelta text(String text) {
        return new BlockDelta(text, null);
    }

    public static BlockDelta input(Map<String, Object> input) {
        return new BlockDelta(null, Collections.unmodifiableMap(new LinkedHashMap<>(input)));
    }
}
