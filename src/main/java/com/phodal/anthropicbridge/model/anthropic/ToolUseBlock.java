package com.phodal.anthropicbridge.model.anthropic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolUseBlock(String id, String name, Map<String, Object> input) implements ContentBlock {

    public ToolUseBlock {
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }
}
