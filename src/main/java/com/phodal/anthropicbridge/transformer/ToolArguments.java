package com.phodal.anthropicbridge.transformer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Optional;

/**
 * Lenient handling of OpenAI function-call argument strings.
 */
public final class ToolArguments {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ToolArguments(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a JSON object, returning an empty map for blank, malformed or non-object input.
     */
    public Map<String, Object> parseOrEmpty(String arguments) {
        return tryParse(arguments).orElse(Map.of());
    }

    /**
     * Parses a JSON object, or empty when the text is blank, malformed or not an object.
     */
    public Optional<Map<String, Object>> tryParse(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(arguments);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.convertValue(node, MAP_TYPE));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Serializes tool input to a JSON string, {@code "{}"} when absent.
     */
    public String serialize(Object input) {
        if (input == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            return "{}";
        }
    }
}
