package com.phodal.anthropicbridge.model.anthropic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnthropicMessage {

    private String role;

    // String, or a list of AnthropicContent / Map content blocks
    private Object content;

    public static AnthropicMessage of(String role, String text) {
        return new AnthropicMessage(role, text);
    }

    public static AnthropicMessage of(String role, List<AnthropicContent> blocks) {
        return new AnthropicMessage(role, blocks);
    }
}
