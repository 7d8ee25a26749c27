package com.phodal.anthropicbridge.model.anthropic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

/**
 * Request-side content block: {@code text}, {@code tool_use} or {@code tool_result}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnthropicContent {
    
    private String type;
    
    private String text;
    
    private String id;
    
    private String name;
    
    private Object input;
    
    @JsonProperty("tool_use_id")
    private String toolUseId;
    
    // tool_result content: String or a list of blocks
    private Object content;

    @JsonProperty("is_error")
    private Boolean isError;

    public static AnthropicContent text(String text) {
        return AnthropicContent.builder().type("text").text(text).build();
    }

    public static AnthropicContent toolUse(String id, String name, Object input) {
        return AnthropicContent.builder().type("tool_use").id(id).name(name).input(input).build();
    }

    public static AnthropicContent toolResult(String toolUseId, Object content) {
        return AnthropicContent.builder().type("tool_result").toolUseId(toolUseId).content(content).build();
    }
}
