package com.phodal.anthropicbridge.model.anthropic;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API Request
 * https://docs.anthropic.com/en/api/messages
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnthropicRequest {
    
    private String model;
    
    private List<AnthropicMessage> messages;
    
    @JsonProperty("max_tokens")
    private Integer maxTokens;
    
    @JsonProperty("stop_sequences")
    private List<String> stopSequences;
    
    private Boolean stream;
    
    // system can be String or List<Map<String, Object>> (content blocks)
    private Object system;
    
    private Double temperature;
    
    @JsonProperty("top_p")
    private Double topP;
    
    private List<AnthropicTool> tools;
    
    // "auto" / "any" / "required" or {"type": "tool", "name": ...}
    @JsonProperty("tool_choice")
    private Object toolChoice;

    /**
     * Extra keys for the outgoing OpenAI payload. Applied last, so they win over computed keys.
     */
    @JsonIgnore
    private Map<String, Object> extraBody;
}
