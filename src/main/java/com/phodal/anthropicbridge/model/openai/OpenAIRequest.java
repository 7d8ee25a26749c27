package com.phodal.anthropicbridge.model.openai;

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
 * OpenAI Chat Completion Request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpenAIRequest {
    
    private String model;
    
    private List<OpenAIMessage> messages;
    
    @JsonProperty("max_tokens")
    private Integer maxTokens;
    
    private Double temperature;
    
    @JsonProperty("top_p")
    private Double topP;
    
    private Boolean stream;
    
    private List<String> stop;
    
    private List<OpenAITool> tools;
    
    // "auto" / "required" or {"type": "function", "function": {"name": ...}}
    @JsonProperty("tool_choice")
    private Object toolChoice;

    // merged over the serialized payload, see RequestTransformer#toPayload
    @JsonIgnore
    private Map<String, Object> extraBody;
}
