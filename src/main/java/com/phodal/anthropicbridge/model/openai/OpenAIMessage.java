package com.phodal.anthropicbridge.model.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.List;

/**
 * OpenAI chat message. Also used as the {@code delta} of a streaming choice.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpenAIMessage {

    private String role;

    private String content;

    @JsonProperty("tool_calls")
    private List<OpenAIToolCall> toolCalls;

    @JsonProperty("tool_call_id")
    private String toolCallId;
}
