package com.phodal.anthropicbridge.model.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.List;

/**
 * OpenAI Streaming Chunk Response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpenAIStreamChunk {
    
    private String id;
    
    private String object;
    
    private Long created;
    
    private String model;
    
    private List<OpenAIChoice> choices;
    
    private OpenAIUsage usage;

    /**
     * First choice, or {@code null} when the chunk carries none (usage-only chunks)
     */
    public OpenAIChoice firstChoice() {
        return choices == null || choices.isEmpty() ? null : choices.get(0);
    }
}
