package com.phodal.anthropicbridge.transformer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phodal.anthropicbridge.model.anthropic.AnthropicContent;
import com.phodal.anthropicbridge.model.anthropic.AnthropicMessage;
import com.phodal.anthropicbridge.model.anthropic.AnthropicRequest;
import com.phodal.anthropicbridge.model.anthropic.AnthropicTool;
import com.phodal.anthropicbridge.model.openai.OpenAIMessage;
import com.phodal.anthropicbridge.model.openai.OpenAIRequest;
import com.phodal.anthropicbridge.model.openai.OpenAITool;
import com.phodal.anthropicbridge.model.openai.OpenAIToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts Anthropic Messages requests into OpenAI Chat Completion requests.
 */
public class RequestTransformer {

    private final ObjectMapper objectMapper;
    private final ToolArguments toolArguments;
    private final Logger log;

    public RequestTransformer(ObjectMapper objectMapper) {
        this(objectMapper, LoggerFactory.getLogger(RequestTransformer.class));
    }

    public RequestTransformer(ObjectMapper objectMapper, Logger log) {
        this.objectMapper = objectMapper;
        this.toolArguments = new ToolArguments(objectMapper);
        this.log = log;
    }

    public OpenAIRequest transform(AnthropicRequest request) {
        OpenAIRequest.OpenAIRequestBuilder builder = OpenAIRequest.builder()
                .model(request.getModel())
                .messages(transformMessages(request.getMessages(), extractSystemText(request.getSystem())))
                .maxTokens(request.getMaxTokens())
                .temperature(request.getTemperature())
                .topP(request.getTopP())
                .stop(request.getStopSequences())
                .stream(request.getStream())
                .extraBody(request.getExtraBody());

        if (request.getTools() != null && !request.getTools().isEmpty()) {
            builder.tools(transformTools(request.getTools()));
        }
        if (request.getToolChoice() != null) {
            builder.toolChoice(transformToolChoice(request.getToolChoice()));
        }

        OpenAIRequest openAIRequest = builder.build();
        log.debug("Transformed Anthropic request for model {} into {} OpenAI messages",
                openAIRequest.getModel(), openAIRequest.getMessages().size());
        return openAIRequest;
    }

    /**
     * Serializes the request and applies {@code extraBody} on top, so caller-supplied keys override computed ones.
     */
    public ObjectNode toPayload(OpenAIRequest request) {
        ObjectNode payload = objectMapper.valueToTree(request);
        if (request.getExtraBody() != null) {
            for (Map.Entry<String, Object> entry : request.getExtraBody().entrySet()) {
                payload.set(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
            }
        }
        return payload;
    }

    private List<OpenAIMessage> transformMessages(List<AnthropicMessage> messages, String systemText) {
        List<OpenAIMessage> result = new ArrayList<>();
        if (systemText != null && !systemText.isEmpty()) {
            result.add(OpenAIMessage.builder().role("system").content(systemText).build());
        }
        if (messages == null) {
            return result;
        }

        for (AnthropicMessage msg : messages) {
            Object content = msg.getContent();
            if (content instanceof String text) {
                result.add(OpenAIMessage.builder().role(msg.getRole()).content(text).build());
            } else if (content instanceof List<?> blocks) {
                List<OpenAIMessage> converted = transformContentBlocks(msg.getRole(), blocks);
                if (converted.isEmpty()) {
                    log.debug("Dropping {} message without text, tool_use or tool_result blocks", msg.getRole());
                }
                result.addAll(converted);
            } else {
                log.debug("Dropping {} message with unsupported content: {}", msg.getRole(), content);
            }
        }
        return result;
    }

    /**
     * Text blocks are joined into one message together with any tool calls; every tool_result becomes
     * its own trailing {@code tool} message.
     */
    private List<OpenAIMessage> transformContentBlocks(String role, List<?> blocks) {
        List<String> textParts = new ArrayList<>();
        List<OpenAIToolCall> toolCalls = new ArrayList<>();
        List<OpenAIMessage> toolResults = new ArrayList<>();

        for (Object raw : blocks) {
            AnthropicContent block = toContent(raw);
            if (block == null || block.getType() == null) {
                continue;
            }

            switch (block.getType()) {
                case "text" -> {
                    if (block.getText() != null) {
                        textParts.add(block.getText());
                    }
                }
                case "tool_use" -> toolCalls.add(OpenAIToolCall.builder()
                        .id(nullToEmpty(block.getId()))
                        .type("function")
                        .function(OpenAIToolCall.Function.builder()
                                .name(nullToEmpty(block.getName()))
                                .arguments(toolArguments.serialize(block.getInput()))
                                .build())
                        .build());
                case "tool_result" -> toolResults.add(OpenAIMessage.builder()
                        .role("tool")
                        .toolCallId(nullToEmpty(block.getToolUseId()))
                        .content(stringify(block.getContent()))
                        .build());
                default -> log.debug("Skipping unsupported content block type: {}", block.getType());
            }
        }

        List<OpenAIMessage> result = new ArrayList<>();
        if (!textParts.isEmpty() || !toolCalls.isEmpty()) {
            OpenAIMessage.OpenAIMessageBuilder main = OpenAIMessage.builder()
                    .role(role)
                    .content(String.join("\n", textParts));
            if (!toolCalls.isEmpty()) {
                main.toolCalls(toolCalls);
            }
            result.add(main.build());
        }
        result.addAll(toolResults);
        return result;
    }

    private AnthropicContent toContent(Object raw) {
        if (raw instanceof AnthropicContent content) {
            return content;
        }
        if (raw instanceof Map<?, ?>) {
            return objectMapper.convertValue(raw, AnthropicContent.class);
        }
        return null;
    }

    private List<OpenAITool> transformTools(List<AnthropicTool> tools) {
        List<OpenAITool> result = new ArrayList<>(tools.size());
        for (AnthropicTool tool : tools) {
            result.add(OpenAITool.builder()
                    .type("function")
                    .function(OpenAITool.FunctionDefinition.builder()
                            .name(nullToEmpty(tool.getName()))
                            .description(nullToEmpty(tool.getDescription()))
                            .parameters(tool.getInputSchema() != null ? tool.getInputSchema() : Map.of())
                            .build())
                    .build());
        }
        return result;
    }

    private Object transformToolChoice(Object toolChoice) {
        if (toolChoice instanceof String choice) {
            return switch (choice) {
                case "any", "required" -> "required";
                default -> "auto";
            };
        }
        if (toolChoice instanceof Map<?, ?> choice
                && "tool".equals(choice.get("type"))
                && choice.get("name") instanceof String name
                && !name.isEmpty()) {
            return Map.of("type", "function", "function", Map.of("name", name));
        }
        return "auto";
    }

    /**
     * System prompt as a plain string or a list of text blocks
     */
    private String extractSystemText(Object system) {
        if (system == null) {
            return null;
        }
        if (system instanceof String text) {
            return text;
        }
        if (system instanceof List<?> blocks) {
            StringBuilder sb = new StringBuilder();
            for (Object block : blocks) {
                AnthropicContent content = toContent(block);
                if (content != null && content.getText() != null) {
                    if (sb.length() > 0) sb.append("\n");
                    sb.append(content.getText());
                }
            }
            return sb.length() > 0 ? sb.toString() : null;
        }
        return system.toString();
    }

    private String stringify(Object content) {
        if (content == null) {
            return "";
        }
        if (content instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize tool_result content: {}", e.getMessage());
            return "";
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
