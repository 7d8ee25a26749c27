package com.phodal.anthropicbridge.transformer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.anthropicbridge.model.anthropic.Message;
import com.phodal.anthropicbridge.model.anthropic.StopReason;
import com.phodal.anthropicbridge.model.anthropic.TextBlock;
import com.phodal.anthropicbridge.model.anthropic.ToolUseBlock;
import com.phodal.anthropicbridge.model.anthropic.Usage;
import com.phodal.anthropicbridge.model.openai.OpenAIChoice;
import com.phodal.anthropicbridge.model.openai.OpenAIMessage;
import com.phodal.anthropicbridge.model.openai.OpenAIResponse;
import com.phodal.anthropicbridge.model.openai.OpenAIToolCall;
import com.phodal.anthropicbridge.model.openai.OpenAIUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Converts OpenAI Chat Completion responses into Anthropic messages.
 * Never throws on malformed tool arguments; those become an empty input.
 */
public class ResponseTransformer {

    static final String UNKNOWN_MODEL = "unknown";

    private final ToolArguments toolArguments;
    private final Logger log;

    public ResponseTransformer(ObjectMapper objectMapper) {
        this(objectMapper, LoggerFactory.getLogger(ResponseTransformer.class));
    }

    public ResponseTransformer(ObjectMapper objectMapper, Logger log) {
        this.toolArguments = new ToolArguments(objectMapper);
        this.log = log;
    }

    public Message transform(OpenAIResponse response) {
        OpenAIChoice choice = response.getChoices() != null && !response.getChoices().isEmpty()
                ? response.getChoices().get(0)
                : new OpenAIChoice();
        OpenAIMessage message = choice.getMessage() != null ? choice.getMessage() : new OpenAIMessage();

        Message.MessageBuilder builder = Message.builder()
                .id(hasText(response.getId()) ? response.getId() : newMessageId())
                .role("assistant")
                .model(hasText(response.getModel()) ? response.getModel() : UNKNOWN_MODEL)
                .stopReason(StopReason.fromFinishReasonValue(choice.getFinishReason()))
                .usage(toUsage(response.getUsage()));

        if (hasText(message.getContent())) {
            builder.block(new TextBlock(message.getContent()));
        }

        if (message.getToolCalls() != null) {
            for (OpenAIToolCall toolCall : message.getToolCalls()) {
                OpenAIToolCall.Function function = toolCall.getFunction();
                if (function == null) {
                    continue;
                }
                Optional<Map<String, Object>> parsed = toolArguments.tryParse(function.getArguments());
                if (parsed.isEmpty() && hasText(function.getArguments())) {
                    log.warn("Unparseable arguments for tool call {}, using empty input", toolCall.getId());
                }
                Map<String, Object> input = parsed.orElse(Map.of());
                builder.block(new ToolUseBlock(
                        toolCall.getId() != null ? toolCall.getId() : "",
                        function.getName() != null ? function.getName() : "",
                        input));
            }
        }

        Message result = builder.build();
        log.debug("Transformed OpenAI response {} into message with {} content blocks",
                response.getId(), result.getContent().size());
        return result;
    }

    /**
     * Never throws: missing usage is {@link Usage#ZERO} and invalid counts become 0.
     */
    public static Usage toUsage(OpenAIUsage usage) {
        if (usage == null) {
            return Usage.ZERO;
        }
        return new Usage(tokenCount(usage.getPromptTokens()), tokenCount(usage.getCompletionTokens()));
    }

    // absent or negative counts are reported as 0
    private static int tokenCount(Integer count) {
        return count != null && count > 0 ? count : 0;
    }

    /**
     * Synthesized ids use the Anthropic {@code msg_} prefix, distinct from upstream {@code chatcmpl-} ids.
     */
    public static String newMessageId() {
        return "msg_" + UUID.randomUUID().toString().replace("-", "");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
