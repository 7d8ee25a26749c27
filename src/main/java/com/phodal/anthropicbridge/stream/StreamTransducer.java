package com.phodal.anthropicbridge.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.anthropicbridge.model.anthropic.Message;
import com.phodal.anthropicbridge.model.anthropic.StopReason;
import com.phodal.anthropicbridge.model.anthropic.StreamingMessage;
import com.phodal.anthropicbridge.model.anthropic.TextBlock;
import com.phodal.anthropicbridge.model.anthropic.Usage;
import com.phodal.anthropicbridge.model.anthropic.event.BlockDelta;
import com.phodal.anthropicbridge.model.anthropic.event.ContentBlockDelta;
import com.phodal.anthropicbridge.model.anthropic.event.ContentBlockStart;
import com.phodal.anthropicbridge.model.anthropic.event.ContentBlockStop;
import com.phodal.anthropicbridge.model.anthropic.event.MessageDelta;
import com.phodal.anthropicbridge.model.anthropic.event.MessageStart;
import com.phodal.anthropicbridge.model.anthropic.event.MessageStop;
import com.phodal.anthropicbridge.model.anthropic.event.StreamingEvent;
import com.phodal.anthropicbridge.model.openai.OpenAIChoice;
import com.phodal.anthropicbridge.model.openai.OpenAIMessage;
import com.phodal.anthropicbridge.model.openai.OpenAIStreamChunk;
import com.phodal.anthropicbridge.model.openai.OpenAIToolCall;
import com.phodal.anthropicbridge.transformer.ResponseTransformer;
import com.phodal.anthropicbridge.transformer.ToolArguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns OpenAI chat completion chunks into Anthropic streaming events, one chunk at a time.
 * <p>
 * Owns the in-progress message of exactly one stream. Block indices are dense and assigned in first-seen
 * order; every open block is stopped when the finish reason arrives, followed by message_delta and
 * message_stop. Chunks after that are ignored. A chunk that fails to decode or map is logged and skipped.
 */
public class StreamTransducer {

    private final ObjectMapper objectMapper;
    private final ToolArguments toolArguments;
    private final Logger log;

    private final StreamingMessage message = new StreamingMessage();
    // tool call key -> block index
    private final Map<String, Integer> toolBlocks = new HashMap<>();
    private Integer textBlock;
    private boolean started;
    private boolean finished;

    public StreamTransducer(ObjectMapper objectMapper) {
        this(objectMapper, LoggerFactory.getLogger(StreamTransducer.class));
    }

    public StreamTransducer(ObjectMapper objectMapper, Logger log) {
        this.objectMapper = objectMapper;
        this.toolArguments = new ToolArguments(objectMapper);
        this.log = log;
    }

    /**
     * Decodes the JSON payload of an SSE event as a chunk and processes it.
     */
    public List<StreamingEvent> onEvent(SseEvent event) {
        if (finished || event.done()) {
            return List.of();
        }
        if (!event.hasJsonObject()) {
            log.debug("Ignoring SSE event without a JSON object payload: {}", event.fields());
            return List.of();
        }
        OpenAIStreamChunk chunk;
        try {
            chunk = objectMapper.treeToValue(event.data(), OpenAIStreamChunk.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping undecodable stream chunk: {}", e.getOriginalMessage());
            return List.of();
        }
        return accept(chunk);
    }

    /**
     * Processes one chunk. Events produced before a failure inside the chunk are still returned.
     */
    public List<StreamingEvent> accept(OpenAIStreamChunk chunk) {
        List<StreamingEvent> events = new ArrayList<>();
        if (finished) {
            return events;
        }
        try {
            process(chunk, events);
        } catch (RuntimeException e) {
            log.error("Error processing streaming chunk {}: {}", chunk.getId(), e.getMessage(), e);
        }
        return events;
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * Immutable view of the message accumulated so far
     */
    public Message snapshot() {
        return message.snapshot();
    }

    private void process(OpenAIStreamChunk chunk, List<StreamingEvent> events) {
        OpenAIChoice choice = chunk.firstChoice();
        if (choice == null) {
            log.debug("Ignoring chunk without choices: {}", chunk.getId());
            return;
        }
        OpenAIMessage delta = choice.getDelta() != null ? choice.getDelta() : new OpenAIMessage();

        if (!started) {
            startMessage(chunk, delta.getRole(), events);
        }

        if (delta.getContent() != null && !delta.getContent().isEmpty()) {
            handleText(delta.getContent(), events);
        }

        if (delta.getToolCalls() != null) {
            List<OpenAIToolCall> toolCalls = delta.getToolCalls();
            for (int position = 0; position < toolCalls.size(); position++) {
                OpenAIToolCall toolCall = toolCalls.get(position);
                if (toolCall != null && toolCall.getFunction() != null) {
                    handleToolCall(toolCall, position, events);
                }
            }
        }

        if (choice.getFinishReason() != null && !choice.getFinishReason().isEmpty()) {
            finish(choice.getFinishReason(), chunk, events);
        }
    }

    private void startMessage(OpenAIStreamChunk chunk, String role, List<StreamingEvent> events) {
        message.start(
                hasText(chunk.getId()) ? chunk.getId() : ResponseTransformer.newMessageId(),
                hasText(role) ? role : "assistant",
                hasText(chunk.getModel()) ? chunk.getModel() : "unknown");
        started = true;
        events.add(new MessageStart(message.snapshot()));
    }

    private void handleText(String text, List<StreamingEvent> events) {
        if (textBlock == null) {
            textBlock = message.openTextBlock();
            events.add(new ContentBlockStart(textBlock, new TextBlock("")));
        }
        message.appendText(textBlock, text);
        events.add(new ContentBlockDelta(textBlock, BlockDelta.text(text)));
    }

    private void handleToolCall(OpenAIToolCall toolCall, int position, List<StreamingEvent> events) {
        OpenAIToolCall.Function function = toolCall.getFunction();
        String key = toolCallKey(toolCall, position);

        Integer index = toolBlocks.get(key);
        boolean opened = index == null;
        if (opened) {
            index = message.openToolUseBlock(
                    toolCall.getId() != null ? toolCall.getId() : "",
                    function.getName() != null ? function.getName() : "");
            toolBlocks.put(key, index);
        }

        String arguments = message.appendArguments(index, function.getArguments() != null ? function.getArguments() : "");
        Map<String, Object> input = toolArguments.parseOrEmpty(arguments);
        message.updateInput(index, input);

        if (opened) {
            events.add(new ContentBlockStart(index, message.blockAt(index)));
        }
        events.add(new ContentBlockDelta(index, BlockDelta.input(input)));
    }

    // settle the message before emitting any stop
    private void finish(String finishReason, OpenAIStreamChunk chunk, List<StreamingEvent> events) {
        StopReason stopReason = StopReason.fromFinishReasonValue(finishReason);
        Usage usage = chunk.getUsage() != null ? ResponseTransformer.toUsage(chunk.getUsage()) : null;
        message.finish(stopReason, usage);
        finished = true;

        for (int i = 0; i < message.blockCount(); i++) {
            events.add(new ContentBlockStop(i));
        }
        events.add(new MessageDelta(new MessageDelta.Delta(stopReason, null), message.getUsage()));
        events.add(new MessageStop());
    }

    /**
     * Streamed tool calls are identified by their delta index, falling back to the call id and then
     * to the position inside the delta array.
     */
    private static String toolCallKey(OpenAIToolCall toolCall, int position) {
        if (toolCall.getIndex() != null) {
            return "index:" + toolCall.getIndex();
        }
        if (hasText(toolCall.getId())) {
            return "id:" + toolCall.getId();
        }
        return "position:" + position;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
