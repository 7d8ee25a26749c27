package com.phodal.anthropicbridge.service;

import com.phodal.anthropicbridge.exception.ApiException;
import com.phodal.anthropicbridge.model.anthropic.AnthropicRequest;
import com.phodal.anthropicbridge.model.anthropic.ContentBlock;
import com.phodal.anthropicbridge.model.anthropic.Message;
import com.phodal.anthropicbridge.model.anthropic.ToolUseBlock;
import com.phodal.anthropicbridge.model.anthropic.Usage;
import com.phodal.anthropicbridge.model.anthropic.event.ContentBlockStart;
import com.phodal.anthropicbridge.model.anthropic.event.MessageDelta;
import com.phodal.anthropicbridge.model.anthropic.event.StreamingEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Micrometer counters for bridged requests, tool calls, token usage and failures
 */
@Slf4j
public class BridgeMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter truncatedStreamsCounter;

    public BridgeMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.truncatedStreamsCounter = Counter.builder("bridge.streams.truncated")
                .description("Streams that ended without message_stop")
                .register(meterRegistry);
    }

    /**
     * Record a request
     */
    public void recordRequest(AnthropicRequest request) {
        Counter.builder("bridge.requests")
                .description("Total number of requests")
                .tag("model", modelTag(request.getModel()))
                .tag("stream", String.valueOf(Boolean.TRUE.equals(request.getStream())))
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record tool calls and token usage of a complete message
     */
    public void recordMessage(Message message) {
        if (message == null) {
            return;
        }
        for (ContentBlock block : message.getContent()) {
            if (block instanceof ToolUseBlock toolUse) {
                recordToolCall(toolUse.name());
            }
        }
        recordUsage(message.getUsage());
    }

    /**
     * Record tool calls and token usage as they appear on a stream
     */
    public void recordStreamEvent(StreamingEvent event) {
        if (event instanceof ContentBlockStart start && start.contentBlock() instanceof ToolUseBlock toolUse) {
            recordToolCall(toolUse.name());
        } else if (event instanceof MessageDelta delta) {
            recordUsage(delta.usage());
        }
    }

    public void recordError(ApiException e) {
        Counter.builder("bridge.errors")
                .description("Failed requests by error kind")
                .tag("kind", e.getKind().name())
                .register(meterRegistry)
                .increment();
    }

    public void recordTruncatedStream(String model) {
        log.warn("Stream for model {} ended without message_stop", model);
        truncatedStreamsCounter.increment();
    }

    public void recordDuration(String model, boolean stream, Duration duration) {
        Timer.builder("bridge.request.duration")
                .description("Time until the response (or the end of the stream)")
                .tag("model", modelTag(model))
                .tag("stream", String.valueOf(stream))
                .register(meterRegistry)
                .record(duration);
    }

    private void recordToolCall(String toolName) {
        Counter.builder("bridge.tool_calls")
                .description("Tool calls returned by the model")
                .tag("tool", toolName == null || toolName.isEmpty() ? "unknown" : toolName)
                .register(meterRegistry)
                .increment();
    }

    private void recordUsage(Usage usage) {
        if (usage == null) {
            return;
        }
        tokenCounter("input").increment(usage.inputTokens());
        tokenCounter("output").increment(usage.outputTokens());
    }

    private Counter tokenCounter(String direction) {
        return Counter.builder("bridge.tokens")
                .description("Tokens reported by the upstream service")
                .tag("direction", direction)
                .register(meterRegistry);
    }

    private static String modelTag(String model) {
        return model != null ? model : "unknown";
    }
}
