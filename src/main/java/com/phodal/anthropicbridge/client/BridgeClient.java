package com.phodal.anthropicbridge.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.anthropicbridge.config.BridgeProperties;
import com.phodal.anthropicbridge.config.BridgeWebClients;
import com.phodal.anthropicbridge.model.anthropic.AnthropicRequest;
import com.phodal.anthropicbridge.model.anthropic.Message;
import com.phodal.anthropicbridge.service.BridgeMetrics;
import com.phodal.anthropicbridge.service.OpenAIBridgeService;
import com.phodal.anthropicbridge.stream.MessageStream;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Blocking facade over {@link OpenAIBridgeService}.
 *
 * <pre>
 * BridgeClient client = BridgeClient.create(properties);
 * try (MessageStream stream = client.stream(request)) {
 *     for (StreamingEvent event : stream) { ... }
 * }
 * </pre>
 */
public class BridgeClient {

    private final OpenAIBridgeService service;

    public BridgeClient(OpenAIBridgeService service) {
        this.service = service;
    }

    /**
     * Client without a Spring context, reporting metrics to a private registry
     */
    public static BridgeClient create(BridgeProperties properties) {
        ObjectMapper objectMapper = new ObjectMapper();
        BridgeMetrics metrics = new BridgeMetrics(new SimpleMeterRegistry());
        return new BridgeClient(new OpenAIBridgeService(BridgeWebClients.create(properties), objectMapper, metrics));
    }

    /**
     * Blocks until the complete message is available.
     *
     * @throws com.phodal.anthropicbridge.exception.ApiException on upstream or transport failure
     */
    public Message create(AnthropicRequest request) {
        return service.createMessage(request).block();
    }

    /**
     * Nothing is sent until the returned stream is iterated.
     */
    public MessageStream stream(AnthropicRequest request) {
        return new MessageStream(service.streamMessage(request));
    }
}
