package com.phodal.anthropicbridge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phodal.anthropicbridge.exception.ApiErrors;
import com.phodal.anthropicbridge.exception.ApiException;
import com.phodal.anthropicbridge.model.anthropic.AnthropicRequest;
import com.phodal.anthropicbridge.model.anthropic.Message;
import com.phodal.anthropicbridge.model.anthropic.event.MessageStop;
import com.phodal.anthropicbridge.model.anthropic.event.StreamingEvent;
import com.phodal.anthropicbridge.model.openai.OpenAIResponse;
import com.phodal.anthropicbridge.stream.AnthropicStreamTransformer;
import com.phodal.anthropicbridge.transformer.RequestTransformer;
import com.phodal.anthropicbridge.transformer.ResponseTransformer;
import com.phodal.anthropicbridge.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ResolvableType;
import org.springframework.core.codec.StringDecoder;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sends Anthropic-shaped requests to an OpenAI-compatible chat completion endpoint
 */
@Slf4j
public class OpenAIBridgeService {

    static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    // Splits on line ends without stripping them, so multi-byte characters are never cut.
    private static final StringDecoder LINE_DECODER = StringDecoder.allMimeTypes(List.of("\n"), false);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final BridgeMetrics metrics;
    private final RequestTransformer requestTransformer;
    private final ResponseTransformer responseTransformer;
    private final AnthropicStreamTransformer streamTransformer;
    private final ApiErrors apiErrors;

    public OpenAIBridgeService(WebClient webClient, ObjectMapper objectMapper, BridgeMetrics metrics) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.requestTransformer = new RequestTransformer(objectMapper);
        this.responseTransformer = new ResponseTransformer(objectMapper);
        this.streamTransformer = new AnthropicStreamTransformer(objectMapper);
        this.apiErrors = new ApiErrors(objectMapper);
    }

    /**
     * Send non-streaming request
     */
    public Mono<Message> createMessage(AnthropicRequest anthropicRequest) {
        return Mono.defer(() -> {
            AnthropicRequest request = anthropicRequest.toBuilder().stream(false).build();
            ObjectNode payload = requestTransformer.toPayload(requestTransformer.transform(request));
            metrics.recordRequest(request);
            logRequest(payload);
            long start = System.nanoTime();

            return webClient.post()
                    .uri(CHAT_COMPLETIONS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .exchangeToMono(response -> {
                        log.debug("Response status {}", response.statusCode().value());
                        if (!response.statusCode().is2xxSuccessful()) {
                            return this.<String>errorBody(response);
                        }
                        return response.bodyToMono(String.class)
                                .switchIfEmpty(Mono.error(() -> new ApiException("Empty response body",
                                        response.statusCode().value(), null)));
                    })
                    .map(body -> responseTransformer.transform(readResponse(body)))
                    .onErrorMap(e -> !(e instanceof ApiException), apiErrors::fromTransportFailure)
                    .doOnNext(message -> {
                        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                        log.debug("Response {} stop_reason={} usage={} in {} ms", message.getId(),
                                message.getStopReason(), message.getUsage(), elapsed.toMillis());
                        metrics.recordMessage(message);
                        metrics.recordDuration(request.getModel(), false, elapsed);
                    })
                    .doOnError(ApiException.class, this::recordError);
        });
    }

    /**
     * Send streaming request. The returned flux ends after message_stop, or earlier if the upstream
     * stream is truncated.
     */
    public Flux<StreamingEvent> streamMessage(AnthropicRequest anthropicRequest) {
        return Flux.defer(() -> {
            AnthropicRequest request = anthropicRequest.toBuilder().stream(true).build();
            ObjectNode payload = requestTransformer.toPayload(requestTransformer.transform(request));
            metrics.recordRequest(request);
            logRequest(payload);
            long start = System.nanoTime();
            AtomicBoolean stopped = new AtomicBoolean();

            Flux<String> body = webClient.post()
                    .uri(CHAT_COMPLETIONS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(payload)
                    .exchangeToFlux(response -> {
                        log.debug("Stream response status {}", response.statusCode().value());
                        if (!response.statusCode().is2xxSuccessful()) {
                            return this.<String>errorBody(response).flux();
                        }
                        return decodeLines(response.bodyToFlux(DataBuffer.class));
                    })
                    .onErrorMap(e -> !(e instanceof ApiException), apiErrors::fromTransportFailure);

            return streamTransformer.transform(body)
                    .doOnNext(event -> {
                        if (event instanceof MessageStop) {
                            stopped.set(true);
                        }
                        metrics.recordStreamEvent(event);
                    })
                    .doOnComplete(() -> {
                        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                        log.debug("Stream for model {} finished in {} ms", request.getModel(), elapsed.toMillis());
                        metrics.recordDuration(request.getModel(), true, elapsed);
                        if (!stopped.get()) {
                            metrics.recordTruncatedStream(request.getModel());
                        }
                    })
                    .doOnError(ApiException.class, this::recordError);
        });
    }

    private <T> Mono<T> errorBody(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(apiErrors.fromResponse(status, body.isEmpty() ? null : body)));
    }

    private OpenAIResponse readResponse(String body) {
        try {
            return objectMapper.readValue(body, OpenAIResponse.class);
        } catch (JsonProcessingException e) {
            throw new ApiException("Invalid response body: " + e.getOriginalMessage(), 500, body, e);
        }
    }

    private void recordError(ApiException e) {
        log.error("Upstream request failed with status {}: {}", e.getStatusCode(), e.getMessage());
        metrics.recordError(e);
    }

    private void logRequest(ObjectNode payload) {
        if (log.isDebugEnabled()) {
            Map<?, ?> body = objectMapper.convertValue(payload, Map.class);
            log.debug("POST {} {}", CHAT_COMPLETIONS_PATH, LogSanitizer.sanitize(body));
        }
    }

    static Flux<String> decodeLines(Flux<DataBuffer> buffers) {
        return LINE_DECODER.decode(buffers, ResolvableType.forClass(String.class), null, Collections.emptyMap());
    }
}
