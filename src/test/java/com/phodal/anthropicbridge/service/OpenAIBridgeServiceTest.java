package com.phodal.anthropicbridge.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.anthropicbridge.exception.ApiException;
import com.phodal.anthropicbridge.exception.ErrorKind;
import com.phodal.anthropicbridge.model.anthropic.AnthropicMessage;
import com.phodal.anthropicbridge.model.anthropic.AnthropicRequest;
import com.phodal.anthropicbridge.model.anthropic.StopReason;
import com.phodal.anthropicbridge.model.anthropic.TextBlock;
import com.phodal.anthropicbridge.model.anthropic.Usage;
import com.phodal.anthropicbridge.model.anthropic.event.BlockDelta;
import com.phodal.anthropicbridge.model.anthropic.event.ContentBlockDelta;
import com.phodal.anthropicbridge.model.anthropic.event.MessageStop;
import com.phodal.anthropicbridge.model.anthropic.event.StreamingEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAIBridgeServiceTest {

    private static final String COMPLETION = """
            {"id":"chatcmpl-1","object":"chat.completion","model":"gpt-4o",
             "choices":[{"index":0,"message":{"role":"assistant","content":"Hello!"},"finish_reason":"stop"}],
             "usage":{"prompt_tokens":5,"completion_tokens":2,"total_tokens":7}}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private OpenAIBridgeService service(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://localhost:8080/v1")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return exchange.exchange(request);
                })
                .build();
        return new OpenAIBridgeService(webClient, objectMapper, new BridgeMetrics(registry));
    }

    private static AnthropicRequest request() {
        return AnthropicRequest.builder()
                .model("gpt-4o")
                .maxTokens(100)
                .messages(List.of(AnthropicMessage.of("user", "Hi")))
                .build();
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static ClientResponse eventStream(byte[]... parts) {
        Flux<DataBuffer> body = Flux.fromIterable(Arrays.asList(parts))
                .map(DefaultDataBufferFactory.sharedInstance::wrap);
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                .body(body)
                .build();
    }

    private JsonNode sentBody() throws Exception {
        MockClientHttpRequest mock = new MockClientHttpRequest(HttpMethod.POST, "/");
        lastRequest.get().body().insert(mock, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return objectMapper.readTree(mock.getBodyAsString().block());
    }

    @Test
    void createMessagePostsChatCompletion() throws Exception {
        OpenAIBridgeService service = service(request -> Mono.just(json(HttpStatus.OK, COMPLETION)));

        StepVerifier.create(service.createMessage(request().toBuilder().stream(true).build()))
                .assertNext(message -> {
                    assertThat(message.getId()).isEqualTo("chatcmpl-1");
                    assertThat(message.getContent()).containsExactly(new TextBlock("Hello!"));
                    assertThat(message.getStopReason()).isEqualTo(StopReason.END_TURN);
                    assertThat(message.getUsage()).isEqualTo(new Usage(5, 2));
                })
                .verifyComplete();

        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(lastRequest.get().url().toString()).isEqualTo("http://localhost:8080/v1/chat/completions");
        JsonNode body = sentBody();
        assertThat(body.get("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.get("stream").asBoolean()).isFalse();
        assertThat(body.at("/messages/0/content").asText()).isEqualTo("Hi");

        assertThat(registry.get("bridge.requests").tag("model", "gpt-4o").tag("stream", "false").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("bridge.tokens").tag("direction", "input").counter().count()).isEqualTo(5.0);
        assertThat(registry.get("bridge.request.duration").timer().count()).isEqualTo(1);
    }

    @Test
    void errorStatusBecomesApiException() {
        OpenAIBridgeService service = service(request -> Mono.just(json(HttpStatus.TOO_MANY_REQUESTS,
                "{\"error\":{\"message\":\"Rate limit reached\"}}")));

        StepVerifier.create(service.createMessage(request()))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ApiException.class).hasMessage("Rate limit reached");
                    ApiException apiException = (ApiException) e;
                    assertThat(apiException.isRateLimit()).isTrue();
                    assertThat(apiException.getStatusCode()).isEqualTo(429);
                    assertThat(apiException.getResponseBody()).contains("Rate limit reached");
                })
                .verify();

        assertThat(registry.get("bridge.errors").tag("kind", "RATE_LIMIT").counter().count()).isEqualTo(1.0);
    }

    @Test
    void errorWithoutBodyUsesFallbackMessage() {
        OpenAIBridgeService service = service(request -> Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build()));

        StepVerifier.create(service.createMessage(request()))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ApiException.class).hasMessage("Unknown error");
                    assertThat(((ApiException) e).getKind()).isEqualTo(ErrorKind.INTERNAL_SERVER);
                    assertThat(((ApiException) e).getResponseBody()).isNull();
                })
                .verify();
    }

    @Test
    void transportFailureBecomesInternalServerError() {
        OpenAIBridgeService service = service(request -> Mono.error(new ConnectException("Connection refused")));

        StepVerifier.create(service.createMessage(request()))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ApiException.class).hasMessageContaining("Connection refused");
                    assertThat(((ApiException) e).getKind()).isEqualTo(ErrorKind.INTERNAL_SERVER);
                    assertThat(e.getCause()).isInstanceOf(ConnectException.class);
                })
                .verify();
    }

    @Test
    void unparseableSuccessBodyIsInternalServerError() {
        OpenAIBridgeService service = service(request -> Mono.just(json(HttpStatus.OK, "not json")));

        StepVerifier.create(service.createMessage(request()))
                .expectErrorSatisfies(e -> assertThat(((ApiException) e).getKind()).isEqualTo(ErrorKind.INTERNAL_SERVER))
                .verify();
    }

    @Test
    void nothingIsSentUntilSubscribed() {
        OpenAIBridgeService service = service(request -> Mono.just(json(HttpStatus.OK, COMPLETION)));

        service.createMessage(request());
        service.streamMessage(request());

        assertThat(lastRequest.get()).isNull();
    }

    @Test
    void streamMessageDecodesEventStream() throws Exception {
        byte[] body = """
                data: {"id":"chatcmpl-1","model":"gpt-4o","choices":[{"delta":{"role":"assistant","content":"café"}}]}

                data: {"id":"chatcmpl-1","choices":[{"delta":{},"finish_reason":"stop"}]}

                data: [DONE]

                """.getBytes(StandardCharsets.UTF_8);
        // cut inside the two-byte encoding of the accented character
        int cut = new String(body, StandardCharsets.UTF_8).indexOf('é') + 1;
        OpenAIBridgeService service = service(request -> Mono.just(eventStream(
                Arrays.copyOfRange(body, 0, cut),
                Arrays.copyOfRange(body, cut, body.length))));

        List<StreamingEvent> events = service.streamMessage(request()).collectList().block();

        assertThat(events).hasSize(6);
        assertThat(events).contains(new ContentBlockDelta(0, BlockDelta.text("café")));
        assertThat(events.get(events.size() - 1)).isEqualTo(new MessageStop());
        assertThat(lastRequest.get().headers().getAccept()).containsExactly(MediaType.TEXT_EVENT_STREAM);
        assertThat(sentBody().get("stream").asBoolean()).isTrue();
        assertThat(registry.get("bridge.requests").tag("stream", "true").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("bridge.streams.truncated").counter().count()).isZero();
    }

    @Test
    void streamErrorStatusFailsBeforeAnyEvent() {
        OpenAIBridgeService service = service(request -> Mono.just(json(HttpStatus.UNAUTHORIZED,
                "{\"error\":{\"message\":\"Invalid API key\"}}")));

        StepVerifier.create(service.streamMessage(request()))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ApiException.class).hasMessage("Invalid API key");
                    assertThat(((ApiException) e).isAuthError()).isTrue();
                })
                .verify();
    }

    @Test
    void truncatedStreamIsCounted() {
        byte[] body = "data: {\"id\":\"c\",\"choices\":[{\"delta\":{\"content\":\"par\"}}]}\n\n"
                .getBytes(StandardCharsets.UTF_8);
        OpenAIBridgeService service = service(request -> Mono.just(eventStream(body)));

        StepVerifier.create(service.streamMessage(request()))
                .expectNextCount(3)
                .verifyComplete();

        assertThat(registry.get("bridge.streams.truncated").counter().count()).isEqualTo(1.0);
    }
}
