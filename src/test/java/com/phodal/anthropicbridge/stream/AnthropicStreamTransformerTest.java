package com.phodal.anthropicbridge.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.anthropicbridge.model.anthropic.event.BlockDelta;
import com.phodal.anthropicbridge.model.anthropic.event.ContentBlockDelta;
import com.phodal.anthropicbridge.model.anthropic.event.ContentBlockStart;
import com.phodal.anthropicbridge.model.anthropic.event.ContentBlockStop;
import com.phodal.anthropicbridge.model.anthropic.event.MessageDelta;
import com.phodal.anthropicbridge.model.anthropic.event.MessageStart;
import com.phodal.anthropicbridge.model.anthropic.event.MessageStop;
import com.phodal.anthropicbridge.model.anthropic.event.StreamingEvent;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class AnthropicStreamTransformerTest {

    private static final String BODY = """
            data: {"id":"chatcmpl-1","model":"gpt-4o","choices":[{"index":0,"delta":{"role":"assistant"}}]}

            data: {"id":"chatcmpl-1","choices":[{"index":0,"delta":{"content":"Hi"}}]}

            data: {"id":"chatcmpl-1","choices":[{"index":0,"delta":{"content":" there"}}]}

            data: {"id":"chatcmpl-1","choices":[{"index":0,"delta":{},"finish_reason":"stop"}],"usage":{"prompt_tokens":3,"completion_tokens":2}}

            data: [DONE]

            """;

    private final AnthropicStreamTransformer transformer = new AnthropicStreamTransformer(new ObjectMapper());

    private static List<String> split(String text, int size) {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < text.length(); i += size) {
            parts.add(text.substring(i, Math.min(text.length(), i + size)));
        }
        return parts;
    }

    @Test
    void emitsFullEventSequence() {
        StepVerifier.create(transformer.transform(Flux.just(BODY)))
                .assertNext(event -> assertThat(event).isInstanceOf(MessageStart.class))
                .assertNext(event -> assertThat(event).isInstanceOf(ContentBlockStart.class))
                .assertNext(event -> assertThat(event).isInstanceOf(ContentBlockDelta.class))
                .assertNext(event -> assertThat(event).isInstanceOf(ContentBlockDelta.class))
                .expectNext(new ContentBlockStop(0))
                .assertNext(event -> assertThat(event).isInstanceOf(MessageDelta.class))
                .expectNext(new MessageStop())
                .verifyComplete();
    }

    @Test
    void fragmentBoundariesDoNotChangeEvents() {
        List<StreamingEvent> whole = transformer.transform(Flux.just(BODY)).collectList().block();

        for (int size : new int[]{1, 3, 7, 64}) {
            List<StreamingEvent> split = transformer.transform(Flux.fromIterable(split(BODY, size))).collectList().block();
            assertThat(split).as("fragment size %d", size).isEqualTo(whole);
        }
    }

    @Test
    void crlfDelimitedStream() {
        StepVerifier.create(transformer.transform(Flux.just(BODY.replace("\n", "\r\n"))))
                .expectNextCount(7)
                .verifyComplete();
    }

    @Test
    void doneSentinelEndsStreamEvenWithTrailingData() {
        String body = """
                data: {"id":"c","choices":[{"delta":{"content":"a"}}]}

                data: [DONE]

                data: {"id":"c","choices":[{"delta":{"content":"b"}}]}

                """;

        StepVerifier.create(transformer.transform(Flux.just(body)))
                .expectNextCount(3)
                .verifyComplete();
    }

    @Test
    void truncatedStreamEndsWithoutMessageStop() {
        String body = """
                data: {"id":"c","choices":[{"delta":{"role":"assistant","content":"partial"}}]}

                data: {"id":"c","choices":[{"delta":{"content":" cut""";

        List<StreamingEvent> events = transformer.transform(Flux.just(body)).collectList().block();

        assertThat(events).hasSize(3);
        assertThat(events).noneMatch(MessageStop.class::isInstance);
    }

    @Test
    void completesAfterMessageStopWithoutWaitingForSource() {
        AtomicBoolean cancelled = new AtomicBoolean();
        Flux<String> neverEnding = Flux.concat(Flux.just(BODY.replace("data: [DONE]\n\n", "")), Flux.<String>never())
                .doOnCancel(() -> cancelled.set(true));

        StepVerifier.create(transformer.transform(neverEnding))
                .expectNextCount(6)
                .expectNext(new MessageStop())
                .verifyComplete();
        assertThat(cancelled).isTrue();
    }

    @Test
    void honoursDownstreamDemand() {
        StepVerifier.create(transformer.transform(Flux.fromIterable(split(BODY, 5))), 1)
                .assertNext(event -> assertThat(event).isInstanceOf(MessageStart.class))
                .expectNoEvent(Duration.ofMillis(50))
                .thenRequest(2)
                .expectNextCount(2)
                .thenRequest(Long.MAX_VALUE)
                .expectNextCount(4)
                .verifyComplete();
    }

    @Test
    void skipsMalformedChunksAndContinues() {
        String body = """
                data: {"id":"c","choices":[{"delta":{"content":"a"}}]}

                data: {not json}

                data: {"id":"c","choices":"oops"}

                : comment

                data: {"id":"c","choices":[{"delta":{"content":"b"},"finish_reason":"stop"}]}

                """;

        StepVerifier.create(transformer.transform(Flux.just(body)))
                .expectNextCount(3)
                .expectNext(new ContentBlockDelta(0, BlockDelta.text("b")))
                .expectNextCount(3)
                .verifyComplete();
    }

    @Test
    void eachSubscriptionHasItsOwnState() {
        Flux<StreamingEvent> events = transformer.transform(Flux.just(BODY));

        assertThat(events.collectList().block()).hasSize(7);
        assertThat(events.collectList().block()).hasSize(7);
    }

    @Test
    void sourceErrorsPropagate() {
        Flux<String> failing = Flux.concat(Flux.just(split(BODY, 40).get(0)), Flux.error(new IllegalStateException("reset")));

        StepVerifier.create(transformer.transform(failing))
                .expectErrorMessage("reset")
                .verify();
    }
}
