package com.phodal.anthropicbridge.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.anthropicbridge.model.anthropic.event.MessageStop;
import com.phodal.anthropicbridge.model.anthropic.event.StreamingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Converts a raw OpenAI SSE body into Anthropic streaming events.
 * <p>
 * Each subscription gets its own framer and transducer, so independent streams share no state.
 * Demand is propagated one item at a time: at most one chunk is read ahead of the consumer.
 * The events of a single chunk are produced together as one batch and then drained as requested.
 * A batch is bounded: one event per content delta, plus one block stop per open block and the
 * {@code message_delta}/{@code message_stop} pair when the chunk carries a finish reason.
 * The result completes after {@code message_stop}, after the {@code [DONE]} sentinel, or when the
 * source completes; a truncated stream simply ends without {@code message_stop}.
 */
public class AnthropicStreamTransformer {

    private final ObjectMapper objectMapper;
    private final SseDecoder decoder;
    private final Logger log;

    public AnthropicStreamTransformer(ObjectMapper objectMapper) {
        this(objectMapper, LoggerFactory.getLogger(AnthropicStreamTransformer.class));
    }

    public AnthropicStreamTransformer(ObjectMapper objectMapper, Logger log) {
        this.objectMapper = objectMapper;
        this.decoder = new SseDecoder(objectMapper, log);
        this.log = log;
    }

    public Flux<StreamingEvent> transform(Flux<String> fragments) {
        return Flux.defer(() -> {
            SseFramer framer = new SseFramer();
            StreamTransducer transducer = new StreamTransducer(objectMapper, log);

            return fragments
                    .doOnComplete(() -> {
                        if (framer.pendingLength() > 0) {
                            log.debug("Discarding {} chars of unterminated SSE data", framer.pendingLength());
                        }
                    })
                    .concatMapIterable(framer::feed, 1)
                    .<SseEvent>handle((record, sink) -> decoder.decode(record).ifPresent(sink::next))
                    .takeWhile(event -> !event.done())
                    .concatMapIterable(transducer::onEvent, 1)
                    .takeUntil(event -> event instanceof MessageStop);
        });
    }
}
