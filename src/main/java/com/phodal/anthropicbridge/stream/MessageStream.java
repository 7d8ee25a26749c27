package com.phodal.anthropicbridge.stream;

import com.phodal.anthropicbridge.model.anthropic.event.MessageStop;
import com.phodal.anthropicbridge.model.anthropic.event.StreamingEvent;
import reactor.core.publisher.Flux;

import java.util.Iterator;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Blocking, single-pass view over a streaming response.
 * <p>
 * Nothing is requested from the server until {@link #iterator()} is called. Closing the stream
 * cancels the underlying request. Use {@link #isComplete()} after iteration to tell a finished
 * message from a truncated one.
 */
public class MessageStream implements Iterable<StreamingEvent>, AutoCloseable {

    private final Flux<StreamingEvent> events;
    private final AtomicBoolean consumed = new AtomicBoolean(false);
    private volatile boolean complete;
    private volatile Stream<StreamingEvent> stream;

    public MessageStream(Flux<StreamingEvent> events) {
        this.events = events;
    }

    @Override
    public Iterator<StreamingEvent> iterator() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("MessageStream can only be iterated once");
        }
        stream = events
                .doOnNext(event -> {
                    if (event instanceof MessageStop) {
                        complete = true;
                    }
                })
                .toStream(1);
        return stream.iterator();
    }

    /**
     * Whether {@code message_stop} has been received
     */
    public boolean isComplete() {
        return complete;
    }

    @Override
    public void close() {
        Stream<StreamingEvent> current = stream;
        if (current != null) {
            current.close();
        }
    }
}
