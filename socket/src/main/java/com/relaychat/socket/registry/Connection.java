package com.relaychat.socket.registry;

import com.relaychat.core.msg.ClientFrame;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A live client channel as seen by the registry.
 * <p>
 * Frames are queued in a bounded sink; the transport drains it at the client's pace.
 * Emission is serialized per connection because broadcasts from different handlers may
 * target the same connection concurrently.
 * </p>
 */
public class Connection {
    @Getter
    private final String id;
    private final Sinks.Many<ClientFrame> sink;
    private final AtomicBoolean alive = new AtomicBoolean(true);

    public Connection(String id, Sinks.Many<ClientFrame> sink) {
        this.id = id;
        this.sink = sink;
    }

    /**
     * Frames still queued when the connection closes are discarded, not flushed.
     */
    public Flux<ClientFrame> getOutboundFlux() {
        return sink.asFlux().filter(frame -> alive.get());
    }

    public boolean isAlive() {
        return alive.get();
    }

    /**
     * Queues a frame without blocking.
     *
     * @param frame Frame to send
     * @return {@link Sinks.EmitResult#FAIL_OVERFLOW} when the buffer is full,
     * {@link Sinks.EmitResult#FAIL_TERMINATED} once closed
     */
    synchronized Sinks.EmitResult send(ClientFrame frame) {
        if (!alive.get()) {
            return Sinks.EmitResult.FAIL_TERMINATED;
        }
        return sink.tryEmitNext(frame);
    }

    /**
     * Marks the connection dead and completes its outbound stream. Idempotent.
     */
    synchronized void close() {
        if (alive.compareAndSet(true, false)) {
            sink.tryEmitComplete();
        }
    }
}
