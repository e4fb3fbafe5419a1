package com.relaychat.socket.accumulator;

import com.relaychat.core.error.FlushExhaustedException;
import com.relaychat.core.model.ChatEvent;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Buffers consumed events and writes them to the persistent store in batches.
 */
public interface IBatchAccumulator {

    /**
     * Absorbs one event. Returning normally means the event is owned by the accumulator and
     * its log position may be committed.
     *
     * @param event Consumed event
     * @throws com.relaychat.core.error.IngestException if the event was not absorbed
     */
    void ingest(ChatEvent event);

    /**
     * Writes everything buffered so far as one batch.
     *
     * @return Mono completing once the batch was written or escalated
     */
    Mono<Void> flush();

    /**
     * Registers the handler for batches that could not be written after every retry.
     */
    void onFlushExhausted(Consumer<FlushExhaustedException> listener);

    /**
     * Stops the timer, waits for an in-flight flush and flushes the remainder. Later
     * {@link #ingest(ChatEvent)} calls fail.
     */
    void close();
}
