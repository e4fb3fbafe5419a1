package com.relaychat.socket.consumer;

import com.relaychat.core.model.ChatEvent;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Consumer-group view of one log topic.
 * <p>
 * Not thread-safe: every method except {@link #wakeup()} must be called from the thread that
 * drives {@link #poll(Duration)}.
 * </p>
 */
public interface EventSource {

    /**
     * Joins the consumer group for a topic. Partition assignments are reported to the
     * listener from inside {@link #poll(Duration)}.
     */
    void subscribe(String topic, RebalanceListener listener);

    /**
     * Fetches the next events of every assigned, non-paused partition.
     * <p>
     * Within a partition events are returned in offset order. Returns an empty list on
     * timeout or after {@link #wakeup()}.
     * </p>
     */
    List<ChatEvent> poll(Duration timeout);

    void pause(Collection<Integer> partitions);

    void resume(Collection<Integer> partitions);

    /**
     * Moves the fetch position of a partition; the next poll starts at {@code offset}.
     */
    void seek(int partition, long offset);

    /**
     * Durably records, per partition, the offset of the next event to consume.
     */
    void commit(Map<Integer, Long> nextOffsets);

    /**
     * @return next offset to consume per partition; partitions without a commit are absent
     */
    Map<Integer, Long> committed(Set<Integer> partitions);

    Set<Integer> assignment();

    /**
     * Interrupts a blocked {@link #poll(Duration)}. Safe to call from any thread.
     */
    void wakeup();

    void close();

    /**
     * Callback for group membership changes.
     */
    interface RebalanceListener {
        void onAssigned(Collection<Integer> partitions);

        void onRevoked(Collection<Integer> partitions);
    }
}
