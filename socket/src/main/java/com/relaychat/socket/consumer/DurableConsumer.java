package com.relaychat.socket.consumer;

import com.relaychat.core.error.IngestException;
import com.relaychat.core.model.ChatEvent;
import com.relaychat.core.model.ConsumerCursor;
import com.relaychat.core.util.JitterBackoff;
import com.relaychat.socket.accumulator.IBatchAccumulator;
import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads the durable log as a member of a consumer group and hands events to the accumulator.
 * <p>
 * Per partition the consumer runs a small state machine:
 * <pre>
 * IDLE -> CONSUMING -> PAUSED -> CONSUMING ...   (any) -> STOPPED
 * </pre>
 * When the accumulator refuses an event the partition is paused at the source, its fetch
 * position is rewound to the refused event and a resume deadline is armed with jittered
 * exponential backoff. On expiry the same event is offered again. Other partitions keep flowing.
 * </p>
 * <p>
 * A partition's cursor only moves past events the accumulator absorbed, so a crash can cause
 * redelivery but never loss.
 * </p>
 * <p>
 * All source access happens on one dedicated loop thread.
 * </p>
 */
public class DurableConsumer {
    private static final Logger log = LoggerFactory.getLogger(DurableConsumer.class);

    private final SocketConfig config;
    private final EventSource source;
    private final IBatchAccumulator accumulator;
    private final MetricsService metricsService;

    private final Map<Integer, PartitionSlot> partitions = new ConcurrentHashMap<>();
    private final Map<Integer, Long> committedOffsets = new ConcurrentHashMap<>();
    private final Object cursorLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch loopExited = new CountDownLatch(1);
    private final Scheduler loopScheduler;

    private volatile boolean running;
    private volatile boolean stopped;

    public DurableConsumer(SocketConfig config, EventSource source, IBatchAccumulator accumulator,
                           MetricsService metricsService) {
        this.config = config;
        this.source = source;
        this.accumulator = accumulator;
        this.metricsService = metricsService;
        this.loopScheduler = Schedulers.newBoundedElastic(1, Integer.MAX_VALUE, "consumer-loop", 60, true);
    }

    /**
     * Joins the group and starts the poll loop.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("Durable consumer already started");
            return;
        }
        running = true;
        String nodeId = config.getNodeId();
        loopScheduler.schedule(() -> {
            MDC.put("nodeId", nodeId);
            try {
                source.subscribe(config.getChatTopic(), new Rebalance());
                runLoop();
            } finally {
                shutdownOnLoopThread();
                MDC.remove("nodeId");
            }
        });
        log.info("Durable consumer started (topic={}, group={})", config.getChatTopic(), config.getConsumerGroup());
    }

    private void runLoop() {
        while (running) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                log.error("Consumer loop iteration failed, retrying after {}ms", config.getConsumerPollTimeout().toMillis(), e);
                sleepQuietly(config.getConsumerPollTimeout());
            }
        }
    }

    /**
     * One loop turn: resume partitions whose deadline passed, poll, hand events over, commit.
     */
    void pollOnce() {
        resumeDuePartitions(System.currentTimeMillis());

        List<ChatEvent> events = source.poll(config.getConsumerPollTimeout());
        if (!running && events.isEmpty()) {
            return;
        }

        synchronized (cursorLock) {
            partitions.values().forEach(PartitionSlot::activate);

            Map<Integer, Long> toCommit = new LinkedHashMap<>();
            for (ChatEvent event : events) {
                PartitionSlot slot = partitions.get(event.getPartition());
                if (slot == null || slot.state != ConsumerState.CONSUMING) {
                    // paused earlier in this batch; the event is fetched again after resume
                    continue;
                }

                try {
                    accumulator.ingest(event);
                } catch (IngestException e) {
                    pause(slot, event, e);
                    continue;
                }

                slot.attempts = 0;
                toCommit.put(event.getPartition(), event.getOffset() + 1);
                metricsService.recordConsumerLag(event.getTimestamp());
            }

            commit(toCommit);
        }
    }

    private void pause(PartitionSlot slot, ChatEvent event, IngestException e) {
        Duration delay = JitterBackoff.next(slot.attempts, config.getConsumerRetryBase(), config.getConsumerRetryMax());
        slot.attempts++;
        slot.state = ConsumerState.PAUSED;
        slot.resumeAt = System.currentTimeMillis() + delay.toMillis();

        source.pause(List.of(slot.partition));
        source.seek(slot.partition, event.getOffset());
        metricsService.recordConsumerPause();

        if (e.isRetryable()) {
            log.warn("Partition {} paused at offset {} for {}ms (attempt {}): {}",
                slot.partition, event.getOffset(), delay.toMillis(), slot.attempts, e.getMessage());
        } else {
            log.error("Partition {} paused at offset {} for {}ms (attempt {}), non-retryable refusal: {}",
                slot.partition, event.getOffset(), delay.toMillis(), slot.attempts, e.getMessage());
        }
    }

    private void resumeDuePartitions(long now) {
        for (PartitionSlot slot : partitions.values()) {
            if (slot.state == ConsumerState.PAUSED && slot.resumeAt <= now) {
                source.resume(List.of(slot.partition));
                slot.state = ConsumerState.CONSUMING;
                log.info("Partition {} resumed after {} attempt(s)", slot.partition, slot.attempts);
            }
        }
    }

    private void commit(Map<Integer, Long> nextOffsets) {
        if (nextOffsets.isEmpty()) {
            return;
        }
        try {
            source.commit(nextOffsets);
            committedOffsets.putAll(nextOffsets);
            log.debug("Committed {}", nextOffsets);
        } catch (RuntimeException e) {
            log.warn("Commit of {} failed, events will be redelivered: {}", nextOffsets, e.getMessage());
        }
    }

    /**
     * Stops the loop, closes the accumulator (flushing what it holds) and leaves the group.
     * Blocks until done or the timeout elapsed.
     *
     * @param timeout Maximum time to wait for the loop thread
     */
    public void stop(Duration timeout) {
        if (stopped) {
            loopScheduler.dispose();
            return;
        }
        log.info("Stopping durable consumer");
        running = false;

        if (!started.get()) {
            synchronized (cursorLock) {
                accumulator.close();
            }
            markStopped();
            return;
        }

        source.wakeup();
        try {
            if (!loopExited.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Consumer loop did not exit within {}ms", timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for consumer loop to exit");
        }
        loopScheduler.dispose();
    }

    private void shutdownOnLoopThread() {
        try {
            synchronized (cursorLock) {
                accumulator.close();
            }
        } catch (RuntimeException e) {
            log.error("Accumulator close failed", e);
        }
        try {
            source.close();
        } catch (RuntimeException e) {
            log.warn("Event source close failed: {}", e.getMessage());
        }
        markStopped();
        loopExited.countDown();
        log.info("Durable consumer stopped");
    }

    private void markStopped() {
        stopped = true;
        partitions.values().forEach(slot -> slot.state = ConsumerState.STOPPED);
    }

    /**
     * @return current state of a partition; {@code STOPPED} after shutdown, {@code IDLE} when unassigned
     */
    public ConsumerState state(int partition) {
        if (stopped) {
            return ConsumerState.STOPPED;
        }
        PartitionSlot slot = partitions.get(partition);
        return slot != null ? slot.state : ConsumerState.IDLE;
    }

    public Map<Integer, ConsumerState> states() {
        Map<Integer, ConsumerState> snapshot = new HashMap<>();
        partitions.forEach((partition, slot) -> snapshot.put(partition, slot.state));
        return snapshot;
    }

    /**
     * @return the last cursor this consumer committed (or found committed) for a partition
     */
    public ConsumerCursor cursor(int partition) {
        long next = committedOffsets.getOrDefault(partition, 0L);
        return new ConsumerCursor(config.getConsumerGroup(), partition, next - 1);
    }

    private static void sleepQuietly(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private final class Rebalance implements EventSource.RebalanceListener {
        @Override
        public void onAssigned(Collection<Integer> assigned) {
            Map<Integer, Long> committed = source.committed(Set.copyOf(assigned));
            for (Integer partition : assigned) {
                partitions.put(partition, new PartitionSlot(partition));
                Long next = committed.get(partition);
                if (next != null) {
                    committedOffsets.put(partition, next);
                }
            }
            log.info("Partitions assigned: {} (committed: {})", assigned, committed);
        }

        @Override
        public void onRevoked(Collection<Integer> revoked) {
            revoked.forEach(partitions::remove);
            log.info("Partitions revoked: {}", revoked);
        }
    }

    private static final class PartitionSlot {
        private final int partition;
        private volatile ConsumerState state = ConsumerState.IDLE;
        private int attempts;
        private long resumeAt;

        private PartitionSlot(int partition) {
            this.partition = partition;
        }

        private void activate() {
            if (state == ConsumerState.IDLE) {
                state = ConsumerState.CONSUMING;
                log.info("Partition {} consuming", partition);
            }
        }
    }
}
