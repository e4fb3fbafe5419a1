package com.relaychat.socket.consumer;

import com.relaychat.core.msg.Topics;
import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.metrics.MetricsService;
import com.relaychat.socket.support.Await;
import com.relaychat.socket.support.InMemoryEventLog;
import com.relaychat.socket.support.RecordingAccumulator;
import com.relaychat.socket.support.TestConfigs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives the consumer against an in-memory partitioned log.
 */
class DurableConsumerTest {
    private static final String GROUP = Topics.PERSISTER_GROUP;

    private SocketConfig config;
    private InMemoryEventLog eventLog;
    private RecordingAccumulator accumulator;
    private DurableConsumer consumer;

    @BeforeEach
    void setUp() {
        config = TestConfigs.defaults("node-a")
            .consumerRetryBase(Duration.ofMillis(150))
            .consumerRetryMax(Duration.ofMillis(300))
            .build();
        eventLog = new InMemoryEventLog(config.getChatTopic(), 2);
        accumulator = new RecordingAccumulator();
    }

    @AfterEach
    void tearDown() {
        if (consumer != null) {
            consumer.stop(Duration.ofSeconds(5));
        }
    }

    private DurableConsumer start(RecordingAccumulator target) {
        DurableConsumer started = new DurableConsumer(config, eventLog.openSource(GROUP), target,
            new MetricsService(new SimpleMeterRegistry(), config));
        started.start();
        return started;
    }

    // ========== Ordering and commits ==========

    @Test
    void testEventsIngestedInOffsetOrderPerPartition() {
        for (int i = 0; i < 5; i++) {
            eventLog.appendTo(0, "message-" + i, "p0-" + i);
            eventLog.appendTo(1, "message-" + (100 + i), "p1-" + i);
        }

        consumer = start(accumulator);

        Await.until(() -> accumulator.positions().size() == 10, "all events ingested");
        assertEquals(List.of("0:0", "0:1", "0:2", "0:3", "0:4"), accumulator.positions(0));
        assertEquals(List.of("1:0", "1:1", "1:2", "1:3", "1:4"), accumulator.positions(1));
        Await.until(() -> Map.of(0, 5L, 1, 5L).equals(eventLog.committedOffsets(GROUP)), "offsets committed");
        assertEquals(4L, consumer.cursor(0).getLastCommittedOffset());
        assertEquals(ConsumerState.CONSUMING, consumer.state(0));
    }

    // ========== Pause / resume ==========

    @Test
    @DisplayName("A refused event pauses its partition only and is redelivered after backoff")
    void testRefusal_PausesPartitionAndRedeliversSameEvent() {
        eventLog.appendTo(0, "message-1", "first");
        eventLog.appendTo(0, "message-2", "refused");
        eventLog.appendTo(0, "message-3", "third");
        accumulator.refuseWhile(event -> event.getPartition() == 0 && event.getOffset() == 1);

        consumer = start(accumulator);

        Await.until(() -> consumer.state(0) == ConsumerState.PAUSED, "partition 0 paused");
        assertEquals(List.of("0:0"), accumulator.positions(0));
        // only the absorbed prefix is committed
        Await.until(() -> Long.valueOf(1L).equals(eventLog.committedOffsets(GROUP).get(0)), "prefix committed");

        // partition 1 keeps flowing while 0 is paused
        eventLog.appendTo(1, "message-9", "other partition");
        Await.until(() -> accumulator.positions(1).size() == 1, "partition 1 consumed");
        assertEquals(List.of("0:0"), accumulator.positions(0));

        accumulator.acceptAll();

        Await.until(() -> accumulator.positions(0).size() == 3, "partition 0 resumed");
        assertEquals(List.of("0:0", "0:1", "0:2"), accumulator.positions(0));
        assertEquals(ConsumerState.CONSUMING, consumer.state(0));
        Await.until(() -> Long.valueOf(3L).equals(eventLog.committedOffsets(GROUP).get(0)), "all committed");
    }

    @Test
    void testRepeatedRefusal_KeepsRetryingWithoutSkipping() {
        eventLog.appendTo(0, "message-1", "poison");
        eventLog.appendTo(0, "message-2", "behind poison");
        accumulator.refuseWhile(event -> "poison".equals(event.getPayload()));

        consumer = start(accumulator);

        Await.until(() -> accumulator.refusalCount() >= 3, Duration.ofSeconds(5), "several redeliveries");
        assertTrue(accumulator.positions(0).isEmpty());
        assertNull(eventLog.committedOffsets(GROUP).get(0));

        accumulator.acceptAll();
        Await.until(() -> accumulator.positions(0).size() == 2, "drained after recovery");
        assertEquals(List.of("poison", "behind poison"), accumulator.payloads());
    }

    // ========== Restart ==========

    @Test
    @DisplayName("A restarted consumer resumes after the last committed offset")
    void testRestart_ResumesFromCommittedCursor() {
        for (int i = 0; i < 3; i++) {
            eventLog.appendTo(0, "message-" + i, "before-" + i);
        }
        consumer = start(accumulator);
        Await.until(() -> Long.valueOf(3L).equals(eventLog.committedOffsets(GROUP).get(0)), "first run committed");
        consumer.stop(Duration.ofSeconds(5));

        eventLog.appendTo(0, "message-3", "after-0");
        eventLog.appendTo(0, "message-4", "after-1");

        RecordingAccumulator second = new RecordingAccumulator();
        consumer = start(second);

        Await.until(() -> second.positions(0).size() == 2, "second run consumed new events");
        assertEquals(List.of("0:3", "0:4"), second.positions(0));
        Await.until(() -> consumer.cursor(0).getLastCommittedOffset() == 4L, "cursor advanced");
    }

    @Test
    @DisplayName("Events absorbed but never committed are redelivered after restart")
    void testRestart_UncommittedEventsRedelivered() {
        eventLog.setFailCommits(true);
        eventLog.appendTo(0, "message-1", "a");
        eventLog.appendTo(0, "message-2", "b");

        consumer = start(accumulator);
        Await.until(() -> accumulator.positions(0).size() == 2, "first run ingested");
        consumer.stop(Duration.ofSeconds(5));

        eventLog.setFailCommits(false);
        RecordingAccumulator second = new RecordingAccumulator();
        consumer = start(second);

        Await.until(() -> second.positions(0).size() == 2, "redelivered");
        assertEquals(List.of("a", "b"), second.payloads());
    }

    // ========== Stop ==========

    @Test
    void testStop_ClosesAccumulatorAndSource() {
        eventLog.appendTo(1, "message-1", "x");
        consumer = start(accumulator);
        Await.until(() -> accumulator.positions().size() == 1, "consumed");

        consumer.stop(Duration.ofSeconds(5));

        assertTrue(accumulator.isClosed());
        assertEquals(1, eventLog.closedSources());
        assertEquals(ConsumerState.STOPPED, consumer.state(0));
        assertEquals(ConsumerState.STOPPED, consumer.state(1));
        List<ConsumerState> states = new ArrayList<>(consumer.states().values());
        assertTrue(states.stream().allMatch(ConsumerState.STOPPED::equals));
    }
}
