package com.relaychat.socket.registry;

import com.relaychat.core.msg.ChatMessage;
import com.relaychat.core.msg.ClientFrame;
import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.metrics.MetricsService;
import com.relaychat.socket.support.TestConfigs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionRegistryTest {

    private ConnectionFactory factory;
    private MetricsService metricsService;
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        SocketConfig config = TestConfigs.defaults("node-a").perConnBufferSize(4).build();
        factory = new ConnectionFactory(config);
        metricsService = new MetricsService(new SimpleMeterRegistry(), config);
        registry = new ConnectionRegistry(factory, metricsService);
    }

    // ========== Membership ==========

    @Test
    void testRegisterAndUnregister() {
        Connection connection = factory.create("c1");

        assertEquals("c1", registry.register(connection));
        assertEquals(1, registry.size());

        registry.unregister("c1");
        assertEquals(0, registry.size());
        assertFalse(connection.isAlive());

        // idempotent
        registry.unregister("c1");
        registry.unregister("unknown");
        assertEquals(0, registry.size());
    }

    @Test
    void testDuplicateId_Rejected() {
        registry.register(factory.create("c1"));

        assertThrows(IllegalStateException.class, () -> registry.register(factory.create("c1")));
        assertEquals(1, registry.size());
    }

    @Test
    void testOpen_AssignsUniqueIds() {
        Connection first = registry.open();
        Connection second = registry.open();

        assertNotEquals(first.getId(), second.getId());
        assertEquals(2, registry.getActiveConnectionIds().size());
    }

    @Test
    void testUnregister_CompletesOutboundAndDiscardsQueuedFrames() {
        Connection connection = registry.open();
        registry.broadcastAll(ChatMessage.relayed("queued"));

        registry.unregister(connection.getId());

        StepVerifier.create(connection.getOutboundFlux())
            .expectComplete()
            .verify(Duration.ofSeconds(1));
        assertFalse(registry.sendTo(connection.getId(), ClientFrame.received("late")));
    }

    @Test
    void testDrainAll_ClosesConnectionsAndRefusesNewOnes() {
        Connection a = registry.open();
        Connection b = registry.open();

        registry.drainAll();

        assertEquals(0, registry.size());
        assertFalse(a.isAlive());
        assertFalse(b.isAlive());
        assertFalse(registry.isAccepting());
        assertThrows(IllegalStateException.class, () -> registry.open());
    }

    // ========== Broadcast ==========

    @Test
    void testBroadcastExceptSender_SkipsSender() {
        Connection sender = registry.open();
        Connection peer1 = registry.open();
        Connection peer2 = registry.open();
        List<ClientFrame> senderFrames = collect(sender);
        List<ClientFrame> peer1Frames = collect(peer1);
        List<ClientFrame> peer2Frames = collect(peer2);

        ChatMessage message = ChatMessage.builder().text("hello").ts(1L).senderId(sender.getId()).build();
        int delivered = registry.broadcastExceptSender(message, sender.getId());

        assertEquals(2, delivered);
        assertTrue(senderFrames.isEmpty());
        assertEquals(1, peer1Frames.size());
        assertEquals("hello", peer1Frames.get(0).getMessage());
        assertEquals(ClientFrame.MESSAGE_RECEIVED, peer1Frames.get(0).getType());
        assertEquals(1, peer2Frames.size());
    }

    @Test
    void testBroadcastAll_ReachesEveryone() {
        List<ClientFrame> frames = collect(registry.open());
        List<ClientFrame> otherFrames = collect(registry.open());

        assertEquals(2, registry.broadcastAll(ChatMessage.relayed("from another node")));
        assertEquals(1, frames.size());
        assertEquals(1, otherFrames.size());
    }

    @Test
    void testSlowConnection_OverflowDroppedForThatConnectionOnly() {
        Connection slow = registry.open();
        Connection fast = registry.open();
        List<ClientFrame> fastFrames = collect(fast);
        slow.getOutboundFlux().subscribe(new BaseSubscriber<>() {
            @Override
            protected void hookOnSubscribe(Subscription subscription) {
                // never requests
            }
        });

        for (int i = 0; i < 20; i++) {
            registry.broadcastAll(ChatMessage.relayed("m" + i));
        }

        assertEquals(20, fastFrames.size());
        assertTrue(metricsService.getDropBufferFullCount() > 0);
        assertTrue(metricsService.getDropBufferFullCount() <= 20 - 4);
    }

    @Test
    void testNoDeliveryAfterUnregister_UnderConcurrentBroadcast() throws Exception {
        Connection leaving = registry.open();
        List<ClientFrame> frames = collect(leaving);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch started = new CountDownLatch(1);

        try {
            for (int t = 0; t < 4; t++) {
                executor.submit(() -> {
                    started.countDown();
                    for (int i = 0; i < 500; i++) {
                        registry.broadcastAll(ChatMessage.relayed("x"));
                    }
                });
            }
            started.await();
            registry.unregister(leaving.getId());
            int seenAtUnregister = frames.size();

            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
            assertEquals(seenAtUnregister, frames.size());
        } finally {
            executor.shutdownNow();
        }
    }

    private static List<ClientFrame> collect(Connection connection) {
        List<ClientFrame> frames = Collections.synchronizedList(new ArrayList<>());
        connection.getOutboundFlux().subscribe(frames::add);
        return frames;
    }
}
