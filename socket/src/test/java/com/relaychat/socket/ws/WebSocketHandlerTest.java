package com.relaychat.socket.ws;

import com.relaychat.core.msg.ClientFrame;
import com.relaychat.core.msg.Topics;
import com.relaychat.core.util.JsonUtils;
import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.http.HttpServer;
import com.relaychat.socket.metrics.MetricsService;
import com.relaychat.socket.metrics.PrometheusMetricsExporter;
import com.relaychat.socket.pipeline.MessagePipeline;
import com.relaychat.socket.registry.ConnectionFactory;
import com.relaychat.socket.registry.ConnectionRegistry;
import com.relaychat.socket.support.Await;
import com.relaychat.socket.support.InMemoryBroadcastBus;
import com.relaychat.socket.support.InMemoryEventLog;
import com.relaychat.socket.support.InMemoryLogProducer;
import com.relaychat.socket.support.TestConfigs;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Drives the node's HTTP surface with real WebSocket clients on an ephemeral port.
 * The log and the bus are in-memory.
 */
class WebSocketHandlerTest {

    private InMemoryLogProducer producer;
    private ConnectionRegistry registry;
    private MessagePipeline pipeline;
    private HttpServer httpServer;
    private int port;
    private final List<TestClient> clients = new ArrayList<>();

    @BeforeEach
    void setUp() {
        SocketConfig config = TestConfigs.defaults("node-ws").build();
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), config);
        PrometheusMetricsExporter exporter = new PrometheusMetricsExporter(new CompositeMeterRegistry(),
            config.getNodeId());

        producer = new InMemoryLogProducer(new InMemoryEventLog(Topics.CHAT_MESSAGES, 2));
        registry = new ConnectionRegistry(new ConnectionFactory(config), metricsService);
        pipeline = new MessagePipeline(config, registry,
            new InMemoryBroadcastBus(new InMemoryBroadcastBus.Hub(), config.getNodeId()), producer);
        pipeline.start();

        httpServer = new HttpServer(config, registry, pipeline, metricsService, exporter);
        port = httpServer.start().port();
    }

    @AfterEach
    void tearDown() {
        clients.forEach(TestClient::close);
        pipeline.stop();
        httpServer.stop();
    }

    // ========== Client channel ==========

    @Test
    @DisplayName("A new client first receives its connection id")
    void testConnect_ConnectedFrameFirst() {
        TestClient client = connect();

        ClientFrame first = client.frames.get(0);
        assertEquals(ClientFrame.CONNECTED, first.getType());
        assertNotNull(first.getConnectionId());
    }

    @Test
    @DisplayName("A submitted message reaches every other client but not its sender")
    void testSubmit_ReachesPeersNotSender() {
        TestClient alice = connect();
        TestClient bob = connect();

        alice.submit("hello");
        Await.until(() -> bob.received().contains("hello"), "bob received hello");

        bob.submit("reply");
        Await.until(() -> alice.received().contains("reply"), "alice received reply");

        // a frame for alice's own message would have been queued before the reply
        assertEquals(List.of("reply"), alice.received());
        assertEquals(List.of("hello"), bob.received());
    }

    @Test
    @DisplayName("A log that times out does not throttle a sender's live frames")
    void testSubmit_StalledLog_LiveFramesNotThrottled() {
        producer.setBrokerDown(true);
        producer.setFailureDelay(Duration.ofSeconds(2));
        TestClient alice = connect();
        TestClient bob = connect();

        alice.submit("m1");
        alice.submit("m2");
        alice.submit("m3");

        Await.until(() -> bob.received().size() == 3, Duration.ofSeconds(1), "all three frames relayed");
        assertEquals(List.of("m1", "m2", "m3"), bob.received());
    }

    @Test
    void testMalformedFrame_IgnoredAndConnectionKept() {
        TestClient alice = connect();
        TestClient bob = connect();

        alice.send("{not json");
        alice.send("{\"type\":\"shout\",\"message\":\"x\"}");
        alice.submit("still here");

        Await.until(() -> bob.received().contains("still here"), "connection survived bad frames");
        assertEquals(List.of("still here"), bob.received());
    }

    // ========== Health endpoints ==========

    @Test
    void testReadiness_FailsAfterDrain() {
        assertEquals(200, status("/healthz"));
        assertEquals(200, status("/readyz"));

        registry.drainAll();

        assertEquals(503, status("/readyz"));
        assertEquals(503, status("/ws"));
        assertEquals(200, status("/healthz"));
    }

    private int status(String path) {
        Integer code = HttpClient.create()
            .get()
            .uri("http://localhost:" + port + path)
            .response()
            .map(response -> response.status().code())
            .block(Duration.ofSeconds(5));
        assertNotNull(code);
        return code;
    }

    private TestClient connect() {
        TestClient client = new TestClient(port);
        clients.add(client);
        Await.until(() -> !client.frames.isEmpty(), "connected frame");
        return client;
    }

    private static final class TestClient {
        private final List<ClientFrame> frames = new CopyOnWriteArrayList<>();
        private final Sinks.Many<String> outgoing = Sinks.many().unicast().onBackpressureBuffer();
        private final Disposable session;

        private TestClient(int port) {
            session = HttpClient.create()
                .websocket()
                .uri("ws://localhost:" + port + "/ws")
                .handle((in, out) -> Mono.when(
                    out.sendString(outgoing.asFlux()),
                    in.receive()
                        .asString()
                        .doOnNext(json -> frames.add(JsonUtils.readValue(json, ClientFrame.class)))
                        .then()
                ))
                .subscribe();
        }

        private void submit(String text) {
            send(JsonUtils.writeValueAsString(
                ClientFrame.builder().type(ClientFrame.SUBMIT_MESSAGE).message(text).build()));
        }

        private void send(String json) {
            outgoing.emitNext(json, Sinks.EmitFailureHandler.FAIL_FAST);
        }

        private List<String> received() {
            List<String> texts = new ArrayList<>();
            for (ClientFrame frame : frames) {
                if (ClientFrame.MESSAGE_RECEIVED.equals(frame.getType())) {
                    texts.add(frame.getMessage());
                }
            }
            return texts;
        }

        private void close() {
            outgoing.tryEmitComplete();
            session.dispose();
        }
    }
}
