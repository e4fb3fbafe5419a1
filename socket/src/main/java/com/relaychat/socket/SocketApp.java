package com.relaychat.socket;

import com.relaychat.socket.accumulator.BatchAccumulator;
import com.relaychat.socket.bus.RedisBroadcastBus;
import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.consumer.DurableConsumer;
import com.relaychat.socket.consumer.KafkaEventSource;
import com.relaychat.socket.http.HttpServer;
import com.relaychat.socket.kafka.KafkaDurableProducer;
import com.relaychat.socket.metrics.MetricsService;
import com.relaychat.socket.metrics.PrometheusMetricsExporter;
import com.relaychat.socket.pipeline.MessagePipeline;
import com.relaychat.socket.registry.ConnectionFactory;
import com.relaychat.socket.registry.ConnectionRegistry;
import com.relaychat.socket.store.JdbcMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Main entry point for a relay node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at /ws</li>
 *   <li>Rebroadcast submitted messages locally and over the Redis bus</li>
 *   <li>Append every message to Kafka</li>
 *   <li>Consume Kafka and persist messages to PostgreSQL in batches</li>
 *   <li>Expose /healthz, /readyz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class SocketApp {
    private static final Logger log = LoggerFactory.getLogger(SocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting relay node: {}", config.getNodeId());
        log.info("  Kafka: {}", config.getKafkaBootstrap());
        log.info("  Redis: {}", config.getRedisUrl());
        log.info("  Store: {}", config.getJdbcUrl());

        // Setup metrics registry with Prometheus support
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        // Durable path: store <- accumulator <- consumer
        JdbcMessageStore store = JdbcMessageStore.fromConfig(config);
        if (config.isStoreInitSchema()) {
            store.ensureSchema();
        }
        BatchAccumulator accumulator = new BatchAccumulator(config, store, metricsService);
        accumulator.onFlushExhausted(failure -> log.error("Dropped {} records after {} attempts",
            failure.getRecords().size(), failure.getAttempts()));

        KafkaDurableProducer producer = new KafkaDurableProducer(config, metricsService);
        producer.start().block(Duration.ofSeconds(30));

        DurableConsumer consumer = new DurableConsumer(config, new KafkaEventSource(config), accumulator, metricsService);
        consumer.start();

        // Live path
        ConnectionRegistry registry = new ConnectionRegistry(new ConnectionFactory(config), metricsService);
        RedisBroadcastBus bus = new RedisBroadcastBus(config, metricsService);
        MessagePipeline pipeline = new MessagePipeline(config, registry, bus, producer);
        pipeline.start();

        HttpServer httpServer = new HttpServer(config, registry, pipeline, metricsService, metricsExporter);
        httpServer.start();

        log.info("Relay node {} is ready", config.getNodeId());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            // Stop accepting and close client connections
            registry.drainAll();
            pipeline.stop();

            // Flush what was consumed, then stop appending
            consumer.stop(Duration.ofSeconds(30));
            producer.stop().block(Duration.ofSeconds(10));

            bus.close();
            httpServer.stop();

            log.info("Shutdown complete");
        }, "shutdown"));

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }
}
