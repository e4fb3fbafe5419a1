package com.relaychat.socket.metrics;

import com.relaychat.core.metrics.MetricsNames;
import com.relaychat.core.metrics.MetricsTags;
import com.relaychat.socket.config.SocketConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics service for a socket node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    // Live broadcast
    private final Counter deliveredLocal;
    private final Counter deliveredRelay;
    private final Counter dropsBufferFull;
    private final Counter dropsClosed;

    // Bus
    private final Counter busPublished;
    private final Counter busReceived;
    private final Counter busEchoFiltered;
    private final Counter busFailed;

    // Durable log
    private final Counter appendOk;
    private final Counter appendFailed;
    private final Timer appendLatency;

    // Accumulator
    private final Counter ingested;
    private final Counter ingestRejectedFull;
    private final Counter ingestRejectedClosed;
    private final Counter flushedRecords;
    private final Counter flushOk;
    private final Counter flushRetry;
    private final Counter flushExhausted;
    private final Timer flushLatency;

    // Consumer
    private final Counter consumerPauses;
    private final Timer consumerLag;

    // Network traffic counters (bytes)
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        deliveredLocal = counter(MetricsNames.DELIVERED_TOTAL, MetricsTags.TYPE, "local",
            "Frames delivered for messages submitted on this node");
        deliveredRelay = counter(MetricsNames.DELIVERED_TOTAL, MetricsTags.TYPE, "relay",
            "Frames delivered for messages relayed from other nodes");
        dropsBufferFull = counter(MetricsNames.DROPS_TOTAL, MetricsTags.REASON, "buffer_full",
            "Frames dropped because a connection's outbound buffer was full");
        dropsClosed = counter(MetricsNames.DROPS_TOTAL, MetricsTags.REASON, "closed",
            "Frames dropped because the connection was closing");

        busPublished = counter(MetricsNames.BUS_TOTAL, MetricsTags.TYPE, "published", "Bus publishes");
        busReceived = counter(MetricsNames.BUS_TOTAL, MetricsTags.TYPE, "received", "Bus deliveries handled");
        busEchoFiltered = counter(MetricsNames.BUS_TOTAL, MetricsTags.TYPE, "echo_filtered",
            "Bus deliveries dropped because this node published them");
        busFailed = counter(MetricsNames.BUS_TOTAL, MetricsTags.TYPE, "failed", "Bus publish failures");

        appendOk = counter(MetricsNames.APPEND_TOTAL, MetricsTags.TYPE, "ok", "Acknowledged log appends");
        appendFailed = counter(MetricsNames.APPEND_TOTAL, MetricsTags.TYPE, "failed", "Failed log appends");
        appendLatency = Timer.builder(MetricsNames.APPEND_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TOPIC, config.getChatTopic())
            .description("Time from append to broker acknowledgement")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(5),
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500)
            )
            .register(registry);

        ingested = Counter.builder(MetricsNames.INGEST_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Events absorbed by the accumulator")
            .register(registry);
        ingestRejectedFull = counter(MetricsNames.INGEST_REJECTED_TOTAL, MetricsTags.REASON, "buffer_full",
            "Events refused because the accumulator was at capacity");
        ingestRejectedClosed = counter(MetricsNames.INGEST_REJECTED_TOTAL, MetricsTags.REASON, "closed",
            "Events refused because the accumulator was closed");
        flushedRecords = Counter.builder(MetricsNames.FLUSHED_RECORDS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Rows inserted by flushes")
            .register(registry);
        flushOk = counter(MetricsNames.FLUSH_TOTAL, MetricsTags.TYPE, "ok", "Successful flushes");
        flushRetry = counter(MetricsNames.FLUSH_TOTAL, MetricsTags.TYPE, "retry", "Retried bulk writes");
        flushExhausted = counter(MetricsNames.FLUSH_TOTAL, MetricsTags.TYPE, "exhausted",
            "Batches escalated after exhausting retries");
        flushLatency = Timer.builder(MetricsNames.FLUSH_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Bulk write duration including retries")
            .publishPercentileHistogram()
            .register(registry);

        consumerPauses = Counter.builder(MetricsNames.CONSUMER_PAUSES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Partition pauses after an ingest refusal")
            .register(registry);
        consumerLag = Timer.builder(MetricsNames.CONSUMER_LAG_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TOPIC, config.getChatTopic())
            .description("Delay between log append and ingest")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(100),
                Duration.ofMillis(500),
                Duration.ofSeconds(1),
                Duration.ofSeconds(5),
                Duration.ofSeconds(30)
            )
            .register(registry);

        networkInboundWs = counter(MetricsNames.NETWORK_WS_BYTES, MetricsTags.DIRECTION, "inbound",
            "Total bytes received from WebSocket clients");
        networkOutboundWs = counter(MetricsNames.NETWORK_WS_BYTES, MetricsTags.DIRECTION, "outbound",
            "Total bytes sent to WebSocket clients");
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return Counter.builder(name)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(tagKey, tagValue)
            .description(description)
            .register(registry);
    }

    /**
     * Registers a gauge backed by a live value.
     *
     * @param name     Metric name
     * @param supplier Current value
     */
    public void gauge(String name, Supplier<Number> supplier) {
        Gauge.builder(name, supplier)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);
    }

    public void recordDeliveredLocal(int frames) {
        deliveredLocal.increment(frames);
    }

    public void recordDeliveredRelay(int frames) {
        deliveredRelay.increment(frames);
    }

    public void recordDropBufferFull() {
        dropsBufferFull.increment();
    }

    public void recordDropClosed() {
        dropsClosed.increment();
    }

    public void recordBusPublished() {
        busPublished.increment();
    }

    public void recordBusReceived() {
        busReceived.increment();
    }

    public void recordBusEchoFiltered() {
        busEchoFiltered.increment();
    }

    public void recordBusFailed() {
        busFailed.increment();
    }

    /**
     * Records an acknowledged append.
     *
     * @param startNanos {@link System#nanoTime()} when the append was issued
     */
    public void recordAppendOk(long startNanos) {
        appendOk.increment();
        appendLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordAppendFailed() {
        appendFailed.increment();
    }

    public void recordIngested() {
        ingested.increment();
    }

    public void recordIngestRejected(boolean retryable) {
        if (retryable) {
            ingestRejectedFull.increment();
        } else {
            ingestRejectedClosed.increment();
        }
    }

    /**
     * Records a completed flush.
     *
     * @param inserted   Rows the store actually inserted
     * @param startNanos {@link System#nanoTime()} when the write started
     */
    public void recordFlushOk(int inserted, long startNanos) {
        flushOk.increment();
        flushedRecords.increment(inserted);
        flushLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordFlushRetry() {
        flushRetry.increment();
    }

    public void recordFlushExhausted(long startNanos) {
        flushExhausted.increment();
        flushLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordConsumerPause() {
        consumerPauses.increment();
    }

    /**
     * Records how far behind the log the consumer is.
     *
     * @param appendMillis log append time of the event
     */
    public void recordConsumerLag(long appendMillis) {
        consumerLag.record(Math.max(0, System.currentTimeMillis() - appendMillis), TimeUnit.MILLISECONDS);
    }

    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
    }

    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }

    public double getFlushExhaustedCount() {
        return flushExhausted.count();
    }

    public double getBusFailedCount() {
        return busFailed.count();
    }

    public double getDropBufferFullCount() {
        return dropsBufferFull.count();
    }

}
