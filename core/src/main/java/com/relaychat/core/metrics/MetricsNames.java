package com.relaychat.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code relay.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Live connections registered on this node.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String CONNECTIONS = "relay.registry.connections";

    /**
     * Counter: Frames handed to a connection's outbound buffer.
     * <p>
     * Tags: nodeId, type (local/relay)
     * </p>
     */
    public static final String DELIVERED_TOTAL = "relay.registry.delivered.total";

    /**
     * Counter: Frames dropped for one connection.
     * <p>
     * Tags: nodeId, reason (buffer_full/closed)
     * </p>
     */
    public static final String DROPS_TOTAL = "relay.registry.drops.total";

    /**
     * Counter: Bus operations.
     * <p>
     * Tags: nodeId, type (published/received/echo_filtered/failed)
     * </p>
     */
    public static final String BUS_TOTAL = "relay.bus.total";

    /**
     * Counter: Log appends.
     * <p>
     * Tags: nodeId, type (ok/failed)
     * </p>
     */
    public static final String APPEND_TOTAL = "relay.log.append.total";

    /**
     * Timer: Time from append call to broker acknowledgement.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String APPEND_LATENCY = "relay.log.append.latency";

    /**
     * Counter: Events absorbed by the accumulator.
     */
    public static final String INGEST_TOTAL = "relay.accumulator.ingest.total";

    /**
     * Counter: Ingest refusals.
     * <p>
     * Tags: reason (buffer_full/closed)
     * </p>
     */
    public static final String INGEST_REJECTED_TOTAL = "relay.accumulator.ingest.rejected.total";

    /**
     * Counter: Records written by flushes (duplicates skipped by the store are not counted).
     */
    public static final String FLUSHED_RECORDS_TOTAL = "relay.accumulator.flushed.records.total";

    /**
     * Counter: Flush outcomes.
     * <p>
     * Tags: type (ok/retry/exhausted)
     * </p>
     */
    public static final String FLUSH_TOTAL = "relay.accumulator.flush.total";

    /**
     * Timer: Duration of one bulk write including retries.
     */
    public static final String FLUSH_LATENCY = "relay.accumulator.flush.latency";

    /**
     * Gauge: Records waiting in the accumulator (buffered plus in flight).
     */
    public static final String BUFFERED = "relay.accumulator.buffered";

    /**
     * Counter: Partition pauses triggered by ingest refusals.
     */
    public static final String CONSUMER_PAUSES_TOTAL = "relay.consumer.pauses.total";

    /**
     * Timer: Lag between log append time and ingest.
     */
    public static final String CONSUMER_LAG_LATENCY = "relay.consumer.lag.latency";

    /**
     * Counter: Bytes received from / sent to WebSocket clients.
     * <p>
     * Tags: nodeId, direction (inbound/outbound)
     * </p>
     */
    public static final String NETWORK_WS_BYTES = "relay.socket.network.ws.bytes";
}
