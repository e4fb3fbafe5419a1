package com.relaychat.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for outcome or delivery type.
     */
    public static final String TYPE = "type";

    /**
     * Tag key for failure/drop reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for Kafka topic.
     */
    public static final String TOPIC = "topic";

    /**
     * Tag key for traffic direction.
     */
    public static final String DIRECTION = "direction";

}
