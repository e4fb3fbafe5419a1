package com.relaychat.socket.config;

import com.relaychat.core.msg.Topics;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a socket node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    String nodeId;
    int httpPort;
    String kafkaBootstrap;
    String redisUrl;

    // Log and bus naming
    String chatTopic;
    String consumerGroup;
    String busChannel;
    Duration busPublishTimeout;
    int topicPartitions;
    short topicReplication;

    // Producer
    String producerAcks;           // "1" = leader ack, "all" = full replica ack
    Duration appendTimeout;
    AppendFailurePolicy appendFailurePolicy;

    // Client connections
    int perConnBufferSize;
    int pingInterval;              // seconds
    int idleTimeout;               // seconds

    // Accumulator
    int batchSize;
    int maxBufferedRecords;
    Duration flushInterval;
    int flushMaxRetries;
    Duration flushBackoffBase;
    Duration flushBackoffMax;

    // Consumer
    Duration consumerPollTimeout;
    int consumerMaxPollRecords;
    Duration consumerRetryBase;
    Duration consumerRetryMax;

    // Persistent store
    String jdbcUrl;
    String jdbcUser;
    String jdbcPassword;
    boolean storeInitSchema;

    /**
     * What the ingress path does with a message the durable log did not acknowledge.
     */
    public enum AppendFailurePolicy {
        /**
         * Log and continue; the live broadcast already happened.
         */
        DROP,
        /**
         * Tell the sender the message was not recorded.
         */
        REJECT
    }

    public static SocketConfig fromEnv() {
        return SocketConfig.builder()
                .nodeId(getEnv("NODE_ID", "socket-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .chatTopic(getEnv("CHAT_TOPIC", Topics.CHAT_MESSAGES))
                .consumerGroup(getEnv("CONSUMER_GROUP", Topics.PERSISTER_GROUP))
                .busChannel(getEnv("BUS_CHANNEL", Topics.BROADCAST_CHANNEL))
                .busPublishTimeout(Duration.ofMillis(Long.parseLong(getEnv("BUS_PUBLISH_TIMEOUT_MS", "1000"))))
                .topicPartitions(Integer.parseInt(getEnv("TOPIC_PARTITIONS", "3")))
                .topicReplication(Short.parseShort(getEnv("TOPIC_REPLICATION", "1")))
                .producerAcks(getEnv("PRODUCER_ACKS", "all"))
                .appendTimeout(Duration.ofMillis(Long.parseLong(getEnv("APPEND_TIMEOUT_MS", "5000"))))
                .appendFailurePolicy(AppendFailurePolicy.valueOf(getEnv("APPEND_FAILURE_POLICY", "DROP")))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "100")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL_SEC", "10")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT_SEC", "60")))
                .batchSize(Integer.parseInt(getEnv("BATCH_SIZE", "100")))
                .maxBufferedRecords(Integer.parseInt(getEnv("MAX_BUFFERED_RECORDS", "10000")))
                .flushInterval(Duration.ofMillis(Long.parseLong(getEnv("FLUSH_INTERVAL_MS", "5000"))))
                .flushMaxRetries(Integer.parseInt(getEnv("FLUSH_MAX_RETRIES", "3")))
                .flushBackoffBase(Duration.ofMillis(Long.parseLong(getEnv("FLUSH_BACKOFF_BASE_MS", "200"))))
                .flushBackoffMax(Duration.ofMillis(Long.parseLong(getEnv("FLUSH_BACKOFF_MAX_MS", "5000"))))
                .consumerPollTimeout(Duration.ofMillis(Long.parseLong(getEnv("CONSUMER_POLL_MS", "500"))))
                .consumerMaxPollRecords(Integer.parseInt(getEnv("CONSUMER_MAX_POLL_RECORDS", "500")))
                .consumerRetryBase(Duration.ofMillis(Long.parseLong(getEnv("CONSUMER_RETRY_BASE_MS", "500"))))
                .consumerRetryMax(Duration.ofMillis(Long.parseLong(getEnv("CONSUMER_RETRY_MAX_MS", "30000"))))
                .jdbcUrl(getEnv("JDBC_URL", "jdbc:postgresql://localhost:5432/chat"))
                .jdbcUser(getEnv("JDBC_USER", "chat"))
                .jdbcPassword(getEnv("JDBC_PASSWORD", "chat"))
                .storeInitSchema(Boolean.parseBoolean(getEnv("STORE_INIT_SCHEMA", "true")))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
