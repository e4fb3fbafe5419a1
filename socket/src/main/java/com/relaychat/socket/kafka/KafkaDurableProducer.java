package com.relaychat.socket.kafka;

import com.relaychat.core.error.AppendException;
import com.relaychat.core.model.AppendAck;
import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.metrics.MetricsService;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Durable producer backed by a Kafka topic.
 * <p>
 * Acknowledgement level follows {@code PRODUCER_ACKS}:
 * <ul>
 *   <li>{@code all}: idempotent producer, every in-sync replica acknowledges</li>
 *   <li>{@code 1}: leader acknowledgement only, an acked event can be lost on leader failover</li>
 * </ul>
 * </p>
 */
public class KafkaDurableProducer implements IDurableProducer {
    private static final Logger log = LoggerFactory.getLogger(KafkaDurableProducer.class);

    private final SocketConfig config;
    private final MetricsService metricsService;
    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;

    public KafkaDurableProducer(SocketConfig config, MetricsService metricsService) {
        this.config = config;
        this.metricsService = metricsService;

        boolean fullAcks = "all".equalsIgnoreCase(config.getProducerAcks());

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, fullAcks ? "all" : config.getProducerAcks());
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, String.valueOf(fullAcks));
        producerProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        producerProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, deliveryTimeoutMs());
        producerProps.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG,
            (int) Math.min(config.getAppendTimeout().toMillis(), deliveryTimeoutMs()));
        producerProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, config.getAppendTimeout().toMillis());

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        log.info("Kafka producer initialized (acks={}, idempotence={})", producerProps.get(ProducerConfig.ACKS_CONFIG),
            fullAcks);
    }

    // delivery.timeout.ms must cover linger + request timeout
    private int deliveryTimeoutMs() {
        return (int) Math.max(config.getAppendTimeout().toMillis(), 1000L);
    }

    @Override
    public Mono<Void> start() {
        return createTopicIfNotExists(config.getChatTopic(), config.getTopicPartitions(), config.getTopicReplication());
    }

    @Override
    public Mono<AppendAck> append(String topic, String correlationKey, String payload) {
        long startNanos = System.nanoTime();
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, correlationKey, payload);

        return sender.send(Mono.just(SenderRecord.create(record, correlationKey)))
            .next()
            .timeout(config.getAppendTimeout())
            .map(result -> {
                if (result.exception() != null) {
                    throw new AppendException(correlationKey, "Broker rejected " + correlationKey, result.exception());
                }
                RecordMetadata metadata = result.recordMetadata();
                return new AppendAck(metadata.topic(), metadata.partition(), metadata.offset());
            })
            .doOnNext(ack -> {
                metricsService.recordAppendOk(startNanos);
                log.debug("Appended {} to {}-{}@{}", correlationKey, ack.getTopic(), ack.getPartition(), ack.getOffset());
            })
            .onErrorMap(err -> !(err instanceof AppendException), err -> {
                String reason = err instanceof TimeoutException
                    ? "No acknowledgement within " + config.getAppendTimeout().toMillis() + "ms"
                    : "Append failed: " + err.getMessage();
                return new AppendException(correlationKey, reason, err);
            })
            .doOnError(err -> metricsService.recordAppendFailed());
    }

    /**
     * Creates a Kafka topic if it doesn't already exist.
     * <p>
     * Idempotent: an existing topic, or one created concurrently by another node, is success.
     * </p>
     *
     * @param topicName         Topic to create
     * @param partitions        Number of partitions
     * @param replicationFactor Replication factor
     * @return Mono completing when topic is created or already exists
     */
    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);

                    return adminClient.createTopics(Collections.singleton(new NewTopic(topicName, partitions, replicationFactor)))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                }).doOnSuccess(v -> log.info("Kafka topic created: {}", topicName));
            })
            .onErrorResume(error -> {
                if (error instanceof TopicExistsException || error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }

                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public Mono<Void> stop() {
        sender.close();
        adminClient.close();
        log.info("Kafka producer stopped");
        return Mono.empty();
    }
}
