package com.relaychat.socket.consumer;

import com.relaychat.core.model.ChatEvent;
import com.relaychat.socket.config.SocketConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link EventSource} over a Kafka consumer group.
 * <p>
 * Auto-commit is off: offsets move only through {@link #commit(Map)}. A group with no
 * committed offset starts from the earliest retained event.
 * </p>
 */
public class KafkaEventSource implements EventSource {
    private static final Logger log = LoggerFactory.getLogger(KafkaEventSource.class);

    private final KafkaConsumer<String, String> consumer;
    private String topic;

    public KafkaEventSource(SocketConfig config) {
        Map<String, Object> consumerProps = new HashMap<>();
        consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, config.getConsumerGroup());
        consumerProps.put(ConsumerConfig.CLIENT_ID_CONFIG, config.getConsumerGroup() + "-" + config.getNodeId());
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        consumerProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, config.getConsumerMaxPollRecords());

        this.consumer = new KafkaConsumer<>(consumerProps);
    }

    @Override
    public void subscribe(String topic, RebalanceListener listener) {
        this.topic = topic;
        consumer.subscribe(List.of(topic), new ConsumerRebalanceListener() {
            @Override
            public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
                listener.onRevoked(toPartitions(partitions));
            }

            @Override
            public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
                listener.onAssigned(toPartitions(partitions));
            }
        });
        log.info("Subscribed to topic {}", topic);
    }

    @Override
    public List<ChatEvent> poll(Duration timeout) {
        try {
            List<ChatEvent> events = new ArrayList<>();
            for (ConsumerRecord<String, String> record : consumer.poll(timeout)) {
                events.add(ChatEvent.builder()
                    .topic(record.topic())
                    .partition(record.partition())
                    .offset(record.offset())
                    .key(record.key())
                    .payload(record.value())
                    .timestamp(record.timestamp())
                    .build());
            }
            return events;
        } catch (WakeupException e) {
            log.debug("Poll interrupted by wakeup");
            return List.of();
        }
    }

    @Override
    public void pause(Collection<Integer> partitions) {
        consumer.pause(toTopicPartitions(partitions));
    }

    @Override
    public void resume(Collection<Integer> partitions) {
        consumer.resume(toTopicPartitions(partitions));
    }

    @Override
    public void seek(int partition, long offset) {
        consumer.seek(new TopicPartition(topic, partition), offset);
    }

    @Override
    public void commit(Map<Integer, Long> nextOffsets) {
        Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
        nextOffsets.forEach((partition, next) -> offsets.put(new TopicPartition(topic, partition), new OffsetAndMetadata(next)));
        try {
            consumer.commitSync(offsets);
        } catch (WakeupException e) {
            // a pending wakeup is meant for poll; the commit still has to go through
            consumer.commitSync(offsets);
        }
    }

    @Override
    public Map<Integer, Long> committed(Set<Integer> partitions) {
        Map<Integer, Long> result = new HashMap<>();
        consumer.committed(Set.copyOf(toTopicPartitions(partitions))).forEach((tp, meta) -> {
            if (meta != null) {
                result.put(tp.partition(), meta.offset());
            }
        });
        return result;
    }

    @Override
    public Set<Integer> assignment() {
        return consumer.assignment().stream().map(TopicPartition::partition).collect(Collectors.toSet());
    }

    @Override
    public void wakeup() {
        consumer.wakeup();
    }

    @Override
    public void close() {
        consumer.close(Duration.ofSeconds(5));
        log.info("Kafka consumer closed");
    }

    private List<TopicPartition> toTopicPartitions(Collection<Integer> partitions) {
        return partitions.stream().map(p -> new TopicPartition(topic, p)).collect(Collectors.toList());
    }

    private static List<Integer> toPartitions(Collection<TopicPartition> partitions) {
        return partitions.stream().map(TopicPartition::partition).collect(Collectors.toList());
    }
}
