package com.relaychat.socket.support;

import com.relaychat.core.model.ChatEvent;
import com.relaychat.socket.consumer.EventSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Partitioned, append-only log kept in memory, with committed offsets per consumer group.
 * <p>
 * Committed offsets outlive the sources that wrote them, so a test can stop a consumer, open
 * a new source for the same group and observe where consumption resumes.
 * </p>
 */
public class InMemoryEventLog {
    private static final int MAX_POLL_RECORDS = 50;

    private final String topic;
    private final List<List<ChatEvent>> partitions = new ArrayList<>();
    private final Map<String, Map<Integer, Long>> committed = new HashMap<>();
    private final AtomicInteger roundRobin = new AtomicInteger();
    private final AtomicBoolean failCommits = new AtomicBoolean(false);
    private final AtomicInteger closedSources = new AtomicInteger();

    public InMemoryEventLog(String topic, int partitionCount) {
        this.topic = topic;
        for (int i = 0; i < partitionCount; i++) {
            partitions.add(new ArrayList<>());
        }
    }

    /**
     * Appends to the partition chosen from the key, like the default Kafka partitioner does.
     */
    public ChatEvent append(String key, String payload) {
        int partition = key == null
            ? Math.floorMod(roundRobin.getAndIncrement(), partitions.size())
            : Math.floorMod(key.hashCode(), partitions.size());
        return appendTo(partition, key, payload);
    }

    public synchronized ChatEvent appendTo(int partition, String key, String payload) {
        List<ChatEvent> events = partitions.get(partition);
        ChatEvent event = ChatEvent.builder()
            .topic(topic)
            .partition(partition)
            .offset(events.size())
            .key(key)
            .payload(payload)
            .timestamp(System.currentTimeMillis())
            .build();
        events.add(event);
        notifyAll();
        return event;
    }

    public synchronized Map<Integer, Long> committedOffsets(String groupId) {
        return Map.copyOf(committed.getOrDefault(groupId, Map.of()));
    }

    public synchronized int size(int partition) {
        return partitions.get(partition).size();
    }

    public void setFailCommits(boolean fail) {
        failCommits.set(fail);
    }

    public int closedSources() {
        return closedSources.get();
    }

    public EventSource openSource(String groupId) {
        return new Source(groupId);
    }

    private final class Source implements EventSource {
        private final String groupId;
        private final Map<Integer, Long> positions = new HashMap<>();
        private final Set<Integer> paused = new HashSet<>();
        private final Set<Integer> assigned = new HashSet<>();
        private RebalanceListener listener;
        private boolean woken;
        private boolean closed;

        private Source(String groupId) {
            this.groupId = groupId;
        }

        @Override
        public void subscribe(String topic, RebalanceListener listener) {
            this.listener = listener;
        }

        @Override
        public List<ChatEvent> poll(Duration timeout) {
            synchronized (InMemoryEventLog.this) {
                if (closed) {
                    throw new IllegalStateException("Source closed");
                }
                if (assigned.isEmpty() && listener != null) {
                    List<Integer> all = new ArrayList<>();
                    for (int p = 0; p < partitions.size(); p++) {
                        all.add(p);
                        assigned.add(p);
                        positions.put(p, committed.getOrDefault(groupId, Map.of()).getOrDefault(p, 0L));
                    }
                    listener.onAssigned(all);
                }

                long deadline = System.currentTimeMillis() + timeout.toMillis();
                while (true) {
                    if (woken) {
                        woken = false;
                        return List.of();
                    }
                    List<ChatEvent> batch = collect();
                    if (!batch.isEmpty()) {
                        return batch;
                    }
                    long remaining = deadline - System.currentTimeMillis();
                    if (remaining <= 0) {
                        return List.of();
                    }
                    try {
                        InMemoryEventLog.this.wait(remaining);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return List.of();
                    }
                }
            }
        }

        private List<ChatEvent> collect() {
            List<ChatEvent> batch = new ArrayList<>();
            for (int p : assigned) {
                if (paused.contains(p)) {
                    continue;
                }
                List<ChatEvent> events = partitions.get(p);
                long position = positions.get(p);
                while (position < events.size() && batch.size() < MAX_POLL_RECORDS) {
                    batch.add(events.get((int) position));
                    position++;
                }
                positions.put(p, position);
            }
            return batch;
        }

        @Override
        public void pause(Collection<Integer> toPause) {
            synchronized (InMemoryEventLog.this) {
                paused.addAll(toPause);
            }
        }

        @Override
        public void resume(Collection<Integer> toResume) {
            synchronized (InMemoryEventLog.this) {
                paused.removeAll(toResume);
            }
        }

        @Override
        public void seek(int partition, long offset) {
            synchronized (InMemoryEventLog.this) {
                positions.put(partition, offset);
            }
        }

        @Override
        public void commit(Map<Integer, Long> nextOffsets) {
            if (failCommits.get()) {
                throw new IllegalStateException("Commit failed: coordinator not available");
            }
            synchronized (InMemoryEventLog.this) {
                committed.computeIfAbsent(groupId, g -> new HashMap<>()).putAll(nextOffsets);
            }
        }

        @Override
        public Map<Integer, Long> committed(Set<Integer> partitionIds) {
            synchronized (InMemoryEventLog.this) {
                Map<Integer, Long> result = new HashMap<>();
                Map<Integer, Long> group = committed.getOrDefault(groupId, Map.of());
                partitionIds.stream().filter(group::containsKey).forEach(p -> result.put(p, group.get(p)));
                return result;
            }
        }

        @Override
        public Set<Integer> assignment() {
            synchronized (InMemoryEventLog.this) {
                return Set.copyOf(assigned);
            }
        }

        @Override
        public void wakeup() {
            synchronized (InMemoryEventLog.this) {
                woken = true;
                InMemoryEventLog.this.notifyAll();
            }
        }

        @Override
        public void close() {
            synchronized (InMemoryEventLog.this) {
                if (!closed) {
                    closed = true;
                    closedSources.incrementAndGet();
                }
            }
        }
    }
}
