package com.relaychat.core.model;

import lombok.Value;

/**
 * Durable bookmark of a consumer group on one partition.
 * <p>
 * {@code lastCommittedOffset} is the offset of the last event absorbed by the accumulator, or
 * -1 when nothing has been committed yet. Consumption resumes at {@code lastCommittedOffset + 1}.
 * </p>
 */
@Value
public class ConsumerCursor {
    String groupId;
    int partition;
    long lastCommittedOffset;

    public long nextOffset() {
        return lastCommittedOffset + 1;
    }
}
