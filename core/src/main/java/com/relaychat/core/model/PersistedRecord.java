package com.relaychat.core.model;

import lombok.Value;

/**
 * Row written to the persistent store.
 * <p>
 * When {@code uniqueKey} is set, inserting a record whose key already exists is a no-op, which
 * makes re-applying a redelivered event idempotent.
 * </p>
 */
@Value
public class PersistedRecord {
    String text;
    String uniqueKey;

    public static PersistedRecord fromEvent(ChatEvent event) {
        return new PersistedRecord(event.getPayload(), UniqueKeys.derive(event.getKey(), event.getPayload()));
    }
}
