package com.relaychat.core.error;

import com.relaychat.core.model.PersistedRecord;

import java.util.List;

/**
 * A batch could not be written after every retry.
 * <p>
 * Carries the records of the failed batch so the listener can dead-letter them.
 * </p>
 */
public class FlushExhaustedException extends PipelineException {
    private final transient List<PersistedRecord> records;
    private final int attempts;

    public FlushExhaustedException(List<PersistedRecord> records, int attempts, Throwable cause) {
        super(String.format("Flush of %d records failed after %d attempts", records.size(), attempts), cause);
        this.records = List.copyOf(records);
        this.attempts = attempts;
    }

    public List<PersistedRecord> getRecords() {
        return records;
    }

    public int getAttempts() {
        return attempts;
    }
}
