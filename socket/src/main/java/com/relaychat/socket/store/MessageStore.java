package com.relaychat.socket.store;

import com.relaychat.core.model.PersistedRecord;

import java.util.List;

/**
 * Persistent store for chat messages.
 */
public interface MessageStore {

    /**
     * Inserts a batch in one transaction. Records whose unique key already exists are skipped.
     *
     * @param records Records in ingestion order
     * @return number of rows actually inserted
     * @throws com.relaychat.core.error.StoreException if the transaction was rolled back
     */
    int insertBatch(List<PersistedRecord> records);

    /**
     * @param limit maximum number of messages
     * @return most recent messages, newest first
     */
    List<PersistedRecord> findRecent(int limit);

    /**
     * Creates the messages table if it does not exist.
     */
    void ensureSchema();
}
