package com.companya.sensorhub.integration;

import com.companya.sensorhub.exception.SecondaryStoreException;
import com.companya.sensorhub.model.ReadingDocument;

/**
 * Write side of the searchable store.
 * Allows swapping the HTTP implementation for an in-memory one in tests.
 */
public interface SecondaryStoreClient {

    /**
     * Indexes {@code document} under its document id, replacing any document already stored there.
     *
     * @throws SecondaryStoreException if the store did not confirm the write
     */
    void upsert(ReadingDocument document);

    /**
     * @throws SecondaryStoreException if the store is unreachable
     */
    void ping();
}
