package com.companya.sensorhub.service;

import com.companya.sensorhub.model.ReplicationState;

/**
 * What a single replication pass did.
 */
public record CycleResult(ReplicationState state, Outcome outcome, int rowsFetched, int documentsWritten) {

    public enum Outcome {
        NO_NEW_ROWS,
        REPLICATED,
        QUERY_FAILED,
        WRITE_FAILED,
        SKIPPED
    }

    static CycleResult skipped(ReplicationState state) {
        return new CycleResult(state, Outcome.SKIPPED, 0, 0);
    }

    static CycleResult queryFailed(ReplicationState state) {
        return new CycleResult(state, Outcome.QUERY_FAILED, 0, 0);
    }
}
