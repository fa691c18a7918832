package com.dosify.node.sync;

import java.time.Instant;

/**
 * Summary of one pass over the pending write queue.
 */
public record SyncResult(
        boolean success,
        String message,
        int operationsProcessed,
        int conflictsDetected,
        int operationsFailed,
        int operationsDiscarded,
        Instant completedAt
) {

    public static SyncResult skipped(String reason) {
        return new SyncResult(false, reason, 0, 0, 0, 0, null);
    }
}
