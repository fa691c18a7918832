package com.dosify.node.store;

import java.time.Instant;

/**
 * Snapshot of the synchronization state.
 *
 * @param lastSyncTime        completion time of the last replay pass, null if none ran yet
 * @param pendingOperations   writes and deletes waiting for the remote
 * @param unresolvedConflicts conflicts not yet resolved
 * @param remoteAvailable     whether the remote is currently considered reachable
 * @param syncing             whether a replay pass is in progress
 */
public record SyncStatistics(
        Instant lastSyncTime,
        int pendingOperations,
        int unresolvedConflicts,
        boolean remoteAvailable,
        boolean syncing
) {}
