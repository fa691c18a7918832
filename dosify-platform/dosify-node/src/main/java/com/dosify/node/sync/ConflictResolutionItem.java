package com.dosify.node.sync;

import java.time.Instant;
import java.util.Objects;

/**
 * A conflict awaiting (or past) resolution, tied to the record it was detected on.
 */
public record ConflictResolutionItem(
        String id,
        String collection,
        String recordId,
        ConflictData conflictData,
        Instant detectedAt,
        ConflictState state
) {

    public ConflictResolutionItem {
        Objects.requireNonNull(id, "Conflict ID cannot be null");
        Objects.requireNonNull(collection, "Collection cannot be null");
        Objects.requireNonNull(recordId, "Record ID cannot be null");
        Objects.requireNonNull(conflictData, "Conflict data cannot be null");
        Objects.requireNonNull(detectedAt, "Detection time cannot be null");
        state = state != null ? state : ConflictState.DETECTED;
    }

    public ConflictResolutionItem withState(ConflictState newState) {
        return new ConflictResolutionItem(id, collection, recordId, conflictData, detectedAt, newState);
    }
}
