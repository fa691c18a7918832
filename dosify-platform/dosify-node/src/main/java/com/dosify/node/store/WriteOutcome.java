package com.dosify.node.store;

import com.dosify.node.sync.ConflictResolutionItem;

import java.util.Map;
import java.util.Optional;

/**
 * Per-tier result of a best-effort write. Tiers are written independently; a failure in one
 * does not undo the others.
 *
 * @param remote   what happened at the remote tier
 * @param local    outcome of each local tier
 * @param conflict conflict surfaced by the remote version check, if any
 */
public record WriteOutcome(
        RemoteOutcome remote,
        Map<Tier, Boolean> local,
        Optional<ConflictResolutionItem> conflict
) {

    public enum RemoteOutcome {
        WRITTEN,
        UNCHANGED,
        QUEUED,
        CONFLICT,
        FAILED
    }

    public WriteOutcome {
        local = Map.copyOf(local);
        conflict = conflict != null ? conflict : Optional.empty();
    }

    public boolean isConflict() {
        return conflict.isPresent();
    }

    public boolean localSucceeded() {
        return !local.isEmpty() && local.values().stream().allMatch(Boolean::booleanValue);
    }

    /**
     * True when the remote accepted the write and every local tier stored it.
     */
    public boolean isFullySynced() {
        return remote == RemoteOutcome.WRITTEN && localSucceeded();
    }
}
