package com.dosify.node.sync;

import java.time.Instant;

/**
 * Audit entry for one resolved conflict.
 */
public record ResolutionRecord(
        String itemId,
        String collection,
        String recordId,
        ResolutionStrategy strategy,
        Instant resolvedAt
) {}
