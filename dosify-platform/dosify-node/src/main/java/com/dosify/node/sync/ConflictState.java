package com.dosify.node.sync;

/**
 * Lifecycle of a detected conflict. A conflict is always presented before it is resolved.
 */
public enum ConflictState {
    DETECTED,
    PRESENTED,
    RESOLVED
}
