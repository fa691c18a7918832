package com.dosify.node.sync;

public enum ResolutionStrategy {
    USE_LOCAL,
    USE_REMOTE,
    MERGE
}
