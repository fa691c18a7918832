package com.dosify.node.sync;

/**
 * Side to take a conflicting field from during a merge.
 */
public enum FieldChoice {
    LOCAL,
    REMOTE
}
