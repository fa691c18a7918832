package com.dosify.node.store;

/**
 * Storage tier that served a read or took part in a write.
 */
public enum Tier {
    CACHE,
    REMOTE,
    ENCRYPTED_LOCAL,
    PLAIN_LOCAL
}
