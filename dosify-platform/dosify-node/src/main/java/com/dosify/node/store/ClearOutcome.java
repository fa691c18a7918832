package com.dosify.node.store;

/**
 * Result of {@link TieredStore#clearAll()}, one flag per cleared tier.
 */
public record ClearOutcome(boolean cache, boolean encryptedLocal, boolean plainLocal) {

    public boolean success() {
        return cache && encryptedLocal && plainLocal;
    }
}
