package com.dosify.node.store;

import com.dosify.node.kv.KeyValueStore;
import com.dosify.node.record.FieldValue;
import com.dosify.node.record.Records;

import java.util.Map;

/**
 * Unencrypted fallback tier, read only when the encrypted tier is empty or unreadable.
 */
public class PlainLocalTier extends LocalTier {

    static final String TIER_NAME = "plain";

    public PlainLocalTier(KeyValueStore store, String localPrefix) {
        super(store, localPrefix, TIER_NAME);
    }

    @Override
    public Tier tier() {
        return Tier.PLAIN_LOCAL;
    }

    @Override
    protected Map<String, FieldValue> encode(String collection, Map<String, FieldValue> fields) {
        return Records.copyOf(fields);
    }

    @Override
    protected Map<String, FieldValue> decode(String collection, Map<String, FieldValue> stored) {
        return stored;
    }
}
