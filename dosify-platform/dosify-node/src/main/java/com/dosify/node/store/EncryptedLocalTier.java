package com.dosify.node.store;

import com.dosify.node.crypto.FieldEncryptor;
import com.dosify.node.kv.KeyValueStore;
import com.dosify.node.record.FieldValue;

import java.util.Map;

/**
 * Local tier holding records with their sensitive fields encrypted.
 */
public class EncryptedLocalTier extends LocalTier {

    static final String TIER_NAME = "enc";

    private final FieldEncryptor encryptor;
    private final StoreConfig config;

    public EncryptedLocalTier(KeyValueStore store, FieldEncryptor encryptor, StoreConfig config) {
        super(store, config.localPrefix(), TIER_NAME);
        if (encryptor == null) {
            throw new IllegalArgumentException("Encryptor cannot be null");
        }
        this.encryptor = encryptor;
        this.config = config;
    }

    @Override
    public Tier tier() {
        return Tier.ENCRYPTED_LOCAL;
    }

    /**
     * @throws FieldEncryptor.EncryptionUnavailableException if no key is available
     */
    @Override
    protected Map<String, FieldValue> encode(String collection, Map<String, FieldValue> fields) {
        return encryptor.encryptRecord(fields, config.sensitiveFieldsOf(collection));
    }

    /**
     * @throws FieldEncryptor.DecryptionException if a sensitive field fails to decrypt
     */
    @Override
    protected Map<String, FieldValue> decode(String collection, Map<String, FieldValue> stored) {
        return encryptor.decryptRecord(stored, config.sensitiveFieldsOf(collection));
    }
}
