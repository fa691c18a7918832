package com.dosify.node.store;

import com.dosify.node.kv.KeyValueStore;
import com.dosify.node.record.Document;
import com.dosify.node.record.FieldValue;
import com.dosify.node.record.Records;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A local tier keeps one JSON document per record in the key-value store, under
 * {@code <localPrefix>_<tierName>:<collection>:<id>}.
 *
 * Subclasses decide how records are transformed on the way in and out.
 */
public abstract class LocalTier {

    private static final Logger log = LoggerFactory.getLogger(LocalTier.class);

    private final KeyValueStore store;
    private final String keyPrefix;

    protected LocalTier(KeyValueStore store, String localPrefix, String tierName) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }
        if (localPrefix == null || localPrefix.isBlank()) {
            throw new IllegalArgumentException("Local prefix cannot be null or blank");
        }
        this.store = store;
        this.keyPrefix = localPrefix + "_" + tierName + ":";
    }

    public abstract Tier tier();

    protected abstract Map<String, FieldValue> encode(String collection, Map<String, FieldValue> fields);

    protected abstract Map<String, FieldValue> decode(String collection, Map<String, FieldValue> stored);

    /**
     * Stores a record.
     *
     * @throws KeyValueStore.KeyValueStoreException if the backend fails
     */
    public void put(String collection, String id, Map<String, FieldValue> fields) {
        store.setString(key(collection, id), Records.toJson(encode(collection, fields)));
    }

    /**
     * Reads a record. Failures of {@link #decode} propagate to the caller.
     *
     * @throws KeyValueStore.KeyValueStoreException if the backend fails or the stored JSON is corrupt
     */
    public Optional<Map<String, FieldValue>> get(String collection, String id) {
        Optional<String> json = store.getString(key(collection, id));
        if (json.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(decode(collection, parse(json.get(), key(collection, id))));
    }

    public boolean remove(String collection, String id) {
        return store.remove(key(collection, id));
    }

    /**
     * All records of a collection. Records that fail to decode are skipped and logged.
     */
    public List<Document> list(String collection) {
        String scope = collectionScope(collection);
        List<Document> documents = new ArrayList<>();
        for (String key : store.getAllKeys()) {
            if (!key.startsWith(scope)) {
                continue;
            }
            String id = key.substring(scope.length());
            try {
                get(collection, id).ifPresent(fields -> documents.add(new Document(id, fields)));
            } catch (RuntimeException e) {
                log.warn("Skipping unreadable {} record {}/{}: {}", tier(), collection, id, e.getMessage());
            }
        }
        return documents;
    }

    /**
     * Removes every record of this tier.
     *
     * @throws KeyValueStore.KeyValueStoreException if the backend fails
     */
    public int clear() {
        int removed = 0;
        for (String key : store.getAllKeys()) {
            if (key.startsWith(keyPrefix) && store.remove(key)) {
                removed++;
            }
        }
        return removed;
    }

    String key(String collection, String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Record ID cannot be null or blank");
        }
        return collectionScope(collection) + id;
    }

    private String collectionScope(String collection) {
        if (collection == null || collection.isBlank() || collection.contains(":")) {
            throw new IllegalArgumentException("Collection must be non-blank and must not contain ':'");
        }
        return keyPrefix + collection + ":";
    }

    private static Map<String, FieldValue> parse(String json, String key) {
        try {
            return Records.fromJson(json);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new KeyValueStore.KeyValueStoreException("Corrupt local record under " + key, e);
        }
    }
}
