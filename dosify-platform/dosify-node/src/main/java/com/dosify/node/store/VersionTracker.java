package com.dosify.node.store;

import com.dosify.node.kv.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Remembers, per record, the remote {@code lastUpdate} this client last saw. Remote writes are
 * conditioned on it, which is how concurrent edits by another client are detected.
 */
class VersionTracker {

    private static final Logger log = LoggerFactory.getLogger(VersionTracker.class);

    private final KeyValueStore store;
    private final String keyPrefix;

    VersionTracker(KeyValueStore store, String localPrefix) {
        this.store = store;
        this.keyPrefix = localPrefix + "_version:";
    }

    Optional<Instant> lastSeen(String collection, String id) {
        try {
            return store.getString(key(collection, id)).map(Instant::parse);
        } catch (KeyValueStore.KeyValueStoreException | DateTimeParseException e) {
            log.warn("Version of {}/{} unreadable, treating record as unseen", collection, id, e);
            return Optional.empty();
        }
    }

    void record(String collection, String id, Instant lastUpdate) {
        if (lastUpdate == null) {
            return;
        }
        try {
            store.setString(key(collection, id), lastUpdate.toString());
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Could not remember version of {}/{}", collection, id, e);
        }
    }

    void forget(String collection, String id) {
        try {
            store.remove(key(collection, id));
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Could not forget version of {}/{}", collection, id, e);
        }
    }

    private String key(String collection, String id) {
        return keyPrefix + collection + ":" + id;
    }
}
