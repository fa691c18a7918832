package com.dosify.node.kv;

import java.util.Optional;
import java.util.Set;

/**
 * Persistent key-value backend shared by the TTL cache and the local storage tiers.
 * Scalars are stored natively; anything structured is stored as a JSON string by the caller.
 *
 * Implementations throw {@link KeyValueStoreException} when the underlying storage fails.
 * A value stored under one type and read back as another is reported the same way.
 */
public interface KeyValueStore {

    Optional<String> getString(String key);

    Optional<Long> getLong(String key);

    Optional<Double> getDouble(String key);

    Optional<Boolean> getBoolean(String key);

    void setString(String key, String value);

    void setLong(String key, long value);

    void setDouble(String key, double value);

    void setBoolean(String key, boolean value);

    /**
     * Removes a key.
     *
     * @return true if the key was present
     */
    boolean remove(String key);

    boolean containsKey(String key);

    /**
     * Returns a snapshot of every key in the backend, including keys owned by other components.
     */
    Set<String> getAllKeys();

    /**
     * Failure of the persistent backend.
     */
    class KeyValueStoreException extends RuntimeException {
        public KeyValueStoreException(String message) {
            super(message);
        }

        public KeyValueStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
