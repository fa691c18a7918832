package com.dosify.node.kv;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of KeyValueStore for testing and development.
 * Production builds persist through {@link FileKeyValueStore} or a platform preference store.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, Object> values;

    public InMemoryKeyValueStore() {
        this.values = new ConcurrentHashMap<>();
    }

    @Override
    public Optional<String> getString(String key) {
        return read(key, String.class);
    }

    @Override
    public Optional<Long> getLong(String key) {
        return read(key, Long.class);
    }

    @Override
    public Optional<Double> getDouble(String key) {
        return read(key, Double.class);
    }

    @Override
    public Optional<Boolean> getBoolean(String key) {
        return read(key, Boolean.class);
    }

    @Override
    public void setString(String key, String value) {
        write(key, value);
    }

    @Override
    public void setLong(String key, long value) {
        write(key, value);
    }

    @Override
    public void setDouble(String key, double value) {
        write(key, value);
    }

    @Override
    public void setBoolean(String key, boolean value) {
        write(key, value);
    }

    @Override
    public boolean remove(String key) {
        return values.remove(requireKey(key)) != null;
    }

    @Override
    public boolean containsKey(String key) {
        return key != null && values.containsKey(key);
    }

    @Override
    public Set<String> getAllKeys() {
        return Set.copyOf(values.keySet());
    }

    /**
     * Returns the raw stored object (for testing).
     */
    public Object rawValue(String key) {
        return values.get(key);
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        Object value = values.get(requireKey(key));
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new KeyValueStoreException("Key " + key + " holds " + value.getClass().getSimpleName()
                    + ", not " + type.getSimpleName());
        }
        return Optional.of(type.cast(value));
    }

    private void write(String key, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        values.put(requireKey(key), value);
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be null or blank");
        }
        return key;
    }
}
