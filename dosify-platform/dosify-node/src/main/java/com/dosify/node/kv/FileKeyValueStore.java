package com.dosify.node.kv;

import com.dosify.node.record.JsonCodec;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * KeyValueStore persisted as a single JSON document on disk.
 *
 * Every mutation rewrites the file: the new content goes to "{@code <file>.tmp}" first and is
 * then moved over the previous file with ATOMIC_MOVE, so a crash leaves either the old or the
 * new state. Values keep their scalar type across restarts.
 */
public class FileKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(FileKeyValueStore.class);
    private static final TypeReference<Map<String, StoredValue>> FILE_FORMAT = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, StoredValue> values = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    public FileKeyValueStore(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("File cannot be null");
        }
        this.file = file;
        this.objectMapper = JsonCodec.mapper();
        load();
    }

    @Override
    public Optional<String> getString(String key) {
        return read(key, ValueType.STRING).map(StoredValue::text);
    }

    @Override
    public Optional<Long> getLong(String key) {
        return read(key, ValueType.LONG).map(v -> Long.parseLong(v.text()));
    }

    @Override
    public Optional<Double> getDouble(String key) {
        return read(key, ValueType.DOUBLE).map(v -> Double.parseDouble(v.text()));
    }

    @Override
    public Optional<Boolean> getBoolean(String key) {
        return read(key, ValueType.BOOLEAN).map(v -> Boolean.parseBoolean(v.text()));
    }

    @Override
    public void setString(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        write(key, new StoredValue(ValueType.STRING, value));
    }

    @Override
    public void setLong(String key, long value) {
        write(key, new StoredValue(ValueType.LONG, Long.toString(value)));
    }

    @Override
    public void setDouble(String key, double value) {
        write(key, new StoredValue(ValueType.DOUBLE, Double.toString(value)));
    }

    @Override
    public void setBoolean(String key, boolean value) {
        write(key, new StoredValue(ValueType.BOOLEAN, Boolean.toString(value)));
    }

    @Override
    public boolean remove(String key) {
        requireKey(key);
        synchronized (writeLock) {
            StoredValue previous = values.remove(key);
            if (previous == null) {
                return false;
            }
            try {
                persist();
            } catch (KeyValueStoreException e) {
                values.put(key, previous);
                throw e;
            }
            return true;
        }
    }

    @Override
    public boolean containsKey(String key) {
        return key != null && values.containsKey(key);
    }

    @Override
    public Set<String> getAllKeys() {
        return Set.copyOf(values.keySet());
    }

    // ==================== Private Methods ====================

    private Optional<StoredValue> read(String key, ValueType expected) {
        StoredValue value = values.get(requireKey(key));
        if (value == null) {
            return Optional.empty();
        }
        if (value.type() != expected) {
            throw new KeyValueStoreException("Key " + key + " holds " + value.type() + ", not " + expected);
        }
        return Optional.of(value);
    }

    private void write(String key, StoredValue value) {
        requireKey(key);
        synchronized (writeLock) {
            StoredValue previous = values.put(key, value);
            try {
                persist();
            } catch (KeyValueStoreException e) {
                if (previous == null) {
                    values.remove(key);
                } else {
                    values.put(key, previous);
                }
                throw e;
            }
        }
    }

    private void persist() {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(tmp.toFile(), new LinkedHashMap<>(values));
            try {
                Files.move(tmp, file, ATOMIC_MOVE, REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new KeyValueStoreException("Failed to persist key-value file " + file, e);
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            Map<String, StoredValue> stored = objectMapper.readValue(file.toFile(), FILE_FORMAT);
            if (stored != null) {
                values.putAll(stored);
            }
            log.debug("Loaded {} keys from {}", values.size(), file);
        } catch (IOException e) {
            throw new KeyValueStoreException("Failed to read key-value file " + file, e);
        }
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be null or blank");
        }
        return key;
    }

    // ==================== Inner Types ====================

    enum ValueType {
        STRING, LONG, DOUBLE, BOOLEAN
    }

    record StoredValue(ValueType type, String text) {}
}
