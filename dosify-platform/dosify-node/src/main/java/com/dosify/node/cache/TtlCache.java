package com.dosify.node.cache;

import com.dosify.node.kv.KeyValueStore;
import com.dosify.node.record.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key-value cache with per-entry time-to-live, layered on a persistent {@link KeyValueStore}.
 *
 * Values live under {@code <prefix>_<key>}. The expiry index (logical key to ISO-8601 instant,
 * null for entries that never expire) is persisted as one JSON object under
 * {@code <prefix>_expiry_times}. A key found in the value store but not in the index is treated
 * as expired.
 *
 * Cache failures never reach the caller: writes report {@code false}, reads report a miss.
 * Reads never delete anything; expired entries stay until {@link #cleanExpiredEntries()}.
 */
public class TtlCache {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    static final String EXPIRY_INDEX_KEY = "expiry_times";

    private final KeyValueStore store;
    private final String prefix;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    // Logical key -> expiry; Optional.empty() marks an entry without expiry.
    private final Map<String, Optional<Instant>> expiryIndex = new ConcurrentHashMap<>();
    private final Object indexLock = new Object();

    public TtlCache(KeyValueStore store, String prefix, Duration defaultTtl, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Prefix cannot be null or blank");
        }
        if (defaultTtl == null || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("Default TTL cannot be null or negative");
        }
        this.store = store;
        this.prefix = prefix;
        this.defaultTtl = defaultTtl;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.objectMapper = JsonCodec.mapper();
    }

    public TtlCache(KeyValueStore store, String prefix) {
        this(store, prefix, Duration.ofHours(1), Clock.systemUTC());
    }

    /**
     * Loads the persisted expiry index. A corrupt index is treated as empty.
     * Index entries without a stored value are dropped.
     */
    public void initialize() {
        synchronized (indexLock) {
            expiryIndex.clear();
            try {
                Optional<String> persisted = store.getString(fullKey(EXPIRY_INDEX_KEY));
                if (persisted.isPresent()) {
                    parseIndex(persisted.get());
                }
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("Expiry index for cache '{}' unreadable, starting with an empty index", prefix, e);
                expiryIndex.clear();
            }

            int dropped = 0;
            Iterator<String> keys = expiryIndex.keySet().iterator();
            while (keys.hasNext()) {
                String key = keys.next();
                if (!safeContains(fullKey(key))) {
                    keys.remove();
                    dropped++;
                }
            }
            if (dropped > 0) {
                log.info("Dropped {} expiry index entries without cached values", dropped);
                persistIndex();
            }
        }
        log.info("Cache '{}' initialized with {} indexed entries", prefix, expiryIndex.size());
    }

    // ==================== Writes ====================

    /**
     * Stores a value with the default TTL.
     */
    public boolean set(String key, Object value) {
        return set(key, value, defaultTtl);
    }

    /**
     * Stores a value. Strings, integral numbers, doubles and booleans are stored natively,
     * anything else as JSON.
     *
     * @param ttl time-to-live, or null for an entry that never expires
     * @return false if the backend failed; never throws for storage errors
     */
    public boolean set(String key, Object value, Duration ttl) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        Optional<Instant> expiresAt = ttl == null ? Optional.empty() : Optional.of(clock.instant().plus(ttl));

        boolean indexed;
        synchronized (indexLock) {
            // Index entry first: a stored value is never unindexed.
            Optional<Instant> previous = expiryIndex.put(key, expiresAt);
            try {
                writeValue(fullKey(key), value);
            } catch (KeyValueStore.KeyValueStoreException | JsonProcessingException e) {
                restoreIndexEntry(key, previous);
                log.warn("Cache write failed for key {}", key, e);
                return false;
            }
            indexed = persistIndex();
        }
        log.debug("Cache set: {} (expires: {})", key, expiresAt.map(Instant::toString).orElse("never"));
        return indexed;
    }

    public boolean remove(String key) {
        validateKey(key);
        synchronized (indexLock) {
            try {
                store.remove(fullKey(key));
            } catch (KeyValueStore.KeyValueStoreException e) {
                log.warn("Cache remove failed for key {}", key, e);
                return false;
            }
            expiryIndex.remove(key);
            return persistIndex();
        }
    }

    /**
     * Removes every key under this cache's prefix, including the expiry index.
     * Keys of other components sharing the backend are left untouched.
     */
    public boolean clear() {
        String scope = prefix + "_";
        synchronized (indexLock) {
            expiryIndex.clear();
            try {
                for (String key : store.getAllKeys()) {
                    if (key.startsWith(scope)) {
                        store.remove(key);
                    }
                }
                log.info("Cache '{}' cleared", prefix);
                return true;
            } catch (KeyValueStore.KeyValueStoreException e) {
                log.warn("Clearing cache '{}' failed", prefix, e);
                return false;
            }
        }
    }

    /**
     * Removes expired entries and values that are missing from the expiry index.
     *
     * @return number of removed entries, 0 on failure
     */
    public int cleanExpiredEntries() {
        Instant now = clock.instant();
        try {
            List<String> expired = new ArrayList<>();
            synchronized (indexLock) {
                for (Map.Entry<String, Optional<Instant>> entry : expiryIndex.entrySet()) {
                    if (entry.getValue().map(at -> !now.isBefore(at)).orElse(false)) {
                        expired.add(entry.getKey());
                    }
                }
                for (String key : unindexedKeys()) {
                    expired.add(key);
                }
                for (String key : expired) {
                    store.remove(fullKey(key));
                    expiryIndex.remove(key);
                }
                if (!expired.isEmpty()) {
                    persistIndex();
                }
            }
            log.debug("Cleaned {} expired entries from cache '{}'", expired.size(), prefix);
            return expired.size();
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Cleaning expired entries of cache '{}' failed", prefix, e);
            return 0;
        }
    }

    // ==================== Reads ====================

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, type, false);
    }

    /**
     * Reads a value.
     *
     * @return empty when absent, expired (unless {@code ignoreExpiry}) or not readable as {@code type}
     */
    public <T> Optional<T> get(String key, Class<T> type, boolean ignoreExpiry) {
        return read(key, objectMapper.constructType(type), ignoreExpiry);
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return get(key, type, false);
    }

    public <T> Optional<T> get(String key, TypeReference<T> type, boolean ignoreExpiry) {
        return read(key, objectMapper.constructType(type), ignoreExpiry);
    }

    public boolean containsKey(String key) {
        return containsKey(key, true);
    }

    /**
     * Agrees with {@link #get}: a key is contained when its value is stored and, if
     * {@code checkExpiry}, not expired.
     */
    public boolean containsKey(String key, boolean checkExpiry) {
        validateKey(key);
        if (checkExpiry && isExpired(key, clock.instant())) {
            return false;
        }
        return safeContains(fullKey(key));
    }

    /**
     * Raw entry with its expiry, regardless of freshness.
     */
    public Optional<CacheEntry> entry(String key) {
        validateKey(key);
        try {
            Optional<Object> raw = rawValue(fullKey(key));
            Optional<Instant> expiresAt = expiryIndex.getOrDefault(key, Optional.of(Instant.EPOCH));
            return raw.map(value -> new CacheEntry(key, value, expiresAt.orElse(null)));
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Reading cache entry {} failed", key, e);
            return Optional.empty();
        }
    }

    /**
     * Logical keys currently tracked by the expiry index.
     */
    public Set<String> keys() {
        return Set.copyOf(expiryIndex.keySet());
    }

    // ==================== Private Methods ====================

    private <T> Optional<T> read(String key, JavaType type, boolean ignoreExpiry) {
        validateKey(key);
        if (!ignoreExpiry && isExpired(key, clock.instant())) {
            log.debug("Cache entry expired: {}", key);
            return Optional.empty();
        }
        String fullKey = fullKey(key);
        try {
            Optional<T> value = readValue(fullKey, type);
            log.debug(value.isPresent() ? "Cache hit: {}" : "Cache miss: {}", key);
            return value;
        } catch (KeyValueStore.KeyValueStoreException | JsonProcessingException | IllegalArgumentException e) {
            log.debug("Cache entry {} unreadable as {}: {}", key, type, e.getMessage());
            return Optional.empty();
        }
    }

    @SuppressWarnings("unchecked")
    private <T> Optional<T> readValue(String fullKey, JavaType type) throws JsonProcessingException {
        Class<?> raw = type.getRawClass();
        if (raw == String.class) {
            return (Optional<T>) store.getString(fullKey);
        }
        if (raw == Long.class) {
            return (Optional<T>) store.getLong(fullKey);
        }
        if (raw == Integer.class) {
            Optional<Long> value = store.getLong(fullKey);
            if (value.isPresent() && (value.get() > Integer.MAX_VALUE || value.get() < Integer.MIN_VALUE)) {
                throw new IllegalArgumentException("Stored long does not fit an int");
            }
            return (Optional<T>) value.map(Long::intValue);
        }
        if (raw == Double.class) {
            return (Optional<T>) store.getDouble(fullKey);
        }
        if (raw == Boolean.class) {
            return (Optional<T>) store.getBoolean(fullKey);
        }
        Optional<String> json = store.getString(fullKey);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(objectMapper.readValue(json.get(), type));
    }

    private Optional<Object> rawValue(String fullKey) {
        if (!store.containsKey(fullKey)) {
            return Optional.empty();
        }
        for (RawReader reader : List.<RawReader>of(store::getString, store::getLong, store::getDouble, store::getBoolean)) {
            try {
                Optional<?> value = reader.read(fullKey);
                if (value.isPresent()) {
                    return Optional.of(value.get());
                }
            } catch (KeyValueStore.KeyValueStoreException typeMismatch) {
                log.trace("Key {} is not stored as this type", fullKey);
            }
        }
        return Optional.empty();
    }

    private void writeValue(String fullKey, Object value) throws JsonProcessingException {
        if (value instanceof String s) {
            store.setString(fullKey, s);
        } else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            store.setLong(fullKey, ((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            store.setDouble(fullKey, ((Number) value).doubleValue());
        } else if (value instanceof Boolean b) {
            store.setBoolean(fullKey, b);
        } else {
            store.setString(fullKey, objectMapper.writeValueAsString(value));
        }
    }

    private boolean isExpired(String key, Instant now) {
        Optional<Instant> expiresAt = expiryIndex.get(key);
        if (expiresAt == null) {
            // Unknown to the index: expired if a value exists, which also hides orphans.
            return true;
        }
        return expiresAt.map(at -> !now.isBefore(at)).orElse(false);
    }

    private List<String> unindexedKeys() {
        String scope = prefix + "_";
        String indexKey = fullKey(EXPIRY_INDEX_KEY);
        List<String> orphans = new ArrayList<>();
        for (String fullKey : store.getAllKeys()) {
            if (fullKey.startsWith(scope) && !fullKey.equals(indexKey)) {
                String logical = fullKey.substring(scope.length());
                if (!expiryIndex.containsKey(logical)) {
                    orphans.add(logical);
                }
            }
        }
        return orphans;
    }

    private void parseIndex(String json) throws JsonProcessingException {
        JsonNode node = objectMapper.readTree(json);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Expiry index is not a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                expiryIndex.put(field.getKey(), Optional.empty());
            } else {
                expiryIndex.put(field.getKey(), Optional.of(Instant.parse(value.asText())));
            }
        }
    }

    private void restoreIndexEntry(String key, Optional<Instant> previous) {
        if (previous == null) {
            expiryIndex.remove(key);
        } else {
            expiryIndex.put(key, previous);
        }
    }

    /**
     * Writes the whole index; callers hold {@link #indexLock}.
     */
    private boolean persistIndex() {
        ObjectNode node = objectMapper.createObjectNode();
        expiryIndex.forEach((key, expiresAt) -> {
            if (expiresAt.isPresent()) {
                node.put(key, expiresAt.get().toString());
            } else {
                node.putNull(key);
            }
        });
        try {
            store.setString(fullKey(EXPIRY_INDEX_KEY), objectMapper.writeValueAsString(node));
            return true;
        } catch (KeyValueStore.KeyValueStoreException | JsonProcessingException e) {
            log.warn("Persisting expiry index of cache '{}' failed", prefix, e);
            return false;
        }
    }

    private boolean safeContains(String fullKey) {
        try {
            return store.containsKey(fullKey);
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Cache backend unreadable for {}", fullKey, e);
            return false;
        }
    }

    private String fullKey(String key) {
        return prefix + "_" + key;
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be null or blank");
        }
        if (EXPIRY_INDEX_KEY.equals(key)) {
            throw new IllegalArgumentException("Key '" + EXPIRY_INDEX_KEY + "' is reserved");
        }
    }

    @FunctionalInterface
    private interface RawReader {
        Optional<?> read(String key);
    }
}
