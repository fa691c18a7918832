package com.dosify.node.store;

import com.dosify.node.remote.RetryPolicy;
import com.dosify.node.sync.PendingWriteQueue;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration of the tiered store.
 *
 * @param cachePrefix     keyspace prefix of the TTL cache
 * @param defaultTtl      TTL of cache entries written without an explicit TTL
 * @param recordTtl       TTL of records written through to the cache on remote reads
 * @param queryTtl        TTL of cached query results
 * @param localPrefix     keyspace prefix of the local tiers and sync bookkeeping
 * @param maxQueueSize    capacity of the pending write queue
 * @param maxRetries      replay attempts before a queued write is discarded
 * @param retryPolicy     retry policy for secure store access
 * @param remoteRetryInterval how long the remote is skipped after it was found unreachable
 * @param sensitiveFields per collection, the fields encrypted at rest
 */
public record StoreConfig(
        String cachePrefix,
        Duration defaultTtl,
        Duration recordTtl,
        Duration queryTtl,
        String localPrefix,
        int maxQueueSize,
        int maxRetries,
        RetryPolicy retryPolicy,
        Duration remoteRetryInterval,
        Map<String, Set<String>> sensitiveFields
) {

    public static final String RESOURCE = "dosify-node.properties";
    static final String SENSITIVE_PREFIX = "dosify.sensitive.";

    public StoreConfig {
        if (cachePrefix == null || cachePrefix.isBlank()) {
            throw new IllegalArgumentException("Cache prefix cannot be null or blank");
        }
        if (localPrefix == null || localPrefix.isBlank()) {
            throw new IllegalArgumentException("Local prefix cannot be null or blank");
        }
        if (cachePrefix.equals(localPrefix)
                || localPrefix.startsWith(cachePrefix + "_")
                || cachePrefix.startsWith(localPrefix + "_")) {
            throw new IllegalArgumentException(
                    "Cache and local prefixes must not overlap: " + cachePrefix + ", " + localPrefix);
        }
        if (defaultTtl == null || recordTtl == null || queryTtl == null) {
            throw new IllegalArgumentException("TTLs cannot be null");
        }
        if (remoteRetryInterval == null || remoteRetryInterval.isNegative()) {
            throw new IllegalArgumentException("Remote retry interval cannot be null or negative");
        }
        if (maxQueueSize < 1 || maxRetries < 1) {
            throw new IllegalArgumentException("Queue size and retries must be positive");
        }
        retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaults();
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        if (sensitiveFields != null) {
            sensitiveFields.forEach((collection, fields) -> copy.put(collection, Set.copyOf(fields)));
        }
        sensitiveFields = Map.copyOf(copy);
    }

    /**
     * Default configuration: medication records carry their dosing data encrypted.
     */
    public static StoreConfig defaults() {
        return new StoreConfig(
                "dosify_cache",
                Duration.ofHours(1),
                Duration.ofMinutes(30),
                Duration.ofMinutes(5),
                "dosify_local",
                PendingWriteQueue.DEFAULT_MAX_QUEUE_SIZE,
                PendingWriteQueue.DEFAULT_MAX_RETRIES,
                RetryPolicy.defaults(),
                Duration.ofMinutes(5),
                Map.of("medications", Set.of(
                        "name",
                        "strength",
                        "strengthUnit",
                        "tabletsInStock",
                        "quantityUnit",
                        "reconstitutionVolume",
                        "reconstitutionVolumeUnit",
                        "concentrationAfterReconstitution"
                ))
        );
    }

    /**
     * Defaults overridden by {@code properties}. Durations use ISO-8601 ({@code PT30M}).
     */
    public static StoreConfig fromProperties(Properties properties) {
        StoreConfig base = defaults();
        if (properties == null) {
            return base;
        }

        Map<String, Set<String>> sensitive = new LinkedHashMap<>(base.sensitiveFields());
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(SENSITIVE_PREFIX)) {
                String collection = name.substring(SENSITIVE_PREFIX.length());
                sensitive.put(collection, parseFieldList(properties.getProperty(name)));
            }
        }

        RetryPolicy retry = new RetryPolicy(
                intProperty(properties, "dosify.retry.max-attempts", base.retryPolicy().maxAttempts()),
                durationProperty(properties, "dosify.retry.initial-delay", base.retryPolicy().initialDelay()),
                base.retryPolicy().multiplier()
        );

        return new StoreConfig(
                properties.getProperty("dosify.cache.prefix", base.cachePrefix()).trim(),
                durationProperty(properties, "dosify.cache.default-ttl", base.defaultTtl()),
                durationProperty(properties, "dosify.cache.record-ttl", base.recordTtl()),
                durationProperty(properties, "dosify.cache.query-ttl", base.queryTtl()),
                properties.getProperty("dosify.local.prefix", base.localPrefix()).trim(),
                intProperty(properties, "dosify.sync.max-queue-size", base.maxQueueSize()),
                intProperty(properties, "dosify.sync.max-retries", base.maxRetries()),
                retry,
                durationProperty(properties, "dosify.remote.retry-interval", base.remoteRetryInterval()),
                sensitive
        );
    }

    /**
     * Reads {@value #RESOURCE} from the classpath, falling back to {@link #defaults()} when absent.
     */
    public static StoreConfig load() {
        Properties properties = new Properties();
        try (InputStream in = StoreConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return fromProperties(properties);
    }

    public Set<String> sensitiveFieldsOf(String collection) {
        return sensitiveFields.getOrDefault(collection, Set.of());
    }

    private static Set<String> parseFieldList(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(field -> !field.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static int intProperty(Properties properties, String name, int fallback) {
        String value = properties.getProperty(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + name + " is not an integer: " + value, e);
        }
    }

    private static Duration durationProperty(Properties properties, String name, Duration fallback) {
        String value = properties.getProperty(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Property " + name + " is not an ISO-8601 duration: " + value, e);
        }
    }
}
