package com.dosify.node.sync;

import com.dosify.node.kv.KeyValueStore;
import com.dosify.node.record.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Pending conflicts awaiting an explicit resolution, persisted in the local key-value store.
 *
 * Subscribers receive the full pending list after every change. Resolved conflicts leave the
 * pending set and are appended to the in-memory resolution history.
 */
public class ConflictQueue {

    private static final Logger log = LoggerFactory.getLogger(ConflictQueue.class);

    static final String QUEUE_KEY_SUFFIX = "_conflict_queue";
    private static final TypeReference<List<ConflictResolutionItem>> ITEM_LIST = new TypeReference<>() {};

    private final KeyValueStore store;
    private final String queueKey;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    private final Map<String, ConflictResolutionItem> pending = new LinkedHashMap<>();
    private final List<ResolutionRecord> history = new CopyOnWriteArrayList<>();
    private final List<Consumer<List<ConflictResolutionItem>>> listeners = new CopyOnWriteArrayList<>();

    public ConflictQueue(KeyValueStore store, String keyPrefix, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("Key prefix cannot be null or blank");
        }
        this.store = store;
        this.queueKey = keyPrefix + QUEUE_KEY_SUFFIX;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.objectMapper = JsonCodec.mapper();
    }

    /**
     * Reloads pending conflicts persisted by a previous run. An unreadable queue starts empty.
     */
    public synchronized void load() {
        pending.clear();
        try {
            Optional<String> json = store.getString(queueKey);
            if (json.isPresent()) {
                for (ConflictResolutionItem item : objectMapper.readValue(json.get(), ITEM_LIST)) {
                    pending.put(item.id(), item);
                }
            }
            log.info("Loaded {} unresolved conflicts", pending.size());
        } catch (JsonProcessingException | KeyValueStore.KeyValueStoreException e) {
            log.warn("Conflict queue unreadable, starting empty", e);
            pending.clear();
        }
        publish();
    }

    // ==================== Lifecycle ====================

    public ConflictResolutionItem enqueue(String collection, String recordId, ConflictData conflictData) {
        ConflictResolutionItem item = new ConflictResolutionItem(
                UUID.randomUUID().toString(),
                collection,
                recordId,
                conflictData,
                clock.instant(),
                ConflictState.DETECTED
        );
        synchronized (this) {
            pending.put(item.id(), item);
            persist();
        }
        log.info("Conflict {} detected on {}/{} for fields {}",
                item.id(), collection, recordId, conflictData.conflictingFields());
        publish();
        return item;
    }

    /**
     * Moves a conflict to {@link ConflictState#PRESENTED}. Presenting twice is allowed.
     */
    public ConflictResolutionItem present(String itemId) {
        ConflictResolutionItem presented;
        synchronized (this) {
            ConflictResolutionItem item = require(itemId);
            if (item.state() == ConflictState.PRESENTED) {
                return item;
            }
            presented = item.withState(ConflictState.PRESENTED);
            pending.put(itemId, presented);
            persist();
        }
        publish();
        return presented;
    }

    /**
     * Records the resolution of a presented conflict and removes it from the pending set.
     *
     * @throws IllegalStateException if the conflict was not presented first
     */
    public ResolutionRecord markResolved(String itemId, ResolutionStrategy strategy) {
        ResolutionRecord record;
        synchronized (this) {
            ConflictResolutionItem item = require(itemId);
            if (item.state() != ConflictState.PRESENTED) {
                throw new IllegalStateException(
                        "Conflict " + itemId + " must be presented before resolution, was " + item.state());
            }
            pending.remove(itemId);
            persist();
            record = new ResolutionRecord(itemId, item.collection(), item.recordId(), strategy, clock.instant());
            history.add(record);
        }
        log.info("Resolved conflict {} using {}", itemId, strategy);
        publish();
        return record;
    }

    public synchronized Optional<ConflictResolutionItem> find(String itemId) {
        return Optional.ofNullable(pending.get(itemId));
    }

    public synchronized List<ConflictResolutionItem> pending() {
        return List.copyOf(pending.values());
    }

    public synchronized int size() {
        return pending.size();
    }

    public List<ResolutionRecord> history() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    /**
     * Drops every pending conflict.
     */
    public boolean clear() {
        boolean persisted;
        synchronized (this) {
            pending.clear();
            persisted = persist();
        }
        publish();
        return persisted;
    }

    // ==================== Subscription ====================

    /**
     * Registers a listener and immediately delivers the current pending list to it.
     */
    public Subscription subscribe(Consumer<List<ConflictResolutionItem>> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        listeners.add(listener);
        listener.accept(pending());
        return () -> listeners.remove(listener);
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    // ==================== Private Methods ====================

    private ConflictResolutionItem require(String itemId) {
        ConflictResolutionItem item = pending.get(itemId);
        if (item == null) {
            throw new IllegalArgumentException("Conflict not found: " + itemId);
        }
        return item;
    }

    private boolean persist() {
        try {
            store.setString(queueKey, objectMapper.writeValueAsString(new ArrayList<>(pending.values())));
            return true;
        } catch (JsonProcessingException | KeyValueStore.KeyValueStoreException e) {
            log.warn("Failed to save conflict queue", e);
            return false;
        }
    }

    private void publish() {
        List<ConflictResolutionItem> snapshot = pending();
        for (Consumer<List<ConflictResolutionItem>> listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                log.warn("Conflict listener failed", e);
            }
        }
    }
}
