package com.dosify.node.sync;

import com.dosify.node.kv.KeyValueStore;
import com.dosify.node.record.FieldValue;
import com.dosify.node.record.JsonCodec;
import com.dosify.node.record.Records;
import com.dosify.node.remote.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Remote writes and deletes that could not be delivered, queued to survive restarts and
 * replayed in order once the remote is reachable again.
 *
 * The queue is bounded: when full, the oldest operation is dropped. An operation that fails
 * {@code maxRetries} times is discarded.
 */
public class PendingWriteQueue {

    private static final Logger log = LoggerFactory.getLogger(PendingWriteQueue.class);

    public static final int DEFAULT_MAX_QUEUE_SIZE = 1000;
    public static final int DEFAULT_MAX_RETRIES = 3;
    static final String QUEUE_KEY_SUFFIX = "_pending_operations";
    private static final TypeReference<List<PendingOperation>> OPERATION_LIST = new TypeReference<>() {};

    private final KeyValueStore store;
    private final String queueKey;
    private final int maxQueueSize;
    private final int maxRetries;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    private final LinkedList<PendingOperation> operations = new LinkedList<>();
    private final AtomicBoolean processing = new AtomicBoolean(false);

    public PendingWriteQueue(KeyValueStore store, String keyPrefix, int maxQueueSize, int maxRetries, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("Key prefix cannot be null or blank");
        }
        if (maxQueueSize < 1) {
            throw new IllegalArgumentException("Max queue size must be at least 1");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("Max retries must be at least 1");
        }
        this.store = store;
        this.queueKey = keyPrefix + QUEUE_KEY_SUFFIX;
        this.maxQueueSize = maxQueueSize;
        this.maxRetries = maxRetries;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.objectMapper = JsonCodec.mapper();
    }

    public PendingWriteQueue(KeyValueStore store, String keyPrefix, Clock clock) {
        this(store, keyPrefix, DEFAULT_MAX_QUEUE_SIZE, DEFAULT_MAX_RETRIES, clock);
    }

    /**
     * Loads operations persisted by a previous run. An unreadable queue starts empty.
     */
    public synchronized void load() {
        operations.clear();
        try {
            Optional<String> json = store.getString(queueKey);
            if (json.isPresent()) {
                operations.addAll(objectMapper.readValue(json.get(), OPERATION_LIST));
            }
            log.info("Loaded {} pending operations", operations.size());
        } catch (JsonProcessingException | KeyValueStore.KeyValueStoreException e) {
            log.warn("Pending operations unreadable, starting with an empty queue", e);
            operations.clear();
        }
    }

    // ==================== Queue ====================

    public PendingOperation enqueueWrite(String collection, String recordId, Map<String, FieldValue> fields) {
        return enqueue(new PendingOperation(UUID.randomUUID().toString(), OperationType.WRITE, collection,
                recordId, Records.copyOf(fields), 0, clock.instant(), null));
    }

    public PendingOperation enqueueDelete(String collection, String recordId) {
        return enqueue(new PendingOperation(UUID.randomUUID().toString(), OperationType.DELETE, collection,
                recordId, Map.of(), 0, clock.instant(), null));
    }

    private synchronized PendingOperation enqueue(PendingOperation operation) {
        if (operations.size() >= maxQueueSize) {
            PendingOperation dropped = operations.removeFirst();
            log.warn("Sync queue full, dropped oldest operation {} on {}/{}",
                    dropped.id(), dropped.collection(), dropped.recordId());
        }
        operations.addLast(operation);
        persist();
        log.debug("Queued {} of {}/{} as {}", operation.type(), operation.collection(),
                operation.recordId(), operation.id());
        return operation;
    }

    public synchronized List<PendingOperation> snapshot() {
        return List.copyOf(operations);
    }

    public synchronized int size() {
        return operations.size();
    }

    public boolean isProcessing() {
        return processing.get();
    }

    public synchronized boolean clear() {
        operations.clear();
        return persist();
    }

    // ==================== Processing ====================

    /**
     * Replays queued operations one after another through {@code handler}.
     *
     * Delivered and conflicting operations leave the queue; failed ones are retried on a later
     * pass until they have failed {@code maxRetries} times. A pass already in progress makes
     * this call return immediately without processing.
     */
    public CompletableFuture<SyncResult> process(Function<PendingOperation, CompletableFuture<Outcome>> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        if (!processing.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(SyncResult.skipped("Sync already in progress"));
        }

        List<PendingOperation> batch = snapshot();
        log.info("Starting sync with {} pending operations", batch.size());
        Tally tally = new Tally();

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (PendingOperation operation : batch) {
            chain = chain.thenCompose(ignored -> invoke(handler, operation)
                    .handle((outcome, error) -> {
                        apply(operation, error == null ? outcome : Outcome.FAILED, error, tally);
                        return null;
                    }));
        }

        return chain.handle((ignored, error) -> {
            processing.set(false);
            synchronized (this) {
                persist();
            }
            SyncResult result = new SyncResult(error == null,
                    error == null ? "Sync completed" : "Sync failed: " + error.getMessage(),
                    tally.delivered, tally.conflicts, tally.failed, tally.discarded, clock.instant());
            log.info("Sync completed: {} operations processed, {} conflicts detected, {} failed",
                    result.operationsProcessed(), result.conflictsDetected(), result.operationsFailed());
            return result;
        });
    }

    private CompletableFuture<Outcome> invoke(Function<PendingOperation, CompletableFuture<Outcome>> handler,
                                              PendingOperation operation) {
        try {
            CompletableFuture<Outcome> future = handler.apply(operation);
            return future != null ? future : CompletableFuture.completedFuture(Outcome.FAILED);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private synchronized void apply(PendingOperation operation, Outcome outcome, Throwable error, Tally tally) {
        switch (outcome) {
            case DELIVERED -> {
                operations.removeIf(op -> op.id().equals(operation.id()));
                tally.delivered++;
            }
            case CONFLICT -> {
                operations.removeIf(op -> op.id().equals(operation.id()));
                tally.conflicts++;
            }
            case FAILED -> {
                tally.failed++;
                int index = indexOf(operation.id());
                if (index < 0) {
                    return;
                }
                PendingOperation retried = operation.failedAttempt(
                        error != null ? RetryPolicy.unwrap(error).getMessage() : "Operation failed");
                if (retried.retryCount() >= maxRetries) {
                    operations.remove(index);
                    tally.discarded++;
                    log.warn("Operation {} exceeded max retries, removing from queue", operation.id());
                } else {
                    operations.set(index, retried);
                }
            }
        }
    }

    private int indexOf(String operationId) {
        for (int i = 0; i < operations.size(); i++) {
            if (operations.get(i).id().equals(operationId)) {
                return i;
            }
        }
        return -1;
    }

    private boolean persist() {
        try {
            store.setString(queueKey, objectMapper.writeValueAsString(new ArrayList<>(operations)));
            return true;
        } catch (JsonProcessingException | KeyValueStore.KeyValueStoreException e) {
            log.warn("Failed to save pending operations", e);
            return false;
        }
    }

    private static final class Tally {
        int delivered;
        int conflicts;
        int failed;
        int discarded;
    }

    // ==================== Inner Types ====================

    public enum OperationType {
        WRITE,
        DELETE
    }

    /**
     * Result of replaying one operation against the remote.
     */
    public enum Outcome {
        DELIVERED,
        CONFLICT,
        FAILED
    }

    public record PendingOperation(
            String id,
            OperationType type,
            String collection,
            String recordId,
            Map<String, FieldValue> fields,
            int retryCount,
            Instant queuedAt,
            String lastError
    ) {
        public PendingOperation {
            Objects.requireNonNull(id, "Operation ID cannot be null");
            Objects.requireNonNull(type, "Operation type cannot be null");
            Objects.requireNonNull(collection, "Collection cannot be null");
            Objects.requireNonNull(recordId, "Record ID cannot be null");
            fields = Records.copyOf(fields);
        }

        PendingOperation failedAttempt(String error) {
            return new PendingOperation(id, type, collection, recordId, fields, retryCount + 1, queuedAt, error);
        }
    }
}
