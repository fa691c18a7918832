package com.dosify.node.remote;

import com.dosify.node.record.Document;
import com.dosify.node.record.FieldValue;
import com.dosify.node.record.Records;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * In-memory implementation of RemoteStore for testing and development.
 * Reachability can be toggled to simulate network loss; version preconditions are checked
 * against the stored {@code lastUpdate} field.
 */
public class InMemoryRemoteStore implements RemoteStore {

    private final Map<String, Map<String, Map<String, FieldValue>>> collections = new ConcurrentHashMap<>();
    private final AtomicBoolean reachable = new AtomicBoolean(true);
    private final AtomicInteger readCount = new AtomicInteger();
    private final AtomicInteger writeCount = new AtomicInteger();

    @Override
    public CompletableFuture<Document> getById(String collection, String id) {
        if (!reachable.get()) {
            return unreachable();
        }
        readCount.incrementAndGet();
        Map<String, FieldValue> fields = collection(collection).get(id);
        if (fields == null) {
            return CompletableFuture.failedFuture(new RemoteStoreException(
                    RemoteStoreException.Kind.NOT_FOUND, "Document not found: " + collection + "/" + id));
        }
        return CompletableFuture.completedFuture(new Document(id, fields));
    }

    @Override
    public CompletableFuture<Stream<Document>> streamCollection(String collection, List<QueryFilter> filters) {
        if (!reachable.get()) {
            return unreachable();
        }
        readCount.incrementAndGet();
        List<QueryFilter> predicates = filters != null ? List.copyOf(filters) : List.of();
        List<Document> matching = collection(collection).entrySet().stream()
                .filter(e -> predicates.stream().allMatch(f -> f.matches(e.getValue())))
                .map(e -> new Document(e.getKey(), e.getValue()))
                .toList();
        return CompletableFuture.completedFuture(matching.stream());
    }

    @Override
    public CompletableFuture<Void> setDocument(String collection, String id, Map<String, FieldValue> fields,
                                               WritePrecondition precondition) {
        if (!reachable.get()) {
            return unreachable();
        }
        Map<String, Map<String, FieldValue>> docs = collection(collection);
        synchronized (docs) {
            Map<String, FieldValue> current = docs.get(id);
            Optional<String> violation = checkPrecondition(current, precondition);
            if (violation.isPresent()) {
                return CompletableFuture.failedFuture(new RemoteStoreException(
                        RemoteStoreException.Kind.PRECONDITION_FAILED, violation.get()));
            }
            docs.put(id, Records.copyOf(fields));
        }
        writeCount.incrementAndGet();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> deleteDocument(String collection, String id) {
        if (!reachable.get()) {
            return unreachable();
        }
        collection(collection).remove(id);
        writeCount.incrementAndGet();
        return CompletableFuture.completedFuture(null);
    }

    public void setReachable(boolean reachable) {
        this.reachable.set(reachable);
    }

    /**
     * Direct access to stored content, bypassing reachability (for testing).
     */
    public Optional<Map<String, FieldValue>> peek(String collection, String id) {
        return Optional.ofNullable(collection(collection).get(id));
    }

    public int getReadCount() {
        return readCount.get();
    }

    public int getWriteCount() {
        return writeCount.get();
    }

    private Map<String, Map<String, FieldValue>> collection(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collection cannot be null or blank");
        }
        return collections.computeIfAbsent(name, n -> new ConcurrentHashMap<>());
    }

    private static Optional<String> checkPrecondition(Map<String, FieldValue> current, WritePrecondition precondition) {
        if (precondition == null || precondition.isNone()) {
            return Optional.empty();
        }
        if (precondition.mustNotExist()) {
            return current == null ? Optional.empty() : Optional.of("Document already exists");
        }
        if (current == null) {
            return Optional.of("Document no longer exists");
        }
        Instant stored = Records.lastUpdate(current).orElse(null);
        if (!precondition.expectedLastUpdate().equals(stored)) {
            return Optional.of("Stored version " + stored + " differs from expected " + precondition.expectedLastUpdate());
        }
        return Optional.empty();
    }

    private static <T> CompletableFuture<T> unreachable() {
        return CompletableFuture.failedFuture(new RemoteStoreException(
                RemoteStoreException.Kind.UNAVAILABLE, "Remote store unreachable"));
    }
}
