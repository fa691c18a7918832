package com.dosify.node.store;

import com.dosify.node.cache.TtlCache;
import com.dosify.node.crypto.FieldEncryptor;
import com.dosify.node.kv.KeyValueStore;
import com.dosify.node.query.QueryResult;
import com.dosify.node.query.QueryResultCache;
import com.dosify.node.query.QuerySignature;
import com.dosify.node.record.Document;
import com.dosify.node.record.FieldValue;
import com.dosify.node.record.Records;
import com.dosify.node.remote.RemoteAvailability;
import com.dosify.node.remote.RemoteStore;
import com.dosify.node.remote.RemoteStoreException;
import com.dosify.node.remote.RetryPolicy;
import com.dosify.node.remote.WritePrecondition;
import com.dosify.node.sync.ConflictData;
import com.dosify.node.sync.ConflictQueue;
import com.dosify.node.sync.ConflictResolutionItem;
import com.dosify.node.sync.ConflictState;
import com.dosify.node.sync.FieldChoice;
import com.dosify.node.sync.PendingWriteQueue;
import com.dosify.node.sync.ResolutionPolicy;
import com.dosify.node.sync.ResolutionStrategy;
import com.dosify.node.sync.SyncConflictResolver;
import com.dosify.node.sync.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Single entry point for reading and writing records across the storage tiers.
 *
 * Reads go cache, remote, encrypted local, plain local; the first tier that answers wins.
 * Writes go to the remote under a version precondition and always to both local tiers. A
 * rejected precondition surfaces a {@link ConflictResolutionItem} instead of overwriting the
 * remote. Writes the remote could not take are queued and replayed by
 * {@link #synchronizePending()}.
 *
 * No write is atomic across tiers: each tier's result is reported in the {@link WriteOutcome}.
 */
public class TieredStore {

    private static final Logger log = LoggerFactory.getLogger(TieredStore.class);

    static final String RECORD_KEY_PREFIX = "record:";

    private final StoreConfig config;
    private final RemoteStore remote;
    private final RemoteAvailability availability;
    private final FieldEncryptor encryptor;
    private final TtlCache cache;
    private final QueryResultCache queryCache;
    private final EncryptedLocalTier encryptedTier;
    private final PlainLocalTier plainTier;
    private final SyncConflictResolver resolver;
    private final ConflictQueue conflicts;
    private final PendingWriteQueue pendingWrites;
    private final VersionTracker versions;
    private final KeyValueStore localStore;
    private final String lastSyncKey;
    private final Clock clock;

    public TieredStore(StoreConfig config,
                       RemoteStore remote,
                       KeyValueStore localStore,
                       FieldEncryptor encryptor,
                       TtlCache cache,
                       ConflictQueue conflicts,
                       PendingWriteQueue pendingWrites,
                       RemoteAvailability availability,
                       Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        if (remote == null) {
            throw new IllegalArgumentException("Remote store cannot be null");
        }
        if (localStore == null) {
            throw new IllegalArgumentException("Local store cannot be null");
        }
        if (encryptor == null) {
            throw new IllegalArgumentException("Encryptor cannot be null");
        }
        if (cache == null || conflicts == null || pendingWrites == null || availability == null) {
            throw new IllegalArgumentException("Cache, conflict queue, write queue and availability are required");
        }
        this.config = config;
        this.remote = remote;
        this.localStore = localStore;
        this.encryptor = encryptor;
        this.cache = cache;
        this.queryCache = new QueryResultCache(cache, new EncryptedQueryForm());
        this.conflicts = conflicts;
        this.pendingWrites = pendingWrites;
        this.availability = availability;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.encryptedTier = new EncryptedLocalTier(localStore, encryptor, config);
        this.plainTier = new PlainLocalTier(localStore, config.localPrefix());
        this.resolver = new SyncConflictResolver();
        this.versions = new VersionTracker(localStore, config.localPrefix());
        this.lastSyncKey = config.localPrefix() + "_last_sync_time";
    }

    // ==================== Read ====================

    /**
     * Reads a record from the first tier that has it.
     *
     * The returned future fails with {@link RecordUnavailableException} when no tier could
     * serve the record.
     */
    public CompletableFuture<TieredRecord> read(String collection, String id) {
        validate(collection, id);

        Optional<Map<String, FieldValue>> cached = readCache(collection, id);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(new TieredRecord(collection, id, cached.get(), Tier.CACHE));
        }

        if (!availability.isAvailable()) {
            log.debug("Remote marked unavailable, reading {}/{} locally", collection, id);
            return completeWith(() -> readLocal(collection, id));
        }

        return call(() -> remote.getById(collection, id))
                .handle((document, error) -> {
                    if (error == null) {
                        Map<String, FieldValue> fields = document.fields();
                        versions.record(collection, id, Records.lastUpdate(fields).orElse(null));
                        writeThrough(collection, id, fields);
                        return new TieredRecord(collection, id, fields, Tier.REMOTE);
                    }
                    noteRemoteFailure("read of " + collection + "/" + id, error);
                    return readLocal(collection, id);
                });
    }

    /**
     * Runs a query against the remote through the query cache. When the remote cannot answer
     * and nothing is cached, the query is evaluated over the local tiers.
     */
    public CompletableFuture<QueryResult> query(QuerySignature signature) {
        return query(signature, config.queryTtl());
    }

    public CompletableFuture<QueryResult> query(QuerySignature signature, Duration ttl) {
        if (signature == null) {
            throw new IllegalArgumentException("Signature cannot be null");
        }
        return queryCache.cachedQuery(signature, ttl, () -> fetchQuery(signature))
                .handle((result, error) -> {
                    if (error == null) {
                        return result;
                    }
                    log.warn("Query on {} not answerable remotely, scanning local tiers: {}",
                            signature.collection(), RetryPolicy.unwrap(error).getMessage());
                    return signature.applyTo(scanLocal(signature.collection()));
                });
    }

    // ==================== Write ====================

    /**
     * Writes a record, stamping it with a fresh {@code lastUpdate}.
     */
    public CompletableFuture<WriteOutcome> write(String collection, String id, Map<String, FieldValue> fields) {
        validate(collection, id);
        if (fields == null) {
            throw new IllegalArgumentException("Fields cannot be null");
        }
        Map<String, FieldValue> stamped = Records.withLastUpdate(fields, clock.instant());

        CompletableFuture<RemoteResult> remoteWrite;
        if (availability.isAvailable()) {
            remoteWrite = pushWrite(collection, id, stamped, true);
        } else {
            pendingWrites.enqueueWrite(collection, id, stamped);
            remoteWrite = CompletableFuture.completedFuture(RemoteResult.of(WriteOutcome.RemoteOutcome.QUEUED));
        }

        return remoteWrite.thenApply(result -> {
            Map<Tier, Boolean> local = writeLocal(collection, id, stamped);
            invalidate(collection, id);
            return new WriteOutcome(result.outcome(), local, result.conflict());
        });
    }

    /**
     * Deletes a record from every tier. The remote delete is queued when the remote is unreachable.
     */
    public CompletableFuture<WriteOutcome> delete(String collection, String id) {
        validate(collection, id);

        Map<Tier, Boolean> local = new EnumMap<>(Tier.class);
        local.put(Tier.ENCRYPTED_LOCAL, removeLocal(encryptedTier, collection, id));
        local.put(Tier.PLAIN_LOCAL, removeLocal(plainTier, collection, id));
        invalidate(collection, id);

        if (!availability.isAvailable()) {
            pendingWrites.enqueueDelete(collection, id);
            return CompletableFuture.completedFuture(
                    new WriteOutcome(WriteOutcome.RemoteOutcome.QUEUED, local, Optional.empty()));
        }

        return call(() -> remote.deleteDocument(collection, id))
                .handle((ignored, error) -> {
                    if (error == null) {
                        versions.forget(collection, id);
                        return new WriteOutcome(WriteOutcome.RemoteOutcome.WRITTEN, local, Optional.empty());
                    }
                    noteRemoteFailure("delete of " + collection + "/" + id, error);
                    pendingWrites.enqueueDelete(collection, id);
                    return new WriteOutcome(WriteOutcome.RemoteOutcome.QUEUED, local, Optional.empty());
                });
    }

    /**
     * Clears the cache and both local tiers. Every tier is attempted even when an earlier one fails.
     */
    public ClearOutcome clearAll() {
        boolean cacheCleared = cache.clear();

        boolean encryptedCleared = clearTier(encryptedTier);
        boolean plainCleared = clearTier(plainTier);

        ClearOutcome outcome = new ClearOutcome(cacheCleared, encryptedCleared, plainCleared);
        if (outcome.success()) {
            log.info("All local tiers cleared");
        } else {
            log.warn("Clearing tiers incomplete: {}", outcome);
        }
        return outcome;
    }

    // ==================== Conflicts ====================

    /**
     * Pending conflicts and their subscription stream.
     */
    public ConflictQueue conflicts() {
        return conflicts;
    }

    public ConflictResolutionItem presentConflict(String itemId) {
        return conflicts.present(itemId);
    }

    public CompletableFuture<WriteOutcome> resolveConflict(String itemId, ResolutionStrategy strategy) {
        return resolveConflict(itemId, strategy, Map.of());
    }

    /**
     * Applies the chosen resolution of a presented conflict to every tier.
     *
     * {@link ResolutionStrategy#USE_REMOTE} only adopts the remote copy locally. The other
     * strategies write the resolved record to the remote, conditioned on the remote version the
     * conflict was detected against; a newer remote change raises a fresh conflict.
     *
     * @throws IllegalStateException if the conflict has not been presented
     * @throws SyncConflictResolver.MissingFieldChoiceException if a merge lacks a field choice
     */
    public CompletableFuture<WriteOutcome> resolveConflict(String itemId, ResolutionStrategy strategy,
                                                           Map<String, FieldChoice> fieldChoices) {
        ConflictResolutionItem item = conflicts.find(itemId)
                .orElseThrow(() -> new IllegalArgumentException("Conflict not found: " + itemId));
        if (item.state() != ConflictState.PRESENTED) {
            throw new IllegalStateException("Conflict " + itemId + " must be presented before resolution");
        }
        Map<String, FieldValue> resolved = resolver.resolve(item, strategy, fieldChoices);
        conflicts.markResolved(itemId, strategy);

        String collection = item.collection();
        String id = item.recordId();
        Instant remoteVersion = item.conflictData().remoteTimestamp();

        if (strategy == ResolutionStrategy.USE_REMOTE) {
            Map<String, FieldValue> adopted = remoteVersion != null
                    ? Records.withLastUpdate(resolved, remoteVersion)
                    : resolved;
            versions.record(collection, id, remoteVersion);
            Map<Tier, Boolean> local = writeLocal(collection, id, adopted);
            invalidate(collection, id);
            return CompletableFuture.completedFuture(
                    new WriteOutcome(WriteOutcome.RemoteOutcome.UNCHANGED, local, Optional.empty()));
        }

        versions.record(collection, id, remoteVersion);
        return write(collection, id, resolved);
    }

    /**
     * Resolves a conflict with an automatic policy. The conflict is presented first so the
     * resolution shows up in the audit history like a manual one.
     */
    public CompletableFuture<WriteOutcome> resolveWithPolicy(String itemId, ResolutionPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Policy cannot be null");
        }
        ConflictResolutionItem presented = conflicts.present(itemId);
        ResolutionPolicy.Decision decision = policy.decide(presented.conflictData());
        return resolveConflict(itemId, decision.strategy(), decision.fieldChoices());
    }

    // ==================== Synchronization ====================

    /**
     * Replays queued writes and deletes. Deferred while the remote is marked unavailable.
     */
    public CompletableFuture<SyncResult> synchronizePending() {
        if (!availability.isAvailable()) {
            return CompletableFuture.completedFuture(SyncResult.skipped("Offline - processing deferred"));
        }
        return pendingWrites.process(this::replay)
                .thenApply(result -> {
                    if (result.success() && result.completedAt() != null) {
                        rememberSyncTime(result.completedAt());
                    }
                    return result;
                });
    }

    /**
     * Clears the unavailable flag and replays the queue.
     */
    public CompletableFuture<SyncResult> reconnect() {
        availability.reset();
        return synchronizePending();
    }

    public SyncStatistics statistics() {
        return new SyncStatistics(
                lastSyncTime().orElse(null),
                pendingWrites.size(),
                conflicts.size(),
                availability.isAvailable(),
                pendingWrites.isProcessing()
        );
    }

    // ==================== Private Methods ====================

    private CompletableFuture<PendingWriteQueue.Outcome> replay(PendingWriteQueue.PendingOperation operation) {
        String collection = operation.collection();
        String id = operation.recordId();
        return switch (operation.type()) {
            case WRITE -> pushWrite(collection, id, operation.fields(), false)
                    .thenApply(result -> switch (result.outcome()) {
                        case WRITTEN, UNCHANGED -> PendingWriteQueue.Outcome.DELIVERED;
                        case CONFLICT -> PendingWriteQueue.Outcome.CONFLICT;
                        case QUEUED, FAILED -> PendingWriteQueue.Outcome.FAILED;
                    });
            case DELETE -> call(() -> remote.deleteDocument(collection, id))
                    .handle((ignored, error) -> {
                        if (error == null) {
                            versions.forget(collection, id);
                            return PendingWriteQueue.Outcome.DELIVERED;
                        }
                        noteRemoteFailure("replayed delete of " + collection + "/" + id, error);
                        return PendingWriteQueue.Outcome.FAILED;
                    });
        };
    }

    /**
     * Writes to the remote under the last seen version. Never completes exceptionally.
     *
     * @param queueOnFailure queue the write when the remote cannot be reached
     */
    private CompletableFuture<RemoteResult> pushWrite(String collection, String id,
                                                      Map<String, FieldValue> stamped, boolean queueOnFailure) {
        WritePrecondition precondition = versions.lastSeen(collection, id)
                .map(WritePrecondition::lastUpdateEquals)
                .orElse(WritePrecondition.absent());

        return call(() -> remote.setDocument(collection, id, stamped, precondition))
                .handle((ignored, error) -> {
                    if (error == null) {
                        versions.record(collection, id, Records.lastUpdate(stamped).orElse(null));
                        log.debug("Remote write of {}/{} accepted", collection, id);
                        return CompletableFuture.completedFuture(RemoteResult.of(WriteOutcome.RemoteOutcome.WRITTEN));
                    }
                    Throwable cause = RetryPolicy.unwrap(error);
                    if (cause instanceof RemoteStoreException e
                            && e.kind() == RemoteStoreException.Kind.PRECONDITION_FAILED) {
                        return surfaceConflict(collection, id, stamped, queueOnFailure);
                    }
                    return CompletableFuture.completedFuture(
                            remoteWriteFailed(collection, id, stamped, cause, queueOnFailure));
                })
                .thenCompose(result -> result);
    }

    private CompletableFuture<RemoteResult> surfaceConflict(String collection, String id,
                                                            Map<String, FieldValue> stamped, boolean queueOnFailure) {
        return call(() -> remote.getById(collection, id))
                .handle((document, error) -> {
                    if (error != null) {
                        Throwable cause = RetryPolicy.unwrap(error);
                        if (cause instanceof RemoteStoreException e && e.kind() == RemoteStoreException.Kind.NOT_FOUND) {
                            // Deleted remotely since last seen; the replay recreates it.
                            versions.forget(collection, id);
                        }
                        return remoteWriteFailed(collection, id, stamped, cause, queueOnFailure);
                    }
                    Map<String, FieldValue> remoteFields = document.fields();
                    Optional<ConflictData> conflict = resolver.detectConflict(
                            Records.withoutLastUpdate(stamped), Records.lastUpdate(stamped).orElse(null),
                            Records.withoutLastUpdate(remoteFields), Records.lastUpdate(remoteFields).orElse(null));

                    if (conflict.isEmpty()) {
                        // Same content already stored remotely.
                        versions.record(collection, id, Records.lastUpdate(remoteFields).orElse(null));
                        return RemoteResult.of(WriteOutcome.RemoteOutcome.UNCHANGED);
                    }
                    ConflictResolutionItem item = conflicts.enqueue(collection, id, conflict.get());
                    return new RemoteResult(WriteOutcome.RemoteOutcome.CONFLICT, Optional.of(item));
                });
    }

    private RemoteResult remoteWriteFailed(String collection, String id, Map<String, FieldValue> stamped,
                                           Throwable cause, boolean queueOnFailure) {
        noteRemoteFailure("write of " + collection + "/" + id, cause);
        if (!queueOnFailure) {
            return RemoteResult.of(WriteOutcome.RemoteOutcome.FAILED);
        }
        pendingWrites.enqueueWrite(collection, id, stamped);
        return RemoteResult.of(WriteOutcome.RemoteOutcome.QUEUED);
    }

    private void noteRemoteFailure(String operation, Throwable error) {
        Throwable cause = RetryPolicy.unwrap(error);
        if (cause instanceof RemoteStoreException e) {
            if (e.isUnavailable()) {
                availability.markUnavailable(e.getMessage());
            }
            if (e.kind() == RemoteStoreException.Kind.NOT_FOUND) {
                log.debug("Remote {} found nothing", operation);
                return;
            }
            log.warn("Remote {} failed ({}): {}", operation, e.kind(), e.getMessage());
            return;
        }
        availability.markUnavailable(String.valueOf(cause.getMessage()));
        log.warn("Remote {} failed", operation, cause);
    }

    private CompletableFuture<QueryResult> fetchQuery(QuerySignature signature) {
        if (!availability.isAvailable()) {
            return CompletableFuture.failedFuture(new RemoteStoreException(
                    RemoteStoreException.Kind.UNAVAILABLE, "Remote marked unavailable"));
        }
        return call(() -> remote.streamCollection(signature.collection(), signature.filters()))
                .thenApply(stream -> {
                    try (stream) {
                        return signature.applyTo(stream.toList());
                    }
                })
                .whenComplete((result, error) -> {
                    if (error != null) {
                        noteRemoteFailure("query on " + signature.collection(), error);
                    }
                });
    }

    private List<Document> scanLocal(String collection) {
        Map<String, Document> byId = new LinkedHashMap<>();
        for (Document document : safeList(encryptedTier, collection)) {
            byId.put(document.id(), document);
        }
        for (Document document : safeList(plainTier, collection)) {
            byId.putIfAbsent(document.id(), document);
        }
        return new ArrayList<>(byId.values());
    }

    private List<Document> safeList(LocalTier tier, String collection) {
        try {
            return tier.list(collection);
        } catch (RuntimeException e) {
            log.warn("Listing {} of {} failed", tier.tier(), collection, e);
            return List.of();
        }
    }

    private TieredRecord readLocal(String collection, String id) {
        try {
            Optional<Map<String, FieldValue>> fields = encryptedTier.get(collection, id);
            if (fields.isPresent()) {
                log.debug("Serving {}/{} from encrypted local tier", collection, id);
                return new TieredRecord(collection, id, fields.get(), Tier.ENCRYPTED_LOCAL);
            }
        } catch (FieldEncryptor.DecryptionException e) {
            log.error("SECURITY: encrypted local copy of {}/{} failed to decrypt (key loss or tampering), "
                    + "falling back to plain tier", collection, id, e);
        } catch (FieldEncryptor.EncryptionUnavailableException e) {
            log.warn("Encryption key unavailable, skipping encrypted tier for {}/{}", collection, id);
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Encrypted local tier unreadable for {}/{}", collection, id, e);
        }

        try {
            Optional<Map<String, FieldValue>> fields = plainTier.get(collection, id);
            if (fields.isPresent()) {
                log.debug("Serving {}/{} from plain local tier", collection, id);
                return new TieredRecord(collection, id, fields.get(), Tier.PLAIN_LOCAL);
            }
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Plain local tier unreadable for {}/{}", collection, id, e);
        }

        log.error("Record {}/{} unavailable in every tier", collection, id);
        throw new RecordUnavailableException(collection, id);
    }

    private Optional<Map<String, FieldValue>> readCache(String collection, String id) {
        if (!encryptor.isReady()) {
            return Optional.empty();
        }
        Optional<Map<String, FieldValue>> stored = cache.get(recordKey(collection, id), Records.FIELD_MAP);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            log.debug("Cache hit for {}/{}", collection, id);
            return Optional.of(encryptor.decryptRecord(stored.get(), config.sensitiveFieldsOf(collection)));
        } catch (FieldEncryptor.DecryptionException e) {
            log.error("SECURITY: cached copy of {}/{} failed to decrypt, treating as miss", collection, id, e);
            return Optional.empty();
        }
    }

    private void writeThrough(String collection, String id, Map<String, FieldValue> fields) {
        if (!encryptor.isReady()) {
            log.warn("Encryption key unavailable, {}/{} not written through", collection, id);
            return;
        }
        Set<String> sensitive = config.sensitiveFieldsOf(collection);
        if (!cache.set(recordKey(collection, id), encryptor.encryptRecord(fields, sensitive), config.recordTtl())) {
            log.warn("Cache write-through failed for {}/{}", collection, id);
        }
        putLocal(encryptedTier, collection, id, fields);
    }

    private Map<Tier, Boolean> writeLocal(String collection, String id, Map<String, FieldValue> fields) {
        Map<Tier, Boolean> outcome = new EnumMap<>(Tier.class);
        outcome.put(Tier.ENCRYPTED_LOCAL, putLocal(encryptedTier, collection, id, fields));
        outcome.put(Tier.PLAIN_LOCAL, putLocal(plainTier, collection, id, fields));
        return outcome;
    }

    private boolean putLocal(LocalTier tier, String collection, String id, Map<String, FieldValue> fields) {
        try {
            tier.put(collection, id, fields);
            return true;
        } catch (FieldEncryptor.EncryptionUnavailableException | KeyValueStore.KeyValueStoreException e) {
            log.warn("Write of {}/{} to {} failed", collection, id, tier.tier(), e);
            return false;
        }
    }

    private boolean removeLocal(LocalTier tier, String collection, String id) {
        try {
            tier.remove(collection, id);
            return true;
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Removal of {}/{} from {} failed", collection, id, tier.tier(), e);
            return false;
        }
    }

    private boolean clearTier(LocalTier tier) {
        try {
            int removed = tier.clear();
            log.info("Cleared {} records from {}", removed, tier.tier());
            return true;
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Clearing {} failed", tier.tier(), e);
            return false;
        }
    }

    private void invalidate(String collection, String id) {
        cache.remove(recordKey(collection, id));
        queryCache.invalidate(collection);
    }

    private Optional<Instant> lastSyncTime() {
        try {
            return localStore.getLong(lastSyncKey).map(Instant::ofEpochMilli);
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Last sync time unreadable", e);
            return Optional.empty();
        }
    }

    private void rememberSyncTime(Instant completedAt) {
        try {
            localStore.setLong(lastSyncKey, completedAt.toEpochMilli());
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Could not persist last sync time", e);
        }
    }

    private static String recordKey(String collection, String id) {
        return RECORD_KEY_PREFIX + collection + ":" + id;
    }

    private static void validate(String collection, String id) {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("Collection cannot be null or blank");
        }
        if (collection.contains(":")) {
            throw new IllegalArgumentException("Collection name cannot contain ':'");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Record ID cannot be null or blank");
        }
    }

    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> operation) {
        try {
            return operation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static <T> CompletableFuture<T> completeWith(Supplier<T> operation) {
        try {
            return CompletableFuture.completedFuture(operation.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private record RemoteResult(WriteOutcome.RemoteOutcome outcome, Optional<ConflictResolutionItem> conflict) {
        static RemoteResult of(WriteOutcome.RemoteOutcome outcome) {
            return new RemoteResult(outcome, Optional.empty());
        }
    }

    /**
     * Cached query results carry their sensitive fields encrypted, like cached records.
     */
    private final class EncryptedQueryForm implements QueryResultCache.StoredForm {

        @Override
        public QueryResult seal(String collection, QueryResult result) {
            Set<String> sensitive = config.sensitiveFieldsOf(collection);
            if (sensitive.isEmpty()) {
                return result;
            }
            List<Document> sealed = new ArrayList<>(result.size());
            for (Document document : result.documents()) {
                sealed.add(new Document(document.id(), encryptor.encryptRecord(document.fields(), sensitive)));
            }
            return new QueryResult(sealed);
        }

        @Override
        public QueryResult open(String collection, QueryResult stored) {
            Set<String> sensitive = config.sensitiveFieldsOf(collection);
            if (sensitive.isEmpty()) {
                return stored;
            }
            List<Document> opened = new ArrayList<>(stored.size());
            for (Document document : stored.documents()) {
                opened.add(new Document(document.id(), encryptor.decryptRecord(document.fields(), sensitive)));
            }
            return new QueryResult(opened);
        }
    }

    // ==================== Exceptions ====================

    /**
     * No tier could serve the record.
     */
    public static class RecordUnavailableException extends RuntimeException {
        private final String collection;
        private final String recordId;

        public RecordUnavailableException(String collection, String recordId) {
            super("Record unavailable in every tier: " + collection + "/" + recordId);
            this.collection = collection;
            this.recordId = recordId;
        }

        public String getCollection() {
            return collection;
        }

        public String getRecordId() {
            return recordId;
        }
    }
}
