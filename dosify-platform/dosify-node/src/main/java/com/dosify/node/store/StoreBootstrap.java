package com.dosify.node.store;

import com.dosify.node.cache.TtlCache;
import com.dosify.node.crypto.FieldEncryptor;
import com.dosify.node.key.KeyManager;
import com.dosify.node.key.SecureKeyStore;
import com.dosify.node.kv.KeyValueStore;
import com.dosify.node.remote.RemoteAvailability;
import com.dosify.node.remote.RemoteStore;
import com.dosify.node.sync.ConflictQueue;
import com.dosify.node.sync.PendingWriteQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Builds the store's components once at process start and wires them together explicitly.
 * Stages run in order: key init, cache init, sync state load, store assembly. Each stage is
 * idempotent and requires the previous one.
 */
public class StoreBootstrap {

    private static final Logger log = LoggerFactory.getLogger(StoreBootstrap.class);

    private final StoreConfig config;
    private final KeyValueStore localStore;
    private final RemoteStore remote;
    private final Clock clock;

    private final KeyManager keyManager;
    private final FieldEncryptor encryptor;
    private final TtlCache cache;
    private final ConflictQueue conflictQueue;
    private final PendingWriteQueue pendingWrites;
    private final RemoteAvailability availability;

    private final AtomicBoolean keyInitialized = new AtomicBoolean(false);
    private final AtomicBoolean cacheInitialized = new AtomicBoolean(false);
    private final AtomicBoolean syncStateLoaded = new AtomicBoolean(false);

    private volatile TieredStore store;
    private Instant keyInitTime;
    private Instant cacheInitTime;
    private Instant syncLoadTime;
    private Instant storeReadyTime;

    public StoreBootstrap(StoreConfig config, SecureKeyStore keyStore, KeyValueStore localStore,
                          RemoteStore remote, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        if (keyStore == null || localStore == null || remote == null) {
            throw new IllegalArgumentException("Key store, local store and remote store are required");
        }
        this.config = config;
        this.localStore = localStore;
        this.remote = remote;
        this.clock = clock != null ? clock : Clock.systemUTC();

        this.keyManager = new KeyManager(keyStore, config.retryPolicy());
        this.encryptor = new FieldEncryptor(keyManager);
        this.cache = new TtlCache(localStore, config.cachePrefix(), config.defaultTtl(), this.clock);
        this.conflictQueue = new ConflictQueue(localStore, config.localPrefix(), this.clock);
        this.pendingWrites = new PendingWriteQueue(localStore, config.localPrefix(),
                config.maxQueueSize(), config.maxRetries(), this.clock);
        this.availability = new RemoteAvailability(localStore, config.localPrefix(),
                config.remoteRetryInterval(), this.clock);
    }

    /**
     * Runs every remaining stage and returns the assembled store.
     *
     * @throws KeyManager.KeyStorageException if the encryption key cannot be loaded or created
     */
    public TieredStore boot() {
        executeKeyInit();
        executeCacheInit();
        executeSyncLoad();
        return executeStoreAssembly();
    }

    /**
     * Step 1: load or create the encryption key.
     */
    public void executeKeyInit() {
        if (keyInitialized.get()) {
            return;
        }
        keyManager.initialize();
        keyInitialized.set(true);
        keyInitTime = clock.instant();
        log.info("Encryption key ready");
    }

    /**
     * Step 2: load the cache expiry index.
     */
    public void executeCacheInit() {
        if (!keyInitialized.get()) {
            throw new IllegalStateException("Keys must be initialized before cache init");
        }
        if (cacheInitialized.get()) {
            return;
        }
        cache.initialize();
        cacheInitialized.set(true);
        cacheInitTime = clock.instant();
    }

    /**
     * Step 3: reload queued writes and unresolved conflicts.
     */
    public void executeSyncLoad() {
        if (!cacheInitialized.get()) {
            throw new IllegalStateException("Cache must be initialized before sync state load");
        }
        if (syncStateLoaded.get()) {
            return;
        }
        pendingWrites.load();
        conflictQueue.load();
        syncStateLoaded.set(true);
        syncLoadTime = clock.instant();
    }

    /**
     * Step 4: assemble the facade.
     */
    public synchronized TieredStore executeStoreAssembly() {
        if (!syncStateLoaded.get()) {
            throw new IllegalStateException("Sync state must be loaded before store assembly");
        }
        if (store == null) {
            store = new TieredStore(config, remote, localStore, encryptor, cache,
                    conflictQueue, pendingWrites, availability, clock);
            storeReadyTime = clock.instant();
            log.info("Tiered store ready ({} pending operations, {} unresolved conflicts, remote {})",
                    pendingWrites.size(), conflictQueue.size(),
                    availability.isAvailable() ? "available" : "unavailable");
        }
        return store;
    }

    public boolean isComplete() {
        return store != null;
    }

    public BootStage getCurrentStage() {
        if (!keyInitialized.get()) return BootStage.KEY_INIT;
        if (!cacheInitialized.get()) return BootStage.CACHE_INIT;
        if (!syncStateLoaded.get()) return BootStage.SYNC_LOAD;
        if (store == null) return BootStage.STORE_ASSEMBLY;
        return BootStage.COMPLETE;
    }

    public KeyManager keyManager() {
        return keyManager;
    }

    public FieldEncryptor encryptor() {
        return encryptor;
    }

    public TtlCache cache() {
        return cache;
    }

    public ConflictQueue conflictQueue() {
        return conflictQueue;
    }

    public PendingWriteQueue pendingWrites() {
        return pendingWrites;
    }

    public RemoteAvailability availability() {
        return availability;
    }

    public Instant getKeyInitTime() { return keyInitTime; }
    public Instant getCacheInitTime() { return cacheInitTime; }
    public Instant getSyncLoadTime() { return syncLoadTime; }
    public Instant getStoreReadyTime() { return storeReadyTime; }

    public enum BootStage {
        KEY_INIT,
        CACHE_INIT,
        SYNC_LOAD,
        STORE_ASSEMBLY,
        COMPLETE
    }
}
