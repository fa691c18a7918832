package com.dosify.node.query;

import com.dosify.node.cache.TtlCache;
import com.dosify.node.remote.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Caches query results in a {@link TtlCache} under their signature key.
 *
 * A fetch failure is answered with the last cached result, even an expired one, when one
 * exists; otherwise the failure propagates. Cache failures only ever cost a fetch.
 *
 * Results pass through a {@link StoredForm} on their way in and out of the cache, so a caller
 * can keep sensitive fields encrypted at rest. An entry that cannot be opened counts as a miss.
 */
public class QueryResultCache {

    private static final Logger log = LoggerFactory.getLogger(QueryResultCache.class);

    private final TtlCache cache;
    private final StoredForm storedForm;

    public QueryResultCache(TtlCache cache) {
        this(cache, StoredForm.IDENTITY);
    }

    public QueryResultCache(TtlCache cache, StoredForm storedForm) {
        if (cache == null) {
            throw new IllegalArgumentException("Cache cannot be null");
        }
        if (storedForm == null) {
            throw new IllegalArgumentException("Stored form cannot be null");
        }
        this.cache = cache;
        this.storedForm = storedForm;
    }

    public CompletableFuture<QueryResult> cachedQuery(QuerySignature signature, Duration ttl,
                                                      Supplier<CompletableFuture<QueryResult>> fetch) {
        return cachedQuery(signature, ttl, fetch, false);
    }

    /**
     * Returns the fresh cached result for {@code signature}, or runs {@code fetch} and caches its
     * result for {@code ttl}.
     *
     * @param forceRefresh skip the cache lookup and always fetch
     */
    public CompletableFuture<QueryResult> cachedQuery(QuerySignature signature, Duration ttl,
                                                      Supplier<CompletableFuture<QueryResult>> fetch,
                                                      boolean forceRefresh) {
        if (signature == null) {
            throw new IllegalArgumentException("Signature cannot be null");
        }
        if (fetch == null) {
            throw new IllegalArgumentException("Fetch cannot be null");
        }
        String key = signature.cacheKey();

        if (!forceRefresh) {
            Optional<QueryResult> cached = lookup(signature, false);
            if (cached.isPresent()) {
                log.debug("Query cache hit for {}", key);
                return CompletableFuture.completedFuture(cached.get());
            }
        }

        CompletableFuture<QueryResult> fetched;
        try {
            fetched = fetch.get();
        } catch (RuntimeException e) {
            fetched = CompletableFuture.failedFuture(e);
        }

        return fetched.handle((result, error) -> {
            if (error == null) {
                QueryResult value = result != null ? result : QueryResult.empty();
                store(signature, value, ttl);
                return CompletableFuture.completedFuture(value);
            }
            Optional<QueryResult> stale = lookup(signature, true);
            if (stale.isPresent()) {
                log.warn("Query fetch for {} failed, serving stale result: {}",
                        key, RetryPolicy.unwrap(error).getMessage());
                return CompletableFuture.completedFuture(stale.get());
            }
            return CompletableFuture.<QueryResult>failedFuture(RetryPolicy.unwrap(error));
        }).thenCompose(future -> future);
    }

    /**
     * Removes every cached query of {@code collection}.
     *
     * @return number of removed signatures
     */
    public int invalidate(String collection) {
        String prefix = QuerySignature.collectionPrefix(collection);
        int removed = 0;
        for (String key : cache.keys()) {
            if (key.startsWith(prefix) && cache.remove(key)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Invalidated {} cached queries of {}", removed, collection);
        }
        return removed;
    }

    /**
     * Removes every cached query regardless of collection.
     */
    public int clear() {
        int removed = 0;
        for (String key : cache.keys()) {
            if (key.startsWith(QuerySignature.KEY_PREFIX) && cache.remove(key)) {
                removed++;
            }
        }
        log.info("Cleared {} cached queries", removed);
        return removed;
    }

    // ==================== Private Methods ====================

    private Optional<QueryResult> lookup(QuerySignature signature, boolean ignoreExpiry) {
        String key = signature.cacheKey();
        Optional<QueryResult> stored = cache.get(key, QueryResult.class, ignoreExpiry);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(storedForm.open(signature.collection(), stored.get()));
        } catch (RuntimeException e) {
            log.error("Cached query {} could not be opened, treating as miss", key, e);
            return Optional.empty();
        }
    }

    private void store(QuerySignature signature, QueryResult result, Duration ttl) {
        String key = signature.cacheKey();
        QueryResult sealed;
        try {
            sealed = storedForm.seal(signature.collection(), result);
        } catch (RuntimeException e) {
            log.warn("Query result for {} not cached: {}", key, e.getMessage());
            return;
        }
        if (!cache.set(key, sealed, ttl)) {
            log.warn("Query result for {} could not be cached", key);
        }
    }

    /**
     * Conversion between a query result and the form kept in the cache.
     */
    public interface StoredForm {

        StoredForm IDENTITY = new StoredForm() {
            @Override
            public QueryResult seal(String collection, QueryResult result) {
                return result;
            }

            @Override
            public QueryResult open(String collection, QueryResult stored) {
                return stored;
            }
        };

        QueryResult seal(String collection, QueryResult result);

        QueryResult open(String collection, QueryResult stored);
    }
}
