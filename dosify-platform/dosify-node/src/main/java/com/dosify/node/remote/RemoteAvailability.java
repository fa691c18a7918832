package com.dosify.node.remote;

import com.dosify.node.kv.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Remembers whether the remote store was last found unreachable.
 * While the flag is down the remote tier is skipped instead of paying a network timeout per call.
 * The flag survives restarts so an offline device starts in offline mode.
 *
 * The flag lapses once {@code retryInterval} has passed since the remote was marked
 * unavailable; the next call then tries the remote again.
 */
public class RemoteAvailability {

    private static final Logger log = LoggerFactory.getLogger(RemoteAvailability.class);

    private final KeyValueStore store;
    private final String flagKey;
    private final String sinceKey;
    private final Duration retryInterval;
    private final Clock clock;

    private boolean available;
    private Instant unavailableSince;

    public RemoteAvailability(KeyValueStore store, String keyPrefix, Duration retryInterval, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }
        if (retryInterval == null || retryInterval.isNegative()) {
            throw new IllegalArgumentException("Retry interval cannot be null or negative");
        }
        this.store = store;
        this.flagKey = keyPrefix + "_remote_available";
        this.sinceKey = keyPrefix + "_remote_unavailable_since";
        this.retryInterval = retryInterval;
        this.clock = clock != null ? clock : Clock.systemUTC();
        load();
    }

    /**
     * @return true when the remote should be tried, including after the retry interval lapsed
     */
    public synchronized boolean isAvailable() {
        if (!available && !clock.instant().isBefore(unavailableSince.plus(retryInterval))) {
            log.info("Remote unavailable since {}, trying it again", unavailableSince);
            available = true;
            persist();
        }
        return available;
    }

    /**
     * Marks the remote unreachable; a repeated failure restarts the retry interval.
     */
    public synchronized void markUnavailable(String reason) {
        if (available) {
            log.warn("Remote store marked unavailable: {}", reason);
        }
        available = false;
        unavailableSince = clock.instant();
        persist();
    }

    /**
     * Clears the unavailable flag so the next call tries the remote again.
     */
    public synchronized void reset() {
        if (!available) {
            log.info("Remote store availability reset");
        }
        available = true;
        persist();
    }

    private void load() {
        try {
            available = store.getBoolean(flagKey).orElse(true);
            unavailableSince = store.getLong(sinceKey).map(Instant::ofEpochMilli).orElse(clock.instant());
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Could not read remote availability flag, assuming available", e);
            available = true;
            unavailableSince = clock.instant();
        }
    }

    private void persist() {
        try {
            store.setBoolean(flagKey, available);
            store.setLong(sinceKey, unavailableSince.toEpochMilli());
        } catch (KeyValueStore.KeyValueStoreException e) {
            log.warn("Could not persist remote availability flag", e);
        }
    }
}
