package com.dosify.node.remote;

import com.dosify.node.kv.InMemoryKeyValueStore;
import com.dosify.node.support.MutableClock;
import net.jqwik.api.*;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RemoteAvailabilityTest {

    private static final Duration RETRY_INTERVAL = Duration.ofMinutes(5);

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private RemoteAvailability availability;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new InMemoryKeyValueStore();
        availability = new RemoteAvailability(store, "test", RETRY_INTERVAL, clock);
    }

    // ==================== Property 1: Retry Interval ====================

    @Property(tries = 50)
    void property1_flagLapsesExactlyAtRetryInterval(@ForAll @LongRange(min = 1, max = 3_600) long seconds) {
        MutableClock localClock = new MutableClock();
        Duration interval = Duration.ofSeconds(seconds);
        RemoteAvailability flag = new RemoteAvailability(new InMemoryKeyValueStore(), "test", interval, localClock);

        flag.markUnavailable("timeout");
        localClock.advance(interval.minusMillis(1));
        assertThat(flag.isAvailable()).isFalse();

        localClock.advance(Duration.ofMillis(1));
        assertThat(flag.isAvailable()).isTrue();
    }

    @Test
    void repeatedFailureRestartsTheInterval() {
        availability.markUnavailable("timeout");
        clock.advance(Duration.ofMinutes(4));
        availability.markUnavailable("timeout again");

        clock.advance(Duration.ofMinutes(4));
        assertThat(availability.isAvailable()).isFalse();

        clock.advance(Duration.ofMinutes(1));
        assertThat(availability.isAvailable()).isTrue();
    }

    @Test
    void resetMakesRemoteAvailableImmediately() {
        availability.markUnavailable("timeout");

        availability.reset();

        assertThat(availability.isAvailable()).isTrue();
    }

    // ==================== Persistence ====================

    @Test
    void unavailableStateAndItsStartSurviveRestart() {
        availability.markUnavailable("timeout");
        clock.advance(Duration.ofMinutes(3));

        RemoteAvailability restarted = new RemoteAvailability(store, "test", RETRY_INTERVAL, clock);
        assertThat(restarted.isAvailable()).isFalse();

        clock.advance(Duration.ofMinutes(2));
        assertThat(restarted.isAvailable()).isTrue();
        assertThat(new RemoteAvailability(store, "test", RETRY_INTERVAL, clock).isAvailable()).isTrue();
    }

    @Test
    void freshStoreStartsAvailable() {
        assertThat(availability.isAvailable()).isTrue();
    }

    @Test
    void negativeIntervalIsRejected() {
        assertThatThrownBy(() -> new RemoteAvailability(store, "test", Duration.ofSeconds(-1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
