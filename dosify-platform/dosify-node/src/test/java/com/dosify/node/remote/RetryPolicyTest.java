package com.dosify.node.remote;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    // ==================== Property 1: Back-off ====================

    @Property(tries = 50)
    void property1_delaysGrowGeometrically(@ForAll @IntRange(min = 1, max = 8) int retry) {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(100), 2.0);

        assertThat(policy.delayBefore(retry + 1)).isEqualTo(policy.delayBefore(retry).multipliedBy(2));
        assertThat(policy.delayBefore(1)).isEqualTo(Duration.ofMillis(100));
    }

    // ==================== Execution ====================

    @Test
    void succeedsOnceAnAttemptSucceeds() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, 1.0);

        String result = policy.execute(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void lastFailureIsRethrownWhenAttemptsRunOut() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> RetryPolicy.none().execute(() -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("down");
        })).isInstanceOf(IllegalStateException.class).hasMessage("down");
        assertThat(attempts).hasValue(1);
    }

    @Test
    void invalidParametersAreRejected() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofSeconds(-1), 1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ZERO, 0.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unwrapStripsFutureWrappers() {
        RemoteStoreException cause = new RemoteStoreException(RemoteStoreException.Kind.UNAVAILABLE, "offline");

        assertThat(RetryPolicy.unwrap(new CompletionException(new ExecutionException(cause)))).isSameAs(cause);
        assertThat(RetryPolicy.unwrap(cause)).isSameAs(cause);
    }
}
