package com.dosify.node.sync;

import com.dosify.node.kv.InMemoryKeyValueStore;
import com.dosify.node.record.FieldValue;
import com.dosify.node.remote.RemoteStoreException;
import com.dosify.node.support.MutableClock;
import com.dosify.node.sync.PendingWriteQueue.*;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the bounded, persisted pending write queue.
 */
class PendingWriteQueueTest {

    private static final String PREFIX = "dosify_local";

    private InMemoryKeyValueStore store;
    private MutableClock clock;
    private PendingWriteQueue queue;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        clock = new MutableClock();
        queue = new PendingWriteQueue(store, PREFIX, clock);
        queue.load();
    }

    // ==================== Property 1: Bounded queue ====================

    @Property(tries = 30)
    void property1_queueNeverExceedsBoundAndKeepsNewest(
            @ForAll @IntRange(min = 1, max = 10) int bound,
            @ForAll @IntRange(min = 0, max = 30) int writes) {
        PendingWriteQueue bounded = new PendingWriteQueue(new InMemoryKeyValueStore(), PREFIX, bound, 3, new MutableClock());
        for (int i = 0; i < writes; i++) {
            bounded.enqueueWrite("medications", "m" + i, Map.of());
        }

        List<PendingOperation> snapshot = bounded.snapshot();
        assertThat(snapshot).hasSize(Math.min(bound, writes));
        if (writes > 0) {
            assertThat(snapshot.get(snapshot.size() - 1).recordId()).isEqualTo("m" + (writes - 1));
        }
    }

    @Test
    void fullQueueDropsOldestOperation() {
        PendingWriteQueue small = new PendingWriteQueue(store, PREFIX, 2, 3, clock);
        small.enqueueWrite("medications", "a", Map.of());
        small.enqueueWrite("medications", "b", Map.of());
        small.enqueueDelete("medications", "c");

        assertThat(small.snapshot()).extracting(PendingOperation::recordId).containsExactly("b", "c");
    }

    // ==================== Property 2: Replay ====================

    @Test
    void deliveredAndConflictingOperationsLeaveTheQueue() {
        queue.enqueueWrite("medications", "m1", Map.of("name", FieldValue.of("Aspirin")));
        queue.enqueueWrite("medications", "m2", Map.of("name", FieldValue.of("Metformin")));
        queue.enqueueDelete("medications", "m3");

        SyncResult result = queue.process(op -> CompletableFuture.completedFuture(
                op.recordId().equals("m2") ? Outcome.CONFLICT : Outcome.DELIVERED)).join();

        assertThat(result.success()).isTrue();
        assertThat(result.operationsProcessed()).isEqualTo(2);
        assertThat(result.conflictsDetected()).isEqualTo(1);
        assertThat(result.operationsFailed()).isZero();
        assertThat(queue.size()).isZero();
        assertThat(queue.isProcessing()).isFalse();
    }

    @Test
    void operationsReplayInQueueOrder() {
        queue.enqueueWrite("medications", "m1", Map.of());
        queue.enqueueDelete("medications", "m1");
        queue.enqueueWrite("medications", "m2", Map.of());
        List<String> seen = new ArrayList<>();

        queue.process(op -> {
            seen.add(op.type() + ":" + op.recordId());
            return CompletableFuture.completedFuture(Outcome.DELIVERED);
        }).join();

        assertThat(seen).containsExactly("WRITE:m1", "DELETE:m1", "WRITE:m2");
    }

    @Test
    void failedOperationIsRetriedThenDiscardedAfterMaxRetries() {
        queue.enqueueWrite("medications", "m1", Map.of());

        for (int pass = 1; pass <= 2; pass++) {
            SyncResult result = queue.process(op -> CompletableFuture.failedFuture(
                    new RemoteStoreException(RemoteStoreException.Kind.UNAVAILABLE, "offline"))).join();
            assertThat(result.operationsFailed()).isEqualTo(1);
            assertThat(queue.snapshot()).singleElement().satisfies(op -> {
                assertThat(op.lastError()).isEqualTo("offline");
            });
        }
        assertThat(queue.snapshot().get(0).retryCount()).isEqualTo(2);

        SyncResult last = queue.process(op -> CompletableFuture.completedFuture(Outcome.FAILED)).join();

        assertThat(last.operationsDiscarded()).isEqualTo(1);
        assertThat(queue.size()).isZero();
    }

    @Test
    void throwingHandlerCountsAsFailure() {
        queue.enqueueWrite("medications", "m1", Map.of());

        SyncResult result = queue.process(op -> {
            throw new IllegalStateException("boom");
        }).join();

        assertThat(result.operationsFailed()).isEqualTo(1);
        assertThat(queue.snapshot()).singleElement()
                .satisfies(op -> assertThat(op.retryCount()).isEqualTo(1));
    }

    @Test
    void concurrentPassIsSkipped() {
        queue.enqueueWrite("medications", "m1", Map.of());
        CompletableFuture<Outcome> blocked = new CompletableFuture<>();

        CompletableFuture<SyncResult> first = queue.process(op -> blocked);
        SyncResult second = queue.process(op -> CompletableFuture.completedFuture(Outcome.DELIVERED)).join();

        assertThat(queue.isProcessing()).isTrue();
        assertThat(second.success()).isFalse();
        assertThat(second.operationsProcessed()).isZero();

        blocked.complete(Outcome.DELIVERED);
        assertThat(first.join().operationsProcessed()).isEqualTo(1);
        assertThat(queue.isProcessing()).isFalse();
    }

    // ==================== Property 3: Persistence ====================

    @Test
    void queueSurvivesRestart() {
        queue.enqueueWrite("medications", "m1", Map.of("name", FieldValue.of("Aspirin"), "strength", FieldValue.of(81)));
        queue.enqueueDelete("medications", "m2");

        PendingWriteQueue reloaded = new PendingWriteQueue(store, PREFIX, clock);
        reloaded.load();

        assertThat(reloaded.snapshot()).isEqualTo(queue.snapshot());
        assertThat(reloaded.snapshot().get(0).fields()).containsEntry("strength", FieldValue.of(81));
    }

    @Test
    void retryCountIsPersistedAfterAPass() {
        queue.enqueueWrite("medications", "m1", Map.of());
        queue.process(op -> CompletableFuture.completedFuture(Outcome.FAILED)).join();

        PendingWriteQueue reloaded = new PendingWriteQueue(store, PREFIX, clock);
        reloaded.load();

        assertThat(reloaded.snapshot()).singleElement()
                .satisfies(op -> assertThat(op.retryCount()).isEqualTo(1));
    }

    @Test
    void clearEmptiesPersistedQueue() {
        queue.enqueueWrite("medications", "m1", Map.of());

        assertThat(queue.clear()).isTrue();

        PendingWriteQueue reloaded = new PendingWriteQueue(store, PREFIX, clock);
        reloaded.load();
        assertThat(reloaded.size()).isZero();
    }
}
