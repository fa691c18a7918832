package com.dosify.node.key;

import com.dosify.node.crypto.FieldEncryptor;
import com.dosify.node.key.KeyManager.*;
import com.dosify.node.remote.RetryPolicy;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the key manager.
 */
class KeyManagerPropertyTest {

    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, Duration.ZERO, 1.0);

    // ==================== Property 1: Lazy Generation ====================

    @Test
    void property1_firstInitializationGeneratesAndStoresKey() {
        InMemoryKeyStore store = new InMemoryKeyStore();
        KeyManager keyManager = new KeyManager(store, FAST_RETRY);

        keyManager.initialize();

        assertThat(keyManager.isInitialized()).isTrue();
        assertThat(store.read(KeyManager.KEY_SLOT))
                .hasValueSatisfying(key -> assertThat(key).hasSize(KeyManager.KEY_LENGTH_BYTES));
        assertThat(keyManager.hasBackupKey()).isFalse();
    }

    @Property(tries = 20)
    void property1_restartReadsTheSameKey(@ForAll @StringLength(max = 50) String plaintext) {
        InMemoryKeyStore store = new InMemoryKeyStore();
        KeyManager first = new KeyManager(store, FAST_RETRY);
        first.initialize();
        String payload = new FieldEncryptor(first).encryptString(plaintext);

        KeyManager restarted = new KeyManager(store, FAST_RETRY);
        restarted.initialize();

        assertThat(new FieldEncryptor(restarted).decryptString(payload)).isEqualTo(plaintext);
    }

    @Test
    void initializeIsIdempotent() {
        InMemoryKeyStore store = new InMemoryKeyStore();
        KeyManager keyManager = new KeyManager(store, FAST_RETRY);
        keyManager.initialize();
        byte[] key = store.read(KeyManager.KEY_SLOT).orElseThrow();

        keyManager.initialize();

        assertThat(store.read(KeyManager.KEY_SLOT)).hasValueSatisfying(k -> assertThat(k).isEqualTo(key));
    }

    // ==================== Property 2: Retry and Fail Closed ====================

    @Property(tries = 10)
    void property2_transientFailuresWithinRetryBudgetAreAbsorbed(@ForAll @IntRange(min = 0, max = 2) int failures) {
        InMemoryKeyStore store = new InMemoryKeyStore();
        store.failNextOperations(failures);
        KeyManager keyManager = new KeyManager(store, FAST_RETRY);

        keyManager.initialize();

        assertThat(keyManager.isInitialized()).isTrue();
    }

    @Test
    void property2_exhaustedRetriesLeaveManagerUninitialized() {
        InMemoryKeyStore store = new InMemoryKeyStore();
        store.failNextOperations(10);
        KeyManager keyManager = new KeyManager(store, FAST_RETRY);

        assertThatThrownBy(keyManager::initialize)
                .isInstanceOf(KeyStorageException.class);

        assertThat(keyManager.isInitialized()).isFalse();
        FieldEncryptor encryptor = new FieldEncryptor(keyManager);
        assertThatThrownBy(() -> encryptor.encryptString("dose"))
                .isInstanceOf(FieldEncryptor.EncryptionUnavailableException.class);
    }

    @Test
    void interruptedRetryKeepsInterruptFlag() {
        InMemoryKeyStore store = new InMemoryKeyStore();
        store.failNextOperations(1);
        KeyManager keyManager = new KeyManager(store, new RetryPolicy(3, Duration.ofSeconds(30), 2.0));

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(keyManager::initialize)
                    .isInstanceOf(KeyStorageException.class)
                    .hasRootCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(keyManager.isInitialized()).isFalse();
    }

    @Test
    void storedKeyOfWrongLengthIsRejected() {
        InMemoryKeyStore store = new InMemoryKeyStore();
        store.write(KeyManager.KEY_SLOT, new byte[16]);
        KeyManager keyManager = new KeyManager(store, FAST_RETRY);

        assertThatThrownBy(keyManager::initialize)
                .isInstanceOf(KeyStorageException.class)
                .hasMessageContaining("invalid length");
        assertThat(keyManager.isInitialized()).isFalse();
    }

    // ==================== Property 3: Rotation ====================

    @Test
    void property3_rotationMovesOldKeyToBackupSlot() {
        InMemoryKeyStore store = new InMemoryKeyStore();
        KeyManager keyManager = new KeyManager(store, FAST_RETRY);
        keyManager.initialize();
        byte[] original = store.read(KeyManager.KEY_SLOT).orElseThrow();

        keyManager.rotate();

        assertThat(store.read(KeyManager.BACKUP_KEY_SLOT))
                .hasValueSatisfying(backup -> assertThat(backup).isEqualTo(original));
        assertThat(store.read(KeyManager.KEY_SLOT))
                .hasValueSatisfying(current -> assertThat(current).isNotEqualTo(original));
        assertThat(keyManager.hasBackupKey()).isTrue();
    }

    @Test
    void backupKeySurvivesRestartUntilDiscarded() {
        InMemoryKeyStore store = new InMemoryKeyStore();
        KeyManager keyManager = new KeyManager(store, FAST_RETRY);
        keyManager.initialize();
        String payload = new FieldEncryptor(keyManager).encryptString("Amoxicillin");
        keyManager.rotate();

        KeyManager restarted = new KeyManager(store, FAST_RETRY);
        restarted.initialize();
        assertThat(restarted.hasBackupKey()).isTrue();
        assertThat(new FieldEncryptor(restarted).decryptString(payload)).isEqualTo("Amoxicillin");

        restarted.discardBackupKey();
        assertThat(restarted.hasBackupKey()).isFalse();
        assertThat(store.read(KeyManager.BACKUP_KEY_SLOT)).isEmpty();
    }

    @Test
    void rotateBeforeInitializeFails() {
        KeyManager keyManager = new KeyManager(new InMemoryKeyStore(), FAST_RETRY);

        assertThatThrownBy(keyManager::rotate)
                .isInstanceOf(KeyStorageException.class);
    }

    @Test
    void nullKeyStoreIsRejected() {
        assertThatThrownBy(() -> new KeyManager(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
