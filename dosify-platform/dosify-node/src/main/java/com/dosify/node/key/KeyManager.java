package com.dosify.node.key;

import com.dosify.node.remote.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Optional;

/**
 * Owns the lifecycle of the symmetric key used for field-level encryption.
 *
 * The key is generated once, kept in a single secure-storage slot and read back on every start.
 * Rotation moves the previous key to a backup slot so ciphertext written before the rotation stays
 * readable until callers have re-written their records. Key bytes are never logged.
 */
public class KeyManager {

    public static final String KEY_SLOT = "encryption_key";
    public static final String BACKUP_KEY_SLOT = "encryption_key_backup";
    public static final int KEY_LENGTH_BYTES = 32;

    private static final Logger log = LoggerFactory.getLogger(KeyManager.class);
    private static final String KEY_ALGORITHM = "AES";

    private final SecureKeyStore keyStore;
    private final RetryPolicy retryPolicy;
    private final SecureRandom secureRandom;

    private volatile SecretKey currentKey;
    private volatile SecretKey backupKey;

    public KeyManager(SecureKeyStore keyStore, RetryPolicy retryPolicy) {
        if (keyStore == null) {
            throw new IllegalArgumentException("KeyStore cannot be null");
        }
        this.keyStore = keyStore;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaults();
        this.secureRandom = new SecureRandom();
    }

    public KeyManager(SecureKeyStore keyStore) {
        this(keyStore, RetryPolicy.defaults());
    }

    /**
     * Loads the key from secure storage, generating and persisting one on first use.
     *
     * @throws KeyStorageException if the store stays unreadable or unwritable after retries,
     *                             or holds a key of the wrong length
     */
    public synchronized void initialize() {
        if (currentKey != null) {
            return;
        }

        Optional<byte[]> stored = readSlot(KEY_SLOT);
        byte[] keyBytes;
        if (stored.isPresent()) {
            keyBytes = stored.get();
            validateLength(keyBytes, KEY_SLOT);
            log.info("Existing encryption key loaded");
        } else {
            keyBytes = generateKeyBytes();
            writeSlot(KEY_SLOT, keyBytes);
            log.info("No encryption key found, generated and stored a new key (hardware-backed: {})",
                    keyStore.isHardwareBacked());
        }

        Optional<byte[]> backup = readSlot(BACKUP_KEY_SLOT);
        if (backup.isPresent()) {
            validateLength(backup.get(), BACKUP_KEY_SLOT);
            backupKey = toSecretKey(backup.get());
            log.info("Backup encryption key present, rotation window still open");
        }

        currentKey = toSecretKey(keyBytes);
        Arrays.fill(keyBytes, (byte) 0);
    }

    /**
     * Installs a fresh key and keeps the previous one in the backup slot.
     * Existing ciphertext is not re-encrypted.
     */
    public synchronized void rotate() {
        SecretKey previous = requireCurrentKey();
        byte[] newKeyBytes = generateKeyBytes();

        writeSlot(BACKUP_KEY_SLOT, previous.getEncoded());
        writeSlot(KEY_SLOT, newKeyBytes);

        backupKey = previous;
        currentKey = toSecretKey(newKeyBytes);
        Arrays.fill(newKeyBytes, (byte) 0);
        log.info("Encryption key rotated");
    }

    /**
     * Ends the migration window opened by {@link #rotate()}.
     * Ciphertext still encrypted under the backup key becomes unreadable.
     */
    public synchronized void discardBackupKey() {
        if (backupKey == null) {
            return;
        }
        keyStore.delete(BACKUP_KEY_SLOT);
        backupKey = null;
        log.info("Backup encryption key discarded");
    }

    public boolean isInitialized() {
        return currentKey != null;
    }

    public boolean hasBackupKey() {
        return backupKey != null;
    }

    /**
     * Current key; only the field encryptor reads it.
     *
     * @throws KeyStorageException if {@link #initialize()} has not succeeded
     */
    SecretKey requireCurrentKey() {
        SecretKey key = currentKey;
        if (key == null) {
            throw new KeyStorageException("Encryption key is not initialized");
        }
        return key;
    }

    Optional<SecretKey> backupKey() {
        return Optional.ofNullable(backupKey);
    }

    /**
     * Read-only access for the encryption layer. Returning the key material outside this
     * package and {@code com.dosify.node.crypto} is not supported.
     */
    public KeyAccess access() {
        return new KeyAccess(this);
    }

    // ==================== Private Helper Methods ====================

    private Optional<byte[]> readSlot(String slot) {
        try {
            return retryPolicy.execute(() -> keyStore.read(slot));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KeyStorageException("Interrupted while reading slot " + slot, e);
        } catch (Exception e) {
            throw new KeyStorageException("Secure store unreadable for slot " + slot, e);
        }
    }

    private void writeSlot(String slot, byte[] value) {
        try {
            retryPolicy.execute(() -> {
                keyStore.write(slot, value);
                return null;
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KeyStorageException("Interrupted while writing slot " + slot, e);
        } catch (Exception e) {
            throw new KeyStorageException("Secure store unwritable for slot " + slot, e);
        }
    }

    private byte[] generateKeyBytes() {
        byte[] bytes = new byte[KEY_LENGTH_BYTES];
        secureRandom.nextBytes(bytes);
        return bytes;
    }

    private static void validateLength(byte[] keyBytes, String slot) {
        if (keyBytes.length != KEY_LENGTH_BYTES) {
            throw new KeyStorageException("Key in slot " + slot + " has invalid length " + keyBytes.length);
        }
    }

    private static SecretKey toSecretKey(byte[] bytes) {
        return new SecretKeySpec(bytes, KEY_ALGORITHM);
    }

    // ==================== Inner Types ====================

    /**
     * Narrow handle passed to the field encryptor.
     */
    public static final class KeyAccess {
        private final KeyManager manager;

        private KeyAccess(KeyManager manager) {
            this.manager = manager;
        }

        public SecretKey currentKey() {
            return manager.requireCurrentKey();
        }

        public Optional<SecretKey> backupKey() {
            return manager.backupKey();
        }

        public boolean isReady() {
            return manager.isInitialized();
        }
    }

    /**
     * Exception for secure key storage errors.
     */
    public static class KeyStorageException extends RuntimeException {
        public KeyStorageException(String message) {
            super(message);
        }

        public KeyStorageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
