package com.dosify.node.key;

import java.util.Optional;

/**
 * Interface for secure key storage.
 * Implementations should use hardware-backed storage when available (Keychain/Keystore).
 */
public interface SecureKeyStore {

    /**
     * Reads the bytes stored in a slot.
     *
     * @param slot The slot name
     * @return The stored bytes, or empty if the slot was never written
     * @throws SecureStoreException if the store cannot be read
     */
    Optional<byte[]> read(String slot);

    /**
     * Writes bytes to a slot, replacing previous content.
     *
     * @throws SecureStoreException if the store cannot be written
     */
    void write(String slot, byte[] value);

    /**
     * Securely deletes a slot.
     */
    void delete(String slot);

    /**
     * Checks if hardware-backed storage is available.
     *
     * @return true if hardware-backed storage is available
     */
    boolean isHardwareBacked();

    /**
     * Failure of the platform secure store.
     */
    class SecureStoreException extends RuntimeException {
        public SecureStoreException(String message) {
            super(message);
        }

        public SecureStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
