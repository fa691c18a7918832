package com.dosify.node.key;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of SecureKeyStore for testing and development.
 * Production implementations should use platform-specific secure storage.
 */
public class InMemoryKeyStore implements SecureKeyStore {

    private final Map<String, byte[]> slots;
    private final AtomicInteger failuresBeforeSuccess;

    public InMemoryKeyStore() {
        this.slots = new ConcurrentHashMap<>();
        this.failuresBeforeSuccess = new AtomicInteger();
    }

    @Override
    public Optional<byte[]> read(String slot) {
        failIfScheduled("read", slot);
        byte[] value = slots.get(slot);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void write(String slot, byte[] value) {
        failIfScheduled("write", slot);
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        slots.put(slot, value.clone());
    }

    @Override
    public void delete(String slot) {
        byte[] removed = slots.remove(slot);
        if (removed != null) {
            Arrays.fill(removed, (byte) 0);
        }
    }

    @Override
    public boolean isHardwareBacked() {
        return false; // In-memory is not hardware-backed
    }

    /**
     * Makes the next {@code count} reads or writes fail (for testing).
     */
    public void failNextOperations(int count) {
        failuresBeforeSuccess.set(count);
    }

    /**
     * Gets the number of occupied slots (for testing).
     */
    public int getSlotCount() {
        return slots.size();
    }

    private void failIfScheduled(String operation, String slot) {
        if (failuresBeforeSuccess.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new SecureStoreException("Simulated secure store " + operation + " failure for slot " + slot);
        }
    }
}
