package com.dosify.node.crypto;

import java.util.Arrays;
import java.util.Base64;

/**
 * Output of one encryption: the random IV and the ciphertext (GCM tag appended), stored as
 * {@code Base64(iv || ciphertext)}.
 */
public record EncryptedPayload(byte[] iv, byte[] ciphertext) {

    public static final int IV_LENGTH = 12;
    public static final int TAG_LENGTH_BYTES = 16;

    public EncryptedPayload {
        if (iv == null || iv.length != IV_LENGTH) {
            throw new IllegalArgumentException("IV must be " + IV_LENGTH + " bytes");
        }
        if (ciphertext == null || ciphertext.length < TAG_LENGTH_BYTES) {
            throw new IllegalArgumentException("Ciphertext is shorter than the authentication tag");
        }
        iv = iv.clone();
        ciphertext = ciphertext.clone();
    }

    @Override
    public byte[] iv() {
        return iv.clone();
    }

    @Override
    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    public byte[] toBytes() {
        byte[] result = new byte[iv.length + ciphertext.length];
        System.arraycopy(iv, 0, result, 0, iv.length);
        System.arraycopy(ciphertext, 0, result, iv.length, ciphertext.length);
        return result;
    }

    public String encode() {
        return Base64.getEncoder().encodeToString(toBytes());
    }

    /**
     * Parses an encoded payload.
     *
     * @throws IllegalArgumentException if the text is not Base64 or too short
     */
    public static EncryptedPayload decode(String encoded) {
        if (encoded == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        return fromBytes(Base64.getDecoder().decode(encoded));
    }

    public static EncryptedPayload fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length < IV_LENGTH + TAG_LENGTH_BYTES) {
            throw new IllegalArgumentException("Payload too short");
        }
        return new EncryptedPayload(
                Arrays.copyOfRange(bytes, 0, IV_LENGTH),
                Arrays.copyOfRange(bytes, IV_LENGTH, bytes.length));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EncryptedPayload other
                && Arrays.equals(iv, other.iv)
                && Arrays.equals(ciphertext, other.ciphertext);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(iv) + Arrays.hashCode(ciphertext);
    }

    @Override
    public String toString() {
        return "EncryptedPayload[" + (iv.length + ciphertext.length) + " bytes]";
    }
}
