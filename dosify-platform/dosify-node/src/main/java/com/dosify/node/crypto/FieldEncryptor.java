package com.dosify.node.crypto;

import com.dosify.node.key.KeyManager;
import com.dosify.node.record.FieldValue;
import com.dosify.node.record.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Authenticated field-level encryption (AES-256-GCM) on top of the {@link KeyManager} key.
 *
 * Every call draws a fresh 96-bit IV, so equal plaintexts never produce equal payloads.
 * Calls fail closed: without an initialized key they throw instead of returning plaintext.
 *
 * Sensitive record fields are encrypted from their JSON text ({@code "Aspirin"} for a string,
 * {@code 500} for a number) so their type survives the round trip. A null or missing sensitive
 * field is stored as the encryption of the empty string and comes back as an empty string.
 */
public class FieldEncryptor {

    private static final Logger log = LoggerFactory.getLogger(FieldEncryptor.class);

    private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128;

    private final KeyManager.KeyAccess keys;
    private final SecureRandom secureRandom;
    private final ObjectMapper objectMapper;

    public FieldEncryptor(KeyManager keyManager) {
        if (keyManager == null) {
            throw new IllegalArgumentException("KeyManager cannot be null");
        }
        this.keys = keyManager.access();
        this.secureRandom = new SecureRandom();
        this.objectMapper = JsonCodec.mapper();
    }

    public boolean isReady() {
        return keys.isReady();
    }

    /**
     * Encrypts a string under the current key with a fresh IV.
     *
     * @return the encoded {@link EncryptedPayload}
     * @throws EncryptionUnavailableException if no key is initialized
     */
    public String encryptString(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext cannot be null");
        }
        SecretKey key = currentKey();
        byte[] iv = generateIV();
        try {
            Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return new EncryptedPayload(iv, ciphertext).encode();
        } catch (GeneralSecurityException e) {
            throw new EncryptionUnavailableException("Encryption failed", e);
        }
    }

    /**
     * Decrypts and verifies a payload produced by {@link #encryptString(String)}.
     * During a rotation window the backup key is tried when the current key does not verify.
     *
     * @throws DecryptionException if the payload is malformed or fails integrity verification
     */
    public String decryptString(String payload) {
        SecretKey key = currentKey();
        EncryptedPayload parsed;
        try {
            parsed = EncryptedPayload.decode(payload);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Malformed encrypted payload", e);
        }

        try {
            return decrypt(parsed, key);
        } catch (AEADBadTagException e) {
            Optional<SecretKey> backup = keys.backupKey();
            if (backup.isPresent()) {
                try {
                    return decrypt(parsed, backup.get());
                } catch (GeneralSecurityException backupFailure) {
                    e.addSuppressed(backupFailure);
                }
            }
            throw new DecryptionException("Integrity check failed (tampered payload or wrong key)", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Decryption failed", e);
        }
    }

    /**
     * Returns a copy of {@code fields} with every sensitive field encrypted.
     * Absent or null sensitive fields become the encryption of the empty string.
     */
    public Map<String, FieldValue> encryptRecord(Map<String, FieldValue> fields, Set<String> sensitiveFieldNames) {
        Map<String, FieldValue> result = new LinkedHashMap<>(fields != null ? fields : Map.of());
        for (String name : sensitiveFieldNames) {
            FieldValue value = result.get(name);
            String plaintext = plaintextOf(value);
            result.put(name, new FieldValue.StringValue(encryptString(plaintext)));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Inverse of {@link #encryptRecord}. A sensitive field that decrypts to the empty string is
     * returned as an empty string.
     *
     * @throws DecryptionException if any sensitive field fails to decrypt
     */
    public Map<String, FieldValue> decryptRecord(Map<String, FieldValue> fields, Set<String> sensitiveFieldNames) {
        Map<String, FieldValue> result = new LinkedHashMap<>(fields != null ? fields : Map.of());
        for (String name : sensitiveFieldNames) {
            FieldValue value = result.get(name);
            if (value == null) {
                continue;
            }
            if (!(value instanceof FieldValue.StringValue encrypted)) {
                throw new DecryptionException("Sensitive field " + name + " is not an encrypted payload");
            }
            result.put(name, valueOf(decryptString(encrypted.value())));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Deterministic SHA-256 digest of a value, for equality lookups on encrypted fields.
     */
    public String blindIndex(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ==================== Private Methods ====================

    private SecretKey currentKey() {
        if (!keys.isReady()) {
            throw new EncryptionUnavailableException("Field encryptor used before key initialization");
        }
        return keys.currentKey();
    }

    private byte[] generateIV() {
        byte[] iv = new byte[EncryptedPayload.IV_LENGTH];
        secureRandom.nextBytes(iv);
        return iv;
    }

    private static String decrypt(EncryptedPayload payload, SecretKey key) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, payload.iv()));
        return new String(cipher.doFinal(payload.ciphertext()), StandardCharsets.UTF_8);
    }

    private String plaintextOf(FieldValue value) {
        if (value == null || value instanceof FieldValue.NullValue) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Field value cannot be encoded", e);
        }
    }

    private FieldValue valueOf(String plaintext) {
        if (plaintext.isEmpty()) {
            return new FieldValue.StringValue("");
        }
        try {
            return JsonCodec.fromNode(objectMapper.readTree(plaintext));
        } catch (JsonProcessingException e) {
            // Written before values were JSON-encoded: keep the raw text.
            log.debug("Sensitive field plaintext is not JSON, keeping it as text");
            return new FieldValue.StringValue(plaintext);
        }
    }

    // ==================== Exceptions ====================

    /**
     * Malformed ciphertext or failed integrity check. Always a security event.
     */
    public static class DecryptionException extends RuntimeException {
        public DecryptionException(String message) {
            super(message);
        }

        public DecryptionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Encryption requested while no key is available.
     */
    public static class EncryptionUnavailableException extends RuntimeException {
        public EncryptionUnavailableException(String message) {
            super(message);
        }

        public EncryptionUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
