package com.dosify.node.crypto;

import com.dosify.node.crypto.FieldEncryptor.*;
import com.dosify.node.key.InMemoryKeyStore;
import com.dosify.node.key.KeyManager;
import com.dosify.node.record.FieldValue;
import com.dosify.node.remote.RetryPolicy;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for field-level encryption.
 */
class FieldEncryptorPropertyTest {

    private static final Set<String> SENSITIVE = Set.of("name", "strength", "tabletsInStock");

    // ==================== Property 1: Round Trip ====================

    @Property(tries = 100)
    void property1_decryptInvertsEncrypt(@ForAll String plaintext) {
        FieldEncryptor encryptor = newEncryptor();

        String payload = encryptor.encryptString(plaintext);

        assertThat(encryptor.decryptString(payload)).isEqualTo(plaintext);
    }

    @Test
    void roundTrip_emptyAndNonAsciiStrings() {
        FieldEncryptor encryptor = newEncryptor();

        for (String plaintext : List.of("", "Insulin glargine", "Ибупрофен 400 мг", "アスピリン", "💊 x2")) {
            assertThat(encryptor.decryptString(encryptor.encryptString(plaintext))).isEqualTo(plaintext);
        }
    }

    // ==================== Property 2: Non-Determinism ====================

    @Property(tries = 50)
    void property2_repeatedEncryptionsDiffer(@ForAll String plaintext) {
        FieldEncryptor encryptor = newEncryptor();

        Set<String> payloads = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            payloads.add(encryptor.encryptString(plaintext));
        }

        assertThat(payloads).hasSize(5);
    }

    // ==================== Property 3: Tamper Detection ====================

    @Property(tries = 100)
    void property3_anyFlippedByteFailsDecryption(
            @ForAll @StringLength(max = 64) String plaintext,
            @ForAll @IntRange(min = 0, max = 10_000) int position,
            @ForAll @IntRange(min = 1, max = 255) int mask) {
        FieldEncryptor encryptor = newEncryptor();
        byte[] bytes = EncryptedPayload.decode(encryptor.encryptString(plaintext)).toBytes();

        int index = position % bytes.length;
        bytes[index] = (byte) (bytes[index] ^ mask);
        String tampered = Base64.getEncoder().encodeToString(bytes);

        assertThatThrownBy(() -> encryptor.decryptString(tampered))
                .isInstanceOf(DecryptionException.class);
    }

    @Test
    void malformedPayloadsAreRejected() {
        FieldEncryptor encryptor = newEncryptor();

        assertThatThrownBy(() -> encryptor.decryptString("not base64 !!"))
                .isInstanceOf(DecryptionException.class);
        assertThatThrownBy(() -> encryptor.decryptString(Base64.getEncoder().encodeToString(new byte[10])))
                .isInstanceOf(DecryptionException.class);
    }

    @Test
    void payloadFromAnotherKeyIsRejected() {
        FieldEncryptor first = newEncryptor();
        FieldEncryptor second = newEncryptor();

        String payload = first.encryptString("Metformin");

        assertThatThrownBy(() -> second.decryptString(payload))
                .isInstanceOf(DecryptionException.class);
    }

    // ==================== Property 4: Record Encryption ====================

    @Property(tries = 50)
    void property4_recordRoundTripRestoresSensitiveValues(
            @ForAll @StringLength(min = 1, max = 40) String name,
            @ForAll @DoubleRange(min = 0, max = 1000) double strength,
            @ForAll @StringLength(max = 20) String type) {
        FieldEncryptor encryptor = newEncryptor();
        Map<String, FieldValue> record = new LinkedHashMap<>();
        record.put("name", FieldValue.of(name));
        record.put("strength", FieldValue.of(strength));
        record.put("tabletsInStock", FieldValue.of(30));
        record.put("type", FieldValue.of(type));

        Map<String, FieldValue> encrypted = encryptor.encryptRecord(record, SENSITIVE);
        Map<String, FieldValue> decrypted = encryptor.decryptRecord(encrypted, SENSITIVE);

        assertThat(encrypted.get("type")).isEqualTo(FieldValue.of(type));
        assertThat(encrypted.get("name")).isNotEqualTo(FieldValue.of(name));
        assertThat(decrypted).isEqualTo(record);
    }

    @Test
    void absentAndNullSensitiveFieldsBecomeEmptyStrings() {
        FieldEncryptor encryptor = newEncryptor();
        Map<String, FieldValue> record = new LinkedHashMap<>();
        record.put("name", FieldValue.nullValue());
        record.put("type", FieldValue.of("tablet"));

        Map<String, FieldValue> encrypted = encryptor.encryptRecord(record, SENSITIVE);
        Map<String, FieldValue> decrypted = encryptor.decryptRecord(encrypted, SENSITIVE);

        assertThat(encrypted).containsKeys("name", "strength", "tabletsInStock");
        assertThat(decrypted.get("name")).isEqualTo(FieldValue.of(""));
        assertThat(decrypted.get("strength")).isEqualTo(FieldValue.of(""));
        assertThat(decrypted.get("type")).isEqualTo(FieldValue.of("tablet"));
    }

    @Test
    void nonStringSensitiveValueIsNotAPayload() {
        FieldEncryptor encryptor = newEncryptor();

        assertThatThrownBy(() -> encryptor.decryptRecord(Map.of("strength", FieldValue.of(5)), SENSITIVE))
                .isInstanceOf(DecryptionException.class);
    }

    // ==================== Property 5: Fail Closed ====================

    @Test
    void uninitializedKeyNeverProducesPlaintext() {
        FieldEncryptor encryptor = new FieldEncryptor(new KeyManager(new InMemoryKeyStore(), RetryPolicy.none()));

        assertThat(encryptor.isReady()).isFalse();
        assertThatThrownBy(() -> encryptor.encryptString("secret"))
                .isInstanceOf(EncryptionUnavailableException.class);
        assertThatThrownBy(() -> encryptor.encryptRecord(Map.of("name", FieldValue.of("secret")), SENSITIVE))
                .isInstanceOf(EncryptionUnavailableException.class);
    }

    @Test
    void rotationKeepsOldCiphertextReadableUntilBackupDiscarded() {
        KeyManager keyManager = new KeyManager(new InMemoryKeyStore(), RetryPolicy.none());
        keyManager.initialize();
        FieldEncryptor encryptor = new FieldEncryptor(keyManager);
        String before = encryptor.encryptString("Levothyroxine");

        keyManager.rotate();

        assertThat(encryptor.decryptString(before)).isEqualTo("Levothyroxine");
        String after = encryptor.encryptString("Levothyroxine");
        assertThat(encryptor.decryptString(after)).isEqualTo("Levothyroxine");

        keyManager.discardBackupKey();

        assertThatThrownBy(() -> encryptor.decryptString(before))
                .isInstanceOf(DecryptionException.class);
        assertThat(encryptor.decryptString(after)).isEqualTo("Levothyroxine");
    }

    @Test
    void blindIndexIsDeterministic() {
        FieldEncryptor encryptor = newEncryptor();

        assertThat(encryptor.blindIndex("Warfarin")).isEqualTo(encryptor.blindIndex("Warfarin"));
        assertThat(encryptor.blindIndex("Warfarin")).isNotEqualTo(encryptor.blindIndex("warfarin"));
        assertThat(encryptor.blindIndex("")).hasSize(64);
    }

    // ==================== Helper Methods ====================

    private static FieldEncryptor newEncryptor() {
        KeyManager keyManager = new KeyManager(new InMemoryKeyStore(), RetryPolicy.none());
        keyManager.initialize();
        return new FieldEncryptor(keyManager);
    }
}
