package com.dosify.node.remote;

import com.dosify.node.record.FieldValue;
import com.dosify.node.record.Records;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InMemoryRemoteStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");

    private final InMemoryRemoteStore remote = new InMemoryRemoteStore();

    // ==================== Write Preconditions ====================

    @Test
    void absentPreconditionCreatesOnlyMissingDocuments() {
        WritePrecondition absent = WritePrecondition.absent();
        assertThat(absent.mustNotExist()).isTrue();
        assertThat(absent.isNone()).isFalse();

        remote.setDocument("medications", "m1", medication("Aspirin", T0), absent).join();

        assertThatThrownBy(() -> remote.setDocument("medications", "m1", medication("Ibuprofen", T0), absent).join())
                .hasCauseInstanceOf(RemoteStoreException.class)
                .hasMessageContaining("already exists");
        assertThat(remote.peek("medications", "m1")).hasValueSatisfying(fields ->
                assertThat(fields).containsEntry("name", FieldValue.of("Aspirin")));
    }

    @Test
    void lastUpdatePreconditionRejectsStaleVersion() {
        remote.setDocument("medications", "m1", medication("Aspirin", T0), WritePrecondition.absent()).join();
        Instant later = T0.plusSeconds(60);

        remote.setDocument("medications", "m1", medication("Aspirin", later),
                WritePrecondition.lastUpdateEquals(T0)).join();

        assertThatThrownBy(() -> remote.setDocument("medications", "m1", medication("Ibuprofen", later),
                WritePrecondition.lastUpdateEquals(T0)).join())
                .hasCauseInstanceOf(RemoteStoreException.class);
        assertThat(remote.getWriteCount()).isEqualTo(2);
    }

    @Test
    void preconditionCannotExpectAbsenceAndVersion() {
        assertThatThrownBy(() -> new WritePrecondition(T0, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Map<String, FieldValue> medication(String name, Instant lastUpdate) {
        return Records.withLastUpdate(Map.of("name", FieldValue.of(name)), lastUpdate);
    }
}
