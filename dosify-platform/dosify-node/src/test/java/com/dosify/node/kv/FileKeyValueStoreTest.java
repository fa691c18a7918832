package com.dosify.node.kv;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FileKeyValueStoreTest {

    @TempDir
    Path dir;

    @Test
    void valuesSurviveReopenWithTheirTypes() {
        Path file = dir.resolve("state/dosify.json");
        FileKeyValueStore store = new FileKeyValueStore(file);
        store.setString("name", "Warfarin");
        store.setLong("synced", 1_709_280_000_000L);
        store.setDouble("dose", 2.5);
        store.setBoolean("online", false);

        FileKeyValueStore reopened = new FileKeyValueStore(file);

        assertThat(reopened.getString("name")).contains("Warfarin");
        assertThat(reopened.getLong("synced")).contains(1_709_280_000_000L);
        assertThat(reopened.getDouble("dose")).contains(2.5);
        assertThat(reopened.getBoolean("online")).contains(false);
        assertThat(reopened.getAllKeys()).containsExactlyInAnyOrder("name", "synced", "dose", "online");
        assertThat(Files.exists(dir.resolve("state/dosify.json.tmp"))).isFalse();
    }

    @Test
    void removeIsPersisted() {
        Path file = dir.resolve("dosify.json");
        FileKeyValueStore store = new FileKeyValueStore(file);
        store.setString("a", "1");

        assertThat(store.remove("a")).isTrue();
        assertThat(store.remove("a")).isFalse();
        assertThat(new FileKeyValueStore(file).containsKey("a")).isFalse();
    }

    @Test
    void readingWithTheWrongTypeFails() {
        FileKeyValueStore store = new FileKeyValueStore(dir.resolve("dosify.json"));
        store.setString("count", "three");

        assertThatThrownBy(() -> store.getLong("count"))
                .isInstanceOf(KeyValueStore.KeyValueStoreException.class);
        assertThat(store.getLong("absent")).isEmpty();
    }

    @Test
    void corruptFileIsReported() throws Exception {
        Path file = dir.resolve("dosify.json");
        Files.writeString(file, "{broken");

        assertThatThrownBy(() -> new FileKeyValueStore(file))
                .isInstanceOf(KeyValueStore.KeyValueStoreException.class);
    }

    @Test
    void blankKeysAreRejected() {
        FileKeyValueStore store = new FileKeyValueStore(dir.resolve("dosify.json"));

        assertThatThrownBy(() -> store.setString(" ", "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
